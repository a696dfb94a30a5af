/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.otree.transform;

import ai.floedb.otree.types.LogicalType;
import ai.floedb.otree.types.LogicalValues;
import java.util.Objects;

/** {@code (x - min) / (max - min)}, clamped into {@code [0, 1)}. */
public record LinearTransformation(LogicalType type, double min, double max)
    implements Transformation {

  private static final double UPPER = Math.nextDown(1.0);

  public LinearTransformation {
    Objects.requireNonNull(type, "type");
    if (!(min < max)) {
      throw new IllegalArgumentException("linear bounds need min < max: " + min + ", " + max);
    }
  }

  @Override
  public double transform(Object value) {
    if (value == null) {
      return 0.0;
    }
    double x = LogicalValues.toDouble(type, value);
    if (Double.isNaN(x)) {
      return 0.0;
    }
    double r = (x - min) / (max - min);
    if (r <= 0.0) {
      return 0.0;
    }
    return Math.min(r, UPPER);
  }

  @Override
  public boolean isSupersededBy(Transformation other) {
    if (other instanceof LinearTransformation l) {
      return l.min < min || l.max > max;
    }
    if (other instanceof IdentityTransformation i && i.value() != null) {
      return i.value() < min || i.value() > max;
    }
    return false;
  }

  @Override
  public Transformation merge(Transformation other) {
    if (other instanceof LinearTransformation l) {
      return new LinearTransformation(type, Math.min(min, l.min), Math.max(max, l.max));
    }
    if (other instanceof IdentityTransformation i && i.value() != null) {
      return new LinearTransformation(type, Math.min(min, i.value()), Math.max(max, i.value()));
    }
    return this;
  }
}
