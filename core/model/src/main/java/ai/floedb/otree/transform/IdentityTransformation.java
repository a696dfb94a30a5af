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
import java.util.Objects;

/**
 * Transformation of a linear column whose batch held a single distinct value, or no value at all
 * when {@code value} is null. Every value maps to 0.
 */
public record IdentityTransformation(LogicalType type, Double value) implements Transformation {

  public IdentityTransformation {
    Objects.requireNonNull(type, "type");
  }

  @Override
  public double transform(Object v) {
    return 0.0;
  }

  @Override
  public boolean isSupersededBy(Transformation other) {
    if (other instanceof LinearTransformation) {
      return true;
    }
    if (other instanceof IdentityTransformation i) {
      return i.value != null && !i.value.equals(value);
    }
    return false;
  }

  @Override
  public Transformation merge(Transformation other) {
    if (value == null) {
      return other instanceof HashTransformation ? this : other;
    }
    if (other instanceof LinearTransformation l) {
      return l.merge(this);
    }
    if (other instanceof IdentityTransformation i && i.value != null && !i.value.equals(value)) {
      return new LinearTransformation(type, Math.min(value, i.value), Math.max(value, i.value));
    }
    return this;
  }
}
