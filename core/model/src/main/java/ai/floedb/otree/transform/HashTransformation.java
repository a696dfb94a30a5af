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

import ai.floedb.otree.hash.ValueHashing;
import ai.floedb.otree.types.LogicalType;
import java.util.Objects;

/**
 * Places a value by its Murmur3 hash, {@code (hash - MIN_INT) / 2^32}. The seed differs from the
 * weight seed so that a column's position and its rows' weights are not correlated. Hashing
 * covers every value, so it is never superseded.
 */
public record HashTransformation(LogicalType type) implements Transformation {

  public static final int POSITION_SEED = 0;

  private static final double RANGE = 4294967296.0;

  public HashTransformation {
    Objects.requireNonNull(type, "type");
  }

  @Override
  public double transform(Object value) {
    if (value == null) {
      return 0.0;
    }
    int h = ValueHashing.hash(type, value, POSITION_SEED);
    return ((double) h - Integer.MIN_VALUE) / RANGE;
  }

  @Override
  public boolean isSupersededBy(Transformation other) {
    return false;
  }

  @Override
  public Transformation merge(Transformation other) {
    return this;
  }
}
