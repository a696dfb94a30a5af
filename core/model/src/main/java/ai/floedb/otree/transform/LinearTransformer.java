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
import java.util.Optional;

/** Maps ordered values linearly between the observed minimum and maximum. */
public record LinearTransformer(String columnName, LogicalType type, String nullLiteral)
    implements Transformer {

  public LinearTransformer {
    Objects.requireNonNull(columnName, "columnName");
    Objects.requireNonNull(type, "type");
    if (!type.kind().isLinearlyOrdered()) {
      throw new IllegalArgumentException(
          "Column " + columnName + " of type " + type + " cannot be transformed linearly");
    }
    if (nullLiteral != null) {
      LogicalValues.parse(type, nullLiteral);
    }
  }

  @Override
  public Optional<String> nullValue() {
    return Optional.ofNullable(nullLiteral);
  }

  @Override
  public TransformerType transformerType() {
    return TransformerType.LINEAR;
  }

  @Override
  public Transformation makeTransformation(ColumnStats stats) {
    if (stats.min() == null || stats.max() == null) {
      return new IdentityTransformation(type, null);
    }
    if (stats.min().doubleValue() == stats.max().doubleValue()) {
      return new IdentityTransformation(type, stats.min());
    }
    return new LinearTransformation(type, stats.min(), stats.max());
  }
}
