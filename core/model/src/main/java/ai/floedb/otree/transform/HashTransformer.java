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

/** Spreads values of any type uniformly over the unit axis by hashing them. */
public record HashTransformer(String columnName, LogicalType type, String nullLiteral)
    implements Transformer {

  public HashTransformer {
    Objects.requireNonNull(columnName, "columnName");
    Objects.requireNonNull(type, "type");
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
    return TransformerType.HASHING;
  }

  @Override
  public Transformation makeTransformation(ColumnStats stats) {
    return new HashTransformation(type);
  }
}
