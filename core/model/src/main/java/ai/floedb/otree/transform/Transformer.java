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
import java.util.Optional;

/**
 * Describes how one indexed column is placed on a unit axis. Stateless: the bounds live in the
 * {@link Transformation} built from a batch's {@link ColumnStats}.
 */
public sealed interface Transformer permits LinearTransformer, HashTransformer {

  String columnName();

  LogicalType type();

  /** Literal replacing nulls of this column, if configured. */
  Optional<String> nullValue();

  TransformerType transformerType();

  Transformation makeTransformation(ColumnStats stats);

  /**
   * Returns the merged transformation when the bounds observed in {@code stats} are not covered by
   * {@code current}, or empty when {@code current} still fits.
   */
  default Optional<Transformation> maybeUpdateTransformation(
      Transformation current, ColumnStats stats) {
    Transformation observed = makeTransformation(stats);
    if (current.isSupersededBy(observed)) {
      return Optional.of(current.merge(observed));
    }
    return Optional.empty();
  }

  /** The canonical value to index: the raw value, or the null representative for nulls. */
  default Object resolve(Object raw) {
    Object v = LogicalValues.normalize(type(), raw);
    if (v == null && nullValue().isPresent()) {
      return LogicalValues.parse(type(), nullValue().get());
    }
    return v;
  }
}
