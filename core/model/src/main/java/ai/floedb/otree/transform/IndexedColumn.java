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
 * A column requested for indexing: its type, the transformer to use and an optional literal that
 * replaces its nulls.
 */
public record IndexedColumn(
    String name, LogicalType type, TransformerType transformerType, String nullValue) {

  public IndexedColumn {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Indexed column name must not be blank");
    }
    if (transformerType == null) {
      transformerType = TransformerType.defaultFor(type);
    }
  }

  public static IndexedColumn of(String name, LogicalType type) {
    return new IndexedColumn(name, type, null, null);
  }

  public IndexedColumn withNullValue(String literal) {
    return new IndexedColumn(name, type, transformerType, literal);
  }

  public IndexedColumn withTransformer(TransformerType t) {
    return new IndexedColumn(name, type, t, nullValue);
  }

  public Transformer toTransformer() {
    return transformerType.create(name, type, nullValue);
  }
}
