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
import java.util.Locale;

/** The closed set of column transformers. */
public enum TransformerType {
  LINEAR("linear"),
  HASHING("hashing");

  private final String id;

  TransformerType(String id) {
    this.id = id;
  }

  /** Persisted name of the transformer type. */
  public String id() {
    return id;
  }

  public static TransformerType fromId(String id) {
    String n = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    for (TransformerType t : values()) {
      if (t.id.equals(n)) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown transformer type: " + id);
  }

  /** Linear for ordered numeric and temporal kinds, hashing otherwise. */
  public static TransformerType defaultFor(LogicalType type) {
    return type.kind().isLinearlyOrdered() ? LINEAR : HASHING;
  }

  public Transformer create(String columnName, LogicalType type, String nullValue) {
    return switch (this) {
      case LINEAR -> new LinearTransformer(columnName, type, nullValue);
      case HASHING -> new HashTransformer(columnName, type, nullValue);
    };
  }
}
