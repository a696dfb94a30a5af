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

package ai.floedb.otree.types;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Logical kinds of the columns an OTree can index.
 *
 * <p>Every integer size collapses to {@link #INT} (64-bit). Only scalar kinds are indexable;
 * nested and semi-structured columns are never part of the cube space.
 */
public enum LogicalKind {
  BOOLEAN,
  INT,
  FLOAT,
  DOUBLE,
  DECIMAL,

  STRING,
  BINARY,
  UUID,

  DATE,
  TIMESTAMP,
  TIMESTAMPTZ;

  private static final Map<String, LogicalKind> ALIASES;

  static {
    Map<String, LogicalKind> m = new HashMap<>();

    m.put("INTEGER", INT);
    m.put("BIGINT", INT);
    m.put("LONG", INT);
    m.put("SMALLINT", INT);
    m.put("TINYINT", INT);
    m.put("INT8", INT);
    m.put("INT4", INT);
    m.put("INT2", INT);

    m.put("FLOAT4", FLOAT);
    m.put("FLOAT32", FLOAT);
    m.put("REAL", FLOAT);

    m.put("FLOAT8", DOUBLE);
    m.put("FLOAT64", DOUBLE);
    m.put("DOUBLE PRECISION", DOUBLE);

    m.put("VARCHAR", STRING);
    m.put("CHAR", STRING);
    m.put("TEXT", STRING);

    m.put("VARBINARY", BINARY);
    m.put("BYTEA", BINARY);
    m.put("BLOB", BINARY);

    m.put("BOOL", BOOLEAN);

    m.put("NUMERIC", DECIMAL);

    m.put("TIMESTAMP WITH TIME ZONE", TIMESTAMPTZ);
    m.put("DATETIME", TIMESTAMP);

    ALIASES = Map.copyOf(m);
  }

  /**
   * Whether values of this kind have a numeric order that survives a linear mapping into the unit
   * interval. Such columns get a {@code linear} transformer by default; every other kind is hashed.
   */
  public boolean isLinearlyOrdered() {
    return switch (this) {
      case INT, FLOAT, DOUBLE, DECIMAL, DATE, TIMESTAMP, TIMESTAMPTZ -> true;
      case BOOLEAN, STRING, BINARY, UUID -> false;
    };
  }

  /**
   * Resolves a type name (canonical or aliased) to a {@link LogicalKind}. Lookup is
   * case-insensitive and collapses internal whitespace.
   *
   * @throws IllegalArgumentException if {@code candidate} is null, blank, or not recognised
   */
  public static LogicalKind fromName(String candidate) {
    if (candidate == null) {
      throw new IllegalArgumentException("Logical kind must not be null");
    }

    String normalized = normalize(candidate);
    for (LogicalKind kind : values()) {
      if (kind.name().equals(normalized)) {
        return kind;
      }
    }

    LogicalKind alias = ALIASES.get(normalized);
    if (alias != null) {
      return alias;
    }

    throw new IllegalArgumentException("Unknown logical kind: " + candidate);
  }

  private static String normalize(String s) {
    String out = s.trim().toUpperCase(Locale.ROOT);
    if (out.isEmpty()) {
      throw new IllegalArgumentException("Logical kind must not be blank");
    }
    return out.replaceAll("\\s+", " ");
  }
}
