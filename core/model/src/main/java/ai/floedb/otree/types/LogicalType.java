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

import java.util.Objects;

public final class LogicalType {
  private final LogicalKind kind;
  private final Integer precision;
  private final Integer scale;

  private LogicalType(LogicalKind kind, Integer precision, Integer scale) {
    this.kind = Objects.requireNonNull(kind, "kind");
    if (kind == LogicalKind.DECIMAL) {
      if (precision == null || scale == null || precision < 1 || scale < 0 || scale > precision) {
        throw new IllegalArgumentException(
            "Invalid DECIMAL(precision, scale): " + precision + ", " + scale);
      }
    } else if (precision != null || scale != null) {
      throw new IllegalArgumentException("precision/scale only allowed for DECIMAL");
    }
    this.precision = precision;
    this.scale = scale;
  }

  public static LogicalType of(LogicalKind kind) {
    return new LogicalType(kind, null, null);
  }

  public static LogicalType decimal(int precision, int scale) {
    return new LogicalType(LogicalKind.DECIMAL, precision, scale);
  }

  /**
   * Parses the {@link #toString()} form back, e.g. {@code INT}, {@code bigint} or {@code
   * DECIMAL(10,2)}.
   */
  public static LogicalType parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Logical type must not be blank");
    }
    String t = text.trim();
    int open = t.indexOf('(');
    if (open < 0) {
      return of(LogicalKind.fromName(t));
    }
    if (!t.endsWith(")")) {
      throw new IllegalArgumentException("Malformed logical type: " + text);
    }
    LogicalKind kind = LogicalKind.fromName(t.substring(0, open));
    if (kind != LogicalKind.DECIMAL) {
      throw new IllegalArgumentException("Only DECIMAL takes parameters: " + text);
    }
    String[] parts = t.substring(open + 1, t.length() - 1).split(",");
    if (parts.length != 2) {
      throw new IllegalArgumentException("Malformed DECIMAL type: " + text);
    }
    try {
      return decimal(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Malformed DECIMAL type: " + text, e);
    }
  }

  public LogicalKind kind() {
    return kind;
  }

  public Integer precision() {
    return precision;
  }

  public Integer scale() {
    return scale;
  }

  public boolean isDecimal() {
    return kind == LogicalKind.DECIMAL;
  }

  @Override
  public String toString() {
    return isDecimal() ? "DECIMAL(" + precision + "," + scale + ")" : kind.name();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof LogicalType that)) {
      return false;
    }

    return kind == that.kind
        && Objects.equals(precision, that.precision)
        && Objects.equals(scale, that.scale);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, precision, scale);
  }
}
