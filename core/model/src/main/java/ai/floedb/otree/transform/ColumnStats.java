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

/**
 * Batch statistics of one indexed column, after null substitution. {@code min} and {@code max} are
 * the finite extremes of the column's values on the real line, null when none were seen or when
 * the column is hashed.
 */
public record ColumnStats(
    String columnName, long rowCount, long nullCount, Double min, Double max) {

  public static Accumulator accumulator(String columnName) {
    return new Accumulator(columnName);
  }

  /** Mutable, single-threaded collector; partial accumulators combine with {@link #combine}. */
  public static final class Accumulator {
    private final String columnName;
    private long rowCount;
    private long nullCount;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    private Accumulator(String columnName) {
      this.columnName = columnName;
    }

    public Accumulator addNull() {
      rowCount++;
      nullCount++;
      return this;
    }

    /** Adds a value of a hashed column, which only counts. */
    public Accumulator addUnordered() {
      rowCount++;
      return this;
    }

    public Accumulator add(double value) {
      rowCount++;
      if (Double.isFinite(value)) {
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
      return this;
    }

    public Accumulator combine(Accumulator other) {
      rowCount += other.rowCount;
      nullCount += other.nullCount;
      min = Math.min(min, other.min);
      max = Math.max(max, other.max);
      return this;
    }

    public ColumnStats build() {
      boolean seen = min <= max;
      return new ColumnStats(
          columnName, rowCount, nullCount, seen ? min : null, seen ? max : null);
    }
  }
}
