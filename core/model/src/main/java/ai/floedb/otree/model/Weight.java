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

package ai.floedb.otree.model;

import java.nio.ByteBuffer;

/**
 * Sampling priority of a row. A 32-bit signed integer whose value is uniformly distributed over
 * the int range; lower weights stay in shallower cubes.
 */
public final class Weight implements Comparable<Weight> {

  /** Sentinel threshold of a cube that has no upper bound yet. */
  public static final Weight MAX_VALUE = new Weight(Integer.MAX_VALUE);

  public static final Weight MIN_VALUE = new Weight(Integer.MIN_VALUE);

  private static final double RANGE = (double) Integer.MAX_VALUE - (double) Integer.MIN_VALUE;

  private final int value;

  private Weight(int value) {
    this.value = value;
  }

  public static Weight of(int value) {
    if (value == Integer.MAX_VALUE) {
      return MAX_VALUE;
    }
    if (value == Integer.MIN_VALUE) {
      return MIN_VALUE;
    }
    return new Weight(value);
  }

  /** Inverse of {@link #fraction()}; fractions outside [0, 1] are clamped. */
  public static Weight fromFraction(double fraction) {
    if (Double.isNaN(fraction) || fraction <= 0.0) {
      return MIN_VALUE;
    }
    if (fraction >= 1.0) {
      return MAX_VALUE;
    }
    return of((int) Math.round(fraction * RANGE + Integer.MIN_VALUE));
  }

  /**
   * Decodes the persisted form, a 4-byte big-endian int.
   *
   * @throws CorruptIndexDataException if {@code bytes} is not exactly 4 bytes long
   */
  public static Weight fromBytes(byte[] bytes) {
    if (bytes == null || bytes.length != Integer.BYTES) {
      throw new CorruptIndexDataException(
          "weight must be encoded in 4 bytes, got "
              + (bytes == null ? "null" : bytes.length + " bytes"));
    }
    return of(ByteBuffer.wrap(bytes).getInt());
  }

  public int value() {
    return value;
  }

  /** Normalized weight, {@code (value - MIN_INT) / (MAX_INT - MIN_INT)}. */
  public double fraction() {
    return ((double) value - Integer.MIN_VALUE) / RANGE;
  }

  public byte[] bytes() {
    return ByteBuffer.allocate(Integer.BYTES).putInt(value).array();
  }

  /** The next smaller weight, saturating at {@link #MIN_VALUE}. */
  public Weight predecessor() {
    return value == Integer.MIN_VALUE ? MIN_VALUE : of(value - 1);
  }

  public Weight min(Weight other) {
    return compareTo(other) <= 0 ? this : other;
  }

  public boolean isMax() {
    return value == Integer.MAX_VALUE;
  }

  @Override
  public int compareTo(Weight o) {
    return Integer.compare(value, o.value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Weight w && w.value == value;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(value);
  }

  @Override
  public String toString() {
    return "Weight(" + value + ")";
  }
}
