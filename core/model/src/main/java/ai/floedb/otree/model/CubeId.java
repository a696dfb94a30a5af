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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Address of a cube in the OTree: the path of child selectors from the root.
 *
 * <p>With {@code d} indexed dimensions every cube has {@code 2^d} children and a path is a
 * sequence of digits in {@code [0, 2^d)}. Bit {@code d - 1 - i} of a digit tells whether the cube
 * lies in the upper half of its parent along dimension {@code i}. The root is the empty path and
 * {@link #parent()} is derived by dropping the last digit.
 *
 * <p>Ordering is lexicographic over the digits, a prefix ordering before its extensions, which is
 * exactly the depth-first pre-order of the tree.
 *
 * <p>Binary layout: a 2-byte big-endian depth, then {@code ceil(depth * d / 8)} bytes with the
 * digits packed most significant bit first. Pad bits must be zero.
 */
public final class CubeId implements Comparable<CubeId> {

  public static final int MAX_DIMENSIONS = 24;
  public static final int MAX_DEPTH = 62;

  private static final String ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

  private final int dimensionCount;
  private final int[] digits;

  private CubeId(int dimensionCount, int[] digits) {
    this.dimensionCount = dimensionCount;
    this.digits = digits;
  }

  public static CubeId root(int dimensionCount) {
    checkDimensions(dimensionCount);
    return new CubeId(dimensionCount, new int[0]);
  }

  public static CubeId of(int dimensionCount, int... digits) {
    checkDimensions(dimensionCount);
    if (digits.length > MAX_DEPTH) {
      throw new IllegalArgumentException("cube depth exceeds " + MAX_DEPTH + ": " + digits.length);
    }
    int limit = 1 << dimensionCount;
    for (int digit : digits) {
      if (digit < 0 || digit >= limit) {
        throw new IllegalArgumentException(
            "digit " + digit + " out of range for " + dimensionCount + " dimensions");
      }
    }
    return new CubeId(dimensionCount, digits.clone());
  }

  /** The cube at {@code depth} whose hyper-rectangle contains {@code point}. */
  public static CubeId container(Point point, int depth) {
    int d = point.dimensionCount();
    checkDimensions(d);
    if (depth < 0 || depth > MAX_DEPTH) {
      throw new IllegalArgumentException("invalid depth: " + depth);
    }
    long[] cells = new long[d];
    for (int i = 0; i < d; i++) {
      cells[i] = (long) Math.floor(Math.scalb(point.coordinate(i), depth));
    }
    int[] out = new int[depth];
    for (int level = 0; level < depth; level++) {
      int shift = depth - 1 - level;
      int digit = 0;
      for (int i = 0; i < d; i++) {
        digit = (digit << 1) | (int) ((cells[i] >>> shift) & 1L);
      }
      out[level] = digit;
    }
    return new CubeId(d, out);
  }

  /**
   * Decodes the binary layout.
   *
   * @throws CorruptIndexDataException if the bytes do not describe a cube of {@code
   *     dimensionCount} dimensions
   */
  public static CubeId fromBytes(int dimensionCount, byte[] bytes) {
    checkDimensions(dimensionCount);
    if (bytes == null || bytes.length < 2) {
      throw new CorruptIndexDataException("cube id bytes too short");
    }
    int depth = ((bytes[0] & 0xff) << 8) | (bytes[1] & 0xff);
    if (depth > MAX_DEPTH) {
      throw new CorruptIndexDataException("cube id depth out of range: " + depth);
    }
    long bits = (long) depth * dimensionCount;
    int expected = 2 + (int) ((bits + 7) / 8);
    if (bytes.length != expected) {
      throw new CorruptIndexDataException(
          "cube id of depth "
              + depth
              + " and "
              + dimensionCount
              + " dimensions needs "
              + expected
              + " bytes, got "
              + bytes.length);
    }
    int[] out = new int[depth];
    long bit = 0;
    for (int level = 0; level < depth; level++) {
      int digit = 0;
      for (int i = 0; i < dimensionCount; i++, bit++) {
        digit = (digit << 1) | readBit(bytes, bit);
      }
      out[level] = digit;
    }
    for (long pad = bit; pad < (long) (bytes.length - 2) * 8; pad++) {
      if (readBit(bytes, pad) != 0) {
        throw new CorruptIndexDataException("cube id has non-zero pad bits");
      }
    }
    return new CubeId(dimensionCount, out);
  }

  /**
   * Parses the string form produced by {@link #string()}.
   *
   * @throws CorruptIndexDataException if the string is not a valid cube of {@code dimensionCount}
   *     dimensions
   */
  public static CubeId fromString(int dimensionCount, String text) {
    checkDimensions(dimensionCount);
    int charsPerLevel = charsPerLevel(dimensionCount);
    if (text == null || text.length() % charsPerLevel != 0) {
      throw new CorruptIndexDataException("malformed cube id string: " + text);
    }
    int depth = text.length() / charsPerLevel;
    if (depth > MAX_DEPTH) {
      throw new CorruptIndexDataException("cube id depth out of range: " + depth);
    }
    int limit = 1 << dimensionCount;
    int[] out = new int[depth];
    for (int level = 0; level < depth; level++) {
      int digit = 0;
      for (int c = 0; c < charsPerLevel; c++) {
        int sextet = ALPHABET.indexOf(text.charAt(level * charsPerLevel + c));
        if (sextet < 0) {
          throw new CorruptIndexDataException("malformed cube id string: " + text);
        }
        digit = (digit << 6) | sextet;
      }
      if (digit >= limit) {
        throw new CorruptIndexDataException("malformed cube id string: " + text);
      }
      out[level] = digit;
    }
    return new CubeId(dimensionCount, out);
  }

  public int dimensionCount() {
    return dimensionCount;
  }

  public int depth() {
    return digits.length;
  }

  public boolean isRoot() {
    return digits.length == 0;
  }

  public int digit(int level) {
    return digits[level];
  }

  public Optional<CubeId> parent() {
    if (isRoot()) {
      return Optional.empty();
    }
    return Optional.of(new CubeId(dimensionCount, Arrays.copyOf(digits, digits.length - 1)));
  }

  public CubeId child(int digit) {
    if (digit < 0 || digit >= (1 << dimensionCount)) {
      throw new IllegalArgumentException("invalid child digit: " + digit);
    }
    if (digits.length == MAX_DEPTH) {
      throw new IllegalStateException("cube is at the maximum depth " + MAX_DEPTH);
    }
    int[] out = Arrays.copyOf(digits, digits.length + 1);
    out[digits.length] = digit;
    return new CubeId(dimensionCount, out);
  }

  /** All children in digit order. */
  public List<CubeId> children() {
    int count = 1 << dimensionCount;
    List<CubeId> out = new ArrayList<>(count);
    for (int digit = 0; digit < count; digit++) {
      out.add(child(digit));
    }
    return Collections.unmodifiableList(out);
  }

  /** The child of this cube whose hyper-rectangle contains {@code point}. */
  public CubeId childContaining(Point point) {
    checkPoint(point);
    int depth = digits.length + 1;
    int digit = 0;
    for (int i = 0; i < dimensionCount; i++) {
      long cell = (long) Math.floor(Math.scalb(point.coordinate(i), depth));
      digit = (digit << 1) | (int) (cell & 1L);
    }
    return child(digit);
  }

  public boolean contains(Point point) {
    checkPoint(point);
    return container(point, digits.length).equals(this);
  }

  /** True if this cube is a strict ancestor of {@code other}. */
  public boolean isAncestorOf(CubeId other) {
    if (other.dimensionCount != dimensionCount || other.digits.length <= digits.length) {
      return false;
    }
    for (int i = 0; i < digits.length; i++) {
      if (digits[i] != other.digits[i]) {
        return false;
      }
    }
    return true;
  }

  /** Lower corner of the cube's hyper-rectangle. */
  public double[] from() {
    double[] out = new double[dimensionCount];
    for (int level = 0; level < digits.length; level++) {
      double size = Math.scalb(1.0, -(level + 1));
      for (int i = 0; i < dimensionCount; i++) {
        if (((digits[level] >>> (dimensionCount - 1 - i)) & 1) == 1) {
          out[i] += size;
        }
      }
    }
    return out;
  }

  /** Upper (exclusive) corner of the cube's hyper-rectangle. */
  public double[] to() {
    double[] out = from();
    double size = Math.scalb(1.0, -digits.length);
    for (int i = 0; i < out.length; i++) {
      out[i] += size;
    }
    return out;
  }

  public byte[] bytes() {
    long bits = (long) digits.length * dimensionCount;
    byte[] out = new byte[2 + (int) ((bits + 7) / 8)];
    out[0] = (byte) (digits.length >>> 8);
    out[1] = (byte) digits.length;
    long bit = 0;
    for (int digit : digits) {
      for (int i = dimensionCount - 1; i >= 0; i--, bit++) {
        if (((digit >>> i) & 1) == 1) {
          out[2 + (int) (bit >>> 3)] |= (byte) (0x80 >>> (bit & 7));
        }
      }
    }
    return out;
  }

  public String string() {
    int charsPerLevel = charsPerLevel(dimensionCount);
    StringBuilder sb = new StringBuilder(digits.length * charsPerLevel);
    for (int digit : digits) {
      for (int c = charsPerLevel - 1; c >= 0; c--) {
        sb.append(ALPHABET.charAt((digit >>> (6 * c)) & 0x3f));
      }
    }
    return sb.toString();
  }

  @Override
  public int compareTo(CubeId o) {
    if (o.dimensionCount != dimensionCount) {
      throw new IllegalArgumentException(
          "cannot compare cubes of " + dimensionCount + " and " + o.dimensionCount + " dimensions");
    }
    return Arrays.compare(digits, o.digits);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof CubeId that
        && that.dimensionCount == dimensionCount
        && Arrays.equals(digits, that.digits);
  }

  @Override
  public int hashCode() {
    return 31 * dimensionCount + Arrays.hashCode(digits);
  }

  @Override
  public String toString() {
    return "CubeId(" + dimensionCount + ", " + digits.length + ", " + string() + ")";
  }

  private void checkPoint(Point point) {
    if (point.dimensionCount() != dimensionCount) {
      throw new IllegalArgumentException(
          "point has " + point.dimensionCount() + " dimensions, cube has " + dimensionCount);
    }
  }

  private static int readBit(byte[] bytes, long bit) {
    return (bytes[2 + (int) (bit >>> 3)] >>> (7 - (bit & 7))) & 1;
  }

  private static int charsPerLevel(int dimensionCount) {
    return (dimensionCount + 5) / 6;
  }

  private static void checkDimensions(int dimensionCount) {
    if (dimensionCount < 1 || dimensionCount > MAX_DIMENSIONS) {
      throw new IllegalArgumentException(
          "dimension count must be in [1, " + MAX_DIMENSIONS + "]: " + dimensionCount);
    }
  }
}
