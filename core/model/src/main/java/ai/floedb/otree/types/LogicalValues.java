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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.UUID;

/**
 * Canonicalisation of raw column values for indexing.
 *
 * <p>Values arriving from writers, from JSON round trips or from configuration literals are
 * normalised to one Java representation per {@link LogicalKind} before they are hashed or mapped
 * to coordinates: integers to {@link Long}, decimals to {@link BigDecimal}, binaries to {@code
 * byte[]}, dates to {@link LocalDate}, timestamps to {@link LocalDateTime} and zoned timestamps to
 * {@link Instant}. Strings are accepted for every kind and parsed.
 */
public final class LogicalValues {
  private LogicalValues() {}

  /**
   * Returns the canonical Java value of {@code v} for {@code t}, or {@code null} when {@code v} is
   * null.
   *
   * @throws IllegalArgumentException if the value cannot represent the type
   */
  public static Object normalize(LogicalType t, Object v) {
    if (v == null) {
      return null;
    }
    switch (t.kind()) {
      case BOOLEAN:
        if (v instanceof Boolean b) {
          return b;
        }
        if (v instanceof CharSequence s) {
          return parseBoolean(s.toString());
        }
        throw typeErr(t, v);

      case INT:
        if (v instanceof Number n) {
          return checkedLong(n);
        }
        if (v instanceof CharSequence s) {
          return checkedLong(new BigDecimal(s.toString().trim()));
        }
        throw typeErr(t, v);

      case FLOAT:
        if (v instanceof Number n) {
          return n.floatValue();
        }
        if (v instanceof CharSequence s) {
          return Float.parseFloat(s.toString().trim());
        }
        throw typeErr(t, v);

      case DOUBLE:
        if (v instanceof Number n) {
          return n.doubleValue();
        }
        if (v instanceof CharSequence s) {
          return Double.parseDouble(s.toString().trim());
        }
        throw typeErr(t, v);

      case DECIMAL:
        if (v instanceof BigDecimal bd) {
          return bd;
        }
        if (v instanceof BigInteger bi) {
          return new BigDecimal(bi);
        }
        if (v instanceof Number || v instanceof CharSequence) {
          return new BigDecimal(v.toString().trim());
        }
        throw typeErr(t, v);

      case STRING:
        return (v instanceof CharSequence cs) ? cs.toString() : v.toString();

      case BINARY:
        if (v instanceof byte[] arr) {
          return arr;
        }
        if (v instanceof ByteBuffer bb) {
          var dup = bb.duplicate();
          byte[] bytes = new byte[dup.remaining()];
          dup.get(bytes);
          return bytes;
        }
        if (v instanceof CharSequence s) {
          String raw = s.toString().trim();
          if (raw.startsWith("0x") || raw.startsWith("0X")) {
            return decodeHex(raw.substring(2));
          }
          return Base64.getDecoder().decode(raw);
        }
        throw typeErr(t, v);

      case UUID:
        return (v instanceof UUID u) ? u : UUID.fromString(v.toString().trim());

      case DATE:
        if (v instanceof LocalDate d) {
          return d;
        }
        if (v instanceof Number n) {
          return LocalDate.ofEpochDay(checkedLong(n));
        }
        if (v instanceof CharSequence s) {
          return LocalDate.parse(s.toString().trim());
        }
        throw typeErr(t, v);

      case TIMESTAMP:
        if (v instanceof LocalDateTime ts) {
          return ts;
        }
        if (v instanceof Instant i) {
          return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
        }
        if (v instanceof CharSequence s) {
          return LocalDateTime.parse(s.toString().trim());
        }
        throw typeErr(t, v);

      case TIMESTAMPTZ:
        if (v instanceof Instant i) {
          return i;
        }
        if (v instanceof OffsetDateTime odt) {
          return odt.toInstant();
        }
        if (v instanceof ZonedDateTime zdt) {
          return zdt.toInstant();
        }
        if (v instanceof CharSequence s) {
          return OffsetDateTime.parse(s.toString().trim()).toInstant();
        }
        throw typeErr(t, v);
    }
    throw typeErr(t, v);
  }

  /** Parses a configuration literal (for example a null representative value). */
  public static Object parse(LogicalType t, String literal) {
    if (literal == null) {
      return null;
    }
    return normalize(t, literal);
  }

  /**
   * Maps a value of a linearly ordered kind onto the real line: integers and floating point values
   * as themselves, dates as epoch days and timestamps as epoch microseconds (UTC).
   *
   * @throws IllegalArgumentException if the kind is not linearly ordered
   */
  public static double toDouble(LogicalType t, Object v) {
    if (!t.kind().isLinearlyOrdered()) {
      throw new IllegalArgumentException("Logical type is not linearly ordered: " + t);
    }
    Object n = normalize(t, v);
    if (n == null) {
      throw new IllegalArgumentException("Cannot place a null value of type " + t);
    }
    return switch (t.kind()) {
      case INT -> ((Long) n).doubleValue();
      case FLOAT -> ((Float) n).doubleValue();
      case DOUBLE -> (Double) n;
      case DECIMAL -> ((BigDecimal) n).doubleValue();
      case DATE -> (double) ((LocalDate) n).toEpochDay();
      case TIMESTAMP -> (double) epochMicros(((LocalDateTime) n).toInstant(ZoneOffset.UTC));
      case TIMESTAMPTZ -> (double) epochMicros((Instant) n);
      default -> throw new IllegalArgumentException("Logical type is not linearly ordered: " + t);
    };
  }

  /**
   * Returns a JSON-friendly representation of a canonical value: numbers and booleans as
   * themselves, binaries as base64, everything else as its ISO/string form. {@link #normalize}
   * accepts every encoded form back.
   */
  public static Object encode(LogicalType t, Object v) {
    Object n = normalize(t, v);
    if (n == null) {
      return null;
    }
    return switch (t.kind()) {
      case BOOLEAN, INT, FLOAT, DOUBLE, STRING -> n;
      case DECIMAL -> ((BigDecimal) n).toPlainString();
      case BINARY -> Base64.getEncoder().encodeToString((byte[]) n);
      case UUID, DATE, TIMESTAMP, TIMESTAMPTZ -> n.toString();
    };
  }

  static long epochMicros(Instant i) {
    return ChronoUnit.MICROS.between(Instant.EPOCH, i);
  }

  private static boolean parseBoolean(String s) {
    String v = s.trim();
    if ("true".equalsIgnoreCase(v) || "1".equals(v)) {
      return true;
    }
    if ("false".equalsIgnoreCase(v) || "0".equals(v)) {
      return false;
    }
    throw new IllegalArgumentException("Invalid BOOLEAN value: " + s);
  }

  private static long checkedLong(Number value) {
    if (value instanceof Long l) {
      return l;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return value.longValue();
    }
    try {
      BigDecimal bd =
          (value instanceof BigDecimal b)
              ? b
              : (value instanceof BigInteger bi)
                  ? new BigDecimal(bi)
                  : new BigDecimal(value.toString());
      return bd.longValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new IllegalArgumentException(
          "INT value must be a whole 64-bit number, got: " + value, e);
    }
  }

  private static byte[] decodeHex(String hex) {
    if ((hex.length() & 1) != 0) {
      throw new IllegalArgumentException("Invalid hex BINARY value (odd length): " + hex);
    }
    byte[] out = new byte[hex.length() / 2];
    for (int i = 0; i < out.length; i++) {
      int hi = Character.digit(hex.charAt(2 * i), 16);
      int lo = Character.digit(hex.charAt(2 * i + 1), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException("Invalid hex BINARY value: " + hex);
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return out;
  }

  private static IllegalArgumentException typeErr(LogicalType t, Object v) {
    return new IllegalArgumentException(
        t.kind().name() + " column cannot hold a value of type " + v.getClass().getName());
  }
}
