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

package ai.floedb.otree.hash;

import ai.floedb.otree.types.LogicalType;
import ai.floedb.otree.types.LogicalValues;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Deterministic hashing of raw column values.
 *
 * <p>Two hashes are derived from a row: the 32-bit weight hash over the indexed values, which is
 * the row's sampling priority, and a 64-bit identity key over every column, used only to break
 * ties between rows of equal weight. Both must be stable across processes and releases.
 */
public final class ValueHashing {

  /** Seed of the weight hash. Part of the persisted contract. */
  public static final int WEIGHT_SEED = 42;

  private static final long FNV_OFFSET = 0xcbf29ce484222325L;
  private static final long FNV_PRIME = 0x100000001b3L;

  private ValueHashing() {}

  /**
   * Chains the canonical form of each value into one Murmur3 hash starting at {@link
   * #WEIGHT_SEED}. Null values leave the running hash unchanged.
   */
  public static int weightHash(List<LogicalType> types, List<?> values) {
    if (types.size() != values.size()) {
      throw new IllegalArgumentException(
          "Expected " + types.size() + " indexed values, got " + values.size());
    }
    int h = WEIGHT_SEED;
    for (int i = 0; i < types.size(); i++) {
      h = hash(types.get(i), values.get(i), h);
    }
    return h;
  }

  /** Hashes one value of the given type with {@code seed}. */
  public static int hash(LogicalType type, Object value, int seed) {
    Object v = LogicalValues.normalize(type, value);
    if (v == null) {
      return seed;
    }
    return switch (type.kind()) {
      case BOOLEAN -> Murmur3.hashInt(((Boolean) v) ? 1 : 0, seed);
      case INT -> Murmur3.hashLong((Long) v, seed);
      case FLOAT -> {
        float f = (Float) v;
        yield Murmur3.hashInt(Float.floatToIntBits(f == -0.0f ? 0.0f : f), seed);
      }
      case DOUBLE -> {
        double d = (Double) v;
        yield Murmur3.hashLong(Double.doubleToLongBits(d == -0.0d ? 0.0d : d), seed);
      }
      case DECIMAL -> {
        BigDecimal bd = (BigDecimal) v;
        int h = Murmur3.hashBytes(bd.unscaledValue().toByteArray(), seed);
        yield Murmur3.hashInt(bd.scale(), h);
      }
      case STRING -> Murmur3.hashBytes(((String) v).getBytes(StandardCharsets.UTF_8), seed);
      case BINARY -> Murmur3.hashBytes((byte[]) v, seed);
      case UUID -> {
        UUID u = (UUID) v;
        yield Murmur3.hashLong(
            u.getLeastSignificantBits(), Murmur3.hashLong(u.getMostSignificantBits(), seed));
      }
      case DATE -> Murmur3.hashLong(((LocalDate) v).toEpochDay(), seed);
      case TIMESTAMP ->
          Murmur3.hashLong(micros(((LocalDateTime) v).toInstant(ZoneOffset.UTC)), seed);
      case TIMESTAMPTZ -> Murmur3.hashLong(micros((Instant) v), seed);
    };
  }

  /**
   * 64-bit identity key over every column of a row: FNV-1a over the column names in sorted order
   * and the string form of their values, finished with the Murmur3 fmix64 finalizer.
   */
  public static long identityKey(Map<String, ?> values) {
    long h = FNV_OFFSET;
    for (Map.Entry<String, ?> e : new TreeMap<>(values).entrySet()) {
      h = fnv1a(h, e.getKey());
      h = fnv1a(h, "=");
      Object v = e.getValue();
      String text =
          v instanceof byte[] b ? new String(b, StandardCharsets.ISO_8859_1) : String.valueOf(v);
      h = fnv1a(h, text);
      h = fnv1a(h, ";");
    }
    return fmix64(h);
  }

  private static long micros(Instant i) {
    return ChronoUnit.MICROS.between(Instant.EPOCH, i);
  }

  private static long fnv1a(long h, String s) {
    byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
    for (byte b : bytes) {
      h ^= (b & 0xff);
      h *= FNV_PRIME;
    }
    return h;
  }

  private static long fmix64(long k) {
    k ^= (k >>> 33);
    k *= 0xff51afd7ed558ccdL;
    k ^= (k >>> 33);
    k *= 0xc4ceb9fe1a85ec53L;
    k ^= (k >>> 33);
    return k;
  }
}
