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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.otree.types.LogicalKind;
import ai.floedb.otree.types.LogicalType;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValueHashingTest {

  private static final LogicalType INT = LogicalType.of(LogicalKind.INT);
  private static final LogicalType STRING = LogicalType.of(LogicalKind.STRING);

  @Test
  void murmurMatchesReferenceVectors() {
    assertThat(Murmur3.hashBytes(new byte[0], 0)).isZero();
    assertThat(Murmur3.hashBytes(new byte[0], 1)).isEqualTo(0x514E28B7);
    assertThat(Murmur3.hashBytes("hello".getBytes(StandardCharsets.UTF_8), 0))
        .isEqualTo(0x248BFA47);
  }

  @Test
  void intAndLongHashMatchTheirLittleEndianBytes() {
    assertThat(Murmur3.hashInt(0x04030201, 9))
        .isEqualTo(Murmur3.hashBytes(new byte[] {1, 2, 3, 4}, 9));
    assertThat(Murmur3.hashLong(0x0807060504030201L, 9))
        .isEqualTo(Murmur3.hashBytes(new byte[] {1, 2, 3, 4, 5, 6, 7, 8}, 9));
  }

  @Test
  void weightHashDependsOnCanonicalValuesOnly() {
    List<LogicalType> types = List.of(INT, STRING);

    int h = ValueHashing.weightHash(types, List.of(5L, "a"));

    assertThat(ValueHashing.weightHash(types, List.of(5, "a"))).isEqualTo(h);
    assertThat(ValueHashing.weightHash(types, List.of("5", "a"))).isEqualTo(h);
    assertThat(ValueHashing.weightHash(types, List.of(6L, "a"))).isNotEqualTo(h);
  }

  @Test
  void nullsLeaveTheRunningHashUnchanged() {
    int h = ValueHashing.weightHash(List.of(INT, INT), Arrays.asList(null, 5L));

    assertThat(h).isEqualTo(ValueHashing.hash(INT, 5L, ValueHashing.WEIGHT_SEED));
    assertThat(ValueHashing.weightHash(List.of(INT), Arrays.asList((Object) null)))
        .isEqualTo(ValueHashing.WEIGHT_SEED);
  }

  @Test
  void weightHashRejectsArityMismatch() {
    assertThatThrownBy(() -> ValueHashing.weightHash(List.of(INT), List.of(1L, 2L)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void identityKeyIgnoresColumnOrder() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("x", 1L);
    a.put("y", "b");
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("y", "b");
    b.put("x", 1L);

    assertThat(ValueHashing.identityKey(a)).isEqualTo(ValueHashing.identityKey(b));
    b.put("x", 2L);
    assertThat(ValueHashing.identityKey(a)).isNotEqualTo(ValueHashing.identityKey(b));
  }
}
