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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LogicalValuesTest {

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "int,           INT",
    "BIGINT,        INT",
    "float8,        DOUBLE",
    "varchar,       STRING",
    "bool,          BOOLEAN",
    "'decimal(10,2)', 'DECIMAL(10,2)'",
    "timestamptz,   TIMESTAMPTZ",
  })
  void typesParseFromNamesAndAliases(String text, String expected) {
    assertThat(LogicalType.parse(text).toString()).isEqualTo(expected);
  }

  @Test
  void unknownTypesAreRejected() {
    assertThatThrownBy(() -> LogicalType.parse("GEOMETRY"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LogicalType.parse("INT(3,1)"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void normalizeCanonicalisesPerKind() {
    assertThat(LogicalValues.normalize(LogicalType.of(LogicalKind.INT), 3)).isEqualTo(3L);
    assertThat(LogicalValues.normalize(LogicalType.of(LogicalKind.INT), " 42 ")).isEqualTo(42L);
    assertThat(LogicalValues.normalize(LogicalType.decimal(10, 2), "1.50"))
        .isEqualTo(new BigDecimal("1.50"));
    assertThat(LogicalValues.normalize(LogicalType.of(LogicalKind.BOOLEAN), "1")).isEqualTo(true);
    assertThat(LogicalValues.normalize(LogicalType.of(LogicalKind.DATE), 3L))
        .isEqualTo(LocalDate.ofEpochDay(3));
    assertThat(LogicalValues.normalize(LogicalType.of(LogicalKind.STRING), null)).isNull();
  }

  @Test
  void fractionalIntegersAreRejected() {
    assertThatThrownBy(() -> LogicalValues.normalize(LogicalType.of(LogicalKind.INT), 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void temporalValuesMapToEpochUnits() {
    assertThat(LogicalValues.toDouble(LogicalType.of(LogicalKind.DATE), "1970-01-11"))
        .isEqualTo(10.0);
    assertThat(
            LogicalValues.toDouble(
                LogicalType.of(LogicalKind.TIMESTAMPTZ), Instant.parse("1970-01-01T00:00:01Z")))
        .isEqualTo(1_000_000.0);
    assertThatThrownBy(() -> LogicalValues.toDouble(LogicalType.of(LogicalKind.STRING), "a"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void encodedValuesNormalizeBack() {
    LogicalType ts = LogicalType.of(LogicalKind.TIMESTAMP);
    LocalDateTime when = LocalDateTime.parse("2026-03-04T05:06:07.123456");
    LogicalType uuid = LogicalType.of(LogicalKind.UUID);
    UUID id = UUID.randomUUID();
    LogicalType bin = LogicalType.of(LogicalKind.BINARY);

    assertThat(LogicalValues.normalize(ts, LogicalValues.encode(ts, when))).isEqualTo(when);
    assertThat(LogicalValues.normalize(uuid, LogicalValues.encode(uuid, id))).isEqualTo(id);
    assertThat((byte[]) LogicalValues.normalize(bin, LogicalValues.encode(bin, new byte[] {1, 2})))
        .containsExactly(1, 2);
  }
}
