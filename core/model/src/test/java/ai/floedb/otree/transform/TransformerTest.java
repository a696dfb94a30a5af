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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.otree.types.LogicalKind;
import ai.floedb.otree.types.LogicalType;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TransformerTest {

  private static final LogicalType INT = LogicalType.of(LogicalKind.INT);
  private static final LogicalType STRING = LogicalType.of(LogicalKind.STRING);

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "INT,         LINEAR",
    "DOUBLE,      LINEAR",
    "DATE,        LINEAR",
    "TIMESTAMPTZ, LINEAR",
    "STRING,      HASHING",
    "UUID,        HASHING",
    "BOOLEAN,     HASHING",
  })
  void defaultTransformerFollowsTheKind(LogicalKind kind, TransformerType expected) {
    assertThat(IndexedColumn.of("c", LogicalType.of(kind)).transformerType()).isEqualTo(expected);
  }

  @Test
  void transformerTypeIdsParseBack() {
    assertThat(TransformerType.fromId("linear")).isEqualTo(TransformerType.LINEAR);
    assertThat(TransformerType.fromId(" Hashing ")).isEqualTo(TransformerType.HASHING);
    assertThatThrownBy(() -> TransformerType.fromId("quantile"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void linearMapsBoundsOntoTheUnitInterval() {
    LinearTransformation t = new LinearTransformation(INT, 0, 100);

    assertThat(t.transform(0L)).isEqualTo(0.0);
    assertThat(t.transform(50)).isEqualTo(0.5);
    assertThat(t.transform("25")).isEqualTo(0.25);
    assertThat(t.transform(100L)).isLessThan(1.0).isGreaterThan(0.99);
    assertThat(t.transform(-5L)).isEqualTo(0.0);
    assertThat(t.transform(null)).isEqualTo(0.0);
  }

  @Test
  void linearTransformationOfDatesUsesEpochDays() {
    LogicalType date = LogicalType.of(LogicalKind.DATE);
    Transformer tr = IndexedColumn.of("d", date).toTransformer();

    Transformation t = tr.makeTransformation(ColumnStats.accumulator("d").add(0).add(10).build());

    assertThat(t.transform(LocalDate.ofEpochDay(5))).isEqualTo(0.5);
  }

  @Test
  void singleValueYieldsIdentityUntilBoundsWiden() {
    Transformer tr = IndexedColumn.of("id", INT).toTransformer();

    Transformation identity =
        tr.makeTransformation(ColumnStats.accumulator("id").add(7).add(7).build());

    assertThat(identity).isEqualTo(new IdentityTransformation(INT, 7.0));
    assertThat(identity.transform(7L)).isEqualTo(0.0);
    assertThat(tr.maybeUpdateTransformation(identity, stats(7, 7))).isEmpty();
    assertThat(tr.maybeUpdateTransformation(identity, stats(3, 9)))
        .contains(new LinearTransformation(INT, 3, 9));
    assertThat(identity.merge(new IdentityTransformation(INT, 1.0)))
        .isEqualTo(new LinearTransformation(INT, 1, 7));
  }

  @Test
  void allNullBatchLeavesTheSpaceOpen() {
    Transformer tr = IndexedColumn.of("id", INT).toTransformer();

    Transformation empty = tr.makeTransformation(ColumnStats.accumulator("id").addNull().build());

    assertThat(empty).isEqualTo(new IdentityTransformation(INT, null));
    assertThat(tr.maybeUpdateTransformation(empty, stats(1, 2)))
        .contains(new LinearTransformation(INT, 1, 2));
  }

  @Test
  void outOfBoundsStatsMergeIntoSupersetBounds() {
    Transformer tr = IndexedColumn.of("id", INT).toTransformer();
    Transformation current = new LinearTransformation(INT, 0, 100);

    assertThat(tr.maybeUpdateTransformation(current, stats(10, 90))).isEmpty();
    assertThat(tr.maybeUpdateTransformation(current, stats(-10, 50)))
        .contains(new LinearTransformation(INT, -10, 100));
    assertThat(tr.maybeUpdateTransformation(current, stats(20, 200)))
        .contains(new LinearTransformation(INT, 0, 200));
  }

  @Test
  void hashingCoversEverythingAndIsDeterministic() {
    Transformer tr = IndexedColumn.of("name", STRING).toTransformer();
    Transformation t = tr.makeTransformation(ColumnStats.accumulator("name").build());

    double a = t.transform("alice");

    assertThat(a).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
    assertThat(t.transform("alice")).isEqualTo(a);
    assertThat(t.transform("bob")).isNotEqualTo(a);
    assertThat(t.isSupersededBy(new HashTransformation(STRING))).isFalse();
    assertThat(tr.maybeUpdateTransformation(t, ColumnStats.accumulator("name").build())).isEmpty();
  }

  @Test
  void nullValueReplacesNulls() {
    Transformer tr = IndexedColumn.of("id", INT).withNullValue("7").toTransformer();

    assertThat(tr.nullValue()).contains("7");
    assertThat(tr.resolve(null)).isEqualTo(7L);
    assertThat(tr.resolve(3)).isEqualTo(3L);
    assertThat(IndexedColumn.of("id", INT).toTransformer().resolve(null)).isNull();
  }

  @Test
  void rejectsInvalidConfigurations() {
    assertThatThrownBy(() -> new LinearTransformer("s", STRING, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IndexedColumn.of("id", INT).withNullValue("x").toTransformer())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new LinearTransformation(INT, 5, 5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void hashTransformerIsAllowedOnOrderedColumns() {
    Transformer tr =
        IndexedColumn.of("id", INT).withTransformer(TransformerType.HASHING).toTransformer();

    assertThat(tr).isInstanceOf(HashTransformer.class);
    assertThat(tr.makeTransformation(stats(0, 10))).isInstanceOf(HashTransformation.class);
  }

  private static ColumnStats stats(double min, double max) {
    return ColumnStats.accumulator("id").add(min).add(max).build();
  }
}
