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

package ai.floedb.otree.index;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.transform.ColumnStats;
import ai.floedb.otree.transform.IndexedColumn;
import ai.floedb.otree.transform.Transformer;
import ai.floedb.otree.types.LogicalKind;
import ai.floedb.otree.types.LogicalType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RowPreparerTest {

  private static final LogicalType INT = LogicalType.of(LogicalKind.INT);
  private static final LogicalType STRING = LogicalType.of(LogicalKind.STRING);

  @Test
  void statsSkipNullsUnlessSubstituted() {
    Transformer plain = IndexedColumn.of("a", INT).toTransformer();
    Transformer substituted = IndexedColumn.of("b", INT).withNullValue("100").toTransformer();
    Transformer hashed = IndexedColumn.of("s", STRING).toTransformer();
    List<Row> rows = List.of(row(1L, 5L, "x"), row(null, null, null), row(9L, 7L, "y"));

    PreparedBatch batch =
        new RowPreparer(List.of(plain, substituted, hashed)).prepare(rows, Runnable::run, 1);

    assertThat(batch.stats())
        .containsExactly(
            new ColumnStats("a", 3, 1, 1.0, 9.0),
            new ColumnStats("b", 3, 0, 5.0, 100.0),
            new ColumnStats("s", 3, 1, null, null));
    assertThat(batch.rows().get(1).values()).containsExactly(null, 100L, null);
  }

  @Test
  void weightIgnoresNullSubstitutionAndOtherColumns() {
    Transformer plain = IndexedColumn.of("a", INT).toTransformer();
    Transformer substituted = IndexedColumn.of("a", INT).withNullValue("3").toTransformer();
    Row r1 = row(null, 1L, "x");
    Row r2 = row(null, 2L, "z");

    Weight w1 =
        new RowPreparer(List.of(plain))
            .prepare(List.of(r1), Runnable::run, 1)
            .rows()
            .get(0)
            .weight();
    Weight w2 =
        new RowPreparer(List.of(substituted))
            .prepare(List.of(r2), Runnable::run, 1)
            .rows()
            .get(0)
            .weight();

    assertThat(w1).isEqualTo(w2);
  }

  private static Row row(Long a, Long b, String s) {
    Map<String, Object> values = new HashMap<>();
    values.put("a", a);
    values.put("b", b);
    values.put("s", s);
    return Row.of(values);
  }
}
