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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.otree.transform.HashTransformation;
import ai.floedb.otree.transform.IndexedColumn;
import ai.floedb.otree.transform.LinearTransformation;
import ai.floedb.otree.transform.Transformer;
import ai.floedb.otree.types.LogicalKind;
import ai.floedb.otree.types.LogicalType;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class RevisionTest {

  private static final LogicalType INT = LogicalType.of(LogicalKind.INT);
  private static final LogicalType STRING = LogicalType.of(LogicalKind.STRING);
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private final List<IndexedColumn> columns =
      List.of(IndexedColumn.of("id", INT), IndexedColumn.of("name", STRING));
  private final List<Transformer> transformers =
      List.of(columns.get(0).toTransformer(), columns.get(1).toTransformer());

  @Test
  void bootstrapIsRevisionZeroWithoutColumns() {
    Revision r = Revision.bootstrap("t", 100, T0);

    assertThat(r.isBootstrap()).isTrue();
    assertThat(r.dimensionCount()).isZero();
    assertThat(r.matchesColumns(columns)).isFalse();
  }

  @Test
  void nextRevisionIncrementsTheId() {
    Revision r1 =
        Revision.bootstrap("t", 100, T0)
            .nextRevision(
                transformers,
                List.of(new LinearTransformation(INT, 0, 10), new HashTransformation(STRING)),
                T0.plusSeconds(1));

    assertThat(r1.revisionId()).isEqualTo(1L);
    assertThat(r1.desiredCubeSize()).isEqualTo(100);
    assertThat(r1.columnNames()).containsExactly("id", "name");
    assertThat(r1.matchesColumns(columns)).isTrue();
    assertThat(r1.matchesColumns(List.of(columns.get(1), columns.get(0)))).isFalse();
    assertThat(r1.root()).isEqualTo(CubeId.root(2));
  }

  @Test
  void transformPlacesResolvedValues() {
    Revision r1 =
        new Revision(
            "t",
            1,
            T0,
            100,
            transformers,
            List.of(new LinearTransformation(INT, 0, 10), new HashTransformation(STRING)));

    Point p = r1.transform(Arrays.asList(5L, null));

    assertThat(p.coordinate(0)).isEqualTo(0.5);
    assertThat(p.coordinate(1)).isEqualTo(0.0);
    assertThatThrownBy(() -> r1.transform(List.of(5L)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsInconsistentRevisions() {
    assertThatThrownBy(() -> new Revision("t", 1, T0, 100, transformers, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Revision("t", 1, T0, 0, List.of(), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Revision("t", 1, T0, 100, List.of(), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
