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

import ai.floedb.otree.transform.IndexedColumn;
import ai.floedb.otree.transform.LinearTransformation;
import ai.floedb.otree.types.LogicalKind;
import ai.floedb.otree.types.LogicalType;
import java.time.Instant;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class TableChangesTest {

  private static final LogicalType DOUBLE = LogicalType.of(LogicalKind.DOUBLE);

  private final Revision revision =
      new Revision(
          "t",
          1,
          Instant.EPOCH,
          10,
          List.of(IndexedColumn.of("x", DOUBLE).toTransformer()),
          List.of(new LinearTransformation(DOUBLE, 0, 1)));

  @Test
  void mergeSumsCountsAndKeepsTheLowerThreshold() {
    CubeId root = CubeId.root(1);
    CubeId child = CubeId.of(1, 1);
    TableChanges a = changes(revision, root, Weight.of(100), 10, child, Weight.MAX_VALUE, 2);
    TableChanges b = changes(revision, root, Weight.of(40), 10, child, Weight.MAX_VALUE, 5);

    TableChanges merged = a.merge(b);

    assertThat(merged.cubeWeight(root)).contains(Weight.of(40));
    assertThat(merged.cubeWeight(child)).contains(Weight.MAX_VALUE);
    assertThat(merged.elementCount(root)).isEqualTo(20L);
    assertThat(merged.elementCount(child)).isEqualTo(7L);
    assertThat(merged.cubeWeight(CubeId.of(1, 0))).isEmpty();
  }

  @Test
  void mergeRejectsDifferentRevisions() {
    Revision other =
        revision.nextRevision(
            revision.transformers(), revision.transformations(), Instant.EPOCH);

    assertThatThrownBy(
            () -> TableChanges.empty(revision, false).merge(TableChanges.empty(other, true)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static TableChanges changes(
      Revision r, CubeId c1, Weight w1, long n1, CubeId c2, Weight w2, long n2) {
    TreeMap<CubeId, Weight> weights = new TreeMap<>();
    weights.put(c1, w1);
    weights.put(c2, w2);
    TreeMap<CubeId, Long> counts = new TreeMap<>();
    counts.put(c1, n1);
    counts.put(c2, n2);
    return new TableChanges(
        false, r, weights, counts, new TreeSet<>(), new TreeSet<>(), new TreeSet<>());
  }
}
