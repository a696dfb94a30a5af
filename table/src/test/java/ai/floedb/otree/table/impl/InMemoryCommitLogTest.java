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

package ai.floedb.otree.table.impl;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.IndexStatus;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.table.spi.Commit;
import ai.floedb.otree.table.spi.CommitResult;
import ai.floedb.otree.table.spi.TableSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryCommitLogTest {
  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Test
  void unknownTableIsEmpty() {
    TableSnapshot snap = new InMemoryCommitLog().snapshot("t");

    assertThat(snap.version()).isZero();
    assertThat(snap.latestRevision()).isEmpty();
    assertThat(snap.files()).isEmpty();
  }

  @Test
  void commitsAreConditionalOnTheVersion() {
    InMemoryCommitLog log = new InMemoryCommitLog();
    Revision revision = CodecFixtures.revision();
    Commit first =
        new Commit(
            NOW,
            Optional.of(revision),
            List.of(CodecFixtures.indexFile(revision, "a")),
            List.of(),
            Optional.empty());

    assertThat(log.commit("t", 0, first)).isEqualTo(CommitResult.success(1));
    assertThat(log.commit("t", 0, first)).isEqualTo(CommitResult.conflict(1));
    assertThat(log.commit("other", 0, first).committed()).isTrue();

    TableSnapshot snap = log.snapshot("t");
    assertThat(snap.version()).isEqualTo(1);
    assertThat(snap.latestRevision()).contains(revision);
    assertThat(snap.files()).hasSize(1);
  }

  @Test
  void thresholdsOfEmptyPassesStayCommitted() {
    InMemoryCommitLog log = new InMemoryCommitLog();
    Revision revision = CodecFixtures.revision();
    CubeId root = revision.root();
    CubeId empty = root.child(2);
    log.commit(
        "t",
        0,
        new Commit(
            NOW,
            Optional.of(revision),
            List.of(CodecFixtures.indexFile(revision, "a")),
            List.of(),
            Optional.empty()));
    log.commit("t", 1, thresholdsOnly(Map.of(root, Weight.of(3), empty, Weight.of(5))));
    log.commit("t", 2, thresholdsOnly(Map.of(root, Weight.of(6))));

    IndexStatus status = log.snapshot("t").indexStatus(1, Set.of());

    assertThat(status.cubeStatus(root).get().maxWeight()).isEqualTo(Weight.of(3));
    assertThat(status.cubeStatus(root).get().elementCount()).isEqualTo(10);
    assertThat(status.cubeStatus(empty).get().maxWeight()).isEqualTo(Weight.of(5));
    assertThat(status.cubeStatus(empty).get().elementCount()).isZero();
    assertThat(status.cubeStatus(root.child(3)).get().maxWeight()).isEqualTo(Weight.MAX_VALUE);
    assertThat(status.closedCubes()).containsExactly(root, empty);
  }

  private static Commit thresholdsOnly(Map<CubeId, Weight> weights) {
    return new Commit(
        NOW,
        Optional.empty(),
        List.of(),
        List.of(),
        Optional.empty(),
        Commit.Thresholds.closed(1, weights));
  }
}
