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

package ai.floedb.otree.rollup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.otree.model.CubeId;
import java.util.List;
import java.util.SortedMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class RollupPlanTest {

  private static final CubeId ROOT = CubeId.root(1);
  private static final CubeId LEFT = CubeId.of(1, 0);
  private static final CubeId RIGHT = CubeId.of(1, 1);

  @Test
  void bindsOneIdPerGroup() {
    SortedMap<CubeId, CubeId> rollup =
        new Rollup(10).populate(ROOT, 6).populate(LEFT, 6).populate(RIGHT, 3).compute();
    AtomicLong next = new AtomicLong();

    RollupPlan plan = RollupPlan.bind(rollup, () -> new UUID(0, next.incrementAndGet()));

    assertThat(plan.groupCount()).isEqualTo(2);
    assertThat(plan.groupFor(ROOT)).isEqualTo(new UUID(0, 1));
    assertThat(plan.groupFor(LEFT)).isEqualTo(new UUID(0, 1));
    assertThat(plan.groupFor(RIGHT)).isEqualTo(new UUID(0, 2));
    assertThat(plan.groups())
        .containsEntry(new UUID(0, 1), List.of(ROOT, LEFT))
        .containsEntry(new UUID(0, 2), List.of(RIGHT));
  }

  @Test
  void cubesOutsideThePlanAreAnError() {
    RollupPlan plan = RollupPlan.bind(new Rollup(10).populate(LEFT, 1).compute());

    assertThatThrownBy(() -> plan.groupFor(CubeId.of(1, 0, 1)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not part of the rollup");
  }
}
