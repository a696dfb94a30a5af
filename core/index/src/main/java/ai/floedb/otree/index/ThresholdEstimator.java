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

import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.CubeState;
import ai.floedb.otree.model.CubeStatus;
import ai.floedb.otree.model.IndexStatus;
import ai.floedb.otree.model.Point;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Weight;
import io.micrometer.core.instrument.Counter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Pushes a batch down the tree one level at a time. At every cube the lowest-ranked rows that fit
 * stay and the rest move to the child containing them, so the outcome depends on the set of rows
 * and never on their order.
 */
final class ThresholdEstimator {
  private static final Logger LOG = Logger.getLogger(ThresholdEstimator.class);

  private static final Comparator<Placed> RANK =
      Comparator.comparing((Placed p) -> p.row().weight())
          .thenComparingLong(p -> p.row().identityKey());

  private final int maxDepth;
  private final Counter overflowCounter;

  ThresholdEstimator(int maxDepth, Counter overflowCounter) {
    this.maxDepth = maxDepth;
    this.overflowCounter = overflowCounter;
  }

  record Placed(PreparedRow row, Point point) {}

  record Outcome(
      List<IndexedRow> rows,
      SortedMap<CubeId, Weight> cubeWeights,
      SortedMap<CubeId, Long> elementCounts,
      SortedSet<CubeId> overflowed) {}

  Outcome estimate(
      Revision revision,
      List<PreparedRow> rows,
      IndexStatus prior,
      Set<CubeId> announced,
      Set<CubeId> replicated) {
    int desired = revision.desiredCubeSize();
    List<IndexedRow> out = new ArrayList<>(rows.size());
    TreeMap<CubeId, Weight> weights = new TreeMap<>();
    TreeMap<CubeId, Long> counts = new TreeMap<>();
    TreeSet<CubeId> overflowed = new TreeSet<>();

    TreeMap<CubeId, List<Placed>> level = new TreeMap<>();
    if (!rows.isEmpty()) {
      List<Placed> all = new ArrayList<>(rows.size());
      for (PreparedRow r : rows) {
        all.add(new Placed(r, revision.transform(r.values())));
      }
      level.put(revision.root(), all);
    }

    while (!level.isEmpty()) {
      TreeMap<CubeId, List<Placed>> next = new TreeMap<>();
      for (Map.Entry<CubeId, List<Placed>> e : level.entrySet()) {
        CubeId cube = e.getKey();
        List<Placed> group = e.getValue();
        group.sort(RANK);

        Optional<CubeStatus> status = prior.cubeStatus(cube);
        Weight priorMax = status.map(CubeStatus::maxWeight).orElse(Weight.MAX_VALUE);
        long occupied = status.map(CubeStatus::elementCount).orElse(0L);

        if (cube.depth() >= maxDepth) {
          for (Placed p : group) {
            out.add(new IndexedRow(p.row().row(), cube, p.row().weight(), CubeState.FLOODED));
          }
          weights.put(cube, priorMax);
          counts.put(cube, (long) group.size());
          if (occupied + group.size() > desired) {
            LOG.warnf(
                "Cube %s of table %s reached max depth %d holding %d rows (desired %d)",
                cube.string(),
                revision.tableId(),
                maxDepth,
                occupied + group.size(),
                desired);
            overflowed.add(cube);
            overflowCounter.increment();
          }
          continue;
        }

        long capacity = Math.max(0L, desired - occupied);
        int eligible = 0;
        while (eligible < group.size()
            && group.get(eligible).row().weight().compareTo(priorMax) <= 0) {
          eligible++;
        }
        int keep = (int) Math.min(eligible, capacity);
        Weight threshold;
        if (keep == eligible) {
          threshold = priorMax;
        } else if (keep > 0) {
          threshold = group.get(keep - 1).row().weight();
        } else {
          threshold = group.get(0).row().weight().predecessor();
        }

        boolean leaveCopies = announced.contains(cube) && !replicated.contains(cube);
        for (int i = 0; i < group.size(); i++) {
          Placed p = group.get(i);
          if (i < keep) {
            out.add(new IndexedRow(p.row().row(), cube, p.row().weight(), CubeState.FLOODED));
            continue;
          }
          if (leaveCopies) {
            out.add(new IndexedRow(p.row().row(), cube, p.row().weight(), CubeState.ANNOUNCED));
          }
          next.computeIfAbsent(cube.childContaining(p.point()), c -> new ArrayList<>()).add(p);
        }
        weights.put(cube, threshold);
        counts.put(cube, leaveCopies ? (long) group.size() : (long) keep);
      }
      level = next;
    }

    out.sort(IndexedRow.STORAGE_ORDER);
    return new Outcome(out, weights, counts, overflowed);
  }
}
