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

import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.TableChanges;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups cubes into files of roughly {@code desiredFileSize} rows.
 *
 * <p>Cubes are visited in pre-order, so a group is a run of neighbouring cubes. A cube larger than
 * the target closes the run accumulated before it and forms a group on its own; its descendants
 * start a new run. Every group is named after its first cube, so the mapping is a pure function of
 * the counts.
 */
public final class Rollup {

  private final long desiredFileSize;
  private final TreeMap<CubeId, Long> counts = new TreeMap<>();

  public Rollup(long desiredFileSize) {
    if (desiredFileSize <= 0) {
      throw new IllegalArgumentException("desiredFileSize must be > 0: " + desiredFileSize);
    }
    this.desiredFileSize = desiredFileSize;
  }

  /** Rollup of the element counts of {@code changes}. */
  public static SortedMap<CubeId, CubeId> computeRollup(
      TableChanges changes, long desiredFileSize) {
    Rollup rollup = new Rollup(desiredFileSize);
    for (Map.Entry<CubeId, Long> e : changes.inputBlockElementCounts().entrySet()) {
      rollup.populate(e.getKey(), e.getValue());
    }
    return rollup.compute();
  }

  /** Adds {@code count} rows to {@code cube}. Zero counts are ignored. */
  public Rollup populate(CubeId cube, long count) {
    if (count < 0) {
      throw new IllegalArgumentException("negative count for cube " + cube + ": " + count);
    }
    if (count > 0) {
      counts.merge(cube, count, Long::sum);
    }
    return this;
  }

  /** Maps every populated cube to the first cube of its group. */
  public SortedMap<CubeId, CubeId> compute() {
    TreeMap<CubeId, CubeId> out = new TreeMap<>();
    List<CubeId> pending = new ArrayList<>();
    long accumulated = 0;
    for (Map.Entry<CubeId, Long> e : counts.entrySet()) {
      CubeId cube = e.getKey();
      long count = e.getValue();
      if (count > desiredFileSize) {
        flush(pending, out);
        accumulated = 0;
        out.put(cube, cube);
        continue;
      }
      pending.add(cube);
      accumulated += count;
      if (accumulated >= desiredFileSize) {
        flush(pending, out);
        accumulated = 0;
      }
    }
    flush(pending, out);
    return Collections.unmodifiableSortedMap(out);
  }

  private static void flush(List<CubeId> pending, Map<CubeId, CubeId> out) {
    if (pending.isEmpty()) {
      return;
    }
    CubeId leader = pending.get(0);
    for (CubeId c : pending) {
      out.put(c, leader);
    }
    pending.clear();
  }
}
