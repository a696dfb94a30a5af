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

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/** Committed index state of one revision, the prior an incremental write extends. */
public record IndexStatus(
    Revision revision,
    SortedMap<CubeId, CubeStatus> cubes,
    SortedSet<CubeId> announcedSet,
    SortedSet<CubeId> replicatedSet) {

  public IndexStatus {
    Objects.requireNonNull(revision, "revision");
    cubes = Collections.unmodifiableSortedMap(new TreeMap<>(cubes));
    announcedSet = Collections.unmodifiableSortedSet(new TreeSet<>(announcedSet));
    replicatedSet = Collections.unmodifiableSortedSet(new TreeSet<>(replicatedSet));
  }

  public static IndexStatus empty(Revision revision) {
    return new IndexStatus(revision, new TreeMap<>(), new TreeSet<>(), new TreeSet<>());
  }

  /**
   * Replays the blocks of the live files of {@code revision}: a cube's threshold is the lowest
   * {@code cubeMaxWeight} recorded for it and its count sums its {@link CubeState#FLOODED} blocks.
   * Files of other revisions are ignored.
   */
  public static IndexStatus fromFiles(
      Revision revision,
      Collection<IndexFile> files,
      Set<CubeId> announced,
      Set<CubeId> replicated) {
    return fromFiles(revision, files, announced, replicated, Map.of());
  }

  /**
   * Like {@link #fromFiles(Revision, Collection, Set, Set)}, also lowering each cube to its entry
   * in {@code committedThresholds}. A cube that holds no rows yet still gets its committed
   * threshold, with a count of zero.
   */
  public static IndexStatus fromFiles(
      Revision revision,
      Collection<IndexFile> files,
      Set<CubeId> announced,
      Set<CubeId> replicated,
      Map<CubeId, Weight> committedThresholds) {
    Map<CubeId, Weight> thresholds = new HashMap<>(committedThresholds);
    Map<CubeId, Long> counts = new HashMap<>();
    for (IndexFile file : files) {
      if (file.revisionId() != revision.revisionId()) {
        continue;
      }
      for (Block b : file.blocks()) {
        thresholds.merge(b.cubeId(), b.cubeMaxWeight(), Weight::min);
        long owned = b.state() == CubeState.FLOODED ? b.elementCount() : 0L;
        counts.merge(b.cubeId(), owned, Long::sum);
      }
    }
    TreeMap<CubeId, CubeStatus> cubes = new TreeMap<>();
    for (Map.Entry<CubeId, Weight> e : thresholds.entrySet()) {
      long count = counts.getOrDefault(e.getKey(), 0L);
      cubes.put(e.getKey(), new CubeStatus(e.getKey(), e.getValue(), count));
    }
    return new IndexStatus(revision, cubes, new TreeSet<>(announced), new TreeSet<>(replicated));
  }

  public Optional<CubeStatus> cubeStatus(CubeId cube) {
    return Optional.ofNullable(cubes.get(cube));
  }

  /** Cubes whose threshold is below {@link Weight#MAX_VALUE}, in pre-order. */
  public SortedSet<CubeId> closedCubes() {
    TreeSet<CubeId> out = new TreeSet<>();
    for (CubeStatus s : cubes.values()) {
      if (s.isClosed()) {
        out.add(s.cubeId());
      }
    }
    return out;
  }

  public boolean isReplicated(CubeId cube) {
    return replicatedSet.contains(cube);
  }
}
