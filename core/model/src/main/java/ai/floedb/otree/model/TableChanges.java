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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of one write or optimization pass, consumed by the commit. Never partially applied: a
 * commit conflict discards the whole value.
 *
 * @param cubeWeights threshold of every cube the pass touched
 * @param inputBlockElementCounts rows the pass assigned to each cube, copies included
 * @param announcedSet announced cubes the pass honoured
 * @param deltaReplicatedSet cubes whose replication this pass completes
 * @param overflowedCubes cubes at max depth holding more rows than the desired cube size
 */
public record TableChanges(
    boolean isNewRevision,
    Revision updatedRevision,
    SortedMap<CubeId, Weight> cubeWeights,
    SortedMap<CubeId, Long> inputBlockElementCounts,
    SortedSet<CubeId> announcedSet,
    SortedSet<CubeId> deltaReplicatedSet,
    SortedSet<CubeId> overflowedCubes) {

  public TableChanges {
    Objects.requireNonNull(updatedRevision, "updatedRevision");
    cubeWeights = Collections.unmodifiableSortedMap(new TreeMap<>(cubeWeights));
    inputBlockElementCounts =
        Collections.unmodifiableSortedMap(new TreeMap<>(inputBlockElementCounts));
    announcedSet = Collections.unmodifiableSortedSet(new TreeSet<>(announcedSet));
    deltaReplicatedSet = Collections.unmodifiableSortedSet(new TreeSet<>(deltaReplicatedSet));
    overflowedCubes = Collections.unmodifiableSortedSet(new TreeSet<>(overflowedCubes));
  }

  public static TableChanges empty(Revision revision, boolean isNewRevision) {
    return new TableChanges(
        isNewRevision,
        revision,
        new TreeMap<>(),
        new TreeMap<>(),
        new TreeSet<>(),
        new TreeSet<>(),
        new TreeSet<>());
  }

  public Optional<Weight> cubeWeight(CubeId cube) {
    return Optional.ofNullable(cubeWeights.get(cube));
  }

  public long elementCount(CubeId cube) {
    return inputBlockElementCounts.getOrDefault(cube, 0L);
  }

  /**
   * Approximate merge of two partial results for the same revision: counts are summed and each
   * cube keeps the lower threshold.
   */
  public TableChanges merge(TableChanges other) {
    if (other.updatedRevision.revisionId() != updatedRevision.revisionId()) {
      throw new IllegalArgumentException(
          "cannot merge changes of revisions "
              + updatedRevision.revisionId()
              + " and "
              + other.updatedRevision.revisionId());
    }
    TreeMap<CubeId, Weight> weights = new TreeMap<>(cubeWeights);
    for (Map.Entry<CubeId, Weight> e : other.cubeWeights.entrySet()) {
      weights.merge(e.getKey(), e.getValue(), Weight::min);
    }
    TreeMap<CubeId, Long> counts = new TreeMap<>(inputBlockElementCounts);
    for (Map.Entry<CubeId, Long> e : other.inputBlockElementCounts.entrySet()) {
      counts.merge(e.getKey(), e.getValue(), Long::sum);
    }
    return new TableChanges(
        isNewRevision || other.isNewRevision,
        updatedRevision,
        weights,
        counts,
        union(announcedSet, other.announcedSet),
        union(deltaReplicatedSet, other.deltaReplicatedSet),
        union(overflowedCubes, other.overflowedCubes));
  }

  private static SortedSet<CubeId> union(Set<CubeId> a, Set<CubeId> b) {
    TreeSet<CubeId> out = new TreeSet<>(a);
    out.addAll(b);
    return out;
  }
}
