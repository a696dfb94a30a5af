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

package ai.floedb.otree.table.spi;

import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.DeleteFile;
import ai.floedb.otree.model.IndexFile;
import ai.floedb.otree.model.IndexStatus;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Weight;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * State of a table at one log version.
 *
 * @param thresholds lowest committed threshold of each closed cube, per revision
 */
public record TableSnapshot(
    String tableId,
    long version,
    SortedMap<Long, Revision> revisions,
    List<IndexFile> files,
    Map<Long, Set<CubeId>> replicated,
    Map<Long, SortedMap<CubeId, Weight>> thresholds) {

  public TableSnapshot {
    revisions = Collections.unmodifiableSortedMap(new TreeMap<>(revisions));
    files = List.copyOf(files);
    Map<Long, Set<CubeId>> r = new HashMap<>();
    replicated.forEach((k, v) -> r.put(k, Collections.unmodifiableSet(new TreeSet<>(v))));
    replicated = Collections.unmodifiableMap(r);
    Map<Long, SortedMap<CubeId, Weight>> t = new HashMap<>();
    thresholds.forEach((k, v) -> t.put(k, Collections.unmodifiableSortedMap(new TreeMap<>(v))));
    thresholds = Collections.unmodifiableMap(t);
  }

  public static TableSnapshot empty(String tableId) {
    return new TableSnapshot(tableId, 0L, new TreeMap<>(), List.of(), Map.of(), Map.of());
  }

  /** Applies {@code commit} on top of this snapshot, yielding version + 1. */
  public TableSnapshot apply(Commit commit) {
    TreeMap<Long, Revision> nextRevisions = new TreeMap<>(revisions);
    commit.revision().ifPresent(r -> nextRevisions.put(r.revisionId(), r));
    Map<String, IndexFile> live = new LinkedHashMap<>();
    for (IndexFile f : files) {
      live.put(f.path(), f);
    }
    for (DeleteFile d : commit.removeFiles()) {
      live.remove(d.path());
    }
    for (IndexFile f : commit.addFiles()) {
      live.put(f.path(), f);
    }
    Map<Long, Set<CubeId>> nextReplicated = new HashMap<>(replicated);
    commit
        .replicated()
        .ifPresent(
            rep ->
                nextReplicated.merge(
                    rep.revisionId(),
                    rep.cubes(),
                    (a, b) -> {
                      Set<CubeId> u = new TreeSet<>(a);
                      u.addAll(b);
                      return u;
                    }));
    Map<Long, SortedMap<CubeId, Weight>> nextThresholds = new HashMap<>(thresholds);
    commit
        .thresholds()
        .ifPresent(
            t -> {
              TreeMap<CubeId, Weight> merged =
                  new TreeMap<>(nextThresholds.getOrDefault(t.revisionId(), new TreeMap<>()));
              t.weights().forEach((cube, w) -> merged.merge(cube, w, Weight::min));
              nextThresholds.put(t.revisionId(), merged);
            });
    return new TableSnapshot(
        tableId,
        version + 1,
        nextRevisions,
        new ArrayList<>(live.values()),
        nextReplicated,
        nextThresholds);
  }

  public Optional<Revision> latestRevision() {
    return revisions.isEmpty() ? Optional.empty() : Optional.of(revisions.get(revisions.lastKey()));
  }

  public Optional<Revision> revision(long revisionId) {
    return Optional.ofNullable(revisions.get(revisionId));
  }

  public List<IndexFile> filesOf(long revisionId) {
    List<IndexFile> out = new ArrayList<>();
    for (IndexFile f : files) {
      if (f.revisionId() == revisionId) {
        out.add(f);
      }
    }
    return out;
  }

  public Set<CubeId> replicatedCubes(long revisionId) {
    return replicated.getOrDefault(revisionId, Set.of());
  }

  public SortedMap<CubeId, Weight> thresholds(long revisionId) {
    return thresholds.getOrDefault(revisionId, Collections.emptySortedMap());
  }

  /**
   * Committed index state of {@code revisionId} with the given announced cubes.
   *
   * @throws IllegalArgumentException if the revision is unknown
   */
  public IndexStatus indexStatus(long revisionId, Set<CubeId> announced) {
    Revision revision =
        revision(revisionId)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "table " + tableId + " has no revision " + revisionId));
    return IndexStatus.fromFiles(
        revision,
        filesOf(revisionId),
        announced,
        replicatedCubes(revisionId),
        thresholds(revisionId));
  }
}
