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
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Weight;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One atomic change of the table log.
 *
 * @param revision revision introduced by this commit, if any
 * @param replicated cubes whose replication this commit completes
 * @param thresholds cube thresholds the pass lowered, kept even for cubes that got no rows
 */
public record Commit(
    Instant timestamp,
    Optional<Revision> revision,
    List<IndexFile> addFiles,
    List<DeleteFile> removeFiles,
    Optional<Replication> replicated,
    Optional<Thresholds> thresholds) {

  public Commit {
    Objects.requireNonNull(timestamp, "timestamp");
    revision = revision == null ? Optional.empty() : revision;
    replicated = replicated == null ? Optional.empty() : replicated;
    thresholds = thresholds == null ? Optional.empty() : thresholds;
    addFiles = List.copyOf(addFiles);
    removeFiles = List.copyOf(removeFiles);
  }

  public Commit(
      Instant timestamp,
      Optional<Revision> revision,
      List<IndexFile> addFiles,
      List<DeleteFile> removeFiles,
      Optional<Replication> replicated) {
    this(timestamp, revision, addFiles, removeFiles, replicated, Optional.empty());
  }

  public boolean dataChange() {
    return addFiles.stream().anyMatch(IndexFile::dataChange)
        || removeFiles.stream().anyMatch(DeleteFile::dataChange);
  }

  /** Cubes of one revision that are now replicated. */
  public record Replication(long revisionId, Set<CubeId> cubes) {
    public Replication {
      cubes = Set.copyOf(cubes);
    }
  }

  /** Thresholds below {@link Weight#MAX_VALUE} of cubes of one revision. */
  public record Thresholds(long revisionId, SortedMap<CubeId, Weight> weights) {
    public Thresholds {
      weights = Collections.unmodifiableSortedMap(new TreeMap<>(weights));
    }

    /** Keeps the closed cubes of {@code weights}, or nothing if none is closed. */
    public static Optional<Thresholds> closed(long revisionId, Map<CubeId, Weight> weights) {
      TreeMap<CubeId, Weight> closed = new TreeMap<>();
      weights.forEach(
          (cube, w) -> {
            if (w.compareTo(Weight.MAX_VALUE) < 0) {
              closed.put(cube, w);
            }
          });
      return closed.isEmpty() ? Optional.empty() : Optional.of(new Thresholds(revisionId, closed));
    }
  }
}
