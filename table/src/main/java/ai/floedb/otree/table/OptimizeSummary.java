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

package ai.floedb.otree.table;

import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.IndexFile;
import java.util.List;
import java.util.Set;

/** Outcome of an optimization pass. An empty {@code replicatedCubes} means nothing was reserved. */
public record OptimizeSummary(
    long revisionId, Set<CubeId> replicatedCubes, List<IndexFile> files, long rowsCopied) {

  public OptimizeSummary {
    replicatedCubes = Set.copyOf(replicatedCubes);
    files = List.copyOf(files);
  }

  static OptimizeSummary nothing(long revisionId) {
    return new OptimizeSummary(revisionId, Set.of(), List.of(), 0L);
  }
}
