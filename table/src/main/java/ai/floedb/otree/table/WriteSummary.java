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
import ai.floedb.otree.model.Revision;
import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of a committed write.
 *
 * @param version log version produced by the commit, or the version read when nothing was written
 * @param attempts how many times the pass ran, 1 when the first commit succeeded
 */
public record WriteSummary(
    long version,
    Revision revision,
    boolean newRevision,
    List<IndexFile> files,
    long rowsWritten,
    SortedSet<CubeId> overflowedCubes,
    int attempts) {

  public WriteSummary {
    files = List.copyOf(files);
  }
}
