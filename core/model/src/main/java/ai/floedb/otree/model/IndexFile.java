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

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A committed physical file holding the rows of one rollup group.
 *
 * <p>{@code dataChange} is false for files written by optimization, which only add replicated
 * copies of rows the table already holds.
 */
public record IndexFile(
    String path,
    long size,
    boolean dataChange,
    Instant modificationTime,
    long revisionId,
    List<Block> blocks,
    Optional<String> stats)
    implements TableFile {

  public IndexFile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(modificationTime, "modificationTime");
    blocks = List.copyOf(blocks);
    stats = stats == null ? Optional.empty() : stats;
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0: " + size);
    }
  }

  public long elementCount() {
    long total = 0;
    for (Block b : blocks) {
      total += b.elementCount();
    }
    return total;
  }

  public boolean hasCubeData(CubeId cubeId) {
    for (Block b : blocks) {
      if (b.cubeId().equals(cubeId)) {
        return true;
      }
    }
    return false;
  }
}
