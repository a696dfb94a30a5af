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

/**
 * Tuning of the threshold estimator.
 *
 * @param maxDepth depth below which rows are never pushed
 * @param clampOutOfBounds place out-of-bounds values on the nearest face instead of creating a new
 *     revision
 * @param parallelism number of shards row preparation is split into
 */
public record IndexerOptions(int maxDepth, boolean clampOutOfBounds, int parallelism) {

  public static final IndexerOptions DEFAULTS = new IndexerOptions(30, false, 1);

  public IndexerOptions {
    if (maxDepth < 1 || maxDepth > CubeId.MAX_DEPTH) {
      throw new IllegalArgumentException(
          "maxDepth must be in [1, " + CubeId.MAX_DEPTH + "]: " + maxDepth);
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
    }
  }
}
