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

package ai.floedb.otree.table.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "otree")
public interface OTreeConfig {
  Index index();

  Rollup rollup();

  Keeper keeper();

  Commit commit();

  interface Index {
    @WithDefault("100000")
    int desiredCubeSize();

    @WithDefault("30")
    int maxDepth();

    @WithDefault("false")
    boolean clampOutOfBounds();

    @WithDefault("1")
    int parallelism();
  }

  interface Rollup {
    /** Target rows per file; the revision's desired cube size when unset. */
    Optional<Long> desiredFileSize();
  }

  interface Keeper {
    @WithDefault("memory")
    String provider();

    @WithDefault("10")
    int optimizationCubeLimit();

    @WithDefault("PT10M")
    Duration reservationTimeout();
  }

  interface Commit {
    @WithDefault("3")
    int maxRetries();
  }
}
