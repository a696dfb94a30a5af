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

import ai.floedb.otree.model.CubeId;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;

/** Builds {@link OTreeConfig} from the default config sources plus explicit overrides. */
public final class OTreeConfigs {
  private static final int OVERRIDE_ORDINAL = 500;

  private OTreeConfigs() {}

  public static OTreeConfig load() {
    return load(Map.of());
  }

  /**
   * Loads the configuration. {@code overrides} take precedence over system properties, the
   * environment and {@code META-INF/microprofile-config.properties}.
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public static OTreeConfig load(Map<String, String> overrides) {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withSources(
                new PropertiesConfigSource(overrides, "otree-overrides", OVERRIDE_ORDINAL))
            .withMapping(OTreeConfig.class)
            .build();
    OTreeConfig mapped = config.getConfigMapping(OTreeConfig.class);
    validate(mapped);
    return mapped;
  }

  static void validate(OTreeConfig config) {
    OTreeConfig.Index index = config.index();
    require(index.desiredCubeSize() > 0, "otree.index.desired-cube-size must be positive");
    require(
        index.maxDepth() >= 1 && index.maxDepth() <= CubeId.MAX_DEPTH,
        "otree.index.max-depth must be in [1, " + CubeId.MAX_DEPTH + "]");
    require(index.parallelism() >= 1, "otree.index.parallelism must be at least 1");
    config
        .rollup()
        .desiredFileSize()
        .ifPresent(s -> require(s > 0, "otree.rollup.desired-file-size must be positive"));
    require(
        config.keeper().optimizationCubeLimit() > 0,
        "otree.keeper.optimization-cube-limit must be positive");
    require(
        !config.keeper().reservationTimeout().isNegative()
            && !config.keeper().reservationTimeout().isZero(),
        "otree.keeper.reservation-timeout must be positive");
    require(config.commit().maxRetries() >= 0, "otree.commit.max-retries must not be negative");
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new IllegalArgumentException(message);
    }
  }
}
