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

import java.util.Objects;

/**
 * Contiguous run of rows of one cube inside an index file.
 *
 * @param minWeight smallest weight observed in the run
 * @param maxWeight largest weight observed in the run
 * @param cubeMaxWeight the cube's threshold when the run was written
 */
public record Block(
    CubeId cubeId,
    CubeState state,
    long elementCount,
    Weight minWeight,
    Weight maxWeight,
    Weight cubeMaxWeight) {

  public Block {
    Objects.requireNonNull(cubeId, "cubeId");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(minWeight, "minWeight");
    Objects.requireNonNull(maxWeight, "maxWeight");
    Objects.requireNonNull(cubeMaxWeight, "cubeMaxWeight");
    if (elementCount < 0) {
      throw new IllegalArgumentException("elementCount must be >= 0: " + elementCount);
    }
    if (minWeight.compareTo(maxWeight) > 0) {
      throw new IllegalArgumentException(
          "minWeight " + minWeight + " is above maxWeight " + maxWeight);
    }
  }

  public boolean isReplicated() {
    return state == CubeState.REPLICATED;
  }
}
