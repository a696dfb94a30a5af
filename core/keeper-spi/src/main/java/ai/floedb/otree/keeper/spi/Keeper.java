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

package ai.floedb.otree.keeper.spi;

import ai.floedb.otree.model.CubeId;
import java.util.Set;

/**
 * Coordinates writers and optimizers of the same table revision.
 *
 * <p>Writers learn which cubes are announced, optimizers reserve announced cubes so that no two of
 * them replicate the same cube. Announcement is monotonic and a cube reported replicated is never
 * offered again. A reservation conflict yields a smaller, possibly empty, set of cubes and never
 * an error.
 */
public interface Keeper extends AutoCloseable {

  /** Opens a write session; its {@link WriteSession#announcedCubes()} are fixed at this point. */
  WriteSession beginWrite(String tableId, long revisionId);

  /** Adds {@code cubes} to the announced set. Announcing a cube twice has no effect. */
  void announce(String tableId, long revisionId, Set<CubeId> cubes);

  /**
   * Reserves up to {@code cubeLimit} announced cubes that are neither replicated nor reserved by
   * another live session, in cube order.
   *
   * @throws IllegalArgumentException if {@code cubeLimit} is not positive
   */
  OptimizationSession beginOptimization(String tableId, long revisionId, int cubeLimit);

  /** Cubes announced so far. */
  Set<CubeId> announcedCubes(String tableId, long revisionId);

  /** Cubes reported replicated so far. */
  Set<CubeId> replicatedCubes(String tableId, long revisionId);

  /** Stops the keeper. Sessions still open are abandoned. */
  @Override
  void close();
}
