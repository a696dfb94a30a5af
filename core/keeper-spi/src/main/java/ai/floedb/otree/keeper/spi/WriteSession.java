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

/** A write in progress. Ended once its commit is durable, or abandoned. */
public interface WriteSession extends AutoCloseable {

  String id();

  String tableId();

  long revisionId();

  Set<CubeId> announcedCubes();

  void end();

  /** Ends the session unless already ended. */
  @Override
  void close();
}
