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

import ai.floedb.otree.model.Revision;
import java.io.IOException;
import java.util.UUID;

/** Opens one writer per rollup group. */
public interface IndexFileWriterFactory {

  IndexFileWriter open(String tableId, Revision revision, UUID groupId) throws IOException;

  /** Removes a closed file whose commit failed. Missing files are ignored. */
  void discard(String path) throws IOException;
}
