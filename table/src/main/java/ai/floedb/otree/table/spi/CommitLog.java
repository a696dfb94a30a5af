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

import java.io.IOException;

/** Transactional log of a table's revisions and files. */
public interface CommitLog {

  /** Replays the log. A table never written to has version 0 and no revisions. */
  TableSnapshot snapshot(String tableId) throws IOException;

  /**
   * Appends {@code commit} if the log is still at {@code expectedVersion}. Never partially applied.
   */
  CommitResult commit(String tableId, long expectedVersion, Commit commit) throws IOException;
}
