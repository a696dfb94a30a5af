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

/** Raised when a pass keeps losing the commit race after all configured retries. */
public class CommitConflictException extends RuntimeException {
  private final String tableId;
  private final int attempts;

  public CommitConflictException(String tableId, int attempts) {
    super("Commit to table " + tableId + " conflicted " + attempts + " times; giving up");
    this.tableId = tableId;
    this.attempts = attempts;
  }

  public String tableId() {
    return tableId;
  }

  public int attempts() {
    return attempts;
  }
}
