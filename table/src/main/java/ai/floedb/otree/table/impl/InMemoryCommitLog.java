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

package ai.floedb.otree.table.impl;

import ai.floedb.otree.table.spi.Commit;
import ai.floedb.otree.table.spi.CommitLog;
import ai.floedb.otree.table.spi.CommitResult;
import ai.floedb.otree.table.spi.TableSnapshot;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryCommitLog implements CommitLog {
  private final Map<String, TableSnapshot> tables = new ConcurrentHashMap<>();

  @Override
  public TableSnapshot snapshot(String tableId) {
    return tables.getOrDefault(tableId, TableSnapshot.empty(tableId));
  }

  @Override
  public CommitResult commit(String tableId, long expectedVersion, Commit commit) {
    final long[] version = {0L};
    final boolean[] updated = {false};
    tables.compute(
        tableId,
        (k, cur) -> {
          TableSnapshot current = cur == null ? TableSnapshot.empty(tableId) : cur;
          version[0] = current.version();
          if (current.version() != expectedVersion) {
            return cur;
          }
          updated[0] = true;
          TableSnapshot next = current.apply(commit);
          version[0] = next.version();
          return next;
        });
    return updated[0] ? CommitResult.success(version[0]) : CommitResult.conflict(version[0]);
  }
}
