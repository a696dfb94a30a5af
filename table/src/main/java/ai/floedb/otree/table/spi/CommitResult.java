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

/**
 * Outcome of a conditional commit.
 *
 * @param version log version after the commit, or the current version when it conflicted
 */
public record CommitResult(boolean committed, long version) {

  public static CommitResult success(long version) {
    return new CommitResult(true, version);
  }

  public static CommitResult conflict(long currentVersion) {
    return new CommitResult(false, currentVersion);
  }
}
