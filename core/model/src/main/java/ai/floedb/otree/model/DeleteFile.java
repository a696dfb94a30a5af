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

import java.time.Instant;
import java.util.Objects;

/** Tombstone removing a previously committed file. */
public record DeleteFile(String path, long size, boolean dataChange, Instant deletionTimestamp)
    implements TableFile {

  public DeleteFile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(deletionTimestamp, "deletionTimestamp");
  }

  public static DeleteFile of(IndexFile file, Instant at) {
    return new DeleteFile(file.path(), file.size(), true, at);
  }
}
