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

/** Writer of one physical file. Not thread-safe. */
public interface IndexFileWriter {

  String path();

  void writeRow(StoredRow row) throws IOException;

  /** Flushes and closes the file. */
  FileWriteResult close() throws IOException;

  /** Closes and deletes a file that will not be committed. */
  void abort() throws IOException;
}
