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

import ai.floedb.otree.model.CorruptIndexDataException;
import ai.floedb.otree.model.Revision;
import java.io.IOException;
import java.util.List;

/** Reads back the rows of a committed file. */
public interface IndexFileReader {

  /**
   * Reads every row of {@code path}, decoding cube ids with the dimensions of {@code revision}.
   *
   * @throws CorruptIndexDataException if the index columns cannot be decoded
   */
  List<StoredRow> read(String path, Revision revision) throws IOException;
}
