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

package ai.floedb.otree.index;

import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.CubeState;
import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.Weight;
import java.util.Comparator;

/** A row placed in a cube. A row may appear once per cube it is copied into. */
public record IndexedRow(Row row, CubeId cubeId, Weight weight, CubeState state) {

  /** File order: cube pre-order, then state, then weight. */
  public static final Comparator<IndexedRow> STORAGE_ORDER =
      Comparator.comparing(IndexedRow::cubeId)
          .thenComparing(IndexedRow::state)
          .thenComparing(IndexedRow::weight);
}
