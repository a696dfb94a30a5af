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

import ai.floedb.otree.model.Block;
import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.CubeState;
import ai.floedb.otree.model.IndexFile;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.transform.HashTransformation;
import ai.floedb.otree.transform.IndexedColumn;
import ai.floedb.otree.transform.LinearTransformation;
import ai.floedb.otree.types.LogicalKind;
import ai.floedb.otree.types.LogicalType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

final class CodecFixtures {
  static final Instant TS = Instant.parse("2026-03-01T12:00:00Z");
  static final LogicalType INT = LogicalType.of(LogicalKind.INT);
  static final LogicalType STRING = LogicalType.of(LogicalKind.STRING);

  private CodecFixtures() {}

  /** Revision 1 over an INT column "n" in [0, 100] and a hashed STRING column "s". */
  static Revision revision() {
    IndexedColumn n = IndexedColumn.of("n", INT).withNullValue("-1");
    IndexedColumn s = IndexedColumn.of("s", STRING);
    return Revision.bootstrap("t", 100, TS)
        .nextRevision(
            List.of(n.toTransformer(), s.toTransformer()),
            List.of(new LinearTransformation(INT, 0, 100), new HashTransformation(STRING)),
            TS);
  }

  static IndexFile indexFile(Revision revision, String name) {
    CubeId root = revision.root();
    CubeId child = root.child(3);
    return new IndexFile(
        "t/data/" + name + ".jsonl",
        512,
        true,
        TS,
        revision.revisionId(),
        List.of(
            new Block(root, CubeState.FLOODED, 10, Weight.of(-50), Weight.of(7), Weight.of(7)),
            new Block(
                child,
                CubeState.FLOODED,
                4,
                Weight.of(9),
                Weight.of(1_000),
                Weight.MAX_VALUE)),
        Optional.of("{\"numRecords\":14}"));
  }
}
