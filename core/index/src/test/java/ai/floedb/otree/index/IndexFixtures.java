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
import ai.floedb.otree.model.CubeStatus;
import ai.floedb.otree.model.IndexStatus;
import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.transform.IndexedColumn;
import ai.floedb.otree.types.LogicalKind;
import ai.floedb.otree.types.LogicalType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

final class IndexFixtures {
  static final LogicalType DOUBLE = LogicalType.of(LogicalKind.DOUBLE);
  static final List<IndexedColumn> XY =
      List.of(IndexedColumn.of("x", DOUBLE), IndexedColumn.of("y", DOUBLE));

  private IndexFixtures() {}

  /** {@code n} rows with uniform x and y in [0, 1) and a unique id starting at {@code firstId}. */
  static List<Row> uniformRows(int n, long seed, long firstId) {
    Random random = new Random(seed);
    List<Row> rows = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Map<String, Object> values = new HashMap<>();
      values.put("id", firstId + i);
      values.put("x", random.nextDouble());
      values.put("y", random.nextDouble());
      rows.add(Row.of(values));
    }
    return rows;
  }

  static Row row(long id, double x, double y) {
    return Row.of(Map.of("id", id, "x", x, "y", y));
  }

  /** Committed state equivalent to having written {@code result}. */
  static IndexStatus statusOf(IndexResult result, Set<CubeId> announced, Set<CubeId> replicated) {
    Map<CubeId, Long> owned = new HashMap<>();
    for (IndexedRow r : result.rows()) {
      if (r.state() == CubeState.FLOODED) {
        owned.merge(r.cubeId(), 1L, Long::sum);
      }
    }
    TreeMap<CubeId, CubeStatus> cubes = new TreeMap<>();
    for (Map.Entry<CubeId, Weight> e : result.changes().cubeWeights().entrySet()) {
      cubes.put(
          e.getKey(),
          new CubeStatus(e.getKey(), e.getValue(), owned.getOrDefault(e.getKey(), 0L)));
    }
    return new IndexStatus(
        result.changes().updatedRevision(),
        cubes,
        new TreeSet<>(announced),
        new TreeSet<>(replicated));
  }

  static long count(IndexResult result, CubeId cube, CubeState state) {
    return result.rows().stream()
        .filter(r -> r.cubeId().equals(cube) && r.state() == state)
        .count();
  }
}
