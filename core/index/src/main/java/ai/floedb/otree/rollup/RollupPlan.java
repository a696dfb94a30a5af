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

package ai.floedb.otree.rollup;

import ai.floedb.otree.model.CubeId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;

/** A rollup with a file id bound to each group, created right before files are written. */
public final class RollupPlan {

  private final SortedMap<CubeId, CubeId> leaders;
  private final Map<CubeId, UUID> groupIds;

  private RollupPlan(SortedMap<CubeId, CubeId> leaders, Map<CubeId, UUID> groupIds) {
    this.leaders = leaders;
    this.groupIds = groupIds;
  }

  public static RollupPlan bind(SortedMap<CubeId, CubeId> rollup) {
    return bind(rollup, UUID::randomUUID);
  }

  public static RollupPlan bind(SortedMap<CubeId, CubeId> rollup, Supplier<UUID> ids) {
    Map<CubeId, UUID> groupIds = new LinkedHashMap<>();
    for (CubeId leader : new TreeMap<>(invert(rollup)).keySet()) {
      groupIds.put(leader, ids.get());
    }
    return new RollupPlan(
        Collections.unmodifiableSortedMap(new TreeMap<>(rollup)),
        Collections.unmodifiableMap(groupIds));
  }

  /**
   * File id of the group holding {@code cube}.
   *
   * @throws IllegalStateException if the cube was not part of the rollup
   */
  public UUID groupFor(CubeId cube) {
    CubeId leader = leaders.get(cube);
    if (leader == null) {
      throw new IllegalStateException("cube " + cube.string() + " is not part of the rollup");
    }
    return groupIds.get(leader);
  }

  /** Cubes of each group, groups ordered by their first cube. */
  public Map<UUID, List<CubeId>> groups() {
    Map<UUID, List<CubeId>> out = new LinkedHashMap<>();
    for (Map.Entry<CubeId, List<CubeId>> e : new TreeMap<>(invert(leaders)).entrySet()) {
      out.put(groupIds.get(e.getKey()), Collections.unmodifiableList(e.getValue()));
    }
    return Collections.unmodifiableMap(out);
  }

  public int groupCount() {
    return groupIds.size();
  }

  private static Map<CubeId, List<CubeId>> invert(Map<CubeId, CubeId> rollup) {
    Map<CubeId, List<CubeId>> out = new LinkedHashMap<>();
    for (Map.Entry<CubeId, CubeId> e : rollup.entrySet()) {
      out.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
    }
    return out;
  }
}
