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

package ai.floedb.otree.keeper.memory;

import ai.floedb.otree.keeper.spi.Keeper;
import ai.floedb.otree.keeper.spi.KeeperSettings;
import ai.floedb.otree.keeper.spi.OptimizationSession;
import ai.floedb.otree.keeper.spi.WriteSession;
import ai.floedb.otree.model.CubeId;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/**
 * Keeper for a single process. State lives in memory and is lost on restart, after which cubes
 * are announced and replicated again.
 */
public class InMemoryKeeper implements Keeper {
  private static final Logger LOG = Logger.getLogger(InMemoryKeeper.class);

  private final KeeperSettings settings;
  private final Map<Key, RevisionState> revisions = new ConcurrentHashMap<>();
  private final AtomicBoolean stopped = new AtomicBoolean();

  public InMemoryKeeper(KeeperSettings settings) {
    this.settings = settings;
  }

  @Override
  public WriteSession beginWrite(String tableId, long revisionId) {
    RevisionState state = state(tableId, revisionId);
    String id = UUID.randomUUID().toString();
    Set<CubeId> announced;
    synchronized (state) {
      announced = Collections.unmodifiableSortedSet(new TreeSet<>(state.announced));
      state.writes.add(id);
    }
    LOG.debugf(
        "Write session %s on %s@%d sees %d announced cubes",
        id,
        tableId,
        revisionId,
        announced.size());
    return new MemoryWriteSession(id, tableId, revisionId, announced, state);
  }

  @Override
  public void announce(String tableId, long revisionId, Set<CubeId> cubes) {
    RevisionState state = state(tableId, revisionId);
    int added = 0;
    synchronized (state) {
      for (CubeId c : cubes) {
        if (state.announced.add(c)) {
          added++;
        }
      }
    }
    LOG.debugf("Announced %d new cubes on %s@%d", added, tableId, Long.valueOf(revisionId));
  }

  @Override
  public OptimizationSession beginOptimization(String tableId, long revisionId, int cubeLimit) {
    if (cubeLimit <= 0) {
      throw new IllegalArgumentException("cubeLimit must be > 0: " + cubeLimit);
    }
    RevisionState state = state(tableId, revisionId);
    String id = UUID.randomUUID().toString();
    Instant now = settings.clock().instant();
    Instant expiresAt = now.plus(settings.reservationTimeout());
    SortedSet<CubeId> reserved = new TreeSet<>();
    synchronized (state) {
      state.expireReservations(now);
      for (CubeId c : state.announced) {
        if (reserved.size() == cubeLimit) {
          break;
        }
        if (state.replicated.contains(c) || state.reservations.containsKey(c)) {
          continue;
        }
        state.reservations.put(c, new Reservation(id, expiresAt));
        reserved.add(c);
      }
    }
    LOG.infof(
        "Optimization session %s on %s@%d reserved %d cubes",
        id,
        tableId,
        revisionId,
        reserved.size());
    return new MemoryOptimizationSession(
        id, tableId, revisionId, Collections.unmodifiableSortedSet(reserved), state);
  }

  @Override
  public Set<CubeId> announcedCubes(String tableId, long revisionId) {
    RevisionState state = state(tableId, revisionId);
    synchronized (state) {
      return Collections.unmodifiableSortedSet(new TreeSet<>(state.announced));
    }
  }

  @Override
  public Set<CubeId> replicatedCubes(String tableId, long revisionId) {
    RevisionState state = state(tableId, revisionId);
    synchronized (state) {
      return Collections.unmodifiableSortedSet(new TreeSet<>(state.replicated));
    }
  }

  @Override
  public void close() {
    if (stopped.compareAndSet(false, true)) {
      int open = openWriteSessions();
      if (open > 0) {
        LOG.warnf("Stopping in-memory keeper with %d write sessions still open", open);
      }
      LOG.infof("Stopping in-memory keeper tracking %d revisions", revisions.size());
      revisions.clear();
    }
  }

  /** Write sessions begun and not yet ended, across all revisions. */
  int openWriteSessions() {
    int open = 0;
    for (RevisionState state : revisions.values()) {
      synchronized (state) {
        open += state.writes.size();
      }
    }
    return open;
  }

  private RevisionState state(String tableId, long revisionId) {
    if (stopped.get()) {
      throw new IllegalStateException("keeper is stopped");
    }
    return revisions.computeIfAbsent(new Key(tableId, revisionId), k -> new RevisionState());
  }

  private record Key(String tableId, long revisionId) {}

  private record Reservation(String sessionId, Instant expiresAt) {}

  private static final class RevisionState {
    final SortedSet<CubeId> announced = new TreeSet<>();
    final Set<CubeId> replicated = new HashSet<>();
    final Map<CubeId, Reservation> reservations = new HashMap<>();
    final Set<String> writes = new HashSet<>();

    void expireReservations(Instant now) {
      Iterator<Map.Entry<CubeId, Reservation>> it = reservations.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<CubeId, Reservation> e = it.next();
        if (!e.getValue().expiresAt().isAfter(now)) {
          LOG.warnf(
              "Reservation of cube %s by session %s expired",
              e.getKey().string(), e.getValue().sessionId());
          it.remove();
        }
      }
    }

    void release(String sessionId) {
      reservations.values().removeIf(r -> r.sessionId().equals(sessionId));
    }
  }

  private static final class MemoryWriteSession implements WriteSession {
    private final String id;
    private final String tableId;
    private final long revisionId;
    private final Set<CubeId> announced;
    private final RevisionState state;
    private final AtomicBoolean ended = new AtomicBoolean();

    MemoryWriteSession(
        String id, String tableId, long revisionId, Set<CubeId> announced, RevisionState state) {
      this.id = id;
      this.tableId = tableId;
      this.revisionId = revisionId;
      this.announced = announced;
      this.state = state;
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public String tableId() {
      return tableId;
    }

    @Override
    public long revisionId() {
      return revisionId;
    }

    @Override
    public Set<CubeId> announcedCubes() {
      return announced;
    }

    @Override
    public void end() {
      if (!ended.compareAndSet(false, true)) {
        throw new IllegalStateException("write session " + id + " already ended");
      }
      synchronized (state) {
        state.writes.remove(id);
      }
    }

    @Override
    public void close() {
      if (!ended.get()) {
        end();
      }
    }
  }

  private static final class MemoryOptimizationSession implements OptimizationSession {
    private final String id;
    private final String tableId;
    private final long revisionId;
    private final Set<CubeId> cubes;
    private final RevisionState state;
    private final AtomicBoolean ended = new AtomicBoolean();

    MemoryOptimizationSession(
        String id, String tableId, long revisionId, Set<CubeId> cubes, RevisionState state) {
      this.id = id;
      this.tableId = tableId;
      this.revisionId = revisionId;
      this.cubes = cubes;
      this.state = state;
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public String tableId() {
      return tableId;
    }

    @Override
    public long revisionId() {
      return revisionId;
    }

    @Override
    public Set<CubeId> cubesToOptimize() {
      return cubes;
    }

    @Override
    public void end(Set<CubeId> replicatedCubes) {
      if (!ended.compareAndSet(false, true)) {
        throw new IllegalStateException("optimization session " + id + " already ended");
      }
      Set<CubeId> accepted = new HashSet<>(replicatedCubes);
      accepted.retainAll(cubes);
      if (accepted.size() < replicatedCubes.size()) {
        LOG.warnf(
            "Optimization session %s ignored %d cubes it did not reserve",
            id,
            replicatedCubes.size() - accepted.size());
      }
      synchronized (state) {
        state.release(id);
        state.replicated.addAll(accepted);
      }
      LOG.infof(
          "Optimization session %s on %s@%d ended, %d cubes replicated",
          id,
          tableId,
          revisionId,
          accepted.size());
    }

    @Override
    public void close() {
      if (!ended.get()) {
        end(Set.of());
      }
    }
  }
}
