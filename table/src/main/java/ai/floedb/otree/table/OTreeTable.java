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

package ai.floedb.otree.table;

import ai.floedb.otree.index.IndexResult;
import ai.floedb.otree.index.IndexedRow;
import ai.floedb.otree.index.IndexerOptions;
import ai.floedb.otree.index.OTreeIndexer;
import ai.floedb.otree.keeper.spi.Keeper;
import ai.floedb.otree.keeper.spi.KeeperSettings;
import ai.floedb.otree.keeper.spi.Keepers;
import ai.floedb.otree.keeper.spi.OptimizationSession;
import ai.floedb.otree.keeper.spi.WriteSession;
import ai.floedb.otree.model.Block;
import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.CubeState;
import ai.floedb.otree.model.DeleteFile;
import ai.floedb.otree.model.IndexFile;
import ai.floedb.otree.model.IndexStatus;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.TableChanges;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.rollup.Rollup;
import ai.floedb.otree.rollup.RollupPlan;
import ai.floedb.otree.table.config.OTreeConfig;
import ai.floedb.otree.table.spi.Commit;
import ai.floedb.otree.table.spi.CommitLog;
import ai.floedb.otree.table.spi.CommitResult;
import ai.floedb.otree.table.spi.FileWriteResult;
import ai.floedb.otree.table.spi.IndexFileReader;
import ai.floedb.otree.table.spi.IndexFileWriter;
import ai.floedb.otree.table.spi.IndexFileWriterFactory;
import ai.floedb.otree.table.spi.StoredRow;
import ai.floedb.otree.table.spi.TableSnapshot;
import ai.floedb.otree.transform.IndexedColumn;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Drives index maintenance of one table: writes, analysis and optimization against a commit log,
 * a file store and a {@link Keeper}.
 *
 * <p>Every pass reads the latest snapshot, computes its changes and commits them conditionally on
 * the version it read. A lost race discards the written files and the whole {@link TableChanges}
 * and re-runs the pass against the refreshed snapshot, at most {@code otree.commit.max-retries}
 * more times.
 */
public final class OTreeTable implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(OTreeTable.class);

  private final String tableId;
  private final OTreeConfig config;
  private final Keeper keeper;
  private final CommitLog commitLog;
  private final IndexFileWriterFactory writers;
  private final IndexFileReader reader;
  private final Clock clock;
  private final OTreeIndexer indexer;
  private final Counter filesWritten;
  private final Counter commitConflicts;

  public OTreeTable(
      String tableId,
      OTreeConfig config,
      Keeper keeper,
      CommitLog commitLog,
      IndexFileWriterFactory writers,
      IndexFileReader reader,
      Clock clock,
      MeterRegistry registry) {
    this.tableId = tableId;
    this.config = config;
    this.keeper = keeper;
    this.commitLog = commitLog;
    this.writers = writers;
    this.reader = reader;
    this.clock = clock;
    OTreeConfig.Index index = config.index();
    this.indexer =
        new OTreeIndexer(
            new IndexerOptions(index.maxDepth(), index.clampOutOfBounds(), index.parallelism()),
            clock,
            registry);
    this.filesWritten =
        Counter.builder("otree_files_written")
            .description("Index files committed by writes and optimizations")
            .register(registry);
    this.commitConflicts =
        Counter.builder("otree_commit_conflicts")
            .description("Commits rejected because the log moved on")
            .register(registry);
  }

  /** Creates the keeper named by {@code otree.keeper.provider}. */
  public static Keeper openKeeper(OTreeConfig config, Clock clock) {
    return Keepers.create(
        config.keeper().provider(),
        new KeeperSettings(config.keeper().reservationTimeout(), clock));
  }

  public String tableId() {
    return tableId;
  }

  public Optional<Revision> latestRevision() {
    return snapshot().latestRevision();
  }

  /**
   * Committed state of {@code revisionId} with the cubes the keeper has announced.
   *
   * @throws IllegalArgumentException if the table has no such revision
   */
  public IndexStatus indexStatus(long revisionId) {
    return snapshot().indexStatus(revisionId, keeper.announcedCubes(tableId, revisionId));
  }

  /**
   * Indexes and commits {@code rows}. A new revision is created for a new table, an overwrite, a
   * change of indexed columns, or a batch leaving the space of the latest revision.
   *
   * @throws CommitConflictException if every attempt lost the commit race
   * @throws IllegalArgumentException if a row misses an indexed column
   */
  public WriteSummary write(List<Row> rows, List<IndexedColumn> columns, WriteMode mode) {
    int maxRetries = config.commit().maxRetries();
    for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
      TableSnapshot snap = snapshot();
      Optional<WriteSummary> summary = tryWrite(snap, rows, columns, mode, attempt);
      if (summary.isPresent()) {
        return summary.get();
      }
      commitConflicts.increment();
      LOG.infof(
          "Write to table %s lost the commit race at version %d (attempt %d of %d)",
          tableId,
          snap.version(),
          attempt,
          maxRetries + 1);
    }
    throw new CommitConflictException(tableId, maxRetries + 1);
  }

  /**
   * Announces every closed cube of {@code revisionId} not yet announced or replicated.
   *
   * @return the cubes announced by this call
   */
  public SortedSet<CubeId> analyze(long revisionId) {
    Set<CubeId> announced = keeper.announcedCubes(tableId, revisionId);
    IndexStatus status = snapshot().indexStatus(revisionId, announced);
    SortedSet<CubeId> fresh = new TreeSet<>();
    for (CubeId cube : status.closedCubes()) {
      if (!announced.contains(cube) && !status.isReplicated(cube)) {
        fresh.add(cube);
      }
    }
    if (!fresh.isEmpty()) {
      keeper.announce(tableId, revisionId, fresh);
    }
    LOG.infof(
        "Analyzed table %s revision %d: %d cubes announced", tableId, revisionId, fresh.size());
    return fresh;
  }

  /**
   * Replicates the cubes an optimization session reserves for {@code revisionId}. The session ends
   * with the replicated cubes once they are committed, or with none if the pass fails.
   *
   * @throws CommitConflictException if every attempt lost the commit race
   */
  public OptimizeSummary optimize(long revisionId) {
    int limit = config.keeper().optimizationCubeLimit();
    try (OptimizationSession session = keeper.beginOptimization(tableId, revisionId, limit)) {
      Set<CubeId> reserved = session.cubesToOptimize();
      if (reserved.isEmpty()) {
        LOG.debugf("Nothing to optimize in table %s revision %d", tableId, revisionId);
        return OptimizeSummary.nothing(revisionId);
      }
      int maxRetries = config.commit().maxRetries();
      for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
        TableSnapshot snap = snapshot();
        Optional<OptimizeSummary> summary = tryOptimize(snap, revisionId, reserved);
        if (summary.isPresent()) {
          session.end(summary.get().replicatedCubes());
          return summary.get();
        }
        commitConflicts.increment();
        LOG.infof(
            "Optimization of table %s lost the commit race at version %d (attempt %d of %d)",
            tableId,
            snap.version(),
            attempt,
            maxRetries + 1);
      }
      throw new CommitConflictException(tableId, maxRetries + 1);
    }
  }

  @Override
  public void close() {
    indexer.close();
  }

  private Optional<WriteSummary> tryWrite(
      TableSnapshot snap,
      List<Row> rows,
      List<IndexedColumn> columns,
      WriteMode mode,
      int attempt) {
    Revision current =
        snap.latestRevision()
            .orElseGet(
                () ->
                    Revision.bootstrap(
                        tableId, config.index().desiredCubeSize(), clock.instant()));
    boolean first =
        mode == WriteMode.OVERWRITE || current.isBootstrap() || !current.matchesColumns(columns);
    try (WriteSession session = keeper.beginWrite(tableId, current.revisionId())) {
      IndexResult result =
          first
              ? indexer.indexFirst(rows, columns, current)
              : indexer.indexNext(
                  rows,
                  snap.indexStatus(current.revisionId(), session.announcedCubes()),
                  session.announcedCubes());
      TableChanges changes = result.changes();
      Revision revision = changes.updatedRevision();

      List<IndexFile> files = writeFiles(revision, result.rows(), changes, true);
      List<DeleteFile> removed = new ArrayList<>();
      if (mode == WriteMode.OVERWRITE) {
        Instant now = clock.instant();
        for (IndexFile f : snap.files()) {
          removed.add(DeleteFile.of(f, now));
        }
      }
      Commit commit =
          new Commit(
              clock.instant(),
              changes.isNewRevision() ? Optional.of(revision) : Optional.empty(),
              files,
              removed,
              Optional.empty(),
              Commit.Thresholds.closed(revision.revisionId(), changes.cubeWeights()));
      CommitResult committed = commit(snap.version(), commit);
      if (!committed.committed()) {
        discard(files);
        return Optional.empty();
      }
      session.end();
      filesWritten.increment(files.size());
      LOG.infof(
          "Committed %d rows to table %s revision %d in %d files at version %d",
          result.rows().size(),
          tableId,
          revision.revisionId(),
          files.size(),
          committed.version());
      return Optional.of(
          new WriteSummary(
              committed.version(),
              revision,
              changes.isNewRevision(),
              files,
              result.rows().size(),
              changes.overflowedCubes(),
              attempt));
    }
  }

  private Optional<OptimizeSummary> tryOptimize(
      TableSnapshot snap, long revisionId, Set<CubeId> reserved) {
    IndexStatus status =
        snap.indexStatus(revisionId, keeper.announcedCubes(tableId, revisionId));
    Set<CubeId> cubes = new TreeSet<>();
    for (CubeId cube : reserved) {
      if (!status.isReplicated(cube)) {
        cubes.add(cube);
      }
    }
    Revision revision = status.revision();
    List<IndexedRow> rows = new ArrayList<>();
    for (IndexFile f : snap.filesOf(revisionId)) {
      if (cubes.stream().noneMatch(f::hasCubeData)) {
        continue;
      }
      for (StoredRow r : read(f.path(), revision)) {
        if (r.state() == CubeState.FLOODED && cubes.contains(r.cubeId())) {
          rows.add(new IndexedRow(r.row(), r.cubeId(), r.weight(), r.state()));
        }
      }
    }
    IndexResult result = indexer.replicate(status, cubes, rows);
    List<IndexFile> files = writeFiles(revision, result.rows(), result.changes(), false);
    Commit commit =
        new Commit(
            clock.instant(),
            Optional.empty(),
            files,
            List.of(),
            Optional.of(new Commit.Replication(revisionId, cubes)),
            Commit.Thresholds.closed(revisionId, result.changes().cubeWeights()));
    CommitResult committed = commit(snap.version(), commit);
    if (!committed.committed()) {
      discard(files);
      return Optional.empty();
    }
    filesWritten.increment(files.size());
    return Optional.of(new OptimizeSummary(revisionId, cubes, files, result.rows().size()));
  }

  /** Writes one file per rollup group. Rows must be in storage order. */
  private List<IndexFile> writeFiles(
      Revision revision, List<IndexedRow> rows, TableChanges changes, boolean dataChange) {
    if (rows.isEmpty()) {
      return List.of();
    }
    long target = config.rollup().desiredFileSize().orElse((long) revision.desiredCubeSize());
    SortedMap<CubeId, CubeId> rollup = Rollup.computeRollup(changes, target);
    RollupPlan plan = RollupPlan.bind(rollup);
    Map<UUID, List<IndexedRow>> byGroup = new LinkedHashMap<>();
    for (IndexedRow r : rows) {
      byGroup.computeIfAbsent(plan.groupFor(r.cubeId()), g -> new ArrayList<>()).add(r);
    }
    List<IndexFile> files = new ArrayList<>(byGroup.size());
    try {
      for (Map.Entry<UUID, List<IndexedRow>> e : byGroup.entrySet()) {
        files.add(writeGroup(revision, e.getKey(), e.getValue(), changes, dataChange));
      }
    } catch (IOException e) {
      discard(files);
      throw new UncheckedIOException("writing index files of table " + tableId, e);
    } catch (RuntimeException e) {
      discard(files);
      throw e;
    }
    return files;
  }

  private IndexFile writeGroup(
      Revision revision,
      UUID groupId,
      List<IndexedRow> rows,
      TableChanges changes,
      boolean dataChange)
      throws IOException {
    IndexFileWriter writer = writers.open(tableId, revision, groupId);
    FileWriteResult written;
    try {
      for (IndexedRow r : rows) {
        writer.writeRow(
            new StoredRow(r.row(), r.cubeId(), r.weight(), r.state(), groupId.toString()));
      }
      written = writer.close();
    } catch (IOException | RuntimeException e) {
      try {
        writer.abort();
      } catch (IOException abortFailure) {
        e.addSuppressed(abortFailure);
      }
      throw e;
    }
    return new IndexFile(
        written.path(),
        written.bytesWritten(),
        dataChange,
        clock.instant(),
        revision.revisionId(),
        blocks(rows, changes),
        written.stats());
  }

  /** One block per contiguous run of rows sharing cube and state. */
  private static List<Block> blocks(List<IndexedRow> rows, TableChanges changes) {
    List<Block> out = new ArrayList<>();
    int start = 0;
    for (int i = 1; i <= rows.size(); i++) {
      if (i < rows.size()
          && rows.get(i).cubeId().equals(rows.get(start).cubeId())
          && rows.get(i).state() == rows.get(start).state()) {
        continue;
      }
      IndexedRow head = rows.get(start);
      Weight min = head.weight();
      Weight max = head.weight();
      for (int j = start + 1; j < i; j++) {
        min = min.min(rows.get(j).weight());
        if (rows.get(j).weight().compareTo(max) > 0) {
          max = rows.get(j).weight();
        }
      }
      out.add(
          new Block(
              head.cubeId(),
              head.state(),
              i - start,
              min,
              max,
              changes.cubeWeight(head.cubeId()).orElse(Weight.MAX_VALUE)));
      start = i;
    }
    return out;
  }

  private TableSnapshot snapshot() {
    try {
      return commitLog.snapshot(tableId);
    } catch (IOException e) {
      throw new UncheckedIOException("reading the commit log of table " + tableId, e);
    }
  }

  /** Commits, discarding the commit's files if the log fails. */
  private CommitResult commit(long expectedVersion, Commit commit) {
    try {
      return commitLog.commit(tableId, expectedVersion, commit);
    } catch (IOException e) {
      discard(commit.addFiles());
      throw new UncheckedIOException("committing to table " + tableId, e);
    } catch (RuntimeException e) {
      discard(commit.addFiles());
      throw e;
    }
  }

  private List<StoredRow> read(String path, Revision revision) {
    try {
      return reader.read(path, revision);
    } catch (IOException e) {
      throw new UncheckedIOException("reading " + path + " of table " + tableId, e);
    }
  }

  private void discard(List<IndexFile> files) {
    for (IndexFile f : files) {
      try {
        writers.discard(f.path());
      } catch (IOException e) {
        LOG.warnf(e, "Could not discard uncommitted file %s of table %s", f.path(), tableId);
      }
    }
  }
}
