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
import ai.floedb.otree.model.Point;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.TableChanges;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.transform.IndexedColumn;
import ai.floedb.otree.transform.Transformation;
import ai.floedb.otree.transform.Transformer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Places batches of rows in the OTree of a table.
 *
 * <ul>
 *   <li>{@link #indexFirst} builds a new revision from the batch alone.
 *   <li>{@link #indexNext} extends the committed state of the latest revision, falling back to a
 *       new revision when the batch leaves its bounds.
 *   <li>{@link #replicate} copies the rows of announced cubes one level down.
 * </ul>
 *
 * <p>All three are pure: they read their inputs and return the rows and {@link TableChanges} to
 * write and commit. The only owned resource is the executor row preparation runs on.
 */
public final class OTreeIndexer implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(OTreeIndexer.class);

  private static final AtomicInteger COUNTER = new AtomicInteger(1);

  private final IndexerOptions options;
  private final Clock clock;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final ThresholdEstimator estimator;
  private final Counter rowsIndexed;
  private final Counter cubesReplicated;

  public OTreeIndexer(IndexerOptions options, Clock clock, MeterRegistry registry) {
    this(options, clock, registry, newExecutor(options.parallelism()), true);
  }

  public OTreeIndexer(
      IndexerOptions options, Clock clock, MeterRegistry registry, ExecutorService executor) {
    this(options, clock, registry, executor, false);
  }

  private OTreeIndexer(
      IndexerOptions options,
      Clock clock,
      MeterRegistry registry,
      ExecutorService executor,
      boolean ownsExecutor) {
    this.options = options;
    this.clock = clock;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
    this.rowsIndexed =
        Counter.builder("otree_rows_indexed")
            .description("Rows placed in a cube by a write")
            .register(registry);
    this.cubesReplicated =
        Counter.builder("otree_cubes_replicated")
            .description("Cubes whose rows were copied to their children")
            .register(registry);
    Counter overflowed =
        Counter.builder("otree_cubes_overflowed")
            .description("Cubes at max depth holding more rows than the desired cube size")
            .register(registry);
    this.estimator = new ThresholdEstimator(options.maxDepth(), overflowed);
  }

  public IndexerOptions options() {
    return options;
  }

  /**
   * Indexes {@code rows} into a fresh revision following {@code previous}, with bounds taken from
   * the batch.
   *
   * @throws IllegalArgumentException if a row misses one of {@code columns}
   */
  public IndexResult indexFirst(List<Row> rows, List<IndexedColumn> columns, Revision previous) {
    List<Transformer> transformers = new ArrayList<>(columns.size());
    for (IndexedColumn c : columns) {
      transformers.add(c.toTransformer());
    }
    PreparedBatch batch =
        new RowPreparer(transformers).prepare(rows, executor, options.parallelism());
    List<Transformation> transformations = new ArrayList<>(transformers.size());
    for (int i = 0; i < transformers.size(); i++) {
      transformations.add(transformers.get(i).makeTransformation(batch.stats().get(i)));
    }
    Revision revision = previous.nextRevision(transformers, transformations, clock.instant());
    LOG.infof(
        "Indexing %d rows of table %s into new revision %d",
        rows.size(),
        revision.tableId(),
        revision.revisionId());
    return estimate(revision, batch, IndexStatus.empty(revision), Set.of(), true);
  }

  /**
   * Indexes {@code rows} on top of the committed {@code status}. Cubes in {@code announced} and in
   * the status' announced set receive copies of the rows cascading through them.
   */
  public IndexResult indexNext(List<Row> rows, IndexStatus status, Set<CubeId> announced) {
    Revision current = status.revision();
    if (current.isBootstrap()) {
      throw new IllegalArgumentException(
          "table " + current.tableId() + " has no indexed revision yet");
    }
    PreparedBatch batch =
        new RowPreparer(current.transformers()).prepare(rows, executor, options.parallelism());

    if (!options.clampOutOfBounds()) {
      List<Transformation> merged = new ArrayList<>(current.transformations());
      boolean outOfBounds = false;
      for (int i = 0; i < merged.size(); i++) {
        Optional<Transformation> update =
            current
                .transformers()
                .get(i)
                .maybeUpdateTransformation(merged.get(i), batch.stats().get(i));
        if (update.isPresent()) {
          merged.set(i, update.get());
          outOfBounds = true;
        }
      }
      if (outOfBounds) {
        Revision next = current.nextRevision(current.transformers(), merged, clock.instant());
        LOG.infof(
            "Batch of %d rows leaves the space of revision %d of table %s, indexing into %d",
            rows.size(),
            current.revisionId(),
            current.tableId(),
            next.revisionId());
        return estimate(next, batch, IndexStatus.empty(next), Set.of(), true);
      }
    }

    TreeSet<CubeId> allAnnounced = new TreeSet<>(status.announcedSet());
    allAnnounced.addAll(announced);
    LOG.debugf(
        "Indexing %d rows of table %s into revision %d with %d announced cubes",
        rows.size(),
        current.tableId(),
        current.revisionId(),
        allAnnounced.size());
    IndexStatus withAnnounced =
        new IndexStatus(current, status.cubes(), allAnnounced, status.replicatedSet());
    return estimate(current, batch, withAnnounced, allAnnounced, false);
  }

  /**
   * Copies the {@link CubeState#FLOODED} rows of {@code cubes} into the child containing each of
   * them, as {@link CubeState#REPLICATED} rows. Rows of other cubes are ignored. Cubes at max depth
   * have no children and are reported replicated without copies.
   */
  public IndexResult replicate(IndexStatus status, Set<CubeId> cubes, List<IndexedRow> rows) {
    Revision revision = status.revision();
    List<Transformer> transformers = revision.transformers();
    List<IndexedRow> out = new ArrayList<>();
    TreeMap<CubeId, Weight> weights = new TreeMap<>();
    TreeMap<CubeId, Long> counts = new TreeMap<>();
    for (IndexedRow r : rows) {
      if (r.state() != CubeState.FLOODED
          || !cubes.contains(r.cubeId())
          || r.cubeId().depth() >= options.maxDepth()) {
        continue;
      }
      List<Object> values = new ArrayList<>(transformers.size());
      for (Transformer tr : transformers) {
        values.add(tr.resolve(r.row().get(tr.columnName())));
      }
      Point point = revision.transform(values);
      CubeId child = r.cubeId().childContaining(point);
      out.add(new IndexedRow(r.row(), child, r.weight(), CubeState.REPLICATED));
      counts.merge(child, 1L, Long::sum);
      weights.computeIfAbsent(
          child,
          c -> status.cubeStatus(c).map(CubeStatus::maxWeight).orElse(Weight.MAX_VALUE));
    }
    out.sort(IndexedRow.STORAGE_ORDER);
    cubesReplicated.increment(cubes.size());
    LOG.infof(
        "Replicated %d cubes of table %s revision %d: %d rows copied",
        cubes.size(),
        revision.tableId(),
        revision.revisionId(),
        out.size());
    TableChanges changes =
        new TableChanges(
            false,
            revision,
            weights,
            counts,
            status.announcedSet(),
            new TreeSet<>(cubes),
            new TreeSet<>());
    return new IndexResult(out, changes);
  }

  private IndexResult estimate(
      Revision revision,
      PreparedBatch batch,
      IndexStatus prior,
      Set<CubeId> announced,
      boolean isNewRevision) {
    ThresholdEstimator.Outcome outcome =
        estimator.estimate(revision, batch.rows(), prior, announced, prior.replicatedSet());
    rowsIndexed.increment(batch.rows().size());
    TableChanges changes =
        new TableChanges(
            isNewRevision,
            revision,
            outcome.cubeWeights(),
            outcome.elementCounts(),
            new TreeSet<>(announced),
            new TreeSet<>(),
            outcome.overflowed());
    return new IndexResult(outcome.rows(), changes);
  }

  @Override
  public void close() {
    if (!ownsExecutor) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ExecutorService newExecutor(int parallelism) {
    return Executors.newFixedThreadPool(
        parallelism,
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "otree-index-" + COUNTER.getAndIncrement());
            thread.setDaemon(true);
            return thread;
          }
        });
  }
}
