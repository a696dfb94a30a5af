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

import ai.floedb.otree.hash.ValueHashing;
import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.transform.ColumnStats;
import ai.floedb.otree.transform.TransformerType;
import ai.floedb.otree.transform.Transformer;
import ai.floedb.otree.types.LogicalType;
import ai.floedb.otree.types.LogicalValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/**
 * Computes weights, identity keys and column statistics of a batch. Rows are split into
 * contiguous shards that are prepared on an executor and concatenated back in input order.
 */
public final class RowPreparer {
  private static final Logger LOG = Logger.getLogger(RowPreparer.class);

  private static final int MIN_SHARD_SIZE = 1024;

  private final List<Transformer> transformers;
  private final List<LogicalType> types;

  public RowPreparer(List<Transformer> transformers) {
    if (transformers.isEmpty()) {
      throw new IllegalArgumentException("at least one indexed column is required");
    }
    this.transformers = List.copyOf(transformers);
    List<LogicalType> t = new ArrayList<>(transformers.size());
    for (Transformer tr : transformers) {
      t.add(tr.type());
    }
    this.types = List.copyOf(t);
  }

  /**
   * Prepares {@code rows} using up to {@code parallelism} shards on {@code executor}.
   *
   * @throws IllegalArgumentException if a row misses an indexed column or holds a value of the
   *     wrong type
   */
  public PreparedBatch prepare(List<Row> rows, Executor executor, int parallelism) {
    int shards = Math.max(1, Math.min(parallelism, rows.size() / MIN_SHARD_SIZE));
    if (shards == 1) {
      return prepareShard(rows).build();
    }
    LOG.debugf("Preparing %d rows in %d shards", rows.size(), shards);
    int shardSize = (rows.size() + shards - 1) / shards;
    List<CompletableFuture<Shard>> futures = new ArrayList<>(shards);
    for (int from = 0; from < rows.size(); from += shardSize) {
      List<Row> slice = rows.subList(from, Math.min(rows.size(), from + shardSize));
      futures.add(CompletableFuture.supplyAsync(() -> prepareShard(slice), executor));
    }
    Shard all = new Shard();
    try {
      for (CompletableFuture<Shard> f : futures) {
        all.combine(f.join());
      }
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw e;
    }
    return all.build();
  }

  private Shard prepareShard(List<Row> rows) {
    Shard shard = new Shard();
    for (Row row : rows) {
      List<Object> raw = new ArrayList<>(transformers.size());
      List<Object> resolved = new ArrayList<>(transformers.size());
      for (int i = 0; i < transformers.size(); i++) {
        Transformer tr = transformers.get(i);
        if (!row.has(tr.columnName())) {
          throw new IllegalArgumentException("row has no indexed column " + tr.columnName());
        }
        Object value = row.get(tr.columnName());
        Object r = tr.resolve(value);
        raw.add(value);
        resolved.add(r);
        ColumnStats.Accumulator acc = shard.stats.get(i);
        if (r == null) {
          acc.addNull();
        } else if (tr.transformerType() == TransformerType.LINEAR) {
          acc.add(LogicalValues.toDouble(tr.type(), r));
        } else {
          acc.addUnordered();
        }
      }
      Weight weight = Weight.of(ValueHashing.weightHash(types, raw));
      long key = ValueHashing.identityKey(row.values());
      shard.rows.add(new PreparedRow(row, Collections.unmodifiableList(resolved), weight, key));
    }
    return shard;
  }

  private final class Shard {
    final List<PreparedRow> rows = new ArrayList<>();
    final List<ColumnStats.Accumulator> stats = new ArrayList<>();

    Shard() {
      for (Transformer tr : transformers) {
        stats.add(ColumnStats.accumulator(tr.columnName()));
      }
    }

    void combine(Shard other) {
      rows.addAll(other.rows);
      for (int i = 0; i < stats.size(); i++) {
        stats.get(i).combine(other.stats.get(i));
      }
    }

    PreparedBatch build() {
      List<ColumnStats> out = new ArrayList<>(stats.size());
      for (ColumnStats.Accumulator acc : stats) {
        out.add(acc.build());
      }
      return new PreparedBatch(rows, out);
    }
  }
}
