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

package ai.floedb.otree.model;

import ai.floedb.otree.transform.IndexedColumn;
import ai.floedb.otree.transform.Transformation;
import ai.floedb.otree.transform.Transformer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a table's cube space: which columns are indexed, how they map onto the
 * unit hyper-cube, and the desired cube size.
 *
 * <p>Revision 0 is the empty bootstrap revision every table starts with. Files always belong to
 * the revision they were written with; a later revision never invalidates them.
 */
public record Revision(
    String tableId,
    long revisionId,
    Instant timestamp,
    int desiredCubeSize,
    List<Transformer> transformers,
    List<Transformation> transformations) {

  public static final long BOOTSTRAP_ID = 0L;

  public Revision {
    Objects.requireNonNull(tableId, "tableId");
    Objects.requireNonNull(timestamp, "timestamp");
    transformers = List.copyOf(transformers);
    transformations = List.copyOf(transformations);
    if (revisionId < 0) {
      throw new IllegalArgumentException("revisionId must be >= 0: " + revisionId);
    }
    if (desiredCubeSize <= 0) {
      throw new IllegalArgumentException("desiredCubeSize must be > 0: " + desiredCubeSize);
    }
    if (transformers.size() != transformations.size()) {
      throw new IllegalArgumentException(
          "revision "
              + revisionId
              + " has "
              + transformers.size()
              + " transformers but "
              + transformations.size()
              + " transformations");
    }
    if (revisionId == BOOTSTRAP_ID && !transformers.isEmpty()) {
      throw new IllegalArgumentException("the bootstrap revision indexes no columns");
    }
    if (revisionId != BOOTSTRAP_ID && transformers.isEmpty()) {
      throw new IllegalArgumentException("revision " + revisionId + " indexes no columns");
    }
  }

  public static Revision bootstrap(String tableId, int desiredCubeSize, Instant timestamp) {
    return new Revision(tableId, BOOTSTRAP_ID, timestamp, desiredCubeSize, List.of(), List.of());
  }

  public boolean isBootstrap() {
    return revisionId == BOOTSTRAP_ID;
  }

  /** The revision that follows this one with the given space. */
  public Revision nextRevision(
      List<Transformer> nextTransformers,
      List<Transformation> nextTransformations,
      Instant at) {
    return new Revision(
        tableId, revisionId + 1, at, desiredCubeSize, nextTransformers, nextTransformations);
  }

  /** Same revision id and columns, new bounds. Used only while a revision is being built. */
  public Revision withTransformations(List<Transformation> next) {
    return new Revision(tableId, revisionId, timestamp, desiredCubeSize, transformers, next);
  }

  public int dimensionCount() {
    return transformers.size();
  }

  public List<String> columnNames() {
    List<String> out = new ArrayList<>(transformers.size());
    for (Transformer t : transformers) {
      out.add(t.columnName());
    }
    return out;
  }

  /** True if this revision indexes exactly {@code columns}, in order and configured the same. */
  public boolean matchesColumns(List<IndexedColumn> columns) {
    if (columns.size() != transformers.size()) {
      return false;
    }
    for (int i = 0; i < columns.size(); i++) {
      if (!columns.get(i).toTransformer().equals(transformers.get(i))) {
        return false;
      }
    }
    return true;
  }

  public CubeId root() {
    return CubeId.root(dimensionCount());
  }

  /**
   * Maps the resolved indexed values of a row (nulls already substituted) to its point.
   *
   * @throws IllegalArgumentException if the number of values does not match the dimensions
   */
  public Point transform(List<?> resolvedValues) {
    if (resolvedValues.size() != transformations.size()) {
      throw new IllegalArgumentException(
          "expected " + transformations.size() + " values, got " + resolvedValues.size());
    }
    double[] coords = new double[transformations.size()];
    for (int i = 0; i < coords.length; i++) {
      coords[i] = transformations.get(i).transform(resolvedValues.get(i));
    }
    return new Point(coords);
  }

  public CubeId createCubeId(byte[] bytes) {
    return CubeId.fromBytes(dimensionCount(), bytes);
  }
}
