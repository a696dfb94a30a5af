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
import ai.floedb.otree.model.CorruptIndexDataException;
import ai.floedb.otree.model.CubeId;
import ai.floedb.otree.model.CubeState;
import ai.floedb.otree.model.DeleteFile;
import ai.floedb.otree.model.IndexFile;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.table.spi.Commit;
import ai.floedb.otree.transform.HashTransformation;
import ai.floedb.otree.transform.IdentityTransformation;
import ai.floedb.otree.transform.LinearTransformation;
import ai.floedb.otree.transform.Transformation;
import ai.floedb.otree.transform.Transformer;
import ai.floedb.otree.transform.TransformerType;
import ai.floedb.otree.types.LogicalType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * JSON form of the index metadata: revisions, committed files with their blocks, tombstones and
 * whole commits. Cube ids are written in their string form, weights as ints.
 *
 * <p>Decoding never guesses: a missing field or an undecodable cube id or weight is reported as
 * {@link CorruptIndexDataException}.
 */
public final class IndexMetadataCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private IndexMetadataCodec() {}

  public static String encodeCommit(Commit commit) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("timestamp", commit.timestamp().toString());
    commit.revision().ifPresent(r -> root.set("revision", revisionNode(r)));
    ArrayNode add = root.putArray("add");
    for (IndexFile f : commit.addFiles()) {
      add.add(indexFileNode(f));
    }
    ArrayNode remove = root.putArray("remove");
    for (DeleteFile d : commit.removeFiles()) {
      ObjectNode n = remove.addObject();
      n.put("path", d.path());
      n.put("size", d.size());
      n.put("dataChange", d.dataChange());
      n.put("deletionTimestamp", d.deletionTimestamp().toString());
    }
    commit
        .replicated()
        .ifPresent(
            rep -> {
              ObjectNode n = root.putObject("replicated");
              n.put("revisionId", rep.revisionId());
              ArrayNode cubes = n.putArray("cubes");
              for (CubeId c : new TreeSet<>(rep.cubes())) {
                cubes.add(c.string());
              }
            });
    commit
        .thresholds()
        .ifPresent(
            t -> {
              ObjectNode n = root.putObject("thresholds");
              n.put("revisionId", t.revisionId());
              ArrayNode cubes = n.putArray("cubes");
              t.weights()
                  .forEach(
                      (cube, w) -> {
                        ObjectNode c = cubes.addObject();
                        c.put("cube", cube.string());
                        c.put("weight", w.value());
                      });
            });
    return write(root);
  }

  /**
   * Decodes a commit. Cube ids of added files are resolved against the revision the commit
   * introduces or one of {@code knownRevisions}.
   */
  public static Commit decodeCommit(String json, Map<Long, Revision> knownRevisions) {
    JsonNode root = read(json);
    Optional<Revision> revision =
        root.hasNonNull("revision")
            ? Optional.of(decodeRevision(root.get("revision")))
            : Optional.empty();
    Map<Long, Revision> revisions = new HashMap<>(knownRevisions);
    revision.ifPresent(r -> revisions.put(r.revisionId(), r));

    List<IndexFile> add = new ArrayList<>();
    for (JsonNode n : required(root, "add")) {
      add.add(decodeIndexFile(n, revisions));
    }
    List<DeleteFile> remove = new ArrayList<>();
    for (JsonNode n : required(root, "remove")) {
      remove.add(
          new DeleteFile(
              text(n, "path"),
              required(n, "size").asLong(),
              required(n, "dataChange").asBoolean(),
              instant(n, "deletionTimestamp")));
    }
    Optional<Commit.Replication> replicated = Optional.empty();
    if (root.hasNonNull("replicated")) {
      JsonNode n = root.get("replicated");
      long revisionId = required(n, "revisionId").asLong();
      int dims = revisionFor(revisions, revisionId).dimensionCount();
      Set<CubeId> cubes = new TreeSet<>();
      for (JsonNode c : required(n, "cubes")) {
        cubes.add(CubeId.fromString(dims, c.asText()));
      }
      replicated = Optional.of(new Commit.Replication(revisionId, cubes));
    }
    Optional<Commit.Thresholds> thresholds = Optional.empty();
    if (root.hasNonNull("thresholds")) {
      JsonNode n = root.get("thresholds");
      long revisionId = required(n, "revisionId").asLong();
      int dims = revisionFor(revisions, revisionId).dimensionCount();
      TreeMap<CubeId, Weight> weights = new TreeMap<>();
      try {
        for (JsonNode c : required(n, "cubes")) {
          weights.put(CubeId.fromString(dims, text(c, "cube")), weight(c, "weight"));
        }
      } catch (IllegalArgumentException e) {
        throw new CorruptIndexDataException("invalid commit thresholds: " + e.getMessage(), e);
      }
      thresholds = Optional.of(new Commit.Thresholds(revisionId, weights));
    }
    return new Commit(instant(root, "timestamp"), revision, add, remove, replicated, thresholds);
  }

  public static String encodeRevision(Revision revision) {
    return write(revisionNode(revision));
  }

  public static Revision decodeRevision(String json) {
    return decodeRevision(read(json));
  }

  public static String encodeIndexFile(IndexFile file) {
    return write(indexFileNode(file));
  }

  public static IndexFile decodeIndexFile(String json, Revision revision) {
    return decodeIndexFile(read(json), Map.of(revision.revisionId(), revision));
  }

  static ObjectNode revisionNode(Revision r) {
    ObjectNode n = MAPPER.createObjectNode();
    n.put("tableId", r.tableId());
    n.put("revisionId", r.revisionId());
    n.put("timestamp", r.timestamp().toString());
    n.put("desiredCubeSize", r.desiredCubeSize());
    ArrayNode columns = n.putArray("columns");
    for (int i = 0; i < r.transformers().size(); i++) {
      Transformer t = r.transformers().get(i);
      ObjectNode c = columns.addObject();
      c.put("name", t.columnName());
      c.put("type", t.type().toString());
      c.put("transformer", t.transformerType().id());
      t.nullValue().ifPresent(v -> c.put("nullValue", v));
      c.set("transformation", transformationNode(r.transformations().get(i)));
    }
    return n;
  }

  static Revision decodeRevision(JsonNode n) {
    List<Transformer> transformers = new ArrayList<>();
    List<Transformation> transformations = new ArrayList<>();
    try {
      for (JsonNode c : required(n, "columns")) {
        LogicalType type = LogicalType.parse(text(c, "type"));
        String nullValue = c.hasNonNull("nullValue") ? c.get("nullValue").asText() : null;
        transformers.add(
            TransformerType.fromId(text(c, "transformer"))
                .create(text(c, "name"), type, nullValue));
        transformations.add(decodeTransformation(required(c, "transformation"), type));
      }
      return new Revision(
          text(n, "tableId"),
          required(n, "revisionId").asLong(),
          instant(n, "timestamp"),
          required(n, "desiredCubeSize").asInt(),
          transformers,
          transformations);
    } catch (IllegalArgumentException e) {
      throw new CorruptIndexDataException("invalid revision metadata: " + e.getMessage(), e);
    }
  }

  private static ObjectNode transformationNode(Transformation t) {
    ObjectNode n = MAPPER.createObjectNode();
    if (t instanceof LinearTransformation l) {
      n.put("kind", "linear");
      n.put("min", l.min());
      n.put("max", l.max());
    } else if (t instanceof IdentityTransformation i) {
      n.put("kind", "identity");
      if (i.value() != null) {
        n.put("value", i.value());
      }
    } else if (t instanceof HashTransformation) {
      n.put("kind", "hashing");
    }
    return n;
  }

  private static Transformation decodeTransformation(JsonNode n, LogicalType type) {
    String kind = text(n, "kind");
    return switch (kind) {
      case "linear" ->
          new LinearTransformation(
              type, required(n, "min").asDouble(), required(n, "max").asDouble());
      case "identity" -> {
        Double value = n.hasNonNull("value") ? n.get("value").asDouble() : null;
        yield new IdentityTransformation(type, value);
      }
      case "hashing" -> new HashTransformation(type);
      default -> throw new CorruptIndexDataException("unknown transformation kind: " + kind);
    };
  }

  private static ObjectNode indexFileNode(IndexFile f) {
    ObjectNode n = MAPPER.createObjectNode();
    n.put("path", f.path());
    n.put("size", f.size());
    n.put("dataChange", f.dataChange());
    n.put("modificationTime", f.modificationTime().toString());
    n.put("revisionId", f.revisionId());
    ArrayNode blocks = n.putArray("blocks");
    for (Block b : f.blocks()) {
      ObjectNode bn = blocks.addObject();
      bn.put("cube", b.cubeId().string());
      bn.put("state", b.state().name());
      bn.put("elementCount", b.elementCount());
      bn.put("minWeight", b.minWeight().value());
      bn.put("maxWeight", b.maxWeight().value());
      bn.put("cubeMaxWeight", b.cubeMaxWeight().value());
    }
    f.stats().ifPresent(s -> n.put("stats", s));
    return n;
  }

  private static IndexFile decodeIndexFile(JsonNode n, Map<Long, Revision> revisions) {
    long revisionId = required(n, "revisionId").asLong();
    int dims = revisionFor(revisions, revisionId).dimensionCount();
    List<Block> blocks = new ArrayList<>();
    try {
      for (JsonNode bn : required(n, "blocks")) {
        blocks.add(
            new Block(
                CubeId.fromString(dims, text(bn, "cube")),
                CubeState.valueOf(text(bn, "state")),
                required(bn, "elementCount").asLong(),
                weight(bn, "minWeight"),
                weight(bn, "maxWeight"),
                weight(bn, "cubeMaxWeight")));
      }
      return new IndexFile(
          text(n, "path"),
          required(n, "size").asLong(),
          required(n, "dataChange").asBoolean(),
          instant(n, "modificationTime"),
          revisionId,
          blocks,
          n.hasNonNull("stats") ? Optional.of(n.get("stats").asText()) : Optional.empty());
    } catch (IllegalArgumentException e) {
      throw new CorruptIndexDataException("invalid index file metadata: " + e.getMessage(), e);
    }
  }

  private static Revision revisionFor(Map<Long, Revision> revisions, long revisionId) {
    Revision r = revisions.get(revisionId);
    if (r == null) {
      throw new CorruptIndexDataException("metadata refers to unknown revision " + revisionId);
    }
    return r;
  }

  private static Weight weight(JsonNode n, String field) {
    JsonNode v = required(n, field);
    if (!v.isIntegralNumber() || !v.canConvertToInt()) {
      throw new CorruptIndexDataException("weight " + field + " is not a 32-bit int: " + v);
    }
    return Weight.of(v.asInt());
  }

  private static Instant instant(JsonNode n, String field) {
    try {
      return Instant.parse(text(n, field));
    } catch (DateTimeParseException e) {
      throw new CorruptIndexDataException("invalid timestamp in " + field, e);
    }
  }

  private static String text(JsonNode n, String field) {
    return required(n, field).asText();
  }

  private static JsonNode required(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) {
      throw new CorruptIndexDataException("missing metadata field: " + field);
    }
    return v;
  }

  private static JsonNode read(String json) {
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new CorruptIndexDataException("metadata is not valid JSON", e);
    }
  }

  private static String write(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot serialize index metadata", e);
    }
  }
}
