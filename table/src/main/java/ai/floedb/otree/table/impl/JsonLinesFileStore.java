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

import ai.floedb.otree.model.CorruptIndexDataException;
import ai.floedb.otree.model.CubeState;
import ai.floedb.otree.model.Revision;
import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.Weight;
import ai.floedb.otree.table.spi.FileWriteResult;
import ai.floedb.otree.table.spi.IndexFileReader;
import ai.floedb.otree.table.spi.IndexFileWriter;
import ai.floedb.otree.table.spi.IndexFileWriterFactory;
import ai.floedb.otree.table.spi.StoredRow;
import ai.floedb.otree.transform.Transformer;
import ai.floedb.otree.types.LogicalType;
import ai.floedb.otree.types.LogicalValues;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Reference file store writing one JSON object per row. Besides the row values each line carries
 * the cube id (base64 of its binary form), the weight as an int, the cube state and the rollup
 * group id. Paths are relative to the store root: {@code <tableId>/data/<uuid>.jsonl}.
 */
public final class JsonLinesFileStore implements IndexFileWriterFactory, IndexFileReader {
  private static final Logger LOG = Logger.getLogger(JsonLinesFileStore.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String VALUES = "values";
  static final String CUBE = "cube";
  static final String WEIGHT = "weight";
  static final String STATE = "state";
  static final String GROUP = "group";

  private final Path root;

  public JsonLinesFileStore(Path root) {
    this.root = root;
  }

  @Override
  public IndexFileWriter open(String tableId, Revision revision, UUID groupId)
      throws IOException {
    String path = tableId + "/data/" + UUID.randomUUID() + ".jsonl";
    Path file = root.resolve(path);
    Files.createDirectories(file.getParent());
    BufferedWriter out =
        Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    LOG.debugf("opened %s for group %s of table %s", path, groupId, tableId);
    return new JsonLinesWriter(path, file, out, columnTypes(revision));
  }

  @Override
  public void discard(String path) throws IOException {
    if (Files.deleteIfExists(root.resolve(path))) {
      LOG.debugf("discarded %s", path);
    }
  }

  @Override
  public List<StoredRow> read(String path, Revision revision) throws IOException {
    Map<String, LogicalType> types = columnTypes(revision);
    List<StoredRow> out = new ArrayList<>();
    try (BufferedReader in = Files.newBufferedReader(root.resolve(path), StandardCharsets.UTF_8)) {
      String line;
      while ((line = in.readLine()) != null) {
        if (!line.isBlank()) {
          out.add(decode(line, revision, types));
        }
      }
    }
    return out;
  }

  private static StoredRow decode(String line, Revision revision, Map<String, LogicalType> types) {
    JsonNode node;
    try {
      node = MAPPER.readTree(line);
    } catch (JsonProcessingException e) {
      throw new CorruptIndexDataException("row is not valid JSON", e);
    }
    Map<String, Object> values = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.path(VALUES).fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> e = fields.next();
      values.put(e.getKey(), decodeValue(types.get(e.getKey()), e.getValue()));
    }
    JsonNode weight = node.path(WEIGHT);
    if (!weight.isIntegralNumber() || !weight.canConvertToInt()) {
      throw new CorruptIndexDataException("row weight is not a 32-bit int: " + weight);
    }
    byte[] cube;
    try {
      cube = Base64.getDecoder().decode(node.path(CUBE).asText());
    } catch (IllegalArgumentException e) {
      throw new CorruptIndexDataException("row cube id is not base64", e);
    }
    CubeState state;
    try {
      state = CubeState.valueOf(node.path(STATE).asText());
    } catch (IllegalArgumentException e) {
      throw new CorruptIndexDataException("row has an unknown cube state", e);
    }
    return new StoredRow(
        Row.of(values),
        revision.createCubeId(cube),
        Weight.of(weight.asInt()),
        state,
        node.path(GROUP).asText());
  }

  private static Object decodeValue(LogicalType type, JsonNode value) {
    if (value.isNull()) {
      return null;
    }
    try {
      Object plain = MAPPER.treeToValue(value, Object.class);
      return type == null ? plain : LogicalValues.normalize(type, plain);
    } catch (JsonProcessingException e) {
      throw new CorruptIndexDataException("cannot decode row value " + value, e);
    }
  }

  private static Map<String, LogicalType> columnTypes(Revision revision) {
    Map<String, LogicalType> types = new HashMap<>();
    for (Transformer t : revision.transformers()) {
      types.put(t.columnName(), t.type());
    }
    return types;
  }

  private final class JsonLinesWriter implements IndexFileWriter {
    private final String path;
    private final Path file;
    private final BufferedWriter out;
    private final Map<String, LogicalType> types;
    private long bytes;
    private long rows;
    private boolean closed;

    JsonLinesWriter(String path, Path file, BufferedWriter out, Map<String, LogicalType> types) {
      this.path = path;
      this.file = file;
      this.out = out;
      this.types = types;
    }

    @Override
    public String path() {
      return path;
    }

    @Override
    public void writeRow(StoredRow row) throws IOException {
      if (closed) {
        throw new IllegalStateException("writer for " + path + " is closed");
      }
      ObjectNode node = MAPPER.createObjectNode();
      ObjectNode values = node.putObject(VALUES);
      for (Map.Entry<String, Object> e : row.row().values().entrySet()) {
        LogicalType type = types.get(e.getKey());
        Object v = type == null ? e.getValue() : LogicalValues.encode(type, e.getValue());
        values.set(e.getKey(), MAPPER.valueToTree(v));
      }
      node.put(CUBE, Base64.getEncoder().encodeToString(row.cubeId().bytes()));
      node.put(WEIGHT, row.weight().value());
      node.put(STATE, row.state().name());
      node.put(GROUP, row.groupId());
      String line = MAPPER.writeValueAsString(node) + "\n";
      out.write(line);
      bytes += line.getBytes(StandardCharsets.UTF_8).length;
      rows++;
    }

    @Override
    public FileWriteResult close() throws IOException {
      if (!closed) {
        closed = true;
        out.close();
      }
      return new FileWriteResult(
          path, bytes, rows, Optional.of("{\"numRecords\":" + rows + "}"));
    }

    @Override
    public void abort() throws IOException {
      if (!closed) {
        closed = true;
        out.close();
      }
      Files.deleteIfExists(file);
    }
  }
}
