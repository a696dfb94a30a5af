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

import ai.floedb.otree.table.spi.Commit;
import ai.floedb.otree.table.spi.CommitLog;
import ai.floedb.otree.table.spi.CommitResult;
import ai.floedb.otree.table.spi.TableSnapshot;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/**
 * Commit log kept as numbered JSON entries under {@code <root>/<tableId>/_log/}. Entry {@code n}
 * holds the commit that produced version {@code n}; entries are created exclusively so two
 * writers racing for the same version cannot both win.
 */
public final class FileSystemCommitLog implements CommitLog {
  private static final Logger LOG = Logger.getLogger(FileSystemCommitLog.class);
  private static final String LOG_DIR = "_log";
  private static final String SUFFIX = ".json";

  private final Path root;

  public FileSystemCommitLog(Path root) {
    this.root = root;
  }

  @Override
  public TableSnapshot snapshot(String tableId) throws IOException {
    TableSnapshot snapshot = TableSnapshot.empty(tableId);
    for (Path entry : entries(tableId)) {
      long version = versionOf(entry);
      if (version != snapshot.version() + 1) {
        throw new IOException(
            "commit log of " + tableId + " has a gap before version " + version);
      }
      String json = Files.readString(entry, StandardCharsets.UTF_8);
      snapshot = snapshot.apply(IndexMetadataCodec.decodeCommit(json, snapshot.revisions()));
    }
    return snapshot;
  }

  @Override
  public CommitResult commit(String tableId, long expectedVersion, Commit commit)
      throws IOException {
    TableSnapshot current = snapshot(tableId);
    if (expectedVersion > current.version()) {
      throw new IllegalArgumentException(
          "expected version "
              + expectedVersion
              + " is ahead of table "
              + tableId
              + " at "
              + current.version());
    }
    if (expectedVersion < current.version()) {
      return CommitResult.conflict(current.version());
    }
    long next = expectedVersion + 1;
    Path dir = logDir(tableId);
    Files.createDirectories(dir);
    Path entry = dir.resolve(String.format("%020d%s", next, SUFFIX));
    try {
      Files.writeString(
          entry,
          IndexMetadataCodec.encodeCommit(commit),
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE_NEW,
          StandardOpenOption.WRITE);
    } catch (FileAlreadyExistsException e) {
      LOG.debugf("lost race for version %d of table %s", next, tableId);
      return CommitResult.conflict(next);
    }
    LOG.debugf("committed version %d of table %s", next, tableId);
    return CommitResult.success(next);
  }

  private List<Path> entries(String tableId) throws IOException {
    Path dir = logDir(tableId);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> s = Files.list(dir)) {
      List<Path> out = new ArrayList<>();
      s.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).sorted().forEach(out::add);
      return out;
    }
  }

  private Path logDir(String tableId) {
    return root.resolve(tableId).resolve(LOG_DIR);
  }

  private static long versionOf(Path entry) throws IOException {
    String name = entry.getFileName().toString();
    try {
      return Long.parseLong(name.substring(0, name.length() - SUFFIX.length()));
    } catch (NumberFormatException e) {
      throw new IOException("unexpected commit log entry " + entry, e);
    }
  }
}
