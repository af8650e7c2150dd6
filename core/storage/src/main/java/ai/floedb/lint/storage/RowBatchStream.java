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

package ai.floedb.lint.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;
import org.jboss.logging.Logger;

/**
 * Streams decoded rows of a Parquet file as {@link RowBatch}es.
 *
 * <p>Row groups are read one at a time, so memory stays bounded by one row group's pages plus one
 * batch. The stream can be restricted to a subset of row groups, a row limit and a set of leaf
 * columns; a projection keeps every root field that contains a requested leaf.
 *
 * <p>I/O failures while iterating surface as {@link UncheckedIOException}.
 */
public final class RowBatchStream implements Iterator<RowBatch>, AutoCloseable {
  private static final Logger LOG = Logger.getLogger(RowBatchStream.class);

  public static final int DEFAULT_BATCH_SIZE = 8192;

  private final ParquetFileReader reader;
  private final MessageType fileSchema;
  private final MessageType projection;
  private final Deque<Integer> pendingRowGroups;
  private final int batchSize;
  private final long rowLimit;
  private final ColumnIOFactory columnIOFactory = new ColumnIOFactory();

  private RecordReader<Group> current;
  private int currentRowGroup = -1;
  private long rowsLeftInGroup;
  private long emitted;
  private RowBatch next;

  private RowBatchStream(
      ParquetFileReader reader,
      MessageType projection,
      List<Integer> rowGroups,
      int batchSize,
      long rowLimit) {
    this.reader = reader;
    this.fileSchema = reader.getFooter().getFileMetaData().getSchema();
    this.projection = projection;
    this.pendingRowGroups = new ArrayDeque<>(rowGroups);
    this.batchSize = batchSize;
    this.rowLimit = rowLimit;
  }

  /** Streams every row of every row group with all columns. */
  public static RowBatchStream open(ParquetSource source) throws IOException {
    return open(source, Options.all());
  }

  public static RowBatchStream open(ParquetSource source, Options options) throws IOException {
    ParquetFileReader reader = ParquetFileReader.open(source);
    try {
      MessageType schema = reader.getFooter().getFileMetaData().getSchema();
      MessageType projection = project(schema, options.columns());
      if (options.columns() != null) {
        reader.setRequestedSchema(projection);
      }

      int numRowGroups = reader.getRowGroups().size();
      List<Integer> rowGroups = new ArrayList<>();
      if (options.rowGroups() == null) {
        for (int i = 0; i < numRowGroups; i++) {
          rowGroups.add(i);
        }
      } else {
        for (int i : new TreeSet<>(options.rowGroups())) {
          if (i < 0 || i >= numRowGroups) {
            throw new IllegalArgumentException(
                "Row group " + i + " out of range for " + source.location());
          }
          rowGroups.add(i);
        }
      }

      LOG.debugf(
          "Streaming %s: row groups=%s, batch=%d, limit=%d, columns=%d/%d",
          source.location(),
          rowGroups,
          options.batchSize(),
          options.rowLimit(),
          projection.getColumns().size(),
          schema.getColumns().size());
      return new RowBatchStream(
          reader, projection, rowGroups, options.batchSize(), options.rowLimit());
    } catch (RuntimeException e) {
      reader.close();
      throw e;
    }
  }

  /**
   * Builds the projected schema for the given leaf indexes: each root field that contains one of
   * them, in schema order. {@code null} keeps the full schema.
   */
  public static MessageType project(MessageType schema, Set<Integer> leafColumns) {
    if (leafColumns == null) {
      return schema;
    }
    List<ColumnDescriptor> leaves = schema.getColumns();
    Set<String> roots = new LinkedHashSet<>();
    for (int leaf : new TreeSet<>(leafColumns)) {
      if (leaf < 0 || leaf >= leaves.size()) {
        throw new IllegalArgumentException("Leaf column " + leaf + " out of range");
      }
      roots.add(leaves.get(leaf).getPath()[0]);
    }
    List<Type> fields = new ArrayList<>();
    for (Type field : schema.getFields()) {
      if (roots.contains(field.getName())) {
        fields.add(field);
      }
    }
    return new MessageType(schema.getName(), fields);
  }

  public MessageType schema() {
    return projection;
  }

  @Override
  public boolean hasNext() {
    if (next == null) {
      try {
        next = readBatch();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return next != null;
  }

  @Override
  public RowBatch next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    RowBatch out = next;
    next = null;
    return out;
  }

  private RowBatch readBatch() throws IOException {
    while (emitted < rowLimit) {
      if (rowsLeftInGroup == 0) {
        if (!advanceRowGroup()) {
          return null;
        }
        continue;
      }
      long want = Math.min(Math.min(batchSize, rowsLeftInGroup), rowLimit - emitted);
      List<Group> rows = new ArrayList<>((int) want);
      for (long i = 0; i < want; i++) {
        rows.add(current.read());
      }
      rowsLeftInGroup -= want;
      emitted += want;
      return new RowBatch(currentRowGroup, projection, rows);
    }
    return null;
  }

  private boolean advanceRowGroup() throws IOException {
    Integer index = pendingRowGroups.poll();
    if (index == null) {
      return false;
    }
    PageReadStore pages = reader.readRowGroup(index);
    if (pages == null) {
      throw new IOException("Row group " + index + " could not be read");
    }
    MessageColumnIO columnIO = columnIOFactory.getColumnIO(projection, fileSchema);
    current = columnIO.getRecordReader(pages, new GroupRecordConverter(projection));
    currentRowGroup = index;
    rowsLeftInGroup = pages.getRowCount();
    return true;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  /**
   * Stream restrictions.
   *
   * @param rowGroups row groups to read, or {@code null} for all
   * @param batchSize maximum rows per batch
   * @param rowLimit maximum rows over the whole stream
   * @param columns leaf column indexes to project, or {@code null} for all
   */
  public record Options(
      Set<Integer> rowGroups, int batchSize, long rowLimit, Set<Integer> columns) {

    public Options {
      if (batchSize <= 0) {
        throw new IllegalArgumentException("batchSize must be positive");
      }
      if (rowLimit < 0) {
        throw new IllegalArgumentException("rowLimit must not be negative");
      }
    }

    public static Options all() {
      return new Options(null, DEFAULT_BATCH_SIZE, Long.MAX_VALUE, null);
    }

    /** A single row group, capped at {@code rowLimit} rows, limited to {@code columns}. */
    public static Options sample(int rowGroup, long rowLimit, Set<Integer> columns) {
      int batch = (int) Math.max(1, Math.min(rowLimit, DEFAULT_BATCH_SIZE));
      return new Options(Set.of(rowGroup), batch, rowLimit, columns);
    }
  }
}
