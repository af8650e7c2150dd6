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

package ai.floedb.lint.rewrite;

import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.storage.FileMetadata;
import ai.floedb.lint.storage.LocalParquetSource;
import ai.floedb.lint.storage.ParquetMetadataReader;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.RowBatch;
import ai.floedb.lint.storage.RowBatchStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.ColumnWriteStore;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.GroupWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.api.RecordConsumer;
import org.apache.parquet.schema.MessageType;
import org.jboss.logging.Logger;

/**
 * Re-encodes a Parquet file under new physical properties. Rows are streamed from the source and
 * written unchanged with the source schema; only compression, encodings, dictionaries, page and
 * row-group sizing, statistics and bloom filters change.
 */
public final class ParquetRewriter {
  private static final Logger LOG = Logger.getLogger(ParquetRewriter.class);

  /** Byte ceiling for one buffered row group, on top of the row-count limit. */
  public static final long MAX_ROW_GROUP_BYTES = 128L * 1024 * 1024;

  private static final int SIZE_CHECK_INTERVAL = 1000;

  private ParquetRewriter() {}

  /**
   * Overlays {@code prescription} on the source's inferred properties and rewrites the source to
   * {@code output}. Conflicting directives are logged and resolved last-wins.
   *
   * @throws SchemaMismatchException if the written file's schema differs from the source's
   */
  public static void rewrite(ParquetSource source, Path output, Prescription prescription)
      throws IOException {
    FileMetadata metadata = ParquetMetadataReader.read(source);
    prescription
        .validate()
        .ifPresent(conflict -> LOG.warnf("%s; continuing with last directive wins", conflict));
    WriterProperties base = BasePropertiesInference.infer(metadata, source);
    WriterProperties properties = prescription.apply(base.toBuilder()).build();
    write(source, metadata, output, properties);
  }

  /** Rewrites the source with fully resolved properties. */
  public static void rewrite(ParquetSource source, Path output, WriterProperties properties)
      throws IOException {
    write(source, ParquetMetadataReader.read(source), output, properties);
  }

  private static void write(
      ParquetSource source, FileMetadata metadata, Path output, WriterProperties properties)
      throws IOException {
    if (source instanceof LocalParquetSource local
        && Files.exists(output)
        && Files.isSameFile(local.path(), output)) {
      throw new IllegalArgumentException("Output " + output + " is the source file");
    }
    MessageType schema = metadata.schema();
    LOG.infof("Rewriting %s to %s", source.location(), output);

    long rows = 0;
    try (RowBatchStream batches = RowBatchStream.open(source);
        GroupFileWriter writer = new GroupFileWriter(output, schema, properties)) {
      while (batches.hasNext()) {
        RowBatch batch = batches.next();
        for (Group row : batch.rows()) {
          writer.write(row);
        }
        rows += batch.size();
      }
      writer.finish(metadata.keyValueMetadata());
      LOG.infof("Wrote %d rows in %d row group(s) to %s", rows, writer.rowGroups(), output);
    } catch (UncheckedIOException e) {
      discardPartialOutput(output, e.getCause());
      throw e.getCause();
    } catch (IOException | RuntimeException e) {
      discardPartialOutput(output, e);
      throw e;
    }

    FileMetadata written = ParquetMetadataReader.read(new LocalParquetSource(output));
    if (!written.schema().equals(schema)) {
      throw new SchemaMismatchException(output.toString(), schema, written.schema());
    }
  }

  private static void discardPartialOutput(Path output, Throwable failure) {
    try {
      if (Files.isRegularFile(output)) {
        Files.delete(output);
        LOG.debugf("Deleted partial output %s", output);
      }
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }

  static ParquetProperties parquetProperties(MessageType schema, WriterProperties properties) {
    ParquetProperties.Builder b =
        ParquetProperties.builder()
            .withWriterVersion(properties.writerVersion())
            .withPageSize((int) properties.dataPageSizeLimit())
            .withDictionaryPageSize((int) properties.dictionaryPageSizeLimit())
            .withValuesWriterFactory(new ColumnValuesWriterFactory(properties));
    if (properties.statisticsTruncateLength() != null) {
      b.withStatisticsTruncateLength(properties.statisticsTruncateLength());
    }
    for (ColumnDescriptor column : schema.getColumns()) {
      String path = FileMetadata.pathOf(column);
      if (properties.bloomFilterEnabled(path)) {
        b.withBloomFilterEnabled(path, true);
        b.withBloomFilterFPP(path, properties.bloomFilterFpp(path));
        Long ndv = properties.bloomFilterNdv(path);
        if (ndv != null && ndv > 0) {
          b.withBloomFilterNDV(path, ndv);
        }
      }
    }
    return b.build();
  }

  /** Writes {@link Group} rows, cutting a row group at the row-count or byte limit. */
  private static final class GroupFileWriter implements Closeable {
    private final MessageType schema;
    private final WriterProperties properties;
    private final ParquetProperties parquetProperties;
    private final ColumnCompressors compressors;
    private final MessageColumnIO columnIO;
    private final ParquetFileWriter fileWriter;

    private ColumnChunkPageStore pageStore;
    private ColumnWriteStore columnStore;
    private RecordConsumer recordConsumer;
    private GroupWriter groupWriter;
    private long rowsInGroup;
    private int rowGroups;

    GroupFileWriter(Path output, MessageType schema, WriterProperties properties)
        throws IOException {
      this.schema = schema;
      this.properties = properties;
      this.parquetProperties = parquetProperties(schema, properties);
      this.compressors = new ColumnCompressors(properties);
      this.columnIO = new ColumnIOFactory(false).getColumnIO(schema);
      Integer truncate = properties.statisticsTruncateLength();
      this.fileWriter =
          new ParquetFileWriter(
              new LocalOutputFile(output),
              schema,
              ParquetFileWriter.Mode.OVERWRITE,
              MAX_ROW_GROUP_BYTES,
              0,
              truncate != null
                  ? truncate
                  : ParquetProperties.DEFAULT_COLUMN_INDEX_TRUNCATE_LENGTH,
              truncate != null ? truncate : Integer.MAX_VALUE,
              false);
      fileWriter.start();
      startRowGroup();
    }

    void write(Group row) throws IOException {
      groupWriter.write(row);
      rowsInGroup++;
      if (rowsInGroup >= properties.maxRowGroupSize()
          || (rowsInGroup % SIZE_CHECK_INTERVAL == 0
              && columnStore.getBufferedSize() >= MAX_ROW_GROUP_BYTES)) {
        flushRowGroup();
        startRowGroup();
      }
    }

    void finish(Map<String, String> keyValueMetadata) throws IOException {
      flushRowGroup();
      fileWriter.end(keyValueMetadata);
    }

    int rowGroups() {
      return rowGroups;
    }

    private void startRowGroup() {
      pageStore = new ColumnChunkPageStore(schema, properties, compressors);
      columnStore = parquetProperties.newColumnWriteStore(schema, pageStore, pageStore);
      recordConsumer = columnIO.getRecordWriter(columnStore);
      groupWriter = new GroupWriter(recordConsumer, schema);
      rowsInGroup = 0;
    }

    private void flushRowGroup() throws IOException {
      recordConsumer.flush();
      if (rowsInGroup > 0) {
        fileWriter.startBlock(rowsInGroup);
        columnStore.flush();
        pageStore.flushToFileWriter(fileWriter);
        fileWriter.endBlock();
        rowGroups++;
        LOG.debugf("Flushed row group %d with %d rows", rowGroups, rowsInGroup);
      }
      columnStore.close();
      rowsInGroup = 0;
    }

    @Override
    public void close() throws IOException {
      try {
        fileWriter.close();
      } finally {
        compressors.close();
      }
    }
  }
}
