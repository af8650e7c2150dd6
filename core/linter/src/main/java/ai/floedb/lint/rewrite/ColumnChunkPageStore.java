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

import ai.floedb.lint.prescription.StatisticsLevel;
import ai.floedb.lint.storage.FileMetadata;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.parquet.bytes.BytesInput;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.column.page.PageWriteStore;
import org.apache.parquet.column.page.PageWriter;
import org.apache.parquet.column.statistics.SizeStatistics;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.column.values.bloomfilter.BloomFilter;
import org.apache.parquet.column.values.bloomfilter.BloomFilterWriteStore;
import org.apache.parquet.column.values.bloomfilter.BloomFilterWriter;
import org.apache.parquet.compression.CompressionCodecFactory.BytesInputCompressor;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.schema.MessageType;

/**
 * Buffers the compressed pages of one row group, column by column, until the row group is
 * flushed to a {@link ParquetFileWriter}. Each column has its own compressor so codecs can differ
 * per column.
 */
final class ColumnChunkPageStore implements PageWriteStore, BloomFilterWriteStore {
  private final Map<ColumnDescriptor, ColumnChunkPageWriter> writers = new LinkedHashMap<>();

  ColumnChunkPageStore(
      MessageType schema, WriterProperties properties, ColumnCompressors compressors) {
    for (ColumnDescriptor descriptor : schema.getColumns()) {
      String path = FileMetadata.pathOf(descriptor);
      writers.put(
          descriptor,
          new ColumnChunkPageWriter(
              descriptor, path, compressors.forColumn(path), properties.statistics(path)));
    }
  }

  @Override
  public PageWriter getPageWriter(ColumnDescriptor path) {
    return writer(path);
  }

  @Override
  public BloomFilterWriter getBloomFilterWriter(ColumnDescriptor path) {
    return writer(path);
  }

  @Override
  public void close() {
    writers.values().forEach(ColumnChunkPageWriter::close);
  }

  /** Writes every buffered column chunk, in schema order, into the writer's current block. */
  void flushToFileWriter(ParquetFileWriter fileWriter) throws IOException {
    for (ColumnChunkPageWriter writer : writers.values()) {
      writer.writeTo(fileWriter);
    }
  }

  private ColumnChunkPageWriter writer(ColumnDescriptor path) {
    ColumnChunkPageWriter writer = writers.get(path);
    if (writer == null) {
      throw new IllegalArgumentException("Unknown column " + path);
    }
    return writer;
  }

  private static final class ColumnChunkPageWriter implements PageWriter, BloomFilterWriter {
    private final ColumnDescriptor descriptor;
    private final String path;
    private final BytesInputCompressor compressor;
    private final StatisticsLevel statisticsLevel;
    private final List<BufferedPage> pages = new ArrayList<>();
    private DictionaryPage dictionaryPage;
    private BloomFilter bloomFilter;
    private long valueCount;
    private long bufferedBytes;

    ColumnChunkPageWriter(
        ColumnDescriptor descriptor,
        String path,
        BytesInputCompressor compressor,
        StatisticsLevel statisticsLevel) {
      this.descriptor = descriptor;
      this.path = path;
      this.compressor = compressor;
      this.statisticsLevel = statisticsLevel;
    }

    @Override
    @Deprecated
    public void writePage(
        BytesInput bytesInput,
        int valueCount,
        Statistics<?> statistics,
        Encoding rlEncoding,
        Encoding dlEncoding,
        Encoding valuesEncoding)
        throws IOException {
      writePage(bytesInput, valueCount, -1, statistics, rlEncoding, dlEncoding, valuesEncoding);
    }

    @Override
    public void writePage(
        BytesInput bytesInput,
        int valueCount,
        int rowCount,
        Statistics<?> statistics,
        Encoding rlEncoding,
        Encoding dlEncoding,
        Encoding valuesEncoding)
        throws IOException {
      long uncompressed = bytesInput.size();
      if (uncompressed > Integer.MAX_VALUE) {
        throw new IOException("Page of " + path + " too large: " + uncompressed + " bytes");
      }
      BytesInput compressed = BytesInput.copy(compressor.compress(bytesInput));
      add(
          new BufferedPage(
              false,
              compressed,
              (int) uncompressed,
              valueCount,
              rowCount,
              0,
              null,
              null,
              statistics.copy(),
              rlEncoding,
              dlEncoding,
              valuesEncoding));
    }

    @Override
    public void writePage(
        BytesInput bytesInput,
        int valueCount,
        int rowCount,
        Statistics<?> statistics,
        SizeStatistics sizeStatistics,
        Encoding rlEncoding,
        Encoding dlEncoding,
        Encoding valuesEncoding)
        throws IOException {
      writePage(
          bytesInput, valueCount, rowCount, statistics, rlEncoding, dlEncoding, valuesEncoding);
    }

    @Override
    public void writePageV2(
        int rowCount,
        int nullCount,
        int valueCount,
        BytesInput repetitionLevels,
        BytesInput definitionLevels,
        Encoding dataEncoding,
        BytesInput data,
        Statistics<?> statistics)
        throws IOException {
      long uncompressed = data.size();
      if (uncompressed > Integer.MAX_VALUE) {
        throw new IOException("Page of " + path + " too large: " + uncompressed + " bytes");
      }
      BytesInput compressed = BytesInput.copy(compressor.compress(data));
      add(
          new BufferedPage(
              true,
              compressed,
              (int) uncompressed,
              valueCount,
              rowCount,
              nullCount,
              BytesInput.copy(repetitionLevels),
              BytesInput.copy(definitionLevels),
              statistics.copy(),
              null,
              null,
              dataEncoding));
    }

    @Override
    public void writePageV2(
        int rowCount,
        int nullCount,
        int valueCount,
        BytesInput repetitionLevels,
        BytesInput definitionLevels,
        Encoding dataEncoding,
        BytesInput data,
        Statistics<?> statistics,
        SizeStatistics sizeStatistics)
        throws IOException {
      writePageV2(
          rowCount,
          nullCount,
          valueCount,
          repetitionLevels,
          definitionLevels,
          dataEncoding,
          data,
          statistics);
    }

    private void add(BufferedPage page) {
      pages.add(page);
      valueCount += page.valueCount();
      bufferedBytes += page.bufferedSize();
    }

    @Override
    public void writeDictionaryPage(DictionaryPage page) throws IOException {
      if (dictionaryPage != null) {
        throw new IOException("Only one dictionary page is allowed per column chunk: " + path);
      }
      BytesInput compressed = BytesInput.copy(compressor.compress(page.getBytes()));
      dictionaryPage =
          new DictionaryPage(
              compressed, page.getUncompressedSize(), page.getDictionarySize(), page.getEncoding());
      bufferedBytes += compressed.size();
    }

    @Override
    public void writeBloomFilter(BloomFilter bloomFilter) {
      this.bloomFilter = bloomFilter;
    }

    @Override
    public void close() {
      pages.clear();
      dictionaryPage = null;
      bloomFilter = null;
    }

    @Override
    public long getMemSize() {
      return bufferedBytes;
    }

    @Override
    public long allocatedSize() {
      return bufferedBytes;
    }

    @Override
    public String memUsageString(String prefix) {
      return prefix + " ColumnChunkPageWriter(" + path + ") " + bufferedBytes + " bytes";
    }

    void writeTo(ParquetFileWriter fileWriter) throws IOException {
      fileWriter.startColumn(descriptor, valueCount, compressor.getCodecName());
      if (bloomFilter != null) {
        fileWriter.addBloomFilter(path, bloomFilter);
      }
      if (dictionaryPage != null) {
        fileWriter.writeDictionaryPage(dictionaryPage);
      }
      for (BufferedPage page : pages) {
        page.writeTo(fileWriter, descriptor, statisticsLevel);
      }
      if (statisticsLevel != StatisticsLevel.PAGE) {
        // Drops the column index V2 pages always feed; chunk statistics survive only at CHUNK.
        fileWriter.invalidateStatistics(chunkStatistics());
      }
      fileWriter.endColumn();
    }

    private Statistics<?> chunkStatistics() {
      Statistics<?> merged = Statistics.createStats(descriptor.getPrimitiveType());
      if (statisticsLevel == StatisticsLevel.CHUNK) {
        for (BufferedPage page : pages) {
          merged.mergeStatistics(page.statistics());
        }
      }
      return merged;
    }
  }

  private record BufferedPage(
      boolean v2,
      BytesInput bytes,
      int uncompressedSize,
      int valueCount,
      int rowCount,
      int nullCount,
      BytesInput repetitionLevels,
      BytesInput definitionLevels,
      Statistics<?> statistics,
      Encoding rlEncoding,
      Encoding dlEncoding,
      Encoding valuesEncoding) {

    long bufferedSize() {
      long size = bytes.size();
      if (v2) {
        size += repetitionLevels.size() + definitionLevels.size();
      }
      return size;
    }

    void writeTo(ParquetFileWriter fileWriter, ColumnDescriptor descriptor, StatisticsLevel level)
        throws IOException {
      Statistics<?> stats =
          level == StatisticsLevel.NONE
              ? Statistics.createStats(descriptor.getPrimitiveType())
              : statistics;
      if (v2) {
        fileWriter.writeDataPageV2(
            rowCount,
            nullCount,
            valueCount,
            repetitionLevels,
            definitionLevels,
            valuesEncoding,
            bytes,
            uncompressedSize,
            stats);
      } else if (level == StatisticsLevel.PAGE && rowCount >= 0) {
        fileWriter.writeDataPage(
            valueCount,
            uncompressedSize,
            bytes,
            stats,
            rowCount,
            rlEncoding,
            dlEncoding,
            valuesEncoding);
      } else {
        // Without a row count the writer skips the column and offset indexes.
        writeWithoutPageIndex(fileWriter, stats);
      }
    }

    @SuppressWarnings("deprecation")
    private void writeWithoutPageIndex(ParquetFileWriter fileWriter, Statistics<?> stats)
        throws IOException {
      fileWriter.writeDataPage(
          valueCount, uncompressedSize, bytes, stats, rlEncoding, dlEncoding, valuesEncoding);
    }
  }
}
