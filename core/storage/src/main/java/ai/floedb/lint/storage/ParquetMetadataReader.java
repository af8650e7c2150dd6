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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.ColumnMetaData;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.format.Statistics;
import org.apache.parquet.format.Util;
import org.apache.parquet.format.converter.ParquetMetadataConverter;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.schema.MessageType;
import org.jboss.logging.Logger;

/**
 * Reads a Parquet footer with two range reads (tail, then footer body) and decodes it into a
 * {@link FileMetadata}.
 *
 * <p>Schema, codecs and encoding stats go through Parquet's {@link ParquetMetadataConverter}.
 * Everything the converter drops (declared distinct counts, min/max exactness, page index and bloom
 * filter locations, sorting columns) is taken from the raw Thrift structures.
 */
public final class ParquetMetadataReader {
  private static final Logger LOG = Logger.getLogger(ParquetMetadataReader.class);

  private static final byte[] MAGIC = "PAR1".getBytes(StandardCharsets.US_ASCII);
  private static final byte[] ENCRYPTED_MAGIC = "PARE".getBytes(StandardCharsets.US_ASCII);
  private static final int TAIL_LENGTH = 8;

  private ParquetMetadataReader() {}

  public static FileMetadata read(ParquetSource source) throws IOException {
    long fileLength = source.getLength();
    if (fileLength < MAGIC.length + TAIL_LENGTH) {
      throw new IOException(
          source.location() + " is not a Parquet file (too small: " + fileLength + " bytes)");
    }

    byte[] tail = source.readRange(fileLength - TAIL_LENGTH, TAIL_LENGTH);
    byte[] magic = new byte[4];
    System.arraycopy(tail, 4, magic, 0, 4);
    if (Arrays.equals(magic, ENCRYPTED_MAGIC)) {
      throw new IOException("Encrypted footers are not supported: " + source.location());
    }
    if (!Arrays.equals(magic, MAGIC)) {
      throw new IOException(source.location() + " is not a Parquet file (bad magic)");
    }

    int footerLength = ByteBuffer.wrap(tail, 0, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
    long footerStart = fileLength - TAIL_LENGTH - footerLength;
    if (footerLength <= 0 || footerStart < MAGIC.length) {
      throw new IOException(
          "Corrupt footer length " + footerLength + " in " + source.location());
    }

    byte[] footer = source.readRange(footerStart, footerLength);
    FileMetaData thrift = Util.readFileMetaData(new ByteArrayInputStream(footer));
    ParquetMetadata converted = new ParquetMetadataConverter().fromParquetMetadata(thrift);
    LOG.debugf(
        "Read %d-byte footer of %s (%d row groups)",
        Integer.valueOf(footerLength), source.location(), Integer.valueOf(thrift.getRow_groupsSize()));
    return toModel(thrift, converted);
  }

  static FileMetadata toModel(FileMetaData thrift, ParquetMetadata converted) {
    MessageType schema = converted.getFileMetaData().getSchema();
    List<ColumnDescriptor> leaves = schema.getColumns();
    List<BlockMetaData> blocks = converted.getBlocks();
    List<RowGroup> rawGroups = thrift.getRow_groups() == null ? List.of() : thrift.getRow_groups();

    List<RowGroupMetadata> rowGroups = new ArrayList<>(rawGroups.size());
    for (int rg = 0; rg < rawGroups.size(); rg++) {
      RowGroup raw = rawGroups.get(rg);
      BlockMetaData block = blocks.get(rg);

      List<ColumnChunkMetadata> columns = new ArrayList<>(leaves.size());
      long compressed = 0L;
      for (int c = 0; c < leaves.size(); c++) {
        ColumnChunkMetadata chunk =
            toChunk(c, leaves.get(c), raw.getColumns().get(c), block.getColumns().get(c));
        compressed += chunk.totalCompressedSize();
        columns.add(chunk);
      }

      List<SortingColumn> sorting = new ArrayList<>();
      if (raw.isSetSorting_columns()) {
        for (org.apache.parquet.format.SortingColumn s : raw.getSorting_columns()) {
          sorting.add(new SortingColumn(s.getColumn_idx(), s.isDescending(), s.isNulls_first()));
        }
      }

      rowGroups.add(
          new RowGroupMetadata(
              rg,
              raw.getNum_rows(),
              raw.getTotal_byte_size(),
              raw.isSetTotal_compressed_size() ? raw.getTotal_compressed_size() : compressed,
              columns,
              sorting));
    }

    return new FileMetadata(
        schema,
        thrift.getCreated_by(),
        converted.getFileMetaData().getKeyValueMetaData(),
        rowGroups);
  }

  private static ColumnChunkMetadata toChunk(
      int index,
      ColumnDescriptor descriptor,
      ColumnChunk raw,
      org.apache.parquet.hadoop.metadata.ColumnChunkMetaData converted) {
    ColumnMetaData md = raw.getMeta_data();

    ChunkEncodingStats encodingStats =
        converted.getEncodingStats() == null
            ? null
            : ChunkEncodingStats.from(converted.getEncodingStats());

    ChunkStatistics statistics =
        md.isSetStatistics() ? toStatistics(descriptor, md.getStatistics()) : null;

    IndexRange columnIndex =
        raw.isSetColumn_index_offset()
            ? new IndexRange(raw.getColumn_index_offset(), raw.getColumn_index_length())
            : null;
    IndexRange offsetIndex =
        raw.isSetOffset_index_offset()
            ? new IndexRange(raw.getOffset_index_offset(), raw.getOffset_index_length())
            : null;

    return new ColumnChunkMetadata(
        index,
        FileMetadata.pathOf(descriptor),
        descriptor,
        converted.getCodec(),
        converted.getEncodings(),
        encodingStats,
        md.getNum_values(),
        md.getTotal_compressed_size(),
        md.getTotal_uncompressed_size(),
        md.getData_page_offset(),
        md.isSetDictionary_page_offset() ? md.getDictionary_page_offset() : null,
        statistics,
        columnIndex,
        offsetIndex,
        md.isSetBloom_filter_offset() ? md.getBloom_filter_offset() : null);
  }

  static ChunkStatistics toStatistics(ColumnDescriptor descriptor, Statistics raw) {
    var type = descriptor.getPrimitiveType().getPrimitiveTypeName();

    byte[] minBytes = null;
    byte[] maxBytes = null;
    boolean minExact = false;
    boolean maxExact = false;
    // Writers that never set the exactness flags drop oversized min_value/max_value instead of
    // truncating them, so an unset flag on min_value/max_value reads as exact.
    if (raw.isSetMin_value()) {
      minBytes = raw.getMin_value();
      minExact = !raw.isSetIs_min_value_exact() || raw.isIs_min_value_exact();
    } else if (raw.isSetMin()) {
      minBytes = raw.getMin();
    }
    if (raw.isSetMax_value()) {
      maxBytes = raw.getMax_value();
      maxExact = !raw.isSetIs_max_value_exact() || raw.isIs_max_value_exact();
    } else if (raw.isSetMax()) {
      maxBytes = raw.getMax();
    }

    return new ChunkStatistics(
        raw.isSetNull_count() ? raw.getNull_count() : null,
        raw.isSetDistinct_count() ? raw.getDistinct_count() : null,
        ChunkStatistics.decodeValue(type, minBytes),
        ChunkStatistics.decodeValue(type, maxBytes),
        minBytes,
        maxBytes,
        minExact,
        maxExact);
  }
}
