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

import java.util.Set;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Footer metadata of one column chunk.
 *
 * <p>Optional footer fields are {@code null} when the writer did not record them: {@code
 * encodingStats}, {@code dictionaryPageOffset}, {@code statistics}, the page index ranges and
 * {@code bloomFilterOffset}.
 */
public record ColumnChunkMetadata(
    int columnIndex,
    String path,
    ColumnDescriptor descriptor,
    CompressionCodecName codec,
    Set<Encoding> encodings,
    ChunkEncodingStats encodingStats,
    long numValues,
    long totalCompressedSize,
    long totalUncompressedSize,
    long dataPageOffset,
    Long dictionaryPageOffset,
    ChunkStatistics statistics,
    IndexRange columnIndexRange,
    IndexRange offsetIndexRange,
    Long bloomFilterOffset) {

  public ColumnChunkMetadata {
    encodings = Set.copyOf(encodings);
  }

  public PrimitiveTypeName physicalType() {
    return descriptor.getPrimitiveType().getPrimitiveTypeName();
  }

  public boolean hasDictionaryPage() {
    return dictionaryPageOffset != null && dictionaryPageOffset > 0;
  }

  /** Offset of the first page: the dictionary page when present, else the first data page. */
  public long chunkStart() {
    if (hasDictionaryPage() && dictionaryPageOffset < dataPageOffset) {
      return dictionaryPageOffset;
    }
    return dataPageOffset;
  }

  /** Non-null values, assuming no nulls when the null count is unknown. */
  public long nonNullCount() {
    if (statistics == null || statistics.nullCount() == null) {
      return numValues;
    }
    return numValues - Math.min(Math.max(statistics.nullCount(), 0L), numValues);
  }

  public boolean hasColumnIndex() {
    return columnIndexRange != null;
  }

  public boolean hasOffsetIndex() {
    return offsetIndexRange != null;
  }

  public boolean hasBloomFilter() {
    return bloomFilterOffset != null;
  }

  public boolean usesDictionaryEncoding() {
    return encodings.stream().anyMatch(Encoding::usesDictionary);
  }
}
