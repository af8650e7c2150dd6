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

import ai.floedb.lint.prescription.Codec;
import ai.floedb.lint.prescription.DataEncoding;
import ai.floedb.lint.prescription.StatisticsLevel;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import ai.floedb.lint.storage.FileMetadata;
import ai.floedb.lint.storage.PageHeaderScanner;
import ai.floedb.lint.storage.PageInfo;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.RowGroupMetadata;
import ai.floedb.lint.storage.SortingColumn;
import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.ParquetProperties.WriterVersion;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.jboss.logging.Logger;

/**
 * Reconstructs the effective write settings of an existing file from its footer. The result is
 * the base a prescription is overlaid on before a rewrite.
 */
public final class BasePropertiesInference {
  private static final Logger LOG = Logger.getLogger(BasePropertiesInference.class);

  private static final Set<Encoding> V2_ONLY_ENCODINGS =
      Set.of(
          Encoding.RLE_DICTIONARY,
          Encoding.DELTA_BINARY_PACKED,
          Encoding.DELTA_LENGTH_BYTE_ARRAY,
          Encoding.DELTA_BYTE_ARRAY);

  private BasePropertiesInference() {}

  /** Infers from the footer alone; the writer version is derived from the encodings used. */
  public static WriterProperties infer(FileMetadata metadata) {
    return infer(metadata, versionFromEncodings(metadata));
  }

  /**
   * Infers from the footer and reads the first page headers of one non-empty chunk to tell V1 data
   * pages from V2 ones.
   */
  public static WriterProperties infer(FileMetadata metadata, ParquetSource source)
      throws IOException {
    return infer(metadata, versionFromPages(metadata, source));
  }

  private static WriterProperties infer(FileMetadata metadata, WriterVersion version) {
    WriterProperties.Builder b =
        WriterProperties.builder()
            .writerVersion(version)
            .keyValueMetadata(metadata.keyValueMetadata())
            .sortingColumns(consistentSorting(metadata.rowGroups()));

    long maxRows =
        metadata.rowGroups().stream().mapToLong(RowGroupMetadata::numRows).max().orElse(0);
    if (maxRows > 0) {
      b.maxRowGroupSize(maxRows);
    }

    for (int c = 0; c < metadata.numColumns(); c++) {
      String path = FileMetadata.pathOf(metadata.columns().get(c));
      Map<CompressionCodecName, Integer> codecs = new EnumMap<>(CompressionCodecName.class);
      Map<Encoding, Integer> encodings = new EnumMap<>(Encoding.class);
      boolean dictionary = false;
      boolean pageIndex = false;
      boolean chunkStats = false;
      boolean bloom = false;
      for (RowGroupMetadata rg : metadata.rowGroups()) {
        ColumnChunkMetadata chunk = rg.column(c);
        codecs.merge(chunk.codec(), 1, Integer::sum);
        for (Encoding e : chunk.encodings()) {
          if (isDataEncoding(e)) {
            encodings.merge(e, 1, Integer::sum);
          }
        }
        dictionary |= chunk.hasDictionaryPage() || chunk.usesDictionaryEncoding();
        pageIndex |= chunk.hasColumnIndex();
        chunkStats |= chunk.statistics() != null && chunk.statistics().hasMinMax();
        bloom |= chunk.hasBloomFilter();
      }

      majority(codecs)
          .flatMap(BasePropertiesInference::codecOf)
          .ifPresent(codec -> b.columnCompression(path, codec));
      majority(encodings)
          .flatMap(DataEncoding::fromEncoding)
          .ifPresent(encoding -> b.columnEncoding(path, encoding));
      b.columnDictionary(path, dictionary);
      StatisticsLevel statistics =
          pageIndex
              ? StatisticsLevel.PAGE
              : chunkStats ? StatisticsLevel.CHUNK : StatisticsLevel.NONE;
      b.columnStatistics(path, statistics);
      b.columnBloomFilter(path, bloom);
    }
    WriterProperties props = b.build();
    LOG.debugf("Inferred base properties: %s", props);
    return props;
  }

  static boolean isDataEncoding(Encoding e) {
    return switch (e) {
      case RLE, BIT_PACKED, PLAIN_DICTIONARY, RLE_DICTIONARY -> false;
      default -> true;
    };
  }

  static WriterVersion versionFromEncodings(FileMetadata metadata) {
    for (RowGroupMetadata rg : metadata.rowGroups()) {
      for (ColumnChunkMetadata chunk : rg.columns()) {
        for (Encoding e : chunk.encodings()) {
          if (V2_ONLY_ENCODINGS.contains(e)) {
            return WriterVersion.PARQUET_2_0;
          }
        }
      }
    }
    return WriterVersion.PARQUET_1_0;
  }

  private static WriterVersion versionFromPages(FileMetadata metadata, ParquetSource source)
      throws IOException {
    for (RowGroupMetadata rg : metadata.rowGroups()) {
      if (rg.numRows() == 0 || rg.columns().isEmpty()) {
        continue;
      }
      for (PageInfo page : PageHeaderScanner.scan(source, rg.column(0), 2)) {
        if (page.isData()) {
          return page.kind() == PageInfo.Kind.DATA_V2
              ? WriterVersion.PARQUET_2_0
              : WriterVersion.PARQUET_1_0;
        }
      }
    }
    return versionFromEncodings(metadata);
  }

  /** Sorting columns shared by every row group, or none when they differ. */
  static List<SortingColumn> consistentSorting(List<RowGroupMetadata> rowGroups) {
    if (rowGroups.isEmpty()) {
      return List.of();
    }
    List<SortingColumn> first = rowGroups.get(0).sortingColumns();
    for (RowGroupMetadata rg : rowGroups) {
      if (!rg.sortingColumns().equals(first)) {
        return List.of();
      }
    }
    return first;
  }

  /** Most frequent key; ties go to the key seen first in enum order. */
  static <K extends Enum<K>> Optional<K> majority(Map<K, Integer> counts) {
    K best = null;
    int bestCount = 0;
    for (Map.Entry<K, Integer> e : counts.entrySet()) {
      if (e.getValue() > bestCount) {
        best = e.getKey();
        bestCount = e.getValue();
      }
    }
    return Optional.ofNullable(best);
  }

  private static Optional<Codec> codecOf(CompressionCodecName name) {
    try {
      return Optional.of(Codec.fromFooter(name));
    } catch (IllegalArgumentException e) {
      LOG.warnf("Keeping default compression for unsupported codec %s: %s", name, e.getMessage());
      return Optional.empty();
    }
  }
}
