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

package ai.floedb.lint.cardinality;

import ai.floedb.lint.storage.ColumnChunkMetadata;
import ai.floedb.lint.storage.FileMetadata;
import ai.floedb.lint.storage.GroupValues;
import ai.floedb.lint.storage.PageHeaderScanner;
import ai.floedb.lint.storage.PageInfo;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.RowBatch;
import ai.floedb.lint.storage.RowBatchStream;
import ai.floedb.lint.storage.RowGroupMetadata;
import ai.floedb.lint.types.ParquetTypeMapper;
import ai.floedb.lint.types.ValueKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.example.data.Group;
import org.jboss.logging.Logger;

/**
 * Per-column distinct-count estimation with bounded I/O.
 *
 * <p>Each column is resolved by the first tier that succeeds:
 *
 * <ol>
 *   <li>the distinct count declared in the sample row group's chunk statistics,
 *   <li>the entry count of the sample chunk's dictionary page,
 *   <li>hashing up to {@code sampleRows} values of the sample row group (flat schemas only),
 *   <li>every non-null value assumed distinct.
 * </ol>
 *
 * The sample row group is the first one with rows. Tiers 1 to 3 are scaled from the sample to the
 * file total by {@link #scaleDistinct}.
 */
public final class CardinalityEstimator {
  private static final Logger LOG = Logger.getLogger(CardinalityEstimator.class);

  public static final int SAMPLE_ROWS = 16_384;

  private CardinalityEstimator() {}

  public static List<ColumnCardinality> estimate(ParquetSource source, FileMetadata metadata)
      throws IOException {
    return estimate(source, metadata, SAMPLE_ROWS);
  }

  /** One estimate per leaf column, in leaf order. */
  public static List<ColumnCardinality> estimate(
      ParquetSource source, FileMetadata metadata, int sampleRows) throws IOException {
    int numColumns = metadata.numColumns();
    long[] totals = nonNullTotals(metadata);
    ColumnCardinality[] result = new ColumnCardinality[numColumns];
    Optional<Integer> sample = sampleRowGroup(metadata);
    if (sample.isEmpty()) {
      List<ColumnCardinality> empty = new ArrayList<>(numColumns);
      for (int c = 0; c < numColumns; c++) {
        empty.add(ColumnCardinality.unique(totals[c]));
      }
      return empty;
    }
    RowGroupMetadata rg = metadata.rowGroups().get(sample.get());

    for (int c = 0; c < numColumns; c++) {
      ColumnChunkMetadata chunk = rg.column(c);
      long sampleNonNull = nonNullCount(chunk);
      if (sampleNonNull == 0) {
        continue;
      }
      Long declared = chunk.statistics() == null ? null : chunk.statistics().distinctCount();
      if (declared != null && declared >= 0) {
        long distinct = scaleDistinct(Math.min(declared, sampleNonNull), sampleNonNull, totals[c]);
        result[c] = new ColumnCardinality(distinct, totals[c]);
        LOG.debugf("%s: declared distinct count %d -> %d", chunk.path(), declared, distinct);
        continue;
      }
      OptionalLong dict = dictionaryEntries(source, chunk);
      if (dict.isPresent()) {
        long entries = dict.getAsLong();
        long distinct =
            Math.max(
                scaleDistinct(Math.min(entries, sampleNonNull), sampleNonNull, totals[c]),
                Math.min(entries, totals[c]));
        result[c] = new ColumnCardinality(distinct, totals[c]);
        LOG.debugf("%s: dictionary page with %d entries -> %d", chunk.path(), entries, distinct);
      }
    }

    List<Integer> unresolved = new ArrayList<>();
    for (int c = 0; c < numColumns; c++) {
      if (result[c] == null) {
        unresolved.add(c);
      }
    }
    if (!unresolved.isEmpty()) {
      if (metadata.isFlat()) {
        sample(source, metadata, sample.get(), sampleRows, unresolved, totals, result);
      } else {
        LOG.debugf(
            "Nested schema in %s, %d column(s) assumed fully unique",
            source.location(),
            unresolved.size());
      }
    }

    List<ColumnCardinality> out = new ArrayList<>(numColumns);
    for (int c = 0; c < numColumns; c++) {
      out.add(result[c] != null ? result[c] : ColumnCardinality.unique(totals[c]));
    }
    return out;
  }

  /** Index of the first row group with rows, if any. */
  public static Optional<Integer> sampleRowGroup(FileMetadata metadata) {
    List<RowGroupMetadata> rowGroups = metadata.rowGroups();
    for (int i = 0; i < rowGroups.size(); i++) {
      if (rowGroups.get(i).numRows() > 0) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  /** Non-null values of a chunk; a null count above the value count saturates to 0. */
  public static long nonNullCount(ColumnChunkMetadata chunk) {
    if (chunk.numValues() <= 0) {
      return 0;
    }
    return chunk.nonNullCount();
  }

  static long[] nonNullTotals(FileMetadata metadata) {
    long[] totals = new long[metadata.numColumns()];
    for (RowGroupMetadata rg : metadata.rowGroups()) {
      for (int c = 0; c < totals.length; c++) {
        totals[c] += nonNullCount(rg.column(c));
      }
    }
    return totals;
  }

  /**
   * Scales a sample's distinct count to the file: {@code floor(sample / sampleTotal * fullTotal)},
   * floored at {@code sample} and capped at {@code fullTotal}. Returns {@code fullTotal} when
   * either total is 0.
   */
  public static long scaleDistinct(long sample, long sampleTotal, long fullTotal) {
    if (sampleTotal == 0 || fullTotal == 0) {
      return fullTotal;
    }
    double ratio = (double) sample / sampleTotal;
    long scaled = (long) (ratio * fullTotal);
    return Math.min(Math.max(scaled, sample), fullTotal);
  }

  private static OptionalLong dictionaryEntries(
      ParquetSource source, ColumnChunkMetadata chunk) {
    try {
      Optional<PageInfo> first = PageHeaderScanner.firstPage(source, chunk);
      if (first.isPresent() && first.get().isDictionary()) {
        return OptionalLong.of(first.get().numValues());
      }
    } catch (IOException | RuntimeException e) {
      LOG.debugf(e, "%s: dictionary page unavailable", chunk.path());
    }
    return OptionalLong.empty();
  }

  private static void sample(
      ParquetSource source,
      FileMetadata metadata,
      int rowGroup,
      int sampleRows,
      List<Integer> columns,
      long[] totals,
      ColumnCardinality[] result)
      throws IOException {
    List<Set<Object>> sets = new ArrayList<>();
    long[] sampleNonNull = new long[columns.size()];
    boolean[] unknown = new boolean[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      sets.add(new HashSet<>());
      ColumnDescriptor descriptor = metadata.columns().get(columns.get(i));
      unknown[i] = ParquetTypeMapper.map(descriptor).kind() == ValueKind.UNKNOWN;
    }

    RowBatchStream.Options options =
        RowBatchStream.Options.sample(rowGroup, sampleRows, new LinkedHashSet<>(columns));
    long position = 0;
    try (RowBatchStream stream = RowBatchStream.open(source, options)) {
      while (stream.hasNext()) {
        RowBatch batch = stream.next();
        for (Group row : batch.rows()) {
          // Flat schema: projected field i is leaf columns.get(i).
          for (int i = 0; i < columns.size(); i++) {
            if (row.getFieldRepetitionCount(i) == 0) {
              continue;
            }
            sampleNonNull[i]++;
            sets.get(i).add(unknown[i] ? Long.valueOf(position) : GroupValues.hashKey(row, i));
          }
          position++;
        }
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }

    for (int i = 0; i < columns.size(); i++) {
      int c = columns.get(i);
      if (sampleNonNull[i] == 0) {
        continue;
      }
      long sampleDistinct = sets.get(i).size();
      long distinct = scaleDistinct(sampleDistinct, sampleNonNull[i], totals[c]);
      result[c] = new ColumnCardinality(distinct, totals[c]);
      LOG.debugf(
          "%s: sampled %d distinct of %d -> %d",
          metadata.columns().get(c),
          sampleDistinct,
          sampleNonNull[i],
          distinct);
    }
  }
}
