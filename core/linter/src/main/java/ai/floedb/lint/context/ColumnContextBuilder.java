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

package ai.floedb.lint.context;

import ai.floedb.lint.cardinality.CardinalityEstimator;
import ai.floedb.lint.cardinality.ColumnCardinality;
import ai.floedb.lint.storage.ChunkStatistics;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import ai.floedb.lint.storage.FileMetadata;
import ai.floedb.lint.storage.GroupValues;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.RowBatch;
import ai.floedb.lint.storage.RowBatchStream;
import ai.floedb.lint.storage.RowGroupMetadata;
import ai.floedb.lint.types.ParquetTypeMapper;
import ai.floedb.lint.types.ValueComparators;
import ai.floedb.lint.types.ValueKind;
import ai.floedb.lint.types.ValueType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.IntLogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.jboss.logging.Logger;

/**
 * Builds one {@link ColumnContext} per leaf column from footer metadata and cardinality estimates.
 *
 * <p>Min/max come only from statistics the writer marked exact. On flat schemas, a single bounded
 * sample of the first non-empty row group then fills whatever min/max and byte-length statistics
 * are still missing, for all columns at once. Known values are never replaced by sampled ones.
 */
public final class ColumnContextBuilder {
  private static final Logger LOG = Logger.getLogger(ColumnContextBuilder.class);

  private ColumnContextBuilder() {}

  public static List<ColumnContext> build(ParquetSource source, FileMetadata metadata)
      throws IOException {
    return build(
        source,
        metadata,
        CardinalityEstimator.estimate(source, metadata),
        CardinalityEstimator.SAMPLE_ROWS);
  }

  public static List<ColumnContext> build(
      ParquetSource source,
      FileMetadata metadata,
      List<ColumnCardinality> cardinalities,
      int sampleRows)
      throws IOException {
    int numColumns = metadata.numColumns();
    if (cardinalities.size() != numColumns) {
      throw new IllegalArgumentException(
          "Expected " + numColumns + " cardinalities, got " + cardinalities.size());
    }

    List<Accumulator> accumulators = new ArrayList<>(numColumns);
    for (int c = 0; c < numColumns; c++) {
      Accumulator acc = new Accumulator(metadata.columns().get(c));
      for (RowGroupMetadata rg : metadata.rowGroups()) {
        acc.addChunk(rg.column(c));
      }
      accumulators.add(acc);
    }

    List<Integer> needSample = new ArrayList<>();
    for (int c = 0; c < numColumns; c++) {
      if (accumulators.get(c).needsSample()) {
        needSample.add(c);
      }
    }
    Optional<Integer> sampleRowGroup = CardinalityEstimator.sampleRowGroup(metadata);
    if (!needSample.isEmpty() && sampleRowGroup.isPresent()) {
      if (metadata.isFlat()) {
        sample(source, sampleRowGroup.get(), sampleRows, needSample, accumulators);
      } else {
        LOG.debugf(
            "Nested schema in %s, %d column(s) keep footer-only statistics",
            source.location(),
            needSample.size());
      }
    }

    List<ColumnContext> out = new ArrayList<>(numColumns);
    for (int c = 0; c < numColumns; c++) {
      out.add(accumulators.get(c).toContext(c, cardinalities.get(c)));
    }
    return out;
  }

  private static void sample(
      ParquetSource source,
      int rowGroup,
      int sampleRows,
      List<Integer> columns,
      List<Accumulator> accumulators)
      throws IOException {
    List<Accumulator> sampled = new ArrayList<>();
    for (int c : columns) {
      sampled.add(accumulators.get(c).startSample());
    }
    RowBatchStream.Options options =
        RowBatchStream.Options.sample(rowGroup, sampleRows, new LinkedHashSet<>(columns));
    long rows = 0;
    try (RowBatchStream stream = RowBatchStream.open(source, options)) {
      while (stream.hasNext()) {
        RowBatch batch = stream.next();
        for (Group row : batch.rows()) {
          for (int i = 0; i < sampled.size(); i++) {
            Object value = GroupValues.value(row, i);
            if (value != null) {
              sampled.get(i).offerSampled(value);
            }
          }
        }
        rows += batch.size();
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
    LOG.debugf(
        "Sampled %d row(s) of row group %d for %d column(s)", rows, rowGroup, columns.size());
    for (int c : columns) {
      accumulators.get(c).finishSample();
    }
  }

  /** Category of typed statistics a column gets. */
  private enum Category {
    BOOLEAN,
    INT,
    FLOAT,
    TEXT,
    BINARY,
    FIXED,
    UNKNOWN
  }

  private static final class Accumulator {
    private final ColumnDescriptor descriptor;
    private final ValueType valueType;
    private final Category category;
    private final boolean unsigned;
    private final int bitWidth;

    private long numValues;
    private long nullCount;
    private long uncompressedSize;
    private long compressedSize;
    private Object min;
    private Object max;
    private ByteLengthStats lengths;

    // Sample pass state.
    private Object sampleMin;
    private Object sampleMax;
    private long lengthCount;
    private long lengthTotal;
    private long lengthMin = Long.MAX_VALUE;
    private long lengthMax;

    Accumulator(ColumnDescriptor descriptor) {
      this.descriptor = descriptor;
      this.valueType = ParquetTypeMapper.map(descriptor);
      LogicalTypeAnnotation ann = descriptor.getPrimitiveType().getLogicalTypeAnnotation();
      switch (descriptor.getPrimitiveType().getPrimitiveTypeName()) {
        case BOOLEAN -> {
          category = Category.BOOLEAN;
          bitWidth = 1;
          unsigned = false;
        }
        case INT32, INT64 -> {
          category = Category.INT;
          int physical =
              descriptor.getPrimitiveType().getPrimitiveTypeName() == PrimitiveTypeName.INT32
                  ? 32
                  : 64;
          if (ann instanceof IntLogicalTypeAnnotation i) {
            bitWidth = i.getBitWidth();
            unsigned = !i.isSigned();
          } else {
            bitWidth = physical;
            unsigned = false;
          }
        }
        case FLOAT, DOUBLE -> {
          category = Category.FLOAT;
          bitWidth = valueType.kind() == ValueKind.DOUBLE ? 64 : 32;
          unsigned = false;
        }
        case BINARY -> {
          category = valueType.kind().isText() ? Category.TEXT : Category.BINARY;
          bitWidth = 0;
          unsigned = false;
        }
        case FIXED_LEN_BYTE_ARRAY -> {
          category = Category.FIXED;
          bitWidth = 0;
          unsigned = false;
        }
        default -> {
          category = Category.UNKNOWN;
          bitWidth = 0;
          unsigned = false;
        }
      }
    }

    void addChunk(ColumnChunkMetadata chunk) {
      numValues += Math.max(0, chunk.numValues());
      uncompressedSize += chunk.totalUncompressedSize();
      compressedSize += chunk.totalCompressedSize();
      ChunkStatistics stats = chunk.statistics();
      if (stats == null) {
        return;
      }
      if (stats.nullCount() != null && stats.nullCount() > 0) {
        nullCount += stats.nullCount();
      }
      if (stats.minExact() && stats.min() != null) {
        min = lower(min, normalize(stats.min()));
      }
      if (stats.maxExact() && stats.max() != null) {
        max = upper(max, normalize(stats.max()));
      }
    }

    boolean needsSample() {
      return switch (category) {
        case BOOLEAN, INT, FLOAT -> min == null || max == null;
        case TEXT, BINARY -> min == null || max == null || lengths == null;
        case FIXED, UNKNOWN -> false;
      };
    }

    Accumulator startSample() {
      sampleMin = null;
      sampleMax = null;
      return this;
    }

    void offerSampled(Object value) {
      Object v = normalize(value);
      sampleMin = lower(sampleMin, v);
      sampleMax = upper(sampleMax, v);
      if (v instanceof byte[] bytes) {
        lengthCount++;
        lengthTotal += bytes.length;
        lengthMin = Math.min(lengthMin, bytes.length);
        lengthMax = Math.max(lengthMax, bytes.length);
      }
    }

    void finishSample() {
      if (min == null) {
        min = sampleMin;
      }
      if (max == null) {
        max = sampleMax;
      }
      if (lengths == null && lengthCount > 0) {
        lengths = new ByteLengthStats(lengthMin, lengthMax, (double) lengthTotal / lengthCount);
      }
    }

    /** Brings a decoded value into the category's canonical form, or {@code null}. */
    private Object normalize(Object v) {
      switch (category) {
        case BOOLEAN:
          return v instanceof Boolean ? v : null;
        case INT:
          if (v instanceof Integer i) {
            return unsigned ? Integer.toUnsignedLong(i) : (long) i;
          }
          return v instanceof Long ? v : null;
        case FLOAT:
          if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
          }
          return null;
        case TEXT:
        case BINARY:
          return v instanceof byte[] ? v : null;
        default:
          return null;
      }
    }

    private Object lower(Object current, Object v) {
      if (v == null) {
        return current;
      }
      if (current == null) {
        return v;
      }
      if (category == Category.BOOLEAN) {
        return (Boolean) current && (Boolean) v;
      }
      return compare(v, current) < 0 ? v : current;
    }

    private Object upper(Object current, Object v) {
      if (v == null) {
        return current;
      }
      if (current == null) {
        return v;
      }
      if (category == Category.BOOLEAN) {
        return (Boolean) current || (Boolean) v;
      }
      return compare(v, current) > 0 ? v : current;
    }

    private int compare(Object a, Object b) {
      return switch (category) {
        case INT -> bitWidth == 64 && unsigned
            ? Long.compareUnsigned((Long) a, (Long) b)
            : Long.compare((Long) a, (Long) b);
        case FLOAT -> Double.compare((Double) a, (Double) b);
        case TEXT, BINARY -> ValueComparators.compareBytes((byte[]) a, (byte[]) b);
        default -> 0;
      };
    }

    ColumnContext toContext(int index, ColumnCardinality cardinality) {
      long nulls = Math.min(nullCount, numValues);
      long nonNull = numValues - nulls;
      long distinct = Math.min(cardinality.distinctCount(), nonNull);
      return new ColumnContext(
          index,
          FileMetadata.pathOf(descriptor),
          descriptor,
          valueType,
          numValues,
          nulls,
          distinct,
          uncompressedSize,
          compressedSize,
          typeStats());
    }

    private TypeStats typeStats() {
      return switch (category) {
        case BOOLEAN -> new TypeStats.BooleanStats((Boolean) min, (Boolean) max);
        case INT -> new TypeStats.IntStats(bitWidth, !unsigned, (Long) min, (Long) max);
        case FLOAT -> new TypeStats.FloatStats(bitWidth, (Double) min, (Double) max);
        case TEXT -> new TypeStats.TextStats(utf8((byte[]) min), utf8((byte[]) max), lengths);
        case BINARY -> new TypeStats.BinaryStats((byte[]) min, (byte[]) max, lengths);
        case FIXED -> new TypeStats.FixedLenBinaryStats(descriptor.getTypeLength());
        case UNKNOWN -> new TypeStats.UnknownStats();
      };
    }
  }

  /** Strict UTF-8 decoding; {@code null} for missing or malformed input. */
  static String utf8(byte[] bytes) {
    if (bytes == null) {
      return null;
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      LOG.debugf("Dropping text bound that is not valid UTF-8 (%d bytes)", bytes.length);
      return null;
    }
  }
}
