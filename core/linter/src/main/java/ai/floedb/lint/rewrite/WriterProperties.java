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
import ai.floedb.lint.storage.SortingColumn;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.parquet.column.ParquetProperties.WriterVersion;

/**
 * Physical write settings: file-level defaults plus per-column overrides keyed by dotted path.
 *
 * <p>Instances are immutable; use {@link #builder()} or {@link #toBuilder()}.
 */
public final class WriterProperties {
  public static final long DEFAULT_MAX_ROW_GROUP_SIZE = 1024 * 1024;
  public static final long DEFAULT_DATA_PAGE_SIZE_LIMIT = 1024 * 1024;
  public static final long DEFAULT_DICTIONARY_PAGE_SIZE_LIMIT = 1024 * 1024;
  public static final double DEFAULT_BLOOM_FILTER_FPP = 0.05;

  private final Codec compression;
  private final long maxRowGroupSize;
  private final long dataPageSizeLimit;
  private final long dictionaryPageSizeLimit;
  private final Integer statisticsTruncateLength;
  private final WriterVersion writerVersion;
  private final boolean dictionary;
  private final StatisticsLevel statistics;
  private final Map<String, String> keyValueMetadata;
  private final List<SortingColumn> sortingColumns;
  private final Map<String, ColumnProperties> columns;

  private WriterProperties(Builder b) {
    this.compression = b.compression;
    this.maxRowGroupSize = b.maxRowGroupSize;
    this.dataPageSizeLimit = b.dataPageSizeLimit;
    this.dictionaryPageSizeLimit = b.dictionaryPageSizeLimit;
    this.statisticsTruncateLength = b.statisticsTruncateLength;
    this.writerVersion = b.writerVersion;
    this.dictionary = b.dictionary;
    this.statistics = b.statistics;
    this.keyValueMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.keyValueMetadata));
    this.sortingColumns = List.copyOf(b.sortingColumns);
    this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(b.columns));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.compression = compression;
    b.maxRowGroupSize = maxRowGroupSize;
    b.dataPageSizeLimit = dataPageSizeLimit;
    b.dictionaryPageSizeLimit = dictionaryPageSizeLimit;
    b.statisticsTruncateLength = statisticsTruncateLength;
    b.writerVersion = writerVersion;
    b.dictionary = dictionary;
    b.statistics = statistics;
    b.keyValueMetadata.putAll(keyValueMetadata);
    b.sortingColumns = sortingColumns;
    b.columns.putAll(columns);
    return b;
  }

  public Codec compression() {
    return compression;
  }

  public long maxRowGroupSize() {
    return maxRowGroupSize;
  }

  public long dataPageSizeLimit() {
    return dataPageSizeLimit;
  }

  public long dictionaryPageSizeLimit() {
    return dictionaryPageSizeLimit;
  }

  /** Max bytes kept for min/max statistics, {@code null} for no truncation. */
  public Integer statisticsTruncateLength() {
    return statisticsTruncateLength;
  }

  public WriterVersion writerVersion() {
    return writerVersion;
  }

  public Map<String, String> keyValueMetadata() {
    return keyValueMetadata;
  }

  public List<SortingColumn> sortingColumns() {
    return sortingColumns;
  }

  /** Explicit per-column overrides, keyed by dotted path. */
  public Map<String, ColumnProperties> columns() {
    return columns;
  }

  private ColumnProperties column(String path) {
    return columns.getOrDefault(path, ColumnProperties.NONE);
  }

  public Codec compression(String path) {
    Codec c = column(path).compression();
    return c != null ? c : compression;
  }

  /** Explicit data encoding for the column, or {@code null} for the writer's default. */
  public DataEncoding encoding(String path) {
    return column(path).encoding();
  }

  public boolean dictionaryEnabled(String path) {
    Boolean d = column(path).dictionary();
    return d != null ? d : dictionary;
  }

  public long dictionaryPageSizeLimit(String path) {
    Long d = column(path).dictionaryPageSizeLimit();
    return d != null ? d : dictionaryPageSizeLimit;
  }

  public StatisticsLevel statistics(String path) {
    StatisticsLevel s = column(path).statistics();
    return s != null ? s : statistics;
  }

  public boolean bloomFilterEnabled(String path) {
    return Boolean.TRUE.equals(column(path).bloomFilter());
  }

  /** Target NDV for the column's bloom filter, {@code null} to size from the writer default. */
  public Long bloomFilterNdv(String path) {
    return column(path).bloomFilterNdv();
  }

  public double bloomFilterFpp(String path) {
    Double f = column(path).bloomFilterFpp();
    return f != null ? f : DEFAULT_BLOOM_FILTER_FPP;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WriterProperties that)) {
      return false;
    }
    return maxRowGroupSize == that.maxRowGroupSize
        && dataPageSizeLimit == that.dataPageSizeLimit
        && dictionaryPageSizeLimit == that.dictionaryPageSizeLimit
        && dictionary == that.dictionary
        && compression.equals(that.compression)
        && Objects.equals(statisticsTruncateLength, that.statisticsTruncateLength)
        && writerVersion == that.writerVersion
        && statistics == that.statistics
        && keyValueMetadata.equals(that.keyValueMetadata)
        && sortingColumns.equals(that.sortingColumns)
        && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        compression,
        maxRowGroupSize,
        dataPageSizeLimit,
        dictionaryPageSizeLimit,
        statisticsTruncateLength,
        writerVersion,
        dictionary,
        statistics,
        keyValueMetadata,
        sortingColumns,
        columns);
  }

  @Override
  public String toString() {
    return "WriterProperties{compression="
        + compression
        + ", maxRowGroupSize="
        + maxRowGroupSize
        + ", dataPageSizeLimit="
        + dataPageSizeLimit
        + ", statisticsTruncateLength="
        + statisticsTruncateLength
        + ", writerVersion="
        + writerVersion
        + ", columns="
        + columns
        + "}";
  }

  /** Mutable builder; setters return {@code this}. */
  public static final class Builder {
    private Codec compression = Codec.snappy();
    private long maxRowGroupSize = DEFAULT_MAX_ROW_GROUP_SIZE;
    private long dataPageSizeLimit = DEFAULT_DATA_PAGE_SIZE_LIMIT;
    private long dictionaryPageSizeLimit = DEFAULT_DICTIONARY_PAGE_SIZE_LIMIT;
    private Integer statisticsTruncateLength;
    private WriterVersion writerVersion = WriterVersion.PARQUET_1_0;
    private boolean dictionary = true;
    private StatisticsLevel statistics = StatisticsLevel.PAGE;
    private final Map<String, String> keyValueMetadata = new LinkedHashMap<>();
    private List<SortingColumn> sortingColumns = List.of();
    private final Map<String, ColumnProperties> columns = new LinkedHashMap<>();

    private Builder() {}

    public Builder compression(Codec codec) {
      this.compression = Objects.requireNonNull(codec, "codec");
      return this;
    }

    public Builder maxRowGroupSize(long rows) {
      if (rows <= 0) {
        throw new IllegalArgumentException("max_row_group_size must be positive");
      }
      this.maxRowGroupSize = rows;
      return this;
    }

    public Builder dataPageSizeLimit(long bytes) {
      if (bytes <= 0 || bytes > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("data_page_size_limit out of range: " + bytes);
      }
      this.dataPageSizeLimit = bytes;
      return this;
    }

    public Builder dictionaryPageSizeLimit(long bytes) {
      this.dictionaryPageSizeLimit = checkPageSize(bytes);
      return this;
    }

    public Builder statisticsTruncateLength(Integer length) {
      this.statisticsTruncateLength = length;
      return this;
    }

    public Builder writerVersion(WriterVersion version) {
      this.writerVersion = Objects.requireNonNull(version, "version");
      return this;
    }

    public Builder dictionary(boolean enabled) {
      this.dictionary = enabled;
      return this;
    }

    public Builder statistics(StatisticsLevel level) {
      this.statistics = Objects.requireNonNull(level, "level");
      return this;
    }

    public Builder keyValueMetadata(Map<String, String> metadata) {
      this.keyValueMetadata.clear();
      this.keyValueMetadata.putAll(metadata);
      return this;
    }

    public Builder sortingColumns(List<SortingColumn> sorting) {
      this.sortingColumns = List.copyOf(sorting);
      return this;
    }

    public Builder columnCompression(String path, Codec codec) {
      columns.put(path, column(path).withCompression(codec));
      return this;
    }

    public Builder columnEncoding(String path, DataEncoding encoding) {
      columns.put(path, column(path).withEncoding(encoding));
      return this;
    }

    public Builder columnDictionary(String path, boolean enabled) {
      columns.put(path, column(path).withDictionary(enabled));
      return this;
    }

    public Builder columnDictionaryPageSizeLimit(String path, long bytes) {
      columns.put(path, column(path).withDictionaryPageSizeLimit(checkPageSize(bytes)));
      return this;
    }

    public Builder columnStatistics(String path, StatisticsLevel level) {
      columns.put(path, column(path).withStatistics(level));
      return this;
    }

    public Builder columnBloomFilter(String path, boolean enabled) {
      columns.put(path, column(path).withBloomFilter(enabled));
      return this;
    }

    public Builder columnBloomFilterNdv(String path, long ndv) {
      columns.put(path, column(path).withBloomFilterNdv(ndv));
      return this;
    }

    public Builder columnBloomFilterFpp(String path, double fpp) {
      if (!(fpp > 0.0 && fpp < 1.0)) {
        throw new IllegalArgumentException("bloom_filter_fpp must be in (0, 1): " + fpp);
      }
      columns.put(path, column(path).withBloomFilterFpp(fpp));
      return this;
    }

    public WriterProperties build() {
      return new WriterProperties(this);
    }

    private ColumnProperties column(String path) {
      return columns.getOrDefault(Objects.requireNonNull(path, "path"), ColumnProperties.NONE);
    }

    private static long checkPageSize(long bytes) {
      if (bytes <= 0 || bytes > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("page size limit out of range: " + bytes);
      }
      return bytes;
    }
  }
}
