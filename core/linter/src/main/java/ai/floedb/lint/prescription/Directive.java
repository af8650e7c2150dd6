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

package ai.floedb.lint.prescription;

import ai.floedb.lint.rewrite.WriterProperties;
import java.math.BigDecimal;

/**
 * One physical-property change. File-scope directives set writer defaults; column-scope
 * directives override them for one dotted column path.
 *
 * <p>{@link #toString()} is the directive's DSL text. Two directives conflict when they share a
 * {@link #conflictKey()} but differ in {@link #conflictValue()}.
 */
public sealed interface Directive permits Directive.FileDirective, Directive.ColumnDirective {

  /** DSL property name. */
  String property();

  /** Canonical payload text. */
  String conflictValue();

  /** {@code file <property>} or {@code column <path> <property>}. */
  String conflictKey();

  /** Folds this directive into {@code builder}. */
  void applyTo(WriterProperties.Builder builder);

  /** Scope of a file-wide directive. */
  sealed interface FileDirective extends Directive
      permits FileCompression,
          FileMaxRowGroupSize,
          FileDataPageSizeLimit,
          FileStatisticsTruncateLength {

    @Override
    default String conflictKey() {
      return "file " + property();
    }

    default String text() {
      return "set file " + property() + " " + conflictValue();
    }
  }

  /** Scope of a single-column directive. */
  sealed interface ColumnDirective extends Directive
      permits ColumnCompression,
          ColumnEncoding,
          ColumnDictionary,
          ColumnDictionaryPageSizeLimit,
          ColumnStatistics,
          ColumnBloomFilter,
          ColumnBloomFilterNdv,
          ColumnBloomFilterFpp {

    String column();

    @Override
    default String conflictKey() {
      return "column " + column() + " " + property();
    }

    default String text() {
      return "set column " + column() + " " + property() + " " + conflictValue();
    }
  }

  record FileCompression(Codec codec) implements FileDirective {
    @Override
    public String property() {
      return "compression";
    }

    @Override
    public String conflictValue() {
      return codec.toString();
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.compression(codec);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record FileMaxRowGroupSize(long rows) implements FileDirective {
    @Override
    public String property() {
      return "max_row_group_size";
    }

    @Override
    public String conflictValue() {
      return Long.toString(rows);
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.maxRowGroupSize(rows);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record FileDataPageSizeLimit(long bytes) implements FileDirective {
    @Override
    public String property() {
      return "data_page_size_limit";
    }

    @Override
    public String conflictValue() {
      return Long.toString(bytes);
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.dataPageSizeLimit(bytes);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  /** {@code length == null} disables truncation. */
  record FileStatisticsTruncateLength(Integer length) implements FileDirective {
    @Override
    public String property() {
      return "statistics_truncate_length";
    }

    @Override
    public String conflictValue() {
      return length == null ? "none" : Integer.toString(length);
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.statisticsTruncateLength(length);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnCompression(String column, Codec codec) implements ColumnDirective {
    @Override
    public String property() {
      return "compression";
    }

    @Override
    public String conflictValue() {
      return codec.toString();
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnCompression(column, codec);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnEncoding(String column, DataEncoding encoding) implements ColumnDirective {
    @Override
    public String property() {
      return "encoding";
    }

    @Override
    public String conflictValue() {
      return encoding.toString();
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnEncoding(column, encoding);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnDictionary(String column, boolean enabled) implements ColumnDirective {
    @Override
    public String property() {
      return "dictionary";
    }

    @Override
    public String conflictValue() {
      return Boolean.toString(enabled);
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnDictionary(column, enabled);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnDictionaryPageSizeLimit(String column, long bytes) implements ColumnDirective {
    @Override
    public String property() {
      return "dictionary_page_size_limit";
    }

    @Override
    public String conflictValue() {
      return Long.toString(bytes);
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnDictionaryPageSizeLimit(column, bytes);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnStatistics(String column, StatisticsLevel level) implements ColumnDirective {
    @Override
    public String property() {
      return "statistics";
    }

    @Override
    public String conflictValue() {
      return level.toString();
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnStatistics(column, level);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnBloomFilter(String column, boolean enabled) implements ColumnDirective {
    @Override
    public String property() {
      return "bloom_filter";
    }

    @Override
    public String conflictValue() {
      return Boolean.toString(enabled);
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnBloomFilter(column, enabled);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnBloomFilterNdv(String column, long ndv) implements ColumnDirective {
    @Override
    public String property() {
      return "bloom_filter_ndv";
    }

    @Override
    public String conflictValue() {
      return Long.toString(ndv);
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnBloomFilterNdv(column, ndv);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  record ColumnBloomFilterFpp(String column, double fpp) implements ColumnDirective {
    @Override
    public String property() {
      return "bloom_filter_fpp";
    }

    @Override
    public String conflictValue() {
      return BigDecimal.valueOf(fpp).stripTrailingZeros().toPlainString();
    }

    @Override
    public void applyTo(WriterProperties.Builder builder) {
      builder.columnBloomFilterFpp(column, fpp);
    }

    @Override
    public String toString() {
      return text();
    }
  }
}
