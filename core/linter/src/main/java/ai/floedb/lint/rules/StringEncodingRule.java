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

package ai.floedb.lint.rules;

import ai.floedb.lint.context.ColumnContext;
import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.prescription.DataEncoding;
import ai.floedb.lint.prescription.Directive;
import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.rule.Rule;
import ai.floedb.lint.rule.RuleContext;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Suggests DELTA_LENGTH_BYTE_ARRAY without a dictionary for text columns that mix dictionary and
 * PLAIN pages, when their size profile shows the dictionary is not paying for itself.
 *
 * <p>Two profiles qualify: a few large chunks with moderate compression, or many small chunks
 * with weaker compression.
 */
public final class StringEncodingRule implements Rule {

  static final long MIN_TOTAL_BYTES = 32L * 1024 * 1024;
  static final int MIN_NON_EMPTY_GROUPS = 2;
  static final int MAX_NON_EMPTY_GROUPS = 32;
  static final long MIN_AVG_CHUNK_BYTES = 4L * 1024 * 1024;
  static final double MIN_RATIO = 0.35;
  static final double MAX_RATIO = 0.75;

  static final long SMALL_CHUNK_MIN_TOTAL_BYTES = 64L * 1024 * 1024;
  static final int SMALL_CHUNK_MIN_GROUPS = 64;
  static final long SMALL_CHUNK_MAX_AVG_BYTES = 1024L * 1024;
  static final double SMALL_CHUNK_MIN_RATIO = 0.55;
  static final double SMALL_CHUNK_MAX_RATIO = 0.85;

  @Override
  public String name() {
    return "string-byte-array-encoding";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    int totalGroups = ctx.rowGroups().size();
    for (ColumnContext column : ctx.columns()) {
      if (column.physicalType() != PrimitiveTypeName.BINARY || !looksLikeText(column)) {
        continue;
      }
      long uncompressed = 0;
      long compressed = 0;
      int nonEmpty = 0;
      boolean plain = false;
      boolean dictionary = false;
      boolean delta = false;
      for (ColumnChunkMetadata chunk : ctx.chunks(column.columnIndex())) {
        if (chunk.totalUncompressedSize() > 0) {
          uncompressed += chunk.totalUncompressedSize();
          nonEmpty++;
        }
        if (chunk.totalCompressedSize() > 0) {
          compressed += chunk.totalCompressedSize();
        }
        plain |= ChunkEncodings.usesAny(chunk, Encoding.PLAIN);
        dictionary |= chunk.usesDictionaryEncoding();
        delta |=
            ChunkEncodings.usesAny(
                chunk, Encoding.DELTA_BYTE_ARRAY, Encoding.DELTA_LENGTH_BYTE_ARRAY);
      }
      if (!plain || !dictionary || delta || uncompressed <= 0 || compressed <= 0) {
        continue;
      }
      double ratio = (double) compressed / uncompressed;
      if (!matchesProfile(uncompressed, nonEmpty, ratio)) {
        continue;
      }
      out.add(
          new Diagnostic(
              name(),
              Severity.SUGGESTION,
              RuleContext.locate(column),
              String.format(
                  Locale.ROOT,
                  "text column (%s across %d/%d row groups, ratio %.2f) uses dictionary/plain"
                      + " pages; try DELTA_LENGTH_BYTE_ARRAY and disable dictionary",
                  ChunkEncodings.megabytes(uncompressed),
                  nonEmpty,
                  totalGroups,
                  ratio),
              Prescription.of(
                  new Directive.ColumnDictionary(column.path(), false),
                  new Directive.ColumnEncoding(
                      column.path(), DataEncoding.DELTA_LENGTH_BYTE_ARRAY))));
    }
    return out;
  }

  static boolean matchesProfile(long totalBytes, int nonEmptyGroups, double ratio) {
    if (nonEmptyGroups == 0) {
      return false;
    }
    long avgChunk = totalBytes / nonEmptyGroups;
    boolean fewLargeChunks =
        totalBytes >= MIN_TOTAL_BYTES
            && nonEmptyGroups >= MIN_NON_EMPTY_GROUPS
            && nonEmptyGroups <= MAX_NON_EMPTY_GROUPS
            && avgChunk >= MIN_AVG_CHUNK_BYTES
            && ratio >= MIN_RATIO
            && ratio <= MAX_RATIO;
    boolean manySmallChunks =
        totalBytes >= SMALL_CHUNK_MIN_TOTAL_BYTES
            && nonEmptyGroups >= SMALL_CHUNK_MIN_GROUPS
            && avgChunk > 0
            && avgChunk <= SMALL_CHUNK_MAX_AVG_BYTES
            && ratio >= SMALL_CHUNK_MIN_RATIO
            && ratio <= SMALL_CHUNK_MAX_RATIO;
    return fewLargeChunks || manySmallChunks;
  }

  /** Text annotations qualify; otherwise anything not named like raw bytes, images or vectors. */
  static boolean looksLikeText(ColumnContext column) {
    LogicalTypeAnnotation logical = column.logicalType();
    if (logical instanceof LogicalTypeAnnotation.StringLogicalTypeAnnotation
        || logical instanceof LogicalTypeAnnotation.JsonLogicalTypeAnnotation
        || logical instanceof LogicalTypeAnnotation.EnumLogicalTypeAnnotation
        || logical instanceof LogicalTypeAnnotation.BsonLogicalTypeAnnotation) {
      return true;
    }
    String path = column.path().toLowerCase(Locale.ROOT);
    return !(path.contains("bytes") || path.contains("embedding") || path.contains("image"));
  }
}
