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
import ai.floedb.lint.prescription.Codec;
import ai.floedb.lint.prescription.Directive;
import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.rule.Rule;
import ai.floedb.lint.rule.RuleContext;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Recommends ZSTD level 3 for columns on other codecs, or LZ4_RAW where decompression speed
 * matters more than size: large SNAPPY chunks and many small moderately compressible byte-array
 * chunks. Whichever path covers more row groups wins.
 */
public final class CompressionCodecRule implements Rule {

  static final long LARGE_CHUNK_BYTES = 4L * 1024 * 1024;
  static final long MIN_COLUMN_BYTES_FOR_ZSTD = 8L * 1024 * 1024;
  static final long MIN_TEXT_BYTES_FOR_LZ4 = 32L * 1024 * 1024;
  static final double MAX_SNAPPY_RATIO_FOR_ZSTD = 0.90;
  static final double INCOMPRESSIBLE_RATIO_ZSTD = 0.95;
  static final double INCOMPRESSIBLE_RATIO_LZ4 = 0.98;
  static final int SMALL_CHUNK_MIN_GROUPS = 64;
  static final long SMALL_CHUNK_MAX_AVG_BYTES = 1024L * 1024;
  static final double SMALL_CHUNK_MIN_RATIO = 0.55;
  static final double SMALL_CHUNK_MAX_RATIO = 0.85;
  static final int TARGET_ZSTD_LEVEL = 3;

  private enum Target {
    ZSTD("recommend switching to ZSTD level 3", Severity.SUGGESTION),
    LZ4("recommend switching to LZ4 for faster decompression", Severity.WARNING);

    final String advice;
    final Severity severity;

    Target(String advice, Severity severity) {
      this.advice = advice;
      this.severity = severity;
    }

    Codec codec() {
      return this == ZSTD ? Codec.zstd(TARGET_ZSTD_LEVEL) : Codec.lz4Raw();
    }
  }

  /** Row groups tallied for one target, with the first offending codec and its reason. */
  private static final class Tally {
    int groups;
    CompressionCodecName sample;
    String reason;

    void count(CompressionCodecName codec, String why) {
      groups++;
      if (sample == null) {
        sample = codec;
        reason = why;
      }
    }

    void clear() {
      groups = 0;
      sample = null;
      reason = null;
    }
  }

  @Override
  public String name() {
    return "compression-codec-upgrade";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    int totalGroups = ctx.rowGroups().size();
    for (ColumnContext column : ctx.columns()) {
      List<ColumnChunkMetadata> chunks = ctx.chunks(column.columnIndex());
      if (chunks.isEmpty()) {
        continue;
      }

      long totalUncompressed = 0;
      long totalCompressed = 0;
      int nonEmpty = 0;
      Tally zstd = new Tally();
      Tally lz4 = new Tally();
      for (ColumnChunkMetadata chunk : chunks) {
        if (chunk.totalUncompressedSize() > 0) {
          totalUncompressed += chunk.totalUncompressedSize();
          nonEmpty++;
        }
        if (chunk.totalCompressedSize() > 0) {
          totalCompressed += chunk.totalCompressedSize();
        }
        CompressionCodecName codec = chunk.codec();
        if (codec == CompressionCodecName.SNAPPY
            && chunk.totalUncompressedSize() > LARGE_CHUNK_BYTES) {
          lz4.count(codec, "large column chunks are decompression-sensitive");
        } else if (codec != CompressionCodecName.ZSTD) {
          zstd.count(codec, "default compression policy prefers ZSTD level 3");
        }
      }
      Double ratio =
          totalUncompressed > 0 && totalCompressed > 0
              ? (double) totalCompressed / totalUncompressed
              : null;

      boolean smallFast = isSmallFastByteArray(column, chunks, nonEmpty, totalUncompressed, ratio);
      if (smallFast) {
        zstd.clear();
        lz4.clear();
        for (ColumnChunkMetadata chunk : chunks) {
          if (chunk.totalUncompressedSize() > 0 && chunk.codec() == CompressionCodecName.SNAPPY) {
            lz4.count(chunk.codec(), "many small byte-array chunks favor decompression speed");
          }
        }
      }

      if (totalUncompressed < MIN_COLUMN_BYTES_FOR_ZSTD || !benefitsFromZstd(column)) {
        zstd.clear();
      }
      if (chunks.get(0).codec() == CompressionCodecName.SNAPPY
          && ratio != null
          && ratio >= MAX_SNAPPY_RATIO_FOR_ZSTD) {
        zstd.clear();
      }
      if (ratio != null && ratio > INCOMPRESSIBLE_RATIO_ZSTD) {
        zstd.clear();
      }
      // Many small chunks stand on their own count; the size floor guards the large-chunk path.
      if (!smallFast
          && column.valueType().kind().isText()
          && totalUncompressed < MIN_TEXT_BYTES_FOR_LZ4) {
        lz4.clear();
      }
      if (ratio != null && ratio > INCOMPRESSIBLE_RATIO_LZ4) {
        lz4.clear();
      }

      Target target;
      Tally chosen;
      if (lz4.groups > zstd.groups) {
        target = Target.LZ4;
        chosen = lz4;
      } else if (zstd.sample != null) {
        target = Target.ZSTD;
        chosen = zstd;
      } else {
        continue;
      }

      String message =
          String.format(
              Locale.ROOT,
              "using %s in %d/%d row groups; %s; %s (column size %s)",
              chosen.sample,
              chosen.groups,
              totalGroups,
              chosen.reason,
              target.advice,
              ChunkEncodings.megabytes(totalUncompressed));
      out.add(
          new Diagnostic(
              name(),
              target.severity,
              RuleContext.locate(column),
              message,
              Prescription.of(new Directive.ColumnCompression(column.path(), target.codec()))));
    }
    return out;
  }

  /** Booleans and flat floating-point columns gain little from a stronger codec. */
  static boolean benefitsFromZstd(ColumnContext column) {
    PrimitiveTypeName type = column.physicalType();
    if (type == PrimitiveTypeName.BOOLEAN) {
      return false;
    }
    boolean nested = column.isRepeated() || column.descriptor().getPath().length > 1;
    return !((type == PrimitiveTypeName.FLOAT || type == PrimitiveTypeName.DOUBLE) && !nested);
  }

  private static boolean isSmallFastByteArray(
      ColumnContext column,
      List<ColumnChunkMetadata> chunks,
      int nonEmpty,
      long totalUncompressed,
      Double ratio) {
    if (column.physicalType() != PrimitiveTypeName.BINARY
        || nonEmpty < SMALL_CHUNK_MIN_GROUPS
        || ratio == null
        || ratio < SMALL_CHUNK_MIN_RATIO
        || ratio > SMALL_CHUNK_MAX_RATIO
        || totalUncompressed / nonEmpty >= SMALL_CHUNK_MAX_AVG_BYTES) {
      return false;
    }
    return chunks.stream()
        .filter(c -> c.totalUncompressedSize() > 0)
        .allMatch(
            c ->
                c.codec() == CompressionCodecName.SNAPPY
                    || c.codec() == CompressionCodecName.LZ4_RAW);
  }
}
