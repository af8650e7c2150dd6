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

/** Flags compressed columns whose data barely shrinks; compression then only costs CPU. */
public final class CompressionRatioRule implements Rule {

  static final double INCOMPRESSIBLE_RATIO = 0.95;

  @Override
  public String name() {
    return "low-compression-ratio";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    int totalGroups = ctx.rowGroups().size();
    for (ColumnContext column : ctx.columns()) {
      long compressed = 0;
      long uncompressed = 0;
      int groups = 0;
      CompressionCodecName codec = null;
      for (ColumnChunkMetadata chunk : ctx.chunks(column.columnIndex())) {
        if (chunk.codec() == CompressionCodecName.UNCOMPRESSED
            || chunk.totalUncompressedSize() <= 0) {
          continue;
        }
        compressed += chunk.totalCompressedSize();
        uncompressed += chunk.totalUncompressedSize();
        groups++;
        codec = chunk.codec();
      }
      if (uncompressed <= 0) {
        continue;
      }
      double ratio = (double) compressed / uncompressed;
      if (ratio <= INCOMPRESSIBLE_RATIO) {
        continue;
      }
      out.add(
          new Diagnostic(
              name(),
              Severity.WARNING,
              RuleContext.locate(column),
              String.format(
                  Locale.ROOT,
                  "aggregated compression ratio is %.2f (%s) across %d/%d row groups;"
                      + " data is nearly incompressible",
                  ratio,
                  codec,
                  groups,
                  totalGroups),
              Prescription.of(
                  new Directive.ColumnCompression(column.path(), Codec.uncompressed()))));
    }
    return out;
  }
}
