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
import ai.floedb.lint.prescription.Directive;
import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.rule.Rule;
import ai.floedb.lint.rule.RuleContext;
import ai.floedb.lint.storage.ChunkStatistics;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import java.util.ArrayList;
import java.util.List;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/** Flags untruncated byte-array statistics that bloat the footer and page index. */
public final class StringStatisticsRule implements Rule {

  static final int MAX_STAT_LENGTH = 64;

  @Override
  public String name() {
    return "oversized-string-statistics";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    int totalGroups = ctx.rowGroups().size();
    for (ColumnContext column : ctx.columns()) {
      if (column.physicalType() != PrimitiveTypeName.BINARY) {
        continue;
      }
      int affected = 0;
      int peakMin = 0;
      int peakMax = 0;
      for (ColumnChunkMetadata chunk : ctx.chunks(column.columnIndex())) {
        ChunkStatistics stats = chunk.statistics();
        if (stats == null) {
          continue;
        }
        int minLength = stats.minExact() ? length(stats.minBytes()) : 0;
        int maxLength = stats.maxExact() ? length(stats.maxBytes()) : 0;
        if (minLength > MAX_STAT_LENGTH || maxLength > MAX_STAT_LENGTH) {
          affected++;
          peakMin = Math.max(peakMin, minLength);
          peakMax = Math.max(peakMax, maxLength);
        }
      }
      if (affected == 0) {
        continue;
      }
      out.add(
          new Diagnostic(
              name(),
              Severity.WARNING,
              RuleContext.locate(column),
              "string statistics are large (up to min: "
                  + peakMin
                  + "B, max: "
                  + peakMax
                  + "B) in "
                  + affected
                  + "/"
                  + totalGroups
                  + " row groups and untruncated; consider truncating to "
                  + MAX_STAT_LENGTH
                  + " bytes",
              Prescription.of(new Directive.FileStatisticsTruncateLength(MAX_STAT_LENGTH))));
    }
    return out;
  }

  private static int length(byte[] bytes) {
    return bytes == null ? 0 : bytes.length;
  }
}
