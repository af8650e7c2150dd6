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

/** Suggests DELTA_BINARY_PACKED for scalar DATE and TIMESTAMP integer columns stored as PLAIN. */
public final class TimestampEncodingRule implements Rule {

  @Override
  public String name() {
    return "timestamp-delta-encoding";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    for (ColumnContext column : ctx.columns()) {
      if (!isTemporalInteger(column) || column.isRepeated()) {
        continue;
      }
      int nonEmpty = 0;
      int plainGroups = 0;
      for (ColumnChunkMetadata chunk : ctx.chunks(column.columnIndex())) {
        if (chunk.numValues() == 0) {
          continue;
        }
        nonEmpty++;
        if (ChunkEncodings.hasPlainDataPages(chunk)
            && !ChunkEncodings.usesAny(chunk, Encoding.DELTA_BINARY_PACKED)) {
          plainGroups++;
        }
      }
      if (plainGroups == 0) {
        continue;
      }
      out.add(
          new Diagnostic(
              name(),
              Severity.SUGGESTION,
              RuleContext.locate(column),
              String.format(
                  Locale.ROOT,
                  "timestamp/date column uses PLAIN without DELTA_BINARY_PACKED in %d/%d row"
                      + " groups; DELTA_BINARY_PACKED is typically more efficient for temporal"
                      + " data",
                  plainGroups,
                  nonEmpty),
              Prescription.of(
                  new Directive.ColumnEncoding(
                      column.path(), DataEncoding.DELTA_BINARY_PACKED))));
    }
    return out;
  }

  static boolean isTemporalInteger(ColumnContext column) {
    PrimitiveTypeName type = column.physicalType();
    if (type != PrimitiveTypeName.INT32 && type != PrimitiveTypeName.INT64) {
      return false;
    }
    LogicalTypeAnnotation logical = column.logicalType();
    return logical instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation
        || logical instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation;
  }
}
