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
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Suggests BYTE_STREAM_SPLIT for scalar FLOAT/DOUBLE columns stored as PLAIN. Low-cardinality
 * columns are left to the dictionary rule.
 */
public final class FloatEncodingRule implements Rule {

  static final double MIN_CARDINALITY_RATIO = 0.1;

  @Override
  public String name() {
    return "float-byte-stream-split";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    for (ColumnContext column : ctx.columns()) {
      PrimitiveTypeName type = column.physicalType();
      if ((type != PrimitiveTypeName.FLOAT && type != PrimitiveTypeName.DOUBLE)
          || column.isRepeated()
          || column.cardinalityRatio() < MIN_CARDINALITY_RATIO) {
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
            && !ChunkEncodings.usesAny(
                chunk, Encoding.BYTE_STREAM_SPLIT, Encoding.DELTA_BINARY_PACKED)) {
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
                  "scalar float column uses PLAIN without BYTE_STREAM_SPLIT in %d/%d row groups"
                      + " (cardinality %s); BYTE_STREAM_SPLIT typically compresses 2-4x better",
                  plainGroups,
                  nonEmpty,
                  ChunkEncodings.percent(column.cardinalityRatio())),
              Prescription.of(
                  new Directive.ColumnEncoding(column.path(), DataEncoding.BYTE_STREAM_SPLIT))));
    }
    return out;
  }
}
