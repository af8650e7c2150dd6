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
import ai.floedb.lint.storage.ColumnChunkMetadata;
import java.util.ArrayList;
import java.util.List;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Suggests bloom filters for byte-array columns likely used in point lookups: UUIDs and other
 * high-cardinality values. The target NDV is the estimated distinct count.
 */
public final class BloomFilterRule implements Rule {

  static final double HIGH_CARDINALITY_RATIO = 0.5;

  @Override
  public String name() {
    return "bloom-filter-recommendation";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    for (ColumnContext column : ctx.columns()) {
      PrimitiveTypeName type = column.physicalType();
      if (type != PrimitiveTypeName.BINARY && type != PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY) {
        continue;
      }
      int nonEmpty = 0;
      int missing = 0;
      for (ColumnChunkMetadata chunk : ctx.chunks(column.columnIndex())) {
        if (chunk.numValues() == 0) {
          continue;
        }
        nonEmpty++;
        if (!chunk.hasBloomFilter()) {
          missing++;
        }
      }
      if (missing == 0) {
        continue;
      }
      boolean uuid =
          column.logicalType() instanceof LogicalTypeAnnotation.UUIDLogicalTypeAnnotation;
      if (!uuid && column.cardinalityRatio() <= HIGH_CARDINALITY_RATIO) {
        continue;
      }
      String message =
          uuid
              ? "UUID column missing bloom filters in "
                  + missing
                  + "/"
                  + nonEmpty
                  + " row groups; bloom filters enable fast point lookups"
              : "high-cardinality byte array column missing bloom filters in "
                  + missing
                  + "/"
                  + nonEmpty
                  + " row groups (~"
                  + column.distinctCount()
                  + " estimated distinct values)";
      out.add(
          new Diagnostic(
              name(),
              Severity.SUGGESTION,
              RuleContext.locate(column),
              message,
              Prescription.of(
                  new Directive.ColumnBloomFilter(column.path(), true),
                  new Directive.ColumnBloomFilterNdv(column.path(), column.distinctCount()))));
    }
    return out;
  }
}
