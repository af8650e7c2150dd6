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
import ai.floedb.lint.storage.RowGroupMetadata;
import java.util.ArrayList;
import java.util.List;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Treats repeated FLOAT/DOUBLE leaves with many values per row as embedding vectors and asks for
 * smaller data pages, which favor random-access lookups.
 */
public final class VectorEmbeddingRule implements Rule {

  // Much smaller pages over-fragment full scans.
  static final long SMALL_PAGE_SIZE = 256L * 1024;
  static final long MIN_ELEMENTS_PER_ROW = 64;

  @Override
  public String name() {
    return "vector-embedding-page-size";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    for (ColumnContext column : ctx.columns()) {
      PrimitiveTypeName type = column.physicalType();
      if ((type != PrimitiveTypeName.FLOAT && type != PrimitiveTypeName.DOUBLE)
          || !column.isRepeated()) {
        continue;
      }
      long rows = 0;
      long values = 0;
      for (RowGroupMetadata rg : ctx.rowGroups()) {
        if (rg.numRows() <= 0) {
          continue;
        }
        rows += rg.numRows();
        values += rg.column(column.columnIndex()).numValues();
      }
      if (rows <= 0) {
        continue;
      }
      long perRow = values / rows;
      if (perRow < MIN_ELEMENTS_PER_ROW) {
        continue;
      }
      out.add(
          new Diagnostic(
              name(),
              Severity.WARNING,
              RuleContext.locate(column),
              "column looks like a vector embedding ("
                  + perRow
                  + " values/row on average), consider smaller page size for random-access"
                  + " lookups",
              Prescription.of(new Directive.FileDataPageSizeLimit(SMALL_PAGE_SIZE))));
    }
    return out;
  }
}
