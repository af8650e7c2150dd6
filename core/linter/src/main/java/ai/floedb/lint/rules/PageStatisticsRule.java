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
import ai.floedb.lint.prescription.StatisticsLevel;
import ai.floedb.lint.rule.Rule;
import ai.floedb.lint.rule.RuleContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Asks for a page-level column index wherever a row group lacks one. */
public final class PageStatisticsRule implements Rule {

  @Override
  public String name() {
    return "missing-page-statistics";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    int totalGroups = ctx.rowGroups().size();
    for (ColumnContext column : ctx.columns()) {
      long missing =
          ctx.chunks(column.columnIndex()).stream()
              .filter(c -> !c.hasColumnIndex())
              .count();
      if (missing == 0) {
        continue;
      }
      out.add(
          new Diagnostic(
              name(),
              Severity.WARNING,
              RuleContext.locate(column),
              String.format(
                  Locale.ROOT,
                  "no page-level column index found in %d/%d row groups;"
                      + " page statistics are missing",
                  missing,
                  totalGroups),
              Prescription.of(
                  new Directive.ColumnStatistics(column.path(), StatisticsLevel.PAGE))));
    }
    return out;
  }
}
