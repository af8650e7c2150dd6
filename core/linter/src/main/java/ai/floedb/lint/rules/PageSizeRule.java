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

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Location;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.prescription.Directive;
import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.rule.Rule;
import ai.floedb.lint.rule.RuleContext;
import ai.floedb.lint.storage.RowGroupMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Caps row groups at 64K rows and 256 MB compressed, and pins a 1 MB data page limit. */
public final class PageSizeRule implements Rule {

  static final long MAX_ROWS_PER_ROW_GROUP = 64L * 1024;
  static final long MAX_ROW_GROUP_BYTES = 256L * 1024 * 1024;
  static final long IDEAL_DATA_PAGE_SIZE = 1024L * 1024;
  static final long HARD_MAX_DATA_PAGE_SIZE = 4L * 1024 * 1024;

  /** Row-group cap and how many row groups broke each ceiling. */
  record Suggestion(long targetMaxRows, int oversizedRowGroups, int oversizedByteGroups) {}

  @Override
  public String name() {
    return "page-row-group-size";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<RowGroupMetadata> rowGroups = ctx.rowGroups();
    Optional<Suggestion> suggestion = suggest(rowGroups);
    if (suggestion.isEmpty()) {
      return List.of();
    }
    Suggestion s = suggestion.get();
    return List.of(
        new Diagnostic(
            name(),
            Severity.WARNING,
            Location.file(),
            message(s, rowGroups.size()),
            Prescription.of(
                new Directive.FileMaxRowGroupSize(s.targetMaxRows()),
                new Directive.FileDataPageSizeLimit(IDEAL_DATA_PAGE_SIZE))));
  }

  static Optional<Suggestion> suggest(List<RowGroupMetadata> rowGroups) {
    int oversizedRows = 0;
    int oversizedBytes = 0;
    long target = MAX_ROWS_PER_ROW_GROUP;
    for (RowGroupMetadata rg : rowGroups) {
      if (rg.numRows() > MAX_ROWS_PER_ROW_GROUP) {
        oversizedRows++;
      }
      if (rg.compressedSize() > MAX_ROW_GROUP_BYTES) {
        oversizedBytes++;
        if (rg.numRows() > 0) {
          // Scale rows so the compressed size trends under the ceiling.
          long scaled =
              (long) Math.floor((double) rg.numRows() * MAX_ROW_GROUP_BYTES / rg.compressedSize());
          target = Math.min(target, Math.max(scaled, 1));
        }
      }
    }
    if (oversizedRows == 0 && oversizedBytes == 0) {
      return Optional.empty();
    }
    return Optional.of(new Suggestion(target, oversizedRows, oversizedBytes));
  }

  static String message(Suggestion s, int totalRowGroups) {
    List<String> parts = new ArrayList<>();
    if (s.oversizedRowGroups() > 0) {
      parts.add(
          s.oversizedRowGroups()
              + "/"
              + totalRowGroups
              + " row group(s) exceed "
              + MAX_ROWS_PER_ROW_GROUP / 1024
              + "K rows");
    }
    if (s.oversizedByteGroups() > 0) {
      parts.add(
          s.oversizedByteGroups()
              + "/"
              + totalRowGroups
              + " row group(s) exceed "
              + MAX_ROW_GROUP_BYTES / 1024 / 1024
              + "MB compressed");
    }
    return String.join("; ", parts)
        + "; set max_row_group_size="
        + s.targetMaxRows()
        + " ("
        + MAX_ROWS_PER_ROW_GROUP / 1024
        + "K rows). Recommended data_page_size_limit="
        + IDEAL_DATA_PAGE_SIZE / 1024 / 1024
        + "MB (hard max "
        + HARD_MAX_DATA_PAGE_SIZE / 1024 / 1024
        + "MB).";
  }
}
