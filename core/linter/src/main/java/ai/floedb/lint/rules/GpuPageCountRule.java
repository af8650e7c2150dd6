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
import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.rule.Rule;
import ai.floedb.lint.rule.RuleContext;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import ai.floedb.lint.storage.PageHeaderScanner;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.RowGroupMetadata;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import org.jboss.logging.Logger;

/**
 * GPU scans parallelize over pages, so each row group should hold at least {@value
 * #RECOMMENDED_PAGES_PER_ROW_GROUP} pages. Runs only when {@code LintOptions.gpu} is set and emits
 * no fixes.
 */
public final class GpuPageCountRule implements Rule {
  private static final Logger LOG = Logger.getLogger(GpuPageCountRule.class);

  static final int RECOMMENDED_PAGES_PER_ROW_GROUP = 100;

  /** Pages of one non-empty column chunk. */
  record ChunkPages(int columnIndex, String path, int pages) {}

  @Override
  public String name() {
    return "gpu-page-count";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    if (!ctx.options().gpu()) {
      return List.of();
    }
    int numColumns = ctx.metadata().numColumns();
    int totalGroups = ctx.rowGroups().size();
    long[] columnPages = new long[numColumns];
    int[] columnGroups = new int[numColumns];
    String[] paths = new String[numColumns];
    int unreadable = 0;
    int firstBad = -1;
    int firstBadPages = 0;
    int firstBadColumns = 0;

    for (RowGroupMetadata rg : ctx.rowGroups()) {
      if (rg.numRows() <= 0) {
        continue;
      }
      List<ChunkPages> counts;
      try {
        counts = countPages(ctx.source(), rg);
      } catch (IOException e) {
        LOG.debugf(e, "Could not count pages of row group %d", rg.ordinal());
        unreadable++;
        continue;
      }
      int pages = 0;
      for (ChunkPages c : counts) {
        pages += c.pages();
        columnPages[c.columnIndex()] += c.pages();
        columnGroups[c.columnIndex()]++;
        paths[c.columnIndex()] = c.path();
      }
      if (pages < RECOMMENDED_PAGES_PER_ROW_GROUP && firstBad < 0) {
        firstBad = rg.ordinal();
        firstBadPages = pages;
        firstBadColumns = counts.size();
      }
    }

    List<Diagnostic> out = new ArrayList<>();
    if (firstBad >= 0) {
      for (int i = 0; i < numColumns; i++) {
        if (columnGroups[i] == 0) {
          continue;
        }
        double avg = (double) columnPages[i] / columnGroups[i];
        out.add(
            new Diagnostic(
                name(),
                Severity.WARNING,
                Location.column(i, paths[i]),
                String.format(
                    Locale.ROOT,
                    "page count detail: this column averages %.1f pages per non-empty row group"
                        + " (%d total pages across %d/%d row groups); for GPU scans, Parquet is"
                        + " recommended to have more than %d pages in each row group",
                    avg,
                    columnPages[i],
                    columnGroups[i],
                    totalGroups,
                    RECOMMENDED_PAGES_PER_ROW_GROUP),
                Prescription.empty()));
      }
      if (out.isEmpty()) {
        out.add(
            new Diagnostic(
                name(),
                Severity.WARNING,
                Location.rowGroup(firstBad),
                "page count check failed for row_group["
                    + firstBad
                    + "] ("
                    + firstBadPages
                    + " total pages across "
                    + firstBadColumns
                    + " non-empty column chunks); column averages unavailable",
                Prescription.empty()));
      }
    }
    if (unreadable > 0) {
      out.add(
          new Diagnostic(
              name(),
              Severity.WARNING,
              Location.file(),
              "page count check could not read page counts for "
                  + unreadable
                  + " row groups; "
                  + (firstBad >= 0 ? "column averages" : "results")
                  + " may be incomplete",
              Prescription.empty()));
    }
    return out;
  }

  /**
   * Pages per non-empty chunk of {@code rg}: offset index entries plus the dictionary page when
   * the file has a page index, otherwise a header scan of the chunk.
   */
  static List<ChunkPages> countPages(ParquetSource source, RowGroupMetadata rg)
      throws IOException {
    if (source == null) {
      throw new IOException("No source to read page headers from");
    }
    List<ChunkPages> out = new ArrayList<>();
    for (ColumnChunkMetadata chunk : rg.columns()) {
      if (chunk.numValues() == 0) {
        continue;
      }
      OptionalInt indexed = PageHeaderScanner.pageCountFromOffsetIndex(source, chunk);
      int pages;
      if (indexed.isPresent()) {
        pages = indexed.getAsInt() + (chunk.hasDictionaryPage() ? 1 : 0);
      } else {
        pages = PageHeaderScanner.scan(source, chunk).size();
      }
      out.add(new ChunkPages(chunk.columnIndex(), chunk.path(), pages));
    }
    return out;
  }
}
