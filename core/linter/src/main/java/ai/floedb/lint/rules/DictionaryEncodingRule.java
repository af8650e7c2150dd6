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
import ai.floedb.lint.storage.ChunkEncodingStats;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import ai.floedb.lint.storage.PageHeaderScanner;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.RowGroupMetadata;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.jboss.logging.Logger;

/**
 * Matches dictionary usage to estimated cardinality.
 *
 * <p>Each non-empty chunk is classified from its encoding stats, then from its encoding set where
 * that proves the state. Chunks left {@link DictionaryState#AMBIGUOUS} are partly resolved by
 * reading their data page headers: 5% of them, at least one, spread evenly. The rest stay
 * unresolved and never produce a warning.
 *
 * <p>A fallback to PLAIN with high cardinality disables the dictionary; with moderate cardinality
 * the dictionary page limit is raised to fit, shrinking row groups when even the cap is too small.
 * Columns that never use a dictionary despite low cardinality are asked to enable one.
 */
public final class DictionaryEncodingRule implements Rule {
  private static final Logger LOG = Logger.getLogger(DictionaryEncodingRule.class);

  static final double HIGH_CARDINALITY_RATIO = 0.5;
  static final double LOW_CARDINALITY_RATIO = 0.1;
  static final long MIN_DICTIONARY_PAGE_SIZE = 2L * 1024 * 1024;
  static final long MAX_DICTIONARY_PAGE_SIZE = 16L * 1024 * 1024;
  static final double DICTIONARY_HEADROOM = 1.25;
  static final double AMBIGUOUS_SAMPLE_FRACTION = 0.05;

  /** Dictionary state of one column chunk. */
  enum DictionaryState {
    NO_DICTIONARY,
    DICTIONARY_ONLY,
    FALLBACK,
    AMBIGUOUS;

    boolean provesDictionary() {
      return this == DICTIONARY_ONLY || this == FALLBACK;
    }
  }

  @Override
  public String name() {
    return "dictionary-encoding-cardinality";
  }

  @Override
  public List<Diagnostic> check(RuleContext ctx) {
    List<Diagnostic> out = new ArrayList<>();
    int totalGroups = ctx.rowGroups().size();
    for (ColumnContext column : ctx.columns()) {
      if (column.nonNullCount() == 0 || column.physicalType() == PrimitiveTypeName.BOOLEAN) {
        continue;
      }
      List<ColumnChunkMetadata> chunks = new ArrayList<>();
      for (ColumnChunkMetadata chunk : ctx.chunks(column.columnIndex())) {
        if (chunk.numValues() > 0) {
          chunks.add(chunk);
        }
      }
      if (chunks.isEmpty()) {
        continue;
      }
      List<DictionaryState> states = classify(ctx.source(), column, chunks);

      double ratio = column.cardinalityRatio();
      int fallbacks = 0;
      long largestFallback = 0;
      boolean provenDictionary = false;
      boolean provenNoDictionary = false;
      for (int i = 0; i < chunks.size(); i++) {
        DictionaryState state = states.get(i);
        if (state == DictionaryState.FALLBACK) {
          fallbacks++;
          largestFallback = Math.max(largestFallback, chunks.get(i).totalUncompressedSize());
        }
        provenDictionary |= state.provesDictionary();
        provenNoDictionary |= state == DictionaryState.NO_DICTIONARY;
      }

      String cardinality =
          String.format(
              Locale.ROOT,
              "~%d distinct / %d total = %s",
              column.distinctCount(),
              column.nonNullCount(),
              ChunkEncodings.percent(ratio));
      if (fallbacks > 0) {
        out.add(
            fallbackDiagnostic(
                ctx, column, fallbacks, totalGroups, largestFallback, ratio, cardinality));
      } else if (!provenDictionary && provenNoDictionary && ratio < LOW_CARDINALITY_RATIO) {
        out.add(
            new Diagnostic(
                name(),
                Severity.SUGGESTION,
                RuleContext.locate(column),
                "low cardinality (" + cardinality + "), consider enabling dictionary encoding",
                Prescription.of(new Directive.ColumnDictionary(column.path(), true))));
      }
    }
    return out;
  }

  private Diagnostic fallbackDiagnostic(
      RuleContext ctx,
      ColumnContext column,
      int fallbacks,
      int totalGroups,
      long largestFallback,
      double ratio,
      String cardinality) {
    String where =
        "dictionary fell back to plain in " + fallbacks + "/" + totalGroups + " row groups; ";
    if (ratio > HIGH_CARDINALITY_RATIO) {
      return new Diagnostic(
          name(),
          Severity.WARNING,
          RuleContext.locate(column),
          where
              + "estimated cardinality is high ("
              + cardinality
              + "), dictionary encoding is not beneficial",
          Prescription.of(new Directive.ColumnDictionary(column.path(), false)));
    }

    double estimate = largestFallback * ratio * DICTIONARY_HEADROOM;
    long size = dictionaryPageSize(estimate);
    String sizing =
        "estimated cardinality is moderate ("
            + cardinality
            + "), dictionary page size may be too small (estimated dictionary "
            + ChunkEncodings.megabytes((long) estimate)
            + ")";
    if (size <= MAX_DICTIONARY_PAGE_SIZE) {
      return new Diagnostic(
          name(),
          Severity.WARNING,
          RuleContext.locate(column),
          where + sizing,
          Prescription.of(new Directive.ColumnDictionaryPageSizeLimit(column.path(), size)));
    }

    long largestRows =
        ctx.rowGroups().stream().mapToLong(RowGroupMetadata::numRows).max().orElse(1);
    long rows = Math.max(1, (long) Math.floor(largestRows * MAX_DICTIONARY_PAGE_SIZE / estimate));
    return new Diagnostic(
        name(),
        Severity.WARNING,
        RuleContext.locate(column),
        where
            + sizing
            + "; dictionary exceeds the "
            + ChunkEncodings.megabytes(MAX_DICTIONARY_PAGE_SIZE)
            + " cap, shrink row groups to "
            + rows
            + " rows",
        Prescription.of(
            new Directive.ColumnDictionaryPageSizeLimit(column.path(), MAX_DICTIONARY_PAGE_SIZE),
            new Directive.FileMaxRowGroupSize(rows)));
  }

  /**
   * Power-of-two dictionary page size, starting from the 2 MB floor, that holds {@code estimate}
   * bytes. Returns the first step past the cap when the estimate does not fit under it.
   */
  static long dictionaryPageSize(double estimate) {
    long size = MIN_DICTIONARY_PAGE_SIZE;
    while (size < estimate && size <= MAX_DICTIONARY_PAGE_SIZE) {
      size *= 2;
    }
    return size;
  }

  static List<DictionaryState> classify(
      ParquetSource source, ColumnContext column, List<ColumnChunkMetadata> chunks) {
    List<DictionaryState> states = new ArrayList<>(chunks.size());
    List<Integer> ambiguous = new ArrayList<>();
    for (int i = 0; i < chunks.size(); i++) {
      DictionaryState state = fromFooter(chunks.get(i));
      states.add(state);
      if (state == DictionaryState.AMBIGUOUS) {
        ambiguous.add(i);
      }
    }
    if (ambiguous.isEmpty()) {
      return states;
    }

    int resolved = 0;
    if (source != null) {
      for (int pick : sampleIndexes(ambiguous.size())) {
        int index = ambiguous.get(pick);
        ColumnChunkMetadata chunk = chunks.get(index);
        try {
          states.set(index, fromDataPages(PageHeaderScanner.dataPageEncodings(source, chunk)));
          resolved++;
        } catch (IOException | RuntimeException e) {
          LOG.debugf(e, "Page header scan failed for %s, leaving it unresolved", chunk.path());
        }
      }
    }
    if (resolved < ambiguous.size()) {
      LOG.warnf(
          "Dictionary state of %s unresolved in %d of %d ambiguous row group(s)",
          column.path(),
          ambiguous.size() - resolved,
          ambiguous.size());
    }
    return states;
  }

  /** Positions, in {@code [0, count)}, of the ambiguous chunks to scan. */
  static List<Integer> sampleIndexes(int count) {
    int picks = Math.max(1, (int) Math.floor(count * AMBIGUOUS_SAMPLE_FRACTION));
    List<Integer> out = new ArrayList<>(picks);
    for (int i = 0; i < picks; i++) {
      out.add((int) ((long) i * count / picks));
    }
    return out;
  }

  static DictionaryState fromFooter(ColumnChunkMetadata chunk) {
    ChunkEncodingStats stats = chunk.encodingStats();
    if (stats != null && stats.dataPageCount() > 0) {
      boolean dictionary = stats.hasDictionaryEncodedDataPages();
      boolean plain = stats.hasPlainDataPages();
      if (dictionary && plain) {
        return DictionaryState.FALLBACK;
      }
      return dictionary ? DictionaryState.DICTIONARY_ONLY : DictionaryState.NO_DICTIONARY;
    }
    if (!chunk.usesDictionaryEncoding()) {
      return DictionaryState.NO_DICTIONARY;
    }
    if (!chunk.encodings().contains(Encoding.PLAIN)) {
      return DictionaryState.DICTIONARY_ONLY;
    }
    return DictionaryState.AMBIGUOUS;
  }

  static DictionaryState fromDataPages(List<Encoding> encodings) {
    boolean dictionary = encodings.stream().anyMatch(Encoding::usesDictionary);
    boolean plain = encodings.stream().anyMatch(e -> !e.usesDictionary());
    if (dictionary && plain) {
      return DictionaryState.FALLBACK;
    }
    return dictionary ? DictionaryState.DICTIONARY_ONLY : DictionaryState.NO_DICTIONARY;
  }
}
