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

package ai.floedb.lint;

import ai.floedb.lint.cardinality.CardinalityEstimator;
import ai.floedb.lint.cardinality.ColumnCardinality;
import ai.floedb.lint.context.ColumnContext;
import ai.floedb.lint.context.ColumnContextBuilder;
import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.rewrite.ParquetRewriter;
import ai.floedb.lint.rule.LintEngine;
import ai.floedb.lint.rule.LintOptions;
import ai.floedb.lint.rule.Rule;
import ai.floedb.lint.rule.RuleContext;
import ai.floedb.lint.rule.RuleRegistry;
import ai.floedb.lint.storage.FileMetadata;
import ai.floedb.lint.storage.ParquetMetadataReader;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.ParquetSources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/**
 * Entry points for linting and rewriting Parquet files.
 *
 * <p>Each call is one blocking task: footer read, column contexts, rules in sequence. The async
 * variants run that task on the caller's executor; I/O failures then complete the future
 * exceptionally with an {@link UncheckedIOException}.
 */
public final class ParquetLinter {
  private static final Logger LOG = Logger.getLogger(ParquetLinter.class);

  private ParquetLinter() {}

  /** Runs every rule with default options. */
  public static List<Diagnostic> lint(String locator) throws IOException {
    return lint(locator, null);
  }

  /**
   * Runs the named rules with default options; {@code null} runs all.
   *
   * @throws IllegalArgumentException if the locator's scheme is unsupported
   */
  public static List<Diagnostic> lint(String locator, Collection<String> ruleNames)
      throws IOException {
    return lint(ParquetSources.open(locator), ruleNames, LintOptions.defaults());
  }

  /** Loads metadata, builds column contexts and runs the selected rules, sorted by severity. */
  public static List<Diagnostic> lint(
      ParquetSource source, Collection<String> ruleNames, LintOptions options) throws IOException {
    LintOptions opts = options == null ? LintOptions.defaults() : options;
    List<Rule> rules = RuleRegistry.select(ruleNames);
    FileMetadata metadata = ParquetMetadataReader.read(source);
    List<ColumnCardinality> cardinalities =
        CardinalityEstimator.estimate(source, metadata, opts.sampleRows());
    List<ColumnContext> columns =
        ColumnContextBuilder.build(source, metadata, cardinalities, opts.sampleRows());
    List<Diagnostic> diagnostics =
        LintEngine.run(rules, new RuleContext(metadata, columns, source, opts));
    LOG.debugf(
        "Linted %s with %d rule(s): %d diagnostic(s)",
        source.location(),
        rules.size(),
        diagnostics.size());
    return diagnostics;
  }

  public static CompletableFuture<List<Diagnostic>> lintAsync(
      ParquetSource source, Collection<String> ruleNames, LintOptions options, Executor executor) {
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            return lint(source, ruleNames, options);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        },
        executor);
  }

  /**
   * Rewrites {@code locator} into {@code outputPath} with the prescription overlaid on the
   * properties inferred from the source.
   */
  public static void rewrite(String locator, Path outputPath, Prescription prescription)
      throws IOException {
    ParquetRewriter.rewrite(ParquetSources.open(locator), outputPath, prescription);
  }

  public static CompletableFuture<Void> rewriteAsync(
      String locator, Path outputPath, Prescription prescription, Executor executor) {
    return CompletableFuture.runAsync(
        () -> {
          try {
            rewrite(locator, outputPath, prescription);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        },
        executor);
  }

  public static boolean hasWarningsOrErrors(Collection<Diagnostic> diagnostics) {
    return diagnostics.stream().anyMatch(d -> d.severity() != Severity.SUGGESTION);
  }

  /** Concatenates every diagnostic's prescription, in diagnostic order. */
  public static Prescription mergePrescriptions(Collection<Diagnostic> diagnostics) {
    return Prescription.merge(diagnostics.stream().map(Diagnostic::prescription).toList());
  }
}
