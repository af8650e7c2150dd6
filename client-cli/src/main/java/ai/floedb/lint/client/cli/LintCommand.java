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

package ai.floedb.lint.client.cli;

import ai.floedb.lint.ParquetLinter;
import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.rule.LintOptions;
import ai.floedb.lint.storage.ParquetSources;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "floelint",
    mixinStandardHelpOptions = true,
    version = "floelint 0.1",
    description = "Lint a Parquet file's physical layout",
    subcommands = {RewriteCommand.class})
public class LintCommand implements Callable<Integer> {

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(
      index = "0",
      arity = "0..1",
      paramLabel = "FILE",
      description = "File path or URI")
  String file;

  @CommandLine.Option(
      names = {"--rules"},
      split = ",",
      description = "Only run these rules (comma-separated)")
  List<String> rules;

  @CommandLine.Option(
      names = {"--severity"},
      description = "Minimum severity to display (or set FLOELINT_SEVERITY)")
  String severity = System.getenv().getOrDefault("FLOELINT_SEVERITY", "suggestion");

  @CommandLine.Option(
      names = {"--gpu"},
      description = "Enable GPU scan checks (or set FLOELINT_GPU=true)")
  boolean gpu = Boolean.parseBoolean(System.getenv().getOrDefault("FLOELINT_GPU", "false"));

  @CommandLine.Option(
      names = {"--json"},
      description = "Print diagnostics as JSON")
  boolean json;

  @CommandLine.Option(
      names = {"--export-prescription"},
      paramLabel = "FILE",
      description = "Write the merged prescription of the shown diagnostics to FILE")
  Path exportPrescription;

  @Override
  public Integer call() throws Exception {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    if (file == null) {
      throw new CommandLine.ParameterException(spec.commandLine(), "Missing FILE to lint");
    }
    Severity floor;
    try {
      floor = Severity.fromString(severity);
    } catch (IllegalArgumentException e) {
      throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
    }

    LintOptions options = LintOptions.defaults().withGpu(gpu);
    List<Diagnostic> diagnostics = ParquetLinter.lint(ParquetSources.open(file), rules, options);
    List<Diagnostic> shown =
        diagnostics.stream().filter(d -> d.severity().compareTo(floor) >= 0).toList();

    if (exportPrescription != null) {
      Prescription merged = ParquetLinter.mergePrescriptions(shown);
      merged
          .validate()
          .ifPresent(
              c ->
                  err.println(
                      "Prescription contains conflicting directives (exporting for review"
                          + " anyway): "
                          + c));
      PrescriptionFiles.write(exportPrescription, merged, json ? err : out);
    }

    if (json) {
      DiagnosticPrinter.printJson(shown, out);
    } else {
      DiagnosticPrinter.printText(shown, out);
    }
    out.flush();
    return ParquetLinter.hasWarningsOrErrors(diagnostics) ? 1 : 0;
  }
}
