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
import ai.floedb.lint.prescription.Prescription;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "rewrite",
    mixinStandardHelpOptions = true,
    description = "Rewrite a Parquet file using lint results or a prescription file")
public class RewriteCommand implements Callable<Integer> {

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "File path or URI")
  String file;

  @CommandLine.Option(
      names = {"-o", "--output"},
      required = true,
      description = "Output file path")
  Path output;

  @CommandLine.Option(
      names = {"--rules"},
      split = ",",
      description = "Only apply fixes from these rules (comma-separated)")
  List<String> rules;

  @CommandLine.Option(
      names = {"--from-prescription"},
      paramLabel = "FILE",
      description = "Apply a prescription file directly, without linting")
  Path fromPrescription;

  @CommandLine.Option(
      names = {"--dry-run"},
      description = "Show the directives that would be applied without writing")
  boolean dryRun;

  @CommandLine.Option(
      names = {"--export-prescription"},
      paramLabel = "FILE",
      description = "Write the merged prescription to FILE")
  Path exportPrescription;

  @Override
  public Integer call() throws Exception {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    if (fromPrescription != null && rules != null) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "--rules cannot be used with --from-prescription");
    }

    Prescription prescription;
    String origin;
    if (fromPrescription != null) {
      prescription = PrescriptionFiles.read(fromPrescription);
      origin = " from " + fromPrescription;
      if (prescription.isEmpty()) {
        out.println("No directives to apply.");
        return 0;
      }
    } else {
      List<Diagnostic> diagnostics = ParquetLinter.lint(file, rules);
      prescription = ParquetLinter.mergePrescriptions(diagnostics);
      origin = "";
      if (prescription.isEmpty()) {
        out.println("No fixes to apply.");
        return 0;
      }
      for (Diagnostic d : diagnostics) {
        if (!d.prescription().isEmpty()) {
          out.println(d);
          out.println();
        }
      }
    }

    prescription
        .validate()
        .ifPresent(
            c ->
                err.println(
                    "Conflicting directives detected; continuing with last directive wins: " + c));
    if (exportPrescription != null) {
      PrescriptionFiles.write(exportPrescription, prescription, out);
    }

    if (dryRun) {
      out.println(
          "Dry run: " + prescription.size() + " directive(s) would be applied" + origin + ":");
      out.println(prescription);
      return 0;
    }
    ParquetLinter.rewrite(file, output, prescription);
    out.println(
        "Applied " + prescription.size() + " directive(s)" + origin + ", wrote " + output);
    return 0;
  }
}
