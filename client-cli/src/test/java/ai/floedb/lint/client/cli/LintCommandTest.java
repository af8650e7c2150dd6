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

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class LintCommandTest {

  @TempDir Path tmp;

  private final StringWriter out = new StringWriter();
  private final StringWriter err = new StringWriter();

  private int run(String... args) {
    return new CommandLine(new LintCommand())
        .setOut(new PrintWriter(out, true))
        .setErr(new PrintWriter(err, true))
        .execute(args);
  }

  @Test
  void cleanFileExitsZero() throws Exception {
    Path file = CliFiles.write(tmp, "small.parquet", 100, true);

    int code = run(file.toString(), "--rules", "page-row-group-size");

    assertThat(code).isZero();
    assertThat(out.toString()).contains("No issues found.");
  }

  @Test
  void warningsExitOne() throws Exception {
    Path file = CliFiles.write(tmp, "tall.parquet", 70_000, true);

    int code = run(file.toString(), "--rules", "page-row-group-size");

    assertThat(code).isEqualTo(1);
    assertThat(out.toString())
        .contains("[warning] page-row-group-size @ file: 1/1 row group(s) exceed 64K rows")
        .contains("  fix: set file max_row_group_size 65536")
        .contains("1 issue(s) found.");
  }

  @Test
  void severityFloorHidesSuggestionsButExitCodeIgnoresIt() throws Exception {
    Path file = CliFiles.write(tmp, "plain.parquet", 2000, false);

    int shown = run(file.toString(), "--rules", "dictionary-encoding-cardinality");
    String all = out.toString();
    out.getBuffer().setLength(0);
    int hidden =
        run(file.toString(), "--rules", "dictionary-encoding-cardinality", "--severity", "warning");

    assertThat(shown).isZero();
    assertThat(all)
        .contains("[suggestion] dictionary-encoding-cardinality @ column[1](name): low cardinality")
        .contains("fix: set column name dictionary true");
    assertThat(hidden).isZero();
    assertThat(out.toString()).contains("No issues found.");
  }

  @Test
  void jsonOutput() throws Exception {
    Path file = CliFiles.write(tmp, "tall.parquet", 70_000, true);

    run(file.toString(), "--rules", "page-row-group-size", "--json");

    JsonNode array = new ObjectMapper().readTree(out.toString());
    assertThat(array.isArray()).isTrue();
    assertThat(array).hasSize(1);
    JsonNode d = array.get(0);
    assertThat(d.get("rule").asText()).isEqualTo("page-row-group-size");
    assertThat(d.get("severity").asText()).isEqualTo("warning");
    assertThat(d.get("location").get("kind").asText()).isEqualTo("file");
    assertThat(d.get("prescription").get(0).asText())
        .isEqualTo("set file max_row_group_size 65536");
  }

  @Test
  void exportsThePrescriptionOfShownDiagnostics() throws Exception {
    Path file = CliFiles.write(tmp, "tall.parquet", 70_000, true);
    Path exported = tmp.resolve("fix.txt");

    run(
        file.toString(),
        "--rules",
        "page-row-group-size",
        "--export-prescription",
        exported.toString());

    assertThat(Files.readString(exported, StandardCharsets.UTF_8))
        .isEqualTo("set file max_row_group_size 65536\nset file data_page_size_limit 1048576\n");
    assertThat(out.toString()).contains("Wrote prescription to " + exported);
  }

  @Test
  void usageErrors() throws Exception {
    Path file = CliFiles.write(tmp, "small.parquet", 10, true);

    assertThat(run()).isEqualTo(2);
    assertThat(err.toString()).contains("Missing FILE to lint");

    assertThat(run(file.toString(), "--severity", "fatal")).isEqualTo(2);
    assertThat(err.toString()).contains("Unknown severity 'fatal'");
  }
}
