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

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Location;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.prescription.Directive;
import ai.floedb.lint.prescription.Prescription;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticPrinterTest {

  private static final Diagnostic COLUMN =
      new Diagnostic(
          "bloom-filter-recommendation",
          Severity.SUGGESTION,
          Location.column(2, "a.b"),
          "missing bloom filters",
          Prescription.of(
              new Directive.ColumnBloomFilter("a.b", true),
              new Directive.ColumnBloomFilterNdv("a.b", 42)));

  private static final Diagnostic ROW_GROUP =
      new Diagnostic("gpu-page-count", Severity.WARNING, Location.rowGroup(4), "few pages", null);

  @Test
  void textListsEachDiagnosticAndACount() {
    StringWriter buf = new StringWriter();

    DiagnosticPrinter.printText(List.of(COLUMN, ROW_GROUP), new PrintWriter(buf, true));

    assertThat(buf.toString().replace("\r\n", "\n"))
        .isEqualTo(
            "[suggestion] bloom-filter-recommendation @ column[2](a.b): missing bloom filters\n"
                + "  fix: set column a.b bloom_filter true\n"
                + "  fix: set column a.b bloom_filter_ndv 42\n"
                + "\n"
                + "[warning] gpu-page-count @ row_group[4]: few pages\n"
                + "\n"
                + "2 issue(s) found.\n");
  }

  @Test
  void jsonCarriesLocationKinds() {
    ArrayNode json = DiagnosticPrinter.toJson(List.of(COLUMN, ROW_GROUP));

    assertThat(json.get(0).get("location").get("kind").asText()).isEqualTo("column");
    assertThat(json.get(0).get("location").get("path").asText()).isEqualTo("a.b");
    assertThat(json.get(0).get("prescription")).hasSize(2);
    assertThat(json.get(1).get("location").get("kind").asText()).isEqualTo("row_group");
    assertThat(json.get(1).get("location").get("index").asInt()).isEqualTo(4);
    assertThat(json.get(1).get("prescription")).isEmpty();
  }
}
