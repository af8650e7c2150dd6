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

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Location;
import ai.floedb.lint.prescription.Directive;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.PrintWriter;
import java.util.List;

/** Renders diagnostics as text blocks or as a JSON array. */
final class DiagnosticPrinter {
  private static final ObjectMapper M = new ObjectMapper();

  private DiagnosticPrinter() {}

  static void printText(List<Diagnostic> diagnostics, PrintWriter out) {
    if (diagnostics.isEmpty()) {
      out.println("No issues found.");
      return;
    }
    for (Diagnostic d : diagnostics) {
      out.println(d);
      out.println();
    }
    out.println(diagnostics.size() + " issue(s) found.");
  }

  static void printJson(List<Diagnostic> diagnostics, PrintWriter out)
      throws JsonProcessingException {
    out.println(M.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(diagnostics)));
  }

  static ArrayNode toJson(List<Diagnostic> diagnostics) {
    ArrayNode array = M.createArrayNode();
    for (Diagnostic d : diagnostics) {
      ObjectNode n = M.createObjectNode();
      n.put("rule", d.ruleName());
      n.put("severity", d.severity().label());
      n.set("location", location(d.location()));
      n.put("message", d.message());
      ArrayNode fixes = M.createArrayNode();
      for (Directive directive : d.prescription().directives()) {
        fixes.add(directive.toString());
      }
      n.set("prescription", fixes);
      array.add(n);
    }
    return array;
  }

  private static ObjectNode location(Location location) {
    ObjectNode n = M.createObjectNode();
    if (location instanceof Location.RowGroup rg) {
      n.put("kind", "row_group");
      n.put("index", rg.index());
    } else if (location instanceof Location.Column c) {
      n.put("kind", "column");
      n.put("index", c.index());
      n.put("path", c.path());
    } else {
      n.put("kind", "file");
    }
    return n;
  }
}
