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

import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.prescription.PrescriptionParseException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads and writes prescription files for the commands. */
final class PrescriptionFiles {

  private PrescriptionFiles() {}

  static Prescription read(Path path) throws IOException, PrescriptionParseException {
    return Prescription.parse(Files.readString(path, StandardCharsets.UTF_8));
  }

  static void write(Path path, Prescription prescription, PrintWriter out) throws IOException {
    String text = prescription.toString();
    if (!text.endsWith("\n")) {
      text += "\n";
    }
    Files.writeString(path, text, StandardCharsets.UTF_8);
    out.println("Wrote prescription to " + path);
  }
}
