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

package ai.floedb.lint.diagnostic;

import ai.floedb.lint.prescription.Directive;
import ai.floedb.lint.prescription.Prescription;
import java.util.Objects;

/**
 * One finding of one rule, carrying the directives that would fix it.
 *
 * <p>Renders as {@code [severity] rule @ location: message}, followed by one {@code fix:} line per
 * directive.
 */
public record Diagnostic(
    String ruleName,
    Severity severity,
    Location location,
    String message,
    Prescription prescription) {

  public Diagnostic {
    Objects.requireNonNull(ruleName, "ruleName");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(message, "message");
    prescription = prescription == null ? Prescription.empty() : prescription;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append('[')
        .append(severity.label())
        .append("] ")
        .append(ruleName)
        .append(" @ ")
        .append(location)
        .append(": ")
        .append(message);
    for (Directive d : prescription.directives()) {
      sb.append("\n  fix: ").append(d);
    }
    return sb.toString();
  }
}
