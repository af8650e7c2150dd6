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

import java.util.Locale;

/** Diagnostic severity, ordered from least to most severe. */
public enum Severity {
  /** Optional improvement. */
  SUGGESTION,
  /** Likely-costly issue. */
  WARNING,
  /** Severe issue. No shipped rule emits this yet. */
  ERROR;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a severity name, case-insensitively.
   *
   * @throws IllegalArgumentException if {@code value} names no severity
   */
  public static Severity fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Severity must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown severity '" + value + "', expected suggestion, warning or error", e);
    }
  }

  @Override
  public String toString() {
    return label();
  }
}
