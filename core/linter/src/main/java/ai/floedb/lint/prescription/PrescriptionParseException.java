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

package ai.floedb.lint.prescription;

/** A prescription text that does not parse. Any such error aborts the whole parse. */
public final class PrescriptionParseException extends PrescriptionException {
  private final int line;
  private final String detail;

  public PrescriptionParseException(int line, String detail) {
    super("invalid prescription at line " + line + ": " + detail);
    this.line = line;
    this.detail = detail;
  }

  /** 1-based line number of the offending directive. */
  public int line() {
    return line;
  }

  public String detail() {
    return detail;
  }
}
