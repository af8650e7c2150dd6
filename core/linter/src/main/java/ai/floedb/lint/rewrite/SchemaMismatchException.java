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

package ai.floedb.lint.rewrite;

import org.apache.parquet.schema.MessageType;

/** The rewritten file's schema differs from the source schema. The output must be discarded. */
public class SchemaMismatchException extends IllegalStateException {
  private final MessageType expected;
  private final MessageType actual;

  public SchemaMismatchException(String location, MessageType expected, MessageType actual) {
    super(
        "Rewritten schema of "
            + location
            + " does not match the source schema\nexpected:\n"
            + expected
            + "\nactual:\n"
            + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public MessageType expected() {
    return expected;
  }

  public MessageType actual() {
    return actual;
  }
}
