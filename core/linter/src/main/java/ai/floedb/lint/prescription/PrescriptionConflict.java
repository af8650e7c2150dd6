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

/**
 * Two directives sharing a conflict key with different values.
 *
 * @param first text of the earlier directive
 * @param second text of the later directive
 */
public record PrescriptionConflict(String key, String first, String second) {

  @Override
  public String toString() {
    return "conflicting directives for "
        + key
        + ": '"
        + second
        + "' conflicts with '"
        + first
        + "'";
  }
}
