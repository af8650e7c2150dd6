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

/** Where in the file a diagnostic applies. */
public sealed interface Location permits Location.File, Location.RowGroup, Location.Column {

  static Location file() {
    return new File();
  }

  static Location rowGroup(int index) {
    return new RowGroup(index);
  }

  static Location column(int index, String path) {
    return new Column(index, path);
  }

  /** The whole file. */
  record File() implements Location {
    @Override
    public String toString() {
      return "file";
    }
  }

  /** One row group, by ordinal. */
  record RowGroup(int index) implements Location {
    @Override
    public String toString() {
      return "row_group[" + index + "]";
    }
  }

  /** One leaf column, by leaf index and dotted path. */
  record Column(int index, String path) implements Location {
    @Override
    public String toString() {
      return "column[" + index + "](" + path + ")";
    }
  }
}
