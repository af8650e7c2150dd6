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

package ai.floedb.lint.rule;

import ai.floedb.lint.context.ColumnContext;
import ai.floedb.lint.diagnostic.Location;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import ai.floedb.lint.storage.FileMetadata;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.RowGroupMetadata;
import java.util.List;
import java.util.Objects;

/**
 * Read-only snapshot shared by every rule of one lint run: the footer, one context per leaf column
 * (in leaf order), the source for rules that inspect page headers, and the run options.
 *
 * <p>{@code source} may be {@code null} when only footer metadata is at hand; rules that read page
 * headers then skip their I/O.
 */
public record RuleContext(
    FileMetadata metadata, List<ColumnContext> columns, ParquetSource source, LintOptions options) {

  public RuleContext {
    Objects.requireNonNull(metadata, "metadata");
    columns = List.copyOf(columns);
    options = options == null ? LintOptions.defaults() : options;
    if (columns.size() != metadata.numColumns()) {
      throw new IllegalArgumentException(
          "Expected " + metadata.numColumns() + " column contexts, got " + columns.size());
    }
  }

  public List<RowGroupMetadata> rowGroups() {
    return metadata.rowGroups();
  }

  /** The chunks of leaf column {@code columnIndex}, one per row group. */
  public List<ColumnChunkMetadata> chunks(int columnIndex) {
    return metadata.rowGroups().stream().map(rg -> rg.column(columnIndex)).toList();
  }

  public static Location locate(ColumnContext column) {
    return Location.column(column.columnIndex(), column.path());
  }
}
