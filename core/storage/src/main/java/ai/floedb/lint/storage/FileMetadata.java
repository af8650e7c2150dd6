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

package ai.floedb.lint.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.MessageType;

/** Decoded Parquet footer: schema, writer identity, key/value metadata and row groups. */
public record FileMetadata(
    MessageType schema,
    String createdBy,
    Map<String, String> keyValueMetadata,
    List<RowGroupMetadata> rowGroups) {

  public FileMetadata {
    keyValueMetadata =
        keyValueMetadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(keyValueMetadata));
    rowGroups = List.copyOf(rowGroups);
  }

  public List<ColumnDescriptor> columns() {
    return schema.getColumns();
  }

  public int numColumns() {
    return schema.getColumns().size();
  }

  /**
   * A schema is flat when every leaf column is a non-repeated root field. Sampling passes only run
   * on flat schemas.
   */
  public boolean isFlat() {
    for (ColumnDescriptor column : schema.getColumns()) {
      if (column.getPath().length != 1 || column.getMaxRepetitionLevel() != 0) {
        return false;
      }
    }
    return true;
  }

  public long numRows() {
    return rowGroups.stream().mapToLong(RowGroupMetadata::numRows).sum();
  }

  public static String pathOf(ColumnDescriptor descriptor) {
    return String.join(".", descriptor.getPath());
  }
}
