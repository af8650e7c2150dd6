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

package ai.floedb.lint.context;

import ai.floedb.lint.types.ValueType;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * File-level summary of one leaf column: types, totals summed over row groups, estimated distinct
 * count and typed statistics.
 */
public record ColumnContext(
    int columnIndex,
    String path,
    ColumnDescriptor descriptor,
    ValueType valueType,
    long numValues,
    long nullCount,
    long distinctCount,
    long uncompressedSize,
    long compressedSize,
    TypeStats typeStats) {

  public PrimitiveTypeName physicalType() {
    return descriptor.getPrimitiveType().getPrimitiveTypeName();
  }

  /** Logical annotation, or {@code null}. */
  public LogicalTypeAnnotation logicalType() {
    return descriptor.getPrimitiveType().getLogicalTypeAnnotation();
  }

  public boolean isRepeated() {
    return descriptor.getMaxRepetitionLevel() > 0;
  }

  public long nonNullCount() {
    return Math.max(0, numValues - nullCount);
  }

  public double nullRatio() {
    return numValues == 0 ? 0.0 : (double) nullCount / numValues;
  }

  public double cardinalityRatio() {
    long nonNull = nonNullCount();
    return nonNull == 0 ? 0.0 : (double) distinctCount / nonNull;
  }

  /** Compressed over uncompressed bytes; 0 when the column is empty. */
  public double compressionRatio() {
    return uncompressedSize <= 0 ? 0.0 : (double) compressedSize / uncompressedSize;
  }
}
