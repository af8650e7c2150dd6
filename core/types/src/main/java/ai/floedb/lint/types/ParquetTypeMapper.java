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

package ai.floedb.lint.types;

import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.BsonLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.DateLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.DecimalLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.EnumLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.Float16LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.IntLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.IntervalLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.JsonLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.StringLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimeLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimestampLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.UUIDLogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;

/**
 * Maps a Parquet leaf column (physical type + logical annotation) to a {@link ValueType}.
 *
 * <p>The mapping is applied per leaf, so it works the same for flat and nested schemas: a repeated
 * leaf maps to the type of its elements. Annotations that do not fit the physical type fall back to
 * the physical type's natural kind.
 */
public final class ParquetTypeMapper {

  private ParquetTypeMapper() {}

  public static ValueType map(ColumnDescriptor descriptor) {
    return map(descriptor.getPrimitiveType());
  }

  public static ValueType map(PrimitiveType type) {
    LogicalTypeAnnotation ann = type.getLogicalTypeAnnotation();
    return switch (type.getPrimitiveTypeName()) {
      case BOOLEAN -> ValueType.of(ValueKind.BOOLEAN);
      case INT32 -> mapInt32(ann);
      case INT64 -> mapInt64(ann);
      // Legacy nanosecond timestamps.
      case INT96 -> ValueType.of(ValueKind.TIMESTAMP);
      case FLOAT -> ValueType.of(ValueKind.FLOAT);
      case DOUBLE -> ValueType.of(ValueKind.DOUBLE);
      case BINARY -> mapBinary(ann);
      case FIXED_LEN_BYTE_ARRAY -> mapFixed(ann, type.getTypeLength());
    };
  }

  private static ValueType mapInt32(LogicalTypeAnnotation ann) {
    if (ann instanceof IntLogicalTypeAnnotation i) {
      return ValueType.of(intKind(i.getBitWidth(), i.isSigned()));
    }
    if (ann instanceof DateLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.DATE);
    }
    if (ann instanceof TimeLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.TIME);
    }
    if (ann instanceof DecimalLogicalTypeAnnotation d) {
      return ValueType.decimal(d.getPrecision(), d.getScale());
    }
    return ValueType.of(ValueKind.INT32);
  }

  private static ValueType mapInt64(LogicalTypeAnnotation ann) {
    if (ann instanceof IntLogicalTypeAnnotation i) {
      return ValueType.of(intKind(i.getBitWidth(), i.isSigned()));
    }
    if (ann instanceof TimestampLogicalTypeAnnotation ts) {
      return ValueType.of(ts.isAdjustedToUTC() ? ValueKind.TIMESTAMPTZ : ValueKind.TIMESTAMP);
    }
    if (ann instanceof TimeLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.TIME);
    }
    if (ann instanceof DecimalLogicalTypeAnnotation d) {
      return ValueType.decimal(d.getPrecision(), d.getScale());
    }
    return ValueType.of(ValueKind.INT64);
  }

  private static ValueType mapBinary(LogicalTypeAnnotation ann) {
    if (ann instanceof StringLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.STRING);
    }
    if (ann instanceof EnumLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.ENUM);
    }
    if (ann instanceof JsonLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.JSON);
    }
    if (ann instanceof BsonLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.BSON);
    }
    if (ann instanceof DecimalLogicalTypeAnnotation d) {
      return ValueType.decimal(d.getPrecision(), d.getScale());
    }
    return ValueType.of(ValueKind.BINARY);
  }

  private static ValueType mapFixed(LogicalTypeAnnotation ann, int length) {
    if (ann instanceof DecimalLogicalTypeAnnotation d) {
      return ValueType.decimal(d.getPrecision(), d.getScale());
    }
    if (ann instanceof UUIDLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.UUID);
    }
    if (ann instanceof Float16LogicalTypeAnnotation) {
      return ValueType.of(ValueKind.FLOAT16);
    }
    if (ann instanceof IntervalLogicalTypeAnnotation) {
      return ValueType.of(ValueKind.INTERVAL);
    }
    return ValueType.fixed(length);
  }

  private static ValueKind intKind(int bitWidth, boolean signed) {
    return switch (bitWidth) {
      case 8 -> signed ? ValueKind.INT8 : ValueKind.UINT8;
      case 16 -> signed ? ValueKind.INT16 : ValueKind.UINT16;
      case 32 -> signed ? ValueKind.INT32 : ValueKind.UINT32;
      case 64 -> signed ? ValueKind.INT64 : ValueKind.UINT64;
      default -> ValueKind.UNKNOWN;
    };
  }
}
