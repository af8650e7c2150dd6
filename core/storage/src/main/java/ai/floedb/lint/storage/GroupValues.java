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

import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;

/** Reads the first value of a primitive field of an example {@link Group}. */
public final class GroupValues {

  private GroupValues() {}

  /** True when the field holds at least one value. */
  public static boolean isPresent(Group group, int field) {
    return group.getFieldRepetitionCount(field) > 0;
  }

  /**
   * Decoded value in the physical type's Java form: {@link Integer}, {@link Long}, {@link Float},
   * {@link Double}, {@link Boolean} or {@code byte[]}. {@code null} when absent.
   *
   * @throws IllegalArgumentException when the field is not primitive
   */
  public static Object value(Group group, int field) {
    if (!isPresent(group, field)) {
      return null;
    }
    return switch (physicalType(group, field)) {
      case INT32 -> group.getInteger(field, 0);
      case INT64 -> group.getLong(field, 0);
      case FLOAT -> group.getFloat(field, 0);
      case DOUBLE -> group.getDouble(field, 0);
      case BOOLEAN -> group.getBoolean(field, 0);
      case INT96 -> group.getInt96(field, 0).getBytes();
      case BINARY, FIXED_LEN_BYTE_ARRAY -> group.getBinary(field, 0).getBytes();
    };
  }

  /**
   * Key with value equality for distinct counting. Floating-point values are keyed by their raw
   * bits, so NaN payloads and signed zeros stay distinct.
   */
  public static Object hashKey(Group group, int field) {
    if (!isPresent(group, field)) {
      return null;
    }
    return switch (physicalType(group, field)) {
      case INT32 -> group.getInteger(field, 0);
      case INT64 -> group.getLong(field, 0);
      case FLOAT -> Float.floatToRawIntBits(group.getFloat(field, 0));
      case DOUBLE -> Double.doubleToRawLongBits(group.getDouble(field, 0));
      case BOOLEAN -> group.getBoolean(field, 0);
      case INT96 -> group.getInt96(field, 0).copy();
      case BINARY, FIXED_LEN_BYTE_ARRAY -> group.getBinary(field, 0).copy();
    };
  }

  private static PrimitiveTypeName physicalType(Group group, int field) {
    Type type = group.getType().getType(field);
    if (!type.isPrimitive()) {
      throw new IllegalArgumentException("Field " + type.getName() + " is not primitive");
    }
    return type.asPrimitiveType().getPrimitiveTypeName();
  }
}
