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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

/**
 * Column-chunk statistics as written in the footer.
 *
 * <p>{@code min}/{@code max} are decoded into the physical type's Java value ({@link Integer},
 * {@link Long}, {@link Float}, {@link Double}, {@link Boolean}, or {@code byte[]}); the raw bytes
 * are kept alongside. Exactness reflects the writer's {@code is_*_value_exact} flags. Values that
 * only exist in the deprecated {@code min}/{@code max} fields are never exact.
 *
 * @param nullCount null count, or {@code null} when not recorded
 * @param distinctCount declared distinct count, or {@code null} when not recorded
 */
public record ChunkStatistics(
    Long nullCount,
    Long distinctCount,
    Object min,
    Object max,
    byte[] minBytes,
    byte[] maxBytes,
    boolean minExact,
    boolean maxExact) {

  public static ChunkStatistics empty() {
    return new ChunkStatistics(null, null, null, null, null, null, false, false);
  }

  public boolean hasMinMax() {
    return minBytes != null && maxBytes != null;
  }

  /** Decodes a plain-encoded statistics value; {@code null} when the width does not fit. */
  public static Object decodeValue(PrimitiveTypeName type, byte[] bytes) {
    if (bytes == null) {
      return null;
    }
    ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    return switch (type) {
      case BOOLEAN -> bytes.length == 1 ? bytes[0] != 0 : null;
      case INT32 -> bytes.length == 4 ? buf.getInt() : null;
      case INT64 -> bytes.length == 8 ? buf.getLong() : null;
      case FLOAT -> bytes.length == 4 ? buf.getFloat() : null;
      case DOUBLE -> bytes.length == 8 ? buf.getDouble() : null;
      case BINARY, FIXED_LEN_BYTE_ARRAY, INT96 -> bytes;
    };
  }
}
