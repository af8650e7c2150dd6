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

import java.util.Arrays;
import java.util.Objects;

/**
 * Type-specific min/max of a column. Min/max come from exact footer statistics, or from the
 * shared sample pass when the footer has none; {@code null} means unknown.
 */
public sealed interface TypeStats
    permits TypeStats.BooleanStats,
        TypeStats.IntStats,
        TypeStats.FloatStats,
        TypeStats.TextStats,
        TypeStats.BinaryStats,
        TypeStats.FixedLenBinaryStats,
        TypeStats.UnknownStats {

  /** Min aggregates by AND, max by OR. */
  record BooleanStats(Boolean min, Boolean max) implements TypeStats {}

  /**
   * INT32 and INT64 columns, widened to {@code long}. Unsigned 64-bit values keep their raw bits
   * and order with {@link Long#compareUnsigned}.
   */
  record IntStats(int bitWidth, boolean signed, Long min, Long max) implements TypeStats {}

  /** FLOAT and DOUBLE columns, widened to {@code double}; NaN never appears. */
  record FloatStats(int bitWidth, Double min, Double max) implements TypeStats {}

  /** UTF-8 byte arrays. Bounds that are not valid UTF-8 are dropped. */
  record TextStats(String min, String max, ByteLengthStats lengths) implements TypeStats {}

  /** Opaque byte arrays, ordered unsigned-lexicographically. */
  record BinaryStats(byte[] min, byte[] max, ByteLengthStats lengths) implements TypeStats {

    @Override
    public boolean equals(Object o) {
      return o instanceof BinaryStats that
          && Arrays.equals(min, that.min)
          && Arrays.equals(max, that.max)
          && Objects.equals(lengths, that.lengths);
    }

    @Override
    public int hashCode() {
      return 31 * (31 * Arrays.hashCode(min) + Arrays.hashCode(max))
          + Objects.hashCode(lengths);
    }

    @Override
    public String toString() {
      return "BinaryStats[min="
          + (min == null ? null : min.length + " bytes")
          + ", max="
          + (max == null ? null : max.length + " bytes")
          + ", lengths="
          + lengths
          + "]";
    }
  }

  record FixedLenBinaryStats(int typeLength) implements TypeStats {}

  /** Physical types without a typed summary (INT96). */
  record UnknownStats() implements TypeStats {}

  /** Sampled byte lengths, for text and binary columns. */
  default ByteLengthStats lengths() {
    return null;
  }
}
