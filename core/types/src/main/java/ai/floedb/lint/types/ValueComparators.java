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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.parquet.io.api.Binary;

/**
 * Ordering and normalisation of decoded Parquet values for min/max aggregation.
 *
 * <p>Comparisons are performed on <em>normalised</em> values: every integer kind is widened to
 * {@link Long} (unsigned kinds compared unsigned), {@code FLOAT} is widened to {@link Double},
 * text compares by its UTF-8 bytes and every binary kind compares unsigned-lexicographically. This
 * matches the order Parquet writers use for column statistics.
 *
 * <p>Kinds that are not {@linkplain ValueKind#isStatsOrderable() orderable} normalise to {@code
 * null}.
 */
public final class ValueComparators {

  private ValueComparators() {}

  public static boolean isStatsOrderable(ValueType t) {
    return t != null && t.kind().isStatsOrderable();
  }

  /**
   * Compares two values of the given type after normalisation.
   *
   * @param t the type governing comparison semantics
   * @param a left-hand value (null treated as "less than everything")
   * @param b right-hand value (null treated as "less than everything")
   * @throws IllegalArgumentException if the type is not orderable
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public static int compare(ValueType t, Object a, Object b) {
    if (a == b) {
      return 0;
    }

    if (a == null) {
      return -1;
    }

    if (b == null) {
      return 1;
    }

    if (!isStatsOrderable(t)) {
      String kind = (t == null) ? "<null>" : t.kind().name();
      throw new IllegalArgumentException("Value type is not orderable: " + kind);
    }

    Object na = normalize(t, a);
    Object nb = normalize(t, b);

    if (t.kind() == ValueKind.UINT64 || t.kind() == ValueKind.UINT32) {
      return Long.compareUnsigned((Long) na, (Long) nb);
    }

    try {
      return ((Comparable) na).compareTo(nb);
    } catch (ClassCastException e) {
      throw new IllegalArgumentException(
          "Incompatible normalized values for type "
              + t.kind().name()
              + ": "
              + na.getClass().getName()
              + " vs "
              + nb.getClass().getName(),
          e);
    }
  }

  /**
   * Normalises a decoded value to its canonical Java type for ordering.
   *
   * @param t the value type
   * @param v a Java primitive wrapper, {@link String}, {@code byte[]}, {@link ByteBuffer} or
   *     Parquet {@link Binary}
   * @return the normalised value, or {@code null} if the kind is not orderable
   */
  public static Object normalize(ValueType t, Object v) {
    if (!isStatsOrderable(t) || v == null) {
      return null;
    }
    ValueKind kind = t.kind();
    if (kind.isInteger()) {
      if (!(v instanceof Number n)) {
        throw typeErr(kind, v);
      }
      // UINT32 arrives as a negative int when the high bit is set.
      if (kind == ValueKind.UINT32 && v instanceof Integer i) {
        return Integer.toUnsignedLong(i);
      }
      return n.longValue();
    }
    switch (kind) {
      case BOOLEAN:
        if (v instanceof Boolean bool) {
          return bool;
        }
        throw typeErr(kind, v);

      case FLOAT:
      case DOUBLE:
        if (v instanceof Number n) {
          return n.doubleValue();
        }
        throw typeErr(kind, v);

      case DECIMAL:
        if (v instanceof BigDecimal bd) {
          return bd;
        }
        if (v instanceof Integer || v instanceof Long) {
          return BigDecimal.valueOf(((Number) v).longValue(), t.scale());
        }
        return new BigDecimal(new BigInteger(bytes(kind, v)), t.scale());

      case DATE:
      case TIME:
      case TIMESTAMP:
      case TIMESTAMPTZ:
        if (v instanceof Number n) {
          return n.longValue();
        }
        // INT96 timestamps compare as raw bytes.
        return new ByteArrayComparable(bytes(kind, v));

      case STRING:
      case ENUM:
      case JSON:
        if (v instanceof CharSequence cs) {
          return new ByteArrayComparable(cs.toString().getBytes(StandardCharsets.UTF_8));
        }
        return new ByteArrayComparable(bytes(kind, v));

      default:
        return new ByteArrayComparable(bytes(kind, v));
    }
  }

  /** Unsigned lexicographic comparison, shorter prefix first. */
  public static int compareBytes(byte[] a, byte[] b) {
    return Arrays.compareUnsigned(a, b);
  }

  private static byte[] bytes(ValueKind kind, Object v) {
    if (v instanceof byte[] arr) {
      return arr;
    }
    if (v instanceof Binary bin) {
      return bin.getBytes();
    }
    if (v instanceof ByteBuffer bb) {
      var dup = bb.duplicate();
      byte[] out = new byte[dup.remaining()];
      dup.get(out);
      return out;
    }
    throw typeErr(kind, v);
  }

  private static IllegalArgumentException typeErr(ValueKind kind, Object v) {
    return new IllegalArgumentException(
        kind + " compare expects decoded values, got: " + v.getClass().getName());
  }

  public static final class ByteArrayComparable implements Comparable<ByteArrayComparable> {
    private final byte[] b;

    ByteArrayComparable(byte[] b) {
      this.b = b;
    }

    @Override
    public int compareTo(ByteArrayComparable o) {
      return compareBytes(b, o.b);
    }

    public byte[] copy() {
      return Arrays.copyOf(b, b.length);
    }
  }
}
