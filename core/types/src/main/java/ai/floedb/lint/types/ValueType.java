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

import java.util.Objects;

/**
 * A mapped value type: a {@link ValueKind} plus its parameters.
 *
 * <p>Precision and scale are only set for {@link ValueKind#DECIMAL}; length is only set for
 * {@link ValueKind#FIXED_BINARY}.
 */
public final class ValueType {
  private final ValueKind kind;
  private final Integer precision;
  private final Integer scale;
  private final Integer length;

  private ValueType(ValueKind kind, Integer precision, Integer scale, Integer length) {
    this.kind = Objects.requireNonNull(kind, "kind");
    if (kind == ValueKind.DECIMAL) {
      if (precision == null || scale == null) {
        throw new IllegalArgumentException("DECIMAL requires precision and scale");
      }
      if (precision < 1 || scale < 0 || scale > precision) {
        throw new IllegalArgumentException(
            "invalid DECIMAL(" + precision + "," + scale + ")");
      }
    } else if (precision != null || scale != null) {
      throw new IllegalArgumentException("precision/scale only allowed for DECIMAL");
    }
    if (length != null && kind != ValueKind.FIXED_BINARY) {
      throw new IllegalArgumentException("length only allowed for FIXED_BINARY");
    }
    this.precision = precision;
    this.scale = scale;
    this.length = length;
  }

  public static ValueType of(ValueKind kind) {
    return new ValueType(kind, null, null, null);
  }

  public static ValueType decimal(int precision, int scale) {
    return new ValueType(ValueKind.DECIMAL, precision, scale, null);
  }

  public static ValueType fixed(int length) {
    return new ValueType(ValueKind.FIXED_BINARY, null, null, length);
  }

  public ValueKind kind() {
    return kind;
  }

  public Integer precision() {
    return precision;
  }

  public Integer scale() {
    return scale;
  }

  public Integer length() {
    return length;
  }

  public boolean isDecimal() {
    return kind == ValueKind.DECIMAL;
  }

  @Override
  public String toString() {
    if (isDecimal()) {
      return "DECIMAL(" + precision + "," + scale + ")";
    }
    if (kind == ValueKind.FIXED_BINARY) {
      return "FIXED_BINARY(" + length + ")";
    }
    return kind.name();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof ValueType that)) {
      return false;
    }

    return kind == that.kind
        && Objects.equals(precision, that.precision)
        && Objects.equals(scale, that.scale)
        && Objects.equals(length, that.length);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, precision, scale, length);
  }
}
