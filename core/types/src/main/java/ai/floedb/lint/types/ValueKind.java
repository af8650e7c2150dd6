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

/**
 * Value kinds a Parquet leaf column can decode to, derived from its physical type and logical
 * annotation.
 *
 * <p>Unlike a catalog-level kind, integer widths and signedness are kept distinct here because
 * statistics ordering depends on them. {@link #UNKNOWN} is the terminal kind for annotations this
 * mapper does not understand; callers treat it conservatively.
 */
public enum ValueKind {
  // Scalar numeric
  BOOLEAN,
  INT8,
  INT16,
  INT32,
  INT64,
  UINT8,
  UINT16,
  UINT32,
  UINT64,
  FLOAT16,
  FLOAT,
  DOUBLE,
  DECIMAL,

  // Scalar string / binary
  STRING,
  ENUM,
  JSON,
  BSON,
  BINARY,
  FIXED_BINARY,
  UUID,

  // Scalar temporal
  DATE,
  TIME,
  TIMESTAMP,
  TIMESTAMPTZ,
  INTERVAL,

  UNKNOWN;

  public boolean isInteger() {
    return switch (this) {
      case INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64 -> true;
      default -> false;
    };
  }

  public boolean isUnsigned() {
    return switch (this) {
      case UINT8, UINT16, UINT32, UINT64 -> true;
      default -> false;
    };
  }

  /** Bit width of integer kinds, 0 for everything else. */
  public int bitWidth() {
    return switch (this) {
      case INT8, UINT8 -> 8;
      case INT16, UINT16, FLOAT16 -> 16;
      case INT32, UINT32, FLOAT -> 32;
      case INT64, UINT64, DOUBLE -> 64;
      default -> 0;
    };
  }

  public boolean isFloating() {
    return this == FLOAT16 || this == FLOAT || this == DOUBLE;
  }

  public boolean isTemporal() {
    return switch (this) {
      case DATE, TIME, TIMESTAMP, TIMESTAMPTZ -> true;
      default -> false;
    };
  }

  /** Kinds whose byte payload is UTF-8 text. */
  public boolean isText() {
    return this == STRING || this == ENUM || this == JSON;
  }

  /**
   * Returns {@code true} iff values of this kind have a meaningful min/max ordering.
   *
   * <p>INTERVAL, BSON and UNKNOWN have none.
   */
  public boolean isStatsOrderable() {
    return switch (this) {
      case INTERVAL, BSON, UNKNOWN -> false;
      default -> true;
    };
  }
}
