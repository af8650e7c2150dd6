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

package ai.floedb.lint.cardinality;

/**
 * Estimated distinct and non-null value counts of one leaf column across the whole file.
 *
 * <p>{@code distinctCount <= nonNullCount} always holds.
 */
public record ColumnCardinality(long distinctCount, long nonNullCount) {

  public ColumnCardinality {
    if (nonNullCount < 0 || distinctCount < 0) {
      throw new IllegalArgumentException("counts must not be negative");
    }
    distinctCount = Math.min(distinctCount, nonNullCount);
  }

  /** Every non-null value assumed distinct. */
  public static ColumnCardinality unique(long nonNullCount) {
    return new ColumnCardinality(nonNullCount, nonNullCount);
  }

  /** Distinct over non-null values; 0 when there are no non-null values. */
  public double ratio() {
    return nonNullCount == 0 ? 0.0 : (double) distinctCount / nonNullCount;
  }
}
