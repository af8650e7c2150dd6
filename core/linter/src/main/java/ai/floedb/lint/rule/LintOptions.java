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

package ai.floedb.lint.rule;

import ai.floedb.lint.cardinality.CardinalityEstimator;

/**
 * Knobs of a lint run.
 *
 * @param gpu enables the GPU scan checks
 * @param sampleRows row cap for sampling passes
 */
public record LintOptions(boolean gpu, int sampleRows) {

  public LintOptions {
    if (sampleRows <= 0) {
      throw new IllegalArgumentException("sampleRows must be positive, got " + sampleRows);
    }
  }

  public static LintOptions defaults() {
    return new LintOptions(false, CardinalityEstimator.SAMPLE_ROWS);
  }

  public LintOptions withGpu(boolean enabled) {
    return new LintOptions(enabled, sampleRows);
  }
}
