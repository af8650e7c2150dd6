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

package ai.floedb.lint.prescription;

import java.util.Locale;
import java.util.Optional;

/** How much min/max statistics a column carries. */
public enum StatisticsLevel {
  /** No statistics. */
  NONE,
  /** Column-chunk statistics only. */
  CHUNK,
  /** Chunk statistics plus the page index (column index). */
  PAGE;

  public static Optional<StatisticsLevel> fromText(String text) {
    for (StatisticsLevel s : values()) {
      if (s.toString().equals(text)) {
        return Optional.of(s);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
