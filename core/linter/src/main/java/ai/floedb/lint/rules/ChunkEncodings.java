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

package ai.floedb.lint.rules;

import ai.floedb.lint.storage.ChunkEncodingStats;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import java.util.Locale;
import org.apache.parquet.column.Encoding;

/** Footer-level encoding checks shared by the encoding rules. */
final class ChunkEncodings {

  private static final double MIB = 1024.0 * 1024.0;

  private ChunkEncodings() {}

  static boolean usesAny(ColumnChunkMetadata chunk, Encoding... encodings) {
    for (Encoding e : encodings) {
      if (chunk.encodings().contains(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether some data page of the chunk is PLAIN. Encoding stats answer this directly; without
   * them the encoding set only proves it when no dictionary encoding is listed, because writers
   * also list PLAIN for the dictionary page itself.
   */
  static boolean hasPlainDataPages(ColumnChunkMetadata chunk) {
    ChunkEncodingStats stats = chunk.encodingStats();
    if (stats != null && !stats.dataPages().isEmpty()) {
      return stats.dataPages().getOrDefault(Encoding.PLAIN, 0) > 0;
    }
    return chunk.encodings().contains(Encoding.PLAIN) && !chunk.usesDictionaryEncoding();
  }

  static String megabytes(long bytes) {
    return String.format(Locale.ROOT, "%.1fMB", bytes / MIB);
  }

  static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.0f%%", ratio * 100.0);
  }
}
