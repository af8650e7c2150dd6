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

import java.util.EnumMap;
import java.util.Map;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.EncodingStats;

/** Per-encoding page counts of one column chunk, split by dictionary and data pages. */
public record ChunkEncodingStats(
    Map<Encoding, Integer> dictionaryPages, Map<Encoding, Integer> dataPages) {

  public ChunkEncodingStats {
    dictionaryPages = Map.copyOf(dictionaryPages);
    dataPages = Map.copyOf(dataPages);
  }

  public static ChunkEncodingStats from(EncodingStats stats) {
    Map<Encoding, Integer> dict = new EnumMap<>(Encoding.class);
    for (Encoding e : stats.getDictionaryEncodings()) {
      dict.put(e, stats.getNumDictionaryPagesEncodedAs(e));
    }
    Map<Encoding, Integer> data = new EnumMap<>(Encoding.class);
    for (Encoding e : stats.getDataEncodings()) {
      data.put(e, stats.getNumDataPagesEncodedAs(e));
    }
    return new ChunkEncodingStats(dict, data);
  }

  public boolean hasDictionaryPages() {
    return dictionaryPages.values().stream().anyMatch(n -> n > 0);
  }

  public boolean hasDictionaryEncodedDataPages() {
    return dataPages.entrySet().stream()
        .anyMatch(e -> e.getKey().usesDictionary() && e.getValue() > 0);
  }

  public boolean hasPlainDataPages() {
    return dataPages.entrySet().stream()
        .anyMatch(e -> !e.getKey().usesDictionary() && e.getValue() > 0);
  }

  public int dataPageCount() {
    return dataPages.values().stream().mapToInt(Integer::intValue).sum();
  }
}
