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

package ai.floedb.lint.rewrite;

import ai.floedb.lint.prescription.Codec;
import ai.floedb.lint.prescription.DataEncoding;
import ai.floedb.lint.prescription.StatisticsLevel;

/**
 * Per-column overrides. A {@code null} field inherits the file-level default.
 *
 * @param encoding data encoding used once the dictionary is off or has overflowed
 */
public record ColumnProperties(
    Codec compression,
    DataEncoding encoding,
    Boolean dictionary,
    Long dictionaryPageSizeLimit,
    StatisticsLevel statistics,
    Boolean bloomFilter,
    Long bloomFilterNdv,
    Double bloomFilterFpp) {

  static final ColumnProperties NONE =
      new ColumnProperties(null, null, null, null, null, null, null, null);

  ColumnProperties withCompression(Codec v) {
    return new ColumnProperties(
        v, encoding, dictionary, dictionaryPageSizeLimit, statistics, bloomFilter,
        bloomFilterNdv, bloomFilterFpp);
  }

  ColumnProperties withEncoding(DataEncoding v) {
    return new ColumnProperties(
        compression, v, dictionary, dictionaryPageSizeLimit, statistics, bloomFilter,
        bloomFilterNdv, bloomFilterFpp);
  }

  ColumnProperties withDictionary(Boolean v) {
    return new ColumnProperties(
        compression, encoding, v, dictionaryPageSizeLimit, statistics, bloomFilter,
        bloomFilterNdv, bloomFilterFpp);
  }

  ColumnProperties withDictionaryPageSizeLimit(Long v) {
    return new ColumnProperties(
        compression, encoding, dictionary, v, statistics, bloomFilter, bloomFilterNdv,
        bloomFilterFpp);
  }

  ColumnProperties withStatistics(StatisticsLevel v) {
    return new ColumnProperties(
        compression, encoding, dictionary, dictionaryPageSizeLimit, v, bloomFilter,
        bloomFilterNdv, bloomFilterFpp);
  }

  ColumnProperties withBloomFilter(Boolean v) {
    return new ColumnProperties(
        compression, encoding, dictionary, dictionaryPageSizeLimit, statistics, v,
        bloomFilterNdv, bloomFilterFpp);
  }

  ColumnProperties withBloomFilterNdv(Long v) {
    return new ColumnProperties(
        compression, encoding, dictionary, dictionaryPageSizeLimit, statistics, bloomFilter, v,
        bloomFilterFpp);
  }

  ColumnProperties withBloomFilterFpp(Double v) {
    return new ColumnProperties(
        compression, encoding, dictionary, dictionaryPageSizeLimit, statistics, bloomFilter,
        bloomFilterNdv, v);
  }
}
