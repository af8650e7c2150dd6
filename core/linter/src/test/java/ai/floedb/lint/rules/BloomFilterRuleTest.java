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

import static ai.floedb.lint.testing.SyntheticFile.chunk;
import static org.apache.parquet.hadoop.metadata.CompressionCodecName.ZSTD;
import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.testing.SyntheticFile;
import java.util.List;
import org.junit.jupiter.api.Test;

class BloomFilterRuleTest {

  private final BloomFilterRule rule = new BloomFilterRule();

  @Test
  void uuidColumnsAlwaysWantBloomFilters() {
    SyntheticFile file =
        SyntheticFile.of("message m { required fixed_len_byte_array(16) id (UUID); }")
            .rowGroup(1000, chunk(ZSTD, 16_000, 15_000))
            .rowGroup(1000, chunk(ZSTD, 16_000, 15_000).bloomFilter())
            .distinct(0, 30);

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).severity()).isEqualTo(Severity.SUGGESTION);
    assertThat(out.get(0).message())
        .isEqualTo(
            "UUID column missing bloom filters in 1/2 row groups;"
                + " bloom filters enable fast point lookups");
    assertThat(out.get(0).prescription().toString())
        .isEqualTo("set column id bloom_filter true\nset column id bloom_filter_ndv 30");
  }

  @Test
  void highCardinalityByteArraysWantBloomFilters() {
    SyntheticFile file =
        SyntheticFile.of("message m { optional binary k; }")
            .rowGroup(1000, chunk(ZSTD, 20_000, 9_000))
            .distinct(0, 900);

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).message())
        .isEqualTo(
            "high-cardinality byte array column missing bloom filters in 1/1 row groups"
                + " (~900 estimated distinct values)");
  }

  @Test
  void lowCardinalityAndFilteredColumnsPass() {
    SyntheticFile low =
        SyntheticFile.of("message m { optional binary k; }")
            .rowGroup(1000, chunk(ZSTD, 20_000, 9_000))
            .distinct(0, 10);
    SyntheticFile filtered =
        SyntheticFile.of("message m { optional binary k; }")
            .rowGroup(1000, chunk(ZSTD, 20_000, 9_000).bloomFilter())
            .distinct(0, 900);

    assertThat(rule.check(low.context())).isEmpty();
    assertThat(rule.check(filtered.context())).isEmpty();
  }
}
