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
import ai.floedb.lint.storage.ChunkStatistics;
import ai.floedb.lint.testing.SyntheticFile;
import java.util.List;
import org.junit.jupiter.api.Test;

class StringStatisticsRuleTest {

  private static ChunkStatistics stats(int minLength, int maxLength, boolean exact) {
    return new ChunkStatistics(
        0L, null, null, null, new byte[minLength], new byte[maxLength], exact, exact);
  }

  @Test
  void exactOversizedBoundsAskForTruncation() {
    SyntheticFile file =
        SyntheticFile.of("message m { optional binary doc (STRING); }")
            .rowGroup(100, chunk(ZSTD, 50_000, 20_000).statistics(stats(100, 80, true)))
            .rowGroup(100, chunk(ZSTD, 50_000, 20_000).statistics(stats(500, 500, false)));

    List<Diagnostic> out = new StringStatisticsRule().check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).message())
        .isEqualTo(
            "string statistics are large (up to min: 100B, max: 80B) in 1/2 row groups and"
                + " untruncated; consider truncating to 64 bytes");
    assertThat(out.get(0).prescription().toString())
        .isEqualTo("set file statistics_truncate_length 64");
  }

  @Test
  void shortBoundsPass() {
    SyntheticFile file =
        SyntheticFile.of("message m { optional binary doc (STRING); }")
            .rowGroup(100, chunk(ZSTD, 50_000, 20_000).statistics(stats(64, 64, true)));

    assertThat(new StringStatisticsRule().check(file.context())).isEmpty();
  }
}
