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

import static ai.floedb.lint.testing.SyntheticFile.MB;
import static ai.floedb.lint.testing.SyntheticFile.chunk;
import static org.apache.parquet.hadoop.metadata.CompressionCodecName.GZIP;
import static org.apache.parquet.hadoop.metadata.CompressionCodecName.SNAPPY;
import static org.apache.parquet.hadoop.metadata.CompressionCodecName.ZSTD;
import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Location;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.testing.SyntheticFile;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompressionCodecRuleTest {

  private final CompressionCodecRule rule = new CompressionCodecRule();

  @Test
  void weakCodecOnLargeChunkRecommendsZstd() {
    SyntheticFile file =
        SyntheticFile.of("message m { optional binary s (STRING); }")
            .rowGroup(100_000, chunk(GZIP, 10 * MB, 4 * MB));

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    Diagnostic d = out.get(0);
    assertThat(d.severity()).isEqualTo(Severity.SUGGESTION);
    assertThat(d.location()).isEqualTo(Location.column(0, "s"));
    assertThat(d.message()).startsWith("using GZIP in 1/1 row groups");
    assertThat(d.message()).contains("recommend switching to ZSTD level 3");
    assertThat(d.prescription().toString()).isEqualTo("set column s compression zstd(3)");
  }

  @Test
  void zstdColumnsAreOnTarget() {
    SyntheticFile file =
        SyntheticFile.of("message m { optional binary s (STRING); }")
            .rowGroup(100_000, chunk(ZSTD, 10 * MB, 4 * MB));

    assertThat(rule.check(file.context())).isEmpty();
  }

  @Test
  void smallColumnsAndBooleansAreSkipped() {
    SyntheticFile small =
        SyntheticFile.of("message m { optional binary s (STRING); }")
            .rowGroup(1000, chunk(GZIP, 2 * MB, MB));
    SyntheticFile flags =
        SyntheticFile.of("message m { required boolean flag; }")
            .rowGroup(100_000, chunk(GZIP, 10 * MB, 4 * MB));
    SyntheticFile floats =
        SyntheticFile.of("message m { required double v; }")
            .rowGroup(100_000, chunk(GZIP, 10 * MB, 4 * MB));

    assertThat(rule.check(small.context())).isEmpty();
    assertThat(rule.check(flags.context())).isEmpty();
    assertThat(rule.check(floats.context())).isEmpty();
  }

  @Test
  void nearlyIncompressibleColumnsAreLeftToTheRatioRule() {
    SyntheticFile file =
        SyntheticFile.of("message m { required int64 v; }")
            .rowGroup(100_000, chunk(GZIP, 10 * MB, 10 * MB - 1000));

    assertThat(rule.check(file.context())).isEmpty();
  }

  @Test
  void largeSnappyChunksRecommendLz4() {
    SyntheticFile file =
        SyntheticFile.of("message m { required int64 v; }")
            .rowGroup(100_000, chunk(SNAPPY, 10 * MB, 5 * MB));

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).severity()).isEqualTo(Severity.WARNING);
    assertThat(out.get(0).message()).contains("large column chunks are decompression-sensitive");
    assertThat(out.get(0).prescription().toString()).isEqualTo("set column v compression lz4_raw");
  }

  @Test
  void manySmallModerateByteArrayChunksPreferLz4OverZstd() {
    SyntheticFile file = SyntheticFile.of("message m { optional binary payload; }");
    for (int i = 0; i < 70; i++) {
      file.rowGroup(1000, chunk(SNAPPY, 512 * 1024, 358 * 1024));
    }

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).message()).startsWith("using SNAPPY in 70/70 row groups");
    assertThat(out.get(0).prescription().toString())
        .isEqualTo("set column payload compression lz4_raw");
  }

  @Test
  void manySmallTextChunksPreferLz4BelowTheTextSizeFloor() {
    SyntheticFile file = SyntheticFile.of("message m { optional binary s (STRING); }");
    for (int i = 0; i < 64; i++) {
      file.rowGroup(1000, chunk(SNAPPY, 256 * 1024, 180 * 1024));
    }

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).severity()).isEqualTo(Severity.WARNING);
    assertThat(out.get(0).message()).startsWith("using SNAPPY in 64/64 row groups");
    assertThat(out.get(0).message()).contains("many small byte-array chunks");
    assertThat(out.get(0).prescription().toString()).isEqualTo("set column s compression lz4_raw");
  }

  @Test
  void zstdWinsWhenItCoversMoreRowGroups() {
    SyntheticFile file =
        SyntheticFile.of("message m { required int64 v; }")
            .rowGroup(100_000, chunk(SNAPPY, 6 * MB, 3 * MB))
            .rowGroup(100_000, chunk(GZIP, 3 * MB, MB))
            .rowGroup(100_000, chunk(GZIP, 3 * MB, MB));

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).message()).startsWith("using GZIP in 2/3 row groups");
    assertThat(out.get(0).prescription().toString()).isEqualTo("set column v compression zstd(3)");
  }
}
