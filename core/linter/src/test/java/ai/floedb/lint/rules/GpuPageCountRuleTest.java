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

import ai.floedb.lint.ParquetLinter;
import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Location;
import ai.floedb.lint.rule.LintOptions;
import ai.floedb.lint.storage.ParquetSources;
import ai.floedb.lint.testing.LintFiles;
import ai.floedb.lint.testing.SyntheticFile;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GpuPageCountRuleTest {

  @TempDir Path tmp;

  private final GpuPageCountRule rule = new GpuPageCountRule();

  private static SyntheticFile twoGroups() {
    return SyntheticFile.of("message m { required int64 id; }")
        .rowGroup(100, chunk(ZSTD, 800, 400))
        .rowGroup(100, chunk(ZSTD, 800, 400));
  }

  @Test
  void disabledWithoutGpuOption() {
    assertThat(rule.check(twoGroups().context())).isEmpty();
  }

  @Test
  void unreadableRowGroupsAreReportedOnce() {
    List<Diagnostic> out = rule.check(twoGroups().context(LintOptions.defaults().withGpu(true)));

    assertThat(out).hasSize(1);
    assertThat(out.get(0).location()).isEqualTo(Location.file());
    assertThat(out.get(0).message())
        .isEqualTo(
            "page count check could not read page counts for 2 row groups;"
                + " results may be incomplete");
    assertThat(out.get(0).prescription().isEmpty()).isTrue();
  }

  @Test
  void smallFileGetsPerColumnPageDetail() throws Exception {
    Path file = LintFiles.writeFlat(tmp, "small.parquet", 500, 10);

    List<Diagnostic> out =
        ParquetLinter.lint(
            ParquetSources.open(file.toString()),
            List.of(rule.name()),
            LintOptions.defaults().withGpu(true));

    assertThat(out).hasSize(3);
    assertThat(out)
        .extracting(Diagnostic::location)
        .containsExactly(
            Location.column(0, "id"), Location.column(1, "name"), Location.column(2, "score"));
    assertThat(out)
        .allSatisfy(
            d ->
                assertThat(d.message())
                    .startsWith("page count detail: this column averages ")
                    .contains("across 1/1 row groups"));
  }
}
