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
import static org.apache.parquet.hadoop.metadata.CompressionCodecName.UNCOMPRESSED;
import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Severity;
import ai.floedb.lint.testing.SyntheticFile;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompressionRatioRuleTest {

  private final CompressionRatioRule rule = new CompressionRatioRule();

  @Test
  void incompressibleColumnIsAskedToDropCompression() {
    SyntheticFile file =
        SyntheticFile.of("message m { required binary blob; }")
            .rowGroup(1000, chunk(GZIP, 100_000, 99_000))
            .rowGroup(1000, chunk(UNCOMPRESSED, 100_000, 100_000));

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).severity()).isEqualTo(Severity.WARNING);
    assertThat(out.get(0).message())
        .isEqualTo(
            "aggregated compression ratio is 0.99 (GZIP) across 1/2 row groups;"
                + " data is nearly incompressible");
    assertThat(out.get(0).prescription().toString())
        .isEqualTo("set column blob compression uncompressed");
  }

  @Test
  void compressibleAndUncompressedColumnsPass() {
    SyntheticFile file =
        SyntheticFile.of("message m { required binary a; required binary b; }")
            .rowGroup(1000, chunk(GZIP, 10 * MB, 2 * MB), chunk(UNCOMPRESSED, MB, MB));

    assertThat(rule.check(file.context())).isEmpty();
  }
}
