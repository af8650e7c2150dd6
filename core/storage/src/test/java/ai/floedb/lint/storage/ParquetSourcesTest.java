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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ParquetSourcesTest {

  @Test
  void opensPlainPaths() {
    ParquetSource source = ParquetSources.open("/data/x.parquet");

    assertThat(source).isInstanceOf(LocalParquetSource.class);
    assertThat(((LocalParquetSource) source).path()).isEqualTo(Path.of("/data/x.parquet"));
  }

  @Test
  void opensFileUris() {
    ParquetSource source = ParquetSources.open("file:///data/x.parquet");

    assertThat(((LocalParquetSource) source).path()).isEqualTo(Path.of("/data/x.parquet"));
  }

  @Test
  void rejectsRemoteSchemes() {
    assertThatThrownBy(() -> ParquetSources.open("s3://bucket/x.parquet"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'s3'");
    assertThatThrownBy(() -> ParquetSources.open(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
