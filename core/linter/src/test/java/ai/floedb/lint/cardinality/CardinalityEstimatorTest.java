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

package ai.floedb.lint.cardinality;

import static ai.floedb.lint.testing.SyntheticFile.chunk;
import static org.apache.parquet.hadoop.metadata.CompressionCodecName.SNAPPY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ai.floedb.lint.storage.ChunkStatistics;
import ai.floedb.lint.storage.ParquetMetadataReader;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.ParquetSources;
import ai.floedb.lint.testing.LintFiles;
import ai.floedb.lint.testing.SyntheticFile;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CardinalityEstimatorTest {

  @TempDir Path tmp;

  @Test
  void scalesSampleToTheFile() {
    assertThat(CardinalityEstimator.scaleDistinct(10, 100, 1000)).isEqualTo(100);
    assertThat(CardinalityEstimator.scaleDistinct(50, 100, 60)).isEqualTo(50);
    assertThat(CardinalityEstimator.scaleDistinct(90, 100, 80)).isEqualTo(80);
    assertThat(CardinalityEstimator.scaleDistinct(0, 0, 5)).isEqualTo(5);
    assertThat(CardinalityEstimator.scaleDistinct(7, 7, 0)).isZero();
  }

  @Test
  void declaredDistinctCountsNeedNoIo() throws IOException {
    SyntheticFile file =
        SyntheticFile.of("message m { required binary k; }")
            .rowGroup(
                1000,
                chunk(SNAPPY, 10_000, 5_000)
                    .statistics(new ChunkStatistics(0L, 25L, null, null, null, null, false, false)))
            .rowGroup(1000, chunk(SNAPPY, 10_000, 5_000));
    ParquetSource source = mock(ParquetSource.class);

    List<ColumnCardinality> out = CardinalityEstimator.estimate(source, file.metadata());

    assertThat(out).containsExactly(new ColumnCardinality(50, 2000));
    verifyNoInteractions(source);
  }

  @Test
  void nestedColumnsWithoutDictionaryAreAssumedUnique() throws IOException {
    SyntheticFile file =
        SyntheticFile.of("message m { required group a { optional binary b (STRING); } }")
            .rowGroup(100, chunk(SNAPPY, 1_000, 800).nulls(20))
            .rowGroup(100, chunk(SNAPPY, 1_000, 800));
    ParquetSource source = mock(ParquetSource.class);
    when(source.getLength()).thenThrow(new IOException("offline"));

    List<ColumnCardinality> out = CardinalityEstimator.estimate(source, file.metadata());

    assertThat(out).containsExactly(ColumnCardinality.unique(180));
  }

  @Test
  void emptyFileIsUniqueEverywhere() throws IOException {
    SyntheticFile file = SyntheticFile.of("message m { required int64 id; }");

    assertThat(CardinalityEstimator.estimate(mock(ParquetSource.class), file.metadata()))
        .containsExactly(ColumnCardinality.unique(0));
  }

  @Test
  void dictionaryPagesResolveRealColumns() throws IOException {
    Path path = LintFiles.writeFlat(tmp, "dict.parquet", 1000, 10);
    ParquetSource source = ParquetSources.open(path.toString());

    List<ColumnCardinality> out =
        CardinalityEstimator.estimate(source, ParquetMetadataReader.read(source));

    assertThat(out)
        .containsExactly(
            new ColumnCardinality(1000, 1000),
            new ColumnCardinality(10, 900),
            new ColumnCardinality(1000, 1000));
  }

  @Test
  void samplingResolvesColumnsWithoutDictionaries() throws IOException {
    Path path =
        LintFiles.writeFlat(
            tmp,
            "plain.parquet",
            1000,
            7,
            CompressionCodecName.UNCOMPRESSED,
            false,
            ParquetWriter.DEFAULT_BLOCK_SIZE);
    ParquetSource source = ParquetSources.open(path.toString());

    List<ColumnCardinality> out =
        CardinalityEstimator.estimate(source, ParquetMetadataReader.read(source), 500);

    // Half the ids seen, all unique: scaled up to the file.
    assertThat(out.get(0)).isEqualTo(new ColumnCardinality(1000, 1000));
    assertThat(out.get(1).nonNullCount()).isEqualTo(900);
    assertThat(out.get(1).distinctCount()).isBetween(13L, 14L);

    List<ColumnCardinality> full =
        CardinalityEstimator.estimate(source, ParquetMetadataReader.read(source));
    assertThat(full.get(1)).isEqualTo(new ColumnCardinality(7, 900));
  }

  @Test
  void nestedFileWithOneLeafPerRootFieldIsNotSampled() throws IOException {
    Path path =
        LintFiles.writeNested(tmp, "nested.parquet", 500, CompressionCodecName.SNAPPY, false);
    ParquetSource source = ParquetSources.open(path.toString());

    List<ColumnCardinality> out =
        CardinalityEstimator.estimate(source, ParquetMetadataReader.read(source));

    assertThat(out).containsExactly(ColumnCardinality.unique(500), ColumnCardinality.unique(400));
  }

  @Test
  void repeatedLeavesAreNotSampled() throws IOException {
    Path path = LintFiles.writeRepeated(tmp, "repeated.parquet", 400);
    ParquetSource source = ParquetSources.open(path.toString());

    List<ColumnCardinality> out =
        CardinalityEstimator.estimate(source, ParquetMetadataReader.read(source));

    assertThat(out.get(0)).isEqualTo(ColumnCardinality.unique(400));
    assertThat(out.get(1).nonNullCount()).isPositive();
    assertThat(out.get(1).distinctCount()).isEqualTo(out.get(1).nonNullCount());
  }

  @Test
  void sampledFloatingPointValuesAreDistinctByBitPattern() throws IOException {
    Path path =
        LintFiles.writeFloats(tmp, "floats.parquet", 0.0, -0.0, Double.NaN, Double.NaN, 1.0, 0.0);
    ParquetSource source = ParquetSources.open(path.toString());

    List<ColumnCardinality> out =
        CardinalityEstimator.estimate(source, ParquetMetadataReader.read(source));

    // 0.0 and -0.0 differ, both NaNs collapse.
    assertThat(out)
        .containsExactly(new ColumnCardinality(4, 6), new ColumnCardinality(4, 6));
  }
}
