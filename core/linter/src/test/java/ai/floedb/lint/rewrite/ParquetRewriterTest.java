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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.lint.prescription.Prescription;
import ai.floedb.lint.storage.ColumnChunkMetadata;
import ai.floedb.lint.storage.FileMetadata;
import ai.floedb.lint.storage.ParquetMetadataReader;
import ai.floedb.lint.storage.ParquetSource;
import ai.floedb.lint.storage.ParquetSources;
import ai.floedb.lint.storage.RowBatchStream;
import ai.floedb.lint.storage.RowGroupMetadata;
import ai.floedb.lint.testing.LintFiles;
import ai.floedb.lint.storage.PageHeaderScanner;
import ai.floedb.lint.storage.PageInfo;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.ParquetProperties.WriterVersion;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.internal.column.columnindex.ColumnIndex;
import org.apache.parquet.io.LocalInputFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParquetRewriterTest {

  @TempDir Path tmp;

  private static FileMetadata footer(Path path) throws IOException {
    return ParquetMetadataReader.read(ParquetSources.open(path.toString()));
  }

  private static List<String> rows(Path path) throws IOException {
    List<String> out = new ArrayList<>();
    try (RowBatchStream stream = RowBatchStream.open(ParquetSources.open(path.toString()))) {
      while (stream.hasNext()) {
        for (Group g : stream.next().rows()) {
          out.add(g.toString());
        }
      }
    }
    return out;
  }

  private static Path writeV2(Path dir, String name) throws IOException {
    return LintFiles.writeFlat(
        dir,
        name,
        1000,
        10,
        CompressionCodecName.SNAPPY,
        true,
        ParquetWriter.DEFAULT_BLOCK_SIZE,
        WriterVersion.PARQUET_2_0);
  }

  private static ColumnIndex idColumnIndex(Path path) throws IOException {
    try (ParquetFileReader reader = ParquetFileReader.open(new LocalInputFile(path))) {
      return reader.readColumnIndex(reader.getRowGroups().get(0).getColumns().get(0));
    }
  }

  @Test
  void columnCompressionChangesOnlyThatColumn() throws Exception {
    Path input = LintFiles.writeNested(tmp, "in.parquet", 500, CompressionCodecName.SNAPPY);
    Path output = tmp.resolve("out.parquet");

    ParquetRewriter.rewrite(
        ParquetSources.open(input.toString()),
        output,
        Prescription.parse("set column a.b compression zstd(3)"));

    FileMetadata written = footer(output);
    assertThat(written.schema()).isEqualTo(LintFiles.NESTED);
    for (RowGroupMetadata rg : written.rowGroups()) {
      assertThat(rg.column(0).codec()).isEqualTo(CompressionCodecName.SNAPPY);
      assertThat(rg.column(1).codec()).isEqualTo(CompressionCodecName.ZSTD);
    }
    assertThat(rows(output)).isEqualTo(rows(input));
  }

  @Test
  void rowGroupLimitSplitsTheOutput() throws Exception {
    Path input = LintFiles.writeFlat(tmp, "in.parquet", 1000, 10);
    Path output = tmp.resolve("out.parquet");

    ParquetRewriter.rewrite(
        ParquetSources.open(input.toString()),
        output,
        Prescription.parse("set file max_row_group_size 250"));

    FileMetadata written = footer(output);
    assertThat(written.rowGroups()).hasSize(4);
    assertThat(written.rowGroups()).allMatch(rg -> rg.numRows() == 250);
    assertThat(rows(output)).isEqualTo(rows(input));
  }

  @Test
  void encodingDictionaryAndBloomFilterDirectivesTakeEffect() throws Exception {
    Path input = LintFiles.writeFlat(tmp, "in.parquet", 1000, 10);
    Path output = tmp.resolve("out.parquet");

    ParquetRewriter.rewrite(
        ParquetSources.open(input.toString()),
        output,
        Prescription.parse(
            "set column name dictionary false\n"
                + "set column name encoding delta_length_byte_array\n"
                + "set column id bloom_filter true\n"
                + "set column id bloom_filter_ndv 1000"));

    ColumnChunkMetadata id = footer(output).rowGroups().get(0).column(0);
    ColumnChunkMetadata name = footer(output).rowGroups().get(0).column(1);
    assertThat(id.hasBloomFilter()).isTrue();
    assertThat(name.hasDictionaryPage()).isFalse();
    assertThat(name.encodings()).contains(Encoding.DELTA_LENGTH_BYTE_ARRAY);
    assertThat(rows(output)).isEqualTo(rows(input));
  }

  @Test
  void refusesToOverwriteTheSource() throws Exception {
    Path input = LintFiles.writeFlat(tmp, "in.parquet", 10, 2);
    ParquetSource source = ParquetSources.open(input.toString());

    assertThatThrownBy(() -> ParquetRewriter.rewrite(source, input, Prescription.empty()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("is the source file");
  }

  @Test
  void pageStatisticsOnV2KeepAColumnIndex() throws Exception {
    Path input = writeV2(tmp, "in.parquet");
    Path output = tmp.resolve("out.parquet");

    ParquetRewriter.rewrite(
        ParquetSources.open(input.toString()),
        output,
        Prescription.parse("set column id statistics page"));

    ColumnIndex index = idColumnIndex(output);
    assertThat(index).isNotNull();
    assertThat(index.getNullPages()).isNotEmpty().doesNotContain(true);
    assertThat(footer(output).rowGroups().get(0).column(0).statistics().max()).isEqualTo(999L);
    assertThat(rows(output)).isEqualTo(rows(input));
  }

  @Test
  void chunkStatisticsOnV2DropTheColumnIndex() throws Exception {
    Path input = writeV2(tmp, "in.parquet");
    Path output = tmp.resolve("out.parquet");

    ParquetRewriter.rewrite(
        ParquetSources.open(input.toString()),
        output,
        Prescription.parse("set column id statistics chunk"));

    ColumnChunkMetadata id = footer(output).rowGroups().get(0).column(0);
    assertThat(idColumnIndex(output)).isNull();
    assertThat(id.hasColumnIndex()).isFalse();
    assertThat(id.statistics().min()).isEqualTo(0L);
    assertThat(id.statistics().max()).isEqualTo(999L);
    assertThat(rows(output)).isEqualTo(rows(input));
  }

  @Test
  void noStatisticsOnV2WritesNoColumnIndexAndNoBounds() throws Exception {
    Path input = writeV2(tmp, "in.parquet");
    Path output = tmp.resolve("out.parquet");

    ParquetRewriter.rewrite(
        ParquetSources.open(input.toString()),
        output,
        Prescription.parse("set column id statistics none"));

    ColumnChunkMetadata id = footer(output).rowGroups().get(0).column(0);
    assertThat(idColumnIndex(output)).isNull();
    assertThat(id.statistics() == null || !id.statistics().hasMinMax()).isTrue();
    assertThat(footer(output).rowGroups().get(0).column(1).hasColumnIndex()).isTrue();
    assertThat(rows(output)).isEqualTo(rows(input));
  }

  @Test
  void failedRewriteLeavesNoPartialOutput() throws Exception {
    Path input = LintFiles.writeFlat(tmp, "in.parquet", 1000, 10);
    ParquetSource source = ParquetSources.open(input.toString());
    ColumnChunkMetadata score = footer(input).rowGroups().get(0).column(2);
    PageInfo page =
        PageHeaderScanner.scan(source, score).stream().filter(PageInfo::isData).findFirst().get();
    byte[] garbage = new byte[page.compressedSize()];
    Arrays.fill(garbage, (byte) 0xFF);
    try (RandomAccessFile file = new RandomAccessFile(input.toFile(), "rw")) {
      file.seek(page.offset() + page.headerLength());
      file.write(garbage);
    }
    Path output = tmp.resolve("out.parquet");

    assertThatThrownBy(() -> ParquetRewriter.rewrite(source, output, Prescription.empty()))
        .isInstanceOfAny(IOException.class, RuntimeException.class);
    assertThat(output).doesNotExist();
  }
}
