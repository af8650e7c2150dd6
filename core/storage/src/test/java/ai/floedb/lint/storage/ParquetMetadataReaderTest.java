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
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.format.Statistics;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.MessageTypeParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParquetMetadataReaderTest {

  @TempDir Path tmp;

  @Test
  void readsSchemaRowGroupsAndChunks() throws IOException {
    Path file = ParquetFixtures.writeIdName(tmp, "a.parquet", 1000, 5);

    FileMetadata meta = ParquetMetadataReader.read(new LocalParquetSource(file));

    assertThat(meta.schema()).isEqualTo(ParquetFixtures.ID_NAME);
    assertThat(meta.isFlat()).isTrue();
    assertThat(meta.numRows()).isEqualTo(1000);
    assertThat(meta.createdBy()).isNotBlank();
    assertThat(meta.rowGroups()).hasSize(1);

    RowGroupMetadata rg = meta.rowGroups().get(0);
    assertThat(rg.columns()).hasSize(2);
    ColumnChunkMetadata id = rg.column(0);
    ColumnChunkMetadata name = rg.column(1);
    assertThat(id.path()).isEqualTo("id");
    assertThat(name.path()).isEqualTo("name");
    assertThat(name.codec()).isEqualTo(CompressionCodecName.SNAPPY);
    assertThat(name.numValues()).isEqualTo(1000);
    assertThat(name.hasDictionaryPage()).isTrue();
    assertThat(name.usesDictionaryEncoding()).isTrue();
    assertThat(name.chunkStart()).isEqualTo(name.dictionaryPageOffset());
    assertThat(rg.compressedSize())
        .isEqualTo(id.totalCompressedSize() + name.totalCompressedSize());
  }

  @Test
  void decodesStatisticsAndPageIndexLocations() throws IOException {
    Path file = ParquetFixtures.writeIdName(tmp, "b.parquet", 1000, 5);

    RowGroupMetadata rg =
        ParquetMetadataReader.read(new LocalParquetSource(file)).rowGroups().get(0);
    ColumnChunkMetadata id = rg.column(0);
    ColumnChunkMetadata name = rg.column(1);

    assertThat(id.statistics().min()).isEqualTo(0L);
    assertThat(id.statistics().max()).isEqualTo(999L);
    assertThat(id.statistics().minExact()).isTrue();
    assertThat(id.statistics().nullCount()).isZero();
    assertThat(name.statistics().nullCount()).isEqualTo(100L);
    assertThat(name.nonNullCount()).isEqualTo(900L);
    assertThat(new String((byte[]) name.statistics().min())).isEqualTo("value-0");
    assertThat(id.hasColumnIndex()).isTrue();
    assertThat(id.hasOffsetIndex()).isTrue();
    assertThat(id.hasBloomFilter()).isFalse();
  }

  @Test
  void plainColumnWithoutDictionary() throws IOException {
    Path file =
        ParquetFixtures.writeIdName(
            tmp,
            "plain.parquet",
            500,
            500,
            CompressionCodecName.GZIP,
            false,
            1024 * 1024,
            128L * 1024 * 1024);

    ColumnChunkMetadata id =
        ParquetMetadataReader.read(new LocalParquetSource(file)).rowGroups().get(0).column(0);

    assertThat(id.codec()).isEqualTo(CompressionCodecName.GZIP);
    assertThat(id.hasDictionaryPage()).isFalse();
    assertThat(id.encodings()).contains(Encoding.PLAIN);
    assertThat(id.usesDictionaryEncoding()).isFalse();
  }

  @Test
  void fetchesFooterWithTwoRangeReads() throws IOException {
    Path file = ParquetFixtures.writeIdName(tmp, "c.parquet", 100, 5);
    LocalParquetSource source = spy(new LocalParquetSource(file));

    ParquetMetadataReader.read(source);

    verify(source, times(2)).readRange(anyLong(), anyInt());
  }

  @Test
  void rejectsBadMagic() throws IOException {
    Path file = tmp.resolve("junk.parquet");
    Files.write(file, new byte[64]);

    assertThatThrownBy(() -> ParquetMetadataReader.read(new LocalParquetSource(file)))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("bad magic");
  }

  @Test
  void rejectsTruncatedFile() throws IOException {
    Path file = tmp.resolve("tiny.parquet");
    Files.write(file, "PAR1".getBytes());

    assertThatThrownBy(() -> ParquetMetadataReader.read(new LocalParquetSource(file)))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("too small");
  }

  @Test
  void rejectsCorruptFooterLength() throws IOException {
    Path file = tmp.resolve("corrupt.parquet");
    byte[] bytes = new byte[32];
    System.arraycopy("PAR1".getBytes(), 0, bytes, 0, 4);
    bytes[24] = (byte) 0xFF;
    bytes[25] = (byte) 0xFF;
    System.arraycopy("PAR1".getBytes(), 0, bytes, 28, 4);
    Files.write(file, bytes);

    assertThatThrownBy(() -> ParquetMetadataReader.read(new LocalParquetSource(file)))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Corrupt footer length");
  }

  private static byte[] int64(long v) {
    return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(v).array();
  }

  @Test
  void boundsAreExactUnlessMarkedOtherwiseOrLegacy() {
    ColumnDescriptor id =
        MessageTypeParser.parseMessageType("message m { required int64 id; }").getColumns().get(0);

    Statistics unmarked = new Statistics();
    unmarked.setMin_value(int64(1));
    unmarked.setMax_value(int64(9));
    ChunkStatistics stats = ParquetMetadataReader.toStatistics(id, unmarked);
    assertThat(stats.min()).isEqualTo(1L);
    assertThat(stats.minExact()).isTrue();
    assertThat(stats.maxExact()).isTrue();

    Statistics truncated = new Statistics();
    truncated.setMin_value(int64(1));
    truncated.setMax_value(int64(9));
    truncated.setIs_max_value_exact(false);
    stats = ParquetMetadataReader.toStatistics(id, truncated);
    assertThat(stats.minExact()).isTrue();
    assertThat(stats.maxExact()).isFalse();

    Statistics legacy = new Statistics();
    legacy.setMin(int64(1));
    legacy.setMax(int64(9));
    stats = ParquetMetadataReader.toStatistics(id, legacy);
    assertThat(stats.max()).isEqualTo(9L);
    assertThat(stats.minExact()).isFalse();
    assertThat(stats.maxExact()).isFalse();
  }
}
