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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RowBatchStreamTest {

  @TempDir Path tmp;

  @Test
  void streamsAllRowsInBoundedBatches() throws IOException {
    Path file = ParquetFixtures.writeIdName(tmp, "a.parquet", 1000, 7);
    List<Integer> sizes = new ArrayList<>();
    List<Long> ids = new ArrayList<>();

    try (RowBatchStream stream =
        RowBatchStream.open(
            new LocalParquetSource(file),
            new RowBatchStream.Options(null, 300, Long.MAX_VALUE, null))) {
      while (stream.hasNext()) {
        RowBatch batch = stream.next();
        sizes.add(batch.size());
        for (Group g : batch.rows()) {
          ids.add(g.getLong("id", 0));
        }
      }
    }

    assertThat(sizes).containsExactly(300, 300, 300, 100);
    assertThat(ids).hasSize(1000);
    assertThat(ids.get(0)).isZero();
    assertThat(ids.get(999)).isEqualTo(999L);
  }

  @Test
  void sampleAppliesRowLimitAndProjection() throws IOException {
    Path file = ParquetFixtures.writeIdName(tmp, "b.parquet", 1000, 7);
    int rows = 0;

    try (RowBatchStream stream =
        RowBatchStream.open(
            new LocalParquetSource(file), RowBatchStream.Options.sample(0, 50, Set.of(1)))) {
      assertThat(stream.schema().getFieldCount()).isEqualTo(1);
      assertThat(stream.schema().getFieldName(0)).isEqualTo("name");
      while (stream.hasNext()) {
        RowBatch batch = stream.next();
        assertThat(batch.rowGroup()).isZero();
        rows += batch.size();
      }
    }

    assertThat(rows).isEqualTo(50);
  }

  @Test
  void readsEveryRowGroup() throws IOException {
    Path file =
        ParquetFixtures.writeIdName(
            tmp,
            "multi.parquet",
            20_000,
            20_000,
            CompressionCodecName.UNCOMPRESSED,
            false,
            1024,
            4 * 1024);
    FileMetadata meta = ParquetMetadataReader.read(new LocalParquetSource(file));
    assertThat(meta.rowGroups().size()).isGreaterThan(1);

    long rows = 0;
    try (RowBatchStream stream = RowBatchStream.open(new LocalParquetSource(file))) {
      while (stream.hasNext()) {
        rows += stream.next().size();
      }
    }

    assertThat(rows).isEqualTo(20_000L);
  }

  @Test
  void rejectsUnknownRowGroup() throws IOException {
    Path file = ParquetFixtures.writeIdName(tmp, "c.parquet", 10, 2);

    assertThatThrownBy(
            () ->
                RowBatchStream.open(
                    new LocalParquetSource(file), RowBatchStream.Options.sample(3, 10, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of range");
  }

  @Test
  void projectionKeepsRootOfNestedLeaf() {
    MessageType schema =
        MessageTypeParser.parseMessageType(
            "message m { required int32 a; optional group b { optional int64 x; optional int64 y;"
                + " } optional double c; }");

    MessageType projected = RowBatchStream.project(schema, Set.of(2, 3));

    assertThat(projected.getFieldCount()).isEqualTo(2);
    assertThat(projected.getFieldName(0)).isEqualTo("b");
    assertThat(projected.getFieldName(1)).isEqualTo("c");
    assertThat(RowBatchStream.project(schema, null)).isSameAs(schema);
  }
}
