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

import java.io.IOException;
import java.nio.file.Path;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;

/** Small Parquet files written with Parquet's example writer. */
final class ParquetFixtures {

  static final MessageType ID_NAME =
      MessageTypeParser.parseMessageType(
          "message rows { required int64 id; optional binary name (STRING); }");

  private ParquetFixtures() {}

  /**
   * Writes {@code rows} rows of {@link #ID_NAME}: ids ascending from 0, names cycling through
   * {@code distinctNames} values and null for every tenth row.
   */
  static Path writeIdName(
      Path dir,
      String name,
      int rows,
      int distinctNames,
      CompressionCodecName codec,
      boolean dictionary,
      int pageSize,
      long rowGroupSize)
      throws IOException {
    Path path = dir.resolve(name);
    SimpleGroupFactory groups = new SimpleGroupFactory(ID_NAME);
    try (ParquetWriter<Group> writer =
        ExampleParquetWriter.builder(new LocalOutputFile(path))
            .withType(ID_NAME)
            .withCompressionCodec(codec)
            .withDictionaryEncoding(dictionary)
            .withPageSize(pageSize)
            .withRowGroupSize(rowGroupSize)
            .build()) {
      for (int i = 0; i < rows; i++) {
        Group g = groups.newGroup().append("id", (long) i);
        if (i % 10 != 0) {
          g.append("name", "value-" + (i % distinctNames));
        }
        writer.write(g);
      }
    }
    return path;
  }

  static Path writeIdName(Path dir, String name, int rows, int distinctNames) throws IOException {
    return writeIdName(
        dir,
        name,
        rows,
        distinctNames,
        CompressionCodecName.SNAPPY,
        true,
        ParquetWriter.DEFAULT_PAGE_SIZE,
        ParquetWriter.DEFAULT_BLOCK_SIZE);
  }
}
