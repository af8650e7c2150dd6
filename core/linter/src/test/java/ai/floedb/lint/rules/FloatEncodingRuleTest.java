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
import static org.apache.parquet.hadoop.metadata.CompressionCodecName.SNAPPY;
import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.testing.SyntheticFile;
import java.util.List;
import org.apache.parquet.column.Encoding;
import org.junit.jupiter.api.Test;

class FloatEncodingRuleTest {

  private final FloatEncodingRule rule = new FloatEncodingRule();

  @Test
  void plainHighCardinalityFloatsGetByteStreamSplit() {
    SyntheticFile file =
        SyntheticFile.of("message m { required double v; }")
            .rowGroup(1000, chunk(SNAPPY, 8000, 7000).encodings(Encoding.PLAIN))
            .rowGroup(1000, chunk(SNAPPY, 8000, 7000).encodings(Encoding.BYTE_STREAM_SPLIT))
            .distinct(0, 1500);

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).message()).contains("in 1/2 row groups");
    assertThat(out.get(0).prescription().toString())
        .isEqualTo("set column v encoding byte_stream_split");
  }

  @Test
  void lowCardinalityFloatsAreLeftToTheDictionary() {
    SyntheticFile file =
        SyntheticFile.of("message m { required float v; }")
            .rowGroup(1000, chunk(SNAPPY, 4000, 3000).encodings(Encoding.PLAIN))
            .distinct(0, 20);

    assertThat(rule.check(file.context())).isEmpty();
  }

  @Test
  void dictionaryPagesWithoutStatsAreNotTreatedAsPlain() {
    SyntheticFile file =
        SyntheticFile.of("message m { required double v; }")
            .rowGroup(
                1000,
                chunk(SNAPPY, 8000, 7000)
                    .encodings(Encoding.PLAIN, Encoding.RLE_DICTIONARY)
                    .dictionaryPage());

    assertThat(rule.check(file.context())).isEmpty();
  }

  @Test
  void repeatedFloatsAreNotScalar() {
    SyntheticFile file =
        SyntheticFile.of("message m { repeated double v; }")
            .rowGroup(100, chunk(SNAPPY, 8000, 7000).values(1000).encodings(Encoding.PLAIN));

    assertThat(rule.check(file.context())).isEmpty();
  }
}
