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

import ai.floedb.lint.diagnostic.Diagnostic;
import ai.floedb.lint.diagnostic.Location;
import ai.floedb.lint.testing.SyntheticFile;
import java.util.List;
import org.junit.jupiter.api.Test;

class VectorEmbeddingRuleTest {

  private static final String LIST_OF_FLOAT =
      "message m { optional group emb (LIST) { repeated group list { required float element; } } }";

  private final VectorEmbeddingRule rule = new VectorEmbeddingRule();

  @Test
  void wideFloatListsGetSmallPages() {
    SyntheticFile file =
        SyntheticFile.of(LIST_OF_FLOAT)
            .rowGroup(10, chunk(ZSTD, 5120, 4800).values(1280))
            .rowGroup(0, chunk(ZSTD, 0, 0).values(0));

    List<Diagnostic> out = rule.check(file.context());

    assertThat(out).hasSize(1);
    assertThat(out.get(0).location()).isEqualTo(Location.column(0, "emb.list.element"));
    assertThat(out.get(0).message())
        .isEqualTo(
            "column looks like a vector embedding (128 values/row on average), consider smaller"
                + " page size for random-access lookups");
    assertThat(out.get(0).prescription().toString())
        .isEqualTo("set file data_page_size_limit 262144");
  }

  @Test
  void shortListsAndScalarsPass() {
    SyntheticFile lists =
        SyntheticFile.of(LIST_OF_FLOAT).rowGroup(10, chunk(ZSTD, 400, 300).values(100));
    SyntheticFile scalars =
        SyntheticFile.of("message m { required float v; }")
            .rowGroup(10, chunk(ZSTD, 40, 30));

    assertThat(rule.check(lists.context())).isEmpty();
    assertThat(rule.check(scalars.context())).isEmpty();
  }
}
