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

package ai.floedb.lint.rule;

import ai.floedb.lint.rules.BloomFilterRule;
import ai.floedb.lint.rules.CompressionCodecRule;
import ai.floedb.lint.rules.CompressionRatioRule;
import ai.floedb.lint.rules.DictionaryEncodingRule;
import ai.floedb.lint.rules.FloatEncodingRule;
import ai.floedb.lint.rules.GpuPageCountRule;
import ai.floedb.lint.rules.PageSizeRule;
import ai.floedb.lint.rules.PageStatisticsRule;
import ai.floedb.lint.rules.StringEncodingRule;
import ai.floedb.lint.rules.StringStatisticsRule;
import ai.floedb.lint.rules.TimestampEncodingRule;
import ai.floedb.lint.rules.VectorEmbeddingRule;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/** The fixed set of shipped rules, in registry order. */
public final class RuleRegistry {

  private static final List<Rule> ALL =
      List.of(
          new CompressionCodecRule(),
          new CompressionRatioRule(),
          new DictionaryEncodingRule(),
          new FloatEncodingRule(),
          new TimestampEncodingRule(),
          new StringEncodingRule(),
          new PageSizeRule(),
          new PageStatisticsRule(),
          new VectorEmbeddingRule(),
          new BloomFilterRule(),
          new StringStatisticsRule(),
          new GpuPageCountRule());

  private RuleRegistry() {}

  public static List<Rule> all() {
    return ALL;
  }

  /**
   * Rules whose names appear in {@code names}, in registry order. {@code null} selects every rule;
   * unknown names match nothing.
   */
  public static List<Rule> select(Collection<String> names) {
    if (names == null) {
      return ALL;
    }
    Set<String> wanted = Set.copyOf(names);
    return ALL.stream().filter(r -> wanted.contains(r.name())).toList();
  }

  public static List<String> names() {
    return ALL.stream().map(Rule::name).toList();
  }
}
