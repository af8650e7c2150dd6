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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class RuleRegistryTest {

  @Test
  void shipsTwelveUniquelyNamedRules() {
    assertThat(RuleRegistry.all()).hasSize(12);
    assertThat(RuleRegistry.names()).doesNotHaveDuplicates();
    assertThat(RuleRegistry.names())
        .startsWith("compression-codec-upgrade")
        .endsWith("gpu-page-count");
  }

  @Test
  void selectKeepsRegistryOrder() {
    List<Rule> picked = RuleRegistry.select(List.of("gpu-page-count", "compression-codec-upgrade"));

    assertThat(picked)
        .extracting(Rule::name)
        .containsExactly("compression-codec-upgrade", "gpu-page-count");
  }

  @Test
  void nullSelectsEverythingAndUnknownNamesNothing() {
    assertThat(RuleRegistry.select(null)).isEqualTo(RuleRegistry.all());
    assertThat(RuleRegistry.select(List.of("no-such-rule"))).isEmpty();
    assertThat(RuleRegistry.select(List.of())).isEmpty();
  }
}
