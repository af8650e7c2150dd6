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

import ai.floedb.lint.diagnostic.Diagnostic;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jboss.logging.Logger;

/** Runs rules one after another against a shared context. */
public final class LintEngine {
  private static final Logger LOG = Logger.getLogger(LintEngine.class);

  private LintEngine() {}

  /**
   * Runs {@code rules} in order and returns their diagnostics sorted by severity, least severe
   * first. The sort is stable, so diagnostics of equal severity keep rule order.
   *
   * @throws IOException if a rule fails to read the source
   */
  public static List<Diagnostic> run(List<Rule> rules, RuleContext ctx) throws IOException {
    List<Diagnostic> out = new ArrayList<>();
    for (Rule rule : rules) {
      List<Diagnostic> found = rule.check(ctx);
      LOG.debugf("Rule %s produced %d diagnostic(s)", rule.name(), found.size());
      out.addAll(found);
    }
    out.sort(Comparator.comparing(Diagnostic::severity));
    return List.copyOf(out);
  }
}
