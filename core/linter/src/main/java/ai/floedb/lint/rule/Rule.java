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
import java.util.List;

/**
 * A lint rule. Rules read the shared {@link RuleContext} and never mutate it; absent statistics or
 * metadata mean the rule stays silent.
 */
public interface Rule {

  /** Stable kebab-case name used for selection and in diagnostics. */
  String name();

  List<Diagnostic> check(RuleContext ctx) throws IOException;
}
