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

package ai.floedb.lint.prescription;

import ai.floedb.lint.rewrite.WriterProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An ordered list of {@link Directive}s.
 *
 * <p>Merging appends. Applying folds the directives in order, so for directives sharing a conflict
 * key the last one wins; {@link #validate()} reports such disagreements without preventing the
 * application. The text form is one directive per line and round-trips through {@link
 * #parse(String)}.
 */
public final class Prescription {
  private static final Prescription EMPTY = new Prescription(List.of());

  private final List<Directive> directives;

  private Prescription(List<Directive> directives) {
    this.directives = List.copyOf(directives);
  }

  public static Prescription empty() {
    return EMPTY;
  }

  public static Prescription of(Directive... directives) {
    return new Prescription(Arrays.asList(directives));
  }

  public static Prescription of(Collection<Directive> directives) {
    return new Prescription(new ArrayList<>(directives));
  }

  /** Concatenates the prescriptions in order. */
  public static Prescription merge(Collection<Prescription> prescriptions) {
    List<Directive> all = new ArrayList<>();
    for (Prescription p : prescriptions) {
      all.addAll(p.directives);
    }
    return new Prescription(all);
  }

  /**
   * Parses prescription text: one {@code set ...} directive per line, {@code #} comments and blank
   * lines ignored.
   *
   * @throws PrescriptionParseException on the first malformed line
   */
  public static Prescription parse(String text) throws PrescriptionParseException {
    return new Prescription(PrescriptionParser.parse(text));
  }

  public List<Directive> directives() {
    return directives;
  }

  public boolean isEmpty() {
    return directives.isEmpty();
  }

  public int size() {
    return directives.size();
  }

  public Prescription with(Directive directive) {
    List<Directive> out = new ArrayList<>(directives);
    out.add(directive);
    return new Prescription(out);
  }

  public Prescription merge(Prescription other) {
    return merge(List.of(this, other));
  }

  /** The first pair of directives that share a conflict key but disagree, if any. */
  public Optional<PrescriptionConflict> validate() {
    Map<String, Directive> seen = new HashMap<>();
    for (Directive d : directives) {
      Directive first = seen.putIfAbsent(d.conflictKey(), d);
      if (first != null && !first.conflictValue().equals(d.conflictValue())) {
        return Optional.of(
            new PrescriptionConflict(d.conflictKey(), first.toString(), d.toString()));
      }
    }
    return Optional.empty();
  }

  /** Folds every directive into {@code builder} in order and returns it. */
  public WriterProperties.Builder apply(WriterProperties.Builder builder) {
    for (Directive d : directives) {
      d.applyTo(builder);
    }
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Prescription that && directives.equals(that.directives);
  }

  @Override
  public int hashCode() {
    return directives.hashCode();
  }

  @Override
  public String toString() {
    return directives.stream().map(Directive::toString).collect(Collectors.joining("\n"));
  }
}
