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
import java.util.Optional;

/** Helpers for using prescriptions outside a rewrite. */
public final class Prescriptions {

  private Prescriptions() {}

  /**
   * Parses, validates and applies prescription text to {@code builder}, so writers can adopt
   * recommended settings at initial write time:
   *
   * <pre>{@code
   * WriterProperties props =
   *     Prescriptions.applyPrescription(WriterProperties.builder(), "set file compression zstd(3)")
   *         .build();
   * }</pre>
   *
   * @throws PrescriptionParseException if the text does not parse
   * @throws PrescriptionConflictException if two directives disagree
   */
  public static WriterProperties.Builder applyPrescription(
      WriterProperties.Builder builder, String text) throws PrescriptionException {
    Prescription prescription = Prescription.parse(text);
    Optional<PrescriptionConflict> conflict = prescription.validate();
    if (conflict.isPresent()) {
      throw new PrescriptionConflictException(conflict.get());
    }
    return prescription.apply(builder);
  }
}
