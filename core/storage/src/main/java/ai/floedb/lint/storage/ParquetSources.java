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

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/** Resolves locators into {@link ParquetSource}s. */
public final class ParquetSources {

  private ParquetSources() {}

  /**
   * Opens a source for a local path or a {@code file:} URI.
   *
   * @throws IllegalArgumentException for blank locators and unsupported schemes
   */
  public static ParquetSource open(String locator) {
    if (locator == null || locator.isBlank()) {
      throw new IllegalArgumentException("Locator must not be blank");
    }
    return new LocalParquetSource(toLocalPath(locator.trim()));
  }

  static Path toLocalPath(String locator) {
    int colon = locator.indexOf("://");
    if (locator.regionMatches(true, 0, "file:", 0, 5)) {
      return Paths.get(URI.create(locator));
    }
    if (colon > 0) {
      String scheme = locator.substring(0, colon).toLowerCase(Locale.ROOT);
      throw new IllegalArgumentException(
          "Unsupported locator scheme '" + scheme + "': " + locator);
    }
    return Path.of(locator);
  }
}
