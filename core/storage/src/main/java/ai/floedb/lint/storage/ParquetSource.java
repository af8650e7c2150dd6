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
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

/**
 * A located Parquet file that can serve arbitrary byte ranges.
 *
 * <p>Being an {@link InputFile}, a source can also be handed straight to Parquet's own readers for
 * decoded row streaming.
 */
public interface ParquetSource extends InputFile {

  /** The locator this source was opened from, used in messages. */
  String location();

  /**
   * Reads {@code length} bytes starting at {@code offset}.
   *
   * @throws IOException if the range cannot be read in full
   */
  default byte[] readRange(long offset, int length) throws IOException {
    if (offset < 0 || length < 0) {
      throw new IllegalArgumentException(
          "invalid range [" + offset + ", +" + length + ") for " + location());
    }
    byte[] out = new byte[length];
    try (SeekableInputStream in = newStream()) {
      in.seek(offset);
      in.readFully(out);
    }
    return out;
  }
}
