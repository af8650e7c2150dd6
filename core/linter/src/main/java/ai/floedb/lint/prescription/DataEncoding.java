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

import java.util.Optional;
import org.apache.parquet.column.Encoding;

/** Data page value encodings a prescription can select. Level and dictionary encodings excluded. */
public enum DataEncoding {
  PLAIN("plain", Encoding.PLAIN),
  DELTA_BINARY_PACKED("delta_binary_packed", Encoding.DELTA_BINARY_PACKED),
  DELTA_LENGTH_BYTE_ARRAY("delta_length_byte_array", Encoding.DELTA_LENGTH_BYTE_ARRAY),
  DELTA_BYTE_ARRAY("delta_byte_array", Encoding.DELTA_BYTE_ARRAY),
  BYTE_STREAM_SPLIT("byte_stream_split", Encoding.BYTE_STREAM_SPLIT);

  private final String text;
  private final Encoding encoding;

  DataEncoding(String text, Encoding encoding) {
    this.text = text;
    this.encoding = encoding;
  }

  public Encoding toEncoding() {
    return encoding;
  }

  public static Optional<DataEncoding> fromText(String text) {
    for (DataEncoding e : values()) {
      if (e.text.equals(text)) {
        return Optional.of(e);
      }
    }
    return Optional.empty();
  }

  public static Optional<DataEncoding> fromEncoding(Encoding encoding) {
    for (DataEncoding e : values()) {
      if (e.encoding == encoding) {
        return Optional.of(e);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return text;
  }
}
