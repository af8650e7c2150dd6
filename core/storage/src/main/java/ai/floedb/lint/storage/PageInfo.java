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

import org.apache.parquet.column.Encoding;

/**
 * Header of one page, as read without touching the page body.
 *
 * @param offset file offset of the page header
 * @param headerLength encoded size of the header itself
 */
public record PageInfo(
    Kind kind,
    Encoding encoding,
    int numValues,
    int compressedSize,
    int uncompressedSize,
    long offset,
    int headerLength) {

  public enum Kind {
    DICTIONARY,
    DATA,
    DATA_V2,
    INDEX
  }

  public boolean isDictionary() {
    return kind == Kind.DICTIONARY;
  }

  public boolean isData() {
    return kind == Kind.DATA || kind == Kind.DATA_V2;
  }

  /** Offset of the header following this page. */
  public long nextOffset() {
    return offset + headerLength + compressedSize;
  }
}
