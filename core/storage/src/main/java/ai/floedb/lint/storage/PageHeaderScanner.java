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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.format.OffsetIndex;
import org.apache.parquet.format.PageHeader;
import org.apache.parquet.format.Util;
import org.jboss.logging.Logger;

/**
 * Reads page headers of a single column chunk with bounded range reads.
 *
 * <p>Each header is read from a small window at the page's offset; the window doubles (up to 1 MiB)
 * when a header does not fit, e.g. because it carries large inline statistics. Page bodies are
 * skipped, never decompressed.
 */
public final class PageHeaderScanner {
  private static final Logger LOG = Logger.getLogger(PageHeaderScanner.class);

  static final int INITIAL_WINDOW = 8 * 1024;
  static final int MAX_WINDOW = 1024 * 1024;

  private PageHeaderScanner() {}

  /** Reads the first page header of the chunk; empty for an empty chunk. */
  public static Optional<PageInfo> firstPage(ParquetSource source, ColumnChunkMetadata chunk)
      throws IOException {
    List<PageInfo> pages = scan(source, chunk, 1);
    return pages.isEmpty() ? Optional.empty() : Optional.of(pages.get(0));
  }

  /** Reads every page header of the chunk. */
  public static List<PageInfo> scan(ParquetSource source, ColumnChunkMetadata chunk)
      throws IOException {
    return scan(source, chunk, Integer.MAX_VALUE);
  }

  /** Reads at most {@code maxPages} page headers of the chunk, in file order. */
  public static List<PageInfo> scan(ParquetSource source, ColumnChunkMetadata chunk, int maxPages)
      throws IOException {
    long pos = chunk.chunkStart();
    long end = pos + chunk.totalCompressedSize();
    long fileLength = source.getLength();
    if (end > fileLength) {
      throw new IOException(
          "Column chunk " + chunk.path() + " extends past end of " + source.location());
    }

    List<PageInfo> pages = new ArrayList<>();
    while (pos < end && pages.size() < maxPages) {
      PageInfo page = readHeader(source, pos, end);
      pages.add(page);
      if (page.nextOffset() <= pos) {
        throw new IOException("Corrupt page header at offset " + pos + " in " + source.location());
      }
      pos = page.nextOffset();
    }
    LOG.debugf("Scanned %d page header(s) of %s", pages.size(), chunk.path());
    return pages;
  }

  /** Data encodings used by the chunk's data pages, in first-seen order. */
  public static List<Encoding> dataPageEncodings(ParquetSource source, ColumnChunkMetadata chunk)
      throws IOException {
    List<Encoding> out = new ArrayList<>();
    for (PageInfo page : scan(source, chunk)) {
      if (page.isData() && !out.contains(page.encoding())) {
        out.add(page.encoding());
      }
    }
    return out;
  }

  /** Number of data pages according to the chunk's offset index, if it has one. */
  public static OptionalInt pageCountFromOffsetIndex(
      ParquetSource source, ColumnChunkMetadata chunk) throws IOException {
    IndexRange range = chunk.offsetIndexRange();
    if (range == null || range.length() <= 0) {
      return OptionalInt.empty();
    }
    byte[] bytes = source.readRange(range.offset(), range.length());
    OffsetIndex index = Util.readOffsetIndex(new ByteArrayInputStream(bytes));
    return OptionalInt.of(index.getPage_locationsSize());
  }

  static PageInfo readHeader(ParquetSource source, long pos, long end) throws IOException {
    int limit = (int) Math.min(MAX_WINDOW, end - pos);
    int window = Math.min(INITIAL_WINDOW, limit);
    while (true) {
      byte[] bytes = source.readRange(pos, window);
      ByteArrayInputStream in = new ByteArrayInputStream(bytes);
      try {
        PageHeader header = Util.readPageHeader(in);
        int headerLength = bytes.length - in.available();
        return toPageInfo(header, pos, headerLength);
      } catch (IOException e) {
        if (window >= limit) {
          throw new IOException(
              "Unreadable page header at offset " + pos + " in " + source.location(), e);
        }
        window = Math.min(window * 2, limit);
      }
    }
  }

  private static PageInfo toPageInfo(PageHeader header, long pos, int headerLength) {
    PageInfo.Kind kind;
    Encoding encoding = null;
    int numValues = 0;
    switch (header.getType()) {
      case DICTIONARY_PAGE -> {
        kind = PageInfo.Kind.DICTIONARY;
        if (header.isSetDictionary_page_header()) {
          numValues = header.getDictionary_page_header().getNum_values();
          encoding = toEncoding(header.getDictionary_page_header().getEncoding());
        }
      }
      case DATA_PAGE -> {
        kind = PageInfo.Kind.DATA;
        if (header.isSetData_page_header()) {
          numValues = header.getData_page_header().getNum_values();
          encoding = toEncoding(header.getData_page_header().getEncoding());
        }
      }
      case DATA_PAGE_V2 -> {
        kind = PageInfo.Kind.DATA_V2;
        if (header.isSetData_page_header_v2()) {
          numValues = header.getData_page_header_v2().getNum_values();
          encoding = toEncoding(header.getData_page_header_v2().getEncoding());
        }
      }
      default -> kind = PageInfo.Kind.INDEX;
    }
    return new PageInfo(
        kind,
        encoding,
        numValues,
        header.getCompressed_page_size(),
        header.getUncompressed_page_size(),
        pos,
        headerLength);
  }

  private static Encoding toEncoding(org.apache.parquet.format.Encoding encoding) {
    return Encoding.valueOf(encoding.name());
  }
}
