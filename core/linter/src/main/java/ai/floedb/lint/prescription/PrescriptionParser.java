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

import java.util.ArrayList;
import java.util.List;

/** Line-oriented parser for the prescription DSL. */
final class PrescriptionParser {

  private PrescriptionParser() {}

  static List<Directive> parse(String text) throws PrescriptionParseException {
    List<Directive> out = new ArrayList<>();
    String[] lines = text.split("\\r?\\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      int hash = line.indexOf('#');
      if (hash >= 0) {
        line = line.substring(0, hash);
      }
      line = line.trim();
      if (line.isEmpty()) {
        continue;
      }
      out.add(parseDirective(line.split("\\s+"), i + 1));
    }
    return out;
  }

  private static Directive parseDirective(String[] tokens, int line)
      throws PrescriptionParseException {
    if (!tokens[0].equals("set")) {
      throw new PrescriptionParseException(line, "directive must start with 'set'");
    }
    if (tokens.length < 2) {
      throw new PrescriptionParseException(line, "missing scope after 'set'");
    }
    return switch (tokens[1]) {
      case "file" -> parseFile(tokens, line);
      case "column" -> parseColumn(tokens, line);
      default ->
          throw new PrescriptionParseException(
              line, "unknown scope '" + tokens[1] + "', expected 'file' or 'column'");
    };
  }

  private static Directive parseFile(String[] tokens, int line)
      throws PrescriptionParseException {
    if (tokens.length != 4) {
      throw new PrescriptionParseException(
          line, "file directive must be: set file <property> <value>");
    }
    String property = tokens[2];
    String value = tokens[3];
    return switch (property) {
      case "compression" -> new Directive.FileCompression(parseCodec(value, line));
      case "max_row_group_size" ->
          new Directive.FileMaxRowGroupSize(parseSize(value, line, property));
      case "data_page_size_limit" ->
          new Directive.FileDataPageSizeLimit(parseSize(value, line, property));
      case "statistics_truncate_length" ->
          new Directive.FileStatisticsTruncateLength(
              value.equals("none") ? null : parseInt(value, line, property));
      default ->
          throw new PrescriptionParseException(line, "unknown file property '" + property + "'");
    };
  }

  private static Directive parseColumn(String[] tokens, int line)
      throws PrescriptionParseException {
    if (tokens.length != 5) {
      throw new PrescriptionParseException(
          line, "column directive must be: set column <column_path> <property> <value>");
    }
    String column = parseColumnPath(tokens[2], line);
    String property = tokens[3];
    String value = tokens[4];
    return switch (property) {
      case "compression" -> new Directive.ColumnCompression(column, parseCodec(value, line));
      case "encoding" ->
          new Directive.ColumnEncoding(
              column,
              DataEncoding.fromText(value)
                  .orElseThrow(
                      () -> new PrescriptionParseException(
                          line, "unknown encoding '" + value + "'")));
      case "dictionary" -> new Directive.ColumnDictionary(column, parseBool(value, line, property));
      case "dictionary_page_size_limit" ->
          new Directive.ColumnDictionaryPageSizeLimit(column, parseSize(value, line, property));
      case "statistics" ->
          new Directive.ColumnStatistics(
              column,
              StatisticsLevel.fromText(value)
                  .orElseThrow(
                      () -> new PrescriptionParseException(
                          line, "unknown statistics level '" + value + "'")));
      case "bloom_filter" ->
          new Directive.ColumnBloomFilter(column, parseBool(value, line, property));
      case "bloom_filter_ndv" ->
          new Directive.ColumnBloomFilterNdv(column, parseSize(value, line, property));
      case "bloom_filter_fpp" ->
          new Directive.ColumnBloomFilterFpp(column, parseFpp(value, line, property));
      default ->
          throw new PrescriptionParseException(
              line, "unknown column property '" + property + "'");
    };
  }

  private static String parseColumnPath(String value, int line)
      throws PrescriptionParseException {
    for (String part : value.split("\\.", -1)) {
      if (part.isEmpty()) {
        throw new PrescriptionParseException(line, "invalid column path '" + value + "'");
      }
    }
    return value;
  }

  static Codec parseCodec(String value, int line) throws PrescriptionParseException {
    switch (value) {
      case "uncompressed":
        return Codec.uncompressed();
      case "snappy":
        return Codec.snappy();
      case "lz4_raw":
        return Codec.lz4Raw();
      default:
        break;
    }
    Integer zstd = parseLevel(value, "zstd", line);
    if (zstd != null) {
      checkRange("zstd", zstd, 1, 22, line);
      return Codec.zstd(zstd);
    }
    Integer gzip = parseLevel(value, "gzip", line);
    if (gzip != null) {
      checkRange("gzip", gzip, 0, 9, line);
      return Codec.gzip(gzip);
    }
    Integer brotli = parseLevel(value, "brotli", line);
    if (brotli != null) {
      checkRange("brotli", brotli, 0, 11, line);
      return Codec.brotli(brotli);
    }
    throw new PrescriptionParseException(line, "unknown codec '" + value + "'");
  }

  /** Level of {@code codec(<level>)}, or null when {@code value} is not that codec. */
  private static Integer parseLevel(String value, String codec, int line)
      throws PrescriptionParseException {
    if (!value.startsWith(codec + "(")) {
      return null;
    }
    if (!value.endsWith(")")) {
      throw new PrescriptionParseException(
          line,
          "invalid " + codec + " format '" + value + "', expected " + codec + "(<level>)");
    }
    String inner = value.substring(codec.length() + 1, value.length() - 1);
    try {
      return Integer.parseInt(inner);
    } catch (NumberFormatException e) {
      throw new PrescriptionParseException(
          line, "invalid " + codec + " level '" + inner + "'");
    }
  }

  private static void checkRange(String codec, int level, int min, int max, int line)
      throws PrescriptionParseException {
    if (level < min || level > max) {
      throw new PrescriptionParseException(
          line, codec + " level must be between " + min + " and " + max);
    }
  }

  private static boolean parseBool(String value, int line, String property)
      throws PrescriptionParseException {
    return switch (value) {
      case "true" -> true;
      case "false" -> false;
      default ->
          throw new PrescriptionParseException(
              line, "invalid boolean for " + property + " ('" + value + "')");
    };
  }

  private static long parseSize(String value, int line, String property)
      throws PrescriptionParseException {
    try {
      long n = Long.parseLong(value);
      if (n < 0 || value.startsWith("+")) {
        throw new NumberFormatException("negative");
      }
      return n;
    } catch (NumberFormatException e) {
      throw new PrescriptionParseException(
          line, "invalid integer for " + property + " ('" + value + "')");
    }
  }

  private static int parseInt(String value, int line, String property)
      throws PrescriptionParseException {
    long n = parseSize(value, line, property);
    if (n > Integer.MAX_VALUE) {
      throw new PrescriptionParseException(
          line, "invalid integer for " + property + " ('" + value + "')");
    }
    return (int) n;
  }

  private static double parseFpp(String value, int line, String property)
      throws PrescriptionParseException {
    double fpp;
    try {
      fpp = Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new PrescriptionParseException(
          line, "invalid number for " + property + " ('" + value + "')");
    }
    if (!(fpp > 0.0 && fpp < 1.0)) {
      throw new PrescriptionParseException(
          line, property + " must be between 0 and 1 (exclusive), got '" + value + "'");
    }
    return fpp;
  }
}
