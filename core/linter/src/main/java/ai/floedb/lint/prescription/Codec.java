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

import java.util.Locale;
import java.util.Objects;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/**
 * A compression codec with its optional level.
 *
 * <p>Only {@code gzip} (0-9), {@code brotli} (0-11) and {@code zstd} (1-22) carry a level. The
 * deprecated LZ4 framing and LZO are not representable.
 */
public record Codec(CompressionCodecName name, Integer level) {

  public static final int ZSTD_DEFAULT_LEVEL = 3;
  public static final int GZIP_DEFAULT_LEVEL = 6;
  public static final int BROTLI_DEFAULT_LEVEL = 1;

  public Codec {
    Objects.requireNonNull(name, "name");
    switch (name) {
      case UNCOMPRESSED, SNAPPY, LZ4_RAW -> {
        if (level != null) {
          throw new IllegalArgumentException(label(name) + " does not take a level");
        }
      }
      case GZIP -> checkLevel(name, level, 0, 9);
      case BROTLI -> checkLevel(name, level, 0, 11);
      case ZSTD -> checkLevel(name, level, 1, 22);
      default -> throw new IllegalArgumentException("Unsupported codec " + name);
    }
  }

  public static Codec uncompressed() {
    return new Codec(CompressionCodecName.UNCOMPRESSED, null);
  }

  public static Codec snappy() {
    return new Codec(CompressionCodecName.SNAPPY, null);
  }

  public static Codec lz4Raw() {
    return new Codec(CompressionCodecName.LZ4_RAW, null);
  }

  public static Codec gzip(int level) {
    return new Codec(CompressionCodecName.GZIP, level);
  }

  public static Codec brotli(int level) {
    return new Codec(CompressionCodecName.BROTLI, level);
  }

  public static Codec zstd(int level) {
    return new Codec(CompressionCodecName.ZSTD, level);
  }

  /**
   * The codec a footer's codec name stands for. Footers do not record levels, so parameterised
   * codecs get the library default level.
   *
   * @throws IllegalArgumentException for LZ4 and LZO
   */
  public static Codec fromFooter(CompressionCodecName name) {
    return switch (name) {
      case GZIP -> gzip(GZIP_DEFAULT_LEVEL);
      case BROTLI -> brotli(BROTLI_DEFAULT_LEVEL);
      case ZSTD -> zstd(ZSTD_DEFAULT_LEVEL);
      default -> new Codec(name, null);
    };
  }

  @Override
  public String toString() {
    return level == null ? label(name) : label(name) + "(" + level + ")";
  }

  static String label(CompressionCodecName name) {
    return switch (name) {
      case UNCOMPRESSED -> "uncompressed";
      case SNAPPY -> "snappy";
      case GZIP -> "gzip";
      case BROTLI -> "brotli";
      case ZSTD -> "zstd";
      case LZ4_RAW -> "lz4_raw";
      default -> name.name().toLowerCase(Locale.ROOT);
    };
  }

  private static void checkLevel(CompressionCodecName name, Integer level, int min, int max) {
    if (level == null || level < min || level > max) {
      throw new IllegalArgumentException(
          label(name) + " level must be between " + min + " and " + max);
    }
  }
}
