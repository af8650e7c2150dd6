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

package ai.floedb.lint.rewrite;

import ai.floedb.lint.prescription.Codec;
import java.io.Closeable;
import java.util.HashMap;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.compression.CompressionCodecFactory.BytesInputCompressor;
import org.apache.parquet.hadoop.BadConfigurationException;
import org.apache.parquet.hadoop.CodecFactory;
import org.jboss.logging.Logger;

/**
 * Compressors for a rewrite, one codec factory per distinct codec and level. Levels reach the
 * Hadoop and Parquet codecs through their configuration keys.
 */
final class ColumnCompressors implements Closeable {
  private static final Logger LOG = Logger.getLogger(ColumnCompressors.class);

  static final String ZSTD_LEVEL = "parquet.compression.codec.zstd.level";
  static final String ZLIB_LEVEL = "zlib.compress.level";
  static final String BROTLI_QUALITY = "compression.brotli.quality";

  private static final String[] ZLIB_LEVEL_NAMES = {
    "NO_COMPRESSION",
    "BEST_SPEED",
    "TWO",
    "THREE",
    "FOUR",
    "FIVE",
    "DEFAULT_COMPRESSION",
    "SEVEN",
    "EIGHT",
    "BEST_COMPRESSION"
  };

  private final WriterProperties properties;
  private final int pageSize;
  private final Map<Codec, CodecFactory> factories = new HashMap<>();

  ColumnCompressors(WriterProperties properties) {
    this.properties = properties;
    this.pageSize = (int) properties.dataPageSizeLimit();
  }

  BytesInputCompressor forColumn(String path) {
    Codec codec = properties.compression(path);
    CodecFactory factory =
        factories.computeIfAbsent(codec, c -> new CodecFactory(configuration(c), pageSize));
    try {
      return factory.getCompressor(codec.name());
    } catch (BadConfigurationException e) {
      throw new IllegalStateException(
          "Codec " + codec + " for column " + path + " is not available on the classpath", e);
    }
  }

  static Configuration configuration(Codec codec) {
    Configuration conf = new Configuration();
    if (codec.level() == null) {
      return conf;
    }
    switch (codec.name()) {
      case ZSTD -> conf.setInt(ZSTD_LEVEL, codec.level());
      case GZIP -> conf.set(ZLIB_LEVEL, ZLIB_LEVEL_NAMES[codec.level()]);
      case BROTLI -> conf.setInt(BROTLI_QUALITY, codec.level());
      default -> LOG.debugf("Ignoring level of %s", codec);
    }
    return conf;
  }

  @Override
  public void close() {
    for (CodecFactory factory : factories.values()) {
      factory.release();
    }
    factories.clear();
  }
}
