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

import ai.floedb.lint.prescription.DataEncoding;
import ai.floedb.lint.storage.FileMetadata;
import org.apache.parquet.bytes.ByteBufferAllocator;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.column.ParquetProperties.WriterVersion;
import org.apache.parquet.column.values.ValuesWriter;
import org.apache.parquet.column.values.bytestreamsplit.ByteStreamSplitValuesWriter;
import org.apache.parquet.column.values.delta.DeltaBinaryPackingValuesWriterForInteger;
import org.apache.parquet.column.values.delta.DeltaBinaryPackingValuesWriterForLong;
import org.apache.parquet.column.values.deltalengthbytearray.DeltaLengthByteArrayValuesWriter;
import org.apache.parquet.column.values.deltastrings.DeltaByteArrayWriter;
import org.apache.parquet.column.values.dictionary.DictionaryValuesWriter;
import org.apache.parquet.column.values.dictionary.DictionaryValuesWriter.PlainBinaryDictionaryValuesWriter;
import org.apache.parquet.column.values.dictionary.DictionaryValuesWriter.PlainDoubleDictionaryValuesWriter;
import org.apache.parquet.column.values.dictionary.DictionaryValuesWriter.PlainFixedLenArrayDictionaryValuesWriter;
import org.apache.parquet.column.values.dictionary.DictionaryValuesWriter.PlainFloatDictionaryValuesWriter;
import org.apache.parquet.column.values.dictionary.DictionaryValuesWriter.PlainIntegerDictionaryValuesWriter;
import org.apache.parquet.column.values.dictionary.DictionaryValuesWriter.PlainLongDictionaryValuesWriter;
import org.apache.parquet.column.values.factory.ValuesWriterFactory;
import org.apache.parquet.column.values.fallback.FallbackValuesWriter;
import org.apache.parquet.column.values.plain.BooleanPlainValuesWriter;
import org.apache.parquet.column.values.plain.FixedLenByteArrayPlainValuesWriter;
import org.apache.parquet.column.values.plain.PlainValuesWriter;
import org.apache.parquet.column.values.rle.RunLengthBitPackingHybridValuesWriter;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.jboss.logging.Logger;

/**
 * Values writers resolved per column from {@link WriterProperties}: dictionary on/off, dictionary
 * page size and the data encoding used when there is no dictionary or after it overflows.
 */
final class ColumnValuesWriterFactory implements ValuesWriterFactory {
  private static final Logger LOG = Logger.getLogger(ColumnValuesWriterFactory.class);

  private final WriterProperties properties;
  private ParquetProperties parquetProperties;

  ColumnValuesWriterFactory(WriterProperties properties) {
    this.properties = properties;
  }

  @Override
  public void initialize(ParquetProperties parquetProperties) {
    this.parquetProperties = parquetProperties;
  }

  @Override
  public ValuesWriter newValuesWriter(ColumnDescriptor descriptor) {
    String path = FileMetadata.pathOf(descriptor);
    PrimitiveTypeName type = descriptor.getPrimitiveType().getPrimitiveTypeName();
    ValuesWriter data = dataWriter(descriptor, path, properties.encoding(path));
    if (type == PrimitiveTypeName.BOOLEAN || !properties.dictionaryEnabled(path)) {
      return data;
    }
    int maxDictionaryBytes = (int) properties.dictionaryPageSizeLimit(path);
    return FallbackValuesWriter.of(dictionaryWriter(descriptor, maxDictionaryBytes), data);
  }

  private DictionaryValuesWriter dictionaryWriter(ColumnDescriptor descriptor, int maxBytes) {
    boolean v1 = parquetProperties.getWriterVersion() == WriterVersion.PARQUET_1_0;
    Encoding dataEncoding = v1 ? Encoding.PLAIN_DICTIONARY : Encoding.RLE_DICTIONARY;
    Encoding dictEncoding = v1 ? Encoding.PLAIN_DICTIONARY : Encoding.PLAIN;
    ByteBufferAllocator alloc = parquetProperties.getAllocator();
    return switch (descriptor.getPrimitiveType().getPrimitiveTypeName()) {
      case BINARY -> new PlainBinaryDictionaryValuesWriter(
          maxBytes, dataEncoding, dictEncoding, alloc);
      case INT32 -> new PlainIntegerDictionaryValuesWriter(
          maxBytes, dataEncoding, dictEncoding, alloc);
      case INT64 -> new PlainLongDictionaryValuesWriter(
          maxBytes, dataEncoding, dictEncoding, alloc);
      case INT96 -> new PlainFixedLenArrayDictionaryValuesWriter(
          maxBytes, 12, dataEncoding, dictEncoding, alloc);
      case DOUBLE -> new PlainDoubleDictionaryValuesWriter(
          maxBytes, dataEncoding, dictEncoding, alloc);
      case FLOAT -> new PlainFloatDictionaryValuesWriter(
          maxBytes, dataEncoding, dictEncoding, alloc);
      case FIXED_LEN_BYTE_ARRAY -> new PlainFixedLenArrayDictionaryValuesWriter(
          maxBytes, descriptor.getTypeLength(), dataEncoding, dictEncoding, alloc);
      case BOOLEAN -> throw new IllegalArgumentException("no dictionary for BOOLEAN columns");
    };
  }

  private ValuesWriter dataWriter(ColumnDescriptor descriptor, String path, DataEncoding wanted) {
    PrimitiveTypeName type = descriptor.getPrimitiveType().getPrimitiveTypeName();
    DataEncoding encoding = wanted;
    if (encoding != null && !supports(type, encoding)) {
      LOG.warnf("Encoding %s is not valid for %s column %s, using plain", encoding, type, path);
      encoding = null;
    }
    if (encoding == null) {
      encoding = DataEncoding.PLAIN;
    }

    int slab = parquetProperties.getInitialSlabSize();
    int pageSize = parquetProperties.getPageSizeThreshold();
    ByteBufferAllocator alloc = parquetProperties.getAllocator();
    switch (encoding) {
      case DELTA_BINARY_PACKED:
        return type == PrimitiveTypeName.INT32
            ? new DeltaBinaryPackingValuesWriterForInteger(slab, pageSize, alloc)
            : new DeltaBinaryPackingValuesWriterForLong(slab, pageSize, alloc);
      case DELTA_LENGTH_BYTE_ARRAY:
        return new DeltaLengthByteArrayValuesWriter(slab, pageSize, alloc);
      case DELTA_BYTE_ARRAY:
        return new DeltaByteArrayWriter(slab, pageSize, alloc);
      case BYTE_STREAM_SPLIT:
        return type == PrimitiveTypeName.FLOAT
            ? new ByteStreamSplitValuesWriter.FloatByteStreamSplitValuesWriter(
                slab, pageSize, alloc)
            : new ByteStreamSplitValuesWriter.DoubleByteStreamSplitValuesWriter(
                slab, pageSize, alloc);
      case PLAIN:
      default:
        return plainWriter(descriptor, slab, pageSize, alloc);
    }
  }

  private ValuesWriter plainWriter(
      ColumnDescriptor descriptor, int slab, int pageSize, ByteBufferAllocator alloc) {
    switch (descriptor.getPrimitiveType().getPrimitiveTypeName()) {
      case BOOLEAN:
        if (parquetProperties.getWriterVersion() == WriterVersion.PARQUET_2_0) {
          return new RunLengthBitPackingHybridValuesWriter(1, slab, pageSize, alloc);
        }
        return new BooleanPlainValuesWriter();
      case FIXED_LEN_BYTE_ARRAY:
        return new FixedLenByteArrayPlainValuesWriter(
            descriptor.getTypeLength(), slab, pageSize, alloc);
      default:
        return new PlainValuesWriter(slab, pageSize, alloc);
    }
  }

  static boolean supports(PrimitiveTypeName type, DataEncoding encoding) {
    return switch (encoding) {
      case PLAIN -> true;
      case DELTA_BINARY_PACKED -> type == PrimitiveTypeName.INT32
          || type == PrimitiveTypeName.INT64;
      case DELTA_LENGTH_BYTE_ARRAY -> type == PrimitiveTypeName.BINARY;
      case DELTA_BYTE_ARRAY -> type == PrimitiveTypeName.BINARY
          || type == PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY;
      case BYTE_STREAM_SPLIT -> type == PrimitiveTypeName.FLOAT
          || type == PrimitiveTypeName.DOUBLE;
    };
  }
}
