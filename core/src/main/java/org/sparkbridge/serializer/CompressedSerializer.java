/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sparkbridge.serializer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4FastDecompressor;

import org.sparkbridge.SerializerException;

/**
 * Wraps another serializer and LZ4-compresses each of its frame payloads. The payload is
 * the raw length as a big-endian `int32` followed by the compressed block.
 */
public class CompressedSerializer extends Serializer {

  private static final long serialVersionUID = 1L;

  private final Serializer inner;

  public CompressedSerializer(Serializer inner) {
    super(Preconditions.checkNotNull(inner, "inner").batchSize());
    if (inner instanceof CompressedSerializer) {
      throw new SerializerException("Compressing an already compressed serializer");
    }
    this.inner = inner;
  }

  @Override
  public SerializerKind kind() {
    return SerializerKind.COMPRESSED;
  }

  public Serializer inner() {
    return inner;
  }

  @Override
  public List<Serializer> nested() {
    return ImmutableList.of(inner);
  }

  @Override
  public int framedBatchSize() {
    return inner.framedBatchSize();
  }

  @Override
  public byte[] encodeBatch(List<?> batch) throws IOException {
    byte[] raw = inner.encodeBatch(batch);
    LZ4Compressor compressor = LZ4Factory.fastestInstance().fastCompressor();
    byte[] block = new byte[4 + compressor.maxCompressedLength(raw.length)];
    ByteBuffer.wrap(block).putInt(raw.length);
    int written = compressor.compress(raw, 0, raw.length, block, 4);
    byte[] payload = new byte[4 + written];
    System.arraycopy(block, 0, payload, 0, payload.length);
    return payload;
  }

  @Override
  public List<Object> decodeBatch(byte[] payload) throws IOException {
    if (payload.length < 4) {
      throw new SerializerException("Compressed frame is shorter than its header");
    }
    int rawLength = ByteBuffer.wrap(payload).getInt();
    if (rawLength < 0) {
      throw new SerializerException("Negative decompressed length " + rawLength);
    }
    LZ4FastDecompressor decompressor = LZ4Factory.fastestInstance().fastDecompressor();
    byte[] raw = new byte[rawLength];
    try {
      decompressor.decompress(payload, 4, raw, 0, rawLength);
    } catch (LZ4Exception e) {
      throw new SerializerException("Corrupt compressed frame", e);
    }
    return inner.decodeBatch(raw);
  }
}
