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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.sparkbridge.SerializerException;
import org.sparkbridge.util.Pair;

/**
 * Key/value records. A frame holds a batch of {@link Pair}s as two sub-frames: the keys
 * encoded by the key serializer, then the values encoded by the value serializer. Decoding
 * zips them back together, and refuses to do so when the two halves disagree in length.
 */
public class PairSerializer extends Serializer {

  private static final long serialVersionUID = 1L;

  private final Serializer keySerializer;
  private final Serializer valueSerializer;

  public PairSerializer(int batchSize, Serializer keySerializer, Serializer valueSerializer) {
    super(batchSize);
    this.keySerializer = Preconditions.checkNotNull(keySerializer, "keySerializer");
    this.valueSerializer = Preconditions.checkNotNull(valueSerializer, "valueSerializer");
  }

  public PairSerializer(Serializer keySerializer, Serializer valueSerializer) {
    this(1, keySerializer, valueSerializer);
  }

  @Override
  public SerializerKind kind() {
    return SerializerKind.PAIR;
  }

  public Serializer keySerializer() {
    return keySerializer;
  }

  public Serializer valueSerializer() {
    return valueSerializer;
  }

  @Override
  public List<Serializer> nested() {
    return ImmutableList.of(keySerializer, valueSerializer);
  }

  @Override
  public int framedBatchSize() {
    return Math.min(batchSize(),
      Math.min(keySerializer.framedBatchSize(), valueSerializer.framedBatchSize()));
  }

  @Override
  public byte[] encodeBatch(List<?> batch) throws IOException {
    List<Object> keys = new ArrayList<>(batch.size());
    List<Object> values = new ArrayList<>(batch.size());
    for (Object element : batch) {
      if (!(element instanceof Pair)) {
        throw new SerializerException("Pair serializer can only encode Pair elements, got " +
          (element == null ? "null" : element.getClass().getName()));
      }
      Pair<?, ?> pair = (Pair<?, ?>) element;
      keys.add(pair.getKey());
      values.add(pair.getValue());
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      Frames.writeFrame(out, keySerializer.encodeBatch(keys));
      Frames.writeFrame(out, valueSerializer.encodeBatch(values));
    }
    return bytes.toByteArray();
  }

  @Override
  public List<Object> decodeBatch(byte[] payload) throws IOException {
    DataInputStream in = new DataInputStream(new ByteArrayInputStream(payload));
    byte[] keyPayload = Frames.readFrame(in);
    byte[] valuePayload = Frames.readFrame(in);
    if (keyPayload == null || valuePayload == null) {
      throw new SerializerException("Pair frame is missing its key or value half");
    }
    List<Object> keys = keySerializer.decodeBatch(keyPayload);
    List<Object> values = valueSerializer.decodeBatch(valuePayload);
    if (keys.size() != values.size()) {
      throw new SerializerException("Pair frame holds " + keys.size() + " keys but " +
        values.size() + " values; key and value serializers are mismatched");
    }
    List<Object> pairs = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      pairs.add(Pair.of(keys.get(i), values.get(i)));
    }
    return pairs;
  }
}
