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
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.input.ClassLoaderObjectInputStream;

import org.sparkbridge.SerializerException;

/**
 * Java object serialization of batches. Each frame holds an {@link ArrayList} of up to
 * `batchSize` elements; elements must be {@link java.io.Serializable}.
 */
public class MarshalSerializer extends Serializer {

  private static final long serialVersionUID = 1L;

  public MarshalSerializer(int batchSize) {
    super(batchSize);
  }

  @Override
  public SerializerKind kind() {
    return SerializerKind.MARSHAL;
  }

  @Override
  public byte[] encodeBatch(List<?> batch) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(new ArrayList<>(batch));
    }
    return bytes.toByteArray();
  }

  @Override
  @SuppressWarnings("unchecked")
  public List<Object> decodeBatch(byte[] payload) throws IOException {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = MarshalSerializer.class.getClassLoader();
    }
    try (ClassLoaderObjectInputStream in =
        new ClassLoaderObjectInputStream(loader, new ByteArrayInputStream(payload))) {
      Object batch = in.readObject();
      if (!(batch instanceof List)) {
        throw new SerializerException("Expected a batch list, found " +
          (batch == null ? "null" : batch.getClass().getName()));
      }
      return (List<Object>) batch;
    } catch (ClassNotFoundException e) {
      throw new SerializerException("Cannot resolve class of a serialized element", e);
    }
  }
}
