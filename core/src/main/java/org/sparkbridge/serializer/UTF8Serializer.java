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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import org.sparkbridge.SerializerException;

/**
 * Plain UTF-8 text, one string per frame. This is the format the engine uses for the lines
 * it reads from text files, so the batch size is always 1.
 */
public class UTF8Serializer extends Serializer {

  private static final long serialVersionUID = 1L;

  public UTF8Serializer() {
    super(1);
  }

  @Override
  public SerializerKind kind() {
    return SerializerKind.UTF8;
  }

  @Override
  public byte[] encodeBatch(List<?> batch) {
    Preconditions.checkArgument(batch.size() == 1, "UTF8 frames hold exactly one string");
    Object value = batch.get(0);
    if (!(value instanceof String)) {
      throw new SerializerException("UTF8 serializer can only encode strings, got " +
        (value == null ? "null" : value.getClass().getName()));
    }
    return ((String) value).getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public List<Object> decodeBatch(byte[] payload) {
    return Collections.singletonList(new String(payload, StandardCharsets.UTF_8));
  }
}
