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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.sparkbridge.SerializerException;

/**
 * The closed set of serializers the bridge knows how to pair with the engine, and the
 * registry resolving a configured name to a constructor. Names are case-insensitive.
 */
public enum SerializerKind {

  MARSHAL("marshal") {
    @Override
    Serializer create(int batchSize, Serializer... nested) {
      requireNested(nested, 0);
      return new MarshalSerializer(batchSize);
    }
  },

  UTF8("utf8") {
    @Override
    Serializer create(int batchSize, Serializer... nested) {
      requireNested(nested, 0);
      return new UTF8Serializer();
    }
  },

  PAIR("pair") {
    @Override
    Serializer create(int batchSize, Serializer... nested) {
      requireNested(nested, 2);
      return new PairSerializer(batchSize, nested[0], nested[1]);
    }
  },

  COMPRESSED("compressed") {
    @Override
    Serializer create(int batchSize, Serializer... nested) {
      if (nested.length == 0) {
        return new CompressedSerializer(new MarshalSerializer(batchSize));
      }
      requireNested(nested, 1);
      return new CompressedSerializer(nested[0]);
    }
  };

  private static final Map<String, SerializerKind> BY_NAME = Arrays.stream(values())
    .collect(Collectors.toUnmodifiableMap(SerializerKind::serializerName, Function.identity()));

  private final String serializerName;

  SerializerKind(String serializerName) {
    this.serializerName = serializerName;
  }

  public String serializerName() {
    return serializerName;
  }

  abstract Serializer create(int batchSize, Serializer... nested);

  /**
   * Builds a serializer of this kind.
   *
   * @param batchSize elements per frame, ignored by kinds with a fixed batch size
   * @param nested the wrapped serializers, as many as the kind needs
   * @throws SerializerException if the nested serializers do not fit the kind
   */
  public Serializer newSerializer(int batchSize, Serializer... nested) {
    if (batchSize < 1) {
      throw new SerializerException("Batch size must be positive, got " + batchSize);
    }
    return create(batchSize, nested == null ? new Serializer[0] : nested);
  }

  public static boolean isRegistered(String name) {
    return name != null && BY_NAME.containsKey(name.toLowerCase(Locale.ROOT));
  }

  /**
   * Resolves a serializer kind by name.
   *
   * @throws SerializerException if no serializer is registered under that name
   */
  public static SerializerKind fromName(String name) {
    SerializerKind kind = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (kind == null) {
      throw new SerializerException("Unknown serializer '" + name + "', expected one of " +
        BY_NAME.keySet().stream().sorted().collect(Collectors.toList()));
    }
    return kind;
  }

  void requireNested(Serializer[] nested, int expected) {
    if (nested.length != expected) {
      throw new SerializerException("Serializer '" + serializerName + "' takes " + expected +
        " nested serializer(s), got " + nested.length);
    }
    for (Serializer s : nested) {
      if (s == null) {
        throw new SerializerException(
          "Serializer '" + serializerName + "' got a null nested serializer");
      }
    }
  }
}
