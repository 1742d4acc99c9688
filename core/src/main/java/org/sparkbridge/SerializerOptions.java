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

package org.sparkbridge;

import java.util.Objects;

import com.google.common.base.Preconditions;

import org.sparkbridge.stage.StagingStrategy;

/**
 * Per-call overrides of how a dataset is encoded and staged. Unset fields fall back to the
 * context configuration.
 */
public final class SerializerOptions {

  private static final SerializerOptions DEFAULTS = new SerializerOptions(null, null, null);

  private final String serializer;
  private final Integer batchSize;
  private final StagingStrategy staging;

  private SerializerOptions(String serializer, Integer batchSize, StagingStrategy staging) {
    this.serializer = serializer;
    this.batchSize = batchSize;
    this.staging = staging;
  }

  public static SerializerOptions defaults() {
    return DEFAULTS;
  }

  public SerializerOptions withSerializer(String name) {
    return new SerializerOptions(name, batchSize, staging);
  }

  public SerializerOptions withBatchSize(int size) {
    Preconditions.checkArgument(size > 0, "Batch size must be positive, got %s", size);
    return new SerializerOptions(serializer, size, staging);
  }

  public SerializerOptions withStaging(StagingStrategy strategy) {
    return new SerializerOptions(serializer, batchSize, strategy);
  }

  /** Serializer name, or null for the configured default. */
  public String serializer() {
    return serializer;
  }

  /** Batch size, or null for the configured default. */
  public Integer batchSize() {
    return batchSize;
  }

  /** Staging strategy, or null for the configured default. */
  public StagingStrategy staging() {
    return staging;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SerializerOptions)) {
      return false;
    }
    SerializerOptions that = (SerializerOptions) o;
    return Objects.equals(serializer, that.serializer) &&
      Objects.equals(batchSize, that.batchSize) &&
      staging == that.staging;
  }

  @Override
  public int hashCode() {
    return Objects.hash(serializer, batchSize, staging);
  }

  @Override
  public String toString() {
    return "SerializerOptions(serializer=" + serializer + ", batchSize=" + batchSize +
      ", staging=" + staging + ")";
  }
}
