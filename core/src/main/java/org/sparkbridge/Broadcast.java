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

/**
 * A read-only value registered with the engine once and made available to every job.
 * Replication to workers is the engine's business; the driver keeps the local value.
 */
public final class Broadcast<T> {

  private final BridgeContext context;
  private final long id;
  private final T value;

  Broadcast(BridgeContext context, long id, T value) {
    this.context = context;
    this.id = id;
    this.value = value;
  }

  public long id() {
    return id;
  }

  public T value() {
    return value;
  }

  /** Asks the engine to drop its copies of the value. */
  public void unpersist() {
    context.engine().unpersistBroadcast(id);
  }

  @Override
  public String toString() {
    return "Broadcast(" + id + ")";
  }
}
