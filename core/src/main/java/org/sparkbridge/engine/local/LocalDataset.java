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

package org.sparkbridge.engine.local;

import java.util.List;

import org.sparkbridge.command.WorkerCommand;
import org.sparkbridge.engine.EngineDataset;

/**
 * A dataset held by {@link LocalEngine}: either source frames already split into slices, or
 * a parent dataset with a serialized command applied lazily when a partition is computed.
 */
final class LocalDataset implements EngineDataset {

  private final long id;
  private final List<List<byte[]>> slices;
  private final LocalDataset parent;
  private final byte[] command;

  private LocalDataset(long id, List<List<byte[]>> slices, LocalDataset parent, byte[] command) {
    this.id = id;
    this.slices = slices;
    this.parent = parent;
    this.command = command;
  }

  static LocalDataset source(long id, List<List<byte[]>> slices) {
    return new LocalDataset(id, slices, null, null);
  }

  static LocalDataset pipelined(long id, LocalDataset parent, byte[] command) {
    return new LocalDataset(id, null, parent, command);
  }

  @Override
  public long id() {
    return id;
  }

  int numPartitions() {
    return parent != null ? parent.numPartitions() : slices.size();
  }

  /** Output frames of one partition. */
  List<byte[]> compute(int partition, ClassLoader loader) {
    if (parent == null) {
      return slices.get(partition);
    }
    List<byte[]> input = parent.compute(partition, loader);
    return WorkerCommand.fromBytes(command, loader).execute(partition, input);
  }

  @Override
  public String toString() {
    return (parent == null ? "SourceDataset[" : "PipelinedDataset[") + id + "]";
  }
}
