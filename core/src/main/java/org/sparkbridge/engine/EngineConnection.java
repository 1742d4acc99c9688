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

package org.sparkbridge.engine;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The boundary between the driver bridge and the execution engine. Everything behind this
 * interface (scheduling, fault tolerance, data placement) belongs to the engine.
 *
 * <p>Failures are reported as {@link org.sparkbridge.EngineException}. Local properties are
 * scoped to the calling thread.</p>
 */
public interface EngineConnection extends Closeable {

  /** Suggested number of partitions when the caller gives none. */
  int defaultParallelism();

  /** Local scratch directory the driver may create its own temp directories in. */
  String localDir();

  /**
   * Ingests a framed file written by the driver and splits its frames into
   * {@code numSlices} partitions. The engine is done with the file once this returns.
   */
  EngineDataset readRDDFromFile(String path, int numSlices);

  /** Ingests frames handed over in memory, split into {@code numSlices} partitions. */
  EngineDataset parallelize(List<byte[]> frames, int numSlices);

  /** Reads text files line by line, one UTF-8 frame per line. */
  EngineDataset textFile(String path, int minPartitions);

  /** Reads every file of a directory as one (path, content) UTF-8 pair frame. */
  EngineDataset wholeTextFiles(String path, int minPartitions);

  /**
   * Describes {@code parent} with a serialized command applied to each partition. Nothing
   * runs until a job is submitted on the returned dataset.
   */
  EngineDataset pipeline(EngineDataset parent, byte[] command);

  int numPartitions(EngineDataset dataset);

  /**
   * Runs a job over the given partitions and blocks until results start to stream. The
   * iterator yields one result per partition in engine-chosen order.
   *
   * @param allowLocal hint that the job may run in the calling thread
   * @param properties job properties, such as the call site that submitted it
   */
  Iterator<PartitionResult> runJob(
      EngineDataset dataset,
      int[] partitions,
      boolean allowLocal,
      Map<String, String> properties);

  /** Distributes a file to every node running jobs of this connection. */
  void addFile(String path);

  /** Registers a broadcast value from a file holding its serialized bytes. */
  void readBroadcastFromFile(long id, String path);

  void unpersistBroadcast(long id);

  /** Sets a property of the calling thread; a null value removes it. */
  void setLocalProperty(String key, String value);

  String getLocalProperty(String key);

  /** Snapshot of the calling thread's properties. */
  Map<String, String> getLocalProperties();

  String getCallSite();

  /** Stops the engine connection. Any further call is invalid. */
  @Override
  void close();
}
