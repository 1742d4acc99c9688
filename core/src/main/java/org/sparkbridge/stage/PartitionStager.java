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

package org.sparkbridge.stage;

import java.util.List;

import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.serializer.Serializer;

/**
 * Encodes a materialized local collection with a serializer and hands it to the engine,
 * which splits it into partitions.
 */
public interface PartitionStager {

  StagingStrategy strategy();

  /**
   * @param data elements in the order they must keep
   * @param numSlices number of partitions the engine must produce
   * @param serializer the serializer the resulting dataset will be decoded with
   */
  EngineDataset stage(List<?> data, int numSlices, Serializer serializer);
}
