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

package org.sparkbridge.engine.spark;

import org.apache.spark.api.java.JavaRDD;

import org.sparkbridge.engine.EngineDataset;

/**
 * A dataset held by {@link SparkEngine}: an RDD whose elements are the frames of one
 * partition, in order.
 */
final class SparkDataset implements EngineDataset {

  private final long id;
  private final JavaRDD<byte[]> rdd;

  SparkDataset(long id, JavaRDD<byte[]> rdd) {
    this.id = id;
    this.rdd = rdd;
  }

  @Override
  public long id() {
    return id;
  }

  JavaRDD<byte[]> rdd() {
    return rdd;
  }

  @Override
  public String toString() {
    return "SparkDataset[" + id + "] (rdd " + rdd.id() + ")";
  }
}
