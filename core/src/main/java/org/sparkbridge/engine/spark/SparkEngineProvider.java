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

import org.sparkbridge.BridgeConf;
import org.sparkbridge.engine.EngineConnection;
import org.sparkbridge.engine.EngineProvider;

/**
 * Serves cluster master URLs through a Spark driver: {@code spark://}, {@code yarn},
 * {@code k8s://}, {@code mesos://} and {@code local-cluster[...]}. Spark itself must be on
 * the classpath when one of these is used.
 */
public class SparkEngineProvider implements EngineProvider {

  @Override
  public boolean canCreate(String masterURL) {
    if (masterURL == null) {
      return false;
    }
    return "yarn".equals(masterURL) ||
      masterURL.startsWith("spark://") ||
      masterURL.startsWith("k8s://") ||
      masterURL.startsWith("mesos://") ||
      masterURL.startsWith("local-cluster[");
  }

  @Override
  public EngineConnection connect(BridgeConf conf) {
    return new SparkEngine(conf);
  }
}
