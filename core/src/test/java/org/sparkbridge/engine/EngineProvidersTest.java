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

import java.io.File;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

import org.sparkbridge.BridgeConf;
import org.sparkbridge.ConfigException;
import org.sparkbridge.engine.local.LocalEngine;
import org.sparkbridge.engine.local.LocalEngineProvider;
import org.sparkbridge.engine.spark.SparkEngineProvider;

public class EngineProvidersTest {

  @TempDir
  File localDir;

  @Test
  public void findsLocalEngine() {
    BridgeConf conf = new BridgeConf(false)
      .setMaster("local[3]")
      .setAppName("EngineProvidersTest")
      .set(BridgeConf.LOCAL_DIR, localDir.getAbsolutePath());
    try (EngineConnection engine = EngineProviders.connect(conf)) {
      assertTrue(engine instanceof LocalEngine);
      assertEquals(3, engine.defaultParallelism());
      assertEquals(localDir.getAbsolutePath(), engine.localDir());
    }
  }

  @Test
  public void honorsConfiguredParallelism() {
    BridgeConf conf = new BridgeConf(false)
      .setMaster("local")
      .setAppName("EngineProvidersTest")
      .set(BridgeConf.LOCAL_DIR, localDir.getAbsolutePath())
      .set(BridgeConf.DEFAULT_PARALLELISM, "5");
    try (EngineConnection engine = EngineProviders.connect(conf)) {
      assertEquals(5, engine.defaultParallelism());
    }
  }

  @Test
  public void unknownMaster() {
    BridgeConf conf = new BridgeConf(false)
      .setMaster("unknown://host")
      .setAppName("EngineProvidersTest");
    ConfigException e = assertThrows(ConfigException.class, () -> EngineProviders.connect(conf));
    assertTrue(e.getMessage().contains("unknown://host"));
  }

  @Test
  public void clusterMastersGoToSpark() {
    SparkEngineProvider spark = new SparkEngineProvider();
    LocalEngineProvider local = new LocalEngineProvider();
    for (String master : new String[] {
        "spark://host:7077", "yarn", "k8s://https://host:6443", "local-cluster[2,1,1024]"}) {
      assertTrue(spark.canCreate(master), master);
      assertFalse(local.canCreate(master), master);
    }
    for (String master : new String[] {"local", "local[4]", "local[*]"}) {
      assertFalse(spark.canCreate(master), master);
      assertTrue(local.canCreate(master), master);
    }
    assertFalse(spark.canCreate(null));
  }
}
