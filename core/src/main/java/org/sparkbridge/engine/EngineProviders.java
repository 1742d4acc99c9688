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

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import org.sparkbridge.BridgeConf;
import org.sparkbridge.ConfigException;
import org.sparkbridge.internal.LogKeys;
import org.sparkbridge.internal.Logger;
import org.sparkbridge.internal.LoggerFactory;
import org.sparkbridge.internal.MDC;

/**
 * Picks the {@link EngineProvider} for the configured master URL.
 */
public final class EngineProviders {

  private static final Logger LOG = LoggerFactory.getLogger(EngineProviders.class);

  private EngineProviders() { }

  public static EngineConnection connect(BridgeConf conf) {
    String master = conf.get(BridgeConf.MASTER);
    List<EngineProvider> candidates = new ArrayList<>();
    for (EngineProvider provider : ServiceLoader.load(EngineProvider.class, loader())) {
      if (provider.canCreate(master)) {
        candidates.add(provider);
      }
    }
    if (candidates.isEmpty()) {
      throw new ConfigException("Could not find an engine for master URL '" + master + "'");
    }
    if (candidates.size() > 1) {
      throw new ConfigException("Multiple engines registered for master URL '" + master +
        "': " + candidates);
    }
    LOG.info("Connecting to {} with {}", MDC.of(LogKeys.MASTER_URL, master),
      MDC.of(LogKeys.ENGINE_PROVIDER, candidates.get(0).getClass().getSimpleName()));
    return candidates.get(0).connect(conf);
  }

  private static ClassLoader loader() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    return loader != null ? loader : EngineProviders.class.getClassLoader();
  }
}
