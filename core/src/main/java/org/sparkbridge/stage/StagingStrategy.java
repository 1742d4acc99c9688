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

import java.util.Locale;

import org.sparkbridge.ConfigException;

/**
 * How a local collection is handed to the engine.
 */
public enum StagingStrategy {
  /** Write a temp file the engine reads by path. Memory use is bounded by the batch size. */
  FILE("file"),
  /** Hand the encoded frames to the engine in memory. */
  DIRECT("direct");

  private final String strategyName;

  StagingStrategy(String strategyName) {
    this.strategyName = strategyName;
  }

  public String strategyName() {
    return strategyName;
  }

  /** @throws ConfigException for names other than "file" and "direct" */
  public static StagingStrategy fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (StagingStrategy strategy : values()) {
        if (strategy.strategyName.equals(normalized)) {
          return strategy;
        }
      }
    }
    throw new ConfigException("Unknown staging strategy '" + name +
      "', expected 'file' or 'direct'");
  }
}
