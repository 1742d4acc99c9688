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

package org.sparkbridge.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import org.sparkbridge.internal.Logger;
import org.sparkbridge.internal.LoggerFactory;

/**
 * Creates daemon threads named after a `String.format` pattern taking the thread ordinal,
 * e.g. `"local-task-%d"`. Uncaught exceptions are logged instead of going to stderr.
 */
public class NamedThreadFactory implements ThreadFactory {

  private static final Logger LOG = LoggerFactory.getLogger(NamedThreadFactory.class);

  private final String nameFormat;
  private final AtomicLong threadIds;

  public NamedThreadFactory(String nameFormat) {
    this.nameFormat = nameFormat;
    this.threadIds = new AtomicLong();
  }

  /** Number of threads created so far. */
  public long createdThreads() {
    return threadIds.get();
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, String.format(nameFormat, threadIds.incrementAndGet()));
    t.setDaemon(true);
    t.setUncaughtExceptionHandler((thread, e) ->
      LOG.error("Uncaught exception in thread " + thread.getName(), e));
    return t;
  }

}
