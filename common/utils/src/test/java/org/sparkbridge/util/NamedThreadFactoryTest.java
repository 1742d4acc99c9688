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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NamedThreadFactoryTest {

  @Test
  public void namesThreadsInOrder() {
    NamedThreadFactory factory = new NamedThreadFactory("worker-%d");
    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });
    assertEquals("worker-1", first.getName());
    assertEquals("worker-2", second.getName());
    assertTrue(first.isDaemon());
    assertEquals(2, factory.createdThreads());
  }

  @Test
  public void uncaughtExceptionsDoNotEscape() throws InterruptedException {
    NamedThreadFactory factory = new NamedThreadFactory("failing-%d");
    Thread t = factory.newThread(() -> {
      throw new IllegalStateException("boom");
    });
    assertNotNull(t.getUncaughtExceptionHandler());
    t.start();
    t.join(10000);
    assertFalse(t.isAlive());
  }
}
