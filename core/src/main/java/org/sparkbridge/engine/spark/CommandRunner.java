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

import java.util.Iterator;

import com.google.common.collect.Lists;
import org.apache.spark.api.java.function.Function2;

import org.sparkbridge.command.WorkerCommand;

/**
 * Runs a serialized {@link WorkerCommand} over the frames of one Spark partition. The command
 * is deserialized on the executor with the task's context class loader.
 */
final class CommandRunner implements Function2<Integer, Iterator<byte[]>, Iterator<byte[]>> {

  private static final long serialVersionUID = 1L;

  private final byte[] command;

  CommandRunner(byte[] command) {
    this.command = command;
  }

  @Override
  public Iterator<byte[]> call(Integer partition, Iterator<byte[]> frames) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = CommandRunner.class.getClassLoader();
    }
    WorkerCommand workerCommand = WorkerCommand.fromBytes(command, loader);
    return workerCommand.execute(partition, Lists.newArrayList(frames)).iterator();
  }
}
