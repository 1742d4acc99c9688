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

package org.sparkbridge.rdd;

import org.sparkbridge.BridgeContext;
import org.sparkbridge.command.Command;
import org.sparkbridge.command.WorkerCommand;
import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.serializer.Serializer;

/**
 * A handle whose elements are a source dataset with a chain of commands applied. Applying
 * another command extends the chain against the same source instead of stacking engine
 * datasets, so each job ships one command.
 */
public class PipelinedRDD<T> extends BridgeRDD<T> {

  private final EngineDataset source;
  private final Serializer sourceDeserializer;
  private final Command command;

  private PipelinedRDD(
      EngineDataset dataset,
      BridgeRDD<?> prev,
      EngineDataset source,
      Serializer sourceDeserializer,
      Command command) {
    super(dataset, prev.context(), prev.serializer(), prev.serializer());
    this.source = source;
    this.sourceDeserializer = sourceDeserializer;
    this.command = command;
  }

  static <R> PipelinedRDD<R> of(BridgeRDD<?> prev, Command next) {
    BridgeContext context = prev.context();
    // The worker decodes the stored source frames with this deserializer.
    checkWrittenWith(context, prev.sourceDataset(), prev.sourceDeserializer());
    Command combined = prev.command().andThen(next);
    WorkerCommand workerCommand =
      new WorkerCommand(prev.sourceDeserializer(), prev.serializer(), combined);
    EngineDataset dataset =
      context.engine().pipeline(prev.sourceDataset(), workerCommand.toBytes());
    context.recordWriter(dataset, workerCommand.serializer());
    return new PipelinedRDD<>(
      dataset, prev, prev.sourceDataset(), prev.sourceDeserializer(), combined);
  }

  @Override
  protected EngineDataset sourceDataset() {
    return source;
  }

  @Override
  protected Serializer sourceDeserializer() {
    return sourceDeserializer;
  }

  @Override
  public Command command() {
    return command;
  }
}
