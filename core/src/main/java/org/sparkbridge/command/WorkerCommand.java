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

package org.sparkbridge.command;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Serializable;
import java.util.List;

import com.google.common.base.Preconditions;
import org.apache.commons.io.input.ClassLoaderObjectInputStream;
import org.apache.commons.lang3.SerializationException;
import org.apache.commons.lang3.SerializationUtils;

import org.sparkbridge.SerializerException;
import org.sparkbridge.serializer.Serializer;

/**
 * What the engine receives alongside a job: the command pipeline together with the
 * serializer that decodes the partition's stored frames and the one that encodes the
 * pipeline's output. Shipping both with the command keeps the reading and writing side of
 * every frame paired.
 */
public final class WorkerCommand implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Serializer deserializer;
  private final Serializer serializer;
  private final Command command;

  public WorkerCommand(Serializer deserializer, Serializer serializer, Command command) {
    this.deserializer = Preconditions.checkNotNull(deserializer, "deserializer");
    this.serializer = Preconditions.checkNotNull(serializer, "serializer");
    this.command = Preconditions.checkNotNull(command, "command");
  }

  public Serializer deserializer() {
    return deserializer;
  }

  public Serializer serializer() {
    return serializer;
  }

  public Command command() {
    return command;
  }

  /**
   * Runs the pipeline over one partition: decode the input frames, apply every stage, and
   * encode the output frames.
   */
  public List<byte[]> execute(int partition, List<byte[]> inputFrames) {
    return serializer.dumpToFrames(command.apply(partition, deserializer.loadFrames(inputFrames)));
  }

  public byte[] toBytes() {
    try {
      return SerializationUtils.serialize(this);
    } catch (SerializationException e) {
      throw new SerializerException(
        "Command " + command + " is not serializable; check what its functions capture", e);
    }
  }

  public static WorkerCommand fromBytes(byte[] bytes, ClassLoader loader) {
    try (ClassLoaderObjectInputStream in =
        new ClassLoaderObjectInputStream(loader, new ByteArrayInputStream(bytes))) {
      return (WorkerCommand) in.readObject();
    } catch (IOException | ClassNotFoundException | ClassCastException e) {
      throw new SerializerException("Failed to read a serialized command", e);
    }
  }

  @Override
  public String toString() {
    return command + " (" + deserializer + " -> " + serializer + ")";
  }
}
