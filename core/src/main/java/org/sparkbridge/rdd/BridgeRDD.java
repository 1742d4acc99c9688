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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import org.sparkbridge.BridgeContext;
import org.sparkbridge.EngineException;
import org.sparkbridge.SerializerException;
import org.sparkbridge.command.Command;
import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.engine.PartitionResult;
import org.sparkbridge.serializer.Serializer;

/**
 * Driver-side handle of a dataset held by the engine, bound to the serializers that read
 * its elements. Handles are immutable; the driver owns nothing but the reference. The
 * deserializer is always the one the context recorded as the dataset's writer.
 *
 * <p>{@code deserializer} decodes the frames the engine stores for this dataset and
 * {@code serializer} encodes whatever commands run on it produce. They differ for sources the
 * engine reads itself, such as text files.</p>
 *
 * @param <T> element type
 */
public class BridgeRDD<T> {

  private final EngineDataset dataset;
  private final BridgeContext context;
  private final Serializer serializer;
  private final Serializer deserializer;

  /**
   * Binds a handle to {@code dataset}, decoding its frames with the serializer that wrote
   * them.
   *
   * @param serializer encoder of what commands run on this handle produce
   * @throws SerializerException if {@code context} does not know who wrote the dataset
   */
  public static <T> BridgeRDD<T> of(
      EngineDataset dataset,
      BridgeContext context,
      Serializer serializer) {
    Preconditions.checkNotNull(dataset, "dataset");
    Preconditions.checkNotNull(context, "context");
    return new BridgeRDD<>(dataset, context, serializer, context.writerOf(dataset));
  }

  protected BridgeRDD(
      EngineDataset dataset,
      BridgeContext context,
      Serializer serializer,
      Serializer deserializer) {
    this.dataset = Preconditions.checkNotNull(dataset, "dataset");
    this.context = Preconditions.checkNotNull(context, "context");
    this.serializer = Preconditions.checkNotNull(serializer, "serializer");
    checkWrittenWith(context, dataset, deserializer);
    this.deserializer = deserializer;
  }

  static void checkWrittenWith(
      BridgeContext context,
      EngineDataset dataset,
      Serializer deserializer) {
    Serializer writer = context.writerOf(dataset);
    if (writer == null) {
      throw new SerializerException("No serializer is recorded for dataset " + dataset.id() +
        "; its frames cannot be decoded safely");
    }
    writer.checkPairedWith(deserializer);
  }

  public EngineDataset dataset() {
    return dataset;
  }

  public BridgeContext context() {
    return context;
  }

  public Serializer serializer() {
    return serializer;
  }

  public Serializer deserializer() {
    return deserializer;
  }

  /** Current number of partitions, as reported by the engine. */
  public int partitionsSize() {
    return context.engine().numPartitions(dataset);
  }

  /** The engine dataset the command chain of this handle starts from. */
  protected EngineDataset sourceDataset() {
    return dataset;
  }

  /** Decoder of the frames stored in {@link #sourceDataset()}. */
  protected Serializer sourceDeserializer() {
    return deserializer;
  }

  /** Commands already applied on top of {@link #sourceDataset()}. */
  protected Command command() {
    return Command.identity();
  }

  /**
   * A lazy handle describing this dataset with {@code command} applied to every partition.
   * Nothing runs on the engine until a job is submitted.
   */
  public <R> PipelinedRDD<R> newRddFromCommand(Command command) {
    return PipelinedRDD.of(this, command);
  }

  /** All elements, partition by partition. */
  public List<T> collect() {
    List<T> result = new ArrayList<>();
    collectPartitions().forEach(result::addAll);
    return result;
  }

  /** The elements of every partition, ordered by partition index. */
  public List<List<T>> collectPartitions() {
    return context.runJobWithCommand(this, null, false, Command.identity());
  }

  /**
   * Drains a job's result iterator and decodes it with this handle's serializer. Results
   * arrive in engine order; the returned list follows {@code partitions}. Nothing is
   * returned unless every requested partition was received.
   */
  @SuppressWarnings("unchecked")
  public List<List<T>> collectFromIterator(Iterator<PartitionResult> results, int[] partitions) {
    Map<Integer, byte[]> received = new HashMap<>();
    while (results.hasNext()) {
      PartitionResult result = results.next();
      if (received.put(result.partition(), result.data()) != null) {
        throw new EngineException("Engine returned partition " + result.partition() + " twice");
      }
    }
    List<List<T>> decoded = new ArrayList<>(partitions.length);
    for (int partition : partitions) {
      byte[] data = received.get(partition);
      if (data == null) {
        throw new EngineException("Engine returned no result for partition " + partition);
      }
      decoded.add((List<T>) (List<?>) serializer.loadFromBytes(data));
    }
    return decoded;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + dataset.id() + "] (" + serializer + ")";
  }
}
