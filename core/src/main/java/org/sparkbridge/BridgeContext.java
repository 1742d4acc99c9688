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

package org.sparkbridge;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.SerializationException;
import org.apache.commons.lang3.SerializationUtils;

import org.sparkbridge.api.java.function.Function;
import org.sparkbridge.command.Command;
import org.sparkbridge.engine.EngineConnection;
import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.engine.EngineProviders;
import org.sparkbridge.internal.LogKeys;
import org.sparkbridge.internal.Logger;
import org.sparkbridge.internal.LoggerFactory;
import org.sparkbridge.internal.MDC;
import org.sparkbridge.rdd.BridgeRDD;
import org.sparkbridge.scheduler.JobDispatcher;
import org.sparkbridge.serializer.Serializer;
import org.sparkbridge.serializer.SerializerKind;
import org.sparkbridge.stage.DirectStager;
import org.sparkbridge.stage.FileStager;
import org.sparkbridge.stage.PartitionStager;
import org.sparkbridge.stage.StagingStrategy;
import org.sparkbridge.util.JavaFileUtils;
import org.sparkbridge.util.Pair;

/**
 * Main entry point of the bridge. A BridgeContext owns the connection to an execution
 * engine, and is used to turn local collections and files into {@link BridgeRDD} handles
 * and to run jobs on them.
 *
 * <p>Create one context per process with {@link #create(BridgeConf)} and {@link #stop()} it
 * when done; a stopped context rejects every further call. Contexts can be used from
 * several threads at once. Local properties are scoped to the calling thread.</p>
 *
 * <pre>{@code
 *   BridgeContext bc = BridgeContext.create(
 *     new BridgeConf().setMaster("local[2]").setAppName("example"));
 *   BridgeRDD<Integer> rdd = bc.parallelize(Arrays.asList(1, 2, 3, 4), 2);
 *   bc.runJob(rdd, x -> x * 10, Arrays.asList(1));  // [[30, 40]]
 *   bc.stop();
 * }</pre>
 */
public class BridgeContext implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(BridgeContext.class);

  private final BridgeConf conf;
  private final EngineConnection engine;
  private final File tempDir;
  private final PartitionStager fileStager;
  private final PartitionStager directStager;
  private final JobDispatcher dispatcher;
  private final AtomicLong nextBroadcastId = new AtomicLong();
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  // Serializer that wrote the frames of each engine dataset created through this context.
  private final Cache<EngineDataset, Serializer> writers =
    CacheBuilder.newBuilder().weakKeys().build();

  private BridgeContext(BridgeConf conf, EngineConnection engine) {
    this.conf = conf;
    this.engine = engine;
    try {
      this.tempDir = JavaFileUtils.createDirectory(engine.localDir(), "bridge");
    } catch (IOException e) {
      engine.close();
      throw new ContextException("Failed to create a temp directory under " +
        engine.localDir(), e);
    }
    this.fileStager = new FileStager(engine, tempDir);
    this.directStager = new DirectStager(engine);
    this.dispatcher = new JobDispatcher(engine, conf.callSite());
    setCallSite(conf.callSite());
    LOG.info("Started bridge context for {} on {}",
      MDC.of(LogKeys.APP_NAME, conf.get(BridgeConf.APP_NAME)),
      MDC.of(LogKeys.MASTER_URL, conf.get(BridgeConf.MASTER)));
  }

  /**
   * Validates the configuration and connects to the engine serving its master URL.
   *
   * @throws ConfigException if the configuration is invalid or no engine serves the master
   */
  public static BridgeContext create(BridgeConf conf) {
    Preconditions.checkNotNull(conf, "conf");
    conf.validate();
    return new BridgeContext(conf, EngineProviders.connect(conf));
  }

  /**
   * Creates a context over an already open engine connection. The context takes ownership
   * of the connection and closes it on {@link #stop()}.
   *
   * @throws ConfigException if the configuration is invalid
   */
  public static BridgeContext create(BridgeConf conf, EngineConnection engine) {
    Preconditions.checkNotNull(conf, "conf");
    Preconditions.checkNotNull(engine, "engine");
    conf.validate();
    return new BridgeContext(conf, engine);
  }

  /** Stops the engine connection and removes the temp directory. Only valid once. */
  public void stop() {
    Preconditions.checkState(stopped.compareAndSet(false, true),
      "BridgeContext has already been stopped");
    shutdown();
  }

  /** Stops the context unless it was stopped already. Safe to call from several threads. */
  @Override
  public void close() {
    if (stopped.compareAndSet(false, true)) {
      shutdown();
    }
  }

  private void shutdown() {
    try {
      engine.close();
    } finally {
      try {
        JavaFileUtils.deleteRecursively(tempDir);
      } catch (IOException e) {
        LOG.warn("Failed to delete temp directory {}", e, MDC.of(LogKeys.PATH, tempDir));
      }
      LOG.info("Stopped bridge context");
    }
  }

  public boolean isStopped() {
    return stopped.get();
  }

  /** The configuration this context was created with. It cannot change at runtime. */
  public BridgeConf conf() {
    return conf;
  }

  /** Scratch directory of this context, inside the engine's local dir. */
  public File tempDir() {
    return tempDir;
  }

  public EngineConnection engine() {
    checkActive();
    return engine;
  }

  /** Default level of parallelism to use when not given by the caller. */
  public int defaultParallelism() {
    checkActive();
    return engine.defaultParallelism();
  }

  /**
   * Resolves a serializer by name with the configured batch size.
   *
   * @param name serializer name, or null for {@link BridgeConf#SERIALIZER}
   * @throws SerializerException if the name is unknown
   */
  public Serializer getSerializer(String name) {
    return getSerializer(name, (Integer) null);
  }

  /**
   * @param batchSize elements per frame, or null for {@link BridgeConf#BATCH_SIZE}
   */
  public Serializer getSerializer(String name, Integer batchSize) {
    return kindOf(name).newSerializer(batchSize != null ? batchSize : conf.batchSize());
  }

  /** Resolves a wrapping serializer, such as "pair" or "compressed", around others. */
  public Serializer getSerializer(String name, Serializer... nested) {
    return kindOf(name).newSerializer(conf.batchSize(), nested);
  }

  /**
   * Set a local property that affects jobs submitted from this thread, such as the
   * call site they are attributed to. A null value removes the property.
   */
  public void setLocalProperty(String key, String value) {
    checkActive();
    engine.setLocalProperty(key, value);
  }

  /** Get a local property set in this thread, or null if it is missing. */
  public String getLocalProperty(String key) {
    checkActive();
    return engine.getLocalProperty(key);
  }

  /** Attributes jobs submitted from this thread to the given call site. */
  public void setCallSite(String site) {
    setLocalProperty(JobDispatcher.EXTERNAL_CALL_SITE, site);
  }

  public String getCallSite() {
    checkActive();
    return engine.getCallSite();
  }

  /**
   * Add a file to be downloaded with every job of this context on every node.
   */
  public void addFile(String... paths) {
    checkActive();
    for (String path : paths) {
      engine.addFile(path);
    }
  }

  /** Registers a read-only value with the engine under a fresh id. */
  public <T> Broadcast<T> broadcast(T value) {
    return broadcast(value, null);
  }

  /**
   * Registers a read-only value with the engine. The value is written to a temp file which
   * the engine reads; the file is removed afterwards.
   *
   * @param id broadcast id, or null to assign the next free one
   * @throws SerializerException if the value is not serializable
   */
  public <T> Broadcast<T> broadcast(T value, Long id) {
    checkActive();
    if (value != null && !(value instanceof Serializable)) {
      throw new SerializerException("Broadcast value of " + value.getClass().getName() +
        " is not serializable");
    }
    long broadcastId = id != null ? id : nextBroadcastId.getAndIncrement();
    File file = null;
    try {
      file = File.createTempFile("broadcast", ".bin", tempDir);
      Files.write(file.toPath(), SerializationUtils.serialize((Serializable) value));
      engine.readBroadcastFromFile(broadcastId, file.getAbsolutePath());
    } catch (IOException | SerializationException e) {
      throw new SerializerException("Failed to write broadcast " + broadcastId, e);
    } finally {
      if (file != null && !file.delete() && file.exists()) {
        LOG.warn("Could not delete broadcast file {}", MDC.of(LogKeys.PATH, file));
      }
    }
    LOG.info("Registered broadcast {}", MDC.of(LogKeys.BROADCAST_ID, broadcastId));
    return new Broadcast<>(this, broadcastId, value);
  }

  /** Distributes a local collection over {@link #defaultParallelism()} partitions. */
  public <T> BridgeRDD<T> parallelize(Iterable<T> data) {
    return parallelize(data, null, SerializerOptions.defaults());
  }

  public <T> BridgeRDD<T> parallelize(Iterable<T> data, Integer numSlices) {
    return parallelize(data, numSlices, SerializerOptions.defaults());
  }

  /**
   * Distributes a local collection to form a dataset of {@code numSlices} partitions.
   * The elements are copied before encoding, so later changes to {@code data} are not seen.
   *
   * @param numSlices partition count, or null for {@link #defaultParallelism()}
   * @param options serializer, batch size and staging overrides
   */
  public <T> BridgeRDD<T> parallelize(Iterable<T> data, Integer numSlices,
      SerializerOptions options) {
    Preconditions.checkNotNull(data, "data");
    return parallelize(data.iterator(), numSlices, options);
  }

  /** Distributes the remaining elements of a lazy sequence. */
  public <T> BridgeRDD<T> parallelize(Iterator<T> data, Integer numSlices,
      SerializerOptions options) {
    checkActive();
    Preconditions.checkNotNull(data, "data");
    int slices = numSlices != null ? numSlices : defaultParallelism();
    if (slices < 1) {
      throw new ContextException("Number of slices must be positive, got " + slices);
    }
    SerializerOptions opts = options != null ? options : SerializerOptions.defaults();
    List<T> elements = Lists.newArrayList(data);
    Serializer serializer = getSerializer(opts.serializer(), opts.batchSize());
    PartitionStager stager = stagerFor(opts.staging());
    LOG.debug("Parallelizing {} elements into {} slices with {} via {}",
      elements.size(), slices, serializer, stager.strategy());
    EngineDataset dataset = stager.stage(elements, slices, serializer);
    recordWriter(dataset, serializer);
    return BridgeRDD.of(dataset, this, serializer);
  }

  public BridgeRDD<String> textFile(String path) {
    return textFile(path, null, SerializerOptions.defaults());
  }

  public BridgeRDD<String> textFile(String path, Integer minPartitions) {
    return textFile(path, minPartitions, SerializerOptions.defaults());
  }

  /**
   * Read a text file, or a directory of them, from a filesystem the engine can reach, as a
   * dataset of lines. The engine reads the files itself; nothing is staged locally.
   */
  public BridgeRDD<String> textFile(String path, Integer minPartitions,
      SerializerOptions options) {
    checkActive();
    int partitions = minPartitions != null ? minPartitions : defaultParallelism();
    Serializer serializer = resolve(options);
    EngineDataset dataset = engine.textFile(path, partitions);
    recordWriter(dataset, getSerializer(SerializerKind.UTF8.serializerName()));
    return BridgeRDD.of(dataset, this, serializer);
  }

  public BridgeRDD<Pair<String, String>> wholeTextFiles(String path) {
    return wholeTextFiles(path, null, SerializerOptions.defaults());
  }

  public BridgeRDD<Pair<String, String>> wholeTextFiles(String path, Integer minPartitions) {
    return wholeTextFiles(path, minPartitions, SerializerOptions.defaults());
  }

  /**
   * Read a directory of text files. Each file is a single record: a pair of the file's
   * path and its full content.
   */
  public BridgeRDD<Pair<String, String>> wholeTextFiles(String path, Integer minPartitions,
      SerializerOptions options) {
    checkActive();
    int partitions = minPartitions != null ? minPartitions : defaultParallelism();
    Serializer serializer = resolve(options);
    String utf8 = SerializerKind.UTF8.serializerName();
    EngineDataset dataset = engine.wholeTextFiles(path, partitions);
    recordWriter(dataset, getSerializer(SerializerKind.PAIR.serializerName(),
      getSerializer(utf8), getSerializer(utf8)));
    return BridgeRDD.of(dataset, this, serializer);
  }

  /** Applies {@code f} to every element of every partition. */
  public <T, R> List<List<R>> runJob(BridgeRDD<T> rdd, Function<T, R> f) {
    return runJob(rdd, f, null, false);
  }

  public <T, R> List<List<R>> runJob(BridgeRDD<T> rdd, Function<T, R> f,
      List<Integer> partitions) {
    return runJob(rdd, f, partitions, false);
  }

  public <T, R> List<List<R>> runJob(BridgeRDD<T> rdd, Function<T, R> f,
      List<Integer> partitions, boolean allowLocal) {
    return runJob(rdd, f, partitions, allowLocal, null);
  }

  /**
   * Executes {@code f} on each element of the given partitions and returns one list of
   * outputs per partition, ordered like {@code partitions}.
   *
   * @param partitions null for all partitions; indices past the partition count are skipped
   * @param allowLocal hint that the engine may run the job in the calling thread
   * @param properties extra properties for this job only, or null
   * @throws ContextException if {@code partitions} is malformed
   * @throws EngineException if the engine fails the job
   */
  public <T, R> List<List<R>> runJob(BridgeRDD<T> rdd, Function<T, R> f,
      List<Integer> partitions, boolean allowLocal, Map<String, String> properties) {
    checkActive();
    Preconditions.checkArgument(rdd.context() == this, "%s belongs to another context", rdd);
    return dispatcher.runJob(rdd, f, partitions, allowLocal, properties);
  }

  /** Executes a prebuilt command on the given partitions. */
  public <R> List<List<R>> runJobWithCommand(BridgeRDD<?> rdd, List<Integer> partitions,
      boolean allowLocal, Command command) {
    return runJobWithCommand(rdd, partitions, allowLocal, command, null);
  }

  public <R> List<List<R>> runJobWithCommand(BridgeRDD<?> rdd, List<Integer> partitions,
      boolean allowLocal, Command command, Map<String, String> properties) {
    checkActive();
    Preconditions.checkArgument(rdd.context() == this, "%s belongs to another context", rdd);
    return dispatcher.runJobWithCommand(rdd, partitions, allowLocal, command, properties);
  }

  /**
   * Records the serializer whose frames {@code dataset} holds. Handles bound to the dataset
   * must decode with an equal serializer.
   *
   * @throws SerializerException if a different serializer was already recorded
   */
  public void recordWriter(EngineDataset dataset, Serializer writer) {
    Preconditions.checkNotNull(dataset, "dataset");
    Preconditions.checkNotNull(writer, "writer");
    Serializer previous = writers.asMap().putIfAbsent(dataset, writer);
    if (previous != null) {
      previous.checkPairedWith(writer);
    }
  }

  /** The serializer that wrote {@code dataset}, or null if it was not created here. */
  public Serializer writerOf(EngineDataset dataset) {
    return writers.getIfPresent(dataset);
  }

  private Serializer resolve(SerializerOptions options) {
    SerializerOptions opts = options != null ? options : SerializerOptions.defaults();
    return getSerializer(opts.serializer(), opts.batchSize());
  }

  private SerializerKind kindOf(String name) {
    return SerializerKind.fromName(name != null ? name : conf.serializerName());
  }

  private PartitionStager stagerFor(StagingStrategy requested) {
    StagingStrategy strategy = requested != null ? requested : conf.stagingStrategy();
    return strategy == StagingStrategy.DIRECT ? directStager : fileStager;
  }

  private void checkActive() {
    Preconditions.checkState(!stopped.get(), "Cannot call methods on a stopped BridgeContext");
  }
}
