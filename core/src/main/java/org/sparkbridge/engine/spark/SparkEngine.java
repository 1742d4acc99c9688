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

import java.io.BufferedInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;
import scala.Tuple2;

import org.sparkbridge.BridgeConf;
import org.sparkbridge.EngineException;
import org.sparkbridge.engine.EngineConnection;
import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.engine.PartitionResult;
import org.sparkbridge.internal.LogKeys;
import org.sparkbridge.internal.Logger;
import org.sparkbridge.internal.LoggerFactory;
import org.sparkbridge.internal.MDC;
import org.sparkbridge.serializer.Frames;
import org.sparkbridge.serializer.PairSerializer;
import org.sparkbridge.serializer.UTF8Serializer;
import org.sparkbridge.util.Pair;

/**
 * An engine connection backed by a Spark driver. Datasets are RDDs of frames; commands run
 * inside {@code mapPartitionsWithIndex} on the executors, so the bridge classes and every
 * class the shipped functions reference must be on the executor classpath.
 *
 * <p>Spark schedules every job itself, so the {@code allowLocal} hint is ignored.</p>
 */
public class SparkEngine implements EngineConnection {

  private static final Logger LOG = LoggerFactory.getLogger(SparkEngine.class);

  static final String EXTERNAL_CALL_SITE = "externalCallSite";

  private final JavaSparkContext jsc;
  private final boolean ownsContext;
  private final String localDir;

  private final AtomicLong nextDatasetId = new AtomicLong();
  private final Map<Long, SparkDataset> datasets = new ConcurrentHashMap<>();
  private final Map<Long, Broadcast<byte[]>> broadcasts = new ConcurrentHashMap<>();
  private final Set<String> propertyKeys = ConcurrentHashMap.newKeySet();

  private volatile boolean closed = false;

  /** Starts a Spark driver configured with every setting of {@code conf}. */
  public SparkEngine(BridgeConf conf) {
    this(new JavaSparkContext(toSparkConf(conf)), true);
  }

  /**
   * Wraps a running Spark context.
   *
   * @param ownsContext whether {@link #close()} stops {@code jsc}
   */
  public SparkEngine(JavaSparkContext jsc, boolean ownsContext) {
    this.jsc = Preconditions.checkNotNull(jsc, "jsc");
    this.ownsContext = ownsContext;
    this.localDir = jsc.getConf()
      .get(BridgeConf.LOCAL_DIR, System.getProperty("java.io.tmpdir"))
      .split(",")[0].trim();
    LOG.info("Connected to Spark at {}", MDC.of(LogKeys.MASTER_URL, jsc.master()));
  }

  static SparkConf toSparkConf(BridgeConf conf) {
    SparkConf sparkConf = new SparkConf(false);
    for (Map.Entry<String, String> entry : conf.getAll().entrySet()) {
      sparkConf.set(entry.getKey(), entry.getValue());
    }
    return sparkConf;
  }

  /** The underlying Spark context. */
  public JavaSparkContext sparkContext() {
    return jsc;
  }

  @Override
  public int defaultParallelism() {
    checkOpen();
    return jsc.defaultParallelism();
  }

  @Override
  public String localDir() {
    checkOpen();
    return localDir;
  }

  @Override
  public EngineDataset readRDDFromFile(String path, int numSlices) {
    checkOpen();
    List<byte[]> frames;
    try (InputStream in = new BufferedInputStream(new FileInputStream(path))) {
      frames = Frames.readAll(in);
    } catch (IOException e) {
      throw new EngineException("Failed to read " + path, e);
    }
    return parallelize(frames, numSlices);
  }

  @Override
  public EngineDataset parallelize(List<byte[]> frames, int numSlices) {
    checkOpen();
    if (numSlices < 1) {
      throw new EngineException("Positive number of partitions required, got " + numSlices);
    }
    return register(jsc.parallelize(new ArrayList<>(frames), numSlices));
  }

  @Override
  public EngineDataset textFile(String path, int minPartitions) {
    checkOpen();
    return register(jsc.textFile(path, minPartitions)
      .map(line -> line.getBytes(StandardCharsets.UTF_8)));
  }

  @Override
  public EngineDataset wholeTextFiles(String path, int minPartitions) {
    checkOpen();
    return register(jsc.wholeTextFiles(path, minPartitions).map(SparkEngine::encodeWholeFile));
  }

  private static byte[] encodeWholeFile(Tuple2<String, String> file) throws IOException {
    PairSerializer format = new PairSerializer(new UTF8Serializer(), new UTF8Serializer());
    return format.encodeBatch(Collections.singletonList(Pair.of(file._1(), file._2())));
  }

  @Override
  public EngineDataset pipeline(EngineDataset parent, byte[] command) {
    checkOpen();
    JavaRDD<byte[]> source = resolve(parent).rdd();
    return register(source.mapPartitionsWithIndex(new CommandRunner(command), true));
  }

  @Override
  public int numPartitions(EngineDataset dataset) {
    checkOpen();
    return resolve(dataset).rdd().getNumPartitions();
  }

  @Override
  public Iterator<PartitionResult> runJob(
      EngineDataset dataset,
      int[] partitions,
      boolean allowLocal,
      Map<String, String> properties) {
    checkOpen();
    SparkDataset target = resolve(dataset);
    int numPartitions = target.rdd().getNumPartitions();
    for (int p : partitions) {
      if (p < 0 || p >= numPartitions) {
        throw new EngineException("Partition " + p + " does not exist in " + target +
          " with " + numPartitions + " partitions");
      }
    }
    LOG.info("Running job from {} on {} partitions",
      MDC.of(LogKeys.CALL_SITE, properties.get(EXTERNAL_CALL_SITE)),
      MDC.of(LogKeys.NUM_PARTITIONS, partitions.length));

    Map<String, String> previous = new HashMap<>();
    for (Map.Entry<String, String> property : properties.entrySet()) {
      previous.put(property.getKey(), jsc.getLocalProperty(property.getKey()));
      jsc.setLocalProperty(property.getKey(), property.getValue());
    }
    List<byte[]>[] collected;
    try {
      collected = target.rdd().collectPartitions(partitions);
    } catch (Exception e) {
      // Spark rethrows task failures as the checked SparkException.
      throw new EngineException("Job on " + target + " failed", e);
    } finally {
      previous.forEach(jsc::setLocalProperty);
    }
    List<PartitionResult> results = new ArrayList<>(partitions.length);
    for (int i = 0; i < partitions.length; i++) {
      results.add(new PartitionResult(partitions[i], Frames.join(collected[i])));
    }
    return results.iterator();
  }

  @Override
  public void addFile(String path) {
    checkOpen();
    if (!Files.isRegularFile(Paths.get(path))) {
      throw new EngineException("File " + path + " does not exist");
    }
    try {
      jsc.addFile(path);
    } catch (Exception e) {
      throw new EngineException("Failed to add file " + path, e);
    }
    LOG.info("Added file {}", MDC.of(LogKeys.PATH, path));
  }

  @Override
  public void readBroadcastFromFile(long id, String path) {
    checkOpen();
    byte[] value;
    try {
      value = Files.readAllBytes(Paths.get(path));
    } catch (IOException e) {
      throw new EngineException("Failed to read broadcast " + id + " from " + path, e);
    }
    if (broadcasts.containsKey(id)) {
      throw new EngineException("Broadcast " + id + " is already registered");
    }
    broadcasts.put(id, jsc.broadcast(value));
  }

  @Override
  public void unpersistBroadcast(long id) {
    checkOpen();
    Broadcast<byte[]> broadcast = broadcasts.remove(id);
    if (broadcast != null) {
      broadcast.unpersist();
    }
  }

  @Override
  public void setLocalProperty(String key, String value) {
    checkOpen();
    jsc.setLocalProperty(key, value);
    if (value != null) {
      propertyKeys.add(key);
    }
    if (EXTERNAL_CALL_SITE.equals(key)) {
      if (value != null) {
        jsc.setCallSite(value);
      } else {
        jsc.clearCallSite();
      }
    }
  }

  @Override
  public String getLocalProperty(String key) {
    checkOpen();
    return jsc.getLocalProperty(key);
  }

  @Override
  public Map<String, String> getLocalProperties() {
    checkOpen();
    ImmutableMap.Builder<String, String> snapshot = ImmutableMap.builder();
    for (String key : propertyKeys) {
      String value = jsc.getLocalProperty(key);
      if (value != null) {
        snapshot.put(key, value);
      }
    }
    return snapshot.build();
  }

  @Override
  public String getCallSite() {
    checkOpen();
    String site = jsc.getLocalProperty(EXTERNAL_CALL_SITE);
    return site != null ? site : "<unknown>";
  }

  @Override
  public void close() {
    Preconditions.checkState(!closed, "Spark engine already stopped");
    closed = true;
    datasets.clear();
    broadcasts.clear();
    if (ownsContext) {
      jsc.stop();
    }
    LOG.info("Spark engine stopped");
  }

  private SparkDataset register(JavaRDD<byte[]> rdd) {
    SparkDataset dataset = new SparkDataset(nextDatasetId.incrementAndGet(), rdd);
    datasets.put(dataset.id(), dataset);
    LOG.debug("Registered {}", dataset);
    return dataset;
  }

  private SparkDataset resolve(EngineDataset dataset) {
    SparkDataset spark = dataset == null ? null : datasets.get(dataset.id());
    if (spark == null || spark != dataset) {
      throw new EngineException("Unknown dataset " + dataset);
    }
    return spark;
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "Spark engine already stopped");
  }
}
