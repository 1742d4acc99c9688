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

package org.sparkbridge.engine.local;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

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
import org.sparkbridge.util.JavaFileUtils;
import org.sparkbridge.util.NamedThreadFactory;
import org.sparkbridge.util.Pair;

/**
 * An engine running inside the driver JVM. Partitions are computed by a fixed pool of
 * daemon threads, one task per partition; commands are deserialized per task exactly as a
 * remote worker would. There is no fault tolerance: a failed task fails its job.
 *
 * <p>Master URLs: {@code local} (one thread), {@code local[N]}, {@code local[*]} (one thread
 * per available processor).</p>
 */
public class LocalEngine implements EngineConnection {

  private static final Logger LOG = LoggerFactory.getLogger(LocalEngine.class);

  private static final Pattern LOCAL_N_REGEX = Pattern.compile("local\\[([0-9]+|\\*)\\]");

  static final String EXTERNAL_CALL_SITE = "externalCallSite";

  private final int threads;
  private final int defaultParallelism;
  private final String localDir;
  private final File workDir;
  private final File filesDir;
  private final ExecutorService executor;

  private final AtomicLong nextDatasetId = new AtomicLong();
  private final AtomicInteger nextJobId = new AtomicInteger();
  private final Map<Long, LocalDataset> datasets = new ConcurrentHashMap<>();
  private final Map<Long, byte[]> broadcasts = new ConcurrentHashMap<>();
  private final InheritableThreadLocal<Map<String, String>> localProperties =
    new InheritableThreadLocal<>() {
      @Override
      protected Map<String, String> childValue(Map<String, String> parent) {
        return new HashMap<>(parent);
      }

      @Override
      protected Map<String, String> initialValue() {
        return new HashMap<>();
      }
    };

  private volatile boolean closed = false;

  public LocalEngine(BridgeConf conf) {
    String master = conf.get(BridgeConf.MASTER);
    this.threads = threadsFor(master);
    Preconditions.checkArgument(threads > 0, "Not a local master URL: %s", master);
    this.defaultParallelism = conf.getInt(BridgeConf.DEFAULT_PARALLELISM, threads);
    this.localDir = conf.get(BridgeConf.LOCAL_DIR, System.getProperty("java.io.tmpdir"))
      .split(",")[0].trim();
    try {
      this.workDir = JavaFileUtils.createDirectory(localDir, "local-engine");
    } catch (IOException e) {
      throw new EngineException("Failed to create the engine work directory under " +
        localDir, e);
    }
    this.filesDir = new File(workDir, "files");
    if (!filesDir.mkdir()) {
      throw new EngineException("Failed to create " + filesDir);
    }
    this.executor = Executors.newFixedThreadPool(threads,
      new NamedThreadFactory("local-engine-task-%d"));
    LOG.info("Started local engine with {} threads", MDC.of(LogKeys.NUM_THREADS, threads));
  }

  /** Thread count for a local master URL, or -1 if the URL is not a local one. */
  static int threadsFor(String master) {
    if ("local".equals(master)) {
      return 1;
    }
    if (master == null) {
      return -1;
    }
    Matcher m = LOCAL_N_REGEX.matcher(master);
    if (!m.matches()) {
      return -1;
    }
    if ("*".equals(m.group(1))) {
      return Runtime.getRuntime().availableProcessors();
    }
    return Integer.parseInt(m.group(1));
  }

  @Override
  public int defaultParallelism() {
    checkOpen();
    return defaultParallelism;
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
    return register(frames, numSlices);
  }

  @Override
  public EngineDataset parallelize(List<byte[]> frames, int numSlices) {
    checkOpen();
    return register(ImmutableList.copyOf(frames), numSlices);
  }

  @Override
  public EngineDataset textFile(String path, int minPartitions) {
    checkOpen();
    List<byte[]> frames = new ArrayList<>();
    for (File file : inputFiles(path)) {
      try {
        for (String line : Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)) {
          frames.add(line.getBytes(StandardCharsets.UTF_8));
        }
      } catch (IOException e) {
        throw new EngineException("Failed to read " + file, e);
      }
    }
    return register(frames, minPartitions);
  }

  @Override
  public EngineDataset wholeTextFiles(String path, int minPartitions) {
    checkOpen();
    PairSerializer format = new PairSerializer(new UTF8Serializer(), new UTF8Serializer());
    List<byte[]> frames = new ArrayList<>();
    for (File file : inputFiles(path)) {
      try {
        String content = decodeUtf8(Files.readAllBytes(file.toPath()));
        frames.add(format.encodeBatch(
          Collections.singletonList(Pair.of(file.toURI().toString(), content))));
      } catch (IOException e) {
        throw new EngineException("Failed to read " + file, e);
      }
    }
    return register(frames, minPartitions);
  }

  @Override
  public EngineDataset pipeline(EngineDataset parent, byte[] command) {
    checkOpen();
    LocalDataset dataset =
      LocalDataset.pipelined(nextDatasetId.incrementAndGet(), resolve(parent), command);
    datasets.put(dataset.id(), dataset);
    return dataset;
  }

  @Override
  public int numPartitions(EngineDataset dataset) {
    checkOpen();
    return resolve(dataset).numPartitions();
  }

  @Override
  public Iterator<PartitionResult> runJob(
      EngineDataset dataset,
      int[] partitions,
      boolean allowLocal,
      Map<String, String> properties) {
    checkOpen();
    LocalDataset target = resolve(dataset);
    int numPartitions = target.numPartitions();
    for (int p : partitions) {
      if (p < 0 || p >= numPartitions) {
        throw new EngineException("Partition " + p + " does not exist in " + target +
          " with " + numPartitions + " partitions");
      }
    }
    int jobId = nextJobId.incrementAndGet();
    ClassLoader loader = commandLoader();
    LOG.info("Job {} submitted from {} on {} partitions",
      MDC.of(LogKeys.JOB_ID, jobId),
      MDC.of(LogKeys.CALL_SITE, properties.get(EXTERNAL_CALL_SITE)),
      MDC.of(LogKeys.NUM_PARTITIONS, partitions.length));

    if (allowLocal && partitions.length == 1) {
      PartitionResult result;
      try {
        result = computeTask(jobId, target, partitions[0], loader);
      } catch (RuntimeException e) {
        throw new EngineException("Job " + jobId + " aborted due to task failure", e);
      }
      return Collections.singletonList(result).iterator();
    }

    CompletionService<PartitionResult> completion = new ExecutorCompletionService<>(executor);
    List<Future<PartitionResult>> tasks = new ArrayList<>(partitions.length);
    for (int p : partitions) {
      tasks.add(completion.submit(() -> computeTask(jobId, target, p, loader)));
    }
    return new Iterator<>() {
      private int remaining = partitions.length;

      @Override
      public boolean hasNext() {
        return remaining > 0;
      }

      @Override
      public PartitionResult next() {
        if (remaining == 0) {
          throw new NoSuchElementException();
        }
        try {
          PartitionResult result = completion.take().get();
          remaining--;
          return result;
        } catch (ExecutionException e) {
          tasks.forEach(t -> t.cancel(true));
          remaining = 0;
          throw new EngineException("Job " + jobId + " aborted due to task failure", e.getCause());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          tasks.forEach(t -> t.cancel(true));
          remaining = 0;
          throw new EngineException("Interrupted while waiting for job " + jobId, e);
        }
      }
    };
  }

  @Override
  public void addFile(String path) {
    checkOpen();
    File source = new File(path);
    if (!source.isFile()) {
      throw new EngineException("File " + path + " does not exist");
    }
    try {
      Files.copy(source.toPath(), new File(filesDir, source.getName()).toPath(),
        StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new EngineException("Failed to add file " + path, e);
    }
    LOG.info("Added file {}", MDC.of(LogKeys.PATH, path));
  }

  @Override
  public void readBroadcastFromFile(long id, String path) {
    checkOpen();
    byte[] value;
    try {
      value = Files.readAllBytes(new File(path).toPath());
    } catch (IOException e) {
      throw new EngineException("Failed to read broadcast " + id + " from " + path, e);
    }
    if (broadcasts.putIfAbsent(id, value) != null) {
      throw new EngineException("Broadcast " + id + " is already registered");
    }
  }

  @Override
  public void unpersistBroadcast(long id) {
    checkOpen();
    broadcasts.remove(id);
  }

  @Override
  public void setLocalProperty(String key, String value) {
    checkOpen();
    if (value == null) {
      localProperties.get().remove(key);
    } else {
      localProperties.get().put(key, value);
    }
  }

  @Override
  public String getLocalProperty(String key) {
    checkOpen();
    return localProperties.get().get(key);
  }

  @Override
  public Map<String, String> getLocalProperties() {
    checkOpen();
    return ImmutableMap.copyOf(localProperties.get());
  }

  @Override
  public String getCallSite() {
    checkOpen();
    String site = localProperties.get().get(EXTERNAL_CALL_SITE);
    return site != null ? site : "<unknown>";
  }

  @Override
  public void close() {
    Preconditions.checkState(!closed, "Local engine already stopped");
    closed = true;
    executor.shutdownNow();
    datasets.clear();
    broadcasts.clear();
    try {
      JavaFileUtils.deleteRecursively(workDir);
    } catch (IOException e) {
      LOG.warn("Failed to delete engine work directory {}", e, MDC.of(LogKeys.PATH, workDir));
    }
    LOG.info("Local engine stopped");
  }

  @VisibleForTesting
  File filesDir() {
    return filesDir;
  }

  @VisibleForTesting
  boolean hasBroadcast(long id) {
    return broadcasts.containsKey(id);
  }

  /**
   * Splits a sequence into numSlices contiguous slices, the i-th one covering positions
   * {@code [i * n / numSlices, (i + 1) * n / numSlices)}. Slices may be empty.
   */
  @VisibleForTesting
  static <T> List<List<T>> slice(List<T> seq, int numSlices) {
    if (numSlices < 1) {
      throw new EngineException("Positive number of partitions required, got " + numSlices);
    }
    long length = seq.size();
    List<List<T>> slices = new ArrayList<>(numSlices);
    for (int i = 0; i < numSlices; i++) {
      int start = (int) ((i * length) / numSlices);
      int end = (int) (((i + 1) * length) / numSlices);
      slices.add(ImmutableList.copyOf(seq.subList(start, end)));
    }
    return slices;
  }

  private PartitionResult computeTask(int jobId, LocalDataset dataset, int partition,
      ClassLoader loader) {
    long start = System.nanoTime();
    byte[] data = Frames.join(dataset.compute(partition, loader));
    LOG.debug("Job {} finished partition {} in {} ms", jobId, partition,
      (System.nanoTime() - start) / 1_000_000);
    return new PartitionResult(partition, data);
  }

  private LocalDataset register(List<byte[]> frames, int numSlices) {
    LocalDataset dataset =
      LocalDataset.source(nextDatasetId.incrementAndGet(), slice(frames, numSlices));
    datasets.put(dataset.id(), dataset);
    LOG.debug("Registered {} with {} frames in {} partitions", dataset, frames.size(), numSlices);
    return dataset;
  }

  private LocalDataset resolve(EngineDataset dataset) {
    LocalDataset local = dataset == null ? null : datasets.get(dataset.id());
    if (local == null || local != dataset) {
      throw new EngineException("Unknown dataset " + dataset);
    }
    return local;
  }

  private List<File> inputFiles(String path) {
    File input = new File(path);
    if (!input.exists()) {
      throw new EngineException("Input path does not exist: " + path);
    }
    if (input.isFile()) {
      return Collections.singletonList(input);
    }
    File[] children = input.listFiles(f ->
      f.isFile() && !f.getName().startsWith(".") && !f.getName().startsWith("_"));
    if (children == null) {
      throw new EngineException("Failed to list " + path);
    }
    Arrays.sort(children);
    return Arrays.asList(children);
  }

  /** Strict UTF-8 decoding; malformed input fails like it does for line reads. */
  static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
    return StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT)
      .decode(ByteBuffer.wrap(bytes))
      .toString();
  }

  private static ClassLoader commandLoader() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    return loader != null ? loader : LocalEngine.class.getClassLoader();
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "Local engine already stopped");
  }
}
