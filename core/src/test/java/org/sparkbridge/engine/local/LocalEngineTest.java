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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

import org.sparkbridge.BridgeConf;
import org.sparkbridge.EngineException;
import org.sparkbridge.command.Command;
import org.sparkbridge.command.StageExecutionException;
import org.sparkbridge.command.WorkerCommand;
import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.engine.PartitionResult;
import org.sparkbridge.serializer.MarshalSerializer;
import org.sparkbridge.serializer.PairSerializer;
import org.sparkbridge.serializer.Serializer;
import org.sparkbridge.serializer.UTF8Serializer;
import org.sparkbridge.util.Pair;

public class LocalEngineTest {

  @TempDir
  File localDir;

  private static volatile String lastTaskThread;

  private LocalEngine engine;
  private final Serializer marshal = new MarshalSerializer(1);

  @BeforeEach
  public void setUp() {
    engine = new LocalEngine(new BridgeConf(false)
      .setMaster("local[2]")
      .setAppName("LocalEngineTest")
      .set(BridgeConf.LOCAL_DIR, localDir.getAbsolutePath()));
  }

  @AfterEach
  public void tearDown() {
    if (engine != null) {
      engine.close();
      engine = null;
    }
  }

  @Test
  public void parsesMasterUrls() {
    assertEquals(1, LocalEngine.threadsFor("local"));
    assertEquals(4, LocalEngine.threadsFor("local[4]"));
    assertEquals(Runtime.getRuntime().availableProcessors(), LocalEngine.threadsFor("local[*]"));
    assertEquals(-1, LocalEngine.threadsFor("spark://host:7077"));
    assertEquals(-1, LocalEngine.threadsFor(null));
    assertEquals(2, engine.defaultParallelism());
  }

  @Test
  public void slicesContiguously() {
    List<List<Integer>> slices = LocalEngine.slice(Arrays.asList(0, 1, 2, 3, 4, 5), 4);
    assertEquals(Arrays.asList(
      Arrays.asList(0), Arrays.asList(1, 2), Arrays.asList(3), Arrays.asList(4, 5)), slices);

    List<List<Integer>> sparse = LocalEngine.slice(Arrays.asList(7, 8), 4);
    assertEquals(4, sparse.size());
    assertEquals(2, sparse.stream().mapToInt(List::size).sum());
    assertThrows(EngineException.class, () -> LocalEngine.slice(Arrays.asList(1), 0));
  }

  @Test
  public void runsPipelinedJobs() {
    EngineDataset source =
      engine.parallelize(marshal.dumpToFrames(Arrays.asList(1, 2, 3, 4).iterator()), 2);
    assertEquals(2, engine.numPartitions(source));

    WorkerCommand command =
      new WorkerCommand(marshal, marshal, Command.<Integer, Integer>map(x -> x * 10));
    EngineDataset mapped = engine.pipeline(source, command.toBytes());
    assertEquals(2, engine.numPartitions(mapped));

    Map<Integer, List<Object>> results =
      collect(engine.runJob(mapped, new int[] {1, 0}, false, ImmutableMap.of()));
    assertEquals(Arrays.asList(10, 20), results.get(0));
    assertEquals(Arrays.asList(30, 40), results.get(1));
  }

  @Test
  public void runsSinglePartitionInCallerThread() {
    EngineDataset source =
      engine.parallelize(marshal.dumpToFrames(Arrays.asList("a", "b").iterator()), 2);
    WorkerCommand command = new WorkerCommand(marshal, marshal,
      Command.<String, String>map(x -> {
        lastTaskThread = Thread.currentThread().getName();
        return x;
      }));
    EngineDataset mapped = engine.pipeline(source, command.toBytes());

    Iterator<PartitionResult> results =
      engine.runJob(mapped, new int[] {1}, true, ImmutableMap.of());
    assertEquals(Collections.singletonList("b"), collect(results).get(1));
    assertEquals(Thread.currentThread().getName(), lastTaskThread);

    collect(engine.runJob(mapped, new int[] {0, 1}, true, ImmutableMap.of()));
    assertTrue(lastTaskThread.startsWith("local-engine-task-"));
  }

  @Test
  public void reportsTaskFailures() {
    EngineDataset source =
      engine.parallelize(marshal.dumpToFrames(Arrays.asList(1, 0).iterator()), 2);
    WorkerCommand command =
      new WorkerCommand(marshal, marshal, Command.<Integer, Integer>map(x -> 10 / x));
    EngineDataset failing = engine.pipeline(source, command.toBytes());

    EngineException e = assertThrows(EngineException.class,
      () -> collect(engine.runJob(failing, new int[] {0, 1}, false, ImmutableMap.of())));
    assertTrue(e.getCause() instanceof StageExecutionException);

    EngineException local = assertThrows(EngineException.class,
      () -> engine.runJob(failing, new int[] {1}, true, ImmutableMap.of()));
    assertTrue(local.getCause() instanceof StageExecutionException);
  }

  @Test
  public void rejectsMissingPartitions() {
    EngineDataset source = engine.parallelize(new ArrayList<>(), 2);
    assertThrows(EngineException.class,
      () -> engine.runJob(source, new int[] {2}, false, ImmutableMap.of()));
    assertThrows(EngineException.class, () -> engine.numPartitions(() -> 999L));
  }

  @Test
  public void readsTextFiles() throws IOException {
    File dir = new File(localDir, "input");
    assertTrue(dir.mkdir());
    Files.write(new File(dir, "a.txt").toPath(), "one\ntwo\n".getBytes(StandardCharsets.UTF_8));
    Files.write(new File(dir, "b.txt").toPath(), "three".getBytes(StandardCharsets.UTF_8));
    Files.write(new File(dir, "_SUCCESS").toPath(), new byte[0]);

    EngineDataset lines = engine.textFile(dir.getAbsolutePath(), 2);
    Serializer utf8 = new UTF8Serializer();
    Map<Integer, byte[]> raw = rawResults(engine.runJob(lines, new int[] {0, 1}, false,
      ImmutableMap.of()));
    List<Object> decoded = new ArrayList<>(utf8.loadFromBytes(raw.get(0)));
    decoded.addAll(utf8.loadFromBytes(raw.get(1)));
    assertEquals(Arrays.asList("one", "two", "three"), decoded);

    assertThrows(EngineException.class,
      () -> engine.textFile(new File(localDir, "missing").getAbsolutePath(), 1));
  }

  @Test
  public void readsWholeTextFiles() throws IOException {
    File dir = new File(localDir, "docs");
    assertTrue(dir.mkdir());
    File a = new File(dir, "a.txt");
    Files.write(a.toPath(), "alpha\nbeta".getBytes(StandardCharsets.UTF_8));
    Files.write(new File(dir, "b.txt").toPath(), "".getBytes(StandardCharsets.UTF_8));

    EngineDataset files = engine.wholeTextFiles(dir.getAbsolutePath(), 1);
    PairSerializer format = new PairSerializer(new UTF8Serializer(), new UTF8Serializer());
    List<Object> pairs = format.loadFromBytes(
      rawResults(engine.runJob(files, new int[] {0}, false, ImmutableMap.of())).get(0));
    assertEquals(2, pairs.size());
    assertEquals(Pair.of(a.toURI().toString(), "alpha\nbeta"), pairs.get(0));
    assertEquals("", ((Pair<?, ?>) pairs.get(1)).getValue());
  }

  @Test
  public void textReadersRejectMalformedUtf8() throws IOException {
    File dir = new File(localDir, "latin1");
    assertTrue(dir.mkdir());
    File latin1 = new File(dir, "latin1.txt");
    Files.write(latin1.toPath(), "caf\u00e9\n".getBytes(StandardCharsets.ISO_8859_1));

    assertThrows(EngineException.class, () -> engine.textFile(latin1.getAbsolutePath(), 1));
    assertThrows(EngineException.class, () -> engine.wholeTextFiles(dir.getAbsolutePath(), 1));
  }

  @Test
  public void distributesFiles() throws IOException {
    File data = new File(localDir, "lookup.csv");
    Files.write(data.toPath(), "k,v".getBytes(StandardCharsets.UTF_8));
    engine.addFile(data.getAbsolutePath());
    assertTrue(new File(engine.filesDir(), "lookup.csv").isFile());
    assertThrows(EngineException.class,
      () -> engine.addFile(new File(localDir, "nope").getAbsolutePath()));
  }

  @Test
  public void registersBroadcasts() throws IOException {
    File value = new File(localDir, "bc.bin");
    Files.write(value.toPath(), new byte[] {1, 2, 3});
    engine.readBroadcastFromFile(7, value.getAbsolutePath());
    assertTrue(engine.hasBroadcast(7));
    assertThrows(EngineException.class,
      () -> engine.readBroadcastFromFile(7, value.getAbsolutePath()));
    engine.unpersistBroadcast(7);
    assertFalse(engine.hasBroadcast(7));
  }

  @Test
  public void localPropertiesArePerThread() throws InterruptedException {
    engine.setLocalProperty("externalCallSite", "driver");
    assertEquals("driver", engine.getCallSite());
    assertEquals(ImmutableMap.of("externalCallSite", "driver"), engine.getLocalProperties());

    Map<String, String> seenByChild = new HashMap<>();
    Thread child = new Thread(() -> {
      seenByChild.putAll(engine.getLocalProperties());
      engine.setLocalProperty("externalCallSite", "child");
    });
    child.start();
    child.join();
    assertEquals("driver", seenByChild.get("externalCallSite"));
    assertEquals("driver", engine.getLocalProperty("externalCallSite"));

    engine.setLocalProperty("externalCallSite", null);
    assertNull(engine.getLocalProperty("externalCallSite"));
    assertEquals("<unknown>", engine.getCallSite());
  }

  @Test
  public void closeIsTerminal() {
    LocalEngine closing = engine;
    engine = null;
    File[] workDirs = localDir.listFiles(f -> f.getName().startsWith("local-engine"));
    assertEquals(1, workDirs.length);

    closing.close();
    assertFalse(workDirs[0].exists());
    assertThrows(IllegalStateException.class, closing::close);
    assertThrows(IllegalStateException.class, closing::defaultParallelism);
  }

  private Map<Integer, List<Object>> collect(Iterator<PartitionResult> results) {
    Map<Integer, List<Object>> out = new HashMap<>();
    rawResults(results).forEach((p, data) -> out.put(p, marshal.loadFromBytes(data)));
    return out;
  }

  private static Map<Integer, byte[]> rawResults(Iterator<PartitionResult> results) {
    Map<Integer, byte[]> out = new HashMap<>();
    results.forEachRemaining(r -> out.put(r.partition(), r.data()));
    return out;
  }
}
