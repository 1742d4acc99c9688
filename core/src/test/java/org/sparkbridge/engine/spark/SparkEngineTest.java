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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

import org.sparkbridge.BridgeConf;
import org.sparkbridge.BridgeContext;
import org.sparkbridge.Broadcast;
import org.sparkbridge.EngineException;
import org.sparkbridge.SerializerOptions;
import org.sparkbridge.command.Command;
import org.sparkbridge.rdd.BridgeRDD;
import org.sparkbridge.util.Pair;

public class SparkEngineTest {

  private static final SerializerOptions ONE_PER_FRAME =
    SerializerOptions.defaults().withBatchSize(1);

  @TempDir
  File localDir;

  private SparkEngine engine;
  private BridgeContext bc;

  @BeforeEach
  public void setUp() {
    BridgeConf conf = new BridgeConf(false)
      .setMaster("local[2]")
      .setAppName("SparkEngineTest")
      .set(BridgeConf.LOCAL_DIR, localDir.getAbsolutePath())
      .set("spark.ui.enabled", "false")
      .set("spark.driver.host", "localhost")
      .set("spark.driver.bindAddress", "127.0.0.1");
    engine = new SparkEngine(conf);
    bc = BridgeContext.create(conf, engine);
  }

  @AfterEach
  public void tearDown() {
    if (bc != null) {
      bc.close();
      bc = null;
    }
  }

  @Test
  public void runsJobsOnSelectedPartitions() {
    BridgeRDD<Integer> rdd = bc.parallelize(Arrays.asList(0, 1, 2, 3, 4, 5), 2, ONE_PER_FRAME);
    assertEquals(2, rdd.partitionsSize());
    assertEquals(ImmutableList.of(ImmutableList.of(6, 8, 10)),
      bc.runJob(rdd, (Integer x) -> x * 2, Arrays.asList(1)));
    assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5), rdd.collect());

    Command odds = Command.<Integer>filter(x -> x % 2 == 1);
    List<List<Integer>> out = bc.runJobWithCommand(rdd, Arrays.asList(1, 0), false, odds);
    assertEquals(ImmutableList.of(ImmutableList.of(3, 5), ImmutableList.of(1)), out);
  }

  @Test
  public void parallelizesEmptyInput() {
    BridgeRDD<Integer> rdd = bc.parallelize(Collections.<Integer>emptyList(), 2);
    assertEquals(2, rdd.partitionsSize());
    assertEquals(ImmutableList.of(ImmutableList.of(), ImmutableList.of()),
      bc.runJob(rdd, (Integer x) -> x));
  }

  @Test
  public void readsTextFiles() throws IOException {
    File input = new File(localDir, "lines.txt");
    Files.write(input.toPath(), "first\nsecond\nthird\n".getBytes(StandardCharsets.UTF_8));
    BridgeRDD<String> lines = bc.textFile(input.getAbsolutePath(), 1);
    assertEquals(Arrays.asList("first", "second", "third"), lines.collect());

    File dir = new File(localDir, "docs");
    assertTrue(dir.mkdir());
    Files.write(new File(dir, "a.txt").toPath(), "hello\nworld".getBytes(StandardCharsets.UTF_8));
    List<Pair<String, String>> files = bc.wholeTextFiles(dir.getAbsolutePath(), 1).collect();
    assertEquals(1, files.size());
    assertTrue(files.get(0).getKey().endsWith("a.txt"), files.get(0).getKey());
    assertEquals("hello\nworld", files.get(0).getValue());
  }

  @Test
  public void reportsJobFailures() {
    BridgeRDD<Integer> rdd = bc.parallelize(Arrays.asList(1, 0), 1);
    assertThrows(EngineException.class, () -> bc.runJob(rdd, (Integer x) -> 1 / x));
  }

  @Test
  public void rejectsMissingPartitions() {
    BridgeRDD<Integer> rdd = bc.parallelize(Arrays.asList(1, 2), 2);
    assertThrows(EngineException.class,
      () -> engine.runJob(rdd.dataset(), new int[] {2}, false, ImmutableMap.of()));
  }

  @Test
  public void scopesJobProperties() {
    bc.setCallSite("caller.rb:12");
    bc.setLocalProperty("spark.job.description", "bridge");
    assertEquals("caller.rb:12", bc.getCallSite());
    assertEquals("bridge", engine.getLocalProperties().get("spark.job.description"));

    BridgeRDD<Integer> rdd = bc.parallelize(Arrays.asList(1), 1);
    bc.runJob(rdd, (Integer x) -> x, null, false, ImmutableMap.of("job.tag", "once"));
    assertNull(bc.getLocalProperty("job.tag"));
    assertEquals("bridge", bc.getLocalProperty("spark.job.description"));
  }

  @Test
  public void registersBroadcasts() {
    Broadcast<String> broadcast = bc.broadcast("shared");
    assertEquals("shared", broadcast.value());
    assertThrows(EngineException.class,
      () -> bc.broadcast("again", broadcast.id()));
    broadcast.unpersist();
  }

  @Test
  public void addsFiles() throws IOException {
    File data = new File(localDir, "data.txt");
    Files.write(data.toPath(), "x".getBytes(StandardCharsets.UTF_8));
    bc.addFile(data.getAbsolutePath());
    assertThrows(EngineException.class,
      () -> bc.addFile(new File(localDir, "missing.txt").getAbsolutePath()));
  }
}
