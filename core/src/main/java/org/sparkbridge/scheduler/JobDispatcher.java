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

package org.sparkbridge.scheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.sparkbridge.ContextException;
import org.sparkbridge.api.java.function.Function;
import org.sparkbridge.command.Command;
import org.sparkbridge.engine.EngineConnection;
import org.sparkbridge.engine.PartitionResult;
import org.sparkbridge.internal.LogKeys;
import org.sparkbridge.internal.Logger;
import org.sparkbridge.internal.LoggerFactory;
import org.sparkbridge.internal.MDC;
import org.sparkbridge.rdd.BridgeRDD;
import org.sparkbridge.rdd.PipelinedRDD;

/**
 * Runs commands over a chosen subset of a handle's partitions and brings the decoded
 * results back to the driver.
 *
 * <p>The dispatcher never retries: an engine failure is rethrown as is, and no partial
 * result reaches the caller.</p>
 */
public class JobDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(JobDispatcher.class);

  public static final String EXTERNAL_CALL_SITE = "externalCallSite";

  private final EngineConnection engine;
  private final String defaultCallSite;

  public JobDispatcher(EngineConnection engine, String defaultCallSite) {
    this.engine = engine;
    this.defaultCallSite = defaultCallSite;
  }

  /**
   * Applies {@code f} to every element of the selected partitions.
   *
   * @return one list of outputs per selected partition, in the order of {@code partitions}
   */
  public <T, R> List<List<R>> runJob(
      BridgeRDD<T> rdd,
      Function<T, R> f,
      List<Integer> partitions,
      boolean allowLocal,
      Map<String, String> properties) {
    return runJobWithCommand(rdd, partitions, allowLocal, Command.map(f), properties);
  }

  /**
   * Runs {@code command} on the selected partitions of {@code rdd}.
   *
   * @param partitions null for all partitions, otherwise distinct non-negative indices;
   *                   indices past the current partition count are skipped
   * @param allowLocal hint that the engine may run the job in the calling thread
   * @param properties properties attached to this job on top of the thread's local ones
   * @throws ContextException if {@code partitions} is malformed; the engine is not called
   */
  public <R> List<List<R>> runJobWithCommand(
      BridgeRDD<?> rdd,
      List<Integer> partitions,
      boolean allowLocal,
      Command command,
      Map<String, String> properties) {
    validatePartitions(partitions);
    int partitionsSize = rdd.partitionsSize();
    int[] selected = selectPartitions(partitions, partitionsSize);
    if (selected.length == 0) {
      return ImmutableList.of();
    }

    PipelinedRDD<R> mapped = rdd.newRddFromCommand(command);
    Map<String, String> jobProperties = jobProperties(properties);
    long start = System.nanoTime();
    Iterator<PartitionResult> results =
      engine.runJob(mapped.dataset(), selected, allowLocal, jobProperties);
    List<List<R>> collected = mapped.collectFromIterator(results, selected);
    LOG.debug("Job {} over {} partitions took {} ms", command, selected.length,
      (System.nanoTime() - start) / 1_000_000);
    return collected;
  }

  /**
   * Checks the shape of a partition list: null, or a list of distinct, non-negative
   * integers. Runs before anything is sent to the engine.
   */
  @VisibleForTesting
  static void validatePartitions(List<?> partitions) {
    if (partitions == null) {
      return;
    }
    Set<Integer> seen = new HashSet<>();
    for (Object p : partitions) {
      if (!(p instanceof Integer)) {
        throw new ContextException("Partitions must be null or a list of integers, found " +
          (p == null ? "null" : p.getClass().getSimpleName() + " " + p));
      }
      int index = (Integer) p;
      if (index < 0) {
        throw new ContextException("Partition indices must be non-negative, found " + index);
      }
      if (!seen.add(index)) {
        throw new ContextException("Partition " + index + " is listed more than once");
      }
    }
  }

  /**
   * Resolves the requested partitions against the current partition count. Indices past the
   * end are dropped: an earlier repartitioning may have shrunk the dataset after the caller
   * computed them.
   */
  @VisibleForTesting
  static int[] selectPartitions(List<Integer> partitions, int partitionsSize) {
    if (partitions == null) {
      int[] all = new int[partitionsSize];
      for (int i = 0; i < partitionsSize; i++) {
        all[i] = i;
      }
      return all;
    }
    List<Integer> kept = new ArrayList<>(partitions.size());
    for (int p : partitions) {
      if (p < partitionsSize) {
        kept.add(p);
      } else {
        LOG.debug("Dropping partition {}, dataset has {} partitions", p, partitionsSize);
      }
    }
    return kept.stream().mapToInt(Integer::intValue).toArray();
  }

  private Map<String, String> jobProperties(Map<String, String> properties) {
    Map<String, String> merged = new HashMap<>(engine.getLocalProperties());
    if (properties != null) {
      merged.putAll(properties);
    }
    if (!merged.containsKey(EXTERNAL_CALL_SITE)) {
      merged.put(EXTERNAL_CALL_SITE, defaultCallSite);
      LOG.trace("Tagging job with call site {}", defaultCallSite);
    }
    LOG.info("Submitting job from {}", MDC.of(LogKeys.CALL_SITE, merged.get(EXTERNAL_CALL_SITE)));
    return ImmutableMap.copyOf(merged);
  }
}
