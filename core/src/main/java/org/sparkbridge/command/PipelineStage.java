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

import java.io.Serializable;
import java.util.Iterator;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

import org.sparkbridge.api.java.function.FlatMapFunction;
import org.sparkbridge.api.java.function.Function;
import org.sparkbridge.api.java.function.Function2;

/**
 * One tagged step of a command pipeline: a kind and the serializable function it applies.
 * Stages are values; applying one to a partition never mutates it.
 */
public final class PipelineStage implements Serializable {

  private static final long serialVersionUID = 1L;

  private final StageKind kind;
  private final Serializable function;

  private PipelineStage(StageKind kind, Serializable function) {
    this.kind = Preconditions.checkNotNull(kind, "kind");
    this.function = Preconditions.checkNotNull(function, "function");
  }

  public static <T, R> PipelineStage map(Function<T, R> f) {
    return new PipelineStage(StageKind.MAP, f);
  }

  public static <T, R> PipelineStage flatMap(FlatMapFunction<T, R> f) {
    return new PipelineStage(StageKind.FLAT_MAP, f);
  }

  public static <T> PipelineStage filter(Function<T, Boolean> f) {
    return new PipelineStage(StageKind.FILTER, f);
  }

  public static <T, R> PipelineStage mapPartitions(FlatMapFunction<Iterator<T>, R> f) {
    return new PipelineStage(StageKind.MAP_PARTITIONS, f);
  }

  public static <T, R> PipelineStage mapPartitionsWithIndex(
      Function2<Integer, Iterator<T>, Iterator<R>> f) {
    return new PipelineStage(StageKind.MAP_PARTITIONS_WITH_INDEX, f);
  }

  public StageKind kind() {
    return kind;
  }

  /** Lazily applies this stage to the elements of one partition. */
  @SuppressWarnings("unchecked")
  Iterator<Object> apply(int partition, Iterator<Object> input) {
    switch (kind) {
      case MAP: {
        Function<Object, Object> f = (Function<Object, Object>) function;
        return Iterators.transform(input, x -> invoke(partition, () -> f.call(x)));
      }
      case FLAT_MAP: {
        FlatMapFunction<Object, Object> f = (FlatMapFunction<Object, Object>) function;
        return Iterators.concat(
          Iterators.transform(input, x -> invoke(partition, () -> f.call(x))));
      }
      case FILTER: {
        Function<Object, Boolean> f = (Function<Object, Boolean>) function;
        return Iterators.filter(input, x -> Boolean.TRUE.equals(invoke(partition, () -> f.call(x))));
      }
      case MAP_PARTITIONS: {
        FlatMapFunction<Iterator<Object>, Object> f =
          (FlatMapFunction<Iterator<Object>, Object>) function;
        return invoke(partition, () -> f.call(input));
      }
      case MAP_PARTITIONS_WITH_INDEX: {
        Function2<Integer, Iterator<Object>, Iterator<Object>> f =
          (Function2<Integer, Iterator<Object>, Iterator<Object>>) function;
        return invoke(partition, () -> f.call(partition, input));
      }
      default:
        throw new IllegalStateException("Unknown stage kind " + kind);
    }
  }

  private <R> R invoke(int partition, Call<R> call) {
    try {
      return call.run();
    } catch (StageExecutionException e) {
      throw e;
    } catch (Exception e) {
      throw new StageExecutionException(kind, partition, e);
    }
  }

  @Override
  public String toString() {
    return kind.name();
  }

  @FunctionalInterface
  private interface Call<R> {
    R run() throws Exception;
  }
}
