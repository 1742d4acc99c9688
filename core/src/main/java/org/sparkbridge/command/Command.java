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
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.sparkbridge.api.java.function.FlatMapFunction;
import org.sparkbridge.api.java.function.Function;
import org.sparkbridge.api.java.function.Function2;

/**
 * An immutable, serializable chain of {@link PipelineStage}s applied per partition, per
 * element, in chain order. Commands compose with {@link #andThen}: the result wraps this
 * pipeline plus the new stages, leaving both operands unchanged.
 *
 * <pre>{@code
 *   Command doubledEvens = Command.filter((Integer x) -> x % 2 == 0)
 *     .andThen(Command.map((Integer x) -> x * 2));
 * }</pre>
 */
public final class Command implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final Command IDENTITY = new Command(ImmutableList.of());

  private final ImmutableList<PipelineStage> stages;

  private Command(ImmutableList<PipelineStage> stages) {
    this.stages = stages;
  }

  /** The empty pipeline, which returns every partition unchanged. */
  public static Command identity() {
    return IDENTITY;
  }

  public static Command of(PipelineStage... stages) {
    return new Command(ImmutableList.copyOf(stages));
  }

  public static <T, R> Command map(Function<T, R> f) {
    return of(PipelineStage.map(f));
  }

  public static <T, R> Command flatMap(FlatMapFunction<T, R> f) {
    return of(PipelineStage.flatMap(f));
  }

  public static <T> Command filter(Function<T, Boolean> f) {
    return of(PipelineStage.filter(f));
  }

  public static <T, R> Command mapPartitions(FlatMapFunction<Iterator<T>, R> f) {
    return of(PipelineStage.mapPartitions(f));
  }

  public static <T, R> Command mapPartitionsWithIndex(
      Function2<Integer, Iterator<T>, Iterator<R>> f) {
    return of(PipelineStage.mapPartitionsWithIndex(f));
  }

  /** A command running this pipeline, then the stages of {@code next}. */
  public Command andThen(Command next) {
    Preconditions.checkNotNull(next, "next");
    if (next.stages.isEmpty()) {
      return this;
    }
    if (stages.isEmpty()) {
      return next;
    }
    return new Command(ImmutableList.<PipelineStage>builder()
      .addAll(stages).addAll(next.stages).build());
  }

  public Command andThen(PipelineStage next) {
    return andThen(of(next));
  }

  public List<PipelineStage> stages() {
    return stages;
  }

  public boolean isIdentity() {
    return stages.isEmpty();
  }

  /** Lazily applies every stage, in order, to the elements of one partition. */
  public Iterator<Object> apply(int partition, Iterator<Object> input) {
    Iterator<Object> result = input;
    for (PipelineStage stage : stages) {
      result = stage.apply(partition, result);
    }
    return result;
  }

  @Override
  public String toString() {
    return "Command[" + Joiner.on(" -> ").join(stages) + "]";
  }
}
