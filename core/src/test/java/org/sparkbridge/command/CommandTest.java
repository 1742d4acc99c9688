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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CommandTest {

  @SuppressWarnings("unchecked")
  private static List<Object> run(Command command, int partition, Object... input) {
    return Lists.newArrayList(command.apply(partition, (Iterator<Object>) (Iterator<?>)
      Arrays.asList(input).iterator()));
  }

  @Test
  public void identityPassesThrough() {
    assertTrue(Command.identity().isIdentity());
    assertEquals(Arrays.asList(1, 2, 3), run(Command.identity(), 0, 1, 2, 3));
  }

  @Test
  public void stagesRunInOrder() {
    Command command = Command.<Integer, Integer>map(x -> x + 1)
      .andThen(Command.<Integer>filter(x -> x % 2 == 0))
      .andThen(PipelineStage.<Integer, Integer>flatMap(x -> Arrays.asList(x, -x).iterator()));
    assertEquals(3, command.stages().size());
    assertEquals(
      ImmutableList.of(StageKind.MAP, StageKind.FILTER, StageKind.FLAT_MAP),
      Lists.transform(command.stages(), PipelineStage::kind));
    assertEquals(Arrays.asList(2, -2, 4, -4), run(command, 0, 1, 2, 3));
  }

  @Test
  public void chainingKeepsOriginalsUnchanged() {
    Command base = Command.<Integer, Integer>map(x -> x * 2);
    Command extended = base.andThen(Command.<Integer, Integer>map(x -> x + 1));
    assertEquals(1, base.stages().size());
    assertEquals(2, extended.stages().size());
    assertSame(base, base.andThen(Command.identity()));
    assertSame(base, Command.identity().andThen(base));
  }

  @Test
  public void partitionStagesSeeWholePartition() {
    Command sum = Command.<Integer, Integer>mapPartitions(it -> {
      int total = 0;
      while (it.hasNext()) {
        total += it.next();
      }
      return ImmutableList.of(total).iterator();
    });
    assertEquals(ImmutableList.of(10), run(sum, 0, 1, 2, 3, 4));

    Command tagged = Command.<Object, String>mapPartitionsWithIndex((index, it) -> {
      List<String> out = new ArrayList<>();
      it.forEachRemaining(x -> out.add(index + ":" + x));
      return out.iterator();
    });
    assertEquals(Arrays.asList("7:a", "7:b"), run(tagged, 7, "a", "b"));
  }

  @Test
  public void failuresCarryStageAndPartition() {
    Command failing = Command.<Integer, Integer>map(x -> 10 / x);
    StageExecutionException e =
      assertThrows(StageExecutionException.class, () -> run(failing, 3, 1, 0));
    assertEquals("STAGE_FAILED", e.getErrorClass());
    assertEquals("3", e.getMessageParameters()[1]);
    assertTrue(e.getCause() instanceof ArithmeticException);
  }
}
