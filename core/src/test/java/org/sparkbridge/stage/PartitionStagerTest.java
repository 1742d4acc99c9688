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

package org.sparkbridge.stage;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import org.sparkbridge.ConfigException;
import org.sparkbridge.EngineException;
import org.sparkbridge.SerializerException;
import org.sparkbridge.engine.EngineConnection;
import org.sparkbridge.engine.EngineDataset;
import org.sparkbridge.serializer.Frames;
import org.sparkbridge.serializer.MarshalSerializer;
import org.sparkbridge.serializer.Serializer;

public class PartitionStagerTest {

  @TempDir
  File tempDir;

  private final Serializer serializer = new MarshalSerializer(2);
  private final EngineDataset dataset = () -> 42L;

  @Test
  public void fileStagingHandsOverClosedFile() {
    EngineConnection engine = mock(EngineConnection.class);
    AtomicReference<List<byte[]>> seen = new AtomicReference<>();
    when(engine.readRDDFromFile(anyString(), eq(3))).thenAnswer(invocation -> {
      String path = invocation.getArgument(0);
      File file = new File(path);
      assertTrue(file.getName().startsWith(FileStager.FILE_PREFIX));
      assertEquals(tempDir.getCanonicalFile(), file.getParentFile().getCanonicalFile());
      try (InputStream in = new FileInputStream(file)) {
        seen.set(Frames.readAll(in));
      }
      return dataset;
    });

    FileStager stager = new FileStager(engine, tempDir);
    assertSame(StagingStrategy.FILE, stager.strategy());
    assertSame(dataset, stager.stage(Arrays.asList(1, 2, 3, 4, 5), 3, serializer));

    assertEquals(3, seen.get().size());
    assertEquals(Arrays.asList(1, 2, 3, 4, 5), drain(serializer, seen.get()));
    assertEquals(0, tempDir.list().length);
  }

  @Test
  public void fileStagingCleansUpOnEncodingFailure() {
    EngineConnection engine = mock(EngineConnection.class);
    FileStager stager = new FileStager(engine, tempDir);
    List<Object> data = Arrays.asList(1, new Object());

    assertThrows(SerializerException.class, () -> stager.stage(data, 1, serializer));
    verify(engine, never()).readRDDFromFile(anyString(), anyInt());
    assertEquals(0, tempDir.list().length);
  }

  @Test
  public void fileStagingCleansUpOnEngineFailure() {
    EngineConnection engine = mock(EngineConnection.class);
    when(engine.readRDDFromFile(anyString(), anyInt()))
      .thenThrow(new EngineException("engine is gone"));
    FileStager stager = new FileStager(engine, tempDir);

    assertThrows(EngineException.class,
      () -> stager.stage(Arrays.asList("a", "b"), 2, serializer));
    assertEquals(0, tempDir.list().length);
  }

  @Test
  public void directStagingPassesFrames() {
    EngineConnection engine = mock(EngineConnection.class);
    when(engine.parallelize(anyList(), eq(2))).thenReturn(dataset);
    DirectStager stager = new DirectStager(engine);
    assertSame(StagingStrategy.DIRECT, stager.strategy());

    assertSame(dataset, stager.stage(Arrays.asList("x", "y", "z"), 2, serializer));
    verify(engine).parallelize(argThat(frames -> frames.size() == 2), eq(2));
    verify(engine, never()).readRDDFromFile(anyString(), anyInt());
  }

  @Test
  public void strategiesByName() {
    assertSame(StagingStrategy.FILE, StagingStrategy.fromName("file"));
    assertSame(StagingStrategy.DIRECT, StagingStrategy.fromName(" Direct "));
    assertThrows(ConfigException.class, () -> StagingStrategy.fromName("socket"));
    assertThrows(ConfigException.class, () -> StagingStrategy.fromName(null));
  }

  private static List<Object> drain(Serializer serializer, List<byte[]> frames) {
    List<Object> out = new ArrayList<>();
    serializer.loadFrames(frames).forEachRemaining(out::add);
    return out;
  }
}
