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

package org.sparkbridge.serializer;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import org.sparkbridge.SerializerException;

public class FramesTest {

  @Test
  public void lengthPrefixIsBigEndian() {
    byte[] stream = Frames.join(Arrays.asList("abc".getBytes(StandardCharsets.UTF_8)));
    assertEquals(7, stream.length);
    assertEquals(3, ByteBuffer.wrap(stream).getInt());
    assertEquals(0, stream[0]);
    assertEquals(3, stream[3]);
  }

  @Test
  public void splitsJoinedFrames() {
    List<byte[]> frames = Arrays.asList(new byte[0], new byte[] {1, 2}, new byte[] {3});
    List<byte[]> read = Frames.split(Frames.join(frames));
    assertEquals(3, read.size());
    assertArrayEquals(new byte[0], read.get(0));
    assertArrayEquals(new byte[] {1, 2}, read.get(1));
    assertArrayEquals(new byte[] {3}, read.get(2));
  }

  @Test
  public void cleanEndOfStream() throws IOException {
    DataInputStream in = new DataInputStream(new ByteArrayInputStream(new byte[0]));
    assertNull(Frames.readFrame(in));
  }

  @Test
  public void truncatedPayload() {
    byte[] stream = ByteBuffer.allocate(6).putInt(10).put((byte) 1).put((byte) 2).array();
    DataInputStream in = new DataInputStream(new ByteArrayInputStream(stream));
    assertThrows(SerializerException.class, () -> Frames.readFrame(in));
  }

  @Test
  public void negativeLength() {
    byte[] stream = ByteBuffer.allocate(4).putInt(-1).array();
    DataInputStream in = new DataInputStream(new ByteArrayInputStream(stream));
    assertThrows(SerializerException.class, () -> Frames.readFrame(in));
  }
}
