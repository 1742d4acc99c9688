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
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import org.sparkbridge.SerializerException;
import org.sparkbridge.util.Pair;

public class SerializerTest {

  private static final Serializer UTF8 = new UTF8Serializer();

  @Test
  public void marshalBatchesElements() {
    Serializer marshal = new MarshalSerializer(2);
    List<Object> input = Arrays.asList(1, "two", 3.0, null, ImmutableList.of(5));
    List<byte[]> frames = marshal.dumpToFrames(input.iterator());
    assertEquals(3, frames.size());
    assertEquals(input, Lists.newArrayList(marshal.loadFrames(frames)));
  }

  @Test
  public void emptySequenceRoundTrips() throws IOException {
    List<Serializer> kinds = Arrays.asList(
      new MarshalSerializer(4),
      UTF8,
      new PairSerializer(4, new MarshalSerializer(2), UTF8),
      new CompressedSerializer(new MarshalSerializer(4)));
    for (Serializer serializer : kinds) {
      byte[] stream = serializer.dumpToBytes(ImmutableList.of().iterator());
      assertEquals(0, stream.length, serializer.toString());
      assertTrue(serializer.dumpToFrames(ImmutableList.of().iterator()).isEmpty());
      assertTrue(serializer.loadFromBytes(stream).isEmpty());
      assertFalse(serializer.load(new ByteArrayInputStream(stream)).hasNext());

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      serializer.dump(ImmutableList.of().iterator(), out);
      assertEquals(0, out.size());
    }
  }

  @Test
  public void marshalRejectsNonSerializable() {
    Serializer marshal = new MarshalSerializer(4);
    Iterator<Object> items = Arrays.<Object>asList(1, new Object()).iterator();
    assertThrows(SerializerException.class, () -> marshal.dumpToBytes(items));
  }

  @Test
  public void utf8WritesOneStringPerFrame() {
    List<byte[]> frames = UTF8.dumpToFrames(Arrays.asList("a", "héllo", "").iterator());
    assertEquals(3, frames.size());
    assertEquals("héllo", new String(frames.get(1), StandardCharsets.UTF_8));
    assertEquals(Arrays.asList("a", "héllo", ""), Lists.newArrayList(UTF8.loadFrames(frames)));
  }

  @Test
  public void utf8RejectsOtherTypes() {
    assertThrows(SerializerException.class,
      () -> UTF8.dumpToFrames(Arrays.<Object>asList("ok", 42).iterator()));
  }

  @Test
  public void pairFollowsNarrowestBatch() {
    PairSerializer pair = new PairSerializer(10, new MarshalSerializer(3), UTF8);
    assertEquals(1, pair.framedBatchSize());

    PairSerializer wide = new PairSerializer(10, new MarshalSerializer(3), new MarshalSerializer(5));
    assertEquals(3, wide.framedBatchSize());
    List<Pair<Integer, String>> input = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      input.add(Pair.of(i, "v" + i));
    }
    byte[] stream = wide.dumpToBytes(input.iterator());
    assertEquals(3, Frames.split(stream).size());
    assertEquals(input, wide.loadFromBytes(stream));
  }

  @Test
  public void pairDetectsMismatchedHalves() throws IOException {
    byte[] keys = new MarshalSerializer(4).encodeBatch(Arrays.asList(1, 2, 3));
    byte[] values = new MarshalSerializer(4).encodeBatch(Arrays.asList("a", "b"));
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    Frames.writeFrame(out, keys);
    Frames.writeFrame(out, values);
    out.flush();

    PairSerializer pair = new PairSerializer(4, new MarshalSerializer(4), new MarshalSerializer(4));
    assertThrows(SerializerException.class, () -> pair.decodeBatch(bytes.toByteArray()));
  }

  @Test
  public void pairRejectsNonPairs() {
    PairSerializer pair = new PairSerializer(UTF8, UTF8);
    assertThrows(SerializerException.class,
      () -> pair.dumpToFrames(Arrays.<Object>asList("not a pair").iterator()));
  }

  @Test
  public void compressedWrapsInner() {
    Serializer compressed = SerializerKind.COMPRESSED.newSerializer(8);
    assertEquals(new CompressedSerializer(new MarshalSerializer(8)), compressed);

    List<String> input = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      input.add("repeated text " + (i % 3));
    }
    byte[] plain = new MarshalSerializer(8).dumpToBytes(input.iterator());
    byte[] packed = compressed.dumpToBytes(input.iterator());
    assertTrue(packed.length < plain.length);
    assertEquals(input, compressed.loadFromBytes(packed));
  }

  @Test
  public void compressedRejectsCorruptFrames() {
    Serializer compressed = new CompressedSerializer(new MarshalSerializer(2));
    assertThrows(SerializerException.class, () -> compressed.decodeBatch(new byte[] {0, 1}));
    assertThrows(SerializerException.class,
      () -> new CompressedSerializer(new CompressedSerializer(UTF8)));
  }

  @Test
  public void streamsLoadLazily() throws IOException {
    Serializer marshal = new MarshalSerializer(1);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    marshal.dump(Arrays.asList("x", "y").iterator(), out);
    Iterator<Object> it = marshal.load(new ByteArrayInputStream(out.toByteArray()));
    assertEquals("x", it.next());
    assertEquals("y", it.next());
    assertFalse(it.hasNext());
  }

  @Test
  public void registryResolvesNames() {
    assertSame(SerializerKind.MARSHAL, SerializerKind.fromName("marshal"));
    assertSame(SerializerKind.UTF8, SerializerKind.fromName("UTF8"));
    assertTrue(SerializerKind.isRegistered("pair"));
    assertFalse(SerializerKind.isRegistered("oj"));
    assertFalse(SerializerKind.isRegistered(null));

    SerializerException e =
      assertThrows(SerializerException.class, () -> SerializerKind.fromName("oj"));
    assertTrue(e.getMessage().contains("oj"));
    assertEquals("SERIALIZER_ERROR", e.getErrorClass());
  }

  @Test
  public void registryChecksNestedCount() {
    assertThrows(SerializerException.class, () -> SerializerKind.PAIR.newSerializer(4, UTF8));
    assertThrows(SerializerException.class,
      () -> SerializerKind.MARSHAL.newSerializer(4, UTF8));
    assertThrows(SerializerException.class, () -> SerializerKind.MARSHAL.newSerializer(0));
    Serializer pair = SerializerKind.PAIR.newSerializer(4, UTF8, UTF8);
    assertEquals(ImmutableList.of(UTF8, UTF8), pair.nested());
  }

  @Test
  public void pairingComparesStructure() {
    new MarshalSerializer(16).checkPairedWith(new MarshalSerializer(16));
    assertThrows(SerializerException.class,
      () -> new MarshalSerializer(16).checkPairedWith(new MarshalSerializer(8)));
    assertThrows(SerializerException.class,
      () -> new MarshalSerializer(1).checkPairedWith(UTF8));
    assertEquals("pair(1, utf8(1), utf8(1))", new PairSerializer(UTF8, UTF8).toString());
  }
}
