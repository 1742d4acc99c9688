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

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import org.sparkbridge.SerializerException;

/**
 * A codec between local values and the framed byte streams the engine stores.
 *
 * <p>Serializers are plain data: a kind, a batch size and, for wrapping kinds, the nested
 * serializers. Two serializers decode each other's output only if they are structurally
 * equal, which is what {@link #equals(Object)} checks. Datasets and commands keep a
 * reference to the instance that encoded them so the reading side never has to guess.</p>
 *
 * <p>Each frame carries one batch of at most {@link #framedBatchSize()} elements.</p>
 */
public abstract class Serializer implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int batchSize;

  protected Serializer(int batchSize) {
    if (batchSize < 1) {
      throw new SerializerException("Batch size must be positive, got " + batchSize);
    }
    this.batchSize = batchSize;
  }

  public abstract SerializerKind kind();

  public int batchSize() {
    return batchSize;
  }

  /** Serializers wrapped by this one, in order. Empty for leaf kinds. */
  public List<Serializer> nested() {
    return ImmutableList.of();
  }

  /**
   * Number of elements written per frame. Kinds whose payload can only hold a single value
   * cap this at 1.
   */
  public int framedBatchSize() {
    return batchSize;
  }

  /** Encodes one batch into the payload of a single frame. */
  public abstract byte[] encodeBatch(List<?> batch) throws IOException;

  /** Decodes the payload of a single frame. */
  public abstract List<Object> decodeBatch(byte[] payload) throws IOException;

  /**
   * Encodes the items into frames, preserving their order.
   *
   * @throws SerializerException if an element cannot be encoded by this serializer
   */
  public List<byte[]> dumpToFrames(Iterator<?> items) {
    List<byte[]> frames = new ArrayList<>();
    int size = framedBatchSize();
    List<Object> batch = new ArrayList<>(size);
    while (items.hasNext()) {
      batch.add(items.next());
      if (batch.size() == size) {
        frames.add(encode(batch));
        batch.clear();
      }
    }
    if (!batch.isEmpty()) {
      frames.add(encode(batch));
    }
    return frames;
  }

  /**
   * Encodes the items into a framed stream. Encoding happens batch by batch, so an element
   * that fails to encode aborts the dump after the frames preceding it were written.
   *
   * @throws SerializerException if an element cannot be encoded by this serializer
   * @throws IOException if the underlying stream fails
   */
  public void dump(Iterator<?> items, OutputStream out) throws IOException {
    DataOutputStream dos = new DataOutputStream(out);
    int size = framedBatchSize();
    List<Object> batch = new ArrayList<>(size);
    while (items.hasNext()) {
      batch.add(items.next());
      if (batch.size() == size) {
        Frames.writeFrame(dos, encode(batch));
        batch.clear();
      }
    }
    if (!batch.isEmpty()) {
      Frames.writeFrame(dos, encode(batch));
    }
    dos.flush();
  }

  /** Encodes the items into a single framed byte stream. */
  public byte[] dumpToBytes(Iterator<?> items) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try {
      dump(items, bytes);
    } catch (IOException e) {
      throw new SerializerException("Failed to write to an in-memory stream", e);
    }
    return bytes.toByteArray();
  }

  /** Lazily decodes every element of a framed stream. */
  public Iterator<Object> load(InputStream in) {
    DataInputStream dis = new DataInputStream(in);
    return new FlatteningIterator() {
      @Override
      protected byte[] nextFrame() throws IOException {
        return Frames.readFrame(dis);
      }
    };
  }

  /** Lazily decodes the given frames. */
  public Iterator<Object> loadFrames(List<byte[]> frames) {
    Iterator<byte[]> it = frames.iterator();
    return new FlatteningIterator() {
      @Override
      protected byte[] nextFrame() {
        return it.hasNext() ? it.next() : null;
      }
    };
  }

  /** Eagerly decodes a framed byte stream. */
  public List<Object> loadFromBytes(byte[] stream) {
    List<Object> result = new ArrayList<>();
    loadFrames(Frames.split(stream)).forEachRemaining(result::add);
    return result;
  }

  /**
   * Fails with a {@link SerializerException} unless the other serializer reads exactly what
   * this one writes.
   */
  public void checkPairedWith(Serializer other) {
    if (!equals(other)) {
      throw new SerializerException(
        "Serializer " + this + " is not paired with " + other + "; decoding would corrupt data");
    }
  }

  private byte[] encode(List<Object> batch) {
    try {
      return encodeBatch(batch);
    } catch (IOException e) {
      throw new SerializerException("Failed to encode a batch with " + this, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Serializer that = (Serializer) o;
    return kind() == that.kind() &&
      framedBatchSize() == that.framedBatchSize() &&
      nested().equals(that.nested());
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), framedBatchSize(), nested());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind().serializerName());
    sb.append('(').append(framedBatchSize());
    for (Serializer s : nested()) {
      sb.append(", ").append(s);
    }
    return sb.append(')').toString();
  }

  /** Iterates over the elements of a sequence of frames, decoding one frame at a time. */
  private abstract class FlatteningIterator implements Iterator<Object> {
    private Iterator<Object> current = ImmutableList.of().iterator();
    private boolean exhausted = false;

    protected abstract byte[] nextFrame() throws IOException;

    @Override
    public boolean hasNext() {
      while (!current.hasNext() && !exhausted) {
        try {
          byte[] frame = nextFrame();
          if (frame == null) {
            exhausted = true;
          } else {
            current = decodeBatch(frame).iterator();
          }
        } catch (IOException e) {
          throw new SerializerException("Failed to decode a frame with " + Serializer.this, e);
        }
      }
      return current.hasNext();
    }

    @Override
    public Object next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }
  }
}
