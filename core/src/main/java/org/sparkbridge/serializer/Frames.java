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
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import org.sparkbridge.SerializerException;

/**
 * Length-prefixed framing shared by the driver and the engine. A stream is a sequence of
 * frames, each a big-endian `int32` length followed by that many payload bytes. Frames are
 * the unit the engine partitions on; one frame holds one serializer batch.
 */
public final class Frames {

  private Frames() { }

  public static void writeFrame(DataOutputStream out, byte[] payload) throws IOException {
    out.writeInt(payload.length);
    out.write(payload);
  }

  /**
   * Reads the next frame, or returns null at a clean end of stream. A stream that ends in
   * the middle of a frame is corrupt.
   */
  public static byte[] readFrame(DataInputStream in) throws IOException {
    int length;
    try {
      length = in.readInt();
    } catch (EOFException e) {
      return null;
    }
    if (length < 0) {
      throw new SerializerException("Negative frame length " + length);
    }
    byte[] payload = new byte[length];
    try {
      in.readFully(payload);
    } catch (EOFException e) {
      throw new SerializerException(
        "Truncated frame: expected " + length + " bytes of payload", e);
    }
    return payload;
  }

  /** Reads every frame of the stream. */
  public static List<byte[]> readAll(InputStream in) throws IOException {
    DataInputStream dis = in instanceof DataInputStream
      ? (DataInputStream) in : new DataInputStream(in);
    List<byte[]> frames = new ArrayList<>();
    byte[] frame;
    while ((frame = readFrame(dis)) != null) {
      frames.add(frame);
    }
    return frames;
  }

  public static void writeAll(OutputStream out, List<byte[]> frames) throws IOException {
    DataOutputStream dos = out instanceof DataOutputStream
      ? (DataOutputStream) out : new DataOutputStream(out);
    for (byte[] frame : frames) {
      writeFrame(dos, frame);
    }
    dos.flush();
  }

  /** Concatenates frames into one framed byte stream. */
  public static byte[] join(List<byte[]> frames) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try {
      writeAll(bytes, frames);
    } catch (IOException e) {
      throw new IllegalStateException("In-memory stream failed", e);
    }
    return bytes.toByteArray();
  }

  /** Splits a framed byte stream back into frame payloads. */
  public static List<byte[]> split(byte[] stream) {
    try {
      return readAll(new ByteArrayInputStream(stream));
    } catch (IOException e) {
      throw new IllegalStateException("In-memory stream failed", e);
    }
  }
}
