/*
 * Copyright 2026 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.solarwind.geometry;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/** Simple utility for reading little endian primitives from a stream. */
final class LittleEndianInput {
  /** Counts of doubles up to this are allocated up front. */
  static final int CHUNK_DOUBLES = 1 << 16;

  private final InputStream input;

  /** Constructs a little-endian input that reads from the given stream. */
  LittleEndianInput(InputStream input) {
    this.input = input;
  }

  /**
   * Reads a byte.
   *
   * @throws IOException if {@code input.read()} throws an {@code IOException} or returns -1 (EOF).
   */
  byte readByte() throws IOException {
    int b = input.read();
    if (b < 0) {
      throw new EOFException("EOF");
    }
    return (byte) b;
  }

  /**
   * Reads a fixed size of bytes from the input.
   *
   * @throws IOException if past end of input or error in underlying stream
   */
  byte[] readBytes(int size) throws IOException {
    byte[] result = new byte[size];
    int offset = 0;
    while (offset < size) {
      int numRead = input.read(result, offset, size - offset);
      if (numRead < 0) {
        throw new EOFException("EOF");
      }
      offset += numRead;
    }
    return result;
  }

  /**
   * Reads a little-endian signed integer.
   *
   * @throws IOException if past end of input or error in underlying stream
   */
  int readInt() throws IOException {
    return (readByte() & 0xFF)
        | ((readByte() & 0xFF) << 8)
        | ((readByte() & 0xFF) << 16)
        | ((readByte() & 0xFF) << 24);
  }

  /**
   * Reads a little-endian signed long.
   *
   * @throws IOException if past end of input or error in underlying stream
   */
  long readLong() throws IOException {
    return (readByte() & 0xFFL)
        | ((readByte() & 0xFFL) << 8)
        | ((readByte() & 0xFFL) << 16)
        | ((readByte() & 0xFFL) << 24)
        | ((readByte() & 0xFFL) << 32)
        | ((readByte() & 0xFFL) << 40)
        | ((readByte() & 0xFFL) << 48)
        | ((readByte() & 0xFFL) << 56);
  }

  /**
   * Reads a little-endian IEEE754 64-bit double.
   *
   * @throws IOException if past end of input or error in underlying stream
   */
  double readDouble() throws IOException {
    return Double.longBitsToDouble(readLong());
  }

  /**
   * Reads {@code n} little-endian doubles. Storage grows with the data actually read, so a bogus
   * count fails with an EOF rather than a huge allocation.
   *
   * @throws IOException if past end of input or error in underlying stream
   */
  double[] readDoubles(int n) throws IOException {
    if (n <= CHUNK_DOUBLES) {
      double[] result = new double[n];
      for (int k = 0; k < n; k++) {
        result[k] = readDouble();
      }
      return result;
    }
    DoubleArrayList result = new DoubleArrayList(CHUNK_DOUBLES);
    for (int k = 0; k < n; k++) {
      result.add(readDouble());
    }
    return result.toDoubleArray();
  }
}
