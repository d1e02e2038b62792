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

import java.io.IOException;
import java.io.OutputStream;

/** Simple utility for writing little endian primitives to a stream. */
final class LittleEndianOutput {
  private final OutputStream output;

  /** Constructs a little-endian output that writes to the given stream. */
  LittleEndianOutput(OutputStream output) {
    this.output = output;
  }

  /** Writes a byte. */
  void writeByte(byte value) throws IOException {
    output.write((int) value);
  }

  void writeBytes(byte[] bytes) throws IOException {
    output.write(bytes);
  }

  /** Writes a little-endian signed integer. */
  void writeInt(int value) throws IOException {
    output.write(value & 0xFF);
    output.write((value >> 8) & 0xFF);
    output.write((value >> 16) & 0xFF);
    output.write((value >> 24) & 0xFF);
  }

  /** Writes a little-endian signed long. */
  void writeLong(long value) throws IOException {
    output.write((int) (value & 0xFF));
    output.write((int) (value >> 8) & 0xFF);
    output.write((int) (value >> 16) & 0xFF);
    output.write((int) (value >> 24) & 0xFF);
    output.write((int) (value >> 32) & 0xFF);
    output.write((int) (value >> 40) & 0xFF);
    output.write((int) (value >> 48) & 0xFF);
    output.write((int) (value >> 56) & 0xFF);
  }

  /** Writes a little-endian IEEE754 64-bit double. */
  void writeDouble(double value) throws IOException {
    writeLong(Double.doubleToLongBits(value));
  }

  /** Writes each of the given doubles. */
  void writeDoubles(double[] values) throws IOException {
    for (double value : values) {
      writeDouble(value);
    }
  }
}
