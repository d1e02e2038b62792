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

import static java.nio.charset.StandardCharsets.US_ASCII;

import com.google.common.base.Ascii;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;

/**
 * Reads and writes {@link Grid2D} files. Paths ending in {@code .h5} or {@code .hdf5} are written
 * as HDF5 (see {@link Hdf5GridFile}), and files starting with the HDF5 signature are read as such.
 * Everything else uses a compact little-endian encoding:
 *
 * <pre>
 * bytes    "SWGD"
 * byte     version (1)
 * int      n1, the length of scale1
 * int      n2, the length of scale2
 * double   scale1[n1]
 * double   scale2[n2]
 * double   data[n2][n1], row by row
 * </pre>
 */
public final class GridFileCoder {
  private static final byte[] MAGIC = "SWGD".getBytes(US_ASCII);
  private static final byte ENCODING_VERSION = 1;

  /** Grids with more values than this are rejected as corrupt rather than allocated. */
  private static final long MAX_VALUES = Integer.MAX_VALUE / Double.BYTES;

  private GridFileCoder() {}

  /** Writes the encoding of {@code grid} to {@code output}, which is not closed. */
  public static void encode(Grid2D grid, OutputStream output) throws IOException {
    LittleEndianOutput out = new LittleEndianOutput(output);
    out.writeBytes(MAGIC);
    out.writeByte(ENCODING_VERSION);
    out.writeInt(grid.size1());
    out.writeInt(grid.size2());
    out.writeDoubles(grid.scale1());
    out.writeDoubles(grid.scale2());
    for (int k = 0; k < grid.size2(); k++) {
      for (int l = 0; l < grid.size1(); l++) {
        out.writeDouble(grid.get(k, l));
      }
    }
  }

  /**
   * Decodes a grid from {@code input}, which is not closed.
   *
   * @throws IOException if the input is truncated, is not a grid file, or has an unsupported
   *     version
   */
  public static Grid2D decode(InputStream input) throws IOException {
    LittleEndianInput in = new LittleEndianInput(input);
    byte[] magic = in.readBytes(MAGIC.length);
    if (!Arrays.equals(magic, MAGIC)) {
      throw new IOException("Not a grid file: bad magic bytes");
    }
    byte version = in.readByte();
    if (version != ENCODING_VERSION) {
      throw new IOException("Unsupported grid file version " + version);
    }
    int n1 = in.readInt();
    int n2 = in.readInt();
    if (n1 <= 0 || n2 <= 0 || (long) n1 * n2 > MAX_VALUES) {
      throw new IOException("Invalid grid dimensions " + n1 + " x " + n2);
    }
    double[] scale1 = in.readDoubles(n1);
    double[] scale2 = in.readDoubles(n2);
    // One read for all values, so a corrupt header fails on EOF before the rows are allocated.
    double[] values = in.readDoubles(n1 * n2);
    double[][] data = new double[n2][];
    for (int k = 0; k < n2; k++) {
      data[k] = Arrays.copyOfRange(values, k * n1, (k + 1) * n1);
    }
    return new Grid2D(scale1, scale2, data);
  }

  /** Reads the grid file at {@code path}, in either format. */
  public static Grid2D read(Path path) throws IOException {
    try (InputStream input = new BufferedInputStream(Files.newInputStream(path))) {
      input.mark(Hdf5GridFile.signatureLength());
      byte[] header = input.readNBytes(Hdf5GridFile.signatureLength());
      if (!Hdf5GridFile.hasSignature(header)) {
        input.reset();
        return decode(input);
      }
    }
    return Hdf5GridFile.read(path);
  }

  /** Returns true if {@link #write} stores {@code path} as HDF5. */
  public static boolean isHdf5(Path path) {
    String name = Ascii.toLowerCase(path.getFileName().toString());
    return name.endsWith(".h5") || name.endsWith(".hdf5");
  }

  /**
   * Writes {@code grid} to {@code path}. The data goes to a temporary file in the same directory
   * first and is moved into place once complete, so a failure never leaves a partial file at
   * {@code path}.
   */
  public static void write(Path path, Grid2D grid) throws IOException {
    Path absolute = path.toAbsolutePath();
    Path tmp =
        Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
    try {
      if (isHdf5(path)) {
        // The HDF5 writer creates its file itself.
        Files.delete(tmp);
        Hdf5GridFile.write(tmp, grid);
      } else {
        try (OutputStream output = new BufferedOutputStream(Files.newOutputStream(tmp))) {
          encode(grid, output);
        }
      }
      Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }
}
