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

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.exceptions.HdfException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads and writes {@link Grid2D}s as HDF5 files laid out the way the coronal and heliospheric
 * models exchange them: the values in a root dataset {@code Data} of shape {@code [n2][n1]}, with
 * the scales in the root datasets {@code dim1} (length n1) and {@code dim2} (length n2).
 *
 * <p>Scales and data may be stored as any integer or floating point type; they are widened to
 * double on reading. Writing always stores doubles.
 */
final class Hdf5GridFile {
  static final String DATA = "Data";
  static final String DIM1 = "dim1";
  static final String DIM2 = "dim2";

  /** The eight bytes every HDF5 file without a user block starts with. */
  private static final byte[] SIGNATURE = {
    (byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n'
  };

  private Hdf5GridFile() {}

  /** Returns true if {@code header} starts with the HDF5 format signature. */
  static boolean hasSignature(byte[] header) {
    return header.length >= SIGNATURE.length
        && Arrays.equals(Arrays.copyOf(header, SIGNATURE.length), SIGNATURE);
  }

  /** Returns the number of header bytes {@link #hasSignature} looks at. */
  static int signatureLength() {
    return SIGNATURE.length;
  }

  /**
   * Reads the grid stored in the HDF5 file at {@code path}.
   *
   * @throws IOException if the file is not HDF5, lacks one of the datasets, or their shapes
   *     disagree
   */
  static Grid2D read(Path path) throws IOException {
    try (HdfFile hdf = new HdfFile(path)) {
      double[] scale1 = readVector(hdf, DIM1);
      double[] scale2 = readVector(hdf, DIM2);
      Dataset data = hdf.getDatasetByPath(DATA);
      int[] dims = data.getDimensions();
      if (dims.length != 2 || dims[0] != scale2.length || dims[1] != scale1.length) {
        throw new IOException(
            "Dataset "
                + DATA
                + " has shape "
                + Arrays.toString(dims)
                + ", expected ["
                + scale2.length
                + ", "
                + scale1.length
                + "]");
      }
      double[] flat = toDoubles(data.getDataFlat(), DATA);
      double[][] values = new double[scale2.length][];
      for (int k = 0; k < scale2.length; k++) {
        values[k] = Arrays.copyOfRange(flat, k * scale1.length, (k + 1) * scale1.length);
      }
      return new Grid2D(scale1, scale2, values);
    } catch (HdfException e) {
      throw new IOException("Cannot read HDF5 grid " + path + ": " + e.getMessage(), e);
    }
  }

  /** Writes {@code grid} to a new HDF5 file at {@code path}, replacing any existing file. */
  static void write(Path path, Grid2D grid) throws IOException {
    double[][] values = new double[grid.size2()][grid.size1()];
    for (int k = 0; k < grid.size2(); k++) {
      for (int l = 0; l < grid.size1(); l++) {
        values[k][l] = grid.get(k, l);
      }
    }
    try (WritableHdfFile hdf = HdfFile.write(path)) {
      hdf.putDataset(DIM1, grid.scale1());
      hdf.putDataset(DIM2, grid.scale2());
      hdf.putDataset(DATA, values);
    } catch (HdfException e) {
      throw new IOException("Cannot write HDF5 grid " + path + ": " + e.getMessage(), e);
    }
  }

  private static double[] readVector(HdfFile hdf, String name) throws IOException {
    Dataset dataset = hdf.getDatasetByPath(name);
    if (dataset.getDimensions().length != 1) {
      throw new IOException("Dataset " + name + " is not one-dimensional");
    }
    double[] result = toDoubles(dataset.getDataFlat(), name);
    if (result.length == 0) {
      throw new IOException("Dataset " + name + " is empty");
    }
    return result;
  }

  /** Widens a flat primitive array as returned by jHDF to doubles. */
  private static double[] toDoubles(Object flat, String name) throws IOException {
    if (flat instanceof double[]) {
      return (double[]) flat;
    }
    double[] result;
    if (flat instanceof float[]) {
      float[] a = (float[]) flat;
      result = new double[a.length];
      for (int k = 0; k < a.length; k++) {
        result[k] = a[k];
      }
    } else if (flat instanceof int[]) {
      result = Arrays.stream((int[]) flat).asDoubleStream().toArray();
    } else if (flat instanceof long[]) {
      result = Arrays.stream((long[]) flat).asDoubleStream().toArray();
    } else {
      throw new IOException(
          "Dataset " + name + " holds " + flat.getClass().getSimpleName() + ", not numbers");
    }
    return result;
  }
}
