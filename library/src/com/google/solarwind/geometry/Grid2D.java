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

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;
import java.util.Arrays;

/**
 * A 2-D grid in file order: two 1-D scales and a data array indexed {@code [scale2][scale1]}, i.e.
 * {@code data.length == scale2.length} and {@code data[k].length == scale1.length}. This is the
 * shape grid files are read and written in; which scale is colatitude is decided later by {@link
 * ScalarField2D#fromGrid(Grid2D)}.
 */
public final class Grid2D {
  private final double[] scale1;
  private final double[] scale2;
  private final double[][] data;

  /**
   * Creates a grid from the given scales and data, which are copied.
   *
   * @throws IllegalArgumentException if a scale is empty or the data shape does not match
   */
  public Grid2D(double[] scale1, double[] scale2, double[][] data) {
    Preconditions.checkArgument(scale1.length > 0 && scale2.length > 0, "Empty grid scale");
    Preconditions.checkArgument(
        data.length == scale2.length,
        "Grid has %s data rows but %s scale2 values",
        data.length,
        scale2.length);
    for (double[] row : data) {
      Preconditions.checkArgument(
          row.length == scale1.length,
          "Grid row has %s values but %s scale1 values",
          row.length,
          scale1.length);
    }
    this.scale1 = scale1.clone();
    this.scale2 = scale2.clone();
    this.data = copy(data);
  }

  /** Returns the number of points along the first scale. */
  public int size1() {
    return scale1.length;
  }

  /** Returns the number of points along the second scale. */
  public int size2() {
    return scale2.length;
  }

  /** Returns a copy of the first scale. */
  public double[] scale1() {
    return scale1.clone();
  }

  /** Returns a copy of the second scale. */
  public double[] scale2() {
    return scale2.clone();
  }

  /** Returns the largest value of the first scale. */
  public double maxScale1() {
    return Doubles.max(scale1);
  }

  /** Returns the data value at second-scale index {@code k}, first-scale index {@code l}. */
  public double get(int k, int l) {
    return data[k][l];
  }

  /** Returns a copy of the data, indexed {@code [scale2][scale1]}. */
  public double[][] data() {
    return copy(data);
  }

  /** Returns the dimensions as {@code "size1 size2"}, the way mismatches are reported. */
  public String dimensions() {
    return scale1.length + " " + scale2.length;
  }

  static double[][] copy(double[][] values) {
    double[][] result = new double[values.length][];
    for (int k = 0; k < values.length; k++) {
      result[k] = values[k].clone();
    }
    return result;
  }

  static double[][] transpose(double[][] values) {
    int rows = values.length;
    int cols = values[0].length;
    double[][] result = new double[cols][rows];
    for (int k = 0; k < rows; k++) {
      for (int l = 0; l < cols; l++) {
        result[l][k] = values[k][l];
      }
    }
    return result;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Grid2D)) {
      return false;
    }
    Grid2D that = (Grid2D) other;
    return Arrays.equals(scale1, that.scale1)
        && Arrays.equals(scale2, that.scale2)
        && Arrays.deepEquals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(scale1) + Arrays.hashCode(scale2))
        + Arrays.deepHashCode(data);
  }

  @Override
  public String toString() {
    return "Grid2D[" + dimensions() + "]";
  }
}
