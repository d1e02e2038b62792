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

/**
 * A scalar field sampled on a rectangular (colatitude, azimuth) grid. Values are stored in the
 * canonical layout {@code values[azimuthIndex][colatitudeIndex]}, so the array shape is {@code (P,
 * T)} for {@code P} azimuths and {@code T} colatitudes. Both coordinate sequences are in radians
 * and strictly monotonic.
 *
 * <p>Grid files come in two axis orders; {@link #fromGrid(Grid2D)} tells them apart with {@link
 * #AZIMUTH_DETECTION_THRESHOLD}.
 */
public final class ScalarField2D {
  /**
   * A first scale whose maximum exceeds this value is azimuth rather than colatitude. Colatitude
   * never exceeds pi (about 3.14) while azimuth reaches 2 pi (about 6.28). The value is a fixed
   * convention of existing grid files and must not be changed.
   */
  public static final double AZIMUTH_DETECTION_THRESHOLD = 3.5;

  private final double[] colatitudes;
  private final double[] azimuths;
  private final double[][] values;

  /**
   * Creates a field from canonical-layout arrays, which are copied.
   *
   * @param colatitudes the T colatitudes, strictly monotonic
   * @param azimuths the P azimuths, strictly monotonic
   * @param values the values indexed {@code [azimuthIndex][colatitudeIndex]}
   * @throws IllegalArgumentException if the shape does not match or a scale is not monotonic
   */
  public ScalarField2D(double[] colatitudes, double[] azimuths, double[][] values) {
    checkMonotonic(colatitudes, "colatitude");
    checkMonotonic(azimuths, "azimuth");
    Preconditions.checkArgument(
        values.length == azimuths.length,
        "Field has %s azimuth rows but %s azimuths",
        values.length,
        azimuths.length);
    for (double[] row : values) {
      Preconditions.checkArgument(
          row.length == colatitudes.length,
          "Field row has %s values but %s colatitudes",
          row.length,
          colatitudes.length);
    }
    this.colatitudes = colatitudes.clone();
    this.azimuths = azimuths.clone();
    this.values = Grid2D.copy(values);
  }

  /**
   * Returns the field stored in the given file-order grid. If the first scale's maximum exceeds
   * {@link #AZIMUTH_DETECTION_THRESHOLD} it is taken as azimuth and the data is transposed,
   * otherwise the first scale is colatitude and the data is already in canonical layout.
   */
  public static ScalarField2D fromGrid(Grid2D grid) {
    if (isAzimuthScale(grid.scale1())) {
      return new ScalarField2D(grid.scale2(), grid.scale1(), Grid2D.transpose(grid.data()));
    } else {
      return new ScalarField2D(grid.scale1(), grid.scale2(), grid.data());
    }
  }

  /** Returns true if the given first scale of a grid file holds azimuths. */
  public static boolean isAzimuthScale(double[] scale) {
    return Doubles.max(scale) > AZIMUTH_DETECTION_THRESHOLD;
  }

  /** Returns this field as a file-order grid with the colatitude scale first. */
  public Grid2D toGrid() {
    return new Grid2D(colatitudes, azimuths, values);
  }

  /** Returns T, the number of colatitudes. */
  public int numColatitudes() {
    return colatitudes.length;
  }

  /** Returns P, the number of azimuths. */
  public int numAzimuths() {
    return azimuths.length;
  }

  /** Returns the total number of cells, {@code P * T}. */
  public int numCells() {
    return colatitudes.length * azimuths.length;
  }

  /** Returns the colatitude at index {@code i}. */
  public double colatitude(int i) {
    return colatitudes[i];
  }

  /** Returns the azimuth at index {@code j}. */
  public double azimuth(int j) {
    return azimuths[j];
  }

  /** Returns the value at azimuth index {@code j} and colatitude index {@code i}. */
  public double value(int j, int i) {
    return values[j][i];
  }

  /** Returns a copy of the colatitude scale. */
  public double[] colatitudes() {
    return colatitudes.clone();
  }

  /** Returns a copy of the azimuth scale. */
  public double[] azimuths() {
    return azimuths.clone();
  }

  private static void checkMonotonic(double[] scale, String name) {
    Preconditions.checkArgument(scale.length > 0, "Empty %s scale", name);
    if (scale.length < 2) {
      return;
    }
    boolean increasing = scale[1] > scale[0];
    for (int k = 1; k < scale.length; k++) {
      boolean ok = increasing ? scale[k] > scale[k - 1] : scale[k] < scale[k - 1];
      Preconditions.checkArgument(
          ok, "The %s scale is not strictly monotonic at index %s", name, k);
    }
  }

  @Override
  public String toString() {
    return "ScalarField2D[" + azimuths.length + " azimuths x " + colatitudes.length
        + " colatitudes]";
  }
}
