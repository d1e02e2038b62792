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

/**
 * The points at which distances are evaluated: a colatitude map and an azimuth map of the same
 * shape {@code [P'][T']}, which need not form a regular grid, plus the two 1-D scales that label
 * the rows and columns of the output file. See {@link TargetMeshBuilder} for the ways to build one.
 */
public final class TargetMesh {
  private final double[] colatitudeScale;
  private final double[] azimuthScale;
  private final double[][] colatitudes;
  private final double[][] azimuths;

  /**
   * Creates a mesh from copies of the given arrays.
   *
   * @param colatitudeScale the T' colatitude labels of the output columns
   * @param azimuthScale the P' azimuth labels of the output rows
   * @param colatitudes the colatitude of each point, indexed {@code [row][column]}
   * @param azimuths the azimuth of each point, indexed {@code [row][column]}
   */
  public TargetMesh(
      double[] colatitudeScale,
      double[] azimuthScale,
      double[][] colatitudes,
      double[][] azimuths) {
    checkShape(colatitudes, azimuthScale.length, colatitudeScale.length, "colatitude");
    checkShape(azimuths, azimuthScale.length, colatitudeScale.length, "azimuth");
    this.colatitudeScale = colatitudeScale.clone();
    this.azimuthScale = azimuthScale.clone();
    this.colatitudes = Grid2D.copy(colatitudes);
    this.azimuths = Grid2D.copy(azimuths);
  }

  private static void checkShape(double[][] map, int rows, int columns, String name) {
    Preconditions.checkArgument(
        map.length == rows, "The %s map has %s rows, expected %s", name, map.length, rows);
    for (double[] row : map) {
      Preconditions.checkArgument(
          row.length == columns,
          "The %s map has a row of %s values, expected %s",
          name,
          row.length,
          columns);
    }
  }

  /** Returns P', the number of rows. */
  public int numRows() {
    return azimuthScale.length;
  }

  /** Returns T', the number of points per row. */
  public int numColumns() {
    return colatitudeScale.length;
  }

  /** Returns the colatitude of the point at row {@code j}, column {@code i}. */
  public double colatitude(int j, int i) {
    return colatitudes[j][i];
  }

  /** Returns the azimuth of the point at row {@code j}, column {@code i}. */
  public double azimuth(int j, int i) {
    return azimuths[j][i];
  }

  /** Returns the colatitudes of row {@code j}. The array is shared and must not be modified. */
  double[] colatitudeRow(int j) {
    return colatitudes[j];
  }

  /** Returns the azimuths of row {@code j}. The array is shared and must not be modified. */
  double[] azimuthRow(int j) {
    return azimuths[j];
  }

  /** Returns a copy of the colatitude labels of the output columns. */
  public double[] colatitudeScale() {
    return colatitudeScale.clone();
  }

  /** Returns a copy of the azimuth labels of the output rows. */
  public double[] azimuthScale() {
    return azimuthScale.clone();
  }

  @Override
  public String toString() {
    return "TargetMesh[" + numRows() + " x " + numColumns() + "]";
  }
}
