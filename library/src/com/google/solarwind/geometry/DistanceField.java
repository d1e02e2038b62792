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

/**
 * Signed great-circle distances in radians to the nearest coronal hole boundary, one per target
 * mesh point, indexed {@code [row][column]} like the {@link TargetMesh}. Distances are positive
 * inside coronal holes and negative (or zero in forced mode) in closed-field regions.
 */
public final class DistanceField {
  private final double[] colatitudeScale;
  private final double[] azimuthScale;
  private final double[][] distances;

  /** Wraps the given distances, which are not copied. */
  DistanceField(double[] colatitudeScale, double[] azimuthScale, double[][] distances) {
    this.colatitudeScale = colatitudeScale;
    this.azimuthScale = azimuthScale;
    this.distances = distances;
  }

  /** Returns the number of rows. */
  public int numRows() {
    return distances.length;
  }

  /** Returns the number of points per row. */
  public int numColumns() {
    return colatitudeScale.length;
  }

  /** Returns the distance at row {@code j}, column {@code i}. */
  public double get(int j, int i) {
    return distances[j][i];
  }

  /** Returns the smallest (most negative) distance. */
  public double min() {
    double min = Double.POSITIVE_INFINITY;
    for (double[] row : distances) {
      for (double d : row) {
        min = Math.min(min, d);
      }
    }
    return min;
  }

  /** Returns the largest distance. */
  public double max() {
    double max = Double.NEGATIVE_INFINITY;
    for (double[] row : distances) {
      for (double d : row) {
        max = Math.max(max, d);
      }
    }
    return max;
  }

  /** Returns the field as a file-order grid, colatitude scale first. */
  public Grid2D toGrid() {
    return new Grid2D(colatitudeScale, azimuthScale, distances);
  }
}
