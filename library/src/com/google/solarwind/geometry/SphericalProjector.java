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

import static java.lang.Math.cos;
import static java.lang.Math.sin;

import com.google.common.base.Preconditions;

/**
 * Converts spherical (colatitude, azimuth) coordinates in radians to Cartesian points on the unit
 * sphere. Boundary points and target points go through the same formulas so that their dot
 * products are directly comparable.
 */
public final class SphericalProjector {

  private SphericalProjector() {}

  /**
   * Returns the unit vector {@code (sin t cos p, sin t sin p, cos t)}. At the poles {@code sin t}
   * is (nearly) zero, so the azimuth has no effect and the result is (nearly) {@code (0, 0, +-1)}.
   */
  public static SpherePoint project(double colatitude, double azimuth) {
    double sinT = sin(colatitude);
    return new SpherePoint(sinT * cos(azimuth), sinT * sin(azimuth), cos(colatitude));
  }

  /**
   * Projects a row of (colatitude, azimuth) pairs, writing the Cartesian components to the given
   * output arrays, which must be at least as long as the inputs.
   */
  public static void project(
      double[] colatitudes, double[] azimuths, double[] x, double[] y, double[] z) {
    Preconditions.checkArgument(
        colatitudes.length == azimuths.length,
        "Colatitude and azimuth rows differ in length: %s vs %s",
        colatitudes.length,
        azimuths.length);
    int n = colatitudes.length;
    Preconditions.checkArgument(x.length >= n && y.length >= n && z.length >= n);
    for (int i = 0; i < n; i++) {
      double sinT = sin(colatitudes[i]);
      x[i] = sinT * cos(azimuths[i]);
      y[i] = sinT * sin(azimuths[i]);
      z[i] = cos(colatitudes[i]);
    }
  }
}
