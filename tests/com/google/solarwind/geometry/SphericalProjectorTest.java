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

import static java.lang.Math.PI;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies SphericalProjector. */
@RunWith(JUnit4.class)
public class SphericalProjectorTest extends GeometryTestCase {
  @Test
  public void testPolesAndEquator() {
    assertPointsNear(SpherePoint.NORTH_POLE, SphericalProjector.project(0, 1.234), 1e-15);
    assertPointsNear(SpherePoint.SOUTH_POLE, SphericalProjector.project(PI, 0), 1e-15);
    assertPointsNear(new SpherePoint(1, 0, 0), SphericalProjector.project(PI / 2, 0), 1e-15);
    assertPointsNear(new SpherePoint(0, 1, 0), SphericalProjector.project(PI / 2, PI / 2), 1e-15);
    assertPointsNear(new SpherePoint(-1, 0, 0), SphericalProjector.project(PI / 2, PI), 1e-15);
  }

  @Test
  public void testAzimuthIsPeriodic() {
    assertPointsNear(
        SphericalProjector.project(1.1, 0.3), SphericalProjector.project(1.1, 0.3 + 2 * PI), 1e-14);
  }

  @Test
  public void testUnitLength() {
    for (int k = 0; k < 1000; k++) {
      SpherePoint p = SphericalProjector.project(uniform(0, PI), uniform(0, 2 * PI));
      assertDoubleNear(1, p.norm(), 1e-15);
    }
  }

  @Test
  public void testAngleBetweenProjectedPoints() {
    // Points on one meridian are separated by their difference in colatitude.
    SpherePoint a = SphericalProjector.project(0.4, 2.0);
    SpherePoint b = SphericalProjector.project(1.3, 2.0);
    assertDoubleNear(0.9, a.angle(b), 1e-14);
    // Points on the equator are separated by their difference in azimuth.
    SpherePoint c = SphericalProjector.project(PI / 2, 0.25);
    SpherePoint d = SphericalProjector.project(PI / 2, 1.75);
    assertDoubleNear(1.5, c.angle(d), 1e-14);
  }

  @Test
  public void testRowMatchesSinglePoints() {
    int n = 50;
    double[] t = new double[n];
    double[] p = new double[n];
    for (int i = 0; i < n; i++) {
      t[i] = uniform(0, PI);
      p[i] = uniform(-PI, 3 * PI);
    }
    double[] x = new double[n];
    double[] y = new double[n];
    double[] z = new double[n];
    SphericalProjector.project(t, p, x, y, z);
    for (int i = 0; i < n; i++) {
      SpherePoint expected = SphericalProjector.project(t[i], p[i]);
      assertExactly(expected.x, x[i]);
      assertExactly(expected.y, y[i]);
      assertExactly(expected.z, z[i]);
    }
  }

  @Test
  public void testRowLengthMismatch() {
    double[] out = new double[3];
    assertThrows(
        IllegalArgumentException.class,
        () -> SphericalProjector.project(new double[3], new double[2], out, out, out));
    assertThrows(
        IllegalArgumentException.class,
        () -> SphericalProjector.project(new double[3], new double[3], out, out, new double[2]));
  }
}
