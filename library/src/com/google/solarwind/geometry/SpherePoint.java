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

import static java.lang.Math.abs;
import static java.lang.Math.atan2;
import static java.lang.Math.sqrt;

import com.google.errorprone.annotations.Immutable;

/**
 * A point on the unit sphere as a Cartesian 3D vector. Points produced by {@link
 * SphericalProjector} are unit length, so the dot product of two of them is the cosine of their
 * great-circle separation.
 */
@Immutable
public final class SpherePoint {
  /** The north pole, colatitude zero. */
  public static final SpherePoint NORTH_POLE = new SpherePoint(0, 0, 1);

  /** The south pole, colatitude pi. */
  public static final SpherePoint SOUTH_POLE = new SpherePoint(0, 0, -1);

  // Coordinates of the point.
  final double x;
  final double y;
  final double z;

  /** Constructs a SpherePoint from the given coordinates. */
  public SpherePoint(double x, double y, double z) {
    this.x = x;
    this.y = y;
    this.z = z;
  }

  /** Returns the vector dot product of 'this' with 'that'. */
  public double dotProd(SpherePoint that) {
    return this.x * that.x + this.y * that.y + this.z * that.z;
  }

  /** Returns the vector dot product of 'this' with the vector (x, y, z). */
  public double dotProd(double x, double y, double z) {
    return this.x * x + this.y * y + this.z * z;
  }

  /** Returns the vector magnitude {@code sqrt(x*x+y*y+z*z)}. */
  public double norm() {
    return sqrt(norm2());
  }

  /** Returns the square of the vector magnitude {@code x*x+y*y+z*z}. */
  public double norm2() {
    return x * x + y * y + z * z;
  }

  /**
   * Returns the angle between two vectors in radians. Unlike {@code acos(dotProd(va))} this stays
   * accurate when the vectors are nearly parallel.
   */
  public double angle(SpherePoint va) {
    double cx = y * va.z - z * va.y;
    double cy = z * va.x - x * va.z;
    double cz = x * va.y - y * va.x;
    return atan2(sqrt(cx * cx + cy * cy + cz * cz), dotProd(va));
  }

  /** Returns true if all components of 'this' and 'that' are within a difference of margin. */
  boolean aequal(SpherePoint that, double margin) {
    return (abs(x - that.x) < margin) && (abs(y - that.y) < margin) && (abs(z - that.z) < margin);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof SpherePoint)) {
      return false;
    }
    SpherePoint thatPoint = (SpherePoint) that;
    return this.x == thatPoint.x && this.y == thatPoint.y && this.z == thatPoint.z;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(abs(x));
    value += 37 * value + Double.doubleToLongBits(abs(y));
    value += 37 * value + Double.doubleToLongBits(abs(z));
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ", " + z + ")";
  }
}
