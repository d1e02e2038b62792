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
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.Arrays;

/**
 * The boundary cells of a source field as unit vectors, each with the raw scalar value of its cell
 * so that it can be classified again with the run's {@link Classifier}. Instances are immutable
 * after construction and may be shared between threads.
 *
 * <p>Coordinates are kept in three parallel arrays rather than as {@link SpherePoint} objects,
 * since the solver scans every point for every target point.
 */
public final class BoundaryPointSet {
  private static final BoundaryPointSet EMPTY =
      new BoundaryPointSet(new double[0], new double[0], new double[0], new double[0]);

  private final double[] x;
  private final double[] y;
  private final double[] z;
  private final double[] values;

  private BoundaryPointSet(double[] x, double[] y, double[] z, double[] values) {
    this.x = x;
    this.y = y;
    this.z = z;
    this.values = values;
  }

  /**
   * Builds the point set of the given cells of {@code field}.
   *
   * @param cells flat cell indices {@code j * T + i}, as returned by {@link
   *     BoundaryExtractor#extract}
   */
  public static BoundaryPointSet build(ScalarField2D field, IntList cells) {
    int n = cells.size();
    if (n == 0) {
      return EMPTY;
    }
    int numColatitudes = field.numColatitudes();
    double[] x = new double[n];
    double[] y = new double[n];
    double[] z = new double[n];
    double[] values = new double[n];
    for (int k = 0; k < n; k++) {
      int cell = cells.getInt(k);
      Preconditions.checkElementIndex(cell, field.numCells());
      int j = cell / numColatitudes;
      int i = cell % numColatitudes;
      SpherePoint p = SphericalProjector.project(field.colatitude(i), field.azimuth(j));
      x[k] = p.x;
      y[k] = p.y;
      z[k] = p.z;
      values[k] = field.value(j, i);
    }
    return new BoundaryPointSet(x, y, z, values);
  }

  /** Returns a set holding exactly the given points and values, for tests and tools. */
  static BoundaryPointSet of(SpherePoint[] points, double[] values) {
    Preconditions.checkArgument(points.length == values.length);
    int n = points.length;
    double[] x = new double[n];
    double[] y = new double[n];
    double[] z = new double[n];
    for (int k = 0; k < n; k++) {
      x[k] = points[k].x;
      y[k] = points[k].y;
      z[k] = points[k].z;
    }
    return new BoundaryPointSet(x, y, z, values.clone());
  }

  /** Returns the number of boundary points. */
  public int size() {
    return values.length;
  }

  /** Returns true if there are no boundary points. */
  public boolean isEmpty() {
    return values.length == 0;
  }

  /** Returns the position of point {@code k}. */
  public SpherePoint point(int k) {
    return new SpherePoint(x[k], y[k], z[k]);
  }

  /** Returns the scalar value of the cell point {@code k} came from. */
  public double value(int k) {
    return values[k];
  }

  /**
   * Returns the points whose value {@code classifier} puts in the target class (if {@code target})
   * or in the background class (otherwise), in their original order.
   */
  public BoundaryPointSet partition(Classifier classifier, boolean target) {
    int count = 0;
    for (double value : values) {
      if (classifier.classify(value) == target) {
        count++;
      }
    }
    if (count == values.length) {
      return this;
    }
    double[] px = new double[count];
    double[] py = new double[count];
    double[] pz = new double[count];
    double[] pv = new double[count];
    int n = 0;
    for (int k = 0; k < values.length; k++) {
      if (classifier.classify(values[k]) == target) {
        px[n] = x[k];
        py[n] = y[k];
        pz[n] = z[k];
        pv[n] = values[k];
        n++;
      }
    }
    return new BoundaryPointSet(px, py, pz, pv);
  }

  /**
   * Returns the largest dot product between (qx, qy, qz) and any point of this set, i.e. the
   * cosine of the angle to the nearest point. Returns {@link Double#NEGATIVE_INFINITY} if the set
   * is empty.
   */
  public double maxDotProd(double qx, double qy, double qz) {
    double best = Double.NEGATIVE_INFINITY;
    for (int k = 0; k < x.length; k++) {
      double dot = x[k] * qx + y[k] * qy + z[k] * qz;
      if (dot > best) {
        best = dot;
      }
    }
    return best;
  }

  /** As {@link #maxDotProd(double, double, double)}, for a point given as a SpherePoint. */
  public double maxDotProd(SpherePoint q) {
    return maxDotProd(q.x, q.y, q.z);
  }

  /**
   * Computes {@link #maxDotProd(double, double, double)} for a whole row of query points at once,
   * writing the results to {@code out}. The boundary points are the outer loop, so each one is read
   * once per row.
   */
  public void maxDotProd(double[] qx, double[] qy, double[] qz, double[] out) {
    int n = out.length;
    Preconditions.checkArgument(qx.length >= n && qy.length >= n && qz.length >= n);
    Arrays.fill(out, Double.NEGATIVE_INFINITY);
    for (int k = 0; k < x.length; k++) {
      double bx = x[k];
      double by = y[k];
      double bz = z[k];
      for (int i = 0; i < n; i++) {
        double dot = bx * qx[i] + by * qy[i] + bz * qz[i];
        if (dot > out[i]) {
          out[i] = dot;
        }
      }
    }
  }
}
