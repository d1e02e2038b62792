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

import static java.lang.Math.acos;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.solarwind.geometry.DistanceError.Code;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;

/**
 * Computes the signed angular distance from every target mesh point to the nearest coronal hole
 * boundary.
 *
 * <p>The boundary points are split by the class of their own cell. A coronal hole point q is
 * measured against the closed-field boundary points and gets {@code +acos(max_p q.p)}; a
 * closed-field point is measured against the coronal hole boundary points and gets {@code
 * -acos(max_p q.p)}. Since all points are unit vectors the largest dot product belongs to the
 * nearest point. The maximum is clamped to [-1, 1] before {@code acos} to absorb rounding.
 *
 * <p>The search enumerates every boundary point for every target point, one mesh row at a time.
 * Rows are independent and only read the shared boundary set, so with {@link
 * Options#setParallel(boolean)} they are spread over the common fork/join pool.
 *
 * <p>This class is immutable and thread-safe.
 */
public final class DistanceSolver {
  private static final Logger log = Platform.getLoggerForClass(DistanceSolver.class);

  /** Options for a {@link DistanceSolver}. */
  public static class Options {
    private boolean forceCoronalHole = false;
    private boolean parallel = false;

    /** Constructor that sets default options. */
    public Options() {}

    /** Options copy constructor. */
    public Options(Options other) {
      this.forceCoronalHole = other.forceCoronalHole;
      this.parallel = other.parallel;
    }

    /** Returns whether closed-field points get a distance of zero. */
    public boolean forceCoronalHole() {
      return forceCoronalHole;
    }

    /**
     * If true, closed-field points get a distance of exactly zero instead of a negative distance,
     * for consumers that only use distances inside coronal holes.
     *
     * <p>DEFAULT: false
     */
    @CanIgnoreReturnValue
    public Options setForceCoronalHole(boolean forceCoronalHole) {
      this.forceCoronalHole = forceCoronalHole;
      return this;
    }

    /** Returns whether mesh rows are evaluated in parallel. */
    public boolean parallel() {
      return parallel;
    }

    /**
     * If true, mesh rows are evaluated concurrently. The result is identical to a sequential run.
     *
     * <p>DEFAULT: false
     */
    @CanIgnoreReturnValue
    public Options setParallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }
  }

  private final Options options;

  /** Creates a solver with default options. */
  public DistanceSolver() {
    this(new Options());
  }

  /** Creates a solver with a copy of the given options. */
  public DistanceSolver(Options options) {
    this.options = new Options(options);
  }

  /** Returns a copy of this solver's options. */
  public Options options() {
    return new Options(options);
  }

  /**
   * Returns the distance field over {@code mesh}.
   *
   * @param boundary the boundary points of the source field
   * @param classifier the classifier the source field was classified with
   * @param mesh the points to evaluate
   * @param targetClass the nearest-cell class of every mesh point, see {@link
   *     NearestClassEvaluator#classify(TargetMesh)}
   * @throws DistanceException with {@link Code#DEGENERATE_CLASSIFICATION} if there are no boundary
   *     points, or none of a class that some mesh point must be measured against
   */
  public DistanceField solve(
      BoundaryPointSet boundary, Classifier classifier, TargetMesh mesh, boolean[][] targetClass) {
    int numRows = mesh.numRows();
    int numColumns = mesh.numColumns();
    Preconditions.checkArgument(
        targetClass.length == numRows,
        "Class array has %s rows, mesh has %s",
        targetClass.length,
        numRows);
    if (boundary.isEmpty()) {
      throw new DistanceException(
          Code.DEGENERATE_CLASSIFICATION,
          "The source field has no coronal hole boundary; it has a single class everywhere.");
    }

    boolean anyTarget = false;
    boolean anyBackground = false;
    for (boolean[] row : targetClass) {
      Preconditions.checkArgument(row.length == numColumns, "Ragged class array");
      for (boolean t : row) {
        anyTarget |= t;
        anyBackground |= !t;
      }
    }
    BoundaryPointSet closedBoundary = boundary.partition(classifier, false);
    BoundaryPointSet holeBoundary = boundary.partition(classifier, true);
    boolean needClosed = anyTarget;
    boolean needHole = anyBackground && !options.forceCoronalHole;
    if (needClosed && closedBoundary.isEmpty()) {
      throw new DistanceException(
          Code.DEGENERATE_CLASSIFICATION,
          "There are no closed-field boundary points to measure coronal hole points against.");
    }
    if (needHole && holeBoundary.isEmpty()) {
      throw new DistanceException(
          Code.DEGENERATE_CLASSIFICATION,
          "There are no coronal hole boundary points to measure closed-field points against.");
    }

    double[][] distances = new double[numRows][];
    IntStream rows = IntStream.range(0, numRows);
    if (options.parallel) {
      rows = rows.parallel();
    }
    rows.forEach(
        j -> {
          if (log.isLoggable(Level.FINE)) {
            log.fine("Calculating " + (j + 1) + " of " + numRows);
          }
          distances[j] =
              solveRow(
                  mesh,
                  j,
                  targetClass[j],
                  needClosed ? closedBoundary : null,
                  needHole ? holeBoundary : null);
        });
    return new DistanceField(mesh.colatitudeScale(), mesh.azimuthScale(), distances);
  }

  /**
   * Returns the distances of mesh row {@code j}. A boundary subset is null when no point of the row
   * can need it.
   */
  private double[] solveRow(
      TargetMesh mesh,
      int j,
      boolean[] targetClass,
      @Nullable BoundaryPointSet closedBoundary,
      @Nullable BoundaryPointSet holeBoundary) {
    int n = mesh.numColumns();
    double[] x = new double[n];
    double[] y = new double[n];
    double[] z = new double[n];
    SphericalProjector.project(mesh.colatitudeRow(j), mesh.azimuthRow(j), x, y, z);

    double[] maxDotClosed = new double[n];
    double[] maxDotHole = new double[n];
    if (closedBoundary != null) {
      closedBoundary.maxDotProd(x, y, z, maxDotClosed);
    }
    if (holeBoundary != null) {
      holeBoundary.maxDotProd(x, y, z, maxDotHole);
    }

    double[] result = new double[n];
    for (int i = 0; i < n; i++) {
      if (targetClass[i]) {
        result[i] = signedDistance(maxDotClosed[i], true);
      } else if (options.forceCoronalHole) {
        result[i] = 0;
      } else {
        result[i] = signedDistance(maxDotHole[i], false);
      }
    }
    return result;
  }

  /**
   * Converts the largest dot product with the opposite-class boundary to a signed distance:
   * positive for coronal hole points, negative for closed-field points. The dot product is clamped
   * to [-1, 1] first, so rounding just past +-1 gives 0 or pi rather than NaN.
   */
  public static double signedDistance(double maxDotProd, boolean targetClass) {
    double angle = acos(clamp(maxDotProd));
    return targetClass ? angle : -angle;
  }

  /** Returns {@code d} clamped to [-1, 1]. */
  static double clamp(double d) {
    return min(1.0, max(-1.0, d));
  }
}
