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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.logging.Logger;

/**
 * Computes the distance to the nearest coronal hole boundary for a coronal hole map.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ScalarField2D map = ScalarField2D.fromGrid(GridFileCoder.read(chFile));
 * CoronalHoleDistance.Options options = new CoronalHoleDistance.Options().setTolerance(0.5);
 * DistanceField distance =
 *     new CoronalHoleDistance(options).compute(map, TargetMeshBuilder.fromSource(map));
 * GridFileCoder.write(distanceFile, distance.toGrid());
 * }</pre>
 *
 * <p>The steps are: classify the map, find the boundary cells, project them onto the unit sphere,
 * classify each target point by its nearest map cell, and solve for the signed distances.
 */
public final class CoronalHoleDistance {
  private static final Logger log = Platform.getLoggerForClass(CoronalHoleDistance.class);

  /** Options for a {@link CoronalHoleDistance} run. */
  public static class Options {
    private double reference = Classifier.DEFAULT_REFERENCE;
    private double tolerance = Classifier.DEFAULT_TOLERANCE;
    private boolean wrapAzimuth = false;
    private final DistanceSolver.Options solverOptions = new DistanceSolver.Options();

    /** Constructor that sets default options. */
    public Options() {}

    /** Options copy constructor. */
    public Options(Options other) {
      this.reference = other.reference;
      this.tolerance = other.tolerance;
      this.wrapAzimuth = other.wrapAzimuth;
      this.solverOptions.setForceCoronalHole(other.solverOptions.forceCoronalHole());
      this.solverOptions.setParallel(other.solverOptions.parallel());
    }

    /** Returns the map value that marks closed field. */
    public double reference() {
      return reference;
    }

    /**
     * Sets the map value that marks closed field.
     *
     * <p>DEFAULT: {@link Classifier#DEFAULT_REFERENCE}
     */
    @CanIgnoreReturnValue
    public Options setReference(double reference) {
      this.reference = reference;
      return this;
    }

    /** Returns the tolerance around the reference value. */
    public double tolerance() {
      return tolerance;
    }

    /**
     * Sets the tolerance around the reference value; must be {@code >= 0}.
     *
     * <p>DEFAULT: {@link Classifier#DEFAULT_TOLERANCE}
     */
    @CanIgnoreReturnValue
    public Options setTolerance(double tolerance) {
      this.tolerance = tolerance;
      return this;
    }

    /** See {@link BoundaryExtractor#setWrapAzimuth(boolean)}. */
    public boolean wrapAzimuth() {
      return wrapAzimuth;
    }

    /**
     * Makes the boundary scan periodic in azimuth, see {@link
     * BoundaryExtractor#setWrapAzimuth(boolean)}.
     *
     * <p>DEFAULT: false
     */
    @CanIgnoreReturnValue
    public Options setWrapAzimuth(boolean wrapAzimuth) {
      this.wrapAzimuth = wrapAzimuth;
      return this;
    }

    /** See {@link DistanceSolver.Options#setForceCoronalHole(boolean)}. */
    public boolean forceCoronalHole() {
      return solverOptions.forceCoronalHole();
    }

    /**
     * Gives closed-field points a distance of zero, see {@link
     * DistanceSolver.Options#setForceCoronalHole(boolean)}.
     *
     * <p>DEFAULT: false
     */
    @CanIgnoreReturnValue
    public Options setForceCoronalHole(boolean forceCoronalHole) {
      solverOptions.setForceCoronalHole(forceCoronalHole);
      return this;
    }

    /** See {@link DistanceSolver.Options#setParallel(boolean)}. */
    public boolean parallel() {
      return solverOptions.parallel();
    }

    /**
     * Evaluates mesh rows concurrently, see {@link DistanceSolver.Options#setParallel(boolean)}.
     *
     * <p>DEFAULT: false
     */
    @CanIgnoreReturnValue
    public Options setParallel(boolean parallel) {
      solverOptions.setParallel(parallel);
      return this;
    }
  }

  private final Options options;
  private final Classifier classifier;

  /** Creates a computation with default options. */
  public CoronalHoleDistance() {
    this(new Options());
  }

  /**
   * Creates a computation with a copy of the given options.
   *
   * @throws IllegalArgumentException if the tolerance is negative or NaN
   */
  public CoronalHoleDistance(Options options) {
    this.options = new Options(options);
    this.classifier = new Classifier(options.reference, options.tolerance);
  }

  /** Returns the classifier used for the map, the boundary points and the target points. */
  public Classifier classifier() {
    return classifier;
  }

  /**
   * Returns the signed distance from every point of {@code mesh} to the nearest coronal hole
   * boundary of {@code map}.
   *
   * @throws DistanceException if a mesh point lies outside the map, or the map has no boundary of
   *     a class that some mesh point needs
   */
  public DistanceField compute(ScalarField2D map, TargetMesh mesh) {
    BoundaryPointSet boundary = boundaryPoints(map);
    boolean[][] targetClass = new NearestClassEvaluator(map, classifier).classify(mesh);
    log.info("Computing the coronal hole distance on " + mesh + " ...");
    return new DistanceSolver(options.solverOptions).solve(boundary, classifier, mesh, targetClass);
  }

  /** Returns the boundary points of the given map under this computation's classifier. */
  public BoundaryPointSet boundaryPoints(ScalarField2D map) {
    ClassificationMask mask = classifier.classify(map);
    IntArrayList cells = new BoundaryExtractor().setWrapAzimuth(options.wrapAzimuth).extract(mask);
    log.info(
        "Percentage of points near the coronal hole boundary = "
            + Platform.formatDouble(Platform.percentage(cells.size(), map.numCells()))
            + " %");
    return BoundaryPointSet.build(map, cells);
  }
}
