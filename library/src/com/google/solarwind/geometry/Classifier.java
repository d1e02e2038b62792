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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;

/**
 * Splits scalar values into two classes. A value within {@code tolerance} of {@code reference} is
 * closed field (the background class); anything else is coronal hole (the target class).
 *
 * <p>The same instance must be used for the source grid, the boundary points and the target mesh
 * of one run, so that every point is classified against the same reference and tolerance.
 */
@Immutable
public final class Classifier {
  /** The value that marks closed-field cells unless another is given. */
  public static final double DEFAULT_REFERENCE = 0;

  /** The tolerance around the reference unless another is given. */
  public static final double DEFAULT_TOLERANCE = 1e-5;

  /** A classifier with the default reference and tolerance. */
  public static final Classifier DEFAULT = new Classifier(DEFAULT_REFERENCE, DEFAULT_TOLERANCE);

  private final double reference;
  private final double tolerance;

  /**
   * Creates a classifier.
   *
   * @throws IllegalArgumentException if {@code tolerance} is negative or NaN
   */
  public Classifier(double reference, double tolerance) {
    Preconditions.checkArgument(tolerance >= 0, "Tolerance must be >= 0, got %s", tolerance);
    this.reference = reference;
    this.tolerance = tolerance;
  }

  /**
   * Returns false (closed field) if {@code |value - reference| <= tolerance}, true (coronal hole)
   * otherwise. A NaN value is never within tolerance, so it is coronal hole.
   */
  public static boolean classify(double value, double reference, double tolerance) {
    return !(abs(value - reference) <= tolerance);
  }

  /** Returns true if {@code value} is in the coronal hole (target) class. */
  public boolean classify(double value) {
    return classify(value, reference, tolerance);
  }

  /** Classifies every cell of the given field. */
  public ClassificationMask classify(ScalarField2D field) {
    boolean[][] target = new boolean[field.numAzimuths()][field.numColatitudes()];
    for (int j = 0; j < target.length; j++) {
      for (int i = 0; i < target[j].length; i++) {
        target[j][i] = classify(field.value(j, i));
      }
    }
    return new ClassificationMask(target);
  }

  /** Returns the reference value of the closed-field class. */
  public double reference() {
    return reference;
  }

  /** Returns the tolerance around the reference. */
  public double tolerance() {
    return tolerance;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Classifier)) {
      return false;
    }
    Classifier that = (Classifier) other;
    return Double.compare(reference, that.reference) == 0
        && Double.compare(tolerance, that.tolerance) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(reference) + Double.hashCode(tolerance);
  }

  @Override
  public String toString() {
    return "Classifier[reference="
        + Platform.formatDouble(reference)
        + ", tolerance="
        + Platform.formatDouble(tolerance)
        + "]";
  }
}
