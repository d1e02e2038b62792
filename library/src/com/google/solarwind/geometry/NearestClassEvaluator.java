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

import com.google.common.annotations.VisibleForTesting;
import com.google.solarwind.geometry.DistanceError.Code;

/**
 * Classifies arbitrary (colatitude, azimuth) points by the class of the nearest source grid cell.
 * Each coordinate is snapped to the nearest value of the corresponding source scale on its own; a
 * coordinate exactly half way between two scale values snaps to the lower index. There is no
 * smoothing or interpolation between cells.
 *
 * <p>Points outside the range covered by the source scales have no nearest cell in this sense and
 * are rejected with {@link Code#OUT_OF_RANGE}.
 */
public final class NearestClassEvaluator {
  private final ScalarField2D source;
  private final double[] colatitudes;
  private final double[] azimuths;
  private final Classifier classifier;

  /** Creates an evaluator over the given source field and classifier. */
  public NearestClassEvaluator(ScalarField2D source, Classifier classifier) {
    this.source = source;
    this.colatitudes = source.colatitudes();
    this.azimuths = source.azimuths();
    this.classifier = classifier;
  }

  /**
   * Returns true if the source cell nearest to (colatitude, azimuth) is coronal hole (target).
   *
   * @throws DistanceException with {@link Code#OUT_OF_RANGE} if the point is off the source grid
   */
  public boolean classify(double colatitude, double azimuth) {
    int i = snap(colatitudes, colatitude, "colatitude");
    int j = snap(azimuths, azimuth, "azimuth");
    return classifier.classify(source.value(j, i));
  }

  /**
   * Classifies every point of the mesh, returning a {@code [P'][T']} array with true for target
   * class points.
   *
   * @throws DistanceException with {@link Code#OUT_OF_RANGE} if any point is off the source grid
   */
  public boolean[][] classify(TargetMesh mesh) {
    boolean[][] result = new boolean[mesh.numRows()][mesh.numColumns()];
    for (int j = 0; j < result.length; j++) {
      for (int i = 0; i < result[j].length; i++) {
        result[j][i] = classify(mesh.colatitude(j, i), mesh.azimuth(j, i));
      }
    }
    return result;
  }

  /**
   * Returns the index of the value of the strictly monotonic {@code scale} nearest to {@code v}.
   */
  @VisibleForTesting
  static int snap(double[] scale, double v, String name) {
    int n = scale.length;
    boolean descending = n > 1 && scale[n - 1] < scale[0];
    double lo = descending ? scale[n - 1] : scale[0];
    double hi = descending ? scale[0] : scale[n - 1];
    if (!(v >= lo && v <= hi)) {
      throw new DistanceException(
          Code.OUT_OF_RANGE,
          "The %s %s is outside the source grid range [%s, %s]",
          name,
          Platform.formatDouble(v),
          Platform.formatDouble(lo),
          Platform.formatDouble(hi));
    }
    if (n == 1) {
      return 0;
    }
    // Invariant: v lies between scale[a] and scale[b].
    int a = 0;
    int b = n - 1;
    while (b - a > 1) {
      int m = (a + b) >>> 1;
      if (descending ? scale[m] >= v : scale[m] <= v) {
        a = m;
      } else {
        b = m;
      }
    }
    double fraction = (v - scale[a]) / (scale[b] - scale[a]);
    return fraction <= 0.5 ? a : b;
  }
}
