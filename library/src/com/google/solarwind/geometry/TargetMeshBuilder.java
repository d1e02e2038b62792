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

import com.google.solarwind.geometry.DistanceError.Code;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Builds the {@link TargetMesh} on which distances are evaluated. The mesh is either the source
 * grid itself, expanded to full 2-D coordinate maps, or a pair of externally supplied coordinate
 * maps such as the footpoints of traced field lines.
 *
 * <p>Whether background points get a negative distance or zero is not a property of the mesh; see
 * {@link DistanceSolver.Options#setForceCoronalHole(boolean)}.
 */
public final class TargetMeshBuilder {
  private static final Logger log = Platform.getLoggerForClass(TargetMeshBuilder.class);

  private TargetMeshBuilder() {}

  /**
   * Returns the mesh for the given inputs: the source grid if neither map is given, otherwise the
   * external maps.
   *
   * @throws DistanceException with {@link Code#MISSING_COORDINATE_MAP} if exactly one map is
   *     given, or {@link Code#SHAPE_MISMATCH} if the maps do not match
   */
  public static TargetMesh build(
      ScalarField2D source, @Nullable Grid2D colatitudeMap, @Nullable Grid2D azimuthMap) {
    if ((colatitudeMap == null) != (azimuthMap == null)) {
      throw new DistanceException(
          Code.MISSING_COORDINATE_MAP,
          "The colatitude and azimuth maps must both be given together (colatitude map %s, "
              + "azimuth map %s).",
          colatitudeMap == null ? "missing" : "given",
          azimuthMap == null ? "missing" : "given");
    }
    if (colatitudeMap == null) {
      return fromSource(source);
    }
    return fromCoordinateMaps(colatitudeMap, azimuthMap);
  }

  /**
   * Returns the source grid as a mesh: point (j, i) is at colatitude {@code t[i]} and azimuth
   * {@code p[j]}.
   */
  public static TargetMesh fromSource(ScalarField2D source) {
    int numAzimuths = source.numAzimuths();
    int numColatitudes = source.numColatitudes();
    double[][] colatitudes = new double[numAzimuths][numColatitudes];
    double[][] azimuths = new double[numAzimuths][numColatitudes];
    for (int j = 0; j < numAzimuths; j++) {
      for (int i = 0; i < numColatitudes; i++) {
        colatitudes[j][i] = source.colatitude(i);
        azimuths[j][i] = source.azimuth(j);
      }
    }
    return new TargetMesh(source.colatitudes(), source.azimuths(), colatitudes, azimuths);
  }

  /**
   * Returns a mesh whose point coordinates are read from two grid files. The files must have the
   * same dimensions. Each is brought to canonical layout on its own with the {@link
   * ScalarField2D#AZIMUTH_DETECTION_THRESHOLD} test on its first scale; the scales of the
   * colatitude file label the output.
   *
   * @throws DistanceException with {@link Code#SHAPE_MISMATCH} if the dimensions differ before or
   *     after normalisation
   */
  public static TargetMesh fromCoordinateMaps(Grid2D colatitudeMap, Grid2D azimuthMap) {
    if (colatitudeMap.size1() != azimuthMap.size1()
        || colatitudeMap.size2() != azimuthMap.size2()) {
      throw new DistanceException(
          Code.SHAPE_MISMATCH,
          "The colatitude and azimuth coordinate files do not have the same dimensions: "
              + "colatitude file dimensions %s, azimuth file dimensions %s",
          colatitudeMap.dimensions(),
          azimuthMap.dimensions());
    }
    double[] colatitudeScale;
    double[] azimuthScale;
    double[][] colatitudes;
    if (ScalarField2D.isAzimuthScale(colatitudeMap.scale1())) {
      colatitudeScale = colatitudeMap.scale2();
      azimuthScale = colatitudeMap.scale1();
      colatitudes = Grid2D.transpose(colatitudeMap.data());
    } else {
      colatitudeScale = colatitudeMap.scale1();
      azimuthScale = colatitudeMap.scale2();
      colatitudes = colatitudeMap.data();
    }
    double[][] azimuths =
        ScalarField2D.isAzimuthScale(azimuthMap.scale1())
            ? Grid2D.transpose(azimuthMap.data())
            : azimuthMap.data();
    if (azimuths.length != colatitudes.length || azimuths[0].length != colatitudes[0].length) {
      throw new DistanceException(
          Code.SHAPE_MISMATCH,
          "The colatitude and azimuth maps use different axis orders: colatitude map is %s x %s, "
              + "azimuth map is %s x %s after normalisation",
          colatitudes.length,
          colatitudes[0].length,
          azimuths.length,
          azimuths[0].length);
    }
    log.fine(
        "Using an external target mesh of "
            + azimuthScale.length
            + " x "
            + colatitudeScale.length
            + " points.");
    return new TargetMesh(colatitudeScale, azimuthScale, colatitudes, azimuths);
  }
}
