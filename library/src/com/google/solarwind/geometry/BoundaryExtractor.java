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

import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.logging.Logger;

/**
 * Finds the cells of a {@link ClassificationMask} that touch the other class. A cell is a boundary
 * cell iff at least one cell of its 3x3 neighbourhood, diagonals included, has a different class.
 *
 * <p>By default the neighbourhood is clamped to the grid in both directions, so the first and last
 * azimuth rows do not see each other even though azimuth is periodic. Grids that do not repeat the
 * seam can call {@link #setWrapAzimuth(boolean)} to make the scan periodic in azimuth; this changes
 * which cells near the seam are reported and is therefore off unless asked for.
 */
public final class BoundaryExtractor {
  private static final Logger log = Platform.getLoggerForClass(BoundaryExtractor.class);

  private boolean wrapAzimuth = false;

  /** Creates an extractor with the clamped (non-periodic) neighbourhood. */
  public BoundaryExtractor() {}

  /** Returns whether azimuth neighbours wrap around the seam. */
  public boolean wrapAzimuth() {
    return wrapAzimuth;
  }

  /**
   * If true, the azimuth neighbours of row 0 include row {@code P - 1} and vice versa.
   *
   * <p>DEFAULT: false
   */
  @CanIgnoreReturnValue
  public BoundaryExtractor setWrapAzimuth(boolean wrapAzimuth) {
    this.wrapAzimuth = wrapAzimuth;
    return this;
  }

  /**
   * Returns the flat indices {@code j * T + i} of all boundary cells, in increasing order (azimuth
   * rows outer, colatitude columns inner).
   */
  public IntArrayList extract(ClassificationMask mask) {
    int numAzimuths = mask.numAzimuths();
    int numColatitudes = mask.numColatitudes();
    // With fewer than three rows wrapping only revisits rows the clamped scan already sees.
    boolean wrap = wrapAzimuth && numAzimuths > 2;
    if (wrap) {
      log.fine("Boundary scan wraps around the azimuth seam.");
    }
    IntArrayList cells = new IntArrayList();
    for (int j = 0; j < numAzimuths; j++) {
      for (int i = 0; i < numColatitudes; i++) {
        if (isBoundary(mask, j, i, wrap)) {
          cells.add(j * numColatitudes + i);
        }
      }
    }
    return cells;
  }

  /** Returns true if cell (j, i) has a 3x3 neighbour of the other class. */
  boolean isBoundary(ClassificationMask mask, int j, int i, boolean wrap) {
    int numAzimuths = mask.numAzimuths();
    int numColatitudes = mask.numColatitudes();
    boolean own = mask.isTarget(j, i);
    int iLo = max(0, i - 1);
    int iHi = min(numColatitudes - 1, i + 1);
    int jLo = wrap ? j - 1 : max(0, j - 1);
    int jHi = wrap ? j + 1 : min(numAzimuths - 1, j + 1);
    for (int jj = jLo; jj <= jHi; jj++) {
      int row = Math.floorMod(jj, numAzimuths);
      for (int ii = iLo; ii <= iHi; ii++) {
        if (mask.isTarget(row, ii) != own) {
          return true;
        }
      }
    }
    return false;
  }
}
