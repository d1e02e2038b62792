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

/**
 * The class of every cell of a source field, indexed {@code [azimuthIndex][colatitudeIndex]}
 * like the field itself. {@code true} marks coronal hole (target) cells. Masks are derived with
 * {@link Classifier#classify(ScalarField2D)} and are never stored on their own.
 */
public final class ClassificationMask {
  private final boolean[][] target;

  ClassificationMask(boolean[][] target) {
    Preconditions.checkArgument(target.length > 0 && target[0].length > 0, "Empty mask");
    this.target = target;
  }

  /** Creates a mask from a copy of the given rows, which must all have the same length. */
  public static ClassificationMask of(boolean[][] target) {
    boolean[][] copy = new boolean[target.length][];
    for (int j = 0; j < target.length; j++) {
      Preconditions.checkArgument(
          target[j].length == target[0].length, "Ragged mask row %s", j);
      copy[j] = target[j].clone();
    }
    return new ClassificationMask(copy);
  }

  /** Returns P, the number of azimuth rows. */
  public int numAzimuths() {
    return target.length;
  }

  /** Returns T, the number of colatitude columns. */
  public int numColatitudes() {
    return target[0].length;
  }

  /** Returns true if the cell at azimuth index {@code j}, colatitude index {@code i} is target. */
  public boolean isTarget(int j, int i) {
    return target[j][i];
  }

  /** Returns the number of target (coronal hole) cells. */
  public int targetCount() {
    int count = 0;
    for (boolean[] row : target) {
      for (boolean t : row) {
        if (t) {
          count++;
        }
      }
    }
    return count;
  }
}
