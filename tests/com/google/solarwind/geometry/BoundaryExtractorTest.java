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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies BoundaryExtractor. */
@RunWith(JUnit4.class)
public class BoundaryExtractorTest extends GeometryTestCase {
  private static final Classifier HALF = new Classifier(0, 0.5);

  private static ClassificationMask cornerMask() {
    return HALF.classify(cornerHoleField());
  }

  @Test
  public void testCornerRegionClamped() {
    IntArrayList cells = new BoundaryExtractor().extract(cornerMask());
    // The corner cell (0,0) only sees open cells inside the clamped window.
    assertThat(cells.toIntArray()).asList().containsExactly(1, 2, 4, 5, 6, 8, 9, 10).inOrder();
  }

  @Test
  public void testCornerRegionWrapped() {
    IntArrayList cells = new BoundaryExtractor().setWrapAzimuth(true).extract(cornerMask());
    assertThat(cells.toIntArray())
        .asList()
        .containsExactly(0, 1, 2, 4, 5, 6, 8, 9, 10, 12, 13, 14)
        .inOrder();
  }

  @Test
  public void testEveryBoundaryCellHasAnOppositeNeighbour() {
    ClassificationMask mask = cornerMask();
    BoundaryExtractor extractor = new BoundaryExtractor();
    for (int j = 0; j < 4; j++) {
      for (int i = 0; i < 4; i++) {
        boolean flagged = extractor.extract(mask).contains(j * 4 + i);
        assertThat(extractor.isBoundary(mask, j, i, false)).isEqualTo(flagged);
      }
    }
    assertFalse(extractor.isBoundary(mask, 3, 3, false));
    assertFalse(extractor.isBoundary(mask, 0, 0, false));
    assertTrue(extractor.isBoundary(mask, 0, 0, true));
  }

  @Test
  public void testUniformFieldHasNoBoundary() {
    assertTrue(new BoundaryExtractor().extract(ClassificationMask.of(new boolean[5][7])).isEmpty());
    boolean[][] open = new boolean[3][3];
    for (boolean[] row : open) {
      Arrays.fill(row, true);
    }
    IntArrayList cells =
        new BoundaryExtractor().setWrapAzimuth(true).extract(ClassificationMask.of(open));
    assertTrue(cells.isEmpty());
  }

  @Test
  public void testIsolatedCell() {
    boolean[][] target = new boolean[5][5];
    target[2][2] = true;
    IntArrayList cells = new BoundaryExtractor().extract(ClassificationMask.of(target));
    assertThat(cells.toIntArray())
        .asList()
        .containsExactly(6, 7, 8, 11, 12, 13, 16, 17, 18)
        .inOrder();
  }

  @Test
  public void testSingleAzimuthRow() {
    boolean[][] target = {{false, false, true, false, false}};
    IntArrayList clamped = new BoundaryExtractor().extract(ClassificationMask.of(target));
    IntArrayList wrapped =
        new BoundaryExtractor().setWrapAzimuth(true).extract(ClassificationMask.of(target));
    assertThat(clamped.toIntArray()).asList().containsExactly(1, 2, 3).inOrder();
    assertThat(wrapped.toIntArray()).asList().containsExactly(1, 2, 3).inOrder();
  }

  @Test
  public void testSingleColatitudeColumn() {
    boolean[][] target = {{true}, {false}, {false}, {false}, {false}};
    IntArrayList clamped = new BoundaryExtractor().extract(ClassificationMask.of(target));
    IntArrayList wrapped =
        new BoundaryExtractor().setWrapAzimuth(true).extract(ClassificationMask.of(target));
    assertThat(clamped.toIntArray()).asList().containsExactly(0, 1).inOrder();
    assertThat(wrapped.toIntArray()).asList().containsExactly(0, 1, 4).inOrder();
  }

  @Test
  public void testWrapNeedsThreeRows() {
    boolean[][] target = {{true, false, false}, {false, false, false}};
    IntArrayList clamped = new BoundaryExtractor().extract(ClassificationMask.of(target));
    IntArrayList wrapped =
        new BoundaryExtractor().setWrapAzimuth(true).extract(ClassificationMask.of(target));
    assertThat(clamped.toIntArray()).asList().containsExactly(0, 1, 3, 4).inOrder();
    assertThat(wrapped.toIntArray()).isEqualTo(clamped.toIntArray());
  }
}
