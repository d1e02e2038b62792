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

import static java.lang.Math.PI;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.solarwind.geometry.DistanceError.Code;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies DistanceSolver. */
@RunWith(JUnit4.class)
public class DistanceSolverTest extends GeometryTestCase {
  private static final Classifier HALF = new Classifier(0, 0.5);

  private static BoundaryPointSet cornerBoundary() {
    ScalarField2D field = cornerHoleField();
    return BoundaryPointSet.build(field, new BoundaryExtractor().extract(HALF.classify(field)));
  }

  private static boolean[][] cornerClasses() {
    ScalarField2D field = cornerHoleField();
    return new NearestClassEvaluator(field, HALF).classify(TargetMeshBuilder.fromSource(field));
  }

  /** Returns the angle from {@code p} to the closest point of {@code set}. */
  private static double closestAngle(BoundaryPointSet set, SpherePoint p) {
    double best = Double.POSITIVE_INFINITY;
    for (int k = 0; k < set.size(); k++) {
      best = Math.min(best, set.point(k).angle(p));
    }
    return best;
  }

  @Test
  public void testClamp() {
    assertExactly(1, DistanceSolver.clamp(1.0000000002));
    assertExactly(-1, DistanceSolver.clamp(-1.0000000002));
    assertExactly(0.25, DistanceSolver.clamp(0.25));
  }

  @Test
  public void testSignedDistance() {
    assertExactly(0, DistanceSolver.signedDistance(1.0000000002, true));
    assertExactly(0, DistanceSolver.signedDistance(1.0000000002, false));
    assertExactly(PI, DistanceSolver.signedDistance(-1.0000001, true));
    assertExactly(-PI, DistanceSolver.signedDistance(-1.0000001, false));
    assertDoubleNear(PI / 2, DistanceSolver.signedDistance(0, true), 1e-15);
    assertDoubleNear(-PI / 3, DistanceSolver.signedDistance(0.5, false), 1e-15);
  }

  @Test
  public void testCornerRegion() {
    ScalarField2D field = cornerHoleField();
    TargetMesh mesh = TargetMeshBuilder.fromSource(field);
    BoundaryPointSet boundary = cornerBoundary();
    DistanceField distances = new DistanceSolver().solve(boundary, HALF, mesh, cornerClasses());
    BoundaryPointSet closed = boundary.partition(HALF, false);
    BoundaryPointSet open = boundary.partition(HALF, true);
    for (int j = 0; j < 4; j++) {
      for (int i = 0; i < 4; i++) {
        SpherePoint p = SphericalProjector.project(mesh.colatitude(j, i), mesh.azimuth(j, i));
        boolean target = j < 2 && i < 2;
        double expected = target ? closestAngle(closed, p) : -closestAngle(open, p);
        assertDoubleNear("cell " + j + "," + i, expected, distances.get(j, i), 1e-7);
        assertEquals(target, distances.get(j, i) > 0);
      }
    }
    assertDoubleNear(0.3359, distances.get(0, 0), 1e-4);
    assertDoubleNear(-0.5595, distances.get(3, 3), 1e-4);
    assertExactly(distances.get(3, 3), distances.min());
    assertExactly(distances.get(0, 0), distances.max());
  }

  @Test
  public void testForceCoronalHole() {
    ScalarField2D field = cornerHoleField();
    TargetMesh mesh = TargetMeshBuilder.fromSource(field);
    DistanceField plain = new DistanceSolver().solve(cornerBoundary(), HALF, mesh, cornerClasses());
    DistanceField forced =
        new DistanceSolver(new DistanceSolver.Options().setForceCoronalHole(true))
            .solve(cornerBoundary(), HALF, mesh, cornerClasses());
    for (int j = 0; j < 4; j++) {
      for (int i = 0; i < 4; i++) {
        if (j < 2 && i < 2) {
          assertExactly(plain.get(j, i), forced.get(j, i));
        } else {
          assertIdentical(0.0, forced.get(j, i));
        }
      }
    }
  }

  @Test
  public void testEmptyBoundaryIsDegenerate() {
    ScalarField2D field = holeField(new double[] {1, 2}, new double[] {0, 1}, new boolean[2][2]);
    BoundaryPointSet empty = BoundaryPointSet.build(field, new IntArrayList());
    TargetMesh mesh = TargetMeshBuilder.fromSource(field);
    for (boolean force : new boolean[] {false, true}) {
      DistanceSolver solver =
          new DistanceSolver(new DistanceSolver.Options().setForceCoronalHole(force));
      DistanceException e =
          assertThrows(
              DistanceException.class,
              () -> solver.solve(empty, HALF, mesh, new boolean[2][2]));
      assertEquals(Code.DEGENERATE_CLASSIFICATION, e.code());
    }
  }

  @Test
  public void testMissingBoundaryClass() {
    TargetMesh mesh =
        new TargetMesh(
            new double[] {1.0}, new double[] {0.0}, new double[][] {{1.0}}, new double[][] {{0}});
    // Only closed-field boundary points.
    BoundaryPointSet closedOnly =
        BoundaryPointSet.of(new SpherePoint[] {SpherePoint.NORTH_POLE}, new double[] {0});
    DistanceException e =
        assertThrows(
            DistanceException.class,
            () -> new DistanceSolver().solve(closedOnly, HALF, mesh, new boolean[][] {{false}}));
    assertEquals(Code.DEGENERATE_CLASSIFICATION, e.code());

    // Forced mode never measures closed-field points, so it has no use for open boundary points.
    DistanceField forced =
        new DistanceSolver(new DistanceSolver.Options().setForceCoronalHole(true))
            .solve(closedOnly, HALF, mesh, new boolean[][] {{false}});
    assertExactly(0, forced.get(0, 0));

    // Open points are measured against closed-field boundary points, which are present.
    DistanceField open =
        new DistanceSolver().solve(closedOnly, HALF, mesh, new boolean[][] {{true}});
    assertDoubleNear(1.0, open.get(0, 0), 1e-15);

    BoundaryPointSet openOnly =
        BoundaryPointSet.of(new SpherePoint[] {SpherePoint.NORTH_POLE}, new double[] {1});
    e =
        assertThrows(
            DistanceException.class,
            () -> new DistanceSolver().solve(openOnly, HALF, mesh, new boolean[][] {{true}}));
    assertEquals(Code.DEGENERATE_CLASSIFICATION, e.code());
  }

  @Test
  public void testPointOnBoundaryHasZeroDistance() {
    SpherePoint p = SphericalProjector.project(1.234, 5.678);
    BoundaryPointSet boundary =
        BoundaryPointSet.of(new SpherePoint[] {p, SpherePoint.SOUTH_POLE}, new double[] {0, 1});
    TargetMesh mesh =
        new TargetMesh(
            new double[] {1.234},
            new double[] {5.678},
            new double[][] {{1.234}},
            new double[][] {{5.678}});
    DistanceField d = new DistanceSolver().solve(boundary, HALF, mesh, new boolean[][] {{true}});
    assertFalse(Double.isNaN(d.get(0, 0)));
    assertDoubleNear(0, d.get(0, 0), 1e-7);
  }

  @Test
  public void testParallelMatchesSequential() {
    int numColatitudes = 36;
    int numAzimuths = 72;
    boolean[][] hole = new boolean[numAzimuths][numColatitudes];
    for (int j = 0; j < numAzimuths; j++) {
      for (int i = 0; i < numColatitudes; i++) {
        hole[j][i] = rand.nextInt(5) == 0;
      }
    }
    ScalarField2D field =
        holeField(colatitudeScale(numColatitudes), azimuthScale(numAzimuths), hole);
    BoundaryPointSet boundary =
        BoundaryPointSet.build(field, new BoundaryExtractor().extract(HALF.classify(field)));
    TargetMesh mesh = TargetMeshBuilder.fromSource(field);
    boolean[][] classes = new NearestClassEvaluator(field, HALF).classify(mesh);
    DistanceField sequential = new DistanceSolver().solve(boundary, HALF, mesh, classes);
    DistanceField parallel =
        new DistanceSolver(new DistanceSolver.Options().setParallel(true))
            .solve(boundary, HALF, mesh, classes);
    for (int j = 0; j < numAzimuths; j++) {
      for (int i = 0; i < numColatitudes; i++) {
        assertIdentical(sequential.get(j, i), parallel.get(j, i));
      }
    }
  }

  @Test
  public void testClassArrayShape() {
    TargetMesh mesh = TargetMeshBuilder.fromSource(cornerHoleField());
    assertThrows(
        IllegalArgumentException.class,
        () -> new DistanceSolver().solve(cornerBoundary(), HALF, mesh, new boolean[3][4]));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DistanceSolver().solve(cornerBoundary(), HALF, mesh, new boolean[4][3]));
  }

  @Test
  public void testOptionsAreCopied() {
    DistanceSolver.Options options = new DistanceSolver.Options().setParallel(true);
    DistanceSolver solver = new DistanceSolver(options);
    options.setParallel(false).setForceCoronalHole(true);
    assertTrue(solver.options().parallel());
    assertFalse(solver.options().forceCoronalHole());
  }
}
