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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies ChDistanceTool. */
@RunWith(JUnit4.class)
public class ChDistanceToolTest extends GeometryTestCase {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private Path chfile;
  private Path dfile;

  @Before
  public void writeMap() throws IOException {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    chfile = folder.getRoot().toPath().resolve("ch.grid");
    dfile = folder.getRoot().toPath().resolve("dchb.grid");
    GridFileCoder.write(chfile, cornerHoleField().toGrid());
  }

  private int run(String... args) {
    return ChDistanceTool.run(
        args, new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
  }

  private String err() {
    return err.toString(UTF_8);
  }

  @Test
  public void testComputesDistance() throws IOException {
    assertEquals(0, run("-chfile", chfile.toString(), "-dfile", dfile.toString(), "-eps", "0.5"));
    Grid2D written = GridFileCoder.read(dfile);
    ScalarField2D field = cornerHoleField();
    Grid2D expected =
        new CoronalHoleDistance(new CoronalHoleDistance.Options().setTolerance(0.5))
            .compute(field, TargetMeshBuilder.fromSource(field))
            .toGrid();
    assertEquals(expected, written);
    assertThat(err()).isEmpty();
  }

  @Test
  public void testAzimuthFirstInput() throws IOException {
    double[] t = colatitudeScale(18);
    double[] p = azimuthScale(36);
    double[][] values = new double[t.length][p.length];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < p.length; j++) {
        values[i][j] = 1;
      }
    }
    GridFileCoder.write(chfile, new Grid2D(p, t, values));
    assertEquals(
        0, run("-chfile", chfile.toString(), "-dfile", dfile.toString(), "-v", "-parallel"));
    Grid2D written = GridFileCoder.read(dfile);
    // Output is colatitude first whatever the input order.
    assertThat(written.scale1()).isEqualTo(t);
    assertThat(written.scale2()).isEqualTo(p);
    for (int j = 0; j < p.length; j++) {
      assertTrue(written.get(j, 2) > 0);
      assertTrue(written.get(j, 3) < 0);
    }
  }

  @Test
  public void testExternalMesh() throws IOException {
    double[] t = {1.05, 1.35};
    double[] p = {0.05, 0.55};
    double[][] colatitudes = {{1.05, 1.35}, {1.05, 1.35}};
    double[][] azimuths = {{0.05, 0.05}, {0.55, 0.55}};
    Path tfile = folder.getRoot().toPath().resolve("t.grid");
    Path pfile = folder.getRoot().toPath().resolve("p.grid");
    GridFileCoder.write(tfile, new Grid2D(t, p, colatitudes));
    GridFileCoder.write(pfile, new Grid2D(t, p, azimuths));
    assertEquals(
        0,
        run(
            "-chfile", chfile.toString(),
            "-dfile", dfile.toString(),
            "-t", tfile.toString(),
            "-p", pfile.toString(),
            "-eps", "0.5",
            "-force_ch"));
    Grid2D written = GridFileCoder.read(dfile);
    assertEquals("2 2", written.dimensions());
    assertTrue(written.get(0, 0) > 0);
    assertExactly(0, written.get(0, 1));
    assertExactly(0, written.get(1, 0));
    assertExactly(0, written.get(1, 1));
  }

  @Test
  public void testColatitudeMapWithoutAzimuthMap() {
    assertEquals(
        1, run("-chfile", chfile.toString(), "-dfile", dfile.toString(), "-t", "t.grid"));
    assertThat(err()).contains("### ERROR in ChDistanceTool");
    assertThat(err()).contains("-t and -p");
    assertFalse(Files.exists(dfile));
  }

  @Test
  public void testMismatchedMaps() throws IOException {
    Path tfile = folder.getRoot().toPath().resolve("t.grid");
    Path pfile = folder.getRoot().toPath().resolve("p.grid");
    GridFileCoder.write(
        tfile, new Grid2D(new double[] {1, 1.1}, new double[] {0}, new double[][] {{1, 1.1}}));
    GridFileCoder.write(
        pfile, new Grid2D(new double[] {1}, new double[] {0}, new double[][] {{0}}));
    assertEquals(
        1,
        run(
            "-chfile", chfile.toString(),
            "-dfile", dfile.toString(),
            "-t", tfile.toString(),
            "-p", pfile.toString()));
    assertThat(err()).contains("colatitude file dimensions 2 1, azimuth file dimensions 1 1");
    assertFalse(Files.exists(dfile));
  }

  @Test
  public void testUniformMap() throws IOException {
    GridFileCoder.write(
        chfile, new Grid2D(new double[] {1, 2}, new double[] {0, 1}, new double[2][2]));
    assertEquals(1, run("-chfile", chfile.toString(), "-dfile", dfile.toString()));
    assertThat(err()).contains("### ERROR in ChDistanceTool");
    assertThat(err()).contains("single class");
    assertFalse(Files.exists(dfile));
  }

  @Test
  public void testNonMonotonicScale() throws IOException {
    double[][] values = {{1, 0, 0}, {0, 0, 0}};
    GridFileCoder.write(
        chfile, new Grid2D(new double[] {1.0, 0.5, 1.5}, new double[] {0, 1}, values));
    assertEquals(1, run("-chfile", chfile.toString(), "-dfile", dfile.toString()));
    assertThat(err()).contains("### ERROR in ChDistanceTool");
    assertThat(err()).contains("not strictly monotonic");
    assertFalse(Files.exists(dfile));
  }

  @Test
  public void testHdf5Files() throws IOException {
    Path h5map = folder.getRoot().toPath().resolve("ofm_r0.h5");
    Path h5distance = folder.getRoot().toPath().resolve("dchb_r1.h5");
    GridFileCoder.write(h5map, cornerHoleField().toGrid());
    assertEquals(0, run("-chfile", chfile.toString(), "-dfile", dfile.toString(), "-eps", "0.5"));
    assertEquals(
        0, run("-chfile", h5map.toString(), "-dfile", h5distance.toString(), "-eps", "0.5"));
    byte[] header =
        Arrays.copyOf(Files.readAllBytes(h5distance), Hdf5GridFile.signatureLength());
    assertTrue(Hdf5GridFile.hasSignature(header));
    assertEquals(GridFileCoder.read(dfile), GridFileCoder.read(h5distance));
  }

  @Test
  public void testMissingInputFile() {
    Path missing = folder.getRoot().toPath().resolve("none.grid");
    assertEquals(1, run("-chfile", missing.toString(), "-dfile", dfile.toString()));
    assertThat(err()).contains("I/O failure");
    assertFalse(Files.exists(dfile));
  }

  @Test
  public void testHelp() {
    assertEquals(0, run("-help"));
    assertThat(out.toString(UTF_8)).startsWith("Usage: ChDistanceTool");
    assertThat(err()).isEmpty();
  }

  @Test
  public void testUsageErrors() {
    assertEquals(1, run("-dfile", dfile.toString()));
    assertThat(err()).contains("Usage: ChDistanceTool");
    assertEquals(1, run("-chfile", chfile.toString(), "-dfile", dfile.toString(), "-bogus"));
    assertEquals(1, run("-chfile", chfile.toString(), "-dfile"));
    assertEquals(1, run("-chfile", chfile.toString(), "-dfile", dfile.toString(), "-eps", "x"));
    assertEquals(1, run("-chfile", chfile.toString(), "-dfile", dfile.toString(), "-eps", "-1"));
    assertEquals(1, run("ch.grid"));
    assertFalse(Files.exists(dfile));
  }

  @Test
  public void testParseArguments() {
    ChDistanceTool.Arguments args =
        ChDistanceTool.Arguments.parse(new String[] {"-chfile", "a", "-dfile", "b"});
    assertExactly(0, args.cfval);
    assertExactly(1e-5, args.eps);
    assertFalse(args.forceCh);
    assertFalse(args.wrapPhi);
    assertFalse(args.parallel);
    assertNull(args.tfile);
    assertEquals("a", args.chfile.toString());

    args =
        ChDistanceTool.Arguments.parse(
            new String[] {
              "-cfval", "2", "-eps", "0.25", "-force_ch", "-wrap_phi", "-dp", "-v",
              "-chfile", "a", "-dfile", "b", "-t", "t", "-p", "p"
            });
    assertExactly(2, args.cfval);
    assertExactly(0.25, args.eps);
    assertTrue(args.forceCh);
    assertTrue(args.wrapPhi);
    assertTrue(args.showProgress);
    assertTrue(args.verbose);
    assertEquals("p", args.pfile.toString());

    assertThrows(
        IllegalArgumentException.class,
        () -> ChDistanceTool.Arguments.parse(new String[] {"-chfile", "a", "-dfile", "b", "-p"}));
  }
}
