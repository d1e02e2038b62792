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
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Command line tool that computes the distance to the nearest coronal hole boundary of a coronal
 * hole map and writes it as a grid file.
 *
 * <pre>
 * ChDistanceTool -chfile ch.h5 -dfile dchb.h5 [-cfval 0] [-eps 1e-5]
 *     [-t theta.h5 -p phi.h5] [-force_ch] [-wrap_phi] [-parallel] [-v] [-dp]
 * </pre>
 *
 * Inputs may be HDF5 or {@link GridFileCoder} files; the output format follows the name of
 * {@code -dfile}.
 *
 * Exits with status 1 and no output file on any error.
 */
public final class ChDistanceTool {
  private static final Logger log = Platform.getLoggerForClass(ChDistanceTool.class);

  private static final String NAME = "ChDistanceTool";

  static final String USAGE =
      "Usage: "
          + NAME
          + " -chfile <coronal hole map> -dfile <output distance file>\n"
          + "  -cfval <value>  map value of closed-field regions (default 0)\n"
          + "  -eps <value>    tolerance around -cfval (default 1e-5)\n"
          + "  -t <file>       colatitude map of the target mesh (requires -p)\n"
          + "  -p <file>       azimuth map of the target mesh (requires -t)\n"
          + "  -force_ch       write zero instead of negative distances outside coronal holes\n"
          + "  -wrap_phi       treat the map as periodic in azimuth when finding boundaries\n"
          + "  -parallel       evaluate mesh rows in parallel\n"
          + "  -v              verbose\n"
          + "  -dp             display progress per mesh row";

  /** Parsed command line. */
  @VisibleForTesting
  static final class Arguments {
    boolean verbose;
    boolean showProgress;
    double cfval = Classifier.DEFAULT_REFERENCE;
    double eps = Classifier.DEFAULT_TOLERANCE;
    @Nullable Path tfile;
    @Nullable Path pfile;
    boolean forceCh;
    boolean wrapPhi;
    boolean parallel;
    @Nullable Path chfile;
    @Nullable Path dfile;
    boolean help;

    /** Parses the command line, throwing IllegalArgumentException on misuse. */
    static Arguments parse(String[] args) {
      Arguments result = new Arguments();
      ToolArguments cursor = new ToolArguments(args);
      while (cursor.hasNext()) {
        String option = cursor.nextOption();
        switch (option) {
          case "-v":
            result.verbose = true;
            break;
          case "-dp":
            result.showProgress = true;
            break;
          case "-cfval":
            result.cfval = cursor.doubleValue(option);
            break;
          case "-eps":
            result.eps = cursor.doubleValue(option);
            break;
          case "-t":
            result.tfile = Paths.get(cursor.value(option));
            break;
          case "-p":
            result.pfile = Paths.get(cursor.value(option));
            break;
          case "-force_ch":
            result.forceCh = true;
            break;
          case "-wrap_phi":
            result.wrapPhi = true;
            break;
          case "-parallel":
            result.parallel = true;
            break;
          case "-chfile":
            result.chfile = Paths.get(cursor.value(option));
            break;
          case "-dfile":
            result.dfile = Paths.get(cursor.value(option));
            break;
          case "-h":
          case "-help":
            result.help = true;
            break;
          default:
            throw new IllegalArgumentException("Unknown option " + option);
        }
      }
      if (result.help) {
        return result;
      }
      if (result.chfile == null || result.dfile == null) {
        throw new IllegalArgumentException("The options -chfile and -dfile are required.");
      }
      if ((result.tfile == null) != (result.pfile == null)) {
        throw new IllegalArgumentException("The options -t and -p must both be set together.");
      }
      if (!(result.eps >= 0)) {
        throw new IllegalArgumentException("The option -eps must be >= 0.");
      }
      return result;
    }
  }

  private ChDistanceTool() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Runs the tool and returns its exit status. */
  @VisibleForTesting
  static int run(String[] argv, PrintStream out, PrintStream err) {
    Arguments args;
    try {
      args = Arguments.parse(argv);
    } catch (IllegalArgumentException e) {
      ToolArguments.printError(err, NAME, e.getMessage());
      err.println(USAGE);
      return 1;
    }
    if (args.help) {
      out.println(USAGE);
      return 0;
    }
    ToolArguments.configureLogging(
        args.showProgress ? Level.FINE : args.verbose ? Level.INFO : Level.WARNING);
    try {
      compute(args);
      return 0;
    } catch (IOException e) {
      ToolArguments.printError(err, NAME, "I/O failure: " + e);
      return 1;
    } catch (DistanceException e) {
      ToolArguments.printError(err, NAME, e.getMessage());
      return 1;
    } catch (IllegalArgumentException e) {
      ToolArguments.printError(err, NAME, "Invalid input: " + e.getMessage());
      return 1;
    }
  }

  private static void compute(Arguments args) throws IOException {
    log.info("Reading coronal hole file: " + args.chfile);
    ScalarField2D map = ScalarField2D.fromGrid(GridFileCoder.read(args.chfile));

    Grid2D colatitudeMap = null;
    Grid2D azimuthMap = null;
    if (args.tfile != null) {
      log.info("Reading theta coordinate file: " + args.tfile);
      colatitudeMap = GridFileCoder.read(args.tfile);
      log.info("Reading phi coordinate file: " + args.pfile);
      azimuthMap = GridFileCoder.read(args.pfile);
    }
    TargetMesh mesh = TargetMeshBuilder.build(map, colatitudeMap, azimuthMap);

    CoronalHoleDistance.Options options =
        new CoronalHoleDistance.Options()
            .setReference(args.cfval)
            .setTolerance(args.eps)
            .setForceCoronalHole(args.forceCh)
            .setWrapAzimuth(args.wrapPhi)
            .setParallel(args.parallel);
    DistanceField distance = new CoronalHoleDistance(options).compute(map, mesh);

    GridFileCoder.write(args.dfile, distance.toGrid());
    log.info("Wrote the coronal hole distance to file: " + args.dfile);
  }
}
