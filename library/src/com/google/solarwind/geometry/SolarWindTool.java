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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line tool that evaluates a {@link SolarWindModel} from a DCHB grid (as written by {@link
 * ChDistanceTool}) and an expansion factor grid, writing {@code vr_r1}, {@code rho_r1} and {@code
 * t_r1} to the output directory. The outputs are HDF5 ({@code .h5}) when the DCHB file is, and
 * {@code .grid} files otherwise.
 *
 * <pre>
 * SolarWindTool -dchb dchb.grid -expfac expfac.grid -model wsa|wsa2|psi [-outdir dir]
 *     [-vslow v] [-vfast v] [-vmax v] [-c1 c] [-c2 c] [-c3_i c] [-c4 c] [-c5 c]
 *     [-psi_eps e] [-psi_width w] [-rhofast rho] [-tfast t] [-v]
 * </pre>
 */
public final class SolarWindTool {
  private static final Logger log = Platform.getLoggerForClass(SolarWindTool.class);

  private static final String NAME = "SolarWindTool";

  static final String SPEED = "vr_r1";
  static final String DENSITY = "rho_r1";
  static final String TEMPERATURE = "t_r1";

  private SolarWindTool() {}

  public static void main(String[] args) {
    System.exit(run(args, System.err));
  }

  /** Runs the tool and returns its exit status. */
  @VisibleForTesting
  static int run(String[] argv, PrintStream err) {
    Path dchb = null;
    Path expfac = null;
    SolarWindModel.Type type = null;
    Path outdir = Paths.get(".");
    boolean verbose = false;
    // Overrides are applied once the model, and so the defaults, are known.
    Map<String, Double> overrides = new LinkedHashMap<>();
    try {
      ToolArguments cursor = new ToolArguments(argv);
      while (cursor.hasNext()) {
        String option = cursor.nextOption();
        switch (option) {
          case "-dchb":
            dchb = Paths.get(cursor.value(option));
            break;
          case "-expfac":
            expfac = Paths.get(cursor.value(option));
            break;
          case "-model":
            type = SolarWindModel.Type.parse(cursor.value(option));
            break;
          case "-outdir":
            outdir = Paths.get(cursor.value(option));
            break;
          case "-v":
            verbose = true;
            break;
          case "-vslow":
          case "-vfast":
          case "-vmax":
          case "-c1":
          case "-c2":
          case "-c3_i":
          case "-c4":
          case "-c5":
          case "-psi_eps":
          case "-psi_width":
          case "-rhofast":
          case "-tfast":
            overrides.put(option, cursor.doubleValue(option));
            break;
          default:
            throw new IllegalArgumentException("Unknown option " + option);
        }
      }
      if (dchb == null || expfac == null || type == null) {
        throw new IllegalArgumentException("The options -dchb, -expfac and -model are required.");
      }
    } catch (IllegalArgumentException e) {
      ToolArguments.printError(err, NAME, e.getMessage());
      return 1;
    }
    ToolArguments.configureLogging(verbose ? Level.INFO : Level.WARNING);

    SolarWindModel.Parameters parameters = SolarWindModel.Parameters.defaults(type);
    for (Map.Entry<String, Double> override : overrides.entrySet()) {
      setter(parameters, override.getKey()).accept(override.getValue());
    }
    try {
      Grid2D distance = GridFileCoder.read(dchb);
      Grid2D expansionFactor = GridFileCoder.read(expfac);
      SolarWindModel.Result result =
          SolarWindModel.compute(parameters, distance, expansionFactor);
      GridFileCoder.write(outputPath(outdir, SPEED, dchb), result.speed());
      GridFileCoder.write(outputPath(outdir, DENSITY, dchb), result.density());
      GridFileCoder.write(outputPath(outdir, TEMPERATURE, dchb), result.temperature());
      log.info("Wrote " + type + " solar wind to " + outdir);
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

  /** Returns the path of output {@code name}, in the format of the {@code dchb} input. */
  @VisibleForTesting
  static Path outputPath(Path outdir, String name, Path dchb) {
    return outdir.resolve(name + (GridFileCoder.isHdf5(dchb) ? ".h5" : ".grid"));
  }

  private static DoubleConsumer setter(SolarWindModel.Parameters p, String option) {
    switch (option) {
      case "-vslow":
        return p::setVslow;
      case "-vfast":
        return p::setVfast;
      case "-vmax":
        return p::setVmax;
      case "-c1":
        return p::setC1;
      case "-c2":
        return p::setC2;
      case "-c3_i":
        return p::setC3i;
      case "-c4":
        return p::setC4;
      case "-c5":
        return p::setC5;
      case "-psi_eps":
        return p::setPsiEps;
      case "-psi_width":
        return p::setPsiWidth;
      case "-rhofast":
        return p::setRhoFast;
      case "-tfast":
        return p::setTFast;
      default:
        throw new AssertionError(option);
    }
  }
}
