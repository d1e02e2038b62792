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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.io.PrintStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A cursor over single-dash command line arguments of the form {@code -name [value]}, shared by
 * the command line tools of this package. Malformed input is reported with {@link
 * IllegalArgumentException}.
 */
final class ToolArguments {
  /** The logger all loggers of this package inherit their level from. */
  private static final Logger PACKAGE_LOG = Logger.getLogger("com.google.solarwind.geometry");

  private final ImmutableList<String> args;
  private int position = 0;

  ToolArguments(String[] args) {
    this.args = ImmutableList.copyOf(args);
  }

  /** Returns true if there are arguments left. */
  boolean hasNext() {
    return position < args.size();
  }

  /** Returns the next option name, including its dash. */
  String nextOption() {
    String option = args.get(position++);
    if (!option.startsWith("-") || option.length() < 2) {
      throw new IllegalArgumentException("Unexpected argument '" + option + "'");
    }
    return option;
  }

  /** Returns the value following {@code option}. */
  String value(String option) {
    if (position >= args.size()) {
      throw new IllegalArgumentException("The option " + option + " requires a value");
    }
    return args.get(position++);
  }

  /** Returns the value following {@code option} as a double. */
  double doubleValue(String option) {
    String value = value(option);
    Double parsed = Doubles.tryParse(value);
    if (parsed == null) {
      throw new IllegalArgumentException(
          "The option " + option + " requires a number, got '" + value + "'");
    }
    return parsed;
  }

  /**
   * Sets the level of this package's loggers and makes sure records at that level reach the
   * console.
   */
  static void configureLogging(Level level) {
    PACKAGE_LOG.setLevel(level);
    if (level.intValue() < Level.INFO.intValue()) {
      ConsoleHandler handler = new ConsoleHandler();
      handler.setLevel(level);
      for (Handler existing : PACKAGE_LOG.getHandlers()) {
        PACKAGE_LOG.removeHandler(existing);
      }
      PACKAGE_LOG.addHandler(handler);
      PACKAGE_LOG.setUseParentHandlers(false);
    }
  }

  /** Prints a fatal error the way all tools of this package do. */
  static void printError(PrintStream err, String tool, String message) {
    err.println();
    err.println("### ERROR in " + tool);
    err.println("### " + message);
  }
}
