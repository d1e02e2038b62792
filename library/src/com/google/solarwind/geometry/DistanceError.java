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

import com.google.common.base.Strings;

/**
 * An error code and text string describing why a distance computation cannot proceed. All of these
 * are structural properties of the input, so none of them is worth retrying.
 */
public class DistanceError {
  /** Numeric values for distance errors. */
  public enum Code {
    ////////////////////////////////////////////////////////////////////
    // Generic errors:

    /** Argument is out of range. */
    OUT_OF_RANGE(1002),

    ////////////////////////////////////////////////////////////////////
    // Target mesh errors:

    /** Only one of the two coordinate maps defining an external target mesh was supplied. */
    MISSING_COORDINATE_MAP(100),
    /** The colatitude and azimuth maps of an external target mesh have different dimensions. */
    SHAPE_MISMATCH(101),

    ////////////////////////////////////////////////////////////////////
    // Solver errors:

    /**
     * There is no boundary point of the class needed to measure a target point's distance, e.g. the
     * source field has a single class everywhere.
     */
    DEGENERATE_CLASSIFICATION(200);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this error code. */
    public int code() {
      return code;
    }
  }

  private final Code code;
  private final String text;

  /**
   * Creates an error with the given code and text description; the description is formatted
   * according to the rules defined in {@link Strings#lenientFormat(String, Object...)}, except that
   * '%d' positional arguments are also handled.
   */
  public DistanceError(Code code, String format, Object... args) {
    this.code = code;
    this.text = Strings.lenientFormat(format.replace("%d", "%s"), args);
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  @Override
  public String toString() {
    return code + ": " + text;
  }
}
