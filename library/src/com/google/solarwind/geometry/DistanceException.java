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

/**
 * An unchecked exception wrapping a {@link DistanceError}. It is thrown for invalid input
 * configurations (a single coordinate map, mismatched map shapes, query points off the source grid)
 * and for degenerate classifications where a distance would be mathematically undefined.
 */
public class DistanceException extends RuntimeException {

  private final DistanceError error;

  /** Creates a new DistanceException wrapping the given DistanceError. */
  public DistanceException(DistanceError error) {
    this.error = error;
  }

  /** Creates a new DistanceException with the given code and formatted text. */
  public DistanceException(DistanceError.Code code, String format, Object... args) {
    this(new DistanceError(code, format, args));
  }

  /** Returns the code of the DistanceError wrapped by this DistanceException. */
  public DistanceError.Code code() {
    return error.code();
  }

  /** Returns the wrapped error. */
  public DistanceError error() {
    return error;
  }

  @Override
  public String getMessage() {
    return error.text();
  }
}
