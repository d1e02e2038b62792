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

import static java.lang.Math.exp;
import static java.lang.Math.pow;
import static java.lang.Math.tanh;

import com.google.common.base.Ascii;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.solarwind.geometry.DistanceError.Code;

/**
 * Empirical solar wind models driven by the distance to the nearest coronal hole boundary (DCHB, in
 * radians) and the magnetic expansion factor. Each model gives a wind speed in km/s; density and
 * temperature then follow from pressure balance with the fastest wind on the grid.
 */
public final class SolarWindModel {

  /** Degrees per radian, as used by the WSA fits. */
  static final double RAD_TO_DEG = 57.2957795130823;

  /** The supported speed models. */
  public enum Type {
    /** Wang-Sheeley-Arge with a speed cap. */
    WSA,
    /** Wang-Sheeley-Arge with an extra power on the DCHB term and no cap. */
    WSA2,
    /** A tanh profile in DCHB alone. */
    PSI;

    /** Returns the model named by {@code name}, ignoring case. */
    public static Type parse(String name) {
      for (Type type : values()) {
        if (type.name().equals(Ascii.toUpperCase(name))) {
          return type;
        }
      }
      throw new IllegalArgumentException("Valid model options: wsa, wsa2, psi; got " + name);
    }
  }

  /**
   * Model coefficients. {@link #defaults(Type)} gives the published defaults of each model; speeds
   * are in km/s, density in cm^-3, temperature in K.
   */
  public static final class Parameters {
    private final Type type;
    private double vslow;
    private double vfast;
    private double vmax = Double.POSITIVE_INFINITY;
    private double c1;
    private double c2;
    private double c3i;
    private double c4;
    private double c5 = 1;
    private double psiEps;
    private double psiWidth;
    private double rhoFast = 152.0;
    private double tFast = 1.85e6;

    private Parameters(Type type) {
      this.type = type;
    }

    /** Returns the default coefficients of the given model. */
    public static Parameters defaults(Type type) {
      Parameters p = new Parameters(type);
      switch (type) {
        case WSA:
          p.vslow = 250.0;
          p.vfast = 680.0;
          p.vmax = 800.0;
          p.c1 = 1.0 / 3.0;
          p.c2 = 0.8;
          p.c3i = 0.25;
          p.c4 = 4.0;
          break;
        case WSA2:
          p.vslow = 285.0;
          p.vfast = 625.0;
          p.c1 = 2.0 / 9.0;
          p.c2 = 0.8;
          // Tuned for 1-degree maps.
          p.c3i = 1.0;
          p.c4 = 2.0;
          p.c5 = 3.0;
          break;
        case PSI:
          p.vslow = 250.0;
          p.vfast = 650.0;
          p.psiEps = 0.05;
          p.psiWidth = 0.025;
          break;
      }
      return p;
    }

    public Type type() {
      return type;
    }

    public double vslow() {
      return vslow;
    }

    /** Slow wind speed. */
    @CanIgnoreReturnValue
    public Parameters setVslow(double vslow) {
      this.vslow = vslow;
      return this;
    }

    public double vfast() {
      return vfast;
    }

    /** Fast wind speed. */
    @CanIgnoreReturnValue
    public Parameters setVfast(double vfast) {
      this.vfast = vfast;
      return this;
    }

    public double vmax() {
      return vmax;
    }

    /** Speed cap, used by {@link Type#WSA} only. */
    @CanIgnoreReturnValue
    public Parameters setVmax(double vmax) {
      this.vmax = vmax;
      return this;
    }

    public double c1() {
      return c1;
    }

    /** Expansion factor power. */
    @CanIgnoreReturnValue
    public Parameters setC1(double c1) {
      this.c1 = c1;
      return this;
    }

    public double c2() {
      return c2;
    }

    /** DCHB multiplier. */
    @CanIgnoreReturnValue
    public Parameters setC2(double c2) {
      this.c2 = c2;
      return this;
    }

    public double c3i() {
      return c3i;
    }

    /** DCHB factor per degree, the inverse of the C3 width of some interfaces. */
    @CanIgnoreReturnValue
    public Parameters setC3i(double c3i) {
      this.c3i = c3i;
      return this;
    }

    public double c4() {
      return c4;
    }

    /** DCHB power. */
    @CanIgnoreReturnValue
    public Parameters setC4(double c4) {
      this.c4 = c4;
      return this;
    }

    public double c5() {
      return c5;
    }

    /** Overall power of the DCHB term, used by {@link Type#WSA2} only. */
    @CanIgnoreReturnValue
    public Parameters setC5(double c5) {
      this.c5 = c5;
      return this;
    }

    public double psiEps() {
      return psiEps;
    }

    /** DCHB offset of the {@link Type#PSI} profile, in radians. */
    @CanIgnoreReturnValue
    public Parameters setPsiEps(double psiEps) {
      this.psiEps = psiEps;
      return this;
    }

    public double psiWidth() {
      return psiWidth;
    }

    /** DCHB width of the {@link Type#PSI} profile, in radians. */
    @CanIgnoreReturnValue
    public Parameters setPsiWidth(double psiWidth) {
      this.psiWidth = psiWidth;
      return this;
    }

    public double rhoFast() {
      return rhoFast;
    }

    /** Fast wind density. */
    @CanIgnoreReturnValue
    public Parameters setRhoFast(double rhoFast) {
      this.rhoFast = rhoFast;
      return this;
    }

    public double tFast() {
      return tFast;
    }

    /** Fast wind temperature. */
    @CanIgnoreReturnValue
    public Parameters setTFast(double tFast) {
      this.tFast = tFast;
      return this;
    }
  }

  /** Speed, density and temperature grids on the scales of the input DCHB grid. */
  public static final class Result {
    private final Grid2D speed;
    private final Grid2D density;
    private final Grid2D temperature;

    private Result(Grid2D speed, Grid2D density, Grid2D temperature) {
      this.speed = speed;
      this.density = density;
      this.temperature = temperature;
    }

    public Grid2D speed() {
      return speed;
    }

    public Grid2D density() {
      return density;
    }

    public Grid2D temperature() {
      return temperature;
    }
  }

  private SolarWindModel() {}

  /** Returns the wind speed for one DCHB value (radians) and expansion factor. */
  public static double speed(Parameters p, double distance, double expansionFactor) {
    switch (p.type) {
      case WSA:
        {
          double v = p.vslow + p.vfast / pow(1.0 + expansionFactor, p.c1) * dchbFactor(p, distance);
          return Math.min(v, p.vmax);
        }
      case WSA2:
        return p.vslow
            + p.vfast / pow(1.0 + expansionFactor, p.c1) * pow(dchbFactor(p, distance), p.c5);
      case PSI:
        {
          double profile = 0.5 * (1.0 + tanh((distance - p.psiEps) / p.psiWidth));
          return p.vslow + (p.vfast - p.vslow) * profile;
        }
    }
    throw new AssertionError(p.type);
  }

  private static double dchbFactor(Parameters p, double distance) {
    double arg = p.c3i * (distance * RAD_TO_DEG);
    return 1.0 - p.c2 * exp(-pow(arg, p.c4));
  }

  /**
   * Evaluates the model over a DCHB grid and an expansion factor grid of the same shape.
   *
   * @throws DistanceException with {@link Code#SHAPE_MISMATCH} if the grids differ in shape
   */
  public static Result compute(Parameters p, Grid2D distance, Grid2D expansionFactor) {
    if (distance.size1() != expansionFactor.size1()
        || distance.size2() != expansionFactor.size2()) {
      throw new DistanceException(
          Code.SHAPE_MISMATCH,
          "The DCHB and expansion factor files do not have the same dimensions: %s vs %s",
          distance.dimensions(),
          expansionFactor.dimensions());
    }
    int n2 = distance.size2();
    int n1 = distance.size1();
    double[][] v = new double[n2][n1];
    double vmax = Double.NEGATIVE_INFINITY;
    for (int k = 0; k < n2; k++) {
      for (int l = 0; l < n1; l++) {
        v[k][l] = speed(p, distance.get(k, l), expansionFactor.get(k, l));
        vmax = Math.max(vmax, v[k][l]);
      }
    }
    double[][] rho = new double[n2][n1];
    double[][] temp = new double[n2][n1];
    for (int k = 0; k < n2; k++) {
      for (int l = 0; l < n1; l++) {
        double ratio = vmax / v[k][l];
        rho[k][l] = p.rhoFast * ratio * ratio;
        temp[k][l] = p.tFast * p.rhoFast / rho[k][l];
      }
    }
    double[] scale1 = distance.scale1();
    double[] scale2 = distance.scale2();
    return new Result(
        new Grid2D(scale1, scale2, v),
        new Grid2D(scale1, scale2, rho),
        new Grid2D(scale1, scale2, temp));
  }
}
