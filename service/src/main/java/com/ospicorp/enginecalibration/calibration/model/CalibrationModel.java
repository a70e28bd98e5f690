package com.ospicorp.enginecalibration.calibration.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable polynomial fitted over a bounded domain.
 *
 * <p>Coefficients are ordered lowest degree first and apply to the normalized coordinate
 * {@code t = offset + scale * x}, which maps {@code [domainMin, domainMax]} onto
 * {@code [windowMin, windowMax]}. Evaluation outside the domain is well defined; whether such
 * a value should be trusted is the caller's decision (see {@link #isWithinDomain(double)}).
 */
@JsonPropertyOrder({"degree", "coefficients", "domain_min", "domain_max", "window_min",
    "window_max"})
public record CalibrationModel(
    @JsonProperty("degree") int degree,
    @JsonProperty("coefficients") List<Double> coefficients,
    @JsonProperty("domain_min") double domainMin,
    @JsonProperty("domain_max") double domainMax,
    @JsonProperty("window_min") double windowMin,
    @JsonProperty("window_max") double windowMax) {

  public static final double WINDOW_MIN = -1d;
  public static final double WINDOW_MAX = 1d;

  public CalibrationModel {
    if (degree < 1 || degree > 2) {
      throw new IllegalArgumentException("degree must be 1 or 2 but was " + degree);
    }
    Objects.requireNonNull(coefficients, "coefficients");
    if (coefficients.size() != degree + 1) {
      throw new IllegalArgumentException("a degree " + degree + " model needs "
          + (degree + 1) + " coefficients but received " + coefficients.size());
    }
    for (Double c : coefficients) {
      if (c == null || !Double.isFinite(c)) {
        throw new IllegalArgumentException("coefficients must be finite: " + coefficients);
      }
    }
    requireOrderedBounds("domain", domainMin, domainMax);
    requireOrderedBounds("window", windowMin, windowMax);
    coefficients = List.copyOf(coefficients);
  }

  /**
   * Model over {@code [domainMin, domainMax]} using the standard {@code [-1, 1]} window.
   */
  public static CalibrationModel of(int degree, List<Double> coefficients, double domainMin,
      double domainMax) {
    return new CalibrationModel(degree, coefficients, domainMin, domainMax, WINDOW_MIN,
        WINDOW_MAX);
  }

  public double scale() {
    return (windowMax - windowMin) / (domainMax - domainMin);
  }

  public double offset() {
    return (domainMax * windowMin - domainMin * windowMax) / (domainMax - domainMin);
  }

  /** Maps a raw value into the window coordinate. */
  public double toWindow(double x) {
    return offset() + scale() * x;
  }

  public double evaluate(double x) {
    double t = toWindow(x);
    double result = 0d;
    for (int k = coefficients.size() - 1; k >= 0; k--) {
      result = result * t + coefficients.get(k);
    }
    return result;
  }

  /** Domain bounds are inclusive. */
  public boolean isWithinDomain(double x) {
    return x >= domainMin && x <= domainMax;
  }

  /**
   * Coefficients of the same polynomial expressed directly in the raw coordinate, lowest
   * degree first, so that {@code evaluate(x) == sum(c[k] * x^k)} up to rounding.
   */
  public List<Double> powerBasisCoefficients() {
    double offset = offset();
    double scale = scale();
    double[] result = new double[coefficients.size()];
    // (offset + scale * x)^k, expanded incrementally
    double[] power = new double[coefficients.size()];
    power[0] = 1d;
    for (int k = 0; k < coefficients.size(); k++) {
      if (k > 0) {
        for (int j = k; j >= 0; j--) {
          double shifted = j > 0 ? power[j - 1] * scale : 0d;
          power[j] = power[j] * offset + shifted;
        }
      }
      for (int j = 0; j <= k; j++) {
        result[j] += coefficients.get(k) * power[j];
      }
    }
    return Arrays.stream(result).boxed().toList();
  }

  private static void requireOrderedBounds(String name, double min, double max) {
    if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
      throw new IllegalArgumentException(
          name + " bounds must be finite with min < max but were [" + min + ", " + max + "]");
    }
  }
}
