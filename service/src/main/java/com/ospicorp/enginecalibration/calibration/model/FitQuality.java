package com.ospicorp.enginecalibration.calibration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Goodness of fit of one model against one data set.
 *
 * @param rSquared coefficient of determination, at most 1
 * @param sampleCount number of valid rows the value was computed over
 */
public record FitQuality(
    @JsonProperty("r_squared") double rSquared,
    @JsonProperty("sample_count") int sampleCount) {

  public FitQuality {
    if (Double.isNaN(rSquared) || rSquared > 1d + 1e-12) {
      throw new IllegalArgumentException("r_squared must be a number <= 1 but was " + rSquared);
    }
    if (sampleCount < 1) {
      throw new IllegalArgumentException("sample_count must be positive but was " + sampleCount);
    }
  }
}
