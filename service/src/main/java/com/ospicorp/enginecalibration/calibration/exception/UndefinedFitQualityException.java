package com.ospicorp.enginecalibration.calibration.exception;

public class UndefinedFitQualityException extends CalibrationException {
  private final int sampleCount;

  public UndefinedFitQualityException(String column, int sampleCount) {
    super("R-squared is undefined: '" + column + "' has zero variance over "
        + sampleCount + " valid rows", "undefined-fit-quality");
    this.sampleCount = sampleCount;
  }

  public int sampleCount() {
    return sampleCount;
  }
}
