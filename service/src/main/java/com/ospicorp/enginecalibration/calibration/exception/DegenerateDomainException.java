package com.ospicorp.enginecalibration.calibration.exception;

public class DegenerateDomainException extends CalibrationException {
  private final double value;

  public DegenerateDomainException(String column, double value) {
    super("All valid values of '" + column + "' equal " + value
        + "; the fit domain collapses to a single point", "degenerate-domain");
    this.value = value;
  }

  public double value() {
    return value;
  }
}
