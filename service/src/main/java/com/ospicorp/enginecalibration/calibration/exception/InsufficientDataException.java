package com.ospicorp.enginecalibration.calibration.exception;

public class InsufficientDataException extends CalibrationException {
  private final int required;
  private final int actual;

  public InsufficientDataException(String message, int required, int actual) {
    super(message, "insufficient-data");
    this.required = required;
    this.actual = actual;
  }

  public int required() {
    return required;
  }

  public int actual() {
    return actual;
  }
}
