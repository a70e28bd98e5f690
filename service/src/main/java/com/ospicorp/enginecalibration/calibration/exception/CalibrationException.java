package com.ospicorp.enginecalibration.calibration.exception;

/**
 * Base type for every failure raised by a fit, evaluate or apply call.
 * Each subclass carries a stable error code that reporting collaborators can key on.
 */
public abstract class CalibrationException extends RuntimeException {
  private final String errorCode;

  protected CalibrationException(String message, String errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  protected CalibrationException(String message, String errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public String errorCode() {
    return errorCode;
  }
}
