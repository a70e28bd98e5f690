package com.ospicorp.enginecalibration.calibration.exception;

public class ModelSerializationException extends CalibrationException {

  public ModelSerializationException(String message) {
    super(message, "invalid-model-record");
  }

  public ModelSerializationException(String message, Throwable cause) {
    super(message, "invalid-model-record", cause);
  }
}
