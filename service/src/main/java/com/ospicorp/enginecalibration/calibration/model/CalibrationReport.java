package com.ospicorp.enginecalibration.calibration.model;

/** Both candidate fits of a calibration run and the one selected. */
public record CalibrationReport(
    String xColumn,
    String yColumn,
    int rowCount,
    CalibrationModel linear,
    FitQuality linearQuality,
    CalibrationModel quadratic,
    FitQuality quadraticQuality,
    CalibrationModel selected,
    double threshold) {

  public FitQuality selectedQuality() {
    return selected.equals(quadratic) ? quadraticQuality : linearQuality;
  }

  public boolean quadraticSelected() {
    return selected.equals(quadratic);
  }
}
