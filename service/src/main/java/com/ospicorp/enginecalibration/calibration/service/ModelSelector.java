package com.ospicorp.enginecalibration.calibration.service;

import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import com.ospicorp.enginecalibration.calibration.model.FitQuality;

public final class ModelSelector {

  public static final double DEFAULT_THRESHOLD = 0.01d;

  private ModelSelector() {
  }

  public static CalibrationModel select(CalibrationModel modelA, FitQuality qualityA,
      CalibrationModel modelB, FitQuality qualityB) {
    return select(modelA, qualityA, modelB, qualityB, DEFAULT_THRESHOLD);
  }

  public static CalibrationModel select(CalibrationModel modelA, FitQuality qualityA,
      CalibrationModel modelB, FitQuality qualityB, double threshold) {
    if (!Double.isFinite(threshold) || threshold < 0d) {
      throw new IllegalArgumentException(
          "threshold must be a finite, non-negative number but was " + threshold);
    }
    if (modelA.degree() == modelB.degree()) {
      return qualityB.rSquared() > qualityA.rSquared() ? modelB : modelA;
    }
    boolean aIsComplex = modelA.degree() > modelB.degree();
    CalibrationModel complex = aIsComplex ? modelA : modelB;
    CalibrationModel simple = aIsComplex ? modelB : modelA;
    double improvement = aIsComplex
        ? qualityA.rSquared() - qualityB.rSquared()
        : qualityB.rSquared() - qualityA.rSquared();
    return improvement >= threshold ? complex : simple;
  }
}
