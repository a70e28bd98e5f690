package com.ospicorp.enginecalibration.calibration.service;

import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import com.ospicorp.enginecalibration.table.ColumnType;
import com.ospicorp.enginecalibration.table.DataTable;

/** Evenly spaced points along a model curve, for plotting collaborators. */
public final class CurveSampler {

  public static final String X_COLUMN = "x";
  public static final String Y_COLUMN = "y";

  private CurveSampler() {
  }

  public static DataTable sample(CalibrationModel model, double from, double to, int points) {
    if (points < 2) {
      throw new IllegalArgumentException("at least 2 points are needed but got " + points);
    }
    if (!Double.isFinite(from) || !Double.isFinite(to) || from >= to) {
      throw new IllegalArgumentException(
          "sampling range must be finite with from < to but was [" + from + ", " + to + "]");
    }
    DataTable.Builder builder = DataTable.builder()
        .column(X_COLUMN, ColumnType.NUMERIC)
        .column(Y_COLUMN, ColumnType.NUMERIC);
    double step = (to - from) / (points - 1);
    for (int i = 0; i < points; i++) {
      double x = i == points - 1 ? to : from + i * step;
      builder.row(x, model.evaluate(x));
    }
    return builder.build();
  }

  /** Samples the fit domain widened by {@code margin} on both sides. */
  public static DataTable sampleAroundDomain(CalibrationModel model, double margin, int points) {
    if (!Double.isFinite(margin) || margin < 0d) {
      throw new IllegalArgumentException("margin must be finite and non-negative: " + margin);
    }
    return sample(model, model.domainMin() - margin, model.domainMax() + margin, points);
  }
}
