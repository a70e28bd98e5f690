package com.ospicorp.enginecalibration.calibration.service;

import com.ospicorp.enginecalibration.calibration.exception.UndefinedFitQualityException;
import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import com.ospicorp.enginecalibration.calibration.model.FitQuality;
import com.ospicorp.enginecalibration.table.DataTable;

public final class FitEvaluator {
  private FitEvaluator() {
  }

  /**
   * Coefficient of determination of {@code model} over the finite (x, y) rows of
   * {@code table}: {@code 1 - RSS / TSS}. The table need not be the one the model was fitted
   * on, which allows scoring against held-out engines.
   *
   * @throws UndefinedFitQualityException if y has zero variance over the valid rows
   */
  public static FitQuality evaluate(CalibrationModel model, DataTable table, String xColumn,
      String yColumn) {
    FinitePairs pairs = FinitePairs.extract(table, xColumn, yColumn);
    double[] x = pairs.x();
    double[] y = pairs.y();
    int n = pairs.size();
    if (isConstant(y)) {
      throw new UndefinedFitQualityException(yColumn, n);
    }

    double mean = 0d;
    for (double v : y) {
      mean += v;
    }
    mean /= n;

    double tss = 0d;
    double rss = 0d;
    for (int i = 0; i < n; i++) {
      double deviation = y[i] - mean;
      double residual = y[i] - model.evaluate(x[i]);
      tss += deviation * deviation;
      rss += residual * residual;
    }
    if (!(tss > 0d)) {
      throw new UndefinedFitQualityException(yColumn, n);
    }
    return new FitQuality(1d - rss / tss, n);
  }

  // compared on the values: a rounded mean leaves TSS slightly above zero for constant y
  private static boolean isConstant(double[] y) {
    for (int i = 1; i < y.length; i++) {
      if (y[i] != y[0]) {
        return false;
      }
    }
    return true;
  }
}
