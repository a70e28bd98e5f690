package com.ospicorp.enginecalibration.calibration.service;

import com.ospicorp.enginecalibration.table.DataTable;
import java.util.Arrays;

// rows with both cells present and finite, in table order
record FinitePairs(double[] x, double[] y) {

  static FinitePairs extract(DataTable table, String xColumn, String yColumn) {
    table.requireNumericColumn(xColumn);
    table.requireNumericColumn(yColumn);
    int rows = table.rowCount();
    double[] xs = new double[rows];
    double[] ys = new double[rows];
    int n = 0;
    for (int i = 0; i < rows; i++) {
      Double x = table.numeric(i, xColumn);
      Double y = table.numeric(i, yColumn);
      if (isFinite(x) && isFinite(y)) {
        xs[n] = x;
        ys[n] = y;
        n++;
      }
    }
    return new FinitePairs(Arrays.copyOf(xs, n), Arrays.copyOf(ys, n));
  }

  static boolean isFinite(Double value) {
    return value != null && Double.isFinite(value);
  }

  int size() {
    return x.length;
  }
}
