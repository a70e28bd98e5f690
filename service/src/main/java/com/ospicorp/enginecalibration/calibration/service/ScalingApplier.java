package com.ospicorp.enginecalibration.calibration.service;

import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import com.ospicorp.enginecalibration.table.Column;
import com.ospicorp.enginecalibration.table.DataTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scores every row of a table with a fitted model.
 *
 * <p>Two columns are appended: the predicted value and a flag telling whether the row's x lay
 * outside the domain the model was fitted on. Rows without a finite x get {@code null} in
 * both. The input table is left untouched.
 */
public final class ScalingApplier {

  public static final String DEFAULT_PREDICTED_COLUMN = "predicted";
  public static final String DEFAULT_EXTRAPOLATED_COLUMN = "extrapolated";

  private ScalingApplier() {
  }

  public static DataTable apply(CalibrationModel model, DataTable table, String xColumn) {
    return apply(model, table, xColumn, DEFAULT_PREDICTED_COLUMN, DEFAULT_EXTRAPOLATED_COLUMN);
  }

  public static DataTable apply(CalibrationModel model, DataTable table, String xColumn,
      String predictedColumn, String extrapolatedColumn) {
    table.requireNumericColumn(xColumn);
    if (predictedColumn.equals(extrapolatedColumn)) {
      throw new IllegalArgumentException(
          "predicted and extrapolated columns must differ: " + predictedColumn);
    }

    List<List<Object>> appended = new ArrayList<>(table.rowCount());
    for (int i = 0; i < table.rowCount(); i++) {
      Double x = table.numeric(i, xColumn);
      if (!FinitePairs.isFinite(x)) {
        appended.add(Arrays.asList(null, null));
        continue;
      }
      appended.add(List.of(model.evaluate(x), !model.isWithinDomain(x)));
    }
    return table.withAppendedColumns(
        List.of(Column.numeric(predictedColumn), Column.bool(extrapolatedColumn)), appended);
  }

  public static int countExtrapolated(DataTable scored, String extrapolatedColumn) {
    int count = 0;
    for (int i = 0; i < scored.rowCount(); i++) {
      if (Boolean.TRUE.equals(scored.bool(i, extrapolatedColumn))) {
        count++;
      }
    }
    return count;
  }
}
