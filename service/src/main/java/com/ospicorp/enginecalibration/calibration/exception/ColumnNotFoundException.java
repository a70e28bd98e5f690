package com.ospicorp.enginecalibration.calibration.exception;

import java.util.List;

public class ColumnNotFoundException extends CalibrationException {
  private final String column;
  private final List<String> availableColumns;

  public ColumnNotFoundException(String column, List<String> availableColumns) {
    this("Column not found: '" + column + "' (available: " + availableColumns + ")",
        column, availableColumns);
  }

  public ColumnNotFoundException(String message, String column, List<String> availableColumns) {
    super(message, "column-not-found");
    this.column = column;
    this.availableColumns = List.copyOf(availableColumns);
  }

  public String column() {
    return column;
  }

  public List<String> availableColumns() {
    return availableColumns;
  }
}
