package com.ospicorp.enginecalibration.table;

import java.util.Objects;

public record Column(String name, ColumnType type) {

  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) {
      throw new IllegalArgumentException("column name must not be blank");
    }
  }

  public static Column numeric(String name) {
    return new Column(name, ColumnType.NUMERIC);
  }

  public static Column text(String name) {
    return new Column(name, ColumnType.TEXT);
  }

  public static Column bool(String name) {
    return new Column(name, ColumnType.BOOLEAN);
  }

  public static Column date(String name) {
    return new Column(name, ColumnType.DATE);
  }
}
