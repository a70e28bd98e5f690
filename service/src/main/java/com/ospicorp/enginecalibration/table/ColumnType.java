package com.ospicorp.enginecalibration.table;

import java.time.LocalDate;

public enum ColumnType {
  NUMERIC(Double.class),
  TEXT(String.class),
  BOOLEAN(Boolean.class),
  DATE(LocalDate.class);

  private final Class<?> javaType;

  ColumnType(Class<?> javaType) {
    this.javaType = javaType;
  }

  public Class<?> javaType() {
    return javaType;
  }

  /**
   * Converts a raw cell value into the canonical representation of this column type.
   * Numbers of any boxed type become {@link Double}; {@code null} stays {@code null}.
   */
  Object coerce(String column, Object value) {
    if (value == null) {
      return null;
    }
    if (this == NUMERIC && value instanceof Number number) {
      return number.doubleValue();
    }
    if (javaType.isInstance(value)) {
      return value;
    }
    throw new IllegalArgumentException("Column '" + column + "' is " + name()
        + " but received " + value.getClass().getSimpleName() + " value " + value);
  }
}
