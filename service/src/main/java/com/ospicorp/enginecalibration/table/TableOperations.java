package com.ospicorp.enginecalibration.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TableOperations {
  private TableOperations() {
  }

  /**
   * Collapses rows sharing the same key into one row per key, in first-seen key order.
   *
   * <p>Numeric columns take the mean of their finite values, or {@code null} when a group has
   * none. Every other column keeps the first non-null value of the group. Rows with a
   * {@code null} key are dropped. The returned table declares {@code keyColumn} as its key.
   */
  public static DataTable meanByKey(DataTable table, String keyColumn) {
    return meanByKey(table, keyColumn, List.of());
  }

  /**
   * Same as {@link #meanByKey(DataTable, String)}, but first drops every row that lacks a value
   * in one of {@code requiredColumns} (a finite number for numeric columns, non-null
   * otherwise). Averages of those columns then only combine values measured together.
   */
  public static DataTable meanByKey(DataTable table, String keyColumn,
      List<String> requiredColumns) {
    List<Column> columns = table.columns();
    int keyPosition = columns.indexOf(table.requireColumn(keyColumn));
    List<Integer> required = new ArrayList<>(requiredColumns.size());
    for (String name : requiredColumns) {
      required.add(columns.indexOf(table.requireColumn(name)));
    }

    Map<Object, List<List<Object>>> groups = new LinkedHashMap<>();
    for (List<Object> row : table.rows()) {
      Object key = row.get(keyPosition);
      if (key == null || !hasValues(row, columns, required)) {
        continue;
      }
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    }

    DataTable.Builder builder = DataTable.builder().columns(columns).keyColumn(keyColumn);
    for (List<List<Object>> group : groups.values()) {
      List<Object> merged = new ArrayList<>(columns.size());
      for (int c = 0; c < columns.size(); c++) {
        merged.add(columns.get(c).type() == ColumnType.NUMERIC
            ? mean(group, c)
            : firstNonNull(group, c));
      }
      builder.row(merged);
    }
    return builder.build();
  }

  private static boolean hasValues(List<Object> row, List<Column> columns,
      List<Integer> required) {
    for (int c : required) {
      Object value = row.get(c);
      if (value == null) {
        return false;
      }
      if (columns.get(c).type() == ColumnType.NUMERIC && !Double.isFinite((Double) value)) {
        return false;
      }
    }
    return true;
  }

  private static Double mean(List<List<Object>> group, int column) {
    double sum = 0d;
    int count = 0;
    for (List<Object> row : group) {
      Double value = (Double) row.get(column);
      if (value != null && Double.isFinite(value)) {
        sum += value;
        count++;
      }
    }
    return count == 0 ? null : sum / count;
  }

  private static Object firstNonNull(List<List<Object>> group, int column) {
    for (List<Object> row : group) {
      Object value = row.get(column);
      if (value != null) {
        return value;
      }
    }
    return null;
  }
}
