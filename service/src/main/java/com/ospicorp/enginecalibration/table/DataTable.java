package com.ospicorp.enginecalibration.table;

import com.ospicorp.enginecalibration.calibration.exception.ColumnNotFoundException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered set of rows sharing a schema of named, typed columns.
 *
 * <p>Tables are assembled append-only through {@link Builder}. Once built, cells are never
 * edited; {@link #withAppendedColumns(List, List)} returns a new table that shares the
 * existing rows and adds columns to the right. Every cell may be {@code null}.
 */
public final class DataTable {

  private final List<Column> columns;
  private final Map<String, Integer> positions;
  private final List<List<Object>> rows;
  private final String keyColumn;

  private DataTable(List<Column> columns, List<List<Object>> rows, String keyColumn) {
    this.columns = List.copyOf(columns);
    this.positions = indexColumns(this.columns);
    this.rows = Collections.unmodifiableList(rows);
    this.keyColumn = keyColumn;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Column> columns() {
    return columns;
  }

  public List<String> columnNames() {
    return columns.stream().map(Column::name).toList();
  }

  public Optional<Column> findColumn(String name) {
    Integer position = positions.get(name);
    return position == null ? Optional.empty() : Optional.of(columns.get(position));
  }

  public boolean hasColumn(String name) {
    return positions.containsKey(name);
  }

  public Column requireColumn(String name) {
    return findColumn(name).orElseThrow(() -> new ColumnNotFoundException(name, columnNames()));
  }

  /**
   * Resolves a column that must hold numeric values.
   *
   * @throws ColumnNotFoundException if the column is absent or not {@link ColumnType#NUMERIC}
   */
  public Column requireNumericColumn(String name) {
    Column column = requireColumn(name);
    if (column.type() != ColumnType.NUMERIC) {
      throw new ColumnNotFoundException(
          "Column '" + name + "' is " + column.type() + ", expected NUMERIC",
          name, columnNames());
    }
    return column;
  }

  public Optional<String> keyColumn() {
    return Optional.ofNullable(keyColumn);
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public List<Object> row(int index) {
    return rows.get(index);
  }

  public List<List<Object>> rows() {
    return rows;
  }

  public Object value(int row, String column) {
    return rows.get(row).get(position(column));
  }

  public Double numeric(int row, String column) {
    return (Double) value(row, requireNumericColumn(column).name());
  }

  public String text(int row, String column) {
    return (String) value(row, column);
  }

  public Boolean bool(int row, String column) {
    return (Boolean) value(row, column);
  }

  public LocalDate date(int row, String column) {
    return (LocalDate) value(row, column);
  }

  /**
   * Returns a copy of this table with {@code added} columns appended to the right.
   *
   * @param added new columns; names must not clash with existing ones
   * @param values one list per row, in row order, each holding one cell per added column
   */
  public DataTable withAppendedColumns(List<Column> added, List<List<Object>> values) {
    if (values.size() != rows.size()) {
      throw new IllegalArgumentException("Expected " + rows.size()
          + " rows of appended values but received " + values.size());
    }
    Set<String> seen = new HashSet<>(positions.keySet());
    for (Column column : added) {
      if (!seen.add(column.name())) {
        throw new IllegalArgumentException("Column '" + column.name() + "' already exists");
      }
    }
    List<Column> merged = new ArrayList<>(columns);
    merged.addAll(added);
    List<List<Object>> mergedRows = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      List<Object> extra = values.get(i);
      if (extra.size() != added.size()) {
        throw new IllegalArgumentException("Row " + i + " has " + extra.size()
            + " appended cells, expected " + added.size());
      }
      List<Object> row = new ArrayList<>(rows.get(i));
      for (int c = 0; c < added.size(); c++) {
        Column column = added.get(c);
        row.add(column.type().coerce(column.name(), extra.get(c)));
      }
      mergedRows.add(Collections.unmodifiableList(row));
    }
    return new DataTable(merged, mergedRows, keyColumn);
  }

  private int position(String column) {
    Integer position = positions.get(column);
    if (position == null) {
      throw new ColumnNotFoundException(column, columnNames());
    }
    return position;
  }

  private static Map<String, Integer> indexColumns(List<Column> columns) {
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      if (index.put(columns.get(i).name(), i) != null) {
        throw new IllegalArgumentException("Duplicate column name: " + columns.get(i).name());
      }
    }
    return Collections.unmodifiableMap(index);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataTable other)) {
      return false;
    }
    return columns.equals(other.columns)
        && rows.equals(other.rows)
        && Objects.equals(keyColumn, other.keyColumn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, rows, keyColumn);
  }

  @Override
  public String toString() {
    return "DataTable{columns=" + columnNames() + ", rows=" + rows.size() + "}";
  }

  public static final class Builder {
    private final List<Column> columns = new ArrayList<>();
    private final List<List<Object>> rows = new ArrayList<>();
    private final Set<Object> keys = new HashSet<>();
    private String keyColumn;
    private int keyPosition = -1;

    private Builder() {
    }

    public Builder column(String name, ColumnType type) {
      return column(new Column(name, type));
    }

    public Builder column(Column column) {
      if (!rows.isEmpty()) {
        throw new IllegalStateException("Columns must be declared before rows are added");
      }
      for (Column existing : columns) {
        if (existing.name().equals(column.name())) {
          throw new IllegalArgumentException("Duplicate column name: " + column.name());
        }
      }
      columns.add(column);
      return this;
    }

    public Builder columns(List<Column> columns) {
      columns.forEach(this::column);
      return this;
    }

    /**
     * Declares a previously added column as the row key; non-null keys must then be unique.
     */
    public Builder keyColumn(String name) {
      if (!rows.isEmpty()) {
        throw new IllegalStateException("Key column must be declared before rows are added");
      }
      for (int i = 0; i < columns.size(); i++) {
        if (columns.get(i).name().equals(name)) {
          keyColumn = name;
          keyPosition = i;
          return this;
        }
      }
      throw new ColumnNotFoundException(name, columns.stream().map(Column::name).toList());
    }

    public Builder row(Object... values) {
      return row(Arrays.asList(values));
    }

    public Builder row(List<?> values) {
      if (values.size() != columns.size()) {
        throw new IllegalArgumentException("Row has " + values.size()
            + " cells but the schema declares " + columns.size() + " columns");
      }
      List<Object> row = new ArrayList<>(values.size());
      for (int i = 0; i < values.size(); i++) {
        Column column = columns.get(i);
        row.add(column.type().coerce(column.name(), values.get(i)));
      }
      if (keyPosition >= 0) {
        Object key = row.get(keyPosition);
        if (key != null && !keys.add(key)) {
          throw new IllegalArgumentException(
              "Duplicate key '" + key + "' in column '" + keyColumn + "'");
        }
      }
      rows.add(Collections.unmodifiableList(row));
      return this;
    }

    public DataTable build() {
      return new DataTable(columns, new ArrayList<>(rows), keyColumn);
    }
  }
}
