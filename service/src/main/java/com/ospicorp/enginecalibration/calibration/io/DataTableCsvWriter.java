package com.ospicorp.enginecalibration.calibration.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.enginecalibration.table.Column;
import com.ospicorp.enginecalibration.table.DataTable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link DataTable} as CSV with a header row. Null cells are written empty and
 * dates as ISO-8601 strings.
 */
public class DataTableCsvWriter {
  private final CsvMapper mapper = new CsvMapper();

  public DataTableCsvWriter() {
    mapper.findAndRegisterModules();
  }

  public String toCsv(DataTable table) {
    StringWriter out = new StringWriter();
    try {
      write(table, out);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to render table as CSV", ex);
    }
    return out.toString();
  }

  public void write(DataTable table, Path path) throws IOException {
    try (OutputStream out = Files.newOutputStream(path)) {
      write(table, new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }
  }

  public void write(DataTable table, Writer out) throws IOException {
    CsvSchema schema = buildSchema(table.columns());
    try (SequenceWriter rows = mapper.writer(schema).writeValues(out)) {
      for (List<Object> row : table.rows()) {
        rows.write(toRecord(table.columns(), row));
      }
    }
  }

  private CsvSchema buildSchema(List<Column> columns) {
    CsvSchema.Builder builder = CsvSchema.builder();
    columns.forEach(column -> builder.addColumn(column.name()));
    return builder.setUseHeader(true).build();
  }

  private Map<String, Object> toRecord(List<Column> columns, List<Object> row) {
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      Object value = row.get(i);
      record.put(columns.get(i).name(), value instanceof LocalDate date ? date.toString() : value);
    }
    return record;
  }
}
