package com.ospicorp.enginecalibration.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.enginecalibration.table.DataTable;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class EngineTablesTest {

  private final List<EngineRecord> records = List.of(
      new EngineRecord("D-30KU", 13.88, 19.83, LocalDate.of(1982, 1, 1), "large"),
      EngineRecord.of("D-100", 8.10, 15.30),
      EngineRecord.of("PW1127G", 7.95, null));

  @Test
  void toTableUsesStandardColumnsInRecordOrder() {
    DataTable table = EngineTables.toTable(records);

    assertEquals(EngineTables.SCHEMA, table.columns());
    assertEquals(3, table.rowCount());
    assertEquals("D-30KU", table.text(0, EngineTables.ENGINE_ID));
    assertEquals(13.88, table.numeric(0, EngineTables.TSFC_TAKEOFF));
    assertEquals(LocalDate.of(1982, 1, 1), table.date(0, EngineTables.CERTIFICATION_DATE));
    assertNull(table.numeric(2, EngineTables.TSFC_CRUISE));
  }

  @Test
  void withoutCruiseMeasurementKeepsOnlyEnginesToScale() {
    DataTable table = EngineTables.withoutCruiseMeasurement(records);

    assertEquals(1, table.rowCount());
    assertEquals("PW1127G", table.text(0, EngineTables.ENGINE_ID));
  }

  @Test
  void recordRejectsNonPositiveTsfc() {
    assertThrows(IllegalArgumentException.class, () -> EngineRecord.of("X", 0d, null));
    assertThrows(IllegalArgumentException.class, () -> EngineRecord.of("X", 10d, -1d));
    assertThrows(IllegalArgumentException.class, () -> EngineRecord.of("X", Double.NaN, null));
    assertThrows(IllegalArgumentException.class, () -> EngineRecord.of(" ", 10d, null));
  }
}
