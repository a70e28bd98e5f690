package com.ospicorp.enginecalibration.engine;

import com.ospicorp.enginecalibration.table.Column;
import com.ospicorp.enginecalibration.table.DataTable;
import java.util.List;

/** Standard engine column layout and conversion from {@link EngineRecord}s. */
public final class EngineTables {

  public static final String ENGINE_ID = "Engine Identification";
  public static final String TSFC_TAKEOFF = "TSFC (takeoff)";
  public static final String TSFC_CRUISE = "TSFC (cruise)";
  public static final String CERTIFICATION_DATE = "Final Test Date";
  public static final String THRUST_CLASS = "Thrust Class";

  public static final List<Column> SCHEMA = List.of(
      Column.text(ENGINE_ID),
      Column.numeric(TSFC_TAKEOFF),
      Column.numeric(TSFC_CRUISE),
      Column.date(CERTIFICATION_DATE),
      Column.text(THRUST_CLASS));

  private EngineTables() {
  }

  /**
   * Builds a table in record order. Engine identifiers are not required to be unique here;
   * repeated certification entries are collapsed with
   * {@link com.ospicorp.enginecalibration.table.TableOperations#meanByKey}.
   */
  public static DataTable toTable(List<EngineRecord> records) {
    DataTable.Builder builder = DataTable.builder().columns(SCHEMA);
    for (EngineRecord record : records) {
      builder.row(record.engineId(), record.tsfcTakeoff(), record.tsfcCruise(),
          record.certificationDate(), record.thrustClass());
    }
    return builder.build();
  }

  /** Engines lacking a cruise measurement, the rows a calibrated model is applied to. */
  public static DataTable withoutCruiseMeasurement(List<EngineRecord> records) {
    return toTable(records.stream().filter(r -> !r.hasCruiseMeasurement()).toList());
  }
}
