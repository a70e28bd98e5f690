package com.ospicorp.enginecalibration.engine;

import java.time.LocalDate;
import org.springframework.util.StringUtils;

/**
 * One engine certification entry. TSFC values are in g/(kN*s); when both are present they
 * were measured on the same engine under the same rating.
 *
 * @param tsfcTakeoff takeoff TSFC, {@code null} for incomplete databank rows
 * @param tsfcCruise cruise TSFC, {@code null} when the engine has no cruise measurement
 */
public record EngineRecord(
    String engineId,
    Double tsfcTakeoff,
    Double tsfcCruise,
    LocalDate certificationDate,
    String thrustClass) {

  public EngineRecord {
    if (!StringUtils.hasText(engineId)) {
      throw new IllegalArgumentException("engineId must be provided");
    }
    requirePositive("tsfcTakeoff", tsfcTakeoff);
    requirePositive("tsfcCruise", tsfcCruise);
  }

  public static EngineRecord of(String engineId, Double tsfcTakeoff, Double tsfcCruise) {
    return new EngineRecord(engineId, tsfcTakeoff, tsfcCruise, null, null);
  }

  public boolean hasCruiseMeasurement() {
    return tsfcCruise != null;
  }

  private static void requirePositive(String name, Double value) {
    if (value != null && !(Double.isFinite(value) && value > 0d)) {
      throw new IllegalArgumentException(name + " must be a positive number but was " + value);
    }
  }
}
