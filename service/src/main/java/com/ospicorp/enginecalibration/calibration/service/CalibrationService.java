package com.ospicorp.enginecalibration.calibration.service;

import com.ospicorp.enginecalibration.calibration.exception.CalibrationException;
import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import com.ospicorp.enginecalibration.calibration.model.CalibrationReport;
import com.ospicorp.enginecalibration.calibration.model.FitQuality;
import com.ospicorp.enginecalibration.calibration.model.FittedColumn;
import com.ospicorp.enginecalibration.table.DataTable;
import com.ospicorp.enginecalibration.table.TableOperations;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for reporting collaborators: fit, evaluate, select and apply calibration models
 * with the configured defaults. Holds no state between calls.
 */
@Service
public class CalibrationService {

  private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

  private final double selectionThreshold;
  private final String predictedColumn;
  private final String extrapolatedColumn;
  private final double samplingMargin;
  private final int samplingPoints;

  public CalibrationService(
      @Value("${calibration.selection.threshold:0.01}") double selectionThreshold,
      @Value("${calibration.apply.predicted-column:predicted}") String predictedColumn,
      @Value("${calibration.apply.extrapolated-column:extrapolated}") String extrapolatedColumn,
      @Value("${calibration.sampling.margin:5.0}") double samplingMargin,
      @Value("${calibration.sampling.points:100}") int samplingPoints) {
    if (!Double.isFinite(selectionThreshold) || selectionThreshold < 0d) {
      throw new IllegalStateException(
          "calibration.selection.threshold must be non-negative but was " + selectionThreshold);
    }
    if (!StringUtils.hasText(predictedColumn) || !StringUtils.hasText(extrapolatedColumn)) {
      throw new IllegalStateException("calibration.apply column names must not be blank");
    }
    if (!Double.isFinite(samplingMargin) || samplingMargin < 0d) {
      throw new IllegalStateException(
          "calibration.sampling.margin must be non-negative but was " + samplingMargin);
    }
    if (samplingPoints < 2) {
      throw new IllegalStateException(
          "calibration.sampling.points must be at least 2 but was " + samplingPoints);
    }
    this.selectionThreshold = selectionThreshold;
    this.predictedColumn = predictedColumn;
    this.extrapolatedColumn = extrapolatedColumn;
    this.samplingMargin = samplingMargin;
    this.samplingPoints = samplingPoints;
  }

  public double selectionThreshold() {
    return selectionThreshold;
  }

  public String predictedColumn() {
    return predictedColumn;
  }

  public String extrapolatedColumn() {
    return extrapolatedColumn;
  }

  public CalibrationModel fit(DataTable table, String xColumn, String yColumn, int degree) {
    return logged("fit", () -> RegressionFitter.fit(table, xColumn, yColumn, degree));
  }

  public Map<String, FittedColumn> fitAll(DataTable table, String xColumn, List<String> yColumns,
      int degree) {
    return logged("fitAll", () -> RegressionFitter.fitAll(table, xColumn, yColumns, degree));
  }

  public FitQuality evaluate(CalibrationModel model, DataTable table, String xColumn,
      String yColumn) {
    return logged("evaluate", () -> FitEvaluator.evaluate(model, table, xColumn, yColumn));
  }

  /**
   * Scores {@code table} with the configured predicted and extrapolated column names.
   */
  public DataTable apply(CalibrationModel model, DataTable table, String xColumn) {
    DataTable scored = logged("apply", () -> ScalingApplier.apply(model, table, xColumn,
        predictedColumn, extrapolatedColumn));
    log.info("Scored {} rows on '{}' with degree {} model; {} extrapolated",
        scored.rowCount(), xColumn, model.degree(),
        ScalingApplier.countExtrapolated(scored, extrapolatedColumn));
    return scored;
  }

  public CalibrationModel selectModel(CalibrationModel modelA, FitQuality qualityA,
      CalibrationModel modelB, FitQuality qualityB) {
    return selectModel(modelA, qualityA, modelB, qualityB, selectionThreshold);
  }

  public CalibrationModel selectModel(CalibrationModel modelA, FitQuality qualityA,
      CalibrationModel modelB, FitQuality qualityB, double threshold) {
    return logged("selectModel",
        () -> ModelSelector.select(modelA, qualityA, modelB, qualityB, threshold));
  }

  public DataTable sampleCurve(CalibrationModel model) {
    return logged("sampleCurve",
        () -> CurveSampler.sampleAroundDomain(model, samplingMargin, samplingPoints));
  }

  public CalibrationReport calibrate(DataTable table, String xColumn, String yColumn) {
    return calibrate(table, null, xColumn, yColumn);
  }

  /**
   * Fits linear and quadratic models of {@code yColumn} on {@code xColumn}, scores both on the
   * calibration rows and picks one with the configured threshold.
   *
   * @param keyColumn when given, rows with both x and y are averaged per key before fitting
   */
  public CalibrationReport calibrate(DataTable table, String keyColumn, String xColumn,
      String yColumn) {
    return logged("calibrate", () -> {
      DataTable calibrationRows = keyColumn == null
          ? table
          : TableOperations.meanByKey(table, keyColumn, List.of(xColumn, yColumn));

      CalibrationModel linear = RegressionFitter.fit(calibrationRows, xColumn, yColumn, 1);
      CalibrationModel quadratic = RegressionFitter.fit(calibrationRows, xColumn, yColumn, 2);
      FitQuality linearQuality = FitEvaluator.evaluate(linear, calibrationRows, xColumn, yColumn);
      FitQuality quadraticQuality =
          FitEvaluator.evaluate(quadratic, calibrationRows, xColumn, yColumn);
      CalibrationModel selected = ModelSelector.select(linear, linearQuality, quadratic,
          quadraticQuality, selectionThreshold);

      log.info("Calibrated '{}' on '{}' from {} rows: linear R2={}, quadratic R2={}, "
              + "selected degree {} (threshold {})",
          yColumn, xColumn, linearQuality.sampleCount(), linearQuality.rSquared(),
          quadraticQuality.rSquared(), selected.degree(), selectionThreshold);

      return new CalibrationReport(xColumn, yColumn, linearQuality.sampleCount(), linear,
          linearQuality, quadratic, quadraticQuality, selected, selectionThreshold);
    });
  }

  private <T> T logged(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (CalibrationException ex) {
      log.warn("Calibration {} rejected [{}]: {}", operation, ex.errorCode(), ex.getMessage());
      throw ex;
    } catch (IllegalArgumentException ex) {
      log.warn("Calibration {} rejected: {}", operation, ex.getMessage());
      throw ex;
    }
  }
}
