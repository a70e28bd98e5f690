package com.ospicorp.enginecalibration.calibration.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.enginecalibration.EngineFixtures;
import com.ospicorp.enginecalibration.calibration.exception.ColumnNotFoundException;
import com.ospicorp.enginecalibration.calibration.exception.DegenerateDomainException;
import com.ospicorp.enginecalibration.calibration.exception.InsufficientDataException;
import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import com.ospicorp.enginecalibration.calibration.model.FittedColumn;
import com.ospicorp.enginecalibration.engine.EngineTables;
import com.ospicorp.enginecalibration.table.ColumnType;
import com.ospicorp.enginecalibration.table.DataTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.junit.jupiter.api.Test;

class RegressionFitterTest {

  private static final String X = EngineTables.TSFC_TAKEOFF;
  private static final String Y = EngineTables.TSFC_CRUISE;

  @Test
  void fitMatchesReferenceLeastSquaresSolver() {
    DataTable table = EngineFixtures.sampleCalibrationTable();

    for (int degree = 1; degree <= 2; degree++) {
      CalibrationModel model = RegressionFitter.fit(table, X, Y, degree);

      WeightedObservedPoints points = new WeightedObservedPoints();
      for (int i = 0; i < EngineFixtures.SAMPLE_TAKEOFF.length; i++) {
        points.add(EngineFixtures.SAMPLE_TAKEOFF[i], EngineFixtures.SAMPLE_CRUISE[i]);
      }
      double[] reference = PolynomialCurveFitter.create(degree).fit(points.toList());

      for (double x : EngineFixtures.SAMPLE_TAKEOFF) {
        assertEquals(powerSeries(reference, x), model.evaluate(x), 1e-6,
            "degree " + degree + " prediction at " + x);
      }
    }
  }

  @Test
  void fittedCoefficientsMinimiseResidualSumOfSquares() {
    DataTable table = EngineFixtures.sampleCalibrationTable();
    CalibrationModel model = RegressionFitter.fit(table, X, Y, 2);
    double best = rss(model);

    for (int k = 0; k < model.coefficients().size(); k++) {
      for (double delta : new double[] {-1e-3, 1e-3}) {
        List<Double> nudged = new ArrayList<>(model.coefficients());
        nudged.set(k, nudged.get(k) + delta);
        CalibrationModel other =
            CalibrationModel.of(2, nudged, model.domainMin(), model.domainMax());
        assertTrue(rss(other) > best, "nudging coefficient " + k + " should not improve the fit");
      }
    }
  }

  @Test
  void fitStoresDomainAndStandardWindow() {
    CalibrationModel model = RegressionFitter.fit(EngineFixtures.sampleCalibrationTable(), X, Y, 2);

    assertEquals(2, model.degree());
    assertEquals(3, model.coefficients().size());
    assertEquals(7.72, model.domainMin());
    assertEquals(18.37, model.domainMax());
    assertEquals(-1d, model.windowMin());
    assertEquals(1d, model.windowMax());
    assertEquals(21.230144413736504, model.coefficients().get(0), 1e-9);
    assertEquals(2.146569728759429, model.coefficients().get(1), 1e-9);
    assertEquals(0.40896450566784687, model.coefficients().get(2), 1e-9);
  }

  @Test
  void powerBasisMatchesRawNormalEquations() {
    DataTable table = EngineFixtures.xy(new double[] {10, 12, 15, 18},
        new double[] {18, 22, 28, 35});

    List<Double> linear = RegressionFitter.fit(table, "x", "y", 1).powerBasisCoefficients();
    List<Double> quadratic = RegressionFitter.fit(table, "x", "y", 2).powerBasisCoefficients();

    assertEquals(-3.3401360544217824, linear.get(0), 1e-9);
    assertEquals(2.1156462585034026, linear.get(1), 1e-9);
    assertEquals(3.1837270341182324, quadratic.get(0), 1e-7);
    assertEquals(1.1397637795279296, quadratic.get(1), 1e-8);
    assertEquals(0.034776902887126024, quadratic.get(2), 1e-9);
  }

  @Test
  void rowsWithMissingOrNonFiniteValuesAreExcluded() {
    DataTable noisy = EngineFixtures.engineBuilder()
        .row("A", 1d, 3d)
        .row("B", 2d, 5d)
        .row("C", null, 1000d)
        .row("D", 3d, null)
        .row("E", Double.NaN, 1000d)
        .row("F", 4d, Double.POSITIVE_INFINITY)
        .row("G", 3d, 7d)
        .build();

    CalibrationModel model = RegressionFitter.fit(noisy, X, Y, 1);

    assertEquals(1d, model.domainMin());
    assertEquals(3d, model.domainMax());
    assertEquals(1d, model.powerBasisCoefficients().get(0), 1e-12);
    assertEquals(2d, model.powerBasisCoefficients().get(1), 1e-12);
  }

  @Test
  void singleValidRowIsNotEnoughForQuadratic() {
    DataTable table = EngineFixtures.engineBuilder()
        .row("A", 12d, 20d)
        .row("B", null, 21d)
        .build();

    var ex = assertThrows(InsufficientDataException.class,
        () -> RegressionFitter.fit(table, X, Y, 2));
    assertEquals(3, ex.required());
    assertEquals(1, ex.actual());
    assertEquals("insufficient-data", ex.errorCode());
  }

  @Test
  void identicalXValuesCollapseTheDomain() {
    DataTable table = EngineFixtures.engineBuilder()
        .row("A", 12d, 20d)
        .row("B", 12d, 21d)
        .row("C", 12d, 22d)
        .row("D", 12d, 19d)
        .build();

    var ex = assertThrows(DegenerateDomainException.class,
        () -> RegressionFitter.fit(table, X, Y, 2));
    assertEquals(12d, ex.value());
  }

  @Test
  void quadraticNeedsThreeDistinctXValues() {
    DataTable table = EngineFixtures.engineBuilder()
        .row("A", 10d, 20d)
        .row("B", 10d, 21d)
        .row("C", 14d, 22d)
        .row("D", 14d, 23d)
        .build();

    assertThrows(InsufficientDataException.class, () -> RegressionFitter.fit(table, X, Y, 2));
    assertEquals(1, RegressionFitter.fit(table, X, Y, 1).degree());
  }

  @Test
  void missingOrNonNumericColumnsFailBeforeAnyArithmetic() {
    DataTable table = EngineFixtures.sampleCalibrationTable();

    assertThrows(ColumnNotFoundException.class,
        () -> RegressionFitter.fit(table, "TSFC (climb)", Y, 1));
    assertThrows(ColumnNotFoundException.class,
        () -> RegressionFitter.fit(table, X, EngineTables.ENGINE_ID, 1));
  }

  @Test
  void unsupportedDegreeIsRejected() {
    DataTable table = EngineFixtures.sampleCalibrationTable();

    assertThrows(IllegalArgumentException.class, () -> RegressionFitter.fit(table, X, Y, 0));
    assertThrows(IllegalArgumentException.class, () -> RegressionFitter.fit(table, X, Y, 3));
  }

  @Test
  void fitAllFitsEachDependentColumnOnItsOwnRows() {
    DataTable table = DataTable.builder()
        .column("year", ColumnType.NUMERIC)
        .column("rising", ColumnType.NUMERIC)
        .column("falling", ColumnType.NUMERIC)
        .row(2000d, 10d, 30d)
        .row(2005d, 15d, 25d)
        .row(2010d, 20d, null)
        .row(2015d, 25d, 15d)
        .build();

    Map<String, FittedColumn> fits =
        RegressionFitter.fitAll(table, "year", List.of("rising", "falling"), 1);

    assertEquals(List.of("rising", "falling"), List.copyOf(fits.keySet()));
    assertEquals(4, fits.get("rising").quality().sampleCount());
    assertEquals(3, fits.get("falling").quality().sampleCount());
    assertEquals(1d, fits.get("rising").quality().rSquared(), 1e-12);
    assertEquals(20d, fits.get("falling").model().evaluate(2010d), 1e-9);
  }

  private static double rss(CalibrationModel model) {
    double sum = 0d;
    for (int i = 0; i < EngineFixtures.SAMPLE_TAKEOFF.length; i++) {
      double r = EngineFixtures.SAMPLE_CRUISE[i] - model.evaluate(EngineFixtures.SAMPLE_TAKEOFF[i]);
      sum += r * r;
    }
    return sum;
  }

  private static double powerSeries(double[] coefficients, double x) {
    double result = 0d;
    for (int k = coefficients.length - 1; k >= 0; k--) {
      result = result * x + coefficients[k];
    }
    return result;
  }
}
