package com.ospicorp.enginecalibration.calibration.service;

import com.ospicorp.enginecalibration.calibration.exception.DegenerateDomainException;
import com.ospicorp.enginecalibration.calibration.exception.InsufficientDataException;
import com.ospicorp.enginecalibration.calibration.model.CalibrationModel;
import com.ospicorp.enginecalibration.calibration.model.FittedColumn;
import com.ospicorp.enginecalibration.table.DataTable;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Least-squares polynomial fits of one numeric column against another.
 *
 * <p>X is mapped onto {@link CalibrationModel#WINDOW_MIN}..{@link CalibrationModel#WINDOW_MAX}
 * before solving; raw engine values sit far from zero and the unscaled Vandermonde matrix is
 * badly conditioned.
 */
public final class RegressionFitter {

  private static final Logger log = LoggerFactory.getLogger(RegressionFitter.class);

  private RegressionFitter() {
  }

  /**
   * Fits a polynomial of the given degree to the finite (x, y) pairs of {@code table}.
   *
   * @throws com.ospicorp.enginecalibration.calibration.exception.ColumnNotFoundException
   *     if either column is missing or not numeric
   * @throws InsufficientDataException if fewer than {@code degree + 1} valid rows, or distinct
   *     x values, are available
   * @throws DegenerateDomainException if every valid x is the same value
   */
  public static CalibrationModel fit(DataTable table, String xColumn, String yColumn,
      int degree) {
    FinitePairs pairs = FinitePairs.extract(table, xColumn, yColumn);
    requireSupportedDegree(degree);

    int required = degree + 1;
    if (pairs.size() < required) {
      throw new InsufficientDataException("A degree " + degree + " fit of '" + yColumn
          + "' on '" + xColumn + "' needs " + required + " valid rows but only "
          + pairs.size() + " are available", required, pairs.size());
    }

    double[] x = pairs.x();
    double domainMin = Arrays.stream(x).min().orElseThrow();
    double domainMax = Arrays.stream(x).max().orElseThrow();
    if (domainMin == domainMax) {
      throw new DegenerateDomainException(xColumn, domainMin);
    }

    long distinct = Arrays.stream(x).distinct().count();
    if (distinct < required) {
      throw new InsufficientDataException("A degree " + degree + " fit needs " + required
          + " distinct values of '" + xColumn + "' but only " + distinct + " are present",
          required, (int) distinct);
    }

    // placeholder coefficients; only the domain-to-window map is used
    CalibrationModel mapping = CalibrationModel.of(1, List.of(0d, 0d), domainMin, domainMax);
    RealMatrix design = new Array2DRowRealMatrix(x.length, required);
    for (int i = 0; i < x.length; i++) {
      double t = mapping.toWindow(x[i]);
      double power = 1d;
      for (int k = 0; k < required; k++) {
        design.setEntry(i, k, power);
        power *= t;
      }
    }

    RealVector solution;
    try {
      DecompositionSolver solver = new QRDecomposition(design).getSolver();
      solution = solver.solve(new ArrayRealVector(pairs.y(), false));
    } catch (SingularMatrixException ex) {
      throw new InsufficientDataException("The degree " + degree + " design matrix for '"
          + xColumn + "' is rank deficient", required, (int) distinct);
    }

    CalibrationModel model = CalibrationModel.of(degree,
        Arrays.stream(solution.toArray()).boxed().toList(), domainMin, domainMax);
    log.debug("Fitted degree {} model of '{}' on '{}' over [{}, {}] from {} rows: {}",
        degree, yColumn, xColumn, domainMin, domainMax, pairs.size(), model.coefficients());
    return model;
  }

  // each y column gets its own finite-row filter
  public static Map<String, FittedColumn> fitAll(DataTable table, String xColumn,
      List<String> yColumns, int degree) {
    Map<String, FittedColumn> fits = new LinkedHashMap<>();
    for (String yColumn : yColumns) {
      CalibrationModel model = fit(table, xColumn, yColumn, degree);
      fits.put(yColumn, new FittedColumn(yColumn, model,
          FitEvaluator.evaluate(model, table, xColumn, yColumn)));
    }
    return fits;
  }

  static void requireSupportedDegree(int degree) {
    if (degree != 1 && degree != 2) {
      throw new IllegalArgumentException("degree must be 1 or 2 but was " + degree);
    }
  }
}
