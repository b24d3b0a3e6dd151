/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.weekly.helper;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.ejml.data.DenseMatrix64F;

import java.util.Collections;
import java.util.List;

/**
 * Fits y on the columns of a design by ordinary least squares, without an intercept.
 */
public final class OrdinaryLeastSquares {
  // Absolute tolerance on the diagonal of R in the QR decomposition.
  private static final double QR_THRESHOLD = 1e-8;

  private OrdinaryLeastSquares() {}

  public static RegressionModel fit(DenseMatrix64F design, double[] y) {
    return fit(design, y, Collections.nCopies(design.numCols, ""));
  }

  /**
   * @throws SingularDesignException if the design is rank deficient or has no fewer columns
   *     than rows
   */
  public static RegressionModel fit(DenseMatrix64F design, double[] y, List<String> labels) {
    Preconditions.checkArgument(design.numRows == y.length,
        "design has %s rows but y has %s values", design.numRows, y.length);
    Preconditions.checkArgument(labels.size() == design.numCols);

    int n = design.numRows;
    int p = design.numCols;
    if (p == 0) {
      // the empty model: nothing is fitted, the residuals are y itself
      return new RegressionModel(labels, new double[0], new DenseMatrix64F(0, 0),
          new double[n], y.clone());
    }
    if (n <= p) {
      throw new SingularDesignException(
          String.format("%d observations cannot determine %d coefficients", n, p));
    }

    double[][] x = new double[n][p];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < p; j++) {
        x[i][j] = design.unsafe_get(i, j);
      }
    }

    OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(QR_THRESHOLD);
    ols.setNoIntercept(true);
    try {
      ols.newSampleData(y, x);
      double[] beta = ols.estimateRegressionParameters();
      double[] residuals = ols.estimateResiduals();
      double[][] covariance = ols.estimateRegressionParametersVariance();

      double[] fitted = new double[n];
      for (int i = 0; i < n; i++) {
        fitted[i] = y[i] - residuals[i];
      }
      for (double b : beta) {
        if (Double.isNaN(b) || Double.isInfinite(b)) {
          throw new SingularDesignException(
              String.format("%d x %d design produced non-finite coefficients", n, p));
        }
      }
      return new RegressionModel(labels, beta, new DenseMatrix64F(covariance), fitted, residuals);
    } catch (SingularMatrixException e) {
      throw new SingularDesignException(
          String.format("%d x %d design is rank deficient", n, p), e);
    } catch (MathIllegalArgumentException e) {
      throw new SingularDesignException(e.getMessage(), e);
    }
  }
}
