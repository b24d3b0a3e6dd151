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
package net.larse.weekly.timeseries;

import com.google.common.base.Preconditions;
import net.larse.weekly.helper.LinearLeastSquares;
import net.larse.weekly.helper.SingularDesignException;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locally weighted regression of a detrended series on the design, one fit per calendar year.
 *
 * <p>The fit for year i solves (X'W_iX) b_i = X'W_iy with the weights of {@link YearWeights}, so it
 * uses the whole sample but concentrates on year i.  The factors of the rows of year i come only
 * from b_i, which lets the seasonal pattern drift from year to year.
 */
public final class WeightedRegression {
  private static final Logger log = LoggerFactory.getLogger(WeightedRegression.class);

  private WeightedRegression() {}

  /**
   * @throws SingularDesignException if X'W_iX is singular for some year
   */
  public static SeasonalFactors fit(double[] y, WeeklySeries series, DesignMatrix design,
      YearWeights weights) {
    int n = series.size();
    Preconditions.checkArgument(y.length == n && design.numRows() == n);
    Preconditions.checkArgument(design.numCols() > 0, "empty design");

    DenseMatrix64F x = design.matrix();
    int p = design.numCols();
    int holidayStart = design.holidayOffset();
    int outlierStart = design.outlierOffset();

    double[] seasonal = new double[n];
    double[] holiday = new double[n];
    double[] outlier = new double[n];
    int[] years = weights.getYears();
    double[][] coefficients = new double[years.length][];

    LinearLeastSquares lls = new LinearLeastSquares(p);
    for (int i = 0; i < years.length; i++) {
      lls.reset();
      for (int row = 0; row < n; row++) {
        lls.addRow(x, row, y[row], weights.weight(i, row));
      }
      double[] beta;
      try {
        beta = lls.solve();
      } catch (SingularDesignException e) {
        throw new SingularDesignException(
            String.format("Weighted fit for %d failed: %s", years[i], e.getMessage()), e);
      }
      coefficients[i] = beta;

      for (int row : series.rowsOf(years[i])) {
        double s = 0;
        double h = 0;
        double o = 0;
        for (int j = 0; j < p; j++) {
          double v = x.unsafe_get(row, j) * beta[j];
          if (j < outlierStart) {
            s += v;
            if (j >= holidayStart) {
              h += v;
            }
          } else {
            o += v;
          }
        }
        seasonal[row] = s;
        holiday[row] = h;
        outlier[row] = o;
      }
    }
    log.debug("Fitted {} yearly regressions on {} columns", years.length, p);
    return new SeasonalFactors(seasonal, holiday, outlier, years, coefficients);
  }
}
