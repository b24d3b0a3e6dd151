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
import net.larse.weekly.helper.OrdinaryLeastSquares;
import net.larse.weekly.helper.RegressionModel;
import net.larse.weekly.helper.SingularDesignException;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Searches the harmonic order grid for the orders minimising AIC, AICc and BIC.
 *
 * <p>Each of the 21 grid orders is fitted by OLS (no intercept) of the detrended series on the
 * harmonic regressors, the holiday regressors and the outlier indicators.
 */
public final class OrderSelector {
  private static final Logger log = LoggerFactory.getLogger(OrderSelector.class);

  private OrderSelector() {}

  /**
   * @param y detrended series, row-aligned with {@code series}
   * @param holidays holiday regressors, or null
   * @param outliers outlier dates to include as regressors
   * @throws SingularDesignException if no grid order gives a finite criterion value
   */
  public static OrderSelection select(double[] y, WeeklySeries series, DenseMatrix64F holidays,
      List<LocalDate> outliers) {
    Preconditions.checkArgument(y.length == series.size());

    Map<InformationCriterion, double[][]> values = new EnumMap<>(InformationCriterion.class);
    for (InformationCriterion criterion : InformationCriterion.values()) {
      values.put(criterion, new double[HarmonicOrder.gridRows()][HarmonicOrder.gridCols()]);
    }

    SingularDesignException lastFailure = null;
    int designCols = 0;
    for (int i = 0; i < HarmonicOrder.gridRows(); i++) {
      for (int j = 0; j < HarmonicOrder.gridCols(); j++) {
        HarmonicOrder order = HarmonicOrder.fromGridIndex(i, j);
        DesignMatrix design = DesignMatrix.of(series, order, holidays, outliers);
        RegressionModel model;
        designCols = design.numCols();
        try {
          model = OrdinaryLeastSquares.fit(design.matrix(), y, design.getLabels());
        } catch (SingularDesignException e) {
          // An order the sample cannot support is never selected.
          log.debug("Skipping {}: {}", order, e.getMessage());
          lastFailure = e;
          for (double[][] grid : values.values()) {
            grid[i][j] = Double.POSITIVE_INFINITY;
          }
          continue;
        }
        for (InformationCriterion criterion : InformationCriterion.values()) {
          values.get(criterion)[i][j] = criterion.evaluate(model);
        }
      }
    }

    OrderSelection selection = new OrderSelection(values);
    for (InformationCriterion criterion : InformationCriterion.values()) {
      // Every order failed: the holiday or outlier regressors alone are rank deficient, or the
      // sample is too short for any of them.  (0, 0) here would not mean "no seasonality".
      if (selection.getMinimum(criterion) == Double.POSITIVE_INFINITY) {
        throw new SingularDesignException(String.format(
            "No harmonic order can be fitted by %s: %d observations, %d holiday regressors, "
                + "%d outliers (largest design %d columns)",
            criterion, y.length, holidays == null ? 0 : holidays.numCols, outliers.size(),
            designCols), lastFailure);
      }
    }
    log.debug("Selected orders: aic {}, aicc {}, bic {}",
        selection.get(InformationCriterion.AIC),
        selection.get(InformationCriterion.AICC),
        selection.get(InformationCriterion.BIC));
    return selection;
  }
}
