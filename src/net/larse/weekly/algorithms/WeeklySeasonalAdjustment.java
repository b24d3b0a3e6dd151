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
package net.larse.weekly.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.larse.weekly.helper.ArrayHelper;
import net.larse.weekly.helper.OrdinaryLeastSquares;
import net.larse.weekly.timeseries.DesignMatrix;
import net.larse.weekly.timeseries.HarmonicOrder;
import net.larse.weekly.timeseries.InformationCriterion;
import net.larse.weekly.timeseries.OrderSelector;
import net.larse.weekly.timeseries.OutlierDetector;
import net.larse.weekly.timeseries.OutlierSearch;
import net.larse.weekly.timeseries.SeasonalFactors;
import net.larse.weekly.timeseries.Smoother;
import net.larse.weekly.timeseries.SuperSmoother;
import net.larse.weekly.timeseries.WeeklySeries;
import net.larse.weekly.timeseries.WeightedRegression;
import net.larse.weekly.timeseries.YearWeights;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Seasonal adjustment of weekly data with trigonometric regressors, additive outliers and
 * year-weighted least squares.
 *
 * <p>The adjustment runs twice.  Each pass detrends with the smoother, searches for outliers,
 * resolves the harmonic order and fits the seasonal, holiday and outlier regressors year by year.
 * The first pass detrends the input; the second detrends the input with the first pass seasonal
 * and outlier effects removed, which gives a trend free of seasonal leakage before the final fit.
 *
 * <p>A harmonic order of (0, 0) in either pass ends the adjustment with a non-seasonal result.
 */
public final class WeeklySeasonalAdjustment {
  private static final Logger log = LoggerFactory.getLogger(WeeklySeasonalAdjustment.class);

  public static class Args {
    /** Rate of decay of the year weights. Must lie strictly between zero and one. */
    public double decayRate = YearWeights.DEFAULT_DECAY_RATE;

    /** Search for additive outliers. */
    public boolean autoOutlierSearch = true;

    /** |t| threshold of the outlier search. */
    public double outlierThreshold = OutlierDetector.DEFAULT_THRESHOLD;

    /** Known outlier dates.  Always modelled, never searched. */
    public List<LocalDate> fixedOutliers = new ArrayList<>();

    /** Fixed number of yearly and monthly sine/cosine pairs; null to select them. */
    public HarmonicOrder harmonicOrder = null;

    /** Holiday and trading-day regressors, one row per observation; null for none. */
    public DenseMatrix64F holidays = null;

    /** Criterion of the automatic harmonic order selection. */
    public InformationCriterion criterion = InformationCriterion.AICC;

    public DecompositionMode mode = DecompositionMode.ADDITIVE;

    /** Trend estimator. */
    public Smoother smoother = new SuperSmoother();

    /** Cap on backward elimination refits in the outlier search; 0 picks one from the search. */
    public int maxEliminationRounds = 0;

    void validate(int n) {
      Preconditions.checkArgument(decayRate > 0 && decayRate < 1,
          "decayRate must lie in (0, 1), got %s", decayRate);
      Preconditions.checkArgument(outlierThreshold >= 0 && !Double.isInfinite(outlierThreshold),
          "outlierThreshold must be finite and non-negative, got %s", outlierThreshold);
      Preconditions.checkArgument(maxEliminationRounds >= 0);
      Preconditions.checkNotNull(criterion, "criterion");
      Preconditions.checkNotNull(mode, "mode");
      Preconditions.checkNotNull(smoother, "smoother");
      if (holidays != null) {
        Preconditions.checkArgument(holidays.numRows == n,
            "holiday matrix has %s rows for %s observations", holidays.numRows, n);
        Preconditions.checkArgument(ArrayHelper.allFinite(holidays.getData()),
            "holiday matrix must be finite");
      }
      if (fixedOutliers != null) {
        for (LocalDate date : fixedOutliers) {
          Preconditions.checkArgument(date != null, "null outlier date");
        }
      }
    }
  }

  private final Args args;

  public WeeklySeasonalAdjustment() {
    this(new Args());
  }

  public WeeklySeasonalAdjustment(Args args) {
    this.args = args;
  }

  /**
   * Decomposes a weekly series.
   *
   * @param x observations
   * @param dates observation dates: unique, ascending, seven days apart
   * @throws IllegalArgumentException if the input or the arguments are malformed
   * @throws net.larse.weekly.helper.SingularDesignException if a regression cannot be solved
   */
  public Decomposition getResult(double[] x, LocalDate[] dates) {
    WeeklySeries input = WeeklySeries.of(dates, x);
    args.validate(input.size());

    WeeklySeries series = input;
    if (args.mode == DecompositionMode.MULTIPLICATIVE) {
      for (double v : x) {
        Preconditions.checkArgument(v > 0,
            "multiplicative adjustment needs positive values, got %s", v);
      }
      series = input.withValues(ArrayHelper.log(x));
    }

    List<LocalDate> fixed = new ArrayList<>();
    if (args.fixedOutliers != null) {
      for (LocalDate date : new TreeSet<>(args.fixedOutliers)) {
        if (series.contains(date)) {
          fixed.add(date);
        } else {
          log.debug("Ignoring outlier {} outside the series", date);
        }
      }
    }

    YearWeights weights = YearWeights.of(series, args.decayRate);
    OutlierDetector detector =
        new OutlierDetector(args.outlierThreshold, args.maxEliminationRounds);
    double[] values = series.getValues();

    Pass first = runPass(1, series, values, fixed, weights, detector);
    if (first == null) {
      return notSeasonal(x, dates);
    }
    Pass second = runPass(2, series, first.adjusted, fixed, weights, detector);
    if (second == null) {
      return notSeasonal(x, dates);
    }

    double[] trend = args.smoother.smooth(second.adjusted);
    double[] seasonal = second.factors.getSeasonal();
    double[] holiday = second.factors.getHoliday();
    double[] outlier = second.factors.getOutlier();
    double[] adjusted = second.adjusted;

    Decomposition.Builder result = new Decomposition.Builder(x, dates, args.mode, second.order);
    result.detrended = second.y;
    result.coefficients = second.factors.getLastCoefficients();
    result.model = OrdinaryLeastSquares.fit(
        second.design.getMatrix(), second.y, second.design.getLabels());
    result.outliers = second.design.getOutlierDates();
    if (args.mode == DecompositionMode.MULTIPLICATIVE) {
      // Each component is exponentiated separately, so the additive identity in logs becomes a
      // product identity.
      result.adjusted = ArrayHelper.exp(adjusted);
      result.trend = ArrayHelper.exp(trend);
      result.seasonal = ArrayHelper.exp(seasonal);
      result.holiday = ArrayHelper.exp(holiday);
      result.outlier = ArrayHelper.exp(outlier);
    } else {
      result.adjusted = adjusted;
      result.trend = trend;
      result.seasonal = seasonal;
      result.holiday = holiday;
      result.outlier = outlier;
    }
    log.info("Adjusted {} weeks: order {}, {} outliers", x.length, second.order,
        second.design.numOutliers());
    return result.build();
  }

  /**
   * One pass: detrend, find outliers, resolve the harmonic order and fit year by year.  Returns
   * null if the series turns out to have no seasonal pattern.
   */
  private Pass runPass(int pass, WeeklySeries series, double[] trendInput, List<LocalDate> fixed,
      YearWeights weights, OutlierDetector detector) {
    double[] values = series.getValues();
    double[] y = ArrayHelper.subtract(values, args.smoother.smooth(trendInput));

    List<LocalDate> outliers = fixed;
    if (args.autoOutlierSearch) {
      OutlierSearch search = detector.detect(y, series, fixed, args.holidays, args.harmonicOrder);
      if (!search.isSeasonal()) {
        log.warn("Pass {}: no seasonal pattern found by the outlier search", pass);
        return null;
      }
      TreeSet<LocalDate> union = new TreeSet<>(fixed);
      union.addAll(search.getOutliers());
      outliers = ImmutableList.copyOf(union);
    }

    HarmonicOrder order = args.harmonicOrder;
    if (order == null) {
      order = OrderSelector.select(y, series, args.holidays, outliers).get(args.criterion);
    }
    if (order.isZero()) {
      log.warn("Pass {}: harmonic order selection found k = l = 0", pass);
      return null;
    }

    DesignMatrix design = DesignMatrix.of(series, order, args.holidays, outliers);
    SeasonalFactors factors = WeightedRegression.fit(y, series, design, weights);
    double[] adjusted = ArrayHelper.subtract(
        ArrayHelper.subtract(values, factors.getSeasonal()), factors.getOutlier());
    log.info("Pass {}: order {}, {} outliers", pass, order, design.numOutliers());
    return new Pass(y, order, design, factors, adjusted);
  }

  private Decomposition notSeasonal(double[] x, LocalDate[] dates) {
    Decomposition result = Decomposition.notSeasonal(x, dates, args.mode);
    log.warn(result.getNote());
    return result;
  }

  /** What one pass hands on: its regression target, design, factors and adjusted series. */
  private static final class Pass {
    final double[] y;
    final HarmonicOrder order;
    final DesignMatrix design;
    final SeasonalFactors factors;
    final double[] adjusted;

    Pass(double[] y, HarmonicOrder order, DesignMatrix design, SeasonalFactors factors,
        double[] adjusted) {
      this.y = y;
      this.order = order;
      this.design = design;
      this.factors = factors;
      this.adjusted = adjusted;
    }
  }
}
