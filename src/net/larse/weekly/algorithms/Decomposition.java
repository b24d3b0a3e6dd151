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

import com.google.common.collect.ImmutableList;
import net.larse.weekly.helper.RegressionModel;
import net.larse.weekly.timeseries.HarmonicOrder;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of a weekly seasonal adjustment.
 *
 * <p>When the harmonic order resolves to (0, 0) the series is not a candidate for seasonal
 * adjustment: {@link #isSeasonal()} is false, every component accessor returns null and
 * {@link #getNote()} says why.  Callers must check before using the components.
 */
public final class Decomposition {
  private final double[] x;
  private final LocalDate[] dates;
  private final DecompositionMode mode;
  private final HarmonicOrder order;
  private final double[] adjusted;
  private final double[] seasonal;
  private final double[] holiday;
  private final double[] outlier;
  private final double[] trend;
  private final double[] detrended;
  private final double[] coefficients;
  private final RegressionModel model;
  private final ImmutableList<LocalDate> outliers;
  private final String note;

  private Decomposition(Builder b) {
    this.x = b.x;
    this.dates = b.dates;
    this.mode = b.mode;
    this.order = b.order;
    this.adjusted = b.adjusted;
    this.seasonal = b.seasonal;
    this.holiday = b.holiday;
    this.outlier = b.outlier;
    this.trend = b.trend;
    this.detrended = b.detrended;
    this.coefficients = b.coefficients;
    this.model = b.model;
    this.outliers = b.outliers == null ? null : ImmutableList.sortedCopyOf(b.outliers);
    this.note = b.note;
  }

  static Decomposition notSeasonal(double[] x, LocalDate[] dates, DecompositionMode mode) {
    Builder b = new Builder(x, dates, mode, HarmonicOrder.NONE);
    b.note = "Series should not be a candidate for seasonal adjustment: "
        + "automatic selection found k = l = 0";
    return new Decomposition(b);
  }

  public boolean isSeasonal() {
    return !order.isZero();
  }

  /** Explanation for a non-seasonal result, otherwise null. */
  public String getNote() {
    return note;
  }

  public DecompositionMode getMode() {
    return mode;
  }

  /** Harmonic order of the final fit; (0, 0) for a non-seasonal result. */
  public HarmonicOrder getOrder() {
    return order;
  }

  /** The input series. */
  public double[] getValues() {
    return x.clone();
  }

  public LocalDate[] getDates() {
    return dates.clone();
  }

  /** Seasonally (and outlier) adjusted series. */
  public double[] getAdjusted() {
    return copy(adjusted);
  }

  public double[] getSeasonal() {
    return copy(seasonal);
  }

  /** Holiday and trading-day share of the seasonal factors. */
  public double[] getHoliday() {
    return copy(holiday);
  }

  public double[] getOutlier() {
    return copy(outlier);
  }

  public double[] getTrend() {
    return copy(trend);
  }

  /**
   * Adjusted series with the trend removed: sa - trend, or sa / trend in multiplicative mode.
   */
  public double[] getIrregular() {
    if (adjusted == null) {
      return null;
    }
    double[] irregular = new double[adjusted.length];
    for (int i = 0; i < adjusted.length; i++) {
      irregular[i] = mode == DecompositionMode.MULTIPLICATIVE
          ? adjusted[i] / trend[i]
          : adjusted[i] - trend[i];
    }
    return irregular;
  }

  /** Target of the final regressions: the (log) input minus the second pass trend estimate. */
  public double[] getDetrended() {
    return copy(detrended);
  }

  /** Coefficients of the weighted fit centred on the last year. */
  public double[] getCoefficients() {
    return copy(coefficients);
  }

  /** Unweighted OLS fit of the detrended series on the final design, over the full sample. */
  public RegressionModel getModel() {
    return model;
  }

  /** Outlier dates of the final design (given and detected), ascending. */
  public List<LocalDate> getOutliers() {
    return outliers;
  }

  private static double[] copy(double[] values) {
    return values == null ? null : values.clone();
  }

  static final class Builder {
    private final double[] x;
    private final LocalDate[] dates;
    private final DecompositionMode mode;
    private final HarmonicOrder order;
    double[] adjusted;
    double[] seasonal;
    double[] holiday;
    double[] outlier;
    double[] trend;
    double[] detrended;
    double[] coefficients;
    RegressionModel model;
    List<LocalDate> outliers;
    String note;

    Builder(double[] x, LocalDate[] dates, DecompositionMode mode, HarmonicOrder order) {
      this.x = x.clone();
      this.dates = dates.clone();
      this.mode = mode;
      this.order = order;
    }

    Decomposition build() {
      return new Decomposition(this);
    }
  }
}
