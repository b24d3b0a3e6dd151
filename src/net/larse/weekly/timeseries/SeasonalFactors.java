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

import java.util.Arrays;

/**
 * Seasonal, holiday and outlier factors reconstructed year by year, with the coefficients of each
 * year's fit.
 */
public final class SeasonalFactors {
  private final double[] seasonal;
  private final double[] holiday;
  private final double[] outlier;
  private final int[] years;
  private final double[][] coefficients;

  SeasonalFactors(double[] seasonal, double[] holiday, double[] outlier, int[] years,
      double[][] coefficients) {
    this.seasonal = seasonal;
    this.holiday = holiday;
    this.outlier = outlier;
    this.years = years;
    this.coefficients = coefficients;
  }

  /** Seasonal factor: the harmonic and holiday parts of each year's fit. */
  public double[] getSeasonal() {
    return seasonal.clone();
  }

  /** The holiday part of the seasonal factor; zero without holiday regressors. */
  public double[] getHoliday() {
    return holiday.clone();
  }

  /** Outlier effects; zero without outliers. */
  public double[] getOutlier() {
    return outlier.clone();
  }

  /** Coefficients of the fit centred on the given year. */
  public double[] getCoefficients(int year) {
    int i = Arrays.binarySearch(years, year);
    Preconditions.checkArgument(i >= 0, "no fit for year %s", year);
    return coefficients[i].clone();
  }

  /** Coefficients of the fit centred on the last year of the series. */
  public double[] getLastCoefficients() {
    return coefficients[coefficients.length - 1].clone();
  }
}
