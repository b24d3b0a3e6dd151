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

/**
 * Observation weights for the year-by-year regressions.  For target year i a row from year y gets
 * weight r^|y - i|, normalised so that the weights of each target year sum to one over the whole
 * sample.  Only the diagonals of the weight matrices are stored.
 */
public final class YearWeights {
  public static final double DEFAULT_DECAY_RATE = 0.8;

  private final int[] years;
  // weights[i][row] for target year years[i]
  private final double[][] weights;

  private YearWeights(int[] years, double[][] weights) {
    this.years = years;
    this.weights = weights;
  }

  /**
   * @param decayRate r, strictly between 0 and 1
   */
  public static YearWeights of(WeeklySeries series, double decayRate) {
    Preconditions.checkArgument(decayRate > 0 && decayRate < 1,
        "decay rate must lie in (0, 1), got %s", decayRate);
    int[] years = series.getYears();
    int n = series.size();
    double[][] weights = new double[years.length][n];
    for (int i = 0; i < years.length; i++) {
      double sum = 0;
      for (int row = 0; row < n; row++) {
        double w = Math.pow(decayRate, Math.abs(series.yearOf(row) - years[i]));
        weights[i][row] = w;
        sum += w;
      }
      for (int row = 0; row < n; row++) {
        weights[i][row] /= sum;
      }
    }
    return new YearWeights(years, weights);
  }

  /** Target years, ascending. */
  public int[] getYears() {
    return years.clone();
  }

  public int numYears() {
    return years.length;
  }

  /** Diagonal of the weight matrix for the i-th target year. */
  public double[] getWeights(int i) {
    return weights[i].clone();
  }

  double weight(int i, int row) {
    return weights[i][row];
  }
}
