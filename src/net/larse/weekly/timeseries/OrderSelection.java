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

import java.util.EnumMap;
import java.util.Map;

/**
 * Criterion values over the harmonic order grid and the order minimising each criterion.  Grid
 * points that could not be fitted hold positive infinity.
 *
 * <p>Ties go to the first grid point in column-major order: all yearly orders at l = 0 first,
 * then l = 6, then l = 12.
 */
public final class OrderSelection {
  private final Map<InformationCriterion, double[][]> values;
  private final Map<InformationCriterion, HarmonicOrder> best;

  OrderSelection(Map<InformationCriterion, double[][]> values) {
    this.values = new EnumMap<>(values);
    this.best = new EnumMap<>(InformationCriterion.class);
    for (InformationCriterion criterion : InformationCriterion.values()) {
      best.put(criterion, argMin(values.get(criterion)));
    }
  }

  static HarmonicOrder argMin(double[][] grid) {
    int bestI = 0;
    int bestJ = 0;
    double min = Double.POSITIVE_INFINITY;
    for (int j = 0; j < grid[0].length; j++) {
      for (int i = 0; i < grid.length; i++) {
        if (grid[i][j] < min) {
          min = grid[i][j];
          bestI = i;
          bestJ = j;
        }
      }
    }
    return HarmonicOrder.fromGridIndex(bestI, bestJ);
  }

  /** The order minimising the criterion. */
  public HarmonicOrder get(InformationCriterion criterion) {
    return best.get(criterion);
  }

  /** Criterion value at a grid order. */
  public double getValue(InformationCriterion criterion, HarmonicOrder order) {
    Preconditions.checkArgument(order.getYearly() % HarmonicOrder.STEP == 0
        && order.getMonthly() % HarmonicOrder.STEP == 0
        && order.getYearly() <= HarmonicOrder.MAX_YEARLY
        && order.getMonthly() <= HarmonicOrder.MAX_MONTHLY, "%s is not on the search grid", order);
    return values.get(criterion)
        [order.getYearly() / HarmonicOrder.STEP][order.getMonthly() / HarmonicOrder.STEP];
  }

  public double getMinimum(InformationCriterion criterion) {
    return getValue(criterion, get(criterion));
  }
}
