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
import com.google.common.collect.ImmutableList;
import org.ejml.data.DenseMatrix64F;

import java.time.LocalDate;

/**
 * Builds the trigonometric regressors of a harmonic order.
 *
 * <p>The yearly block uses the day of year scaled by the length of that year, so leap years keep
 * the cycle aligned.  The monthly block uses the day of month scaled by the length of that month,
 * which picks up intra-month patterns such as pay days.  Columns are ordered
 * <pre>
 *   S(1/Ny) .. S(k/Ny)  C(1/Ny) .. C(k/Ny)  S(1/Nm) .. S(l/Nm)  C(1/Nm) .. C(l/Nm)
 * </pre>
 */
public final class HarmonicBasis {
  private HarmonicBasis() {}

  public static DenseMatrix64F build(HarmonicOrder order, LocalDate[] dates) {
    Preconditions.checkNotNull(order);
    int k = order.getYearly();
    int l = order.getMonthly();
    DenseMatrix64F x = new DenseMatrix64F(dates.length, order.numColumns());

    for (int row = 0; row < dates.length; row++) {
      LocalDate date = dates[row];
      double ry = 2 * Math.PI * date.getDayOfYear() / date.lengthOfYear();
      for (int i = 1; i <= k; i++) {
        x.unsafe_set(row, i - 1, Math.sin(i * ry));
        x.unsafe_set(row, k + i - 1, Math.cos(i * ry));
      }

      int offset = 2 * k;
      double rm = 2 * Math.PI * date.getDayOfMonth() / date.lengthOfMonth();
      for (int i = 1; i <= l; i++) {
        x.unsafe_set(row, offset + i - 1, Math.sin(i * rm));
        x.unsafe_set(row, offset + l + i - 1, Math.cos(i * rm));
      }
    }
    return x;
  }

  /** Column labels matching {@link #build}. */
  public static ImmutableList<String> labels(HarmonicOrder order) {
    ImmutableList.Builder<String> labels = ImmutableList.builder();
    addLabels(labels, order.getYearly(), "Ny");
    addLabels(labels, order.getMonthly(), "Nm");
    return labels.build();
  }

  private static void addLabels(ImmutableList.Builder<String> labels, int n, String period) {
    for (int i = 1; i <= n; i++) {
      labels.add(String.format("S(%d/%s)", i, period));
    }
    for (int i = 1; i <= n; i++) {
      labels.add(String.format("C(%d/%s)", i, period));
    }
  }
}
