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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Regression design with three column blocks in a fixed order: harmonic regressors, holiday and
 * trading-day regressors, then one additive outlier indicator per outlier date.  Components are
 * reconstructed by slicing the coefficients at the block offsets.
 */
public final class DesignMatrix {
  private final DenseMatrix64F matrix;
  private final ImmutableList<String> labels;
  private final int numHarmonic;
  private final int numHoliday;
  private final ImmutableList<LocalDate> outlierDates;

  private DesignMatrix(DenseMatrix64F matrix, List<String> labels, int numHarmonic,
      int numHoliday, List<LocalDate> outlierDates) {
    this.matrix = matrix;
    this.labels = ImmutableList.copyOf(labels);
    this.numHarmonic = numHarmonic;
    this.numHoliday = numHoliday;
    this.outlierDates = ImmutableList.copyOf(outlierDates);
  }

  /**
   * Builds the design for a series.
   *
   * @param holidays holiday regressors row-aligned with the series, or null
   * @param outliers outlier dates; repeats and dates outside the series are ignored
   */
  public static DesignMatrix of(WeeklySeries series, HarmonicOrder order,
      DenseMatrix64F holidays, List<LocalDate> outliers) {
    int n = series.size();
    DenseMatrix64F harmonic = HarmonicBasis.build(order, series.getDates());
    int numHoliday = 0;
    if (holidays != null) {
      Preconditions.checkArgument(holidays.numRows == n,
          "holiday matrix has %s rows for %s observations", holidays.numRows, n);
      numHoliday = holidays.numCols;
    }

    Set<LocalDate> kept = new LinkedHashSet<>();
    for (LocalDate date : outliers) {
      if (series.contains(date)) {
        kept.add(date);
      }
    }
    ImmutableList<LocalDate> outlierDates = ImmutableList.copyOf(kept);

    int numCols = harmonic.numCols + numHoliday + outlierDates.size();
    DenseMatrix64F matrix = new DenseMatrix64F(n, numCols);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < harmonic.numCols; j++) {
        matrix.unsafe_set(i, j, harmonic.unsafe_get(i, j));
      }
      for (int j = 0; j < numHoliday; j++) {
        matrix.unsafe_set(i, harmonic.numCols + j, holidays.get(i, j));
      }
    }
    int offset = harmonic.numCols + numHoliday;
    for (int j = 0; j < outlierDates.size(); j++) {
      matrix.unsafe_set(series.indexOf(outlierDates.get(j)), offset + j, 1.0);
    }

    ImmutableList.Builder<String> labels = ImmutableList.builder();
    labels.addAll(HarmonicBasis.labels(order));
    for (int j = 0; j < numHoliday; j++) {
      labels.add("H" + (j + 1));
    }
    for (LocalDate date : outlierDates) {
      labels.add(outlierLabel(date));
    }
    return new DesignMatrix(matrix, labels.build(), harmonic.numCols, numHoliday, outlierDates);
  }

  static String outlierLabel(LocalDate date) {
    return "AO " + date;
  }

  /** A copy of this design with an indicator column for {@code row} appended. */
  public DesignMatrix withOutlierColumn(WeeklySeries series, int row) {
    int n = matrix.numRows;
    int p = matrix.numCols;
    DenseMatrix64F augmented = new DenseMatrix64F(n, p + 1);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < p; j++) {
        augmented.unsafe_set(i, j, matrix.unsafe_get(i, j));
      }
    }
    augmented.unsafe_set(row, p, 1.0);
    LocalDate date = series.getDate(row);
    return new DesignMatrix(augmented,
        ImmutableList.<String>builder().addAll(labels).add(outlierLabel(date)).build(),
        numHarmonic, numHoliday,
        ImmutableList.<LocalDate>builder().addAll(outlierDates).add(date).build());
  }

  /** The underlying matrix.  Callers must not modify it. */
  DenseMatrix64F matrix() {
    return matrix;
  }

  public DenseMatrix64F getMatrix() {
    return matrix.copy();
  }

  public ImmutableList<String> getLabels() {
    return labels;
  }

  public int numRows() {
    return matrix.numRows;
  }

  public int numCols() {
    return matrix.numCols;
  }

  public int numHarmonic() {
    return numHarmonic;
  }

  public int numHoliday() {
    return numHoliday;
  }

  public int numOutliers() {
    return outlierDates.size();
  }

  /** First column of the holiday block. */
  public int holidayOffset() {
    return numHarmonic;
  }

  /** First column of the outlier block. */
  public int outlierOffset() {
    return numHarmonic + numHoliday;
  }

  public ImmutableList<LocalDate> getOutlierDates() {
    return outlierDates;
  }
}
