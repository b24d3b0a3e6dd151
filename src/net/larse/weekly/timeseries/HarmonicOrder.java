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

/**
 * Number of yearly (k) and monthly (l) sine/cosine pairs used to model the seasonal pattern.
 */
public final class HarmonicOrder {
  /** Step between the orders tried by the automatic search. */
  public static final int STEP = 6;
  public static final int MAX_YEARLY = 36;
  public static final int MAX_MONTHLY = 12;

  public static final HarmonicOrder NONE = new HarmonicOrder(0, 0);

  /** Every order of the search grid, yearly order varying slowest. */
  public static final ImmutableList<HarmonicOrder> GRID = buildGrid();

  private final int yearly;
  private final int monthly;

  private HarmonicOrder(int yearly, int monthly) {
    this.yearly = yearly;
    this.monthly = monthly;
  }

  /**
   * @throws IllegalArgumentException if either order is negative
   */
  public static HarmonicOrder of(int yearly, int monthly) {
    Preconditions.checkArgument(yearly >= 0 && monthly >= 0,
        "harmonic orders must be non-negative, got (%s, %s)", yearly, monthly);
    return yearly == 0 && monthly == 0 ? NONE : new HarmonicOrder(yearly, monthly);
  }

  /** Order at row i, column j of the search grid. */
  public static HarmonicOrder fromGridIndex(int i, int j) {
    return of(i * STEP, j * STEP);
  }

  public static int gridRows() {
    return MAX_YEARLY / STEP + 1;
  }

  public static int gridCols() {
    return MAX_MONTHLY / STEP + 1;
  }

  private static ImmutableList<HarmonicOrder> buildGrid() {
    ImmutableList.Builder<HarmonicOrder> grid = ImmutableList.builder();
    for (int i = 0; i < gridRows(); i++) {
      for (int j = 0; j < gridCols(); j++) {
        grid.add(fromGridIndex(i, j));
      }
    }
    return grid.build();
  }

  public int getYearly() {
    return yearly;
  }

  public int getMonthly() {
    return monthly;
  }

  /** Number of regressors, 2k + 2l. */
  public int numColumns() {
    return 2 * (yearly + monthly);
  }

  /** True for (0, 0): there is no seasonal pattern to model. */
  public boolean isZero() {
    return yearly == 0 && monthly == 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HarmonicOrder)) {
      return false;
    }
    HarmonicOrder other = (HarmonicOrder) o;
    return yearly == other.yearly && monthly == other.monthly;
  }

  @Override
  public int hashCode() {
    return 31 * yearly + monthly;
  }

  @Override
  public String toString() {
    return String.format("(k=%d, l=%d)", yearly, monthly);
  }
}
