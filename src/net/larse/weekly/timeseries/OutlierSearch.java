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

import com.google.common.collect.ImmutableList;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of an additive outlier search.
 *
 * <p>A search over a series without seasonal structure stops before looking for outliers; such a
 * result reports {@code isSeasonal() == false} and is distinct from a completed search that found
 * no outliers.
 */
public final class OutlierSearch {
  private final boolean seasonal;
  private final HarmonicOrder order;
  private final ImmutableList<LocalDate> outliers;
  private final ImmutableList<LocalDate> forwardSelected;
  private final double robustScale;

  OutlierSearch(HarmonicOrder order, List<LocalDate> outliers, List<LocalDate> forwardSelected,
      double robustScale) {
    this.seasonal = !order.isZero();
    this.order = order;
    this.outliers = ImmutableList.sortedCopyOf(outliers);
    this.forwardSelected = ImmutableList.copyOf(forwardSelected);
    this.robustScale = robustScale;
  }

  static OutlierSearch notSeasonal() {
    return new OutlierSearch(
        HarmonicOrder.NONE, ImmutableList.of(), ImmutableList.of(), Double.NaN);
  }

  /** False when the harmonic order resolved to (0, 0) and no search was run. */
  public boolean isSeasonal() {
    return seasonal;
  }

  /** Harmonic order the search used. */
  public HarmonicOrder getOrder() {
    return order;
  }

  /** Detected outlier dates, ascending; excludes the fixed outliers given to the search. */
  public ImmutableList<LocalDate> getOutliers() {
    return outliers;
  }

  /** Dates accepted by the forward search, in order of acceptance, before elimination. */
  public ImmutableList<LocalDate> getForwardSelected() {
    return forwardSelected;
  }

  /** 1.49 times the median absolute residual of the outlier-free fit. */
  public double getRobustScale() {
    return robustScale;
  }
}
