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
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.larse.weekly.helper.ArrayHelper;
import net.larse.weekly.helper.Cholesky;
import net.larse.weekly.helper.CollinearColumnException;
import net.larse.weekly.helper.OrdinaryLeastSquares;
import net.larse.weekly.helper.RankOneInverse;
import net.larse.weekly.helper.RegressionModel;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stepwise search for additive outliers in a detrended weekly series.
 *
 * <p>The search runs in four phases:
 * <ol>
 *   <li>Resolve the harmonic order, by AICc over the order grid unless one is given.  An order of
 *       (0, 0) ends the search: the series has no seasonal pattern.
 *   <li>Fit the harmonic, holiday and fixed outlier regressors and take the robust scale
 *       sigma = 1.49 * median(|residual|).
 *   <li>Forward selection.  Each round appends, in turn, the indicator of every remaining date to
 *       the design and computes |t| = |coefficient| / (sigma * sqrt(variance)) of the appended
 *       column, using a rank-one update of (X'X)^-1.  The date with the largest |t| is accepted if
 *       |t| reaches the threshold; otherwise the search stops.
 *   <li>Backward elimination.  Refit with every accepted outlier, re-estimate sigma, and drop the
 *       accepted outlier with the smallest |t| while it is below the threshold.
 * </ol>
 */
public final class OutlierDetector {
  private static final Logger log = LoggerFactory.getLogger(OutlierDetector.class);

  public static final double DEFAULT_THRESHOLD = 3.8;
  // Residual scale, relative to the largest |y|, at or below which the fit counts as exact.
  private static final double EXACT_FIT_TOLERANCE = 1e-10;

  private final double threshold;
  private final int maxEliminationRounds;

  public OutlierDetector() {
    this(DEFAULT_THRESHOLD);
  }

  public OutlierDetector(double threshold) {
    this(threshold, 0);
  }

  /**
   * @param threshold |t| an outlier must reach to be kept
   * @param maxEliminationRounds cap on backward elimination refits; 0 allows one more round than
   *     there are forward selections
   */
  public OutlierDetector(double threshold, int maxEliminationRounds) {
    Preconditions.checkArgument(threshold >= 0 && !Double.isInfinite(threshold),
        "threshold must be finite and non-negative, got %s", threshold);
    Preconditions.checkArgument(maxEliminationRounds >= 0);
    this.threshold = threshold;
    this.maxEliminationRounds = maxEliminationRounds;
  }

  /**
   * Searches y for additive outliers.
   *
   * @param y detrended series, row-aligned with {@code series}
   * @param series supplies the dates
   * @param fixedOutliers known outliers: always in the design and never candidates
   * @param holidays holiday regressors, or null
   * @param order harmonic order, or null to select it by AICc
   */
  public OutlierSearch detect(double[] y, WeeklySeries series, List<LocalDate> fixedOutliers,
      DenseMatrix64F holidays, HarmonicOrder order) {
    Preconditions.checkArgument(y.length == series.size(),
        "%s values for a series of %s", y.length, series.size());
    List<LocalDate> fixed = fixedOutliers == null ? ImmutableList.of() : fixedOutliers;

    if (order == null) {
      order = OrderSelector.select(y, series, holidays, fixed).get(InformationCriterion.AICC);
    }
    if (order.isZero()) {
      log.debug("Harmonic order is (0, 0); no outlier search");
      return OutlierSearch.notSeasonal();
    }

    DesignMatrix base = DesignMatrix.of(series, order, holidays, fixed);
    RegressionModel baseFit = OrdinaryLeastSquares.fit(base.matrix(), y, base.getLabels());
    double sigma = ArrayHelper.robustScale(baseFit.getResiduals());
    if (!(sigma > EXACT_FIT_TOLERANCE * ArrayHelper.maxAbs(y))) {
      log.warn("Residual scale is {}; the seasonal model fits exactly, no outlier search", sigma);
      return new OutlierSearch(order, ImmutableList.of(), ImmutableList.of(), sigma);
    }

    Set<Integer> excluded = new HashSet<>();
    for (LocalDate date : fixed) {
      int row = series.indexOf(date);
      if (row >= 0) {
        excluded.add(row);
      }
    }
    IntArrayList pool = new IntArrayList();
    for (int row = 0; row < series.size(); row++) {
      if (!excluded.contains(row)) {
        pool.add(row);
      }
    }

    SearchRound round = new SearchRound(base, pool, ImmutableList.of());
    while (true) {
      Candidate best = round.bestCandidate(y, sigma);
      if (best == null || best.t < threshold) {
        break;
      }
      round = round.accept(series, best);
      log.debug("Added outlier {} (|t| = {})", series.getDate(best.row), best.t);
    }

    List<LocalDate> forward = round.selected;
    List<LocalDate> kept = eliminate(y, series, fixed, holidays, order, forward);
    log.debug("Outlier search at {}: {} selected, {} kept", order, forward.size(), kept.size());
    return new OutlierSearch(order, kept, forward, sigma);
  }

  /**
   * Backward elimination: refits with the fixed and kept outliers and drops the kept outlier with
   * the smallest |t| until every remaining one reaches the threshold.
   */
  List<LocalDate> eliminate(double[] y, WeeklySeries series, List<LocalDate> fixed,
      DenseMatrix64F holidays, HarmonicOrder order, List<LocalDate> forward) {
    List<LocalDate> kept = new ArrayList<>(forward);
    int cap = maxEliminationRounds > 0 ? maxEliminationRounds : forward.size() + 1;
    int rounds = 0;
    while (!kept.isEmpty()) {
      if (rounds++ >= cap) {
        log.warn("Backward elimination stopped after {} rounds with {} outliers", cap, kept.size());
        break;
      }
      List<LocalDate> all = new ArrayList<>(fixed);
      all.addAll(kept);
      DesignMatrix design = DesignMatrix.of(series, order, holidays, all);
      RegressionModel fit = OrdinaryLeastSquares.fit(design.matrix(), y, design.getLabels());
      double sigma = ArrayHelper.robustScale(fit.getResiduals());

      double[] beta = fit.getCoefficients();
      DenseMatrix64F covariance = fit.getUnscaledCovariance();
      // the kept outliers are the trailing columns, in the order of `kept`
      int offset = design.numCols() - kept.size();
      int weakest = -1;
      double minT = Double.POSITIVE_INFINITY;
      for (int j = 0; j < kept.size(); j++) {
        int col = offset + j;
        double t = Math.abs(beta[col]) / Math.sqrt(covariance.get(col, col) * sigma * sigma);
        if (t < minT) {
          minT = t;
          weakest = j;
        }
      }
      if (minT >= threshold) {
        break;
      }
      log.debug("Dropped outlier {} (|t| = {})", kept.get(weakest), minT);
      kept.remove(weakest);
    }
    return kept;
  }

  /** A candidate date and the |t| its indicator would get. */
  private static final class Candidate {
    final int row;
    final double t;

    Candidate(int row, double t) {
      this.row = row;
      this.t = t;
    }
  }

  /**
   * State of the forward search between rounds: the current design, the rows still eligible and
   * the dates accepted so far.  Rounds never modify a state; accepting a candidate makes a new one.
   */
  private static final class SearchRound {
    final DesignMatrix design;
    final IntArrayList pool;
    final ImmutableList<LocalDate> selected;

    SearchRound(DesignMatrix design, IntArrayList pool, ImmutableList<LocalDate> selected) {
      this.design = design;
      this.pool = pool;
      this.selected = selected;
    }

    /**
     * The candidate with the largest |t|, earliest row on ties, or null if no candidate can be
     * added.
     */
    Candidate bestCandidate(double[] y, double sigma) {
      DenseMatrix64F x = design.matrix();
      // keep at least one residual degree of freedom
      if (pool.isEmpty() || x.numCols + 1 >= x.numRows) {
        return null;
      }
      DenseMatrix64F xt = CommonOps.transpose(x, null);
      DenseMatrix64F xtx = new DenseMatrix64F(x.numCols, x.numCols);
      CommonOps.multTransA(x, x, xtx);
      DenseMatrix64F xtxInv = Cholesky.invert(xtx, "outlier search design");
      DenseMatrix64F xty = new DenseMatrix64F(x.numCols, 1);
      CommonOps.mult(xt, DenseMatrix64F.wrap(y.length, 1, y), xty);

      Candidate best = null;
      for (int i = 0; i < pool.size(); i++) {
        int row = pool.getInt(i);
        RankOneInverse.Update update;
        try {
          update = RankOneInverse.updateUnitColumn(xtxInv, xt, row);
        } catch (CollinearColumnException e) {
          continue;
        }
        double coefficient = update.lastCoefficient(xty.getData(), y[row]);
        double t = Math.abs(coefficient) / (sigma * Math.sqrt(update.lastDiagonal()));
        if (!Double.isNaN(t) && (best == null || t > best.t)) {
          best = new Candidate(row, t);
        }
      }
      return best;
    }

    SearchRound accept(WeeklySeries series, Candidate candidate) {
      IntArrayList remaining = new IntArrayList(pool);
      remaining.rem(candidate.row);
      return new SearchRound(
          design.withOutlierColumn(series, candidate.row),
          remaining,
          ImmutableList.<LocalDate>builder()
              .addAll(selected).add(series.getDate(candidate.row)).build());
    }
  }
}
