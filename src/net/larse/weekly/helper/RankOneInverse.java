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
package net.larse.weekly.helper;

import com.google.common.base.Preconditions;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;

/**
 * Updates the inverse cross product (X'X)^-1 of a design X after a column v is appended,
 * without refactorizing the augmented matrix.
 *
 * <p>With u1 = X'v, u2 = (X'X)^-1 u1 and d = 1 / (v'v - u1'u2), the inverse of [X v]'[X v] is
 * <pre>
 *   [ (X'X)^-1 + d u2 u2'   -d u2 ]
 *   [ -d u2'                  d   ]
 * </pre>
 */
public final class RankOneInverse {
  // Relative size of the Schur complement v'v - u1'u2 below which v is treated as lying in the
  // column space of X.
  public static final double COLLINEARITY_TOLERANCE = 1e-10;

  private RankOneInverse() {}

  /**
   * The pieces of an augmented inverse.  The full matrix is only assembled on request, since the
   * outlier search needs nothing but the last row.
   */
  public static final class Update {
    private final DenseMatrix64F xtxInv;
    private final double[] u2;
    private final double d;

    private Update(DenseMatrix64F xtxInv, double[] u2, double d) {
      this.xtxInv = xtxInv;
      this.u2 = u2;
      this.d = d;
    }

    public double getD() {
      return d;
    }

    /** Dimension of the augmented inverse. */
    public int size() {
      return u2.length + 1;
    }

    /** Diagonal element of the augmented inverse for the appended column. */
    public double lastDiagonal() {
      return d;
    }

    /** Last row (equivalently column) of the augmented inverse. */
    public double[] lastRow() {
      double[] row = new double[u2.length + 1];
      for (int i = 0; i < u2.length; i++) {
        row[i] = -d * u2[i];
      }
      row[u2.length] = d;
      return row;
    }

    /**
     * Coefficient of the appended column in the least squares fit, given X'y and v'y of the
     * augmented design.
     */
    public double lastCoefficient(double[] xty, double vty) {
      Preconditions.checkArgument(xty.length == u2.length);
      double sum = 0;
      for (int i = 0; i < u2.length; i++) {
        sum += u2[i] * xty[i];
      }
      return d * (vty - sum);
    }

    /** Assembles the (n+1) x (n+1) inverse. */
    public DenseMatrix64F toMatrix() {
      int n = u2.length;
      DenseMatrix64F result = new DenseMatrix64F(n + 1, n + 1);
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < n; j++) {
          result.unsafe_set(i, j, xtxInv.unsafe_get(i, j) + d * u2[i] * u2[j]);
        }
        result.unsafe_set(i, n, -d * u2[i]);
        result.unsafe_set(n, i, -d * u2[i]);
      }
      result.unsafe_set(n, n, d);
      return result;
    }
  }

  /**
   * Computes the update for appending the column v.
   *
   * @param xtxInv the inverse of X'X, n x n
   * @param xt the transpose of X, n x m
   * @param v the new column, m x 1
   * @throws CollinearColumnException if v is numerically dependent on the columns of X
   */
  public static Update update(DenseMatrix64F xtxInv, DenseMatrix64F xt, DenseMatrix64F v)
      throws CollinearColumnException {
    Preconditions.checkArgument(xtxInv.numRows == xtxInv.numCols);
    Preconditions.checkArgument(xt.numRows == xtxInv.numRows);
    Preconditions.checkArgument(v.numCols == 1 && v.numRows == xt.numCols);

    DenseMatrix64F u1 = new DenseMatrix64F(xt.numRows, 1);
    CommonOps.mult(xt, v, u1);
    return finish(xtxInv, u1.getData(), dot(v.getData(), v.getData()));
  }

  /**
   * Specialisation of {@link #update} for the unit indicator column that is 1 at {@code row} and
   * 0 elsewhere.  Here X'v is just column {@code row} of X' and v'v is 1.
   */
  public static Update updateUnitColumn(DenseMatrix64F xtxInv, DenseMatrix64F xt, int row)
      throws CollinearColumnException {
    Preconditions.checkArgument(xtxInv.numRows == xtxInv.numCols);
    Preconditions.checkArgument(xt.numRows == xtxInv.numRows);
    Preconditions.checkElementIndex(row, xt.numCols);

    double[] u1 = new double[xt.numRows];
    for (int i = 0; i < u1.length; i++) {
      u1[i] = xt.unsafe_get(i, row);
    }
    return finish(xtxInv, u1, 1.0);
  }

  /** Convenience for {@code update(xtxInv, xt, v).toMatrix()}. */
  public static DenseMatrix64F append(DenseMatrix64F xtxInv, DenseMatrix64F xt, DenseMatrix64F v)
      throws CollinearColumnException {
    return update(xtxInv, xt, v).toMatrix();
  }

  private static Update finish(DenseMatrix64F xtxInv, double[] u1, double vtv)
      throws CollinearColumnException {
    int n = u1.length;
    double[] u2 = new double[n];
    for (int i = 0; i < n; i++) {
      double sum = 0;
      for (int j = 0; j < n; j++) {
        sum += xtxInv.unsafe_get(i, j) * u1[j];
      }
      u2[i] = sum;
    }

    double schur = vtv - dot(u1, u2);
    if (!(schur > COLLINEARITY_TOLERANCE * Math.max(vtv, Double.MIN_NORMAL))) {
      throw new CollinearColumnException(
          String.format("Column is collinear with the design (v'v = %g, complement = %g)",
              vtv, schur));
    }
    double d = 1.0 / schur;
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new CollinearColumnException("Non-finite update denominator");
    }
    return new Update(xtxInv, u2, d);
  }

  private static double dot(double[] a, double[] b) {
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }
}
