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

import java.util.Arrays;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.DecompositionFactory;
import org.ejml.interfaces.decomposition.CholeskyDecomposition;

/**
 * Solves and inverts symmetric positive definite cross-product matrices, failing loudly when the
 * matrix is singular instead of returning NaN or Inf.
 *
 * <p>The matrix is factored once as L L'; the pivot check and the triangular solves share that
 * factor.
 */
public final class Cholesky {
  // Smallest allowed ratio between the smallest and largest pivot of the Cholesky factor.  The
  // condition number of the matrix is roughly the inverse square of this ratio.
  public static final double PIVOT_TOLERANCE = 1e-7;

  private Cholesky() {}

  /**
   * Solves a * x = b.
   *
   * @param what describes the system in the exception message
   */
  public static double[] solve(DenseMatrix64F a, double[] b, String what) {
    DenseMatrix64F lower = factor(a, what);
    double[] x = b.clone();
    substitute(lower, x);
    return checkFinite(DenseMatrix64F.wrap(x.length, 1, x), what).getData();
  }

  /** Returns the inverse of a. */
  public static DenseMatrix64F invert(DenseMatrix64F a, String what) {
    DenseMatrix64F lower = factor(a, what);
    int n = lower.numRows;
    DenseMatrix64F inverse = new DenseMatrix64F(n, n);
    double[] column = new double[n];
    for (int j = 0; j < n; j++) {
      Arrays.fill(column, 0);
      column[j] = 1;
      substitute(lower, column);
      for (int i = 0; i < n; i++) {
        inverse.unsafe_set(i, j, column[i]);
      }
    }
    return checkFinite(inverse, what);
  }

  /** The lower triangular factor L of a = L L'. */
  private static DenseMatrix64F factor(DenseMatrix64F a, String what) {
    if (a.numRows != a.numCols || a.numRows == 0) {
      throw new SingularDesignException(
          String.format("%s: %d x %d is not a non-empty square matrix",
              what, a.numRows, a.numCols));
    }
    int n = a.numRows;
    CholeskyDecomposition<DenseMatrix64F> chol = DecompositionFactory.chol(n, true);
    // the decomposition works in place
    if (!chol.decompose(a.copy())) {
      throw new SingularDesignException(
          String.format("%s: %d x %d cross product is not positive definite", what, n, n));
    }
    DenseMatrix64F lower = chol.getT(null);
    double min = Double.POSITIVE_INFINITY;
    double max = 0;
    for (int i = 0; i < n; i++) {
      double pivot = Math.abs(lower.get(i, i));
      min = Math.min(min, pivot);
      max = Math.max(max, pivot);
    }
    if (!(max > 0) || min / max < PIVOT_TOLERANCE) {
      throw new SingularDesignException(
          String.format("%s: %d x %d cross product is singular (pivot ratio %g)",
              what, n, n, max > 0 ? min / max : 0.0));
    }
    return lower;
  }

  // Overwrites b with the solution of L L' x = b: forward substitution, then back substitution.
  private static void substitute(DenseMatrix64F lower, double[] b) {
    int n = lower.numRows;
    for (int i = 0; i < n; i++) {
      double sum = b[i];
      for (int k = 0; k < i; k++) {
        sum -= lower.unsafe_get(i, k) * b[k];
      }
      b[i] = sum / lower.unsafe_get(i, i);
    }
    for (int i = n - 1; i >= 0; i--) {
      double sum = b[i];
      for (int k = i + 1; k < n; k++) {
        sum -= lower.unsafe_get(k, i) * b[k];
      }
      b[i] = sum / lower.unsafe_get(i, i);
    }
  }

  private static DenseMatrix64F checkFinite(DenseMatrix64F m, String what) {
    for (double v : m.getData()) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        throw new SingularDesignException(what + ": solution is not finite");
      }
    }
    return m;
  }
}
