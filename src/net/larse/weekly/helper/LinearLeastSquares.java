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

import java.util.Arrays;

/**
 * Computes a weighted multivariate linear regression (no intercept) by accumulating the normal
 * equations one observation at a time.
 */
public class LinearLeastSquares {
  public final int numX;

  private int numInputs;
  private double weightSum;
  // the lower-left triangle of xMat, row by row
  private final double[] xSums;
  // the elements of yMat
  private final double[] ySums;
  // weighted sum of y^2
  private double y2Sum;

  /**
   * Creates an accumulator for a regression on numX independent variables.
   *
   * <p>Call addInput() for every observation and then solve().  Inputs may be added after
   * solving, and a further call to solve() accounts for them.
   */
  public LinearLeastSquares(int numX) {
    Preconditions.checkArgument(numX >= 1, "need at least one regressor, got %s", numX);
    this.numX = numX;
    this.xSums = new double[numX * (numX + 1) / 2];
    this.ySums = new double[numX];
  }

  // Written as matrices, with W = diag(w) holding the observation weights,
  //   xMat = transpose(X) * W * X
  //   yMat = transpose(X) * W * y
  // and the coefficients b solve xMat * b = yMat.
  //
  // Both are sums over observations:
  //   xMat[i, j] = sum(w * x_i * x_j)
  //   yMat[i]    = sum(w * x_i * y)
  // xMat is symmetric, so only one triangle is stored while accumulating.

  /** Add one observation with unit weight. */
  public void addInput(double[] x, int xStart, double y) {
    addInput(x, xStart, y, 1.0);
  }

  /** Add one observation, using numX values from x starting at xStart. */
  public void addInput(double[] x, int xStart, double y, double weight) {
    Preconditions.checkArgument(weight >= 0, "negative weight %s", weight);
    ++numInputs;
    if (weight == 0) {
      return;
    }
    weightSum += weight;
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      double wxi = weight * x[xStart + i];
      for (int i2 = 0; i2 <= i; ++i2) {
        xSums[pos++] += wxi * x[xStart + i2];
      }
      ySums[i] += wxi * y;
    }
    assert pos == xSums.length;
    y2Sum += weight * y * y;
  }

  /** Add row {@code row} of the design with the given target and weight. */
  public void addRow(DenseMatrix64F design, int row, double y, double weight) {
    Preconditions.checkArgument(design.numCols == numX);
    addInput(design.getData(), row * design.numCols, y, weight);
  }

  public int getNumInputs() {
    return numInputs;
  }

  public double getWeightSum() {
    return weightSum;
  }

  /** The accumulated cross product X'WX as a full symmetric matrix. */
  public DenseMatrix64F getCrossProduct() {
    DenseMatrix64F xMat = new DenseMatrix64F(numX, numX);
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      for (int i2 = 0; i2 <= i; ++i2) {
        double sum = xSums[pos++];
        xMat.unsafe_set(i, i2, sum);
        if (i != i2) {
          xMat.unsafe_set(i2, i, sum);
        }
      }
    }
    return xMat;
  }

  /**
   * Solves the normal equations by Cholesky decomposition.
   *
   * @throws SingularDesignException if X'WX is not positive definite
   */
  public double[] solve() {
    if (numInputs < numX) {
      throw new SingularDesignException(
          String.format("%d observations cannot determine %d coefficients", numInputs, numX));
    }
    return Cholesky.solve(getCrossProduct(), ySums, "weighted normal equations");
  }

  /**
   * Weighted root mean squared residual of a solution returned by solve().
   */
  public double getRmsResidual(double[] beta) {
    Preconditions.checkArgument(beta.length == numX);
    Preconditions.checkState(weightSum > 0);
    double sumSq = y2Sum;
    for (int j = 0; j < numX; ++j) {
      sumSq -= beta[j] * ySums[j];
    }
    // due to roundoff, sumSq could end up slightly negative
    return (sumSq <= 0) ? 0 : Math.sqrt(sumSq / weightSum);
  }

  /**
   * Reset to the no-inputs state.
   */
  public void reset() {
    numInputs = 0;
    weightSum = 0;
    y2Sum = 0;
    Arrays.fill(xSums, 0);
    Arrays.fill(ySums, 0);
  }
}
