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
import com.google.common.collect.ImmutableList;
import org.ejml.data.DenseMatrix64F;

import java.util.List;

/**
 * An ordinary least squares fit without intercept: coefficients, their standard errors, the
 * residuals and the likelihood based information criteria.
 */
public final class RegressionModel {
  private final ImmutableList<String> labels;
  private final double[] coefficients;
  private final double[] standardErrors;
  private final DenseMatrix64F unscaledCovariance;
  private final double[] fitted;
  private final double[] residuals;
  private final double rss;

  RegressionModel(List<String> labels, double[] coefficients, DenseMatrix64F unscaledCovariance,
      double[] fitted, double[] residuals) {
    Preconditions.checkArgument(labels.size() == coefficients.length);
    Preconditions.checkArgument(fitted.length == residuals.length);
    this.labels = ImmutableList.copyOf(labels);
    this.coefficients = coefficients;
    this.unscaledCovariance = unscaledCovariance;
    this.fitted = fitted;
    this.residuals = residuals;

    double sum = 0;
    for (double e : residuals) {
      sum += e * e;
    }
    this.rss = sum;

    int n = residuals.length;
    int p = coefficients.length;
    double sigma2 = n > p ? rss / (n - p) : Double.NaN;
    this.standardErrors = new double[p];
    for (int i = 0; i < p; i++) {
      standardErrors[i] = Math.sqrt(sigma2 * unscaledCovariance.get(i, i));
    }
  }

  public List<String> getLabels() {
    return labels;
  }

  public double[] getCoefficients() {
    return coefficients.clone();
  }

  public double[] getStandardErrors() {
    return standardErrors.clone();
  }

  /** Coefficient divided by its standard error. */
  public double[] getTStatistics() {
    double[] t = new double[coefficients.length];
    for (int i = 0; i < t.length; i++) {
      t[i] = coefficients[i] / standardErrors[i];
    }
    return t;
  }

  /** (X'X)^-1 of the design. */
  public DenseMatrix64F getUnscaledCovariance() {
    return unscaledCovariance.copy();
  }

  public double[] getFitted() {
    return fitted.clone();
  }

  public double[] getResiduals() {
    return residuals.clone();
  }

  public double getResidualSumOfSquares() {
    return rss;
  }

  /** Residual standard error, sqrt(RSS / (n - p)). */
  public double getSigma() {
    int n = getNumObservations();
    int p = getNumParameters();
    return n > p ? Math.sqrt(rss / (n - p)) : Double.NaN;
  }

  public int getNumObservations() {
    return residuals.length;
  }

  public int getNumParameters() {
    return coefficients.length;
  }

  /** Gaussian log-likelihood at the maximum likelihood error variance RSS / n. */
  public double logLikelihood() {
    int n = getNumObservations();
    return -0.5 * n * (Math.log(2 * Math.PI) + Math.log(rss / n) + 1);
  }

  /** Akaike criterion; the error variance counts as one parameter. */
  public double aic() {
    return -2 * logLikelihood() + 2 * (getNumParameters() + 1);
  }

  /** Small sample correction of {@link #aic()}, with p the number of coefficients. */
  public double aicc() {
    int n = getNumObservations();
    int p = getNumParameters();
    if (n - p - 1 <= 0) {
      return Double.POSITIVE_INFINITY;
    }
    return aic() + 2.0 * p * (p + 1) / (n - p - 1);
  }

  /** Schwarz criterion; the error variance counts as one parameter. */
  public double bic() {
    return -2 * logLikelihood() + Math.log(getNumObservations()) * (getNumParameters() + 1);
  }
}
