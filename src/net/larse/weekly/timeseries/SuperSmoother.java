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

import java.util.Arrays;

/**
 * Friedman's super smoother: local linear running-line smooths with three spans, the span chosen
 * point by point by cross-validation.
 *
 * <p>J. H. Friedman (1984) A variable span scatterplot smoother. Laboratory for Computational
 * Statistics, Stanford University Technical Report No. 5.
 *
 * <p>Ported from the Fortran routines supsmu and smooth.
 */
public class SuperSmoother implements Smoother {
  // tweeter, midrange and woofer spans, as fractions of n
  private static final double[] SPANS = {0.05, 0.2, 0.5};
  private static final double BIG = 1.0e20;
  private static final double SML = 1.0e-7;
  private static final double EPS = 1.0e-3;

  private final double span;
  private final double bass;

  /** Span chosen by cross-validation, no bass enhancement. */
  public SuperSmoother() {
    this(0, 0);
  }

  /**
   * @param span fixed span as a fraction of n, or 0 to choose it by cross-validation
   * @param bass bass enhancement in (0, 10] for smoother output; 0 disables it
   */
  public SuperSmoother(double span, double bass) {
    Preconditions.checkArgument(span >= 0 && span <= 1, "span must lie in [0, 1], got %s", span);
    Preconditions.checkArgument(bass >= 0 && bass <= 10, "bass must lie in [0, 10], got %s", bass);
    this.span = span;
    this.bass = bass;
  }

  @Override
  public double[] smooth(double[] y) {
    int n = y.length;
    double[] x = new double[n];
    double[] w = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = i + 1;
      w[i] = 1;
    }
    return supsmu(x, y, w);
  }

  private double[] supsmu(double[] x, double[] y, double[] w) {
    int n = y.length;
    double[] smo = new double[n];
    if (n < 4) {
      // too short to smooth; fall back to the weighted mean
      double sy = 0;
      double sw = 0;
      for (int j = 0; j < n; j++) {
        sy += w[j] * y[j];
        sw += w[j];
      }
      Arrays.fill(smo, sw > 0 ? sy / sw : 0);
      return smo;
    }

    // 1-based positions of the quartiles, as in the Fortran code
    int i = n / 4;
    int j = 3 * i;
    double scale = x[j - 1] - x[i - 1];
    while (scale <= 0) {
      if (j < n) {
        j++;
      }
      if (i > 1) {
        i--;
      }
      scale = x[j - 1] - x[i - 1];
    }
    double vsmlsq = (EPS * scale) * (EPS * scale);
    int jper = 1;

    double[] h = new double[n];
    if (span > 0) {
      smooth(x, y, w, span, jper, vsmlsq, smo, h);
      return smo;
    }

    // sc[0], sc[2], sc[4]: smooths with the three spans
    // sc[1], sc[3], sc[5]: their smoothed cross-validated residuals
    double[][] sc = new double[7][n];
    for (int k = 0; k < 3; k++) {
      smooth(x, y, w, SPANS[k], jper, vsmlsq, sc[2 * k], sc[6]);
      smooth(x, sc[6], w, SPANS[1], -jper, vsmlsq, sc[2 * k + 1], h);
    }

    for (int m = 0; m < n; m++) {
      double resmin = BIG;
      for (int k = 0; k < 3; k++) {
        if (sc[2 * k + 1][m] < resmin) {
          resmin = sc[2 * k + 1][m];
          sc[6][m] = SPANS[k];
        }
      }
      if (bass > 0 && bass <= 10 && resmin < sc[5][m] && resmin > 0) {
        sc[6][m] += (SPANS[2] - sc[6][m])
            * Math.pow(Math.max(SML, resmin / sc[5][m]), 10.0 - bass);
      }
    }

    smooth(x, sc[6], w, SPANS[1], -jper, vsmlsq, sc[1], h);
    for (int m = 0; m < n; m++) {
      if (sc[1][m] <= SPANS[0]) {
        sc[1][m] = SPANS[0];
      }
      if (sc[1][m] >= SPANS[2]) {
        sc[1][m] = SPANS[2];
      }
      double f = sc[1][m] - SPANS[1];
      if (f >= 0) {
        f = f / (SPANS[2] - SPANS[1]);
        sc[3][m] = (1.0 - f) * sc[2][m] + f * sc[4][m];
      } else {
        f = -f / (SPANS[1] - SPANS[0]);
        sc[3][m] = (1.0 - f) * sc[2][m] + f * sc[0][m];
      }
    }
    smooth(x, sc[3], w, SPANS[0], -jper, vsmlsq, smo, h);
    return smo;
  }

  /**
   * Running-lines smoother with a symmetric window of span * n points.  When iper > 0 the
   * absolute cross-validated residuals are written to acvr.  Indices j, in and out are 1-based.
   */
  static void smooth(double[] x, double[] y, double[] w, double span, int iper,
      double vsmlsq, double[] smo, double[] acvr) {
    int n = y.length;
    double xm = 0;
    double ym = 0;
    double var = 0;
    double cvar = 0;
    double fbw = 0;
    int jper = Math.abs(iper);

    int ibw = (int) (0.5 * span * n + 0.5);
    if (ibw < 2) {
      ibw = 2;
    }
    int it = Math.min(2 * ibw + 1, n);

    for (int i = 1; i <= it; i++) {
      int j = i;
      if (jper == 2) {
        j = i - ibw - 1;
      }
      double xti;
      if (j < 1) {
        j = n + j;
        xti = x[j - 1] - 1.0;
      } else {
        xti = x[j - 1];
      }
      double wt = w[j - 1];
      double fbo = fbw;
      fbw += wt;
      if (fbw > 0) {
        xm = (fbo * xm + wt * xti) / fbw;
        ym = (fbo * ym + wt * y[j - 1]) / fbw;
      }
      double tmp = 0;
      if (fbo > 0) {
        tmp = fbw * wt * (xti - xm) / fbo;
      }
      var += tmp * (xti - xm);
      cvar += tmp * (y[j - 1] - ym);
    }

    for (int j = 1; j <= n; j++) {
      int out = j - ibw - 1;
      int in = j + ibw;
      if (jper == 2 || (out >= 1 && in <= n)) {
        double xto;
        double xti;
        if (out < 1) {
          out = n + out;
          xto = x[out - 1] - 1.0;
          xti = x[in - 1];
        } else if (in > n) {
          in = in - n;
          xti = x[in - 1] + 1.0;
          xto = x[out - 1];
        } else {
          xto = x[out - 1];
          xti = x[in - 1];
        }

        // drop the point leaving the window
        double wt = w[out - 1];
        double fbo = fbw;
        fbw -= wt;
        double tmp = 0;
        if (fbw > 0) {
          tmp = fbo * wt * (xto - xm) / fbw;
        }
        var -= tmp * (xto - xm);
        cvar -= tmp * (y[out - 1] - ym);
        if (fbw > 0) {
          xm = (fbo * xm - wt * xto) / fbw;
          ym = (fbo * ym - wt * y[out - 1]) / fbw;
        }

        // add the point entering it
        wt = w[in - 1];
        fbo = fbw;
        fbw += wt;
        if (fbw > 0) {
          xm = (fbo * xm + wt * xti) / fbw;
          ym = (fbo * ym + wt * y[in - 1]) / fbw;
        }
        tmp = 0;
        if (fbo > 0) {
          tmp = fbw * wt * (xti - xm) / fbo;
        }
        var += tmp * (xti - xm);
        cvar += tmp * (y[in - 1] - ym);
      }

      double a = 0;
      if (var > vsmlsq) {
        a = cvar / var;
      }
      smo[j - 1] = a * (x[j - 1] - xm) + ym;

      if (iper > 0) {
        double h = 0;
        if (fbw > 0) {
          h = 1.0 / fbw;
        }
        if (var > vsmlsq) {
          h += (x[j - 1] - xm) * (x[j - 1] - xm) / var;
        }
        acvr[j - 1] = 0;
        a = 1.0 - w[j - 1] * h;
        if (a > 0) {
          acvr[j - 1] = Math.abs(y[j - 1] - smo[j - 1]) / a;
        } else if (j > 1) {
          acvr[j - 1] = acvr[j - 2];
        }
      }
    }

    // points with tied abscissae share the average of their smooths
    int j = 1;
    while (j <= n) {
      int j0 = j;
      double sy = smo[j - 1] * w[j - 1];
      fbw = w[j - 1];
      while (j < n && x[j] <= x[j - 1]) {
        j++;
        sy += w[j - 1] * smo[j - 1];
        fbw += w[j - 1];
      }
      if (j > j0) {
        double a = fbw > 0 ? sy / fbw : 0;
        for (int i = j0; i <= j; i++) {
          smo[i - 1] = a;
        }
      }
      j++;
    }
  }
}
