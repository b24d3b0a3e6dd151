package net.larse.weekly.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Random;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OrdinaryLeastSquaresTest {

  private static DenseMatrix64F design(int n, int p, long seed) {
    Random random = new Random(seed);
    DenseMatrix64F x = new DenseMatrix64F(n, p);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < p; j++) {
        x.set(i, j, random.nextGaussian());
      }
    }
    return x;
  }

  @Test
  public void testCriteria() {
    int n = 60;
    DenseMatrix64F x = design(n, 3, 2);
    Random random = new Random(9);
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = x.get(i, 0) - 0.5 * x.get(i, 2) + random.nextGaussian();
    }
    RegressionModel model = OrdinaryLeastSquares.fit(x, y, Arrays.asList("a", "b", "c"));

    double rss = model.getResidualSumOfSquares();
    double logLik = -0.5 * n * (Math.log(2 * Math.PI) + Math.log(rss / n) + 1);
    assertEquals(logLik, model.logLikelihood(), 1e-9);
    assertEquals(-2 * logLik + 2 * 4, model.aic(), 1e-9);
    assertEquals(-2 * logLik + 2 * 4 + 2.0 * 3 * 4 / (n - 4), model.aicc(), 1e-9);
    assertEquals(-2 * logLik + Math.log(n) * 4, model.bic(), 1e-9);
    assertEquals(Math.sqrt(rss / (n - 3)), model.getSigma(), 1e-12);
    assertEquals("b", model.getLabels().get(1));

    double[] se = model.getStandardErrors();
    double[] t = model.getTStatistics();
    DenseMatrix64F covariance = model.getUnscaledCovariance();
    for (int j = 0; j < 3; j++) {
      assertEquals(model.getSigma() * Math.sqrt(covariance.get(j, j)), se[j], 1e-12);
      assertEquals(model.getCoefficients()[j] / se[j], t[j], 1e-9);
    }

    double[] fitted = model.getFitted();
    double[] residuals = model.getResiduals();
    for (int i = 0; i < n; i++) {
      assertEquals(y[i], fitted[i] + residuals[i], 1e-12);
    }
  }

  @Test
  public void testTStatistics() {
    int n = 40;
    DenseMatrix64F x = design(n, 2, 4);
    Random random = new Random(1);
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = 10 * x.get(i, 0) + 0.1 * random.nextGaussian();
    }
    double[] t = OrdinaryLeastSquares.fit(x, y).getTStatistics();
    assertTrue(Math.abs(t[0]) > 100);
    assertTrue(Math.abs(t[1]) < 10);
  }

  @Test
  public void testEmptyDesign() {
    double[] y = {1, 2, 3};
    RegressionModel model = OrdinaryLeastSquares.fit(new DenseMatrix64F(3, 0), y);
    assertEquals(0, model.getNumParameters());
    assertEquals(14, model.getResidualSumOfSquares(), 0);
  }

  @Test(expected = SingularDesignException.class)
  public void testRankDeficient() {
    DenseMatrix64F x = design(20, 2, 8);
    for (int i = 0; i < 20; i++) {
      x.set(i, 1, 3 * x.get(i, 0));
    }
    OrdinaryLeastSquares.fit(x, new double[20]);
  }

  @Test(expected = SingularDesignException.class)
  public void testTooFewRows() {
    OrdinaryLeastSquares.fit(design(3, 3, 1), new double[3]);
  }

  @Test
  public void testSmallSampleCorrectionInfinite() {
    // n - p - 1 == 0
    RegressionModel model = OrdinaryLeastSquares.fit(design(4, 3, 6), new double[] {1, -1, 2, 0});
    assertEquals(Double.POSITIVE_INFINITY, model.aicc(), 0);
  }
}
