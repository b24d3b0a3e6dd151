package net.larse.weekly.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import net.larse.weekly.helper.ArrayHelper;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SuperSmootherTest {

  @Test
  public void testReproducesLine() {
    double[] y = new double[100];
    for (int i = 0; i < y.length; i++) {
      y[i] = 3 + 0.5 * i;
    }
    double[] smooth = new SuperSmoother().smooth(y);
    assertEquals(y.length, smooth.length);
    for (int i = 0; i < y.length; i++) {
      assertEquals(y[i], smooth[i], 1e-6);
    }
  }

  @Test
  public void testFixedSpanReproducesLine() {
    double[] y = new double[50];
    for (int i = 0; i < y.length; i++) {
      y[i] = -2 * i;
    }
    double[] smooth = new SuperSmoother(0.3, 0).smooth(y);
    for (int i = 0; i < y.length; i++) {
      assertEquals(y[i], smooth[i], 1e-6);
    }
  }

  @Test
  public void testReducesNoise() {
    double[] y = SyntheticSeries.whiteNoise(200, 1, 3);
    double[] smooth = new SuperSmoother().smooth(y);
    assertTrue(ArrayHelper.standardDeviation(smooth) < 0.6 * ArrayHelper.standardDeviation(y));
  }

  @Test
  public void testShortSeriesGivesMean() {
    double[] smooth = new SuperSmoother().smooth(new double[] {1, 2, 6});
    for (double v : smooth) {
      assertEquals(3, v, 1e-12);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadBass() {
    new SuperSmoother(0, 11);
  }
}
