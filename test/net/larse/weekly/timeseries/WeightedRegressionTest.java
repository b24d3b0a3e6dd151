package net.larse.weekly.timeseries;

import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.util.Random;
import net.larse.weekly.helper.SingularDesignException;
import org.ejml.data.DenseMatrix64F;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class WeightedRegressionTest {
  private LocalDate[] dates;
  private WeeklySeries series;
  private YearWeights weights;

  @Before
  public void setUp() {
    dates = SyntheticSeries.dates(156);
    series = WeeklySeries.of(dates, new double[dates.length]);
    weights = YearWeights.of(series, 0.8);
  }

  @Test
  public void testExactComponents() {
    Random random = new Random(11);
    DenseMatrix64F holidays = new DenseMatrix64F(dates.length, 1);
    double[] y = new double[dates.length];
    for (int i = 0; i < y.length; i++) {
      holidays.set(i, 0, random.nextGaussian());
      y[i] = 3 * SyntheticSeries.yearlySine(dates[i]) + 2 * holidays.get(i, 0);
    }
    int outlierRow = 40;
    y[outlierRow] += 5;

    DesignMatrix design = DesignMatrix.of(series, HarmonicOrder.of(1, 0), holidays,
        ImmutableList.of(dates[outlierRow]));
    SeasonalFactors factors = WeightedRegression.fit(y, series, design, weights);

    double[] seasonal = factors.getSeasonal();
    double[] holiday = factors.getHoliday();
    double[] outlier = factors.getOutlier();
    for (int i = 0; i < y.length; i++) {
      assertEquals(2 * holidays.get(i, 0), holiday[i], 1e-8);
      assertEquals(y[i], seasonal[i] + outlier[i], 1e-8);
      assertEquals(i == outlierRow ? 5 : 0, outlier[i], 1e-8);
    }
    assertEquals(4, factors.getCoefficients(2016).length);
    assertEquals(3, factors.getLastCoefficients()[0], 1e-8);
  }

  @Test
  public void testHarmonicOnly() {
    double[] y = new double[dates.length];
    for (int i = 0; i < y.length; i++) {
      y[i] = SyntheticSeries.yearlySine(dates[i]);
    }
    SeasonalFactors factors = WeightedRegression.fit(y, series,
        DesignMatrix.of(series, HarmonicOrder.of(2, 0), null, ImmutableList.of()), weights);
    double[] seasonal = factors.getSeasonal();
    double[] holiday = factors.getHoliday();
    double[] outlier = factors.getOutlier();
    for (int i = 0; i < y.length; i++) {
      assertEquals(0, holiday[i], 0);
      assertEquals(0, outlier[i], 0);
      assertEquals(y[i], seasonal[i], 1e-8);
    }
  }

  @Test(expected = SingularDesignException.class)
  public void testSingularDesign() {
    DenseMatrix64F holidays = new DenseMatrix64F(dates.length, 2);
    for (int i = 0; i < dates.length; i++) {
      holidays.set(i, 0, i % 3);
      holidays.set(i, 1, i % 3);
    }
    WeightedRegression.fit(new double[dates.length], series,
        DesignMatrix.of(series, HarmonicOrder.of(1, 0), holidays, ImmutableList.of()), weights);
  }
}
