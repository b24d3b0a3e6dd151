package net.larse.weekly.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import net.larse.weekly.helper.OrdinaryLeastSquares;
import net.larse.weekly.helper.RegressionModel;
import net.larse.weekly.helper.SingularDesignException;
import org.ejml.data.DenseMatrix64F;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OrderSelectorTest {
  private WeeklySeries series;
  private double[] y;

  @Before
  public void setUp() {
    LocalDate[] dates = SyntheticSeries.dates(156);
    y = SyntheticSeries.values(dates, 0, 0, 5, 1, 42, new int[0], 0);
    series = WeeklySeries.of(dates, y);
  }

  @Test
  public void testSelectedOrderMinimisesEachCriterion() {
    OrderSelection selection = OrderSelector.select(y, series, null, ImmutableList.of());
    for (InformationCriterion criterion : InformationCriterion.values()) {
      // evaluate every grid order on its own
      double min = Double.POSITIVE_INFINITY;
      for (HarmonicOrder order : HarmonicOrder.GRID) {
        DesignMatrix design = DesignMatrix.of(series, order, null, ImmutableList.of());
        double value;
        try {
          value = criterion.evaluate(OrdinaryLeastSquares.fit(design.getMatrix(), y));
        } catch (SingularDesignException e) {
          value = Double.POSITIVE_INFINITY;
        }
        min = Math.min(min, value);
      }
      HarmonicOrder selected = selection.get(criterion);
      DesignMatrix design = DesignMatrix.of(series, selected, null, ImmutableList.of());
      double atSelected = criterion.evaluate(OrdinaryLeastSquares.fit(design.getMatrix(), y));
      assertEquals(criterion + " at " + selected, min, atSelected, 1e-9);
    }
    assertFalse(selection.get(InformationCriterion.AICC).isZero());
    assertTrue(selection.get(InformationCriterion.AICC).getYearly() >= 6);
  }

  @Test
  public void testTiesGoToSmallestMonthlyOrder() {
    Map<InformationCriterion, double[][]> values = new EnumMap<>(InformationCriterion.class);
    for (InformationCriterion criterion : InformationCriterion.values()) {
      double[][] grid = new double[HarmonicOrder.gridRows()][HarmonicOrder.gridCols()];
      for (double[] row : grid) {
        Arrays.fill(row, 5);
      }
      // (0, 6) and (6, 0) tie; l = 0 is scanned first
      grid[0][1] = 1;
      grid[1][0] = 1;
      values.put(criterion, grid);
    }
    OrderSelection selection = new OrderSelection(values);
    assertEquals(HarmonicOrder.of(6, 0), selection.get(InformationCriterion.AICC));
    assertEquals(1, selection.getMinimum(InformationCriterion.BIC), 0);
  }

  @Test(expected = SingularDesignException.class)
  public void testZeroHolidayColumnFailsEveryOrder() {
    // a calendar with the same number of working days every week centres to zero
    DenseMatrix64F holidays = new DenseMatrix64F(y.length, 1);
    OrderSelector.select(y, series, holidays, ImmutableList.of());
  }

  @Test
  public void testValuesMatchDirectFit() {
    OrderSelection selection = OrderSelector.select(y, series, null, ImmutableList.of());
    HarmonicOrder order = HarmonicOrder.of(6, 6);
    DesignMatrix design = DesignMatrix.of(series, order, null, ImmutableList.of());
    RegressionModel model = OrdinaryLeastSquares.fit(design.getMatrix(), y);
    assertEquals(model.aic(), selection.getValue(InformationCriterion.AIC, order), 1e-9);
    assertEquals(model.aicc(), selection.getValue(InformationCriterion.AICC, order), 1e-9);
    assertEquals(model.bic(), selection.getValue(InformationCriterion.BIC, order), 1e-9);
  }

  @Test
  public void testOrdersBeyondTheSampleAreSkipped() {
    // 60 observations cannot support the 96 columns of (36, 12)
    LocalDate[] dates = SyntheticSeries.dates(60);
    double[] shortY = SyntheticSeries.values(dates, 0, 0, 5, 1, 1, new int[0], 0);
    OrderSelection selection =
        OrderSelector.select(shortY, WeeklySeries.of(dates, shortY), null, ImmutableList.of());
    assertEquals(Double.POSITIVE_INFINITY,
        selection.getValue(InformationCriterion.AICC, HarmonicOrder.of(36, 12)), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOffGridOrder() {
    OrderSelector.select(y, series, null, ImmutableList.of())
        .getValue(InformationCriterion.AIC, HarmonicOrder.of(5, 0));
  }
}
