package net.larse.weekly.timeseries;

import static org.junit.Assert.assertEquals;

import java.time.LocalDate;
import java.util.Arrays;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HarmonicBasisTest {

  @Test
  public void testColumnLayout() {
    LocalDate date = LocalDate.of(2020, 3, 15);
    HarmonicOrder order = HarmonicOrder.of(2, 1);
    DenseMatrix64F x = HarmonicBasis.build(order, new LocalDate[] {date});
    assertEquals(6, x.numCols);

    // 2020 is a leap year: day 75 of 366, day 15 of 31
    double ry = 2 * Math.PI * 75 / 366;
    double rm = 2 * Math.PI * 15 / 31;
    assertEquals(Math.sin(ry), x.get(0, 0), 1e-12);
    assertEquals(Math.sin(2 * ry), x.get(0, 1), 1e-12);
    assertEquals(Math.cos(ry), x.get(0, 2), 1e-12);
    assertEquals(Math.cos(2 * ry), x.get(0, 3), 1e-12);
    assertEquals(Math.sin(rm), x.get(0, 4), 1e-12);
    assertEquals(Math.cos(rm), x.get(0, 5), 1e-12);

    assertEquals(Arrays.asList("S(1/Ny)", "S(2/Ny)", "C(1/Ny)", "C(2/Ny)", "S(1/Nm)", "C(1/Nm)"),
        HarmonicBasis.labels(order));
  }

  @Test
  public void testEndOfPeriodClosesTheCycle() {
    LocalDate[] dates = {LocalDate.of(2020, 12, 31), LocalDate.of(2021, 2, 28)};
    DenseMatrix64F x = HarmonicBasis.build(HarmonicOrder.of(1, 1), dates);
    for (int row = 0; row < 2; row++) {
      assertEquals(0, x.get(row, 2), 1e-12);
      assertEquals(1, x.get(row, 3), 1e-12);
    }
    assertEquals(0, x.get(0, 0), 1e-12);
    assertEquals(1, x.get(0, 1), 1e-12);
  }

  @Test
  public void testZeroOrderHasNoColumns() {
    DenseMatrix64F x = HarmonicBasis.build(HarmonicOrder.NONE, SyntheticSeries.dates(5));
    assertEquals(5, x.numRows);
    assertEquals(0, x.numCols);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeOrder() {
    HarmonicOrder.of(-1, 0);
  }

  @Test
  public void testGrid() {
    assertEquals(21, HarmonicOrder.GRID.size());
    assertEquals(HarmonicOrder.NONE, HarmonicOrder.GRID.get(0));
    assertEquals(HarmonicOrder.of(0, 6), HarmonicOrder.GRID.get(1));
    assertEquals(HarmonicOrder.of(6, 0), HarmonicOrder.GRID.get(3));
    assertEquals(HarmonicOrder.of(36, 12), HarmonicOrder.GRID.get(20));
    assertEquals(96, HarmonicOrder.of(36, 12).numColumns());
  }
}
