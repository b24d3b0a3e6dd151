package net.larse.weekly.timeseries;

import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DesignMatrixTest {

  @Test
  public void testBlocks() {
    LocalDate[] dates = SyntheticSeries.dates(20);
    WeeklySeries series = WeeklySeries.of(dates, new double[20]);
    DenseMatrix64F holidays = new DenseMatrix64F(20, 1);
    holidays.set(4, 0, 1);

    DesignMatrix design = DesignMatrix.of(series, HarmonicOrder.of(1, 0), holidays,
        ImmutableList.of(dates[7], dates[3], dates[7], LocalDate.of(1999, 1, 1)));
    assertEquals(2, design.numHarmonic());
    assertEquals(1, design.numHoliday());
    assertEquals(2, design.numOutliers());
    assertEquals(2, design.holidayOffset());
    assertEquals(3, design.outlierOffset());
    assertEquals(ImmutableList.of(dates[7], dates[3]), design.getOutlierDates());
    assertEquals("H1", design.getLabels().get(2));
    assertEquals("AO " + dates[7], design.getLabels().get(3));

    DenseMatrix64F x = design.getMatrix();
    assertEquals(1, x.get(4, 2), 0);
    assertEquals(1, x.get(7, 3), 0);
    assertEquals(1, x.get(3, 4), 0);
    assertEquals(0, x.get(3, 3), 0);

    DesignMatrix augmented = design.withOutlierColumn(series, 12);
    assertEquals(6, augmented.numCols());
    assertEquals(1, augmented.getMatrix().get(12, 5), 0);
    assertEquals(dates[12], augmented.getOutlierDates().get(2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHolidayRowMismatch() {
    WeeklySeries series = WeeklySeries.of(SyntheticSeries.dates(20), new double[20]);
    DesignMatrix.of(series, HarmonicOrder.of(1, 0), new DenseMatrix64F(19, 1),
        ImmutableList.of());
  }
}
