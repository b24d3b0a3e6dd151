package net.larse.weekly.timeseries;

import static org.junit.Assert.assertEquals;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.function.Predicate;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TradingDaysTest {
  private static final Predicate<LocalDate> WEEKDAYS =
      d -> d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY;

  @Test
  public void testFullWeeksAreZero() {
    DenseMatrix64F td = TradingDays.workingDays(SyntheticSeries.dates(10), WEEKDAYS);
    assertEquals(10, td.numRows);
    assertEquals(1, td.numCols);
    for (int i = 0; i < 10; i++) {
      assertEquals(0, td.get(i, 0), 1e-12);
    }
  }

  @Test
  public void testHolidayWeek() {
    LocalDate holiday = LocalDate.of(2015, 1, 7);
    DenseMatrix64F td = TradingDays.workingDays(SyntheticSeries.dates(10),
        WEEKDAYS.and(d -> !d.equals(holiday)));
    // the week ending Sunday 2015-01-11 has four working days
    assertEquals(-1 + 0.1, td.get(1, 0), 1e-12);
    assertEquals(0.1, td.get(0, 0), 1e-12);
  }
}
