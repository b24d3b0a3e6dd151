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
import org.ejml.data.DenseMatrix64F;

import java.time.LocalDate;
import java.util.function.Predicate;

/**
 * Builds a working-day regressor for weekly data from a daily working-day calendar.
 *
 * <p>Each weekly date stands for the seven days ending on it.  The regressor is the number of
 * working days in that window, centred on its mean over the sample.  Which days count as working
 * days is up to the caller's calendar.
 */
public final class TradingDays {
  private TradingDays() {}

  /**
   * @param dates weekly dates of the series
   * @param isWorkingDay the caller's calendar
   * @return an n x 1 matrix suitable as (part of) the holiday regressors
   */
  public static DenseMatrix64F workingDays(LocalDate[] dates, Predicate<LocalDate> isWorkingDay) {
    Preconditions.checkArgument(dates.length > 0, "no dates");
    Preconditions.checkNotNull(isWorkingDay);

    double[] counts = new double[dates.length];
    double sum = 0;
    for (int i = 0; i < dates.length; i++) {
      int count = 0;
      for (int day = WeeklySeries.DAYS_PER_WEEK - 1; day >= 0; day--) {
        if (isWorkingDay.test(dates[i].minusDays(day))) {
          count++;
        }
      }
      counts[i] = count;
      sum += count;
    }

    double mean = sum / dates.length;
    DenseMatrix64F td = new DenseMatrix64F(dates.length, 1);
    for (int i = 0; i < dates.length; i++) {
      td.set(i, 0, counts[i] - mean);
    }
    return td;
  }
}
