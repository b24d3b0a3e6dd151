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
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.larse.weekly.helper.ArrayHelper;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;

/**
 * A complete weekly series: strictly increasing dates spaced exactly seven days apart, and one
 * finite value per date.  Instances are immutable.
 */
public final class WeeklySeries {
  public static final int DAYS_PER_WEEK = 7;

  private final LocalDate[] dates;
  private final double[] values;
  private final int[] years;
  // distinct years, ascending
  private final int[] distinctYears;

  private WeeklySeries(LocalDate[] dates, double[] values) {
    this.dates = dates;
    this.values = values;
    this.years = new int[dates.length];
    IntArrayList distinct = new IntArrayList();
    for (int i = 0; i < dates.length; i++) {
      years[i] = dates[i].getYear();
      if (distinct.isEmpty() || distinct.getInt(distinct.size() - 1) != years[i]) {
        distinct.add(years[i]);
      }
    }
    this.distinctYears = distinct.toIntArray();
  }

  /**
   * Validates and copies the input.
   *
   * @throws IllegalArgumentException if the arrays differ in length, a date is missing, dates
   *     are not strictly increasing in steps of seven days, or a value is not finite
   */
  public static WeeklySeries of(LocalDate[] dates, double[] values) {
    Preconditions.checkArgument(dates != null && values != null, "dates and values are required");
    Preconditions.checkArgument(dates.length == values.length,
        "%s dates but %s values", dates.length, values.length);
    Preconditions.checkArgument(dates.length > 0, "empty series");
    for (int i = 0; i < dates.length; i++) {
      Preconditions.checkArgument(dates[i] != null, "date %s is null", i);
      Preconditions.checkArgument(!Double.isNaN(values[i]) && !Double.isInfinite(values[i]),
          "value at %s is not finite", dates[i]);
      if (i > 0) {
        Preconditions.checkArgument(dates[i].isAfter(dates[i - 1]),
            "dates must be unique and ascending: %s follows %s", dates[i], dates[i - 1]);
        long gap = ChronoUnit.DAYS.between(dates[i - 1], dates[i]);
        Preconditions.checkArgument(gap == DAYS_PER_WEEK,
            "dates must be %s days apart: %s follows %s", DAYS_PER_WEEK, dates[i], dates[i - 1]);
      }
    }
    return new WeeklySeries(dates.clone(), values.clone());
  }

  /** The same dates with different values. */
  public WeeklySeries withValues(double[] newValues) {
    Preconditions.checkArgument(newValues.length == values.length,
        "%s values for %s dates", newValues.length, values.length);
    Preconditions.checkArgument(ArrayHelper.allFinite(newValues),
        "values must be finite");
    return new WeeklySeries(dates, newValues.clone());
  }

  public int size() {
    return dates.length;
  }

  public LocalDate getDate(int row) {
    return dates[row];
  }

  public LocalDate[] getDates() {
    return dates.clone();
  }

  public double[] getValues() {
    return values.clone();
  }

  public int yearOf(int row) {
    return years[row];
  }

  /** Distinct calendar years in ascending order. */
  public int[] getYears() {
    return distinctYears.clone();
  }

  /** Rows whose date falls in the given year. */
  public int[] rowsOf(int year) {
    IntArrayList rows = new IntArrayList();
    for (int i = 0; i < years.length; i++) {
      if (years[i] == year) {
        rows.add(i);
      }
    }
    return rows.toIntArray();
  }

  /** Row of the given date, or -1 if the series does not contain it. */
  public int indexOf(LocalDate date) {
    int idx = Arrays.binarySearch(dates, date);
    return idx >= 0 ? idx : -1;
  }

  public boolean contains(LocalDate date) {
    return indexOf(date) >= 0;
  }
}
