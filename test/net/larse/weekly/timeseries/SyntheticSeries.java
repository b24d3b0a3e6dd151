package net.larse.weekly.timeseries;

import java.time.LocalDate;
import java.util.Random;

/**
 * Builds weekly test series: a linear trend, a yearly sine wave, Gaussian noise and spikes.
 */
public class SyntheticSeries {
  public static final LocalDate START = LocalDate.of(2015, 1, 4);

  public static LocalDate[] dates(int n) {
    LocalDate[] dates = new LocalDate[n];
    for (int i = 0; i < n; i++) {
      dates[i] = START.plusWeeks(i);
    }
    return dates;
  }

  /** sin(2 pi t / Ny) with t the day of year: the first yearly harmonic. */
  public static double yearlySine(LocalDate date) {
    return Math.sin(2 * Math.PI * date.getDayOfYear() / date.lengthOfYear());
  }

  /**
   * level + slope * i + amplitude * yearlySine + sigma * noise, plus spike at each spike row.
   */
  public static double[] values(LocalDate[] dates, double level, double slope, double amplitude,
      double sigma, long seed, int[] spikeRows, double spike) {
    Random random = new Random(seed);
    double[] x = new double[dates.length];
    for (int i = 0; i < dates.length; i++) {
      x[i] = level + slope * i + amplitude * yearlySine(dates[i]) + sigma * random.nextGaussian();
    }
    for (int row : spikeRows) {
      x[row] += spike;
    }
    return x;
  }

  public static double[] whiteNoise(int n, double sigma, long seed) {
    Random random = new Random(seed);
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = sigma * random.nextGaussian();
    }
    return x;
  }
}
