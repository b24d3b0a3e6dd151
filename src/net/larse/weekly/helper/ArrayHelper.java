package net.larse.weekly.helper;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/** Static array manipulation functions. */
public class ArrayHelper {
  // Scales the median absolute residual to a normal-consistent standard deviation.
  public static final double ROBUST_SCALE_FACTOR = 1.49;

  /** Element-wise a - b. */
  public static double[] subtract(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length);
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] - b[i];
    }
    return result;
  }

  /** Element-wise a + b. */
  public static double[] add(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length);
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] + b[i];
    }
    return result;
  }

  public static double[] exp(double[] values) {
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = Math.exp(values[i]);
    }
    return result;
  }

  public static double[] log(double[] values) {
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = Math.log(values[i]);
    }
    return result;
  }

  public static double median(double[] values) {
    Preconditions.checkArgument(values.length > 0);
    return new Median().evaluate(values);
  }

  /** 1.49 times the median absolute value of the residuals. */
  public static double robustScale(double[] residuals) {
    double[] abs = new double[residuals.length];
    for (int i = 0; i < residuals.length; i++) {
      abs[i] = Math.abs(residuals[i]);
    }
    return ROBUST_SCALE_FACTOR * median(abs);
  }

  public static double maxAbs(double[] values) {
    double max = 0;
    for (double v : values) {
      max = Math.max(max, Math.abs(v));
    }
    return max;
  }

  /** Sample standard deviation. */
  public static double standardDeviation(double[] values) {
    return new StandardDeviation().evaluate(values);
  }

  /** Returns true if every element is neither NaN nor infinite. */
  public static boolean allFinite(double[] values) {
    for (double v : values) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        return false;
      }
    }
    return true;
  }
}
