package net.larse.ccd.helper;

import org.apache.commons.lang3.ArrayUtils;

/** Static array manipulation functions. */
public class ArrayHelper {
  /** Copy of array between start (incl) and end (excl). */
  public static double[] slice(double[] array, int start, int end) {
    return ArrayUtils.subarray(array, start, end);
  }

  /**
   * Copy of every band of [BANDS][NUM_OBSERVATIONS] data between start (incl) and end (excl).
   * All bands share the time axis, so they are always sliced together.
   */
  public static double[][] slice(double[][] bands, int start, int end) {
    double[][] result = new double[bands.length][];
    for (int b = 0; b < bands.length; b++) {
      result[b] = ArrayUtils.subarray(bands[b], start, end);
    }
    return result;
  }

  /** The elements of array at the given indices, in index order. */
  public static double[] select(double[] array, int[] indices) {
    double[] result = new double[indices.length];
    for (int i = 0; i < indices.length; i++) {
      result[i] = array[indices[i]];
    }
    return result;
  }

  /** Euclidean norm of (a - b). */
  public static double distance(double[] a, double[] b) {
    double sumSquares = 0;
    for (int i = 0; i < a.length; i++) {
      double diff = a[i] - b[i];
      sumSquares += diff * diff;
    }
    return Math.sqrt(sumSquares);
  }

  /** Count the number of occurrences of value in array. */
  public static int count(boolean value, boolean[] array) {
    int count = 0;
    for (boolean v : array) {
      if (v == value) {
        count++;
      }
    }
    return count;
  }

  public static String join(double[] array, String delimiter) {
    StringBuilder buffer = new StringBuilder();
    for (int i = 0; i < array.length; i++) {
      if (i > 0) {
        buffer.append(delimiter);
      }
      buffer.append(array[i]);
    }
    return buffer.toString();
  }
}
