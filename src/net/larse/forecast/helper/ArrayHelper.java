package net.larse.forecast.helper;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Sum the entries of array between start (incl) and end (excl), strictly left to right. if end
   * is negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static double sum(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    double sum = 0.0;
    for (int i = start; i < end; i++) {
      sum += array[i];
    }
    return sum;
  }

  /**
   * Arithmetic mean of the entries between start (incl) and end (excl), using {@link #sum}. The
   * summation order is fixed so that equal inputs always give bit-identical results.
   */
  public static double mean(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    if (end <= start) {
      throw new IllegalArgumentException(
          String.format("Empty range [%d, %d) has no mean", start, end));
    }
    return sum(array, start, end) / (end - start);
  }

  /**
   * Returns true if the entries of array between start (incl) and end (excl) are strictly
   * increasing. if end is negative, it is taken as the number of entries from the end.
   */
  public static boolean isStrictlyIncreasing(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    for (int i = start + 1; i < end; i++) {
      if (!(array[i - 1] < array[i])) {
        return false;
      }
    }
    return true;
  }
}
