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
package net.larse.forecast.timeseries;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import net.larse.forecast.helper.ArrayHelper;
import net.larse.forecast.methods.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * An ordered sequence of (timestamp, value) observations.
 *
 * A series is built from pairs or entry by entry and never sorted or validated on its own.
 * {@link #sort()} and {@link #normalize(Granularity)} prepare it in place for methods that need a
 * sorted or regularly spaced input. Methods themselves never change the series they are applied
 * to; {@link #apply(Method)} always returns a new series.
 *
 * This class is not thread safe.
 */
public class TimeSeries implements Iterable<Observation> {
  private static final Logger logger = LoggerFactory.getLogger(TimeSeries.class);

  private final DoubleArrayList timestamps;
  private final DoubleArrayList values;
  private Granularity granularity;

  public TimeSeries() {
    this.timestamps = new DoubleArrayList();
    this.values = new DoubleArrayList();
  }

  private TimeSeries(double[] timestamps, double[] values) {
    this.timestamps = new DoubleArrayList(timestamps);
    this.values = new DoubleArrayList(values);
  }

  /**
   * Builds a series from a list of {timestamp, value} pairs, in the given order.
   *
   * @param pairs each entry must hold exactly two numbers
   */
  public static TimeSeries fromTwoDimList(double[][] pairs) {
    TimeSeries series = new TimeSeries();
    for (double[] pair : pairs) {
      Preconditions.checkArgument(pair.length == 2,
          "Expected a (timestamp, value) pair but got %s numbers", pair.length);
      series.addEntry(pair[0], pair[1]);
    }
    return series;
  }

  /** Builds a series from parallel timestamp and value arrays, in the given order. */
  public static TimeSeries fromPairs(double[] timestamps, double[] values) {
    Preconditions.checkArgument(timestamps.length == values.length,
        "Got %s timestamps but %s values", timestamps.length, values.length);
    return new TimeSeries(timestamps, values);
  }

  public TimeSeries addEntry(double timestamp, double value) {
    timestamps.add(timestamp);
    values.add(value);
    granularity = null;
    return this;
  }

  public int size() {
    return timestamps.size();
  }

  public boolean isEmpty() {
    return timestamps.isEmpty();
  }

  /**
   * @throws IndexOutOfBoundsException if index is not in [0, size)
   */
  public Observation get(int index) {
    return new Observation(timestamps.getDouble(index), values.getDouble(index));
  }

  public double getTimestamp(int index) {
    return timestamps.getDouble(index);
  }

  public double getValue(int index) {
    return values.getDouble(index);
  }

  /** A copy of the timestamps. */
  public double[] getTimestamps() {
    return timestamps.toDoubleArray();
  }

  /** A copy of the values. */
  public double[] getValues() {
    return values.toDoubleArray();
  }

  /** True if the timestamps are strictly increasing. */
  public boolean isSorted() {
    return ArrayHelper.isStrictlyIncreasing(timestamps.elements(), 0, size());
  }

  /** True if the series lies on a uniform grid since its last successful normalization. */
  public boolean isNormalized() {
    return granularity != null;
  }

  /** The grid the series was normalized to, or null. */
  public Granularity getGranularity() {
    return granularity;
  }

  public TimeSeries sort() {
    return sort(true);
  }

  /** Stable sort of the observations by timestamp. */
  public TimeSeries sort(boolean ascending) {
    final double[] t = getTimestamps();
    final double[] v = getValues();
    int[] order = new int[t.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    IntArrays.stableSort(order, (a, b) ->
        ascending ? Double.compare(t[a], t[b]) : Double.compare(t[b], t[a]));

    timestamps.clear();
    values.clear();
    for (int i : order) {
      timestamps.add(t[i]);
      values.add(v[i]);
    }
    granularity = null;
    return this;
  }

  /**
   * Checks that consecutive observations are exactly one grid step apart and snaps every
   * timestamp to the start of its grid slot. An evenly spaced series that is offset from the grid
   * is accepted. Irregular spacing, missing or doubly occupied slots are rejected; use {@link
   * #normalize(Granularity, FusionMethod, InterpolationMethod)} to repair them instead.
   *
   * @throws IllegalArgumentException if the series is unsorted or not evenly spaced. The series is
   *     left unchanged in that case.
   */
  public TimeSeries normalize(Granularity granularity) {
    Preconditions.checkArgument(isSorted(), "Only sorted series can be normalized");
    double step = granularity.getSeconds();
    double[] snapped = new double[size()];
    for (int i = 0; i < snapped.length; i++) {
      snapped[i] = granularity.floor(timestamps.getDouble(i));
      if (i > 0 && (timestamps.getDouble(i) - timestamps.getDouble(i - 1) != step
          || snapped[i] - snapped[i - 1] != step)) {
        throw new IllegalArgumentException(String.format(
            "Observations at %s and %s are not one %s apart", timestamps.getDouble(i - 1),
            timestamps.getDouble(i), granularity.name().toLowerCase(Locale.ROOT)));
      }
    }

    timestamps.clear();
    timestamps.addElements(0, snapped);
    this.granularity = granularity;
    return this;
  }

  /**
   * Moves the series onto the grid of the given granularity. Observations sharing a grid slot are
   * merged with fusionMethod; empty slots between the first and last observation are filled
   * according to interpolationMethod.
   *
   * @throws IllegalArgumentException if the series is not sorted in ascending order, or has an
   *     empty slot while interpolationMethod is {@link InterpolationMethod#NONE}. The series is
   *     left unchanged in that case.
   */
  public TimeSeries normalize(Granularity granularity, FusionMethod fusionMethod,
                              InterpolationMethod interpolationMethod) {
    for (int i = 1; i < size(); i++) {
      Preconditions.checkArgument(timestamps.getDouble(i - 1) <= timestamps.getDouble(i),
          "Only sorted series can be normalized");
    }
    if (isEmpty()) {
      this.granularity = granularity;
      return this;
    }

    // Fuse observations per slot.
    DoubleArrayList slots = new DoubleArrayList();
    DoubleArrayList fused = new DoubleArrayList();
    DoubleArrayList bucket = new DoubleArrayList();
    double currentSlot = granularity.floor(timestamps.getDouble(0));
    for (int i = 0; i < size(); i++) {
      double slot = granularity.floor(timestamps.getDouble(i));
      if (slot != currentSlot) {
        slots.add(currentSlot);
        fused.add(fuse(bucket, fusionMethod));
        bucket.clear();
        currentSlot = slot;
      }
      bucket.add(values.getDouble(i));
    }
    slots.add(currentSlot);
    fused.add(fuse(bucket, fusionMethod));

    // Walk the grid and fill the gaps.
    double step = granularity.getSeconds();
    DoubleArrayList gridTimestamps = new DoubleArrayList();
    DoubleArrayList gridValues = new DoubleArrayList();
    gridTimestamps.add(slots.getDouble(0));
    gridValues.add(fused.getDouble(0));
    for (int i = 1; i < slots.size(); i++) {
      double previous = slots.getDouble(i - 1);
      long missing = Math.round((slots.getDouble(i) - previous) / step) - 1;
      if (missing > 0) {
        if (interpolationMethod == InterpolationMethod.NONE) {
          throw new IllegalArgumentException(String.format(
              "%d empty %s slot(s) between %s and %s", missing,
              granularity.name().toLowerCase(Locale.ROOT), previous, slots.getDouble(i)));
        }
        double from = fused.getDouble(i - 1);
        double to = fused.getDouble(i);
        for (long k = 1; k <= missing; k++) {
          gridTimestamps.add(previous + k * step);
          gridValues.add(from + (to - from) * k / (missing + 1));
        }
        logger.debug("Interpolated {} empty slot(s) after {}", missing, previous);
      }
      gridTimestamps.add(slots.getDouble(i));
      gridValues.add(fused.getDouble(i));
    }

    timestamps.clear();
    values.clear();
    timestamps.addAll(gridTimestamps);
    values.addAll(gridValues);
    this.granularity = granularity;
    return this;
  }

  private static double fuse(DoubleArrayList bucket, FusionMethod fusionMethod) {
    if (bucket.size() == 1) {
      return bucket.getDouble(0);
    }
    return fusionMethod.fuse(bucket.toDoubleArray());
  }

  /**
   * Applies the method to this series.
   *
   * @return a new series holding the method's result
   * @throws UnsuitableSeriesException if the method needs a sorted or normalized series and this
   *     one is not
   */
  public TimeSeries apply(Method method) {
    if (method.hasToBeSorted() && !isSorted()) {
      throw new UnsuitableSeriesException(
          method.getClass().getSimpleName() + " requires a sorted time series");
    }
    if (method.hasToBeNormalized() && !isNormalized()) {
      throw new UnsuitableSeriesException(
          method.getClass().getSimpleName() + " requires a normalized time series");
    }
    logger.debug("Applying {} to a series of {} observations", method, size());
    return method.execute(this);
  }

  @Override
  public Iterator<Observation> iterator() {
    return new Iterator<Observation>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < size();
      }

      @Override
      public Observation next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return get(next++);
      }
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeSeries)) {
      return false;
    }
    TimeSeries that = (TimeSeries) o;
    // DoubleArrayList compares element wise with ==, which would treat NaN as unequal.
    if (size() != that.size()) {
      return false;
    }
    for (int i = 0; i < size(); i++) {
      if (Double.compare(timestamps.getDouble(i), that.timestamps.getDouble(i)) != 0
          || Double.compare(values.getDouble(i), that.values.getDouble(i)) != 0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = 1;
    for (int i = 0; i < size(); i++) {
      result = 31 * result + Double.hashCode(timestamps.getDouble(i));
      result = 31 * result + Double.hashCode(values.getDouble(i));
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("TimeSeries[");
    for (int i = 0; i < size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append('(').append(timestamps.getDouble(i)).append(", ")
          .append(values.getDouble(i)).append(')');
    }
    return sb.append(']').toString();
  }
}
