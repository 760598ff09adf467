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
package net.larse.forecast.errors;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.doubles.Double2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import net.larse.forecast.timeseries.TimeSeries;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of accuracy measures comparing an original series with a smoothed or forecasted
 * one.
 *
 * {@link #initialize(TimeSeries, TimeSeries)} pairs observations with identical timestamps and
 * computes one local error per pair; {@link #getError()} aggregates the local errors.
 */
public abstract class ErrorMeasure {
  private static final Logger logger = LoggerFactory.getLogger(ErrorMeasure.class);

  private final double minimalErrorCalculationPercentage;
  private DoubleArrayList errorValues;

  /**
   * @param minimalErrorCalculationPercentage percentage in [0, 100] of the original observations
   *     that need a partner in the calculated series
   */
  protected ErrorMeasure(double minimalErrorCalculationPercentage) {
    Preconditions.checkArgument(
        minimalErrorCalculationPercentage >= 0.0 && minimalErrorCalculationPercentage <= 100.0,
        "minimalErrorCalculationPercentage has to be in [0, 100] but is %s",
        minimalErrorCalculationPercentage);
    this.minimalErrorCalculationPercentage = minimalErrorCalculationPercentage;
  }

  /**
   * Computes the local errors of all observations of original that have a partner with the same
   * timestamp in calculated.
   *
   * @throws IllegalArgumentException if too few observations could be paired
   */
  public void initialize(TimeSeries original, TimeSeries calculated) {
    Double2DoubleOpenHashMap calculatedValues = new Double2DoubleOpenHashMap(calculated.size());
    for (int i = 0; i < calculated.size(); i++) {
      calculatedValues.put(calculated.getTimestamp(i), calculated.getValue(i));
    }

    DoubleArrayList errors = new DoubleArrayList(original.size());
    for (int i = 0; i < original.size(); i++) {
      double timestamp = original.getTimestamp(i);
      if (calculatedValues.containsKey(timestamp)) {
        errors.add(localError(original.getValue(i), calculatedValues.get(timestamp)));
      }
    }

    double required = original.size() * minimalErrorCalculationPercentage / 100.0;
    if (errors.size() < required) {
      throw new IllegalArgumentException(String.format(
          "Only %d of %d observations could be compared, %s%% are required", errors.size(),
          original.size(), minimalErrorCalculationPercentage));
    }
    logger.debug("Compared {} of {} observations", errors.size(), original.size());
    this.errorValues = errors;
  }

  /** The mean of all local errors. */
  public double getError() {
    return getError(0.0, 100.0);
  }

  /**
   * The mean of the local errors between two positions given as percentages of the compared
   * observations.
   *
   * @throws IllegalStateException before {@link #initialize}
   */
  public double getError(double startingPercentage, double endPercentage) {
    Preconditions.checkState(errorValues != null, "The error measure is not initialized");
    Preconditions.checkArgument(
        0.0 <= startingPercentage && startingPercentage < endPercentage && endPercentage <= 100.0,
        "Invalid percentage range [%s, %s]", startingPercentage, endPercentage);
    int start = (int) Math.floor(errorValues.size() * startingPercentage / 100.0);
    int end = (int) Math.ceil(errorValues.size() * endPercentage / 100.0);
    return new Mean().evaluate(errorValues.elements(), start, end - start);
  }

  /** The error of a single calculated value against its original. */
  protected abstract double localError(double originalValue, double calculatedValue);
}
