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
package net.larse.forecast.methods;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import net.larse.forecast.timeseries.TimeSeries;
import net.larse.forecast.timeseries.UnsuitableSeriesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Double exponential smoothing after Holt, tracking a level and a trend.
 *
 * The level starts at the first value and the trend at the first increment. The second
 * observation only seeds the trend; every later one updates level and trend. Smoothed levels are
 * emitted half a step after the timestamp of the observation they include, and the forecast
 * extrapolates the final level linearly along the final trend.
 */
public final class HoltMethod implements Method {
  private static final Logger logger = LoggerFactory.getLogger(HoltMethod.class);

  public static class Args extends ArgsBase {
    @Doc(help = "Weight of a new observation against the trend-adjusted level, in [0, 1].")
    @Required
    double smoothingFactor;

    @Doc(help = "Weight of a new level increment against the current trend, in [0, 1].")
    @Required
    double trendSmoothingFactor;

    @Doc(help = "Number of values forecasted after the end of the series.")
    @Optional
    int valuesToForecast = 1;
  }

  private final double smoothingFactor;
  private final double trendSmoothingFactor;
  private final int valuesToForecast;

  public HoltMethod(double smoothingFactor, double trendSmoothingFactor) {
    this(smoothingFactor, trendSmoothingFactor, 1);
  }

  public HoltMethod(double smoothingFactor, double trendSmoothingFactor, int valuesToForecast) {
    this(args(smoothingFactor, trendSmoothingFactor, valuesToForecast));
  }

  public HoltMethod(Args args) {
    Preconditions.checkState(args.canBeExecuted(),
        "Missing required parameters %s", args.getMissingParameters());
    this.smoothingFactor = ArgsBase.checkUnitInterval("smoothingFactor", args.smoothingFactor);
    this.trendSmoothingFactor =
        ArgsBase.checkUnitInterval("trendSmoothingFactor", args.trendSmoothingFactor);
    this.valuesToForecast = ArgsBase.checkNonNegative("valuesToForecast", args.valuesToForecast);
  }

  private static Args args(double smoothingFactor, double trendSmoothingFactor,
                           int valuesToForecast) {
    Args args = new Args();
    args.smoothingFactor = smoothingFactor;
    args.trendSmoothingFactor = trendSmoothingFactor;
    args.valuesToForecast = valuesToForecast;
    args.markSet("smoothingFactor");
    args.markSet("trendSmoothingFactor");
    args.markSet("valuesToForecast");
    return args;
  }

  public double getSmoothingFactor() {
    return smoothingFactor;
  }

  public double getTrendSmoothingFactor() {
    return trendSmoothingFactor;
  }

  public int getValuesToForecast() {
    return valuesToForecast;
  }

  @Override
  public TimeSeries execute(TimeSeries series) {
    int n = series.size();
    if (n < 2) {
      throw new UnsuitableSeriesException(
          "Holt's method needs at least 2 observations but got " + n);
    }
    double[] t = series.getTimestamps();
    double[] v = series.getValues();

    TimeSeries result = new TimeSeries();
    double estimator = v[0];
    double trend = v[1] - v[0];
    double step = t[1] - t[0];
    double timestamp = t[1] + step / 2;
    result.addEntry(timestamp, estimator);
    logger.debug("Initial level {}, initial trend {}", estimator, trend);

    for (int i = 2; i < n; i++) {
      step = t[i] - t[i - 1];
      timestamp = t[i] + step / 2;

      double lastEstimator = estimator;
      estimator = smoothingFactor * v[i] + (1 - smoothingFactor) * (estimator + trend);
      trend = trendSmoothingFactor * (estimator - lastEstimator)
          + (1 - trendSmoothingFactor) * trend;
      result.addEntry(timestamp, estimator);
    }

    for (int h = 1; h <= valuesToForecast; h++) {
      result.addEntry(timestamp + h * step, estimator + h * trend);
    }
    return result;
  }

  @Override
  public boolean hasToBeSorted() {
    return true;
  }

  @Override
  public boolean hasToBeNormalized() {
    return true;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("smoothingFactor", smoothingFactor)
        .add("trendSmoothingFactor", trendSmoothingFactor)
        .add("valuesToForecast", valuesToForecast)
        .toString();
  }
}
