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

/**
 * Single (Brown) exponential smoothing.
 *
 * The level starts at the first value and moves towards every further observation by the
 * smoothing factor. For each observation after the first, the level known before it is emitted
 * half a step after its timestamp, so the smoothed part of the result is one observation shorter
 * than the input. The forecast continues the final level flat.
 */
public final class ExponentialSmoothing implements Method {
  public static class Args extends ArgsBase {
    @Doc(help = "Weight of a new observation against the current level, in [0, 1].")
    @Required
    double smoothingFactor;

    @Doc(help = "Number of values forecasted after the end of the series.")
    @Optional
    int valuesToForecast = 1;
  }

  private final double smoothingFactor;
  private final int valuesToForecast;

  public ExponentialSmoothing(double smoothingFactor) {
    this(smoothingFactor, 1);
  }

  public ExponentialSmoothing(double smoothingFactor, int valuesToForecast) {
    this(args(smoothingFactor, valuesToForecast));
  }

  public ExponentialSmoothing(Args args) {
    Preconditions.checkState(args.canBeExecuted(),
        "Missing required parameters %s", args.getMissingParameters());
    this.smoothingFactor = ArgsBase.checkUnitInterval("smoothingFactor", args.smoothingFactor);
    this.valuesToForecast = ArgsBase.checkNonNegative("valuesToForecast", args.valuesToForecast);
  }

  private static Args args(double smoothingFactor, int valuesToForecast) {
    Args args = new Args();
    args.smoothingFactor = smoothingFactor;
    args.valuesToForecast = valuesToForecast;
    args.markSet("smoothingFactor");
    args.markSet("valuesToForecast");
    return args;
  }

  public double getSmoothingFactor() {
    return smoothingFactor;
  }

  public int getValuesToForecast() {
    return valuesToForecast;
  }

  @Override
  public TimeSeries execute(TimeSeries series) {
    int n = series.size();
    if (n < 2) {
      throw new UnsuitableSeriesException(
          "Exponential smoothing needs at least 2 observations but got " + n);
    }
    double[] t = series.getTimestamps();
    double[] v = series.getValues();

    TimeSeries result = new TimeSeries();
    double estimator = v[0];
    double step = 0.0;
    double timestamp = t[0];
    for (int i = 1; i < n; i++) {
      step = t[i] - t[i - 1];
      timestamp = t[i] + step / 2;
      result.addEntry(timestamp, estimator);
      // Error correction form. The evaluation order shows in the last bits of the result.
      estimator = estimator + smoothingFactor * (v[i] - estimator);
    }

    for (int h = 1; h <= valuesToForecast; h++) {
      result.addEntry(timestamp + h * step, estimator);
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
        .add("valuesToForecast", valuesToForecast)
        .toString();
  }
}
