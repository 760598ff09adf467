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
import net.larse.forecast.helper.ArrayHelper;
import net.larse.forecast.timeseries.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unweighted moving average over a window of consecutive observations.
 *
 * Every full window yields one observation whose value is the mean of the window's values and
 * whose timestamp is the mean of its timestamps, shifted by half a step. A window larger than the
 * series yields an empty result.
 */
public final class SimpleMovingAverage implements Method {
  private static final Logger logger = LoggerFactory.getLogger(SimpleMovingAverage.class);

  public static class Args extends ArgsBase {
    @Doc(help = "Number of consecutive observations averaged into one value.")
    @Required
    int windowSize;
  }

  private final int windowSize;

  public SimpleMovingAverage(int windowSize) {
    this(args(windowSize));
  }

  public SimpleMovingAverage(Args args) {
    Preconditions.checkState(args.canBeExecuted(),
        "Missing required parameters %s", args.getMissingParameters());
    this.windowSize = ArgsBase.checkPositive("windowSize", args.windowSize);
  }

  private static Args args(int windowSize) {
    Args args = new Args();
    args.windowSize = windowSize;
    args.markSet("windowSize");
    return args;
  }

  public int getWindowSize() {
    return windowSize;
  }

  @Override
  public TimeSeries execute(TimeSeries series) {
    TimeSeries result = new TimeSeries();
    int n = series.size();
    if (windowSize > n) {
      logger.debug("Window of {} does not fit into {} observations", windowSize, n);
      return result;
    }

    double[] t = series.getTimestamps();
    double[] v = series.getValues();
    for (int start = 0; start + windowSize <= n; start++) {
      int end = start + windowSize;
      double halfStep = windowSize > 1 ? (t[end - 1] - t[end - 2]) / 2 : 0.0;
      result.addEntry(ArrayHelper.mean(t, start, end) + halfStep, ArrayHelper.mean(v, start, end));
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
    return MoreObjects.toStringHelper(this).add("windowSize", windowSize).toString();
  }
}
