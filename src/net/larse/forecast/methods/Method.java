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

import net.larse.forecast.timeseries.TimeSeries;

/**
 * A configured smoothing or forecasting method.
 *
 * Implementations are immutable once constructed. All working state of a run is local to {@link
 * #execute(TimeSeries)}, so one instance can be applied to any number of series, also
 * concurrently.
 */
public interface Method {
  /**
   * Runs the method on the series. The input is never modified.
   *
   * @return a new series holding the smoothed and forecasted observations
   * @throws net.larse.forecast.timeseries.UnsuitableSeriesException if the series is too short
   *     for the method's initialization
   */
  TimeSeries execute(TimeSeries series);

  /** True if the method requires strictly increasing timestamps. */
  boolean hasToBeSorted();

  /** True if the method requires timestamps on a uniform grid. */
  boolean hasToBeNormalized();
}
