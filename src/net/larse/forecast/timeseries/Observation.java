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

import com.google.common.base.MoreObjects;

/**
 * A single (timestamp, value) entry of a {@link TimeSeries}. Observations are ordered by their
 * timestamp only.
 */
public final class Observation implements Comparable<Observation> {
  private final double timestamp;
  private final double value;

  public Observation(double timestamp, double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  public double getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  @Override
  public int compareTo(Observation other) {
    return Double.compare(timestamp, other.timestamp);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Observation)) {
      return false;
    }
    Observation that = (Observation) o;
    return Double.compare(timestamp, that.timestamp) == 0
        && Double.compare(value, that.value) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(timestamp) + Double.hashCode(value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("timestamp", timestamp)
        .add("value", value)
        .toString();
  }
}
