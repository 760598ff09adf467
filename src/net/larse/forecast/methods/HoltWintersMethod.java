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
import net.larse.forecast.timeseries.UnsuitableSeriesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Triple exponential smoothing after Holt and Winters, tracking a level, a trend and one seasonal
 * factor per phase of the season.
 *
 * Initialization:
 * <ul>
 *   <li>seasonal factors: per phase, the average over all complete seasons of the observation
 *       relative to its season's mean ({@link #initSeasonFactors}), unless preset values are
 *       configured,
 *   <li>trend: the average slope between observations one season apart ({@link
 *       #initialTrendSmoothingFactors}),
 *   <li>level: the first observation with its seasonal factor removed.
 * </ul>
 *
 * Every observation yields one smoothed observation at the same timestamp; the first one is
 * passed through. The forecast extrapolates level and trend and applies the seasonal factor of the
 * forecasted phase.
 */
public final class HoltWintersMethod implements Method {
  private static final Logger logger = LoggerFactory.getLogger(HoltWintersMethod.class);

  public static class Args extends ArgsBase {
    @Doc(help = "Weight of a deseasonalized observation against the trend-adjusted level.")
    @Optional
    double smoothingFactor = 0.1;

    @Doc(help = "Weight of a new level increment against the current trend.")
    @Optional
    double trendSmoothingFactor = 0.5;

    @Doc(help = "Weight of a new seasonal factor against the one of the previous season.")
    @Optional
    double seasonSmoothingFactor = 0.5;

    @Doc(help = "Number of observations in one season.")
    @Required
    int seasonLength;

    @Doc(help = "Number of values forecasted after the end of the series.")
    @Optional
    int valuesToForecast = 1;

    @Doc(help = "MULTIPLICATIVE or ADDITIVE seasonal factors.")
    @Optional
    SeasonalityType seasonality = SeasonalityType.MULTIPLICATIVE;

    @Doc(help = "Preset seasonal factors, one per phase. Estimated from the data if null.")
    @Optional
    double[] seasonValues = null;
  }

  private final double smoothingFactor;
  private final double trendSmoothingFactor;
  private final double seasonSmoothingFactor;
  private final int seasonLength;
  private final int valuesToForecast;
  private final SeasonalityType seasonality;
  private final double[] seasonValues;

  public HoltWintersMethod(int seasonLength) {
    this(0.1, 0.5, 0.5, seasonLength);
  }

  public HoltWintersMethod(double smoothingFactor, double trendSmoothingFactor,
                           double seasonSmoothingFactor, int seasonLength) {
    this(smoothingFactor, trendSmoothingFactor, seasonSmoothingFactor, seasonLength, 1);
  }

  public HoltWintersMethod(double smoothingFactor, double trendSmoothingFactor,
                           double seasonSmoothingFactor, int seasonLength,
                           int valuesToForecast) {
    this(args(smoothingFactor, trendSmoothingFactor, seasonSmoothingFactor, seasonLength,
        valuesToForecast));
  }

  public HoltWintersMethod(Args args) {
    Preconditions.checkState(args.canBeExecuted(),
        "Missing required parameters %s", args.getMissingParameters());
    this.smoothingFactor = ArgsBase.checkUnitInterval("smoothingFactor", args.smoothingFactor);
    this.trendSmoothingFactor =
        ArgsBase.checkUnitInterval("trendSmoothingFactor", args.trendSmoothingFactor);
    this.seasonSmoothingFactor =
        ArgsBase.checkUnitInterval("seasonSmoothingFactor", args.seasonSmoothingFactor);
    this.seasonLength = ArgsBase.checkPositive("seasonLength", args.seasonLength);
    this.valuesToForecast = ArgsBase.checkNonNegative("valuesToForecast", args.valuesToForecast);
    this.seasonality = Preconditions.checkNotNull(args.seasonality, "seasonality");
    if (args.seasonValues != null) {
      Preconditions.checkArgument(args.seasonValues.length == seasonLength,
          "Expected %s preset season values but got %s", seasonLength, args.seasonValues.length);
      if (seasonality == SeasonalityType.MULTIPLICATIVE) {
        for (double seasonValue : args.seasonValues) {
          Preconditions.checkArgument(seasonValue != 0.0,
              "Multiplicative season values must not be 0: %s",
              Arrays.toString(args.seasonValues));
        }
      }
      this.seasonValues = args.seasonValues.clone();
    } else {
      this.seasonValues = null;
    }
  }

  private static Args args(double smoothingFactor, double trendSmoothingFactor,
                           double seasonSmoothingFactor, int seasonLength, int valuesToForecast) {
    Args args = new Args();
    args.smoothingFactor = smoothingFactor;
    args.trendSmoothingFactor = trendSmoothingFactor;
    args.seasonSmoothingFactor = seasonSmoothingFactor;
    args.seasonLength = seasonLength;
    args.valuesToForecast = valuesToForecast;
    args.markSet("smoothingFactor");
    args.markSet("trendSmoothingFactor");
    args.markSet("seasonSmoothingFactor");
    args.markSet("seasonLength");
    args.markSet("valuesToForecast");
    return args;
  }

  public double getSmoothingFactor() {
    return smoothingFactor;
  }

  public double getTrendSmoothingFactor() {
    return trendSmoothingFactor;
  }

  public double getSeasonSmoothingFactor() {
    return seasonSmoothingFactor;
  }

  public int getSeasonLength() {
    return seasonLength;
  }

  public int getValuesToForecast() {
    return valuesToForecast;
  }

  public SeasonalityType getSeasonality() {
    return seasonality;
  }

  @Override
  public TimeSeries execute(TimeSeries series) {
    int n = series.size();
    if (n < seasonLength) {
      throw new UnsuitableSeriesException(String.format(
          "The time series must contain at least one full season of %d observations but has %d",
          seasonLength, n));
    }
    double[] t = series.getTimestamps();
    double[] v = series.getValues();

    double[] seasonFactors = initSeasonFactors(series);
    double trend = initialTrendSmoothingFactors(series);
    double estimator = seasonality.deseasonalize(v[0], seasonFactors[0]);
    logger.debug("Initial level {}, trend {}, season factors {}",
        estimator, trend, Arrays.toString(seasonFactors));

    TimeSeries result = new TimeSeries();
    result.addEntry(t[0], v[0]);
    for (int i = 1; i < n; i++) {
      int phase = i % seasonLength;
      double seasonFactor = seasonFactors[phase];
      double lastEstimator = estimator;

      estimator = smoothingFactor * seasonality.deseasonalize(v[i], seasonFactor)
          + (1 - smoothingFactor) * (lastEstimator + trend);
      trend = trendSmoothingFactor * (estimator - lastEstimator)
          + (1 - trendSmoothingFactor) * trend;
      seasonFactors[phase] = seasonSmoothingFactor * seasonality.seasonFactor(v[i], estimator)
          + (1 - seasonSmoothingFactor) * seasonFactor;

      result.addEntry(t[i], seasonality.reseasonalize(estimator, seasonFactors[phase]));
    }

    if (valuesToForecast > 0) {
      double step = forecastStep(series);
      for (int h = 1; h <= valuesToForecast; h++) {
        double seasonFactor = seasonFactors[(n - 1 + h) % seasonLength];
        result.addEntry(t[n - 1] + h * step,
            seasonality.reseasonalize(estimator + h * trend, seasonFactor));
      }
    }
    return result;
  }

  private static double forecastStep(TimeSeries series) {
    int n = series.size();
    if (n > 1) {
      return series.getTimestamp(n - 1) - series.getTimestamp(n - 2);
    }
    if (series.isNormalized()) {
      return series.getGranularity().getSeconds();
    }
    throw new UnsuitableSeriesException(
        "Cannot derive the forecast spacing from a single unnormalized observation");
  }

  /**
   * Estimates the level of season j as the mean of its observations.
   *
   * @param j zero based index of a complete season
   * @throws IndexOutOfBoundsException if season j is not completely contained in the series
   */
  public double computeA(int j, TimeSeries series) {
    int start = j * seasonLength;
    int end = start + seasonLength;
    if (j < 0 || end > series.size()) {
      throw new IndexOutOfBoundsException(String.format(
          "Season %d spans observations [%d, %d) of a series of %d", j, start, end,
          series.size()));
    }
    return ArrayHelper.mean(series.getValues(), start, end);
  }

  /**
   * Estimates the initial trend as the average slope between observations one season apart. With
   * less than two full seasons only the phases observed twice are compared. Without any such pair
   * the trend is 0.
   */
  public double initialTrendSmoothingFactors(TimeSeries series) {
    double[] v = series.getValues();
    int comparisons = Math.min(v.length - seasonLength, seasonLength);
    if (comparisons < 1) {
      logger.warn("No observation pair one season apart, using an initial trend of 0");
      return 0.0;
    }

    double result = 0.0;
    for (int i = 0; i < comparisons; i++) {
      result += (v[seasonLength + i] - v[i]) / seasonLength;
    }
    return result / comparisons;
  }

  /**
   * Returns one seasonal factor per phase: the preset values if configured, otherwise the average
   * over all complete seasons of each observation relative to its season's mean level.
   *
   * @return a new array of length seasonLength
   * @throws UnsuitableSeriesException if the series does not contain a complete season, or if a
   *     multiplicative factor cannot be derived because a season mean or a factor is 0
   */
  public double[] initSeasonFactors(TimeSeries series) {
    if (seasonValues != null) {
      return seasonValues.clone();
    }

    int completeCycles = series.size() / seasonLength;
    if (completeCycles < 1) {
      throw new UnsuitableSeriesException(String.format(
          "Seasonal factors need one full season of %d observations but got %d",
          seasonLength, series.size()));
    }

    double[] v = series.getValues();
    double[] levels = new double[completeCycles];
    for (int j = 0; j < completeCycles; j++) {
      levels[j] = computeA(j, series);
      if (levels[j] == 0.0 && seasonality == SeasonalityType.MULTIPLICATIVE) {
        throw new UnsuitableSeriesException(String.format(
            "Season %d has a mean of 0, multiplicative season factors are undefined", j));
      }
    }

    double[] factors = new double[seasonLength];
    for (int i = 0; i < seasonLength; i++) {
      double factor = 0.0;
      for (int j = 0; j < completeCycles; j++) {
        factor += seasonality.seasonFactor(v[seasonLength * j + i], levels[j]);
      }
      factors[i] = factor / completeCycles;
      if (factors[i] == 0.0 && seasonality == SeasonalityType.MULTIPLICATIVE) {
        throw new UnsuitableSeriesException(String.format(
            "Phase %d has a multiplicative season factor of 0", i));
      }
    }
    return factors;
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
        .add("seasonSmoothingFactor", seasonSmoothingFactor)
        .add("seasonLength", seasonLength)
        .add("valuesToForecast", valuesToForecast)
        .add("seasonality", seasonality)
        .toString();
  }
}
