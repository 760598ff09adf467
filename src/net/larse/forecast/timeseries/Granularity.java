package net.larse.forecast.timeseries;

/**
 * Grid units a {@link TimeSeries} can be normalized to. Timestamps are interpreted as seconds.
 */
public enum Granularity {
  SECOND(1),
  MINUTE(60),
  HOUR(60 * 60),
  DAY(24 * 60 * 60),
  WEEK(7 * 24 * 60 * 60);

  private final double seconds;

  Granularity(double seconds) {
    this.seconds = seconds;
  }

  /** Length of one grid step, in seconds. */
  public double getSeconds() {
    return seconds;
  }

  /** Snaps a timestamp down to the start of its grid slot. */
  public double floor(double timestamp) {
    return Math.floor(timestamp / seconds) * seconds;
  }
}
