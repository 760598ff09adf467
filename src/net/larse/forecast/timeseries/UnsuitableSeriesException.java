package net.larse.forecast.timeseries;

/**
 * Thrown when a series does not meet the requirements of the method applied to it, e.g. it is
 * not sorted, not normalized, or too short for the method's initialization.
 */
public class UnsuitableSeriesException extends IllegalArgumentException {
  private static final long serialVersionUID = 1;

  public UnsuitableSeriesException(String message) {
    super(message);
  }
}
