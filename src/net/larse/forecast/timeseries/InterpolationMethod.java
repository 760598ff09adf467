package net.larse.forecast.timeseries;

/** How empty grid slots are treated during normalization. */
public enum InterpolationMethod {
  /** Empty slots are an error. */
  NONE,
  /** Empty slots are filled on the line between the neighbouring filled slots. */
  LINEAR
}
