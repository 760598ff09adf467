package net.larse.forecast.methods;

/**
 * How the seasonal factors of {@link HoltWintersMethod} combine with the level: as a ratio
 * (multiplicative) or as an offset (additive).
 */
public enum SeasonalityType {
  MULTIPLICATIVE {
    @Override
    double deseasonalize(double value, double seasonFactor) {
      return value / seasonFactor;
    }

    @Override
    double seasonFactor(double value, double level) {
      return value / level;
    }

    @Override
    double reseasonalize(double level, double seasonFactor) {
      return level * seasonFactor;
    }
  },
  ADDITIVE {
    @Override
    double deseasonalize(double value, double seasonFactor) {
      return value - seasonFactor;
    }

    @Override
    double seasonFactor(double value, double level) {
      return value - level;
    }

    @Override
    double reseasonalize(double level, double seasonFactor) {
      return level + seasonFactor;
    }
  };

  /** Removes the seasonal factor from an observed value. */
  abstract double deseasonalize(double value, double seasonFactor);

  /** The seasonal factor an observed value shows relative to a level. */
  abstract double seasonFactor(double value, double level);

  /** Applies a seasonal factor to a level. */
  abstract double reseasonalize(double level, double seasonFactor);
}
