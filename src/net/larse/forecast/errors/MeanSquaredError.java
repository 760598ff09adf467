package net.larse.forecast.errors;

/** Mean of the squared differences between original and calculated values. */
public class MeanSquaredError extends ErrorMeasure {
  public MeanSquaredError(double minimalErrorCalculationPercentage) {
    super(minimalErrorCalculationPercentage);
  }

  @Override
  protected double localError(double originalValue, double calculatedValue) {
    double difference = originalValue - calculatedValue;
    return difference * difference;
  }
}
