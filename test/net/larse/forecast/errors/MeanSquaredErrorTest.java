package net.larse.forecast.errors;

import net.larse.forecast.timeseries.TimeSeries;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class MeanSquaredErrorTest {
  TimeSeries original;

  @Before
  public void setUp() throws Exception {
    original = TimeSeries.fromTwoDimList(new double[][] {{0, 1.0}, {1, 2.0}, {2, 3.0}, {3, 4.0}});
  }

  @Test
  public void testError() {
    TimeSeries calculated = TimeSeries.fromTwoDimList(new double[][] {
        {0, 2.0}, {1, 2.0}, {2, 1.0}, {3, 5.0}, {4, 100.0}});

    MeanSquaredError mse = new MeanSquaredError(100);
    mse.initialize(original, calculated);

    // (1 + 0 + 4 + 1) / 4, the unmatched timestamp 4 is ignored
    assertEquals(1.5, mse.getError(), 1e-12);
    assertEquals(0.5, mse.getError(0, 50), 1e-12);
    assertEquals(2.5, mse.getError(50, 100), 1e-12);
  }

  @Test
  public void testPartialOverlap() {
    TimeSeries calculated = TimeSeries.fromTwoDimList(new double[][] {{2, 3.0}, {3, 6.0}});

    MeanSquaredError mse = new MeanSquaredError(50);
    mse.initialize(original, calculated);
    assertEquals(2.0, mse.getError(), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTooLittleOverlap() {
    TimeSeries calculated = TimeSeries.fromTwoDimList(new double[][] {{3, 6.0}});
    new MeanSquaredError(50).initialize(original, calculated);
  }

  @Test(expected = IllegalStateException.class)
  public void testNotInitialized() {
    new MeanSquaredError(100).getError();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidPercentage() {
    new MeanSquaredError(120);
  }
}
