package net.larse.forecast.methods;

import net.larse.forecast.errors.MeanSquaredError;
import net.larse.forecast.timeseries.Granularity;
import net.larse.forecast.timeseries.TimeSeries;
import net.larse.forecast.timeseries.UnsuitableSeriesException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class HoltWintersMethodTest {
  double[] data;
  TimeSeries tsSrc;

  @Before
  public void setUp() throws Exception {
    data = new double[] {362.0, 385.0, 432.0, 341.0, 382.0, 409.0, 498.0, 387.0, 473.0, 513.0,
        582.0, 474.0, 544.0, 582.0, 681.0, 557.0, 628.0, 707.0, 773.0, 592.0, 627.0, 725.0,
        854.0, 661.0};
    tsSrc = series(data);
  }

  @After
  public void tearDown() throws Exception {
    data = null;
    tsSrc = null;
  }

  private static TimeSeries series(double[] values) {
    TimeSeries series = new TimeSeries();
    for (int i = 0; i < values.length; i++) {
      series.addEntry(i, values[i]);
    }
    return series;
  }

  @Test
  public void testInitialization() {
    new HoltWintersMethod(0.2, 0.3, 0.4, 5);
    new HoltWintersMethod(0.0, 1.0, 0.0, 1);

    for (double alpha : new double[] {-0.1, 0.81, 1.1}) {
      for (double beta : new double[] {-1.4, 0.12, 3.2}) {
        for (double gamma : new double[] {-0.05, 1.3}) {
          try {
            new HoltWintersMethod(alpha, beta, gamma, 4);
            fail(String.format("(%s, %s, %s) should have been rejected", alpha, beta, gamma));
          } catch (IllegalArgumentException e) {
            // expected
          }
        }
      }
    }
  }

  @Test
  public void testGetters() {
    HoltWintersMethod hwm = new HoltWintersMethod(0.2, 0.3, 0.4, 5, 7);
    assertEquals(0.2, hwm.getSmoothingFactor(), 0.0);
    assertEquals(0.3, hwm.getTrendSmoothingFactor(), 0.0);
    assertEquals(0.4, hwm.getSeasonSmoothingFactor(), 0.0);
    assertEquals(5, hwm.getSeasonLength());
    assertEquals(7, hwm.getValuesToForecast());
    assertEquals(SeasonalityType.MULTIPLICATIVE, hwm.getSeasonality());

    HoltWintersMethod defaults = new HoltWintersMethod(4);
    assertEquals(0.1, defaults.getSmoothingFactor(), 0.0);
    assertEquals(0.5, defaults.getTrendSmoothingFactor(), 0.0);
    assertEquals(0.5, defaults.getSeasonSmoothingFactor(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveSeasonLength() {
    new HoltWintersMethod(0);
  }

  @Test(expected = IllegalStateException.class)
  public void testSeasonLengthIsRequired() {
    HoltWintersMethod.Args args = new HoltWintersMethod.Args();
    args.setParameter("smoothingFactor", 0.3);
    new HoltWintersMethod(args);
  }

  @Test
  public void testSanity() {
    HoltWintersMethod hwm = new HoltWintersMethod(2);
    try {
      hwm.execute(TimeSeries.fromTwoDimList(new double[][] {{0.0, 152}}));
      fail("a series shorter than one season should have been rejected");
    } catch (UnsuitableSeriesException e) {
      // expected
    }
  }

  @Test
  public void testSmoothing() {
    HoltWintersMethod hwm = new HoltWintersMethod(.7556, 0.0000001, .9837, 4);

    assertEquals(510.5, hwm.computeA(2, tsSrc), 0.0);
    assertEquals(9.75, hwm.initialTrendSmoothingFactors(tsSrc), 0.0);

    TimeSeries res = hwm.execute(tsSrc);
    assertEquals(data.length + 1, res.size());

    MeanSquaredError mse = new MeanSquaredError(100);
    mse.initialize(tsSrc, res);
    assertTrue("error was " + mse.getError(), mse.getError() < 520);
  }

  @Test
  public void testApplyOnNormalizedSeries() {
    tsSrc.normalize(Granularity.SECOND);
    TimeSeries res = tsSrc.apply(new HoltWintersMethod(.7556, 0.0000001, .9837, 4, 8));

    assertEquals(data.length + 8, res.size());
    assertEquals(data[0], res.getValue(0), 0.0);
    assertEquals(31.0, res.getTimestamp(res.size() - 1), 0.0);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testComputeABeyondSeries() {
    new HoltWintersMethod(4).computeA(6, tsSrc);
  }

  @Test
  public void testSeasonFactorInitialization() {
    HoltWintersMethod hwm = new HoltWintersMethod(4);
    TimeSeries threeSeasons = series(Arrays.copyOf(data, 12));

    double[] seasonValues = hwm.initSeasonFactors(threeSeasons);

    assertArrayEquals(new double[] {0.9302895649920525, 0.9980629019785198, 1.1551483413078523,
        0.9164991917215755}, seasonValues, 1e-12);
    double sum = 0.0;
    for (double seasonValue : seasonValues) {
      sum += seasonValue;
    }
    assertEquals(4.0, sum, 1e-9);
  }

  @Test
  public void testPresetSeasonValues() {
    HoltWintersMethod.Args args = new HoltWintersMethod.Args();
    args.setParameter("seasonLength", 4);
    args.setParameter("seasonValues", new double[] {1.0, 1.1, 0.9, 1.0});
    HoltWintersMethod hwm = new HoltWintersMethod(args);

    assertArrayEquals(new double[] {1.0, 1.1, 0.9, 1.0}, hwm.initSeasonFactors(tsSrc), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPresetSeasonValuesOfWrongLength() {
    HoltWintersMethod.Args args = new HoltWintersMethod.Args();
    args.setParameter("seasonLength", 4);
    args.setParameter("seasonValues", new double[] {1.0, 1.0});
    new HoltWintersMethod(args);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroMultiplicativePresetSeasonValue() {
    HoltWintersMethod.Args args = new HoltWintersMethod.Args();
    args.setParameter("seasonLength", 4);
    args.setParameter("seasonValues", new double[] {1.0, 0.0, 1.5, 1.5});
    new HoltWintersMethod(args);
  }

  @Test
  public void testZeroAdditivePresetSeasonValue() {
    HoltWintersMethod.Args args = new HoltWintersMethod.Args();
    args.setParameter("seasonLength", 4);
    args.setParameter("seasonality", SeasonalityType.ADDITIVE);
    args.setParameter("seasonValues", new double[] {1.0, 0.0, -0.5, -0.5});
    HoltWintersMethod hwm = new HoltWintersMethod(args);

    assertEquals(data.length + 1, hwm.execute(tsSrc).size());
  }

  @Test
  public void testZeroSeasonMeanIsRejected() {
    HoltWintersMethod hwm = new HoltWintersMethod(4);
    TimeSeries flatStart = series(new double[] {0, 0, 0, 0, 5, 6, 7, 8});
    try {
      hwm.execute(flatStart);
      fail("a season with a mean of 0 should have been rejected");
    } catch (UnsuitableSeriesException e) {
      // expected
    }
  }

  @Test(expected = UnsuitableSeriesException.class)
  public void testZeroSeasonFactorIsRejected() {
    new HoltWintersMethod(4).execute(series(new double[] {0, 1, 2, 3, 0, 2, 4, 6}));
  }

  @Test
  public void testInitialTrendValues() {
    HoltWintersMethod hwm = new HoltWintersMethod(4);
    TimeSeries shortSeries = TimeSeries.fromTwoDimList(new double[][] {
        {0, 362.0}, {1, 385.0}, {2, 432.0}, {3, 341.0}, {4, 382.0}, {5, 425.0}});

    assertEquals(7.5, hwm.initialTrendSmoothingFactors(shortSeries), 0.0);
  }

  @Test
  public void testInitialTrendOfSingleSeason() {
    HoltWintersMethod hwm = new HoltWintersMethod(4);
    assertEquals(0.0, hwm.initialTrendSmoothingFactors(series(Arrays.copyOf(data, 4))), 0.0);
  }

  @Test
  public void testMultiplicativeSeasonIsReproduced() {
    double[] factors = {0.9, 1.1, 1.2, 0.8};
    double[] values = new double[16];
    for (int i = 0; i < values.length; i++) {
      values[i] = 100.0 * factors[i % 4];
    }

    TimeSeries res = new HoltWintersMethod(0.5, 0.5, 0.5, 4, 4).execute(series(values));

    for (int i = 0; i < values.length; i++) {
      assertEquals(values[i], res.getValue(i), 1e-9);
    }
    for (int h = 1; h <= 4; h++) {
      assertEquals(100.0 * factors[(15 + h) % 4], res.getValue(15 + h), 1e-9);
      assertEquals(15.0 + h, res.getTimestamp(15 + h), 0.0);
    }
  }

  @Test
  public void testAdditiveSeasonIsReproduced() {
    double[] offsets = {1.0, -1.0, 2.0, -2.0};
    double[] values = new double[12];
    for (int i = 0; i < values.length; i++) {
      values[i] = 10.0 + offsets[i % 4];
    }
    HoltWintersMethod.Args args = new HoltWintersMethod.Args();
    args.setParameter("seasonLength", 4);
    args.setParameter("valuesToForecast", 3);
    args.setParameter("seasonality", "additive");
    HoltWintersMethod hwm = new HoltWintersMethod(args);
    assertEquals(SeasonalityType.ADDITIVE, hwm.getSeasonality());

    assertArrayEquals(offsets, hwm.initSeasonFactors(series(values)), 1e-12);

    TimeSeries res = hwm.execute(series(values));
    assertEquals(15, res.size());
    for (int h = 1; h <= 3; h++) {
      assertEquals(10.0 + offsets[(11 + h) % 4], res.getValue(11 + h), 1e-9);
    }
  }
}
