package net.larse.forecast.methods;

import net.larse.forecast.timeseries.Granularity;
import net.larse.forecast.timeseries.TimeSeries;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class HoltMethodTest {
  TimeSeries linear;
  TimeSeries sales;

  @Before
  public void setUp() throws Exception {
    linear = TimeSeries.fromTwoDimList(new double[][] {
        {0.0, 0.0}, {1, 0.1}, {2, 0.2}, {3, 0.3}, {4, 0.4}}).normalize(Granularity.SECOND);
    sales = TimeSeries.fromTwoDimList(new double[][] {
        {0.0, 152}, {1, 176}, {2, 160}, {3, 192}, {4, 220}}).normalize(Granularity.SECOND);
  }

  @Test
  public void testInitialization() {
    new HoltMethod(0.2, 0.3);
    new HoltMethod(0.0, 1.0);

    for (double alpha : new double[] {-0.1, 0.45, 1.1}) {
      for (double beta : new double[] {-1.4, 3.2}) {
        try {
          new HoltMethod(alpha, beta);
          fail(String.format("(%s, %s) should have been rejected", alpha, beta));
        } catch (IllegalArgumentException e) {
          // expected
        }
      }
    }
  }

  @Test
  public void testSmoothing() {
    // The numbers look a little bit odd, based on the binary representation of the inputs.
    TimeSeries tsDst = TimeSeries.fromTwoDimList(new double[][] {
        {1.5, 0.0}, {2.5, 0.12000000000000002}, {3.5, 0.24080000000000004},
        {4.5, 0.36099200000000004}});

    TimeSeries res = linear.apply(new HoltMethod(0.2, 0.3, 0));

    assertEquals(tsDst, res);
    assertEquals(0.361, res.getValue(3), 1e-3);
  }

  @Test
  public void testSecondSmoothing() {
    TimeSeries tsDst = TimeSeries.fromTwoDimList(new double[][] {
        {1.5, 152.0}, {2.5, 172.8}, {3.5, 195.07200000000003}, {4.5, 218.30528000000004}});

    assertEquals(tsDst, sales.apply(new HoltMethod(0.2, 0.3, 0)));
  }

  @Test
  public void testForecasting() {
    TimeSeries res = linear.apply(new HoltMethod(0.2, 0.3, 5));
    assertEquals(linear.size() + 4, res.size());
  }

  @Test
  public void testSecondForecasting() {
    TimeSeries res = sales.apply(new HoltMethod(0.2, 0.3, 5));
    assertEquals(sales.size() + 4, res.size());

    assertTrue(String.valueOf(res.getValue(4)).startsWith("241.2419"));
    assertEquals(5.5, res.getTimestamp(4), 0.0);
    assertEquals(9.5, res.getTimestamp(8), 0.0);
  }

  @Test
  public void testForecastIsLinear() {
    TimeSeries res = sales.apply(new HoltMethod(0.2, 0.3, 5));
    double trend = res.getValue(5) - res.getValue(4);
    for (int i = 6; i < res.size(); i++) {
      assertEquals(trend, res.getValue(i) - res.getValue(i - 1), 1e-9);
    }
  }

  @Test
  public void testMissingTrendFactor() {
    HoltMethod.Args args = new HoltMethod.Args();
    args.setParameter("smoothingFactor", 0.2);
    assertEquals(Collections.singleton("trendSmoothingFactor"),
        args.getMissingParameters());

    try {
      new HoltMethod(args);
      fail("incomplete args should have been rejected");
    } catch (IllegalStateException e) {
      // expected
    }

    args.setParameter("trendSmoothingFactor", 0.3);
    args.setParameter("valuesToForecast", 0);
    assertEquals(4, sales.apply(new HoltMethod(args)).size());
  }
}
