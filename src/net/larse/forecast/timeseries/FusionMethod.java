package net.larse.forecast.timeseries;

import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.summary.Sum;

/** How observations that fall into the same grid slot are merged during normalization. */
public enum FusionMethod {
  MEAN {
    @Override
    double fuse(double[] values) {
      return new Mean().evaluate(values);
    }
  },
  SUM {
    @Override
    double fuse(double[] values) {
      return new Sum().evaluate(values);
    }
  };

  abstract double fuse(double[] values);
}
