package com.sentinel.analyzer.classify;

import org.springframework.stereotype.Component;

/** Votes when the newest value deviates from the median by more than six MADs. */
@Component
public class MedianAbsoluteDeviation implements AnomalyAlgorithm {

  private static final double THRESHOLD = 6.0;

  @Override
  public String name() {
    return "median_absolute_deviation";
  }

  @Override
  public boolean isAnomalous(double[] values) {
    double median = SeriesMath.median(values);
    double[] demedianed = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      demedianed[i] = Math.abs(values[i] - median);
    }
    double mad = SeriesMath.median(demedianed);
    if (mad == 0.0) return false;
    return demedianed[demedianed.length - 1] / mad > THRESHOLD;
  }
}
