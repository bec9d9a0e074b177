package com.sentinel.analyzer.classify;

import org.springframework.stereotype.Component;

/** Votes when the tail average is more than three standard deviations from the series mean. */
@Component
public class StddevFromAverage implements AnomalyAlgorithm {

  @Override
  public String name() {
    return "stddev_from_average";
  }

  @Override
  public boolean isAnomalous(double[] values) {
    SeriesMath.Stats stats = SeriesMath.stats(values);
    return Math.abs(SeriesMath.tailAverage(values) - stats.mean()) > 3 * stats.stddev();
  }
}
