package com.sentinel.analyzer.classify;

import org.springframework.stereotype.Component;

/**
 * Centres the series on the mean of everything but the newest value and votes when the
 * newest value lies beyond three standard deviations of that history.
 */
@Component
public class MeanSubtractionCumulation implements AnomalyAlgorithm {

  @Override
  public String name() {
    return "mean_subtraction_cumulation";
  }

  @Override
  public boolean isAnomalous(double[] values) {
    int history = values.length - 1;
    if (history < 2) return false;
    SeriesMath.Stats stats = SeriesMath.stats(values, history);
    double latest = values[history] - stats.mean();
    return Math.abs(latest) > 3 * stats.stddev();
  }
}
