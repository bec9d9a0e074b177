package com.sentinel.analyzer.classify;

import java.util.Arrays;

final class SeriesMath {

  private SeriesMath() {}

  record Stats(double mean, double stddev) {}

  static Stats stats(double[] values, int n) {
    if (n == 0) return new Stats(0.0, 0.0);
    double sum = 0.0;
    for (int i = 0; i < n; i++) sum += values[i];
    double mean = sum / n;
    if (n == 1) return new Stats(mean, 0.0);
    double var = 0.0;
    for (int i = 0; i < n; i++) {
      double d = values[i] - mean;
      var += d * d;
    }
    // sample standard deviation (n-1)
    return new Stats(mean, Math.sqrt(var / (n - 1)));
  }

  static Stats stats(double[] values) {
    return stats(values, values.length);
  }

  /** Average of the last three values, or the last value for shorter series. */
  static double tailAverage(double[] values) {
    int n = values.length;
    if (n < 3) return values[n - 1];
    return (values[n - 1] + values[n - 2] + values[n - 3]) / 3.0;
  }

  static double median(double[] values) {
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    if (sorted.length % 2 == 1) return sorted[mid];
    return (sorted[mid - 1] + sorted[mid]) / 2.0;
  }
}
