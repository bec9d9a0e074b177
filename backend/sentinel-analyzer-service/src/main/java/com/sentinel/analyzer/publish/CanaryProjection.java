package com.sentinel.analyzer.publish;

import com.sentinel.analyzer.model.SeriesPoint;

import java.util.List;
import java.util.Optional;

public record CanaryProjection(double durationHours, double projectedSeconds) {

  public static Optional<CanaryProjection> of(List<SeriesPoint> canary, double cycleSeconds) {
    if (canary.size() < 2) return Optional.empty();
    long span = canary.get(canary.size() - 1).timestamp() - canary.get(0).timestamp();
    if (span <= 0) return Optional.empty();
    double hours = span / 3600.0;
    return Optional.of(new CanaryProjection(hours, 24 * cycleSeconds / hours));
  }
}
