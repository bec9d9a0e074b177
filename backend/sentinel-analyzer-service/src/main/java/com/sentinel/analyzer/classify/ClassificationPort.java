package com.sentinel.analyzer.classify;

import com.sentinel.analyzer.model.SeriesPoint;

import java.util.List;

public interface ClassificationPort {

  ClassificationOutcome classify(List<SeriesPoint> series, String metricName);

  /** Algorithm names, indexed the same way as {@code ClassificationResult.votes()}. */
  List<String> algorithms();
}
