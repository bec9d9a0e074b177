package com.sentinel.analyzer.model;

import java.util.List;

public record ClassificationResult(boolean anomalous, List<Boolean> votes, SeriesPoint point) {

  public ClassificationResult {
    votes = List.copyOf(votes);
  }
}
