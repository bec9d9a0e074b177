package com.sentinel.analyzer.classify;

import com.sentinel.analyzer.config.AnalyzerProperties;
import com.sentinel.analyzer.model.ClassificationResult;
import com.sentinel.analyzer.model.SeriesPoint;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class EnsembleClassifier implements ClassificationPort {

  private final List<AnomalyAlgorithm> algorithms;
  private final List<String> names;
  private final int minTolerableLength;
  private final int maxTolerableBoredom;
  private final int boredomSetSize;
  private final long stalePeriodSeconds;
  private final int consensus;
  private final Clock clock;

  public EnsembleClassifier(List<AnomalyAlgorithm> available,
                            AnalyzerProperties properties,
                            @Value("${sentinel.classifier.min-tolerable-length:1}") int minTolerableLength,
                            @Value("${sentinel.classifier.max-tolerable-boredom:100}") int maxTolerableBoredom,
                            @Value("${sentinel.classifier.boredom-set-size:1}") int boredomSetSize,
                            @Value("${sentinel.classifier.stale-period-seconds:500}") long stalePeriodSeconds,
                            @Value("${sentinel.classifier.consensus:2}") int consensus,
                            Clock clock) {
    Map<String, AnomalyAlgorithm> byName = available.stream()
        .collect(Collectors.toMap(AnomalyAlgorithm::name, Function.identity()));
    List<AnomalyAlgorithm> selected = new ArrayList<>();
    for (String name : properties.getAlgorithms()) {
      AnomalyAlgorithm algorithm = byName.get(name);
      if (algorithm == null) {
        throw new IllegalStateException("Unknown anomaly algorithm '" + name + "', available: " + byName.keySet());
      }
      selected.add(algorithm);
    }
    if (consensus < 1 || consensus > selected.size()) {
      throw new IllegalStateException("consensus must be between 1 and " + selected.size() + " but was " + consensus);
    }
    this.algorithms = List.copyOf(selected);
    this.names = selected.stream().map(AnomalyAlgorithm::name).toList();
    this.minTolerableLength = Math.max(1, minTolerableLength);
    this.maxTolerableBoredom = maxTolerableBoredom;
    this.boredomSetSize = boredomSetSize;
    this.stalePeriodSeconds = stalePeriodSeconds;
    this.consensus = consensus;
    this.clock = clock;
  }

  @Override
  public List<String> algorithms() {
    return names;
  }

  @Override
  public ClassificationOutcome classify(List<SeriesPoint> series, String metricName) {
    try {
      if (series.size() < minTolerableLength) return ClassificationOutcome.tooShort();
      if (isBoring(series)) return ClassificationOutcome.boring();

      SeriesPoint last = series.get(series.size() - 1);
      if (clock.instant().getEpochSecond() - last.timestamp() > stalePeriodSeconds) {
        return ClassificationOutcome.stale();
      }

      double[] values = new double[series.size()];
      for (int i = 0; i < values.length; i++) values[i] = series.get(i).value();

      List<Boolean> votes = new ArrayList<>(algorithms.size());
      int yes = 0;
      for (AnomalyAlgorithm algorithm : algorithms) {
        boolean vote = algorithm.isAnomalous(values);
        votes.add(vote);
        if (vote) yes++;
      }
      return ClassificationOutcome.success(new ClassificationResult(yes >= consensus, votes, last));
    } catch (RuntimeException e) {
      return ClassificationOutcome.other(e);
    }
  }

  private boolean isBoring(List<SeriesPoint> series) {
    int from = Math.max(0, series.size() - maxTolerableBoredom);
    Set<Double> distinct = new HashSet<>();
    for (SeriesPoint p : series.subList(from, series.size())) distinct.add(p.value());
    return distinct.size() == boredomSetSize;
  }
}
