package com.sentinel.analyzer.scan;

import com.sentinel.analyzer.classify.ClassificationOutcome;
import com.sentinel.analyzer.classify.ClassificationPort;
import com.sentinel.analyzer.model.ClassificationResult;
import com.sentinel.analyzer.model.FailureCause;
import com.sentinel.analyzer.model.Finding;
import com.sentinel.analyzer.model.SeriesPoint;
import com.sentinel.analyzer.store.MalformedSeriesException;
import com.sentinel.analyzer.store.MetricStore;
import com.sentinel.analyzer.store.SeriesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;

public class ScanWorker implements Callable<WorkerReport> {

  private static final Logger log = LoggerFactory.getLogger(ScanWorker.class);

  private final int worker;
  private final List<String> assigned;
  private final MetricStore store;
  private final ClassificationPort classifier;
  private final UnaryOperator<String> baseName;
  private final ScanCancellation cancellation;

  public ScanWorker(int worker,
                    List<String> assigned,
                    MetricStore store,
                    ClassificationPort classifier,
                    UnaryOperator<String> baseName,
                    ScanCancellation cancellation) {
    this.worker = worker;
    this.assigned = List.copyOf(assigned);
    this.store = store;
    this.classifier = classifier;
    this.baseName = baseName;
    this.cancellation = cancellation;
  }

  @Override
  public WorkerReport call() {
    Map<FailureCause, Integer> failures = new EnumMap<>(FailureCause.class);
    Map<String, Integer> votes = new HashMap<>();
    List<Finding> findings = new ArrayList<>();
    if (assigned.isEmpty()) return new WorkerReport(worker, 0, failures, votes, findings);

    cancellation.ensureActive();
    List<byte[]> raw = store.bulkGet(assigned);
    List<String> algorithms = classifier.algorithms();

    for (int i = 0; i < assigned.size(); i++) {
      cancellation.ensureActive();
      if (Thread.currentThread().isInterrupted()) {
        log.warn("[scan] worker {} interrupted after {} of {} metrics", worker, i, assigned.size());
        break;
      }

      String metric = assigned.get(i);
      List<SeriesPoint> series;
      try {
        series = SeriesCodec.decode(i < raw.size() ? raw.get(i) : null);
      } catch (MalformedSeriesException e) {
        failures.merge(FailureCause.MALFORMED, 1, Integer::sum);
        log.debug("Malformed series metric='{}': {}", metric, e.getMessage());
        continue;
      }

      ClassificationOutcome outcome;
      try {
        outcome = classifier.classify(series, metric);
      } catch (RuntimeException e) {
        outcome = ClassificationOutcome.other(e);
      }

      switch (outcome.kind()) {
        case SUCCESS -> record(metric, outcome.result(), algorithms, votes, findings);
        case OTHER -> {
          failures.merge(FailureCause.OTHER, 1, Integer::sum);
          log.warn("Classification failed metric='{}' points={}", metric, series.size(), outcome.error());
        }
        case TOO_SHORT, STALE, BORING -> failures.merge(outcome.failureCause(), 1, Integer::sum);
      }
    }

    return new WorkerReport(worker, assigned.size(), failures, votes, findings);
  }

  private void record(String metric,
                      ClassificationResult result,
                      List<String> algorithms,
                      Map<String, Integer> votes,
                      List<Finding> findings) {
    if (!result.anomalous()) return;
    findings.add(new Finding(result.point(), baseName.apply(metric)));

    List<Boolean> ensemble = result.votes();
    for (int i = 0; i < ensemble.size() && i < algorithms.size(); i++) {
      if (Boolean.TRUE.equals(ensemble.get(i))) {
        votes.merge(algorithms.get(i), 1, Integer::sum);
      }
    }
  }
}
