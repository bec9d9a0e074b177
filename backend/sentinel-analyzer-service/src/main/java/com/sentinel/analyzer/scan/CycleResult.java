package com.sentinel.analyzer.scan;

import com.sentinel.analyzer.model.FailureCause;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

public record CycleResult(int total, int workers, Map<FailureCause, Integer> failures, Map<String, Integer> votes) {

  public CycleResult {
    EnumMap<FailureCause, Integer> byCause = new EnumMap<>(FailureCause.class);
    byCause.putAll(failures);
    failures = Collections.unmodifiableMap(byCause);
    votes = Collections.unmodifiableMap(new TreeMap<>(votes));
  }

  public static CycleResult empty() {
    return new CycleResult(0, 0, Map.of(), Map.of());
  }

  public int failed() {
    return failures.values().stream().mapToInt(Integer::intValue).sum();
  }

  public int analyzed() {
    return total - failed();
  }

  static Builder builder(int total) {
    return new Builder(total);
  }

  static final class Builder {
    private final int total;
    private final Map<FailureCause, Integer> failures = new EnumMap<>(FailureCause.class);
    private final Map<String, Integer> votes = new TreeMap<>();
    private int workers;

    private Builder(int total) {
      this.total = total;
    }

    Builder add(WorkerReport report) {
      workers++;
      report.failures().forEach((cause, n) -> failures.merge(cause, n, Integer::sum));
      report.votes().forEach((algorithm, n) -> votes.merge(algorithm, n, Integer::sum));
      return this;
    }

    /** Counts the metrics of a worker that never reported as {@link FailureCause#OTHER}. */
    Builder addUnreported(int assigned) {
      workers++;
      if (assigned > 0) failures.merge(FailureCause.OTHER, assigned, Integer::sum);
      return this;
    }

    CycleResult build() {
      return new CycleResult(total, workers, failures, votes);
    }
  }
}
