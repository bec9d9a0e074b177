package com.sentinel.analyzer.scan;

import com.sentinel.analyzer.model.FailureCause;
import com.sentinel.analyzer.model.Finding;

import java.util.List;
import java.util.Map;

public record WorkerReport(int worker,
                           int assigned,
                           Map<FailureCause, Integer> failures,
                           Map<String, Integer> votes,
                           List<Finding> findings) {

  public WorkerReport {
    failures = Map.copyOf(failures);
    votes = Map.copyOf(votes);
    findings = List.copyOf(findings);
  }
}
