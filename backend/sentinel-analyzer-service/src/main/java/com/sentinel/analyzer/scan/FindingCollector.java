package com.sentinel.analyzer.scan;

import com.sentinel.analyzer.model.Finding;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

public class FindingCollector {

  private final ConcurrentLinkedQueue<Finding> findings = new ConcurrentLinkedQueue<>();

  public void add(Finding finding) {
    findings.add(finding);
  }

  public int size() {
    return findings.size();
  }

  public List<Finding> sorted() {
    List<Finding> out = new ArrayList<>(findings);
    out.sort(Finding.BY_BASE_NAME);
    return out;
  }

  public void clear() {
    findings.clear();
  }
}
