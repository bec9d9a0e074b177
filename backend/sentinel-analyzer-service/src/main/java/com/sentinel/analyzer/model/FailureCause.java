package com.sentinel.analyzer.model;

public enum FailureCause {
  MALFORMED("Malformed"),
  TOO_SHORT("TooShort"),
  STALE("Stale"),
  BORING("Boring"),
  OTHER("Other");

  private final String label;

  FailureCause(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
