package com.sentinel.analyzer.publish;

@FunctionalInterface
public interface OperationalMetricsSink {

  OperationalMetricsSink NOOP = (path, value) -> {};

  void emit(String path, double value);
}
