package com.sentinel.analyzer.classify;

public interface AnomalyAlgorithm {

  String name();

  boolean isAnomalous(double[] values);
}
