package com.sentinel.analyzer.scan;

@FunctionalInterface
public interface LivenessProbe {

  boolean isAlive();
}
