package com.sentinel.analyzer.publish;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

public class MicrometerMetricsSink implements OperationalMetricsSink {

  private final MeterRegistry registry;
  private final String prefix;
  private final ConcurrentMap<String, AtomicReference<Double>> gauges = new ConcurrentHashMap<>();

  public MicrometerMetricsSink(MeterRegistry registry, String prefix) {
    this.registry = registry;
    this.prefix = prefix.isEmpty() || prefix.endsWith(".") ? prefix : prefix + ".";
  }

  @Override
  public void emit(String path, double value) {
    gauges.computeIfAbsent(prefix + path, name -> {
      AtomicReference<Double> holder = new AtomicReference<>(0.0);
      registry.gauge(name, holder, AtomicReference::get);
      return holder;
    }).set(value);
  }
}
