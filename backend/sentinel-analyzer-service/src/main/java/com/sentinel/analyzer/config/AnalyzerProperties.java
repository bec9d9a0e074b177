package com.sentinel.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "sentinel.analyzer")
public class AnalyzerProperties {

  private int workers = 2;
  private String namespace = "metrics.";
  private String uniqueMetricsKey = "unique_metrics";
  private String canaryMetric = "horizon.test.udp";
  private Duration minCycleDuration = Duration.ofSeconds(5);
  private Duration lowRunTimePause = Duration.ofSeconds(10);
  private Duration storeRetryDelay = Duration.ofSeconds(10);
  private Duration emptyUniverseDelay = Duration.ofSeconds(10);
  private Duration workerTimeout = Duration.ofMinutes(5);
  private List<String> algorithms = new ArrayList<>(List.of(
      "stddev_from_average",
      "mean_subtraction_cumulation",
      "median_absolute_deviation"));

  public int getWorkers() {
    return workers;
  }

  public void setWorkers(int workers) {
    this.workers = workers;
  }

  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(String namespace) {
    this.namespace = namespace;
  }

  public String getUniqueMetricsKey() {
    return uniqueMetricsKey;
  }

  public void setUniqueMetricsKey(String uniqueMetricsKey) {
    this.uniqueMetricsKey = uniqueMetricsKey;
  }

  public String getCanaryMetric() {
    return canaryMetric;
  }

  public void setCanaryMetric(String canaryMetric) {
    this.canaryMetric = canaryMetric;
  }

  public Duration getMinCycleDuration() {
    return minCycleDuration;
  }

  public void setMinCycleDuration(Duration minCycleDuration) {
    this.minCycleDuration = minCycleDuration;
  }

  public Duration getLowRunTimePause() {
    return lowRunTimePause;
  }

  public void setLowRunTimePause(Duration lowRunTimePause) {
    this.lowRunTimePause = lowRunTimePause;
  }

  public Duration getStoreRetryDelay() {
    return storeRetryDelay;
  }

  public void setStoreRetryDelay(Duration storeRetryDelay) {
    this.storeRetryDelay = storeRetryDelay;
  }

  public Duration getEmptyUniverseDelay() {
    return emptyUniverseDelay;
  }

  public void setEmptyUniverseDelay(Duration emptyUniverseDelay) {
    this.emptyUniverseDelay = emptyUniverseDelay;
  }

  public Duration getWorkerTimeout() {
    return workerTimeout;
  }

  public void setWorkerTimeout(Duration workerTimeout) {
    this.workerTimeout = workerTimeout;
  }

  public List<String> getAlgorithms() {
    return algorithms;
  }

  public void setAlgorithms(List<String> algorithms) {
    this.algorithms = algorithms;
  }

  /** Key of the set holding every known metric name. */
  public String universeKey() {
    return namespace + uniqueMetricsKey;
  }

  public String canaryKey() {
    return namespace + canaryMetric;
  }

  public String baseName(String metricName) {
    return metricName.startsWith(namespace) ? metricName.substring(namespace.length()) : metricName;
  }
}
