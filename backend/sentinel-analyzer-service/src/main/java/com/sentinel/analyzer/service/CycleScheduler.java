package com.sentinel.analyzer.service;

import com.sentinel.analyzer.alert.AlertGate;
import com.sentinel.analyzer.config.AnalyzerProperties;
import com.sentinel.analyzer.model.FailureCause;
import com.sentinel.analyzer.model.Finding;
import com.sentinel.analyzer.model.SeriesPoint;
import com.sentinel.analyzer.publish.AnomalySnapshotWriter;
import com.sentinel.analyzer.publish.CanaryProjection;
import com.sentinel.analyzer.publish.OperationalMetricsSink;
import com.sentinel.analyzer.scan.CycleAggregator;
import com.sentinel.analyzer.scan.CycleResult;
import com.sentinel.analyzer.scan.FindingCollector;
import com.sentinel.analyzer.scan.ScanCancellation;
import com.sentinel.analyzer.scan.SupervisorLostException;
import com.sentinel.analyzer.store.MalformedSeriesException;
import com.sentinel.analyzer.store.MetricStore;
import com.sentinel.analyzer.store.SeriesCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Service
public class CycleScheduler {

  private static final Logger log = LoggerFactory.getLogger(CycleScheduler.class);

  public enum Phase { IDLE, SCANNING, AGGREGATING, ALERTING, PUBLISHING, SLEEPING, STOPPED }

  private final MetricStore store;
  private final CycleAggregator aggregator;
  private final AlertGate alerts;
  private final AnomalySnapshotWriter snapshot;
  private final OperationalMetricsSink sink;
  private final AnalyzerProperties properties;
  private final ScanCancellation cancellation;
  private final Sleeper sleeper;
  private final ProcessTerminator terminator;
  private final Clock clock;
  private final Counter cyclesRun;
  private final Timer cycleDuration;
  private final Set<String> breakdownKeys;

  private final ExecutorService loopExecutor;
  private volatile boolean running;
  private volatile Phase phase = Phase.IDLE;

  public CycleScheduler(MetricStore store,
                        CycleAggregator aggregator,
                        AlertGate alerts,
                        AnomalySnapshotWriter snapshot,
                        OperationalMetricsSink sink,
                        AnalyzerProperties properties,
                        ScanCancellation cancellation,
                        Sleeper sleeper,
                        ProcessTerminator terminator,
                        Clock clock,
                        MeterRegistry metrics) {
    this.store = store;
    this.aggregator = aggregator;
    this.alerts = alerts;
    this.snapshot = snapshot;
    this.sink = sink;
    this.properties = properties;
    this.cancellation = cancellation;
    this.sleeper = sleeper;
    this.terminator = terminator;
    this.clock = clock;
    this.cyclesRun = metrics.counter("sentinel_analyzer_cycles_total");
    this.cycleDuration = metrics.timer("sentinel_analyzer_cycle_duration_seconds");
    this.breakdownKeys = new LinkedHashSet<>(properties.getAlgorithms());
    CustomizableThreadFactory threads = new CustomizableThreadFactory("analyzer-cycle-");
    threads.setDaemon(true);
    this.loopExecutor = Executors.newSingleThreadExecutor(threads);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    running = true;
    loopExecutor.submit(this::loop);
    log.info("Analyzer started workers={} universe='{}'", properties.getWorkers(), properties.universeKey());
  }

  @PreDestroy
  void stop() {
    running = false;
    loopExecutor.shutdownNow();
  }

  public Phase phase() {
    return phase;
  }

  void loop() {
    while (running) {
      Duration pause;
      try {
        pause = runCycle();
      } catch (SupervisorLostException e) {
        log.error("[loop] {}; stopping analyzer", e.getMessage());
        running = false;
        phase = Phase.STOPPED;
        terminator.terminate(0);
        return;
      } catch (RuntimeException e) {
        log.error("[loop] cycle aborted: {}", e.getMessage(), e);
        pause = properties.getStoreRetryDelay();
      }

      if (pause.isZero()) continue;
      try {
        sleeper.sleep(pause);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        running = false;
        return;
      }
    }
  }

  // returns the pause before the next cycle, ZERO to start it at once
  public Duration runCycle() {
    long startMs = clock.millis();
    cancellation.ensureActive();
    phase = Phase.IDLE;

    Set<String> members;
    try {
      store.ping();
      members = store.members(properties.universeKey());
    } catch (RuntimeException e) {
      log.error("[cycle] can't connect to the metric store: {}", e.getMessage());
      return properties.getStoreRetryDelay();
    }
    if (members.isEmpty()) {
      log.info("[cycle] no metrics under '{}'; waiting {}", properties.universeKey(), properties.getEmptyUniverseDelay());
      return properties.getEmptyUniverseDelay();
    }

    List<String> universe = new ArrayList<>(members);
    Collections.sort(universe);
    FindingCollector findings = new FindingCollector();

    phase = Phase.SCANNING;
    CycleResult result = aggregator.run(universe, findings, cancellation);
    cancellation.ensureActive();

    phase = Phase.AGGREGATING;
    List<Finding> anomalies = findings.sorted();

    phase = Phase.ALERTING;
    int sent = alerts.evaluate(anomalies);
    if (sent > 0) log.info("[cycle] dispatched {} alerts", sent);

    phase = Phase.PUBLISHING;
    publish(result, anomalies, startMs);

    phase = Phase.SLEEPING;
    findings.clear();
    cyclesRun.increment();
    long elapsedMs = clock.millis() - startMs;
    cycleDuration.record(Duration.ofMillis(elapsedMs));
    if (elapsedMs < properties.getMinCycleDuration().toMillis()) {
      log.info("[cycle] sleeping due to low run time ({} ms)", elapsedMs);
      return properties.getLowRunTimePause();
    }
    return Duration.ZERO;
  }

  private void publish(CycleResult result, List<Finding> anomalies, long startMs) {
    try {
      snapshot.write(anomalies);
    } catch (IOException e) {
      log.error("[publish] failed to write anomaly snapshot to {}: {}", snapshot.path(), e.getMessage());
    }

    double seconds = (clock.millis() - startMs) / 1000.0;
    log.info("[cycle] seconds to run={} total metrics={} total analyzed={} total anomalies={}",
        String.format("%.2f", seconds), result.total(), result.analyzed(), anomalies.size());
    log.info("[cycle] exception stats={} anomaly breakdown={}", labelled(result.failures()), result.votes());

    sink.emit("run_time", round(seconds));
    sink.emit("total_analyzed", result.analyzed());
    sink.emit("total_anomalies", anomalies.size());
    sink.emit("total_metrics", result.total());
    // zero-filled so every gauge reflects this cycle only
    for (FailureCause cause : FailureCause.values()) {
      sink.emit("exceptions." + cause.label(), result.failures().getOrDefault(cause, 0));
    }
    breakdownKeys.addAll(result.votes().keySet());
    for (String algorithm : breakdownKeys) {
      sink.emit("anomaly_breakdown." + algorithm, result.votes().getOrDefault(algorithm, 0));
    }

    publishCanary(seconds);
  }

  private void publishCanary(double cycleSeconds) {
    byte[] raw;
    try {
      raw = store.get(properties.canaryKey());
    } catch (RuntimeException e) {
      log.warn("[publish] canary lookup failed: {}", e.getMessage());
      return;
    }
    if (raw == null) return;

    List<SeriesPoint> canary;
    try {
      canary = SeriesCodec.decode(raw);
    } catch (MalformedSeriesException e) {
      log.warn("[publish] canary '{}' is malformed: {}", properties.getCanaryMetric(), e.getMessage());
      return;
    }
    CanaryProjection.of(canary, cycleSeconds).ifPresentOrElse(p -> {
      log.info("[cycle] canary duration={}h projected={}s",
          String.format("%.2f", p.durationHours()), String.format("%.2f", p.projectedSeconds()));
      sink.emit("duration", round(p.durationHours()));
      sink.emit("projected", round(p.projectedSeconds()));
    }, () -> log.debug("[publish] canary '{}' spans no time yet", properties.getCanaryMetric()));
  }

  private static Map<String, Integer> labelled(Map<FailureCause, Integer> failures) {
    Map<String, Integer> out = new LinkedHashMap<>();
    failures.forEach((cause, n) -> out.put(cause.label(), n));
    return out;
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
