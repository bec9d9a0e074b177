package com.sentinel.analyzer.scan;

import com.sentinel.analyzer.classify.ClassificationPort;
import com.sentinel.analyzer.config.AnalyzerProperties;
import com.sentinel.analyzer.store.MetricStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class CycleAggregator {

  private static final Logger log = LoggerFactory.getLogger(CycleAggregator.class);

  private final MetricStore store;
  private final ClassificationPort classifier;
  private final AnalyzerProperties properties;
  private final int workers;
  private final Duration workerTimeout;
  private final ExecutorService pool;

  public CycleAggregator(MetricStore store, ClassificationPort classifier, AnalyzerProperties properties) {
    if (properties.getWorkers() < 1) {
      throw new IllegalStateException("sentinel.analyzer.workers must be >= 1 but was " + properties.getWorkers());
    }
    this.store = store;
    this.classifier = classifier;
    this.properties = properties;
    this.workers = properties.getWorkers();
    this.workerTimeout = properties.getWorkerTimeout();
    CustomizableThreadFactory threads = new CustomizableThreadFactory("scan-worker-");
    threads.setDaemon(true);
    this.pool = Executors.newFixedThreadPool(workers, threads);
  }

  @PreDestroy
  public void stop() {
    pool.shutdownNow();
  }

  // findings reach the collector only with a folded report; a silent worker contributes none
  public CycleResult run(List<String> universe, FindingCollector findings, ScanCancellation cancellation) {
    List<WorkerPartitioner.Slice> slices = WorkerPartitioner.slices(universe.size(), workers);
    if (workers > universe.size()) {
      log.info("[run] {} workers configured for {} metrics; only {} will run", workers, universe.size(), slices.size());
    }

    List<Future<WorkerReport>> running = new ArrayList<>(slices.size());
    for (WorkerPartitioner.Slice slice : slices) {
      ScanWorker worker = new ScanWorker(
          slice.worker(),
          universe.subList(slice.from(), slice.to()),
          store,
          classifier,
          properties::baseName,
          cancellation);
      running.add(pool.submit(worker));
    }

    CycleResult.Builder result = CycleResult.builder(universe.size());
    long deadline = System.nanoTime() + workerTimeout.toNanos();
    for (int i = 0; i < running.size(); i++) {
      WorkerPartitioner.Slice slice = slices.get(i);
      Future<WorkerReport> future = running.get(i);
      try {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        WorkerReport report = future.get(remaining, TimeUnit.NANOSECONDS);
        result.add(report);
        report.findings().forEach(findings::add);
      } catch (TimeoutException e) {
        future.cancel(true);
        log.warn("[run] worker {} did not report within {}; counting its {} metrics as Other",
            slice.worker(), workerTimeout, slice.size());
        result.addUnreported(slice.size());
      } catch (ExecutionException e) {
        if (e.getCause() instanceof SupervisorLostException lost) {
          running.forEach(f -> f.cancel(true));
          throw lost;
        }
        log.error("[run] worker {} failed; counting its {} metrics as Other", slice.worker(), slice.size(), e.getCause());
        result.addUnreported(slice.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        running.forEach(f -> f.cancel(true));
        throw new IllegalStateException("Interrupted while waiting for scan workers", e);
      }
    }
    return result.build();
  }
}
