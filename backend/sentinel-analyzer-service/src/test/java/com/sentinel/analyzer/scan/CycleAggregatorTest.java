package com.sentinel.analyzer.scan;

import com.sentinel.analyzer.classify.ClassificationOutcome;
import com.sentinel.analyzer.config.AnalyzerProperties;
import com.sentinel.analyzer.model.FailureCause;
import com.sentinel.analyzer.model.Finding;
import com.sentinel.analyzer.model.SeriesPoint;
import com.sentinel.analyzer.support.InMemoryMetricStore;
import com.sentinel.analyzer.support.MutableClock;
import com.sentinel.analyzer.support.StubClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CycleAggregatorTest {

  private final InMemoryMetricStore store = new InMemoryMetricStore(new MutableClock(Instant.ofEpochSecond(1_000)));
  private final StubClassifier classifier = new StubClassifier("first", "second");
  private final AnalyzerProperties properties = new AnalyzerProperties();
  private final ScanCancellation alive = new ScanCancellation(() -> true);
  private CycleAggregator aggregator;

  @BeforeEach
  void setUp() {
    properties.setNamespace("metrics.");
  }

  @AfterEach
  void tearDown() {
    if (aggregator != null) aggregator.stop();
  }

  private CycleAggregator aggregator(int workers) {
    properties.setWorkers(workers);
    aggregator = new CycleAggregator(store, classifier, properties);
    return aggregator;
  }

  private List<String> seed(String... names) {
    for (String name : names) store.putSeries(name, new SeriesPoint(100, 1), new SeriesPoint(160, 2));
    return List.of(names);
  }

  @Test
  void mergesEveryWorkersTallies() {
    List<String> universe = seed("metrics.a", "metrics.b", "metrics.c", "metrics.d", "metrics.e", "metrics.f", "metrics.g");
    classifier
        .anomalous("metrics.a", true, true)
        .anomalous("metrics.e", true, false)
        .anomalous("metrics.g", false, true)
        .answer("metrics.b", ClassificationOutcome.boring())
        .answer("metrics.f", ClassificationOutcome.boring())
        .answer("metrics.c", ClassificationOutcome.stale());
    FindingCollector findings = new FindingCollector();

    CycleResult result = aggregator(3).run(universe, findings, alive);

    assertThat(result.workers()).isEqualTo(3);
    assertThat(result.total()).isEqualTo(7);
    assertThat(result.failures()).containsOnly(Map.entry(FailureCause.BORING, 2), Map.entry(FailureCause.STALE, 1));
    assertThat(result.analyzed()).isEqualTo(4);
    assertThat(result.failed() + result.analyzed()).isEqualTo(universe.size());
    assertThat(result.votes()).containsOnly(Map.entry("first", 2), Map.entry("second", 2));
    assertThat(findings.sorted()).extracting(Finding::baseName).containsExactly("a", "e", "g");
  }

  @Test
  void sameTotalsWhateverTheWorkerCount() {
    List<String> universe = seed("metrics.a", "metrics.b", "metrics.c", "metrics.d", "metrics.e");
    classifier.anomalous("metrics.d", true, false).answer("metrics.a", ClassificationOutcome.tooShort());

    for (int workers = 1; workers <= 7; workers++) {
      CycleResult result = aggregator(workers).run(universe, new FindingCollector(), alive);
      aggregator.stop();

      assertThat(result.workers()).isLessThanOrEqualTo(Math.min(workers, universe.size()));
      assertThat(result.analyzed()).isEqualTo(4);
      assertThat(result.failures()).containsOnly(Map.entry(FailureCause.TOO_SHORT, 1));
      assertThat(result.votes()).containsOnly(Map.entry("first", 1));
    }
  }

  @Test
  void moreWorkersThanMetricsOnlyRunsWhatIsNeeded() {
    List<String> universe = seed("metrics.a", "metrics.b");

    CycleResult result = aggregator(5).run(universe, new FindingCollector(), alive);

    assertThat(result.workers()).isEqualTo(2);
    assertThat(result.analyzed()).isEqualTo(2);
  }

  @Test
  void silentWorkerIsCountedAsOtherAfterTimeout() throws Exception {
    List<String> universe = seed("metrics.a", "metrics.b", "metrics.c", "metrics.hang");
    CountDownLatch never = new CountDownLatch(1);
    classifier.answer("metrics.hang", (series, name) -> {
      try {
        never.await(30, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return ClassificationOutcome.other(new IllegalStateException("interrupted"));
    });
    properties.setWorkerTimeout(Duration.ofMillis(300));

    long started = System.nanoTime();
    CycleResult result = aggregator(2).run(universe, new FindingCollector(), alive);

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    // worker 2 owned metrics.c and metrics.hang
    assertThat(result.failures()).containsOnly(Map.entry(FailureCause.OTHER, 2));
    assertThat(result.analyzed()).isEqualTo(2);
  }

  @Test
  void findingsOfATimedOutWorkerAreDropped() {
    List<String> universe = seed("metrics.a", "metrics.b", "metrics.c", "metrics.hang");
    CountDownLatch never = new CountDownLatch(1);
    classifier
        .anomalous("metrics.a", true, true)
        .anomalous("metrics.c", true, true)
        .answer("metrics.hang", (series, name) -> {
          try {
            never.await(30, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return ClassificationOutcome.other(new IllegalStateException("interrupted"));
        });
    properties.setWorkerTimeout(Duration.ofMillis(300));
    FindingCollector findings = new FindingCollector();

    CycleResult result = aggregator(2).run(universe, findings, alive);

    // metrics.c was flagged by worker 2 before it hung
    assertThat(result.failures()).containsOnly(Map.entry(FailureCause.OTHER, 2));
    assertThat(result.votes()).containsOnly(Map.entry("first", 1), Map.entry("second", 1));
    assertThat(findings.sorted()).extracting(Finding::baseName).containsExactly("a");
  }

  @Test
  void workerThatCannotReachTheStoreIsCountedAsOther() {
    InMemoryMetricStore flaky = new InMemoryMetricStore(new MutableClock(Instant.ofEpochSecond(1_000))) {
      @Override
      public List<byte[]> bulkGet(List<String> keys) {
        if (keys.contains("metrics.c")) throw new RedisConnectionFailureException("connection reset");
        return super.bulkGet(keys);
      }
    };
    for (String name : List.of("metrics.a", "metrics.b", "metrics.c")) {
      flaky.putSeries(name, new SeriesPoint(100, 1), new SeriesPoint(160, 2));
    }
    properties.setWorkers(2);
    aggregator = new CycleAggregator(flaky, classifier, properties);

    CycleResult result = aggregator.run(List.of("metrics.a", "metrics.b", "metrics.c"), new FindingCollector(), alive);

    assertThat(result.failures()).containsOnly(Map.entry(FailureCause.OTHER, 1));
    assertThat(result.analyzed()).isEqualTo(2);
  }

  @Test
  void supervisorLossAbortsTheCycle() {
    List<String> universe = seed("metrics.a", "metrics.b");

    assertThatThrownBy(() -> aggregator(2).run(universe, new FindingCollector(), new ScanCancellation(() -> false)))
        .isInstanceOf(SupervisorLostException.class);
  }

  @Test
  void rejectsZeroWorkers() {
    properties.setWorkers(0);

    assertThatThrownBy(() -> new CycleAggregator(store, classifier, properties))
        .isInstanceOf(IllegalStateException.class);
  }
}
