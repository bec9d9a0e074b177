package com.sentinel.analyzer.config;

import com.sentinel.analyzer.publish.MicrometerMetricsSink;
import com.sentinel.analyzer.publish.OperationalMetricsSink;
import com.sentinel.analyzer.scan.LivenessProbe;
import com.sentinel.analyzer.scan.ScanCancellation;
import com.sentinel.analyzer.service.ProcessLivenessProbe;
import com.sentinel.analyzer.service.ProcessTerminator;
import com.sentinel.analyzer.service.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnalyzerConfig {

  private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.THREAD;
  }

  @Bean
  public ProcessTerminator processTerminator() {
    return System::exit;
  }

  @Bean
  public LivenessProbe livenessProbe(@Value("${sentinel.supervisor.watch-parent:true}") boolean watchParent,
                                     @Value("${sentinel.supervisor.parent-pid:0}") long parentPid) {
    ProcessHandle self = ProcessHandle.current();
    if (!watchParent) {
      return new ProcessLivenessProbe(self, null);
    }
    ProcessHandle supervisor = parentPid > 0
        ? ProcessHandle.of(parentPid).orElse(null)
        : self.parent().orElse(null);
    if (supervisor == null) {
      // configured pid already gone: the first liveness check stops the analyzer
      if (parentPid > 0) return () -> false;
      log.warn("No parent process found for pid={}; running unsupervised", self.pid());
    } else {
      log.info("Watching supervising process pid={}", supervisor.pid());
    }
    return new ProcessLivenessProbe(self, supervisor);
  }

  @Bean
  public ScanCancellation scanCancellation(LivenessProbe livenessProbe) {
    return new ScanCancellation(livenessProbe);
  }

  @Bean
  public OperationalMetricsSink operationalMetricsSink(MeterRegistry registry,
                                                       @Value("${sentinel.metrics.enabled:true}") boolean enabled,
                                                       @Value("${sentinel.metrics.prefix:sentinel.analyzer}") String prefix,
                                                       @Value("${sentinel.metrics.server-name:}") String serverName) {
    if (!enabled) {
      return OperationalMetricsSink.NOOP;
    }
    String path = serverName.isBlank() ? prefix : prefix + "." + serverName;
    return new MicrometerMetricsSink(registry, path);
  }
}
