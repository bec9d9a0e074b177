package com.sentinel.analyzer.alert;

import com.sentinel.analyzer.config.AlertProperties;
import com.sentinel.analyzer.model.AlertRule;
import com.sentinel.analyzer.model.Finding;
import com.sentinel.analyzer.store.MetricStore;
import com.sentinel.analyzer.store.SeriesCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AlertGate {

  private static final Logger log = LoggerFactory.getLogger(AlertGate.class);

  private final MetricStore store;
  private final AlertDispatcher dispatcher;
  private final boolean enabled;
  private final List<AlertRule> rules;
  private final Counter dispatched;
  private final Counter suppressed;
  private final Counter failed;

  public AlertGate(MetricStore store, AlertDispatcher dispatcher, AlertProperties properties, MeterRegistry metrics) {
    this.store = store;
    this.dispatcher = dispatcher;
    this.enabled = properties.isEnabled();
    this.rules = properties.toRules();
    this.dispatched = metrics.counter("sentinel_alerts_dispatched_total");
    this.suppressed = metrics.counter("sentinel_alerts_suppressed_total", "reason", "cooldown");
    this.failed = metrics.counter("sentinel_alerts_failed_total");
  }

  public int evaluate(List<Finding> findings) {
    if (!enabled || rules.isEmpty() || findings.isEmpty()) return 0;

    int sent = 0;
    for (AlertRule rule : rules) {
      for (Finding finding : findings) {
        if (!rule.matches(finding.baseName())) continue;

        String cacheKey = rule.cooldownKey(finding.baseName());
        try {
          byte[] point = SeriesCodec.encodePoint(finding.point());
          if (!store.setIfAbsentWithTtl(cacheKey, point, rule.cooldown())) {
            suppressed.increment();
            continue;
          }
          dispatcher.dispatch(rule, finding);
          dispatched.increment();
          sent++;
        } catch (Exception e) {
          failed.increment();
          log.error("[alerts] couldn't send alert rule='{}' metric='{}': {}", rule.ruleId(), finding.baseName(), e.getMessage());
        }
      }
    }
    return sent;
  }
}
