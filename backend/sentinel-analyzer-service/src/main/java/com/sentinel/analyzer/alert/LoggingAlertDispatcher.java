package com.sentinel.analyzer.alert;

import com.sentinel.analyzer.model.AlertRule;
import com.sentinel.analyzer.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "sentinel.alerts", name = "sink", havingValue = "log", matchIfMissing = true)
public class LoggingAlertDispatcher implements AlertDispatcher {

  private static final Logger log = LoggerFactory.getLogger(LoggingAlertDispatcher.class);

  @Override
  public void dispatch(AlertRule rule, Finding finding) {
    log.warn("ALERT rule='{}' metric='{}' timestamp={} value={}",
        rule.ruleId(), finding.baseName(), finding.point().timestamp(), finding.point().value());
  }
}
