package com.sentinel.analyzer.config;

import com.sentinel.analyzer.model.AlertRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "sentinel.alerts")
public class AlertProperties {

  private boolean enabled;
  private String sink = "log";
  private String topic = "metric_alerts";
  private List<Rule> rules = new ArrayList<>();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getSink() {
    return sink;
  }

  public void setSink(String sink) {
    this.sink = sink;
  }

  public String getTopic() {
    return topic;
  }

  public void setTopic(String topic) {
    this.topic = topic;
  }

  public List<Rule> getRules() {
    return rules;
  }

  public void setRules(List<Rule> rules) {
    this.rules = rules;
  }

  public List<AlertRule> toRules() {
    return rules.stream()
        .map(r -> AlertRule.of(r.getPattern(), r.getRuleId(), r.getCooldown()))
        .toList();
  }

  public static class Rule {
    private String pattern;
    private String ruleId;
    private Duration cooldown = Duration.ofHours(1);

    public String getPattern() {
      return pattern;
    }

    public void setPattern(String pattern) {
      this.pattern = pattern;
    }

    public String getRuleId() {
      return ruleId;
    }

    public void setRuleId(String ruleId) {
      this.ruleId = ruleId;
    }

    public Duration getCooldown() {
      return cooldown;
    }

    public void setCooldown(Duration cooldown) {
      this.cooldown = cooldown;
    }
  }
}
