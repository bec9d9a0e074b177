package com.sentinel.analyzer.model;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

public record AlertRule(Pattern pattern, String ruleId, Duration cooldown) {

  public AlertRule {
    Objects.requireNonNull(pattern, "pattern");
    if (ruleId == null || ruleId.isBlank()) {
      throw new IllegalArgumentException("alert rule id must not be blank");
    }
    if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
      throw new IllegalArgumentException("alert rule cooldown must be positive: " + ruleId);
    }
  }

  public static AlertRule of(String regex, String ruleId, Duration cooldown) {
    return new AlertRule(Pattern.compile(regex), ruleId, cooldown);
  }

  public boolean matches(String baseName) {
    return pattern.matcher(baseName).lookingAt();
  }

  public String cooldownKey(String baseName) {
    return "last_alert." + ruleId + "." + baseName;
  }
}
