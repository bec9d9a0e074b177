package com.sentinel.analyzer.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyzerPropertiesTest {

  @Test
  void keysAreBuiltFromTheNamespace() {
    AnalyzerProperties properties = new AnalyzerProperties();
    properties.setNamespace("metrics.");

    assertThat(properties.universeKey()).isEqualTo("metrics.unique_metrics");
    assertThat(properties.canaryKey()).isEqualTo("metrics.horizon.test.udp");
  }

  @Test
  void baseNameStripsOnlyTheLeadingNamespace() {
    AnalyzerProperties properties = new AnalyzerProperties();
    properties.setNamespace("metrics.");

    assertThat(properties.baseName("metrics.web.metrics.count")).isEqualTo("web.metrics.count");
    assertThat(properties.baseName("other.web")).isEqualTo("other.web");
  }
}
