package com.sentinel.analyzer.classify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyAlgorithmsTest {

  private final double[] calm = {10, 11, 10, 11, 10, 11, 10, 11, 10, 11};
  private final double[] jump = {10, 11, 10, 11, 10, 11, 10, 11, 10, 60};

  @Test
  void medianAbsoluteDeviation() {
    MedianAbsoluteDeviation mad = new MedianAbsoluteDeviation();
    assertThat(mad.isAnomalous(calm)).isFalse();
    assertThat(mad.isAnomalous(jump)).isTrue();
    assertThat(mad.isAnomalous(new double[] {5, 5, 5, 5, 9})).isFalse();
  }

  @Test
  void meanSubtractionCumulation() {
    MeanSubtractionCumulation msc = new MeanSubtractionCumulation();
    assertThat(msc.isAnomalous(calm)).isFalse();
    assertThat(msc.isAnomalous(jump)).isTrue();
    assertThat(msc.isAnomalous(new double[] {1, 50})).isFalse();
  }

  @Test
  void stddevFromAverage() {
    StddevFromAverage sfa = new StddevFromAverage();
    assertThat(sfa.isAnomalous(calm)).isFalse();

    double[] plateau = new double[60];
    for (int i = 0; i < plateau.length; i++) plateau[i] = i % 2 == 0 ? 10 : 11;
    plateau[57] = 200;
    plateau[58] = 200;
    plateau[59] = 200;
    assertThat(sfa.isAnomalous(plateau)).isTrue();
  }
}
