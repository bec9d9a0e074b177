package com.sentinel.analyzer.scan;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanCancellationTest {

  @Test
  void expiresForGoodOnceTheProbeFails() {
    AtomicBoolean alive = new AtomicBoolean(true);
    ScanCancellation cancellation = new ScanCancellation(alive::get);

    cancellation.ensureActive();
    alive.set(false);
    assertThatThrownBy(cancellation::ensureActive)
        .isInstanceOf(SupervisorLostException.class)
        .hasMessageContaining("no longer alive");

    alive.set(true);
    assertThat(cancellation.isCancelled()).isTrue();
  }

  @Test
  void explicitCancelKeepsTheFirstReason() {
    ScanCancellation cancellation = new ScanCancellation(() -> true);

    cancellation.cancel("shutdown requested");
    cancellation.cancel("later");

    assertThatThrownBy(cancellation::ensureActive).hasMessage("shutdown requested");
  }
}
