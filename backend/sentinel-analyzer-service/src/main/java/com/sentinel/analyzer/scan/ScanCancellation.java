package com.sentinel.analyzer.scan;

public class ScanCancellation {

  private final LivenessProbe probe;
  private volatile String reason;

  public ScanCancellation(LivenessProbe probe) {
    this.probe = probe;
  }

  public void cancel(String reason) {
    if (this.reason == null) this.reason = reason;
  }

  public boolean isCancelled() {
    if (reason == null && !probe.isAlive()) {
      cancel("supervising process is no longer alive");
    }
    return reason != null;
  }

  public void ensureActive() {
    if (isCancelled()) throw new SupervisorLostException(reason);
  }
}
