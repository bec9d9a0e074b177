package com.sentinel.analyzer.service;

import com.sentinel.analyzer.scan.LivenessProbe;

public class ProcessLivenessProbe implements LivenessProbe {

  private final ProcessHandle self;
  private final ProcessHandle supervisor;

  public ProcessLivenessProbe(ProcessHandle self, ProcessHandle supervisor) {
    this.self = self;
    this.supervisor = supervisor;
  }

  @Override
  public boolean isAlive() {
    return self.isAlive() && (supervisor == null || supervisor.isAlive());
  }

  public Long supervisorPid() {
    return supervisor == null ? null : supervisor.pid();
  }
}
