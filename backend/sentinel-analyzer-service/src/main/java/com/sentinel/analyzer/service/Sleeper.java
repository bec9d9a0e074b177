package com.sentinel.analyzer.service;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = pause -> Thread.sleep(pause.toMillis());

  void sleep(Duration pause) throws InterruptedException;
}
