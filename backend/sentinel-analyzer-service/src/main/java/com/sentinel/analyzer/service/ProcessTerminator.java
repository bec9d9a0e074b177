package com.sentinel.analyzer.service;

@FunctionalInterface
public interface ProcessTerminator {

  void terminate(int status);
}
