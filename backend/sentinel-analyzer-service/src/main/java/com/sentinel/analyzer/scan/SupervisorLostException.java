package com.sentinel.analyzer.scan;

public class SupervisorLostException extends RuntimeException {

  public SupervisorLostException(String message) {
    super(message);
  }
}
