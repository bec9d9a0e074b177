package com.sentinel.analyzer.store;

public class MalformedSeriesException extends Exception {

  public MalformedSeriesException(String message) {
    super(message);
  }

  public MalformedSeriesException(String message, Throwable cause) {
    super(message, cause);
  }
}
