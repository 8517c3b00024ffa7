package com.taskforge.resize.application;

public class CircuitBreakerOpenException extends RuntimeException {
  public CircuitBreakerOpenException(String message) {
    super(message);
  }
}
