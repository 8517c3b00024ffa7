package com.taskforge.resize.infrastructure.messaging;

public class MalformedTaskException extends Exception {
  public MalformedTaskException(String message) {
    super(message);
  }

  public MalformedTaskException(String message, Throwable cause) {
    super(message, cause);
  }
}
