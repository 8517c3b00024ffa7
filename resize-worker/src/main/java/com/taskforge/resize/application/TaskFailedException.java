package com.taskforge.resize.application;

/**
 * Raised at the breaker boundary when a processor reports a failed {@link com.taskforge.resize.domain.TaskResult}.
 */
public class TaskFailedException extends RuntimeException {
  public TaskFailedException(String reason) {
    super(reason);
  }
}
