package com.taskforge.resize.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one processing attempt: either success with an output URL, or failure with a reason.
 */
public record TaskResult(boolean success, String outputUrl, Map<String, Object> metadata, String reason) {

  public TaskResult {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static TaskResult success(String outputUrl, Map<String, Object> metadata) {
    return new TaskResult(true, outputUrl, metadata, null);
  }

  public static TaskResult failure(String reason) {
    return new TaskResult(false, null, Map.of(), reason);
  }
}
