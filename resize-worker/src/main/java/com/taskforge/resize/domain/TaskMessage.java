package com.taskforge.resize.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of work as produced upstream. {@code id} is stable across redeliveries.
 */
public record TaskMessage(
    String id,
    String type,
    String userId,
    Map<String, Object> payload,
    String traceId,
    String createdAt) {

  public TaskMessage {
    payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
