package com.taskforge.resize.infrastructure.messaging;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.resize.domain.TaskMessage;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Strict JSON decoding of a task body. String fields must be JSON strings (or null/absent),
 * {@code payload} must be an object, and {@code id} must be present.
 */
@Component
public class TaskMessageDecoder {
  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public TaskMessageDecoder(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public TaskMessage decode(byte[] body) throws MalformedTaskException {
    JsonNode n;
    try {
      n = mapper.readTree(body);
    } catch (IOException e) {
      throw new MalformedTaskException("body is not valid JSON", e);
    }
    if (n == null || !n.isObject()) throw new MalformedTaskException("body is not a JSON object");

    String id = text(n, "id");
    if (id == null || id.isBlank()) throw new MalformedTaskException("id is missing");

    Map<String, Object> payload = null;
    JsonNode p = n.get("payload");
    if (p != null && !p.isNull()) {
      if (!p.isObject()) throw new MalformedTaskException("payload must be an object");
      try {
        payload = mapper.convertValue(p, PAYLOAD_TYPE);
      } catch (IllegalArgumentException e) {
        throw new MalformedTaskException("payload is not decodable", e);
      }
    }
    return new TaskMessage(id, text(n, "type"), text(n, "userId"), payload,
        text(n, "traceId"), text(n, "createdAt"));
  }

  private static String text(JsonNode n, String field) throws MalformedTaskException {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return null;
    if (!v.isTextual()) throw new MalformedTaskException(field + " must be a string");
    return v.asText();
  }
}
