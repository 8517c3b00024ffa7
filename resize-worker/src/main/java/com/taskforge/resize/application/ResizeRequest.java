package com.taskforge.resize.application;

import java.util.Map;

/**
 * Typed view over a resize task payload: {@code imageUrl}, {@code width}, {@code height}.
 *
 * <p>Each side is capped at {@value #MAX_SIDE} pixels and the area at {@value #MAX_PIXELS}.
 */
record ResizeRequest(String imageUrl, int width, int height) {
  static final int MAX_SIDE = 10_000;
  static final long MAX_PIXELS = 40_000_000L;

  static ResizeRequest from(Map<String, Object> payload) {
    Object url = payload.get("imageUrl");
    if (!(url instanceof String s) || s.isBlank()) {
      throw new IllegalArgumentException("imageUrl must be a non-empty string");
    }
    int width = dimension(payload, "width");
    int height = dimension(payload, "height");
    if ((long) width * height > MAX_PIXELS) {
      throw new IllegalArgumentException("width x height must be at most " + MAX_PIXELS + " pixels");
    }
    return new ResizeRequest(s, width, height);
  }

  private static int dimension(Map<String, Object> payload, String field) {
    Object v = payload.get(field);
    if (!(v instanceof Number n)) {
      throw new IllegalArgumentException(field + " must be a number");
    }
    long value = n.longValue();
    if (value <= 0) {
      throw new IllegalArgumentException(field + " must be positive");
    }
    if (value > MAX_SIDE) {
      throw new IllegalArgumentException(field + " must be at most " + MAX_SIDE);
    }
    return (int) value;
  }
}
