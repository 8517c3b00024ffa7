package com.taskforge.resize.infrastructure.messaging;

import java.util.List;
import java.util.Map;

/**
 * Reads the retry count out of the broker's {@code x-death} header.
 *
 * <p>The header holds one entry per (queue, reason) pair, most recent first, each with an
 * accumulated {@code count}. The entry recording rejections from the main queue is the retry
 * count; without it the first entry is used, and without any history the count is 0.
 */
public final class DeathHistory {
  public static final String HEADER = "x-death";

  private DeathHistory() {}

  public static int retryCount(Object xDeath, String mainQueue) {
    if (!(xDeath instanceof List<?> entries) || entries.isEmpty()) return 0;
    for (Object entry : entries) {
      if (entry instanceof Map<?, ?> death
          && mainQueue.equals(asString(death.get("queue")))
          && "rejected".equals(asString(death.get("reason")))) {
        return count(death);
      }
    }
    return entries.get(0) instanceof Map<?, ?> first ? count(first) : 0;
  }

  private static int count(Map<?, ?> death) {
    Object c = death.get("count");
    if (c instanceof Number n) return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, n.longValue()));
    return 0;
  }

  // broker strings may arrive as LongString
  private static String asString(Object o) {
    return o == null ? null : o.toString();
  }
}
