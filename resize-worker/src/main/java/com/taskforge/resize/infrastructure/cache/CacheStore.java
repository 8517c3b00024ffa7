package com.taskforge.resize.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with expiry and a pub/sub side channel. Implementations must be safe for
 * concurrent use and throw {@link org.springframework.dao.DataAccessException} on store failures.
 */
public interface CacheStore {
  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  void publish(String channel, String message);
}
