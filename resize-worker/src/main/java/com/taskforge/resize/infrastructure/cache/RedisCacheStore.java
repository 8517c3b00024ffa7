package com.taskforge.resize.infrastructure.cache;

import com.taskforge.resize.infrastructure.health.HealthCheckable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Component
public class RedisCacheStore implements CacheStore, HealthCheckable {
  private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

  private final StringRedisTemplate redis;

  public RedisCacheStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redis.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redis.opsForValue().set(key, value, ttl);
  }

  @Override
  public void publish(String channel, String message) {
    redis.convertAndSend(channel, message);
  }

  @Override
  public String name() { return "redis"; }

  @Override
  public boolean isHealthy() {
    try {
      String pong = redis.execute((RedisCallback<String>) RedisConnection::ping, true);
      return "PONG".equalsIgnoreCase(pong);
    } catch (RuntimeException e) {
      log.debug("Redis ping failed", e);
      return false;
    }
  }
}
