package com.taskforge.resize.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Idempotency cache of completed task results, keyed by task type and task id.
 *
 * <p>Best-effort in both directions: a store or decoding failure on read is a miss, a failure on
 * write is logged and dropped. Neither ever fails the task.
 */
@Component
public class ResultCache {
  private static final Logger log = LoggerFactory.getLogger(ResultCache.class);
  private static final TypeReference<Map<String, Object>> RESULT_TYPE = new TypeReference<>() {};

  private final CacheStore store;
  private final ObjectMapper mapper;

  public ResultCache(CacheStore store, ObjectMapper mapper) {
    this.store = store;
    this.mapper = mapper;
  }

  static String key(String taskType, String taskId) {
    return "task:" + taskType + ":" + taskId + ":output";
  }

  public Optional<Map<String, Object>> get(String taskType, String taskId) {
    String key = key(taskType, taskId);
    try {
      Optional<String> raw = store.get(key);
      if (raw.isEmpty()) return Optional.empty();
      Map<String, Object> result = mapper.readValue(raw.get(), RESULT_TYPE);
      log.info("Found cached output for {}", key);
      return Optional.ofNullable(result);
    } catch (DataAccessException e) {
      log.warn("Cache read failed for {}; treating as miss", key, e);
      return Optional.empty();
    } catch (JsonProcessingException e) {
      log.warn("Cached output for {} is not valid JSON; treating as miss", key, e);
      return Optional.empty();
    }
  }

  public void put(String taskType, String taskId, Map<String, Object> result, Duration ttl) {
    String key = key(taskType, taskId);
    try {
      store.set(key, mapper.writeValueAsString(result), ttl);
      log.debug("Cached output for {} (ttl {}s)", key, ttl.toSeconds());
    } catch (DataAccessException | JsonProcessingException e) {
      log.warn("Cache write failed for {}", key, e);
    }
  }
}
