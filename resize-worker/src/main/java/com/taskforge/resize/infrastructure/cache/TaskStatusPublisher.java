package com.taskforge.resize.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Announces task outcomes on {@code task:<taskId>:status} for out-of-band listeners.
 */
@Component
public class TaskStatusPublisher {
  private static final Logger log = LoggerFactory.getLogger(TaskStatusPublisher.class);

  private final CacheStore store;
  private final ObjectMapper mapper;

  public TaskStatusPublisher(CacheStore store, ObjectMapper mapper) {
    this.store = store;
    this.mapper = mapper;
  }

  static String channel(String taskId) {
    return "task:" + taskId + ":status";
  }

  public void publish(String taskId, Map<String, Object> status) {
    String channel = channel(taskId);
    try {
      store.publish(channel, mapper.writeValueAsString(status));
      log.info("Result published on {}", channel);
    } catch (DataAccessException | JsonProcessingException e) {
      log.error("Result publish failed on {}", channel, e);
    }
  }
}
