package com.taskforge.resize.application;

import com.taskforge.resize.config.WorkerProperties;
import com.taskforge.resize.domain.TaskResult;
import com.taskforge.resize.infrastructure.cache.ResultCache;
import com.taskforge.resize.infrastructure.cache.TaskStatusPublisher;
import com.taskforge.resize.infrastructure.http.ImageDownloader;
import com.taskforge.resize.infrastructure.metrics.TaskMetrics;
import com.taskforge.resize.infrastructure.storage.ObjectStorage;
import com.taskforge.resize.infrastructure.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resizes the image behind {@code imageUrl} and stores it as {@code <prefix>/<taskId>.jpg}.
 *
 * <p>Redeliveries are short-circuited twice before any download happens: first by the result
 * cache, then by an existing object under the task's storage key.
 */
@Service
public class ResizeTaskProcessor implements TaskProcessor {
  private static final Logger log = LoggerFactory.getLogger(ResizeTaskProcessor.class);

  static final Duration UPLOAD_URL_TTL = Duration.ofHours(24);
  static final Duration EXISTING_URL_TTL = Duration.ofHours(1);

  private final ResultCache cache;
  private final TaskStatusPublisher status;
  private final ObjectStorage storage;
  private final ImageDownloader downloader;
  private final ImageResizer resizer;
  private final Duration cacheTtl;
  private final String keyPrefix;

  public ResizeTaskProcessor(ResultCache cache, TaskStatusPublisher status, ObjectStorage storage,
                             ImageDownloader downloader, ImageResizer resizer, WorkerProperties props) {
    this.cache = cache;
    this.status = status;
    this.storage = storage;
    this.downloader = downloader;
    this.resizer = resizer;
    this.cacheTtl = props.cache().ttl();
    this.keyPrefix = props.storage().prefix();
  }

  @Override
  public TaskResult process(String taskId, Map<String, Object> payload) {
    ResizeRequest req;
    try {
      req = ResizeRequest.from(payload);
    } catch (IllegalArgumentException e) {
      return fail(taskId, "Invalid task payload", "invalid payload: " + e.getMessage());
    }

    Optional<Map<String, Object>> cached = cache.get(TaskMetrics.TASK_TYPE, taskId);
    if (cached.isPresent()) {
      log.info("Serving cached output for task {}", taskId);
      status.publish(taskId, cached.get());
      return TaskResult.success(urlOf(cached.get()), cached.get());
    }

    String key = keyPrefix + "/" + taskId + ".jpg";
    Optional<TaskResult> existing = fromExistingObject(taskId, key);
    if (existing.isPresent()) return existing.get();

    log.info("Resizing image to {}x{}: {}", req.width(), req.height(), req.imageUrl());
    byte[] original;
    try {
      original = downloader.download(req.imageUrl());
    } catch (RestClientException e) {
      return fail(taskId, "Failed to download image", "download: " + e.getMessage());
    }

    byte[] encoded;
    try {
      BufferedImage img = resizer.decode(original);
      encoded = resizer.encodeJpeg(resizer.resize(img, req.width(), req.height()));
    } catch (IOException e) {
      return fail(taskId, "Invalid image format", "decode/encode: " + e.getMessage());
    }

    String url;
    try {
      url = storage.upload(encoded, key, "image/jpeg", UPLOAD_URL_TTL);
    } catch (StorageException e) {
      return fail(taskId, "S3 upload failed", "upload: " + e.getMessage());
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("success", true);
    result.put("url", url);
    result.put("width", req.width());
    result.put("height", req.height());
    status.publish(taskId, result);
    cache.put(TaskMetrics.TASK_TYPE, taskId, result, cacheTtl);
    log.info("Resized image uploaded: {}", key);
    return TaskResult.success(url, result);
  }

  // storage errors fall through to a full reprocess
  private Optional<TaskResult> fromExistingObject(String taskId, String key) {
    try {
      if (!storage.exists(key)) return Optional.empty();
      String url = storage.presign(key, EXISTING_URL_TTL);
      Map<String, Object> result = new LinkedHashMap<>();
      result.put("success", true);
      result.put("url", url);
      result.put("cached", true);
      status.publish(taskId, result);
      cache.put(TaskMetrics.TASK_TYPE, taskId, result, cacheTtl);
      log.info("Output already in storage for task {}", taskId);
      return Optional.of(TaskResult.success(url, result));
    } catch (StorageException e) {
      log.warn("Storage lookup failed for {}; processing from source", key, e);
      return Optional.empty();
    }
  }

  private TaskResult fail(String taskId, String publicError, String reason) {
    log.warn("Task {} failed: {}", taskId, reason);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("success", false);
    result.put("error", publicError);
    status.publish(taskId, result);
    return TaskResult.failure(reason);
  }

  private static String urlOf(Map<String, Object> result) {
    Object url = result.get("url");
    return url instanceof String s ? s : null;
  }
}
