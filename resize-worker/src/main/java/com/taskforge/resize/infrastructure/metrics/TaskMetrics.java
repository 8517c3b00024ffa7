package com.taskforge.resize.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class TaskMetrics {
  public static final String TASK_TYPE = "resize-image";

  private final Counter succeeded;
  private final Counter failed;
  private final Counter retried;
  private final Counter dropped;
  private final Counter uploadFailures;
  private final Timer duration;

  public TaskMetrics(MeterRegistry registry) {
    this.succeeded = Counter.builder("task_processed_total")
        .description("Success/failure per task")
        .tag("type", TASK_TYPE).tag("status", "success")
        .register(registry);
    this.failed = Counter.builder("task_processed_total")
        .description("Success/failure per task")
        .tag("type", TASK_TYPE).tag("status", "failed")
        .register(registry);
    this.retried = Counter.builder("task_retry_attempts_total")
        .description("Deliveries sent back through the retry queue")
        .tag("type", TASK_TYPE)
        .register(registry);
    this.dropped = Counter.builder("task_dropped_total")
        .description("Tasks parked in the dead queue")
        .tag("type", TASK_TYPE)
        .register(registry);
    this.uploadFailures = Counter.builder("s3_upload_failures_total")
        .description("Failed uploads or presigns of task output")
        .tag("type", TASK_TYPE)
        .register(registry);
    this.duration = Timer.builder("task_processing_duration")
        .description("Time spent on successful tasks")
        .tag("type", TASK_TYPE)
        .publishPercentileHistogram()
        .register(registry);
  }

  public void succeeded(Duration elapsed) {
    succeeded.increment();
    duration.record(elapsed);
  }

  public void failed() { failed.increment(); }

  public void retried() { retried.increment(); }

  public void dropped() { dropped.increment(); }

  public void uploadFailed() { uploadFailures.increment(); }
}
