package com.taskforge.resize.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Environment-driven worker settings. Binding or validation failure aborts startup.
 */
@Validated
@ConfigurationProperties(prefix = "worker")
public record WorkerProperties(
    @Valid @NotNull Queue queue,
    @Valid @DefaultValue Retry retry,
    @Valid @DefaultValue Breaker breaker,
    @Valid @DefaultValue Cache cache,
    @Valid @NotNull Storage storage,
    @DefaultValue("1") @Min(1) int consumers) {

  public record Queue(
      @NotBlank String name,
      @NotBlank String exchange,
      @NotBlank String routingKey,
      @DefaultValue("1") @Min(1) int prefetch) {}

  public record Retry(
      @DefaultValue("3") @Min(0) int maxRetries,
      @DefaultValue("30s") @NotNull Duration delay) {}

  public record Breaker(
      @DefaultValue("5") @Min(1) int threshold,
      @DefaultValue("60s") @NotNull Duration timeout) {}

  public record Cache(
      @DefaultValue("3600s") @NotNull Duration ttl) {}

  public record Storage(
      @NotBlank String bucket,
      @DefaultValue("us-east-1") @NotBlank String region,
      String endpoint,
      @DefaultValue("false") boolean pathStyleAccess,
      @DefaultValue("image") @NotBlank String prefix) {}
}
