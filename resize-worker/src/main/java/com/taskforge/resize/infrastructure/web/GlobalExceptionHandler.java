package com.taskforge.resize.infrastructure.web;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.time.Instant;

/**
 * JSON error bodies for the worker's HTTP surface ({@code /live}, {@code /health}, actuator).
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  public record ErrorBody(Instant timestamp, int status, String error, String path) {}

  private final Clock clock;

  public GlobalExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorBody> notFound(NoResourceFoundException ex, HttpServletRequest request) {
    return respond(HttpStatus.NOT_FOUND, "No endpoint " + request.getRequestURI(), request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorBody> methodNotAllowed(HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), request);
  }

  // health checks must not leak dependency error details
  @ExceptionHandler(Throwable.class)
  public ResponseEntity<ErrorBody> unexpected(Throwable ex, HttpServletRequest request) {
    log.error("Request {} {} failed", request.getMethod(), request.getRequestURI(), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(), request);
  }

  private ResponseEntity<ErrorBody> respond(HttpStatus status, String error, HttpServletRequest request) {
    String message = error == null || error.isBlank() ? status.getReasonPhrase() : error;
    return ResponseEntity.status(status)
        .body(new ErrorBody(clock.instant(), status.value(), message, request.getRequestURI()));
  }
}
