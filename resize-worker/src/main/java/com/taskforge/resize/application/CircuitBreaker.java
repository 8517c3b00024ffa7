package com.taskforge.resize.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide breaker guarding the downstream calls made while processing a task.
 *
 * <p>CLOSED lets every call through and counts consecutive failures; reaching the threshold opens
 * the breaker. OPEN rejects calls with {@link CircuitBreakerOpenException} until more than
 * {@code timeout} has passed since the last failure, then admits a single HALF_OPEN probe whose
 * outcome closes or re-opens it.
 *
 * <p>State is guarded by one lock; the work itself runs outside of it. Calls arriving while a probe
 * is still running are rejected as if the breaker were open. A success from a call admitted before
 * the breaker last opened does not close it.
 */
public class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  public enum State { CLOSED, OPEN, HALF_OPEN }

  private final int threshold;
  private final Duration timeout;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private State state = State.CLOSED;
  private int failureCount;
  private Instant lastFailureAt;
  private boolean probeInFlight;
  // bumped every time the breaker opens
  private long generation;

  private record Admission(boolean probe, long generation) {}

  public CircuitBreaker(int threshold, Duration timeout, Clock clock) {
    if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
    if (timeout == null || timeout.isNegative()) throw new IllegalArgumentException("timeout must be >= 0");
    this.threshold = threshold;
    this.timeout = timeout;
    this.clock = clock;
  }

  public <T> T execute(Callable<T> work) throws Exception {
    Admission admission = admit();
    T result;
    try {
      result = work.call();
    } catch (Exception e) {
      onFailure(admission.probe());
      throw e;
    } catch (Error e) {
      onFailure(admission.probe());
      throw e;
    }
    onSuccess(admission);
    return result;
  }

  private Admission admit() {
    lock.lock();
    try {
      if (state == State.OPEN) {
        Duration elapsed = Duration.between(lastFailureAt, clock.instant());
        if (elapsed.compareTo(timeout) > 0) {
          state = State.HALF_OPEN;
          log.info("Circuit breaker HALF_OPEN after {} ms cooldown", elapsed.toMillis());
        } else {
          throw new CircuitBreakerOpenException("circuit breaker is OPEN");
        }
      }
      if (state == State.HALF_OPEN) {
        if (probeInFlight) throw new CircuitBreakerOpenException("circuit breaker is HALF_OPEN, probe in flight");
        probeInFlight = true;
        return new Admission(true, generation);
      }
      return new Admission(false, generation);
    } finally {
      lock.unlock();
    }
  }

  private void onSuccess(Admission admission) {
    lock.lock();
    try {
      if (admission.probe()) {
        probeInFlight = false;
        log.info("Circuit breaker CLOSED");
        failureCount = 0;
        state = State.CLOSED;
      } else if (state == State.CLOSED && admission.generation() == generation) {
        failureCount = 0;
      } else {
        log.debug("Ignoring success admitted before the breaker opened");
      }
    } finally {
      lock.unlock();
    }
  }

  private void onFailure(boolean probe) {
    lock.lock();
    try {
      if (probe) probeInFlight = false;
      failureCount++;
      lastFailureAt = clock.instant();
      if (probe || failureCount >= threshold) {
        if (state != State.OPEN) {
          log.warn("Circuit breaker OPEN after {} consecutive failures", failureCount);
          generation++;
        }
        state = State.OPEN;
      }
    } finally {
      lock.unlock();
    }
  }

  public State state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public int failureCount() {
    lock.lock();
    try {
      return failureCount;
    } finally {
      lock.unlock();
    }
  }
}
