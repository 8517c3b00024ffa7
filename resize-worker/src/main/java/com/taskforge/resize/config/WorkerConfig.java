package com.taskforge.resize.config;

import com.taskforge.resize.application.CircuitBreaker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class WorkerConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  /** Shared by every listener thread of this process. */
  @Bean
  CircuitBreaker circuitBreaker(WorkerProperties props, Clock clock) {
    return new CircuitBreaker(props.breaker().threshold(), props.breaker().timeout(), clock);
  }
}
