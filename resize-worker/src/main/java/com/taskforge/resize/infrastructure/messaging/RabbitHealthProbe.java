package com.taskforge.resize.infrastructure.messaging;

import com.taskforge.resize.infrastructure.health.HealthCheckable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Broker reachability for {@code /health}. With the broker down each check costs at most
 * {@code spring.rabbitmq.connection-timeout}.
 */
@Component
public class RabbitHealthProbe implements HealthCheckable {
  private static final Logger log = LoggerFactory.getLogger(RabbitHealthProbe.class);

  private final ConnectionFactory connectionFactory;

  public RabbitHealthProbe(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
  }

  @Override
  public String name() { return "rabbitMQ"; }

  @Override
  public boolean isHealthy() {
    // the caching factory hands out its shared connection; close() does not close it
    try (Connection connection = connectionFactory.createConnection()) {
      return connection.isOpen();
    } catch (AmqpException e) {
      log.debug("RabbitMQ connection check failed", e);
      return false;
    }
  }
}
