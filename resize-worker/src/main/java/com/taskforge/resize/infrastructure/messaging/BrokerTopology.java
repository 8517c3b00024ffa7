package com.taskforge.resize.infrastructure.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import java.time.Duration;

/**
 * Declares the delayed-retry topology:
 *
 * <pre>
 * exchange --rk--> queue --nack--> exchange.retry --rk--> queue.retry --ttl--> exchange
 *                                                                  queue.dead (manual)
 * </pre>
 *
 * Declarations are idempotent and run on every start. Any failure propagates and aborts startup.
 */
public class BrokerTopology {
  private static final Logger log = LoggerFactory.getLogger(BrokerTopology.class);

  private final AmqpAdmin admin;
  private final TopologyNames names;
  private final Duration retryDelay;

  public BrokerTopology(AmqpAdmin admin, TopologyNames names, Duration retryDelay) {
    this.admin = admin;
    this.names = names;
    this.retryDelay = retryDelay;
  }

  public TopologyNames names() { return names; }

  public void declare() {
    DirectExchange main = ExchangeBuilder.directExchange(names.exchange()).durable(true).build();
    DirectExchange retry = ExchangeBuilder.directExchange(names.retryExchange()).durable(true).build();
    admin.declareExchange(main);
    admin.declareExchange(retry);

    Queue retryQueue = QueueBuilder.durable(names.retryQueue())
        .deadLetterExchange(names.exchange())
        .deadLetterRoutingKey(names.routingKey())
        .ttl(Math.toIntExact(retryDelay.toMillis()))
        .build();
    admin.declareQueue(retryQueue);
    admin.declareBinding(BindingBuilder.bind(retryQueue).to(retry).with(names.routingKey()));

    Queue mainQueue = QueueBuilder.durable(names.queue())
        .deadLetterExchange(names.retryExchange())
        .deadLetterRoutingKey(names.routingKey())
        .build();
    admin.declareQueue(mainQueue);
    admin.declareBinding(BindingBuilder.bind(mainQueue).to(main).with(names.routingKey()));

    admin.declareQueue(QueueBuilder.durable(names.deadQueue()).build());

    log.info("Retry topology ready: queue={} retry={} ttl={}s dead={}",
        names.queue(), names.retryExchange(), retryDelay.toSeconds(), names.deadQueue());
  }
}
