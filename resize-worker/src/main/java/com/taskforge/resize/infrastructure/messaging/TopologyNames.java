package com.taskforge.resize.infrastructure.messaging;

import com.taskforge.resize.config.WorkerProperties;

/**
 * Exchange and queue names of the retry topology, all derived from the main queue and exchange.
 */
public record TopologyNames(String exchange, String queue, String routingKey) {

  public static TopologyNames from(WorkerProperties.Queue queue) {
    return new TopologyNames(queue.exchange(), queue.name(), queue.routingKey());
  }

  public String retryExchange() { return exchange + ".retry"; }

  public String retryQueue() { return queue + ".retry"; }

  public String deadQueue() { return queue + ".dead"; }
}
