package com.taskforge.resize.infrastructure.messaging;

import com.rabbitmq.client.Channel;
import com.taskforge.resize.application.CircuitBreaker;
import com.taskforge.resize.application.CircuitBreakerOpenException;
import com.taskforge.resize.application.TaskFailedException;
import com.taskforge.resize.application.TaskProcessor;
import com.taskforge.resize.config.WorkerProperties;
import com.taskforge.resize.domain.TaskMessage;
import com.taskforge.resize.domain.TaskResult;
import com.taskforge.resize.infrastructure.metrics.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * Settles each delivery of the main queue exactly once:
 * <ul>
 *   <li>success: ack;</li>
 *   <li>failure with retries left: nack without requeue, so the broker routes it through the retry queue;</li>
 *   <li>failure with retries exhausted: copy the body to the dead queue, then ack;</li>
 *   <li>undecodable body: nack without requeue, without touching the breaker or processor;</li>
 *   <li>{@link Error} raised while processing: nack without requeue, then rethrow.</li>
 * </ul>
 */
@Component
public class TaskConsumer {
  private static final Logger log = LoggerFactory.getLogger(TaskConsumer.class);

  private final TaskMessageDecoder decoder;
  private final CircuitBreaker breaker;
  private final TaskProcessor processor;
  private final RabbitTemplate rabbitTemplate;
  private final TaskMetrics metrics;
  private final TopologyNames names;
  private final int maxRetries;

  public TaskConsumer(TaskMessageDecoder decoder, CircuitBreaker breaker, TaskProcessor processor,
                      RabbitTemplate rabbitTemplate, TaskMetrics metrics, BrokerTopology topology,
                      WorkerProperties props) {
    this.decoder = decoder;
    this.breaker = breaker;
    this.processor = processor;
    this.rabbitTemplate = rabbitTemplate;
    this.metrics = metrics;
    this.names = topology.names();
    this.maxRetries = props.retry().maxRetries();
  }

  @RabbitListener(queues = "${worker.queue.name}")
  public void handle(Message message, Channel channel) {
    long start = System.nanoTime();
    long tag = message.getMessageProperties().getDeliveryTag();

    TaskMessage task;
    try {
      task = decoder.decode(message.getBody());
    } catch (MalformedTaskException e) {
      log.error("Invalid task format [deliveryTag={}, messageId={}]: {}",
          tag, message.getMessageProperties().getMessageId(), e.getMessage());
      nack(channel, tag);
      return;
    }

    MDC.put("taskId", task.id());
    try {
      log.info("Received task: {}", task.id());
      int retryCount = DeathHistory.retryCount(
          message.getMessageProperties().getHeaders().get(DeathHistory.HEADER), names.queue());

      boolean ok;
      try {
        ok = execute(task);
      } catch (Error e) {
        log.error("Task {} aborted by {}, rejecting delivery", task.id(), e.getClass().getName());
        try {
          nack(channel, tag);
        } catch (AmqpIOException nackFailure) {
          e.addSuppressed(nackFailure);
        }
        throw e;
      }
      if (ok) {
        metrics.succeeded(Duration.ofNanos(System.nanoTime() - start));
        ack(channel, tag);
        return;
      }

      metrics.failed();
      log.info("Task {} failed [retry {}/{}]", task.id(), retryCount, maxRetries);
      if (retryCount >= maxRetries) {
        parkInDeadQueue(message, channel, tag, task);
      } else {
        metrics.retried();
        nack(channel, tag);
      }
    } finally {
      MDC.remove("taskId");
    }
  }

  private boolean execute(TaskMessage task) {
    try {
      breaker.execute(() -> {
        TaskResult result = processor.process(task.id(), task.payload());
        if (!result.success()) throw new TaskFailedException(result.reason());
        return result;
      });
      return true;
    } catch (CircuitBreakerOpenException e) {
      log.warn("Task {} short-circuited: {}", task.id(), e.getMessage());
      return false;
    } catch (TaskFailedException e) {
      log.warn("Task {} processing failed: {}", task.id(), e.getMessage());
      return false;
    } catch (Exception e) {
      log.error("Task {} processing threw", task.id(), e);
      return false;
    }
  }

  private void parkInDeadQueue(Message message, Channel channel, long tag, TaskMessage task) {
    log.info("Task {} exceeded retry limit, sending to {}", task.id(), names.deadQueue());
    MessageProperties props = new MessageProperties();
    props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
    try {
      rabbitTemplate.send("", names.deadQueue(), new Message(message.getBody(), props));
    } catch (AmqpException e) {
      // back through the retry queue; the next failure tries the dead queue again
      log.error("Dead queue publish failed for task {}", task.id(), e);
      nack(channel, tag);
      return;
    }
    metrics.dropped();
    ack(channel, tag);
  }

  private static void ack(Channel channel, long tag) {
    try {
      channel.basicAck(tag, false);
    } catch (IOException e) {
      throw new AmqpIOException(e);
    }
  }

  private static void nack(Channel channel, long tag) {
    try {
      channel.basicNack(tag, false, false);
    } catch (IOException e) {
      throw new AmqpIOException(e);
    }
  }
}
