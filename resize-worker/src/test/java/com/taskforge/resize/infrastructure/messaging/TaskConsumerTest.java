package com.taskforge.resize.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import com.taskforge.resize.application.CircuitBreaker;
import com.taskforge.resize.application.TaskProcessor;
import com.taskforge.resize.domain.TaskResult;
import com.taskforge.resize.infrastructure.metrics.TaskMetrics;
import com.taskforge.resize.support.MutableClock;
import com.taskforge.resize.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(OutputCaptureExtension.class)
public class TaskConsumerTest {

  private static final String BODY =
      "{\"id\":\"task-1\",\"type\":\"resize-image\",\"payload\":{\"imageUrl\":\"http://img/a.png\",\"width\":10,\"height\":10}}";

  private TaskProcessor processor;
  private RabbitTemplate template;
  private Channel channel;
  private SimpleMeterRegistry registry;
  private CircuitBreaker breaker;
  private TaskConsumer consumer;
  private long nextTag;

  @BeforeEach
  void setUp() {
    processor = mock(TaskProcessor.class);
    template = mock(RabbitTemplate.class);
    channel = mock(Channel.class);
    registry = new SimpleMeterRegistry();
    breaker = new CircuitBreaker(5, Duration.ofSeconds(60), new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
    BrokerTopology topology = new BrokerTopology(mock(AmqpAdmin.class),
        new TopologyNames("tasks", "resize.tasks", "resize-image"), Duration.ofSeconds(30));
    consumer = new TaskConsumer(new TaskMessageDecoder(new ObjectMapper()), breaker, processor, template,
        new TaskMetrics(registry), topology, TestProperties.withMaxRetries(3));
    nextTag = 1;
  }

  private Message delivery(String body, long deathCount) {
    MessageProperties props = new MessageProperties();
    props.setDeliveryTag(nextTag++);
    if (deathCount > 0) {
      props.setHeader("x-death", List.of(
          Map.of("queue", "resize.tasks.retry", "reason", "expired", "count", deathCount),
          Map.of("queue", "resize.tasks", "reason", "rejected", "count", deathCount)));
    }
    return new Message(body.getBytes(StandardCharsets.UTF_8), props);
  }

  private double counter(String name, String... tags) {
    return registry.get(name).tags(tags).counter().count();
  }

  @Test
  void success_acksOnce_andRecordsSuccess() throws Exception {
    when(processor.process(eq("task-1"), anyMap())).thenReturn(TaskResult.success("http://s3/x.jpg", Map.of()));

    consumer.handle(delivery(BODY, 0), channel);

    verify(channel).basicAck(1L, false);
    verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    assertThat(counter("task_processed_total", "status", "success")).isEqualTo(1.0d);
    assertThat(counter("task_retry_attempts_total")).isZero();
    assertThat(registry.get("task_processing_duration").timer().count()).isEqualTo(1L);
    verifyNoInteractions(template);
  }

  @Test
  void passesPayloadToProcessor() {
    when(processor.process(anyString(), anyMap())).thenReturn(TaskResult.success("u", Map.of()));

    consumer.handle(delivery(BODY, 0), channel);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
    verify(processor).process(eq("task-1"), payload.capture());
    assertThat(payload.getValue()).containsEntry("imageUrl", "http://img/a.png").containsEntry("width", 10);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2})
  void failsKTimesThenSucceeds(int k) throws Exception {
    TaskResult[] outcomes = new TaskResult[k + 1];
    for (int i = 0; i < k; i++) outcomes[i] = TaskResult.failure("download: timeout");
    outcomes[k] = TaskResult.success("http://s3/x.jpg", Map.of());
    when(processor.process(anyString(), anyMap()))
        .thenReturn(outcomes[0], Arrays.copyOfRange(outcomes, 1, outcomes.length));

    for (int attempt = 0; attempt <= k; attempt++) {
      consumer.handle(delivery(BODY, attempt), channel);
    }

    verify(channel, times(k)).basicNack(anyLong(), eq(false), eq(false));
    verify(channel, times(1)).basicAck(anyLong(), eq(false));
    verify(channel).basicAck(k + 1L, false);
    assertThat(counter("task_retry_attempts_total")).isEqualTo((double) k);
    assertThat(counter("task_processed_total", "status", "success")).isEqualTo(1.0d);
    verifyNoInteractions(template);
  }

  @Test
  void exhaustedRetries_parkInDeadQueue_thenAck() throws Exception {
    when(processor.process(anyString(), anyMap())).thenReturn(TaskResult.failure("upload: denied"));

    for (int attempt = 0; attempt <= 3; attempt++) {
      consumer.handle(delivery(BODY, attempt), channel);
    }

    verify(channel, times(3)).basicNack(anyLong(), eq(false), eq(false));
    ArgumentCaptor<Message> parked = ArgumentCaptor.forClass(Message.class);
    verify(template, times(1)).send(eq(""), eq("resize.tasks.dead"), parked.capture());
    assertThat(new String(parked.getValue().getBody(), StandardCharsets.UTF_8)).isEqualTo(BODY);
    assertThat(parked.getValue().getMessageProperties().getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);

    InOrder order = inOrder(template, channel);
    order.verify(template).send(eq(""), eq("resize.tasks.dead"), any(Message.class));
    order.verify(channel).basicAck(4L, false);
    verify(channel, never()).basicNack(eq(4L), anyBoolean(), anyBoolean());

    assertThat(counter("task_dropped_total")).isEqualTo(1.0d);
    assertThat(counter("task_retry_attempts_total")).isEqualTo(3.0d);
    assertThat(counter("task_processed_total", "status", "failed")).isEqualTo(4.0d);
  }

  @Test
  void deathCountAtMaximum_isNotNackedAgain() throws Exception {
    when(processor.process(anyString(), anyMap())).thenReturn(TaskResult.failure("boom"));

    consumer.handle(delivery(BODY, 3), channel);

    verify(template).send(eq(""), eq("resize.tasks.dead"), any(Message.class));
    verify(channel).basicAck(1L, false);
    verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
  }

  @Test
  void deadQueuePublishFailure_nacksInsteadOfAcking() throws Exception {
    when(processor.process(anyString(), anyMap())).thenReturn(TaskResult.failure("boom"));
    doThrow(new AmqpConnectException(new ConnectException("refused")))
        .when(template).send(anyString(), anyString(), any(Message.class));

    consumer.handle(delivery(BODY, 3), channel);

    verify(channel).basicNack(1L, false, false);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
    assertThat(counter("task_dropped_total")).isZero();
  }

  @Test
  void malformedBody_nacksWithoutInvokingProcessorOrBreaker() throws Exception {
    consumer.handle(delivery("{\"id\": 123}", 0), channel);

    verify(channel).basicNack(1L, false, false);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
    verifyNoInteractions(processor, template);
    assertThat(breaker.failureCount()).isZero();
    assertThat(counter("task_retry_attempts_total")).isZero();
  }

  @Test
  void openBreaker_shortCircuitsAndFollowsRetryAccounting() throws Exception {
    when(processor.process(anyString(), anyMap())).thenReturn(TaskResult.failure("source unreachable"));
    for (int i = 0; i < 5; i++) consumer.handle(delivery(BODY, 0), channel);
    assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.OPEN);

    consumer.handle(delivery(BODY, 0), channel);

    verify(processor, times(5)).process(anyString(), anyMap());
    verify(channel).basicNack(6L, false, false);
    assertThat(counter("task_retry_attempts_total")).isEqualTo(6.0d);
  }

  @Test
  void processorException_isTreatedAsFailure() throws Exception {
    when(processor.process(anyString(), anyMap())).thenThrow(new IllegalStateException("bug"));

    consumer.handle(delivery(BODY, 0), channel);

    verify(channel).basicNack(1L, false, false);
    assertThat(breaker.failureCount()).isEqualTo(1);
  }

  @Test
  void ackFailure_surfacesAsAmqpException() throws Exception {
    when(processor.process(anyString(), anyMap())).thenReturn(TaskResult.success("u", Map.of()));
    doThrow(new IOException("channel closed")).when(channel).basicAck(anyLong(), anyBoolean());

    assertThatThrownBy(() -> consumer.handle(delivery(BODY, 0), channel)).isInstanceOf(AmqpIOException.class);
  }

  @Test
  void errorFromProcessor_rejectsDeliveryBeforePropagating() throws Exception {
    when(processor.process(anyString(), anyMap())).thenThrow(new OutOfMemoryError("Java heap space"));

    assertThatThrownBy(() -> consumer.handle(delivery(BODY, 0), channel)).isInstanceOf(OutOfMemoryError.class);

    verify(channel).basicNack(1L, false, false);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
  }

  @Test
  void errorWithFailingNack_keepsErrorAndRecordsNackFailure() throws Exception {
    when(processor.process(anyString(), anyMap())).thenThrow(new StackOverflowError());
    doThrow(new IOException("channel closed")).when(channel).basicNack(anyLong(), anyBoolean(), anyBoolean());

    Throwable thrown = catchThrowable(() -> consumer.handle(delivery(BODY, 0), channel));

    assertThat(thrown).isInstanceOf(StackOverflowError.class);
    assertThat(thrown.getSuppressed()).hasSize(1).hasOnlyElementsOfType(AmqpIOException.class);
  }

  @Test
  void malformedBody_logsDeliveryTagAndMessageId(CapturedOutput output) {
    Message message = delivery("not json", 0);
    message.getMessageProperties().setMessageId("msg-42");

    consumer.handle(message, channel);

    assertThat(output).contains("deliveryTag=1").contains("messageId=msg-42");
  }
}
