package com.taskforge.resize.infrastructure.messaging;

import com.taskforge.resize.config.WorkerProperties;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitConfig {

  @Bean(initMethod = "declare")
  BrokerTopology brokerTopology(AmqpAdmin admin, WorkerProperties props) {
    return new BrokerTopology(admin, TopologyNames.from(props.queue()), props.retry().delay());
  }

  /**
   * Manual acknowledgement: the consumer settles every delivery itself. Takes the topology as a
   * parameter so no listener can start before the queues exist.
   */
  @Bean
  SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(ConnectionFactory cf,
                                                                     WorkerProperties props,
                                                                     BrokerTopology topology) {
    SimpleRabbitListenerContainerFactory f = new SimpleRabbitListenerContainerFactory();
    f.setConnectionFactory(cf);
    f.setAcknowledgeMode(AcknowledgeMode.MANUAL);
    f.setDefaultRequeueRejected(false);
    f.setPrefetchCount(props.queue().prefetch());
    f.setConcurrentConsumers(props.consumers());
    f.setMaxConcurrentConsumers(props.consumers());
    f.setMissingQueuesFatal(true);
    return f;
  }
}
