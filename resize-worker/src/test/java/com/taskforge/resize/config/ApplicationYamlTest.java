package com.taskforge.resize.config;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ApplicationYamlTest {

  private static Binder binder;

  @BeforeAll
  static void load() throws IOException {
    List<PropertySource<?>> sources =
        new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"));
    binder = new Binder(ConfigurationPropertySources.from(sources), new PropertySourcesPlaceholdersResolver(sources));
  }

  @Test
  void brokerConnectTimeoutIsShort() {
    Duration timeout = binder.bind("spring.rabbitmq.connection-timeout", Duration.class).get();
    assertThat(timeout).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void redisTimeoutsAreBounded() {
    assertThat(binder.bind("spring.data.redis.timeout", Duration.class).get()).isEqualTo(Duration.ofSeconds(5));
    assertThat(binder.bind("spring.data.redis.connect-timeout", Duration.class).get()).isEqualTo(Duration.ofSeconds(15));
  }

  @Test
  void retryDelayDefaultsToThirtySeconds() {
    assertThat(binder.bind("worker.retry.delay", Duration.class).get()).isEqualTo(Duration.ofSeconds(30));
  }
}
