package com.dnmm.pool.events.kafka;

import com.dnmm.pool.events.DnmmEventPublisher;
import com.dnmm.pool.events.DnmmEventsProperties;
import com.dnmm.pool.metrics.DnmmMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

@Configuration(proxyBeanMethods=false)
@ConditionalOnClass(KafkaTemplate.class)
public class KafkaDnmmEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix="dnmm.events", name="enabled", havingValue="true")
  public DnmmEventPublisher kafkaDnmmEventPublisher(
      DnmmEventsProperties properties,
      KafkaTemplate<String, String> kafkaTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      DnmmMetrics metrics,
      Environment env
  ) {
    String source = env.getProperty("spring.application.name", "pool-service");
    return new KafkaDnmmEventPublisher(properties, kafkaTemplate, objectMapper, clock, metrics, source);
  }
}
