package com.dnmm.pool.events.kafka;

import com.dnmm.pool.events.DnmmEventPublisher;
import com.dnmm.pool.events.DnmmEventsProperties;
import com.dnmm.pool.metrics.DnmmMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Publishes pool events as JSON envelopes {@code {ts, source, pool, type, data}} to one topic, keyed by the
 * pool pair so every event of a pool lands on the same partition in settlement order.
 * <p>
 * A pool operation has already committed when its events are published, so failures never reach the caller.
 * They are counted in {@value #FAILURES_METRIC} tagged by stage ({@code serialize} or {@code send}).
 */
@Slf4j
public final class KafkaDnmmEventPublisher implements DnmmEventPublisher {

  static final String FAILURES_METRIC = "dnmm_event_publish_failures_total";
  static final String PUBLISHED_METRIC = "dnmm_events_published_total";

  private final DnmmEventsProperties properties;
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final DnmmMetrics metrics;
  private final String source;

  private final Counter serializeFailures;
  private final Counter sendFailures;

  public KafkaDnmmEventPublisher(
      @NonNull DnmmEventsProperties properties,
      @NonNull KafkaTemplate<String, String> kafkaTemplate,
      @NonNull ObjectMapper objectMapper,
      @NonNull Clock clock,
      @NonNull DnmmMetrics metrics,
      @NonNull String source
  ) {
    this.properties = properties;
    this.kafkaTemplate = kafkaTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.metrics = metrics;
    this.source = source.isBlank() ? "pool-service" : source.trim().toLowerCase(Locale.ROOT);
    this.serializeFailures = metrics.createCounter(FAILURES_METRIC, "Pool events dropped before reaching Kafka",
        Tag.of("stage", "serialize"));
    this.sendFailures = metrics.createCounter(FAILURES_METRIC, "Pool events dropped before reaching Kafka",
        Tag.of("stage", "send"));
  }

  @Override
  public boolean isEnabled() {
    return Boolean.TRUE.equals(properties.enabled());
  }

  @Override
  public void publish(Instant ts, String type, String poolKey, Object data) {
    if (!isEnabled() || type == null || type.isBlank()) {
      return;
    }

    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("ts", ts != null ? ts : Instant.now(clock));
    envelope.put("source", source);
    envelope.put("pool", poolKey);
    envelope.put("type", type);
    envelope.put("data", data == null ? Map.of() : data);

    String json;
    try {
      json = objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      dropped(serializeFailures, type, poolKey, e);
      return;
    }

    // unkeyed events still go out, the broker picks the partition
    String key = poolKey == null || poolKey.isBlank() ? null : poolKey;
    kafkaTemplate.send(properties.topic(), key, json).whenComplete((result, ex) -> {
      if (ex != null) {
        dropped(sendFailures, type, poolKey, ex);
      } else {
        metrics.incrementCounter(PUBLISHED_METRIC, Tag.of("type", type));
      }
    });
  }

  private void dropped(Counter counter, String type, String poolKey, Throwable t) {
    counter.increment();
    long n = (long) (serializeFailures.count() + sendFailures.count());
    if (n == 1 || n % 1000 == 0) {
      log.warn("pool event dropped type={} pool={} failures={} error={}", type, poolKey, n, t.toString());
    }
  }
}
