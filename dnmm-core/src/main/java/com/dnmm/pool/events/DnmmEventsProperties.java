package com.dnmm.pool.events;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix="dnmm.events")
public record DnmmEventsProperties(
    @NotNull Boolean enabled,
    String topic
) {
  public DnmmEventsProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (topic == null || topic.isBlank()) {
      topic = "dnmm.events";
    }
  }
}
