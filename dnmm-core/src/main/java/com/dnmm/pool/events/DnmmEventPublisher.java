package com.dnmm.pool.events;

import java.time.Instant;

public interface DnmmEventPublisher {

  boolean isEnabled();

  void publish(Instant ts, String type, String key, Object data);
}
