package com.dnmm.pool.events;

import java.time.Instant;

public final class NoopDnmmEventPublisher implements DnmmEventPublisher {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
  }
}
