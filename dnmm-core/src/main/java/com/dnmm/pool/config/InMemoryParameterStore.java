package com.dnmm.pool.config;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public final class InMemoryParameterStore implements ParameterStore {

  private final AtomicReference<DnmmProperties> current;

  public InMemoryParameterStore(@NonNull DnmmProperties initial) {
    PoolParametersValidator.validate(initial);
    this.current = new AtomicReference<>(initial);
  }

  @Override
  public DnmmProperties current() {
    return current.get();
  }

  /**
   * Applies a governance-approved parameter set. Rejected sets leave the previous one in place.
   */
  public void update(@NonNull DnmmProperties next) {
    PoolParametersValidator.validate(next);
    current.set(next);
    log.info("pool parameters updated capBps={} floorBps={} acceptBps={} softBps={} hardBps={}",
        next.fee().capBps(), next.inventory().floorBps(), next.divergence().acceptBps(),
        next.divergence().softBps(), next.divergence().hardBps());
  }
}
