package com.dnmm.pool.engine;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * Wall-clock ledger. Block numbers advance once every {@code blockTimeMillis}.
 */
@RequiredArgsConstructor
public class SystemLedgerClock implements LedgerClock {

  private final @NonNull Clock clock;
  private final long blockTimeMillis;

  @Override
  public long nowSeconds() {
    return clock.millis() / 1000L;
  }

  @Override
  public long blockNumber() {
    return clock.millis() / Math.max(1L, blockTimeMillis);
  }
}
