package com.dnmm.pool.recenter;

import java.math.BigDecimal;

/**
 * Recenter hysteresis.
 *
 * @param lastRebalancePrice price of the last commit, or the first observed price before any commit; null until seeded
 * @param lastRebalanceAt    ledger seconds of the last commit; null when no commit happened yet
 * @param healthyStreak      consecutive sub-threshold observations, capped at the configured frame count
 */
public record RecenterState(BigDecimal lastRebalancePrice, Long lastRebalanceAt, int healthyStreak) {

  /**
   * Fresh state. The streak starts satisfied so the first deviation can commit without warm-up.
   */
  public static RecenterState initial(int hysteresisFrames) {
    return new RecenterState(null, null, hysteresisFrames);
  }

  public boolean seeded() {
    return lastRebalancePrice != null;
  }

  public boolean cooldownElapsed(long nowSec, long cooldownSec) {
    return lastRebalanceAt == null || nowSec - lastRebalanceAt >= cooldownSec;
  }

  public long secondsSinceRebalance(long nowSec) {
    return lastRebalanceAt == null ? Long.MAX_VALUE : nowSec - lastRebalanceAt;
  }
}
