package com.dnmm.pool.divergence;

/**
 * Hysteresis memory of the divergence gate. Mutated only by settled swaps.
 */
public record SoftDivergenceState(boolean active, int healthyStreak, long lastDeltaBps) {

  public static SoftDivergenceState initial() {
    return new SoftDivergenceState(false, 0, 0);
  }
}
