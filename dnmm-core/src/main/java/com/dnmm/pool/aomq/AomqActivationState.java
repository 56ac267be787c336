package com.dnmm.pool.aomq;

/**
 * Degraded quote mode activation per side. The ask side sells base (quote in), the bid side buys base (base in).
 * Recomputed on every call; never carried as hysteresis.
 */
public record AomqActivationState(boolean askActive, boolean bidActive, AomqTrigger trigger) {

  public static AomqActivationState inactive() {
    return new AomqActivationState(false, false, AomqTrigger.NONE);
  }

  public boolean activeFor(boolean isBaseIn) {
    return isBaseIn ? bidActive : askActive;
  }

  public boolean anyActive() {
    return askActive || bidActive;
  }
}
