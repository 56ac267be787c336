package com.dnmm.pool.oracle;

import java.math.BigDecimal;

/**
 * Fused reference price for one call.
 *
 * @param secondary fresh secondary reading, or null when the secondary source was unusable
 * @param divergenceComparable true when {@code mid} came from the primary spot and a fresh secondary exists
 */
public record ReferencePrice(
    BigDecimal mid,
    int confidenceBps,
    boolean usedFallback,
    OracleSource source,
    int spreadBps,
    int sigmaBps,
    int secondaryConfBps,
    OracleReading secondary,
    boolean divergenceComparable
) {

  public String reason() {
    return switch (source) {
      case PRIMARY -> "primary_spot";
      case EMA_FALLBACK -> "ema_fallback";
      case SECONDARY -> "secondary_fallback";
    };
  }
}
