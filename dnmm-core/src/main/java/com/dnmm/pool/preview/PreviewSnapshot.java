package com.dnmm.pool.preview;

import com.dnmm.pool.oracle.OracleSource;

import java.math.BigDecimal;

/**
 * Market inputs persisted at the last settled trade (or explicit refresh) so previews replay fees without
 * touching the oracle.
 *
 * @param divergenceComparable whether {@code divergenceBps} came from an actual primary/secondary comparison
 * @param sigmaBps             volatility after the settling trade was folded in
 */
public record PreviewSnapshot(
    BigDecimal mid,
    long divergenceBps,
    boolean divergenceComparable,
    int regimeFlags,
    long blockRef,
    long timestamp,
    int spreadBps,
    int confBps,
    int sigmaBps,
    int secondaryConfBps,
    boolean usedFallback,
    OracleSource source
) {

  public long ageSec(long nowSec) {
    return Math.max(0, nowSec - timestamp);
  }
}
