package com.dnmm.pool.engine;

import com.dnmm.pool.math.BpsMath;

import java.math.BigDecimal;

/**
 * EWMA of absolute mid moves between settled swaps, in bps.
 */
public record VolatilityState(BigDecimal lastMid, int sigmaBps, long updatedAt) {

  public static VolatilityState initial() {
    return new VolatilityState(null, 0, 0L);
  }

  public VolatilityState observe(BigDecimal mid, long nowSec, int lambdaBps) {
    if (lastMid == null) {
      return new VolatilityState(mid, sigmaBps, nowSec);
    }
    long moveBps = BpsMath.relativeDeviationBps(mid, lastMid);
    long next = ((long) lambdaBps * sigmaBps + (long) (BpsMath.BPS - lambdaBps) * moveBps) / BpsMath.BPS;
    return new VolatilityState(mid, (int) Math.min(Integer.MAX_VALUE, next), nowSec);
  }
}
