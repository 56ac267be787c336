package com.dnmm.pool.math;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public final class BpsMath {

  public static final int BPS = 10_000;
  public static final BigDecimal BPS_DECIMAL = BigDecimal.valueOf(BPS);
  public static final MathContext CTX = new MathContext(34, RoundingMode.HALF_EVEN);

  private BpsMath() {
  }

  public static int clamp(int v, int min, int max) {
    if (v < min) {
      return min;
    }
    return Math.min(v, max);
  }

  public static BigDecimal clamp(BigDecimal v, BigDecimal min, BigDecimal max) {
    if (v.compareTo(min) < 0) {
      return min;
    }
    if (v.compareTo(max) > 0) {
      return max;
    }
    return v;
  }

  /**
   * {@code |a - b| / max(a, b)} in bps, rounded up. Symmetric in its arguments.
   */
  public static long symmetricDeviationBps(BigDecimal a, BigDecimal b) {
    BigDecimal hi = a.max(b);
    BigDecimal lo = a.min(b);
    if (hi.signum() <= 0) {
      return 0;
    }
    return hi.subtract(lo)
        .multiply(BPS_DECIMAL)
        .divide(hi, 0, RoundingMode.CEILING)
        .longValueExact();
  }

  /**
   * {@code |value - reference| / reference} in bps, rounded down.
   */
  public static long relativeDeviationBps(BigDecimal value, BigDecimal reference) {
    if (reference == null || reference.signum() <= 0) {
      return 0;
    }
    return value.subtract(reference).abs()
        .multiply(BPS_DECIMAL)
        .divide(reference, 0, RoundingMode.DOWN)
        .longValueExact();
  }

  /**
   * Spread of a bid/ask pair relative to its mid, in bps (rounded up).
   */
  public static int spreadBps(BigDecimal bid, BigDecimal ask) {
    if (bid == null || ask == null || bid.signum() <= 0 || ask.compareTo(bid) < 0) {
      return 0;
    }
    BigDecimal mid = bid.add(ask).divide(BigDecimal.valueOf(2), CTX);
    return ask.subtract(bid)
        .multiply(BPS_DECIMAL)
        .divide(mid, 0, RoundingMode.CEILING)
        .intValueExact();
  }

  public static BigDecimal applyBps(BigDecimal amount, int bps) {
    return amount.multiply(BigDecimal.valueOf(bps)).divide(BPS_DECIMAL, CTX);
  }

  public static int toIntBpsFloor(BigDecimal bps) {
    if (bps.signum() <= 0) {
      return 0;
    }
    BigDecimal floored = bps.setScale(0, RoundingMode.DOWN);
    return floored.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) >= 0 ? Integer.MAX_VALUE : floored.intValue();
  }
}
