package com.dnmm.pool.oracle;

import java.math.BigDecimal;

/**
 * Contract of the external oracle adapters. Every read resolves synchronously; {@code ok=false} means the
 * source had nothing to report.
 */
public interface OracleAdapter {

  MidAndAge readMidAndAge();

  BidAsk readBidAsk();

  EmaMid readEmaFallback();

  SecondaryMid readSecondaryMid();

  record MidAndAge(BigDecimal mid, long ageSeconds, boolean ok) {
    public static MidAndAge missing() {
      return new MidAndAge(null, 0, false);
    }
  }

  record BidAsk(BigDecimal bid, BigDecimal ask, boolean ok) {
    public static BidAsk missing() {
      return new BidAsk(null, null, false);
    }
  }

  record EmaMid(BigDecimal mid, boolean ok) {
    public static EmaMid missing() {
      return new EmaMid(null, false);
    }
  }

  record SecondaryMid(BigDecimal mid, int confidenceBps, long ageSeconds, boolean ok) {
    public static SecondaryMid missing() {
      return new SecondaryMid(null, 0, 0, false);
    }
  }
}
