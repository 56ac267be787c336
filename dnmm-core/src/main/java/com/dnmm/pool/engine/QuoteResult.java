package com.dnmm.pool.engine;

import com.dnmm.pool.fee.FeeBreakdown;

import java.math.BigDecimal;

public record QuoteResult(
    BigDecimal amountOut,
    BigDecimal appliedAmountIn,
    BigDecimal leftoverAmountIn,
    int feeBpsUsed,
    BigDecimal midUsed,
    boolean usedFallback,
    QuoteReason reason,
    int regimeFlags,
    FeeBreakdown fee
) {

  public boolean isPartial() {
    return leftoverAmountIn.signum() > 0;
  }
}
