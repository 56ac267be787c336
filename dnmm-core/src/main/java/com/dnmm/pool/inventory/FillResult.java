package com.dnmm.pool.inventory;

import java.math.BigDecimal;

/**
 * Outcome of a floor-aware fill. {@code appliedAmountIn + leftoverAmountIn} always equals the requested input.
 */
public record FillResult(BigDecimal amountOut, BigDecimal appliedAmountIn, BigDecimal leftoverAmountIn, boolean isPartial) {

  public BigDecimal requestedAmountIn() {
    return appliedAmountIn.add(leftoverAmountIn);
  }
}
