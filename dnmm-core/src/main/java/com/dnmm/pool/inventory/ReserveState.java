package com.dnmm.pool.inventory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Pool reserves plus the base inventory target the pool steers towards. Settlement changes the reserves,
 * recenter changes only the target.
 */
public record ReserveState(BigDecimal baseReserve, BigDecimal quoteReserve, BigDecimal targetBaseStar) {

  public ReserveState {
    Objects.requireNonNull(baseReserve, "baseReserve");
    Objects.requireNonNull(quoteReserve, "quoteReserve");
    Objects.requireNonNull(targetBaseStar, "targetBaseStar");
  }

  public BigDecimal outReserve(boolean isBaseIn) {
    return isBaseIn ? quoteReserve : baseReserve;
  }

  public ReserveState settle(boolean isBaseIn, BigDecimal amountIn, BigDecimal amountOut) {
    if (isBaseIn) {
      return new ReserveState(baseReserve.add(amountIn), quoteReserve.subtract(amountOut), targetBaseStar);
    }
    return new ReserveState(baseReserve.subtract(amountOut), quoteReserve.add(amountIn), targetBaseStar);
  }

  public ReserveState withTarget(BigDecimal target) {
    return new ReserveState(baseReserve, quoteReserve, target);
  }
}
