package com.dnmm.pool.events;

import java.math.BigDecimal;

/**
 * Payloads published by the pool engine.
 */
public final class PoolEvents {

  private PoolEvents() {
  }

  public record SwapSettled(
      boolean isBaseIn,
      BigDecimal amountIn,
      BigDecimal amountOut,
      BigDecimal leftoverAmountIn,
      int feeBps,
      BigDecimal mid,
      String reason,
      int regimeFlags,
      BigDecimal baseReserve,
      BigDecimal quoteReserve,
      String caller
  ) {
  }

  public record TargetUpdated(
      BigDecimal previousTarget,
      BigDecimal newTarget,
      BigDecimal price,
      long timestamp,
      String trigger
  ) {
  }

  public record PreviewSnapshotRefreshed(
      BigDecimal mid,
      long divergenceBps,
      int regimeFlags,
      long blockRef,
      long timestamp
  ) {
  }

  public record DivergenceSoft(
      long deltaBps,
      int haircutBps,
      int healthyStreak
  ) {
  }
}
