package com.dnmm.pool.aomq;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.inventory.InventorySolver;
import com.dnmm.pool.inventory.ReserveState;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Keeps a minimal, widened quote alive when price data or inventory is unhealthy, instead of refusing to trade.
 */
public final class DegradedQuoteMode {

  private DegradedQuoteMode() {
  }

  /**
   * Triggers in priority order: soft divergence, floor proximity (per side), fallback oracle.
   */
  public static AomqActivationState evaluate(
      DnmmProperties params,
      ReserveState reserves,
      BigDecimal mid,
      boolean softDivergenceActive,
      boolean usedFallback
  ) {
    if (!params.features().enableAomq()) {
      return AomqActivationState.inactive();
    }
    if (softDivergenceActive) {
      return new AomqActivationState(true, true, AomqTrigger.SOFT_DIVERGENCE);
    }

    boolean askNearFloor = nearFloor(params, reserves, mid, false);
    boolean bidNearFloor = nearFloor(params, reserves, mid, true);
    if (askNearFloor || bidNearFloor) {
      return new AomqActivationState(askNearFloor, bidNearFloor, AomqTrigger.NEAR_FLOOR);
    }

    if (usedFallback) {
      return new AomqActivationState(true, true, AomqTrigger.FALLBACK);
    }
    return AomqActivationState.inactive();
  }

  /**
   * Floor proximity of the side's output reserve: base for the ask side, quote (target valued at mid) for the bid side.
   */
  public static boolean nearFloor(DnmmProperties params, ReserveState reserves, BigDecimal mid, boolean isBaseIn) {
    int floorBps = params.inventory().floorBps();
    int epsilonBps = params.aomq().floorEpsilonBps();
    BigDecimal targetBase = reserves.targetBaseStar();
    if (isBaseIn) {
      return InventorySolver.nearFloor(reserves.quoteReserve(), targetBase.multiply(mid), floorBps, epsilonBps);
    }
    return InventorySolver.nearFloor(reserves.baseReserve(), targetBase, floorBps, epsilonBps);
  }

  /**
   * Largest input whose notional stays within {@code aomq.minQuoteNotional}, rounded down at the input scale.
   */
  public static BigDecimal clampInput(DnmmProperties params, BigDecimal amountIn, boolean isBaseIn, BigDecimal mid, int inScale) {
    BigDecimal limit = params.aomq().minQuoteNotional();
    BigDecimal notional = isBaseIn ? amountIn.multiply(mid) : amountIn;
    if (notional.compareTo(limit) <= 0) {
      return amountIn;
    }
    BigDecimal clamped = isBaseIn ? limit.divide(mid, inScale, RoundingMode.DOWN) : limit.setScale(inScale, RoundingMode.DOWN);
    return clamped.min(amountIn);
  }
}
