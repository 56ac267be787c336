package com.dnmm.pool.inventory;

import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.math.BpsMath;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Sizes a fill so the output reserve never drops below its floor. Output rounds down at the output token scale;
 * a clamped input rounds up at the input token scale.
 * <p>
 * Floors are anchored to the base target, not to the live reserve: {@code targetBase * floorBps} for base and
 * {@code targetBase * price * floorBps} for quote. A floor therefore stays put while trades drain the reserve.
 */
public final class InventorySolver {

  private InventorySolver() {
  }

  public static FillResult solveFill(
      BigDecimal desiredIn,
      ReserveState reserves,
      int floorBps,
      BigDecimal price,
      int feeBps,
      boolean isBaseIn,
      int baseScale,
      int quoteScale
  ) {
    int inScale = isBaseIn ? baseScale : quoteScale;
    int outScale = isBaseIn ? quoteScale : baseScale;

    BigDecimal outReserve = reserves.outReserve(isBaseIn);
    BigDecimal floor = floorAmount(reserves, floorBps, price, isBaseIn, outScale);
    BigDecimal available = outReserve.subtract(floor).setScale(outScale, RoundingMode.DOWN);
    if (available.signum() <= 0) {
      throw PoolEngineException.floorBreach(isBaseIn ? "quote" : "base", outReserve, floor);
    }

    BigDecimal feeFactor = BigDecimal.valueOf(BpsMath.BPS - (long) feeBps).divide(BpsMath.BPS_DECIMAL, BpsMath.CTX);
    BigDecimal gross = isBaseIn ? desiredIn.multiply(price) : desiredIn.divide(price, BpsMath.CTX);
    BigDecimal out = gross.multiply(feeFactor).setScale(outScale, RoundingMode.DOWN);
    if (out.compareTo(available) <= 0) {
      return new FillResult(out, desiredIn, BigDecimal.ZERO.setScale(desiredIn.scale()), false);
    }

    // smallest input that pays for exactly `available`
    BigDecimal perUnitIn = isBaseIn ? price.multiply(feeFactor) : feeFactor.divide(price, BpsMath.CTX);
    BigDecimal required = available.divide(perUnitIn, BpsMath.CTX).setScale(inScale, RoundingMode.CEILING);
    BigDecimal applied = required.min(desiredIn);
    return new FillResult(available, applied, desiredIn.subtract(applied), true);
  }

  public static boolean hasHeadroom(
      ReserveState reserves,
      int floorBps,
      BigDecimal price,
      boolean isBaseIn,
      int baseScale,
      int quoteScale
  ) {
    int outScale = isBaseIn ? quoteScale : baseScale;
    BigDecimal floor = floorAmount(reserves, floorBps, price, isBaseIn, outScale);
    return reserves.outReserve(isBaseIn).subtract(floor).setScale(outScale, RoundingMode.DOWN).signum() > 0;
  }

  /**
   * Floor of the output reserve of a trade, rounded up at the output token scale. Zero when no target is set.
   */
  public static BigDecimal floorAmount(ReserveState reserves, int floorBps, BigDecimal price, boolean isBaseIn, int outScale) {
    BigDecimal target = reserves.targetBaseStar();
    if (target.signum() <= 0) {
      return BigDecimal.ZERO.setScale(outScale);
    }
    BigDecimal anchor = isBaseIn ? target.multiply(price) : target;
    return BpsMath.applyBps(anchor, floorBps).setScale(outScale, RoundingMode.CEILING);
  }

  /**
   * True when the reserve sits within {@code floorBps + epsilonBps} of its target, where the target is expressed
   * in the reserve's own token units.
   */
  public static boolean nearFloor(BigDecimal reserve, BigDecimal target, int floorBps, int epsilonBps) {
    if (target == null || target.signum() <= 0) {
      return reserve.signum() <= 0;
    }
    return reserve.compareTo(BpsMath.applyBps(target, floorBps + epsilonBps)) <= 0;
  }
}
