package com.dnmm.pool.fee;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.math.BpsMath;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Composes the final fee rate. Stages run in a fixed order and a stage whose feature flag is off
 * contributes exactly zero.
 */
public final class FeePipeline {

  private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
  private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1_000);

  private FeePipeline() {
  }

  public static FeeBreakdown compute(DnmmProperties params, FeeContext ctx) {
    DnmmProperties.Fee fee = params.fee();
    DnmmProperties.Features features = params.features();

    int base = fee.baseBps();
    int confidence = (int) ((long) Math.max(0, ctx.confBps()) * fee.alphaConfNumerator() / fee.alphaConfDenominator());
    int haircut = Math.max(0, ctx.haircutBps());
    long running = (long) base + confidence + haircut;

    int invDev = 0;
    if (features.enableInvDevFee()) {
      long devBps = inventoryDeviationBps(ctx.baseReserve(), ctx.targetBase());
      invDev = (int) Math.min(Integer.MAX_VALUE, devBps * fee.betaInvDevNumerator() / fee.betaInvDevDenominator());
      running += invDev;
    }

    int size = 0;
    if (features.enableSizeFee()) {
      size = sizeFeeBps(ctx.notional(), params.maker().s0Notional(), fee.gammaSizeLinBps(), fee.gammaSizeQuadBps(), fee.sizeFeeCapBps());
      running += size;
    }

    int tilt = 0;
    if (features.enableInvTilt()) {
      tilt = inventoryTiltBps(params.inventory(), ctx);
      running = Math.max(0, running + tilt);
    }

    int floor = 0;
    if (features.enableBboFloor()) {
      DnmmProperties.Maker maker = params.maker();
      floor = (int) Math.max(maker.betaFloorBps(), (long) maker.alphaBboBps() * Math.max(0, ctx.spreadBps()) / BpsMath.BPS);
      running = Math.max(running, floor);
    }

    int volatility = 0;
    if (features.enableLvrFee()) {
      int toxicity = ctx.degraded() ? params.aomq().toxicityBiasBps() : 0;
      volatility = volatilitySurchargeBps(fee.kappaLvrBps(), fee.lvrCapBps(), ctx.sigmaBps(), params.maker().ttlMs(), toxicity);
      running += volatility;
    }

    int emergency = 0;
    if (features.enableAomq() && ctx.degraded()) {
      emergency = params.aomq().emergencySpreadBps();
      running = Math.max(running, emergency);
    }

    running = Math.min(running, fee.capBps());

    int rebate = 0;
    if (features.enableRebates() && ctx.rebateEligible() && params.rebates().bps() > 0) {
      long discounted = running - params.rebates().bps();
      discounted = Math.min(Math.max(discounted, floor), fee.capBps());
      rebate = (int) (running - discounted);
      running = discounted;
    }

    int total = (int) Math.max(0, running);
    return new FeeBreakdown(base, confidence, haircut, invDev, size, tilt, floor, volatility, emergency, rebate, total);
  }

  /**
   * {@code min(cap, lin*u + quad*u^2)} with {@code u = notional / s0}, rounded down. Non-decreasing in {@code u}.
   */
  public static int sizeFeeBps(BigDecimal notional, BigDecimal s0Notional, int linBps, int quadBps, int capBps) {
    if (notional == null || notional.signum() <= 0 || s0Notional == null || s0Notional.signum() <= 0) {
      return 0;
    }
    BigDecimal u = notional.divide(s0Notional, BpsMath.CTX);
    BigDecimal raw = u.multiply(BigDecimal.valueOf(linBps)).add(u.multiply(u).multiply(BigDecimal.valueOf(quadBps)));
    return Math.min(capBps, BpsMath.toIntBpsFloor(raw));
  }

  /**
   * Signed tilt: positive when the trade pushes inventory further from target, negative when it restores it.
   */
  static int inventoryTiltBps(DnmmProperties.Inventory inv, FeeContext ctx) {
    BigDecimal target = ctx.targetBase();
    if (target == null || target.signum() <= 0 || ctx.baseReserve() == null) {
      return 0;
    }
    BigDecimal devPct = ctx.baseReserve().subtract(target).multiply(ONE_HUNDRED).divide(target, BpsMath.CTX);
    BigDecimal raw = devPct.multiply(BigDecimal.valueOf(inv.invTiltBpsPer1pct()));
    if (!ctx.isBaseIn()) {
      raw = raw.negate();
    }
    BigDecimal weighted = raw
        .multiply(weight(inv.tiltSpreadWeightBps(), ctx.spreadBps()))
        .multiply(weight(inv.tiltConfWeightBps(), ctx.confBps()));
    int max = inv.invTiltMaxBps();
    BigDecimal clamped = BpsMath.clamp(weighted, BigDecimal.valueOf(-max), BigDecimal.valueOf(max));
    return clamped.setScale(0, RoundingMode.DOWN).intValue();
  }

  static int volatilitySurchargeBps(int kappaBps, int capBps, int sigmaBps, long ttlMs, int toxicityBiasBps) {
    if (kappaBps <= 0) {
      return 0;
    }
    BigDecimal ttlSec = BigDecimal.valueOf(Math.max(0, ttlMs)).divide(ONE_THOUSAND, BpsMath.CTX);
    BigDecimal term = BigDecimal.valueOf(Math.max(0, sigmaBps)).multiply(ttlSec.sqrt(BpsMath.CTX))
        .add(BigDecimal.valueOf(Math.max(0, toxicityBiasBps)));
    BigDecimal surcharge = term.multiply(BigDecimal.valueOf(kappaBps)).divide(BpsMath.BPS_DECIMAL, BpsMath.CTX);
    return Math.min(capBps, BpsMath.toIntBpsFloor(surcharge));
  }

  static long inventoryDeviationBps(BigDecimal baseReserve, BigDecimal targetBase) {
    if (baseReserve == null) {
      return 0;
    }
    return BpsMath.relativeDeviationBps(baseReserve, targetBase);
  }

  // 1 + weightBps/10000 * min(xBps, 100)/100
  private static BigDecimal weight(int weightBps, int xBps) {
    BigDecimal x = BigDecimal.valueOf(Math.min(Math.max(0, xBps), 100)).divide(ONE_HUNDRED, BpsMath.CTX);
    return BigDecimal.ONE.add(BigDecimal.valueOf(weightBps).divide(BpsMath.BPS_DECIMAL, BpsMath.CTX).multiply(x));
  }
}
