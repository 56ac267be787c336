package com.dnmm.pool.config;

import com.dnmm.pool.error.PoolEngineException;

import java.math.BigDecimal;

/**
 * Cross-field checks that bean validation cannot express on a single component.
 */
public final class PoolParametersValidator {

  private static final int BPS = 10_000;

  private PoolParametersValidator() {
  }

  public static void validate(DnmmProperties p) {
    DnmmProperties.Divergence d = p.divergence();
    if (d.acceptBps() > d.softBps()) {
      throw PoolEngineException.invalidConfig("divergence.accept-bps", "must not exceed divergence.soft-bps");
    }
    if (d.softBps() > d.hardBps()) {
      throw PoolEngineException.invalidConfig("divergence.soft-bps", "must not exceed divergence.hard-bps");
    }
    if (d.healthyFramesToClear() < 1) {
      throw PoolEngineException.invalidConfig("divergence.healthy-frames-to-clear", "must be at least 1");
    }

    DnmmProperties.Fee f = p.fee();
    if (f.capBps() > BPS) {
      throw PoolEngineException.invalidConfig("fee.cap-bps", "must not exceed " + BPS);
    }
    if (f.alphaConfDenominator() <= 0 || f.betaInvDevDenominator() <= 0) {
      throw PoolEngineException.invalidConfig("fee.*-denominator", "must be positive");
    }
    if (f.baseBps() > f.capBps()) {
      throw PoolEngineException.invalidConfig("fee.base-bps", "must not exceed fee.cap-bps");
    }
    if (p.maker().betaFloorBps() > f.capBps()) {
      throw PoolEngineException.invalidConfig("maker.beta-floor-bps", "must not exceed fee.cap-bps");
    }
    if (p.aomq().emergencySpreadBps() > f.capBps()) {
      throw PoolEngineException.invalidConfig("aomq.emergency-spread-bps", "must not exceed fee.cap-bps");
    }

    DnmmProperties.Inventory inv = p.inventory();
    if (inv.floorBps() < 0 || inv.floorBps() >= BPS / 2) {
      throw PoolEngineException.invalidConfig("inventory.floor-bps", "must be in [0, 5000)");
    }
    if (inv.targetBaseXstar() != null && inv.targetBaseXstar().signum() < 0) {
      throw PoolEngineException.invalidConfig("inventory.target-base-xstar", "must not be negative");
    }
    if (p.maker().s0Notional() == null || p.maker().s0Notional().compareTo(BigDecimal.ZERO) <= 0) {
      throw PoolEngineException.invalidConfig("maker.s0-notional", "must be positive");
    }
    if (p.oracle().sigmaEwmaLambdaBps() > BPS) {
      throw PoolEngineException.invalidConfig("oracle.sigma-ewma-lambda-bps", "must not exceed " + BPS);
    }
  }
}
