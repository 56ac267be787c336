package com.dnmm.pool.recenter;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.inventory.ReserveState;
import com.dnmm.pool.math.BpsMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Moves the base inventory target back to a 50/50 split of pool value. Both the automatic path (after a settled swap)
 * and the permissionless manual path share the same commit step.
 */
@Slf4j
public final class RecenterPolicy {

  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  private RecenterPolicy() {
  }

  /**
   * Automatic path. Never throws for policy reasons: anything that blocks a commit leaves the target untouched.
   */
  public static RecenterOutcome observe(
      DnmmProperties params,
      RecenterState state,
      ReserveState reserves,
      BigDecimal price,
      long nowSec,
      int baseScale
  ) {
    DnmmProperties.Inventory inv = params.inventory();
    if (!params.features().enableAutoRecenter()) {
      return new RecenterOutcome(state, reserves, null);
    }
    if (!state.seeded()) {
      return new RecenterOutcome(new RecenterState(price, state.lastRebalanceAt(), state.healthyStreak()), reserves, null);
    }

    long deviationBps = BpsMath.relativeDeviationBps(price, state.lastRebalancePrice());
    int frames = inv.recenterHysteresisFrames();
    if (deviationBps < inv.recenterThresholdBps()) {
      int streak = Math.min(state.healthyStreak() + 1, frames);
      return new RecenterOutcome(new RecenterState(state.lastRebalancePrice(), state.lastRebalanceAt(), streak), reserves, null);
    }

    if (!state.cooldownElapsed(nowSec, inv.recenterCooldownSec()) || state.healthyStreak() < frames) {
      log.debug("auto recenter deferred deviationBps={} streak={} sinceLastSec={}",
          deviationBps, state.healthyStreak(), state.secondsSinceRebalance(nowSec));
      return new RecenterOutcome(state, reserves, null);
    }

    TargetChange change = targetChange(params, reserves, price, baseScale);
    if (!change.commits()) {
      return new RecenterOutcome(state, reserves, null);
    }
    return commit(change, reserves, price, nowSec, RecenterTrigger.AUTO);
  }

  /**
   * Manual path. The caller supplies a fresh primary price.
   */
  public static RecenterOutcome manual(
      DnmmProperties params,
      RecenterState state,
      ReserveState reserves,
      BigDecimal price,
      long nowSec,
      int baseScale
  ) {
    DnmmProperties.Inventory inv = params.inventory();
    if (!state.cooldownElapsed(nowSec, inv.recenterCooldownSec())) {
      throw PoolEngineException.recenterCooldown(state.secondsSinceRebalance(nowSec), inv.recenterCooldownSec());
    }
    TargetChange change = targetChange(params, reserves, price, baseScale);
    if (!change.commits()) {
      throw PoolEngineException.recenterThreshold(change.changeBps(), inv.recenterMinTargetChangeBps());
    }
    return commit(change, reserves, price, nowSec, RecenterTrigger.MANUAL);
  }

  /**
   * {@code newTarget = (quote + base * price) / 2 / price}, committed only when it moves the target by at least
   * {@code recenterMinTargetChangeBps}.
   */
  public static TargetChange targetChange(DnmmProperties params, ReserveState reserves, BigDecimal price, int baseScale) {
    BigDecimal current = reserves.targetBaseStar();
    BigDecimal total = reserves.quoteReserve().add(reserves.baseReserve().multiply(price));
    BigDecimal proposed = total.divide(TWO, BpsMath.CTX).divide(price, BpsMath.CTX).setScale(baseScale, RoundingMode.DOWN);

    long changeBps;
    if (current.signum() <= 0) {
      changeBps = proposed.signum() > 0 ? BpsMath.BPS : 0;
    } else {
      changeBps = BpsMath.relativeDeviationBps(proposed, current);
    }
    boolean commits = proposed.compareTo(current) != 0 && changeBps >= params.inventory().recenterMinTargetChangeBps();
    return new TargetChange(current, proposed, changeBps, commits);
  }

  private static RecenterOutcome commit(TargetChange change, ReserveState reserves, BigDecimal price, long nowSec, RecenterTrigger trigger) {
    RebalanceRecord record = new RebalanceRecord(change.currentTarget(), change.proposedTarget(), price, nowSec, trigger);
    return new RecenterOutcome(new RecenterState(price, nowSec, 0), reserves.withTarget(change.proposedTarget()), record);
  }
}
