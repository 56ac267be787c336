package com.dnmm.pool.divergence;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.math.BpsMath;
import com.dnmm.pool.oracle.ReferencePrice;

/**
 * Classifies primary/secondary divergence into accept/soft/hard bands. Pure: the caller decides whether
 * {@link DivergenceOutcome#nextState()} is committed.
 */
public final class DivergenceGate {

  private DivergenceGate() {
  }

  public static DivergenceOutcome evaluate(DnmmProperties params, ReferencePrice price, SoftDivergenceState state) {
    if (!price.divergenceComparable()) {
      return new DivergenceOutcome(0, DivergenceBand.NOT_COMPARABLE, 0, state);
    }
    long deltaBps = BpsMath.symmetricDeviationBps(price.mid(), price.secondary().mid());
    return classify(params, deltaBps, state);
  }

  public static DivergenceOutcome classify(DnmmProperties params, long deltaBps, SoftDivergenceState state) {
    DnmmProperties.Divergence cfg = params.divergence();

    if (!params.features().enableSoftDivergence()) {
      if (deltaBps > cfg.divergenceBps()) {
        throw PoolEngineException.divergenceHard(deltaBps, cfg.divergenceBps());
      }
      return new DivergenceOutcome(deltaBps, DivergenceBand.ACCEPT, 0, state);
    }

    if (deltaBps > cfg.hardBps()) {
      throw PoolEngineException.divergenceHard(deltaBps, cfg.hardBps());
    }

    if (deltaBps <= cfg.acceptBps()) {
      int frames = cfg.healthyFramesToClear();
      int streak = Math.min(state.healthyStreak() + 1, frames);
      boolean active = state.active() && streak < frames;
      return new DivergenceOutcome(deltaBps, DivergenceBand.ACCEPT, 0, new SoftDivergenceState(active, streak, deltaBps));
    }

    // (accept, hard]: soft band; the stretch above soft still pays the same haircut slope
    long haircut = cfg.haircutMinBps() + (long) cfg.haircutSlopeBps() * (deltaBps - cfg.acceptBps());
    int haircutBps = (int) Math.min(Integer.MAX_VALUE, haircut);
    return new DivergenceOutcome(deltaBps, DivergenceBand.SOFT, haircutBps, new SoftDivergenceState(true, 0, deltaBps));
  }
}
