package com.dnmm.pool.oracle;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.math.BpsMath;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Reads the oracle sources in priority order (primary spot, EMA fallback, secondary) and fuses them into a
 * single reference mid plus a confidence measure.
 */
@Slf4j
@RequiredArgsConstructor
public class OracleFusion {

  private final @NonNull OracleAdapter adapter;

  public ReferencePrice readReferencePrice(DnmmProperties params, OracleMode mode, int sigmaBps) {
    DnmmProperties.Oracle cfg = params.oracle();
    boolean strict = mode == OracleMode.STRICT;
    long secondaryMaxAge = strict ? cfg.secondaryMaxAgeSecStrict() : cfg.secondaryMaxAgeSec();

    OracleReading rawSecondary = read(OracleSource.SECONDARY);
    OracleReading secondary = rawSecondary.hasMid() && rawSecondary.ageSeconds() <= secondaryMaxAge ? rawSecondary : null;
    // a SECONDARY reading reports its confidence interval in the spread slot
    int secondaryConfBps = secondary != null ? secondary.spreadBps() : 0;

    OracleReading primary = read(OracleSource.PRIMARY);
    if (primary.hasMid() && primary.ageSeconds() <= cfg.maxAgeSec()) {
      return fuse(params, mode, primary, primary.spreadBps(), sigmaBps, secondaryConfBps, secondary, false);
    }

    if (!strict && cfg.allowEmaFallback()) {
      OracleReading ema = read(OracleSource.EMA_FALLBACK);
      if (ema.hasMid()) {
        log.debug("oracle primary unusable, using EMA fallback mid={}", ema.mid());
        return fuse(params, mode, ema, primary.spreadBps(), sigmaBps, secondaryConfBps, secondary, true);
      }
    }

    if (secondary != null) {
      log.debug("oracle primary unusable, using secondary mid={} ageSec={}", secondary.mid(), secondary.ageSeconds());
      return fuse(params, mode, secondary, primary.spreadBps(), sigmaBps, secondaryConfBps, secondary, true);
    }

    if (primary.hasMid()) {
      throw PoolEngineException.oracleStale(OracleSource.PRIMARY.name(), primary.ageSeconds(), cfg.maxAgeSec());
    }
    if (rawSecondary.hasMid()) {
      throw PoolEngineException.oracleStale(OracleSource.SECONDARY.name(), rawSecondary.ageSeconds(), secondaryMaxAge);
    }
    throw PoolEngineException.midUnset("no oracle source produced a mid");
  }

  /**
   * Fresh primary spot only. Used by the permissionless rebalance path, which must not act on fallbacks.
   */
  public OracleReading readFreshPrimary(DnmmProperties params) {
    OracleReading primary = read(OracleSource.PRIMARY);
    if (!primary.hasMid()) {
      throw PoolEngineException.midUnset("primary oracle produced no mid");
    }
    long maxAge = params.oracle().maxAgeSec();
    if (primary.ageSeconds() > maxAge) {
      throw PoolEngineException.oracleStale(OracleSource.PRIMARY.name(), primary.ageSeconds(), maxAge);
    }
    return primary;
  }

  public OracleReading read(OracleSource source) {
    return switch (source) {
      case PRIMARY -> {
        OracleAdapter.MidAndAge spot = adapter.readMidAndAge();
        if (spot == null || !spot.ok() || spot.mid() == null || spot.mid().signum() <= 0) {
          yield new OracleReading(null, 0, 0, OracleSource.PRIMARY);
        }
        OracleAdapter.BidAsk book = adapter.readBidAsk();
        int spreadBps = book != null && book.ok() ? BpsMath.spreadBps(book.bid(), book.ask()) : 0;
        yield new OracleReading(spot.mid(), Math.max(0, spot.ageSeconds()), spreadBps, OracleSource.PRIMARY);
      }
      case EMA_FALLBACK -> {
        OracleAdapter.EmaMid ema = adapter.readEmaFallback();
        if (ema == null || !ema.ok() || ema.mid() == null || ema.mid().signum() <= 0) {
          yield new OracleReading(null, 0, 0, OracleSource.EMA_FALLBACK);
        }
        yield new OracleReading(ema.mid(), 0, 0, OracleSource.EMA_FALLBACK);
      }
      case SECONDARY -> {
        OracleAdapter.SecondaryMid sec = adapter.readSecondaryMid();
        if (sec == null || !sec.ok() || sec.mid() == null || sec.mid().signum() <= 0) {
          yield new OracleReading(null, 0, 0, OracleSource.SECONDARY);
        }
        yield new OracleReading(sec.mid(), Math.max(0, sec.ageSeconds()), Math.max(0, sec.confidenceBps()), OracleSource.SECONDARY);
      }
    };
  }

  /**
   * Confidence blend: each term is weighted and capped on its own, the blend is the largest term, capped again.
   */
  public static int confidenceBps(DnmmProperties params, OracleMode mode, int spreadBps, int sigmaBps, int secondaryConfBps) {
    DnmmProperties.Oracle cfg = params.oracle();
    int cap = mode == OracleMode.STRICT ? cfg.confCapBpsStrict() : cfg.confCapBpsSpot();
    int spreadTerm = weighted(spreadBps, cfg.confWeightSpreadBps(), cap);
    if (!cfg.blendOn()) {
      return Math.min(Math.max(0, spreadBps), cap);
    }
    int sigmaTerm = weighted(sigmaBps, cfg.confWeightSigmaBps(), cap);
    int secondaryTerm = weighted(secondaryConfBps, cfg.confWeightSecondaryBps(), cap);
    return Math.min(cap, Math.max(spreadTerm, Math.max(sigmaTerm, secondaryTerm)));
  }

  private static int weighted(int valueBps, int weightBps, int cap) {
    long v = (long) Math.max(0, valueBps) * weightBps / BpsMath.BPS;
    return (int) Math.min(cap, v);
  }

  private ReferencePrice fuse(
      DnmmProperties params,
      OracleMode mode,
      OracleReading chosen,
      int primarySpreadBps,
      int sigmaBps,
      int secondaryConfBps,
      OracleReading secondary,
      boolean usedFallback
  ) {
    int spreadBps = Math.max(0, primarySpreadBps);
    int conf = confidenceBps(params, mode, spreadBps, sigmaBps, secondaryConfBps);
    boolean comparable = chosen.source() == OracleSource.PRIMARY && secondary != null;
    BigDecimal mid = chosen.mid();
    return new ReferencePrice(mid, conf, usedFallback, chosen.source(), spreadBps, sigmaBps, secondaryConfBps, secondary, comparable);
  }
}
