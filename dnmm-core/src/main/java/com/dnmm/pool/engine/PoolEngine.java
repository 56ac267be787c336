package com.dnmm.pool.engine;

import com.dnmm.pool.aomq.AomqActivationState;
import com.dnmm.pool.aomq.AomqTrigger;
import com.dnmm.pool.aomq.DegradedQuoteMode;
import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.config.ParameterStore;
import com.dnmm.pool.divergence.DivergenceBand;
import com.dnmm.pool.divergence.DivergenceGate;
import com.dnmm.pool.divergence.DivergenceOutcome;
import com.dnmm.pool.divergence.SoftDivergenceState;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.events.DnmmEventPublisher;
import com.dnmm.pool.events.DnmmEventTypes;
import com.dnmm.pool.events.PoolEvents;
import com.dnmm.pool.fee.FeeBreakdown;
import com.dnmm.pool.fee.FeeContext;
import com.dnmm.pool.fee.FeePipeline;
import com.dnmm.pool.inventory.FillResult;
import com.dnmm.pool.inventory.InventorySolver;
import com.dnmm.pool.inventory.ReserveState;
import com.dnmm.pool.oracle.OracleAdapter;
import com.dnmm.pool.oracle.OracleFusion;
import com.dnmm.pool.oracle.OracleMode;
import com.dnmm.pool.oracle.OracleReading;
import com.dnmm.pool.oracle.OracleSource;
import com.dnmm.pool.oracle.ReferencePrice;
import com.dnmm.pool.preview.PreviewFees;
import com.dnmm.pool.preview.PreviewLadder;
import com.dnmm.pool.preview.PreviewSnapshot;
import com.dnmm.pool.preview.RegimeFlag;
import com.dnmm.pool.recenter.RebalanceRecord;
import com.dnmm.pool.recenter.RecenterOutcome;
import com.dnmm.pool.recenter.RecenterPolicy;
import com.dnmm.pool.recenter.RecenterState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One pool instance. Quotes and previews read a single immutable {@link PoolState}; swaps, rebalances and
 * snapshot refreshes build the next state and publish it with one reference assignment, so a failed operation
 * leaves nothing behind.
 * <p>
 * Mutating operations are not synchronized here. Callers sharing an engine across threads must serialize
 * {@link #swap}, {@link #manualRebalance} and {@link #refreshPreviewSnapshot}.
 */
@Slf4j
public class PoolEngine {

  private final ParameterStore parameters;
  private final OracleFusion oracle;
  private final LedgerClock clock;
  private final DnmmEventPublisher events;
  private final String pairKey;

  private volatile PoolState state;

  public PoolEngine(
      @NonNull ParameterStore parameters,
      @NonNull OracleAdapter oracleAdapter,
      @NonNull LedgerClock clock,
      @NonNull DnmmEventPublisher events
  ) {
    this.parameters = parameters;
    this.oracle = new OracleFusion(oracleAdapter);
    this.clock = clock;
    this.events = events;
    DnmmProperties.Tokens tokens = parameters.current().tokens();
    this.pairKey = tokens.baseSymbol() + "/" + tokens.quoteSymbol();
    this.state = PoolState.initial(parameters.current());
  }

  public QuoteResult quote(BigDecimal amountIn, boolean isBaseIn, OracleMode mode, String caller) {
    DnmmProperties params = parameters.current();
    requireValidAmount(params, amountIn, isBaseIn);
    PoolState s = state;

    ReferencePrice ref = oracle.readReferencePrice(params, mode == null ? OracleMode.SPOT : mode, s.volatility().sigmaBps());
    DivergenceOutcome div = DivergenceGate.evaluate(params, ref, s.divergence());
    MarketInputs market = MarketInputs.live(ref, div);
    return execute(params, market, div, s.reserves(), amountIn, isBaseIn, rebateEligible(params, caller), false).result();
  }

  public SwapResult swap(@NonNull SwapRequest request) {
    DnmmProperties params = parameters.current();
    long now = clock.nowSeconds();
    if (request.deadline() != null && now > request.deadline()) {
      throw PoolEngineException.deadlineExpired(request.deadline(), now);
    }
    requireValidAmount(params, request.amountIn(), request.isBaseIn());
    PoolState s = state;

    ReferencePrice ref = oracle.readReferencePrice(params, request.mode(), s.volatility().sigmaBps());
    DivergenceOutcome div = DivergenceGate.evaluate(params, ref, s.divergence());
    MarketInputs market = MarketInputs.live(ref, div);
    Execution ex = execute(params, market, div, s.reserves(), request.amountIn(), request.isBaseIn(), rebateEligible(params, request.caller()), false);
    QuoteResult result = ex.result();

    if (request.minAmountOut() != null && result.amountOut().compareTo(request.minAmountOut()) < 0) {
      throw PoolEngineException.slippage(result.amountOut(), request.minAmountOut());
    }

    ReserveState settled = s.reserves().settle(request.isBaseIn(), result.appliedAmountIn(), result.amountOut());
    VolatilityState volatility = s.volatility().observe(market.mid(), now, params.oracle().sigmaEwmaLambdaBps());
    RecenterOutcome recenter = RecenterPolicy.observe(params, s.recenter(), settled, market.mid(), now, params.tokens().baseDecimals());
    PreviewSnapshot snapshot = snapshot(params, market, volatility.sigmaBps(), result.regimeFlags(), now);

    state = new PoolState(recenter.reserves(), div.nextState(), volatility, recenter.state(), snapshot, ex.aomq());

    log.info("swap settled isBaseIn={} amountIn={} amountOut={} leftover={} feeBps={} mid={} reason={} flags={}",
        request.isBaseIn(), result.appliedAmountIn(), result.amountOut(), result.leftoverAmountIn(),
        result.feeBpsUsed(), market.mid(), result.reason(), result.regimeFlags());

    Instant ts = Instant.ofEpochSecond(now);
    events.publish(ts, DnmmEventTypes.POOL_SWAP, pairKey, new PoolEvents.SwapSettled(
        request.isBaseIn(),
        result.appliedAmountIn(),
        result.amountOut(),
        result.leftoverAmountIn(),
        result.feeBpsUsed(),
        market.mid(),
        result.reason().name(),
        result.regimeFlags(),
        recenter.reserves().baseReserve(),
        recenter.reserves().quoteReserve(),
        request.caller()
    ));
    if (div.band() == DivergenceBand.SOFT) {
      events.publish(ts, DnmmEventTypes.POOL_DIVERGENCE_SOFT, pairKey,
          new PoolEvents.DivergenceSoft(div.deltaBps(), div.haircutBps(), div.nextState().healthyStreak()));
    }
    if (recenter.committed()) {
      publishTargetUpdated(recenter.record());
    }
    publishSnapshot(snapshot);
    return new SwapResult(result, recenter.record());
  }

  /**
   * Permissionless rebalance against a fresh primary reading. Fallback sources are never used here.
   */
  public RebalanceRecord manualRebalance() {
    DnmmProperties params = parameters.current();
    long now = clock.nowSeconds();
    PoolState s = state;

    OracleReading primary = oracle.readFreshPrimary(params);
    RecenterOutcome outcome = RecenterPolicy.manual(params, s.recenter(), s.reserves(), primary.mid(), now, params.tokens().baseDecimals());
    state = s.withRecenter(outcome.state(), outcome.reserves());
    publishTargetUpdated(outcome.record());
    return outcome.record();
  }

  public PreviewSnapshot refreshPreviewSnapshot() {
    DnmmProperties params = parameters.current();
    long now = clock.nowSeconds();
    PoolState s = state;

    long cooldown = params.preview().snapshotCooldownSec();
    if (s.snapshot() != null && now - s.snapshot().timestamp() < cooldown) {
      throw PoolEngineException.previewSnapshotCooldown(now - s.snapshot().timestamp(), cooldown);
    }

    ReferencePrice ref = oracle.readReferencePrice(params, OracleMode.SPOT, s.volatility().sigmaBps());
    DivergenceOutcome div = DivergenceGate.evaluate(params, ref, s.divergence());
    MarketInputs market = MarketInputs.live(ref, div);
    AomqActivationState aomq = DegradedQuoteMode.evaluate(params, s.reserves(), market.mid(), div.nextState().active(), market.usedFallback());
    Set<RegimeFlag> flags = marketFlags(params, s.reserves(), market, div, aomq);

    PreviewSnapshot snapshot = snapshot(params, market, s.volatility().sigmaBps(), RegimeFlag.mask(flags), now);
    state = s.withSnapshot(snapshot);
    publishSnapshot(snapshot);
    return snapshot;
  }

  /**
   * Fees for each base size against the persisted snapshot and the current reserves and hysteresis. No state changes.
   */
  public PreviewFees previewFees(@NonNull List<BigDecimal> sizesBase) {
    DnmmProperties params = parameters.current();
    PoolState s = state;
    PreviewSnapshot snapshot = requireSnapshot(params, s);
    return feesFor(params, s, MarketInputs.fromSnapshot(params, snapshot), snapshotDivergence(params, snapshot, s.divergence()), sizesBase);
  }

  /**
   * Same as {@link #previewFees} but against a fresh oracle read instead of the snapshot.
   */
  public PreviewFees previewFeesFresh(@NonNull List<BigDecimal> sizesBase) {
    DnmmProperties params = parameters.current();
    if (!params.preview().enablePreviewFresh()) {
      throw PoolEngineException.invalidConfig("preview.enable-preview-fresh", "is disabled");
    }
    PoolState s = state;
    ReferencePrice ref = oracle.readReferencePrice(params, OracleMode.SPOT, s.volatility().sigmaBps());
    DivergenceOutcome div = DivergenceGate.evaluate(params, ref, s.divergence());
    return feesFor(params, s, MarketInputs.live(ref, div), div, sizesBase);
  }

  public PreviewLadder previewLadder(BigDecimal baseSize) {
    DnmmProperties params = parameters.current();
    PoolState s = state;
    PreviewSnapshot snapshot = requireSnapshot(params, s);
    MarketInputs market = MarketInputs.fromSnapshot(params, snapshot);
    DivergenceOutcome div = snapshotDivergence(params, snapshot, s.divergence());

    int baseScale = params.tokens().baseDecimals();
    int quoteScale = params.tokens().quoteDecimals();
    BigDecimal unit = baseSize;
    if (unit == null || unit.signum() <= 0) {
      unit = params.maker().s0Notional().divide(market.mid(), baseScale, RoundingMode.DOWN);
    }

    List<PreviewLadder.Row> rows = new ArrayList<>();
    for (int multiplier : PreviewLadder.MULTIPLIERS) {
      BigDecimal size = unit.multiply(BigDecimal.valueOf(multiplier)).setScale(baseScale, RoundingMode.DOWN);
      BigDecimal askIn = size.multiply(market.mid()).setScale(quoteScale, RoundingMode.DOWN);
      Execution ask = execute(params, market, div, s.reserves(), askIn, false, false, true);
      Execution bid = execute(params, market, div, s.reserves(), size, true, false, true);
      rows.add(new PreviewLadder.Row(size, ask.result().feeBpsUsed(), bid.result().feeBpsUsed(), ask.clamped(), bid.clamped()));
    }
    long now = clock.nowSeconds();
    return new PreviewLadder(rows, snapshot.ageSec(now), snapshot.mid(), snapshot.timestamp());
  }

  public SoftDivergenceState getSoftDivergenceState() {
    return state.divergence();
  }

  public Optional<PreviewSnapshot> previewSnapshotRaw() {
    return Optional.ofNullable(state.snapshot());
  }

  public ReserveState reserves() {
    return state.reserves();
  }

  public AomqActivationState lastAomqState() {
    return state.lastAomq();
  }

  public RecenterState recenterState() {
    return state.recenter();
  }

  public VolatilityState volatilityState() {
    return state.volatility();
  }

  private PreviewFees feesFor(DnmmProperties params, PoolState s, MarketInputs market, DivergenceOutcome div, List<BigDecimal> sizesBase) {
    int quoteScale = params.tokens().quoteDecimals();
    List<Integer> ask = new ArrayList<>(sizesBase.size());
    List<Integer> bid = new ArrayList<>(sizesBase.size());
    for (BigDecimal size : sizesBase) {
      BigDecimal base = size == null ? BigDecimal.ZERO : size.max(BigDecimal.ZERO);
      BigDecimal askIn = base.multiply(market.mid()).setScale(quoteScale, RoundingMode.DOWN);
      ask.add(priceSide(params, market, div, s.reserves(), askIn, false, false).fee().totalBps());
      bid.add(priceSide(params, market, div, s.reserves(), base, true, false).fee().totalBps());
    }
    return new PreviewFees(ask, bid);
  }

  private PreviewSnapshot requireSnapshot(DnmmProperties params, PoolState s) {
    PreviewSnapshot snapshot = s.snapshot();
    if (snapshot == null) {
      throw PoolEngineException.midUnset("no preview snapshot persisted yet");
    }
    long age = snapshot.ageSec(clock.nowSeconds());
    long maxAge = params.preview().maxAgeSec();
    if (age > maxAge) {
      if (params.preview().revertOnStalePreview()) {
        throw PoolEngineException.previewSnapshotStale(age, maxAge);
      }
      log.debug("serving stale preview snapshot ageSec={} maxAgeSec={}", age, maxAge);
    }
    return snapshot;
  }

  private static DivergenceOutcome snapshotDivergence(DnmmProperties params, PreviewSnapshot snapshot, SoftDivergenceState current) {
    if (!snapshot.divergenceComparable()) {
      return new DivergenceOutcome(0, DivergenceBand.NOT_COMPARABLE, 0, current);
    }
    return DivergenceGate.classify(params, snapshot.divergenceBps(), current);
  }

  private Execution execute(
      DnmmProperties params,
      MarketInputs market,
      DivergenceOutcome div,
      ReserveState reserves,
      BigDecimal amountIn,
      boolean isBaseIn,
      boolean rebateEligible,
      boolean previewOnly
  ) {
    SidePricing pricing = priceSide(params, market, div, reserves, amountIn, isBaseIn, rebateEligible);
    int baseScale = params.tokens().baseDecimals();
    int quoteScale = params.tokens().quoteDecimals();

    int floorBps = params.inventory().floorBps();
    if (previewOnly && !InventorySolver.hasHeadroom(reserves, floorBps, market.mid(), isBaseIn, baseScale, quoteScale)) {
      return Execution.floorBlocked(market, pricing, amountIn);
    }

    FillResult fill;
    boolean floorLimited;
    if (pricing.effectiveIn().signum() == 0) {
      fill = new FillResult(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, false);
      floorLimited = false;
    } else {
      fill = InventorySolver.solveFill(pricing.effectiveIn(), reserves, floorBps, market.mid(),
          pricing.fee().totalBps(), isBaseIn, baseScale, quoteScale);
      floorLimited = fill.isPartial();
    }
    if (!previewOnly && fill.amountOut().signum() == 0) {
      throw PoolEngineException.outputRoundsToZero(amountIn, isBaseIn ? quoteScale : baseScale);
    }

    BigDecimal applied = fill.appliedAmountIn();
    BigDecimal leftover = amountIn.subtract(applied);

    Set<RegimeFlag> flags = marketFlags(params, reserves, market, div, pricing.aomq());
    if (pricing.fee().sizeFeeApplied()) {
      flags.add(RegimeFlag.SIZE_FEE);
    }
    if (pricing.fee().tiltApplied()) {
      flags.add(RegimeFlag.INV_TILT);
    }
    if (floorLimited) {
      flags.add(RegimeFlag.NEAR_FLOOR);
    }

    QuoteReason reason;
    if (pricing.aomqClamped()) {
      reason = QuoteReason.AOMQ_CLAMP;
    } else if (floorLimited) {
      reason = QuoteReason.FLOOR_CLAMP;
    } else if (div.band() == DivergenceBand.SOFT || div.nextState().active()) {
      reason = QuoteReason.SOFT_DIVERGENCE;
    } else if (market.usedFallback()) {
      reason = QuoteReason.FALLBACK;
    } else {
      reason = QuoteReason.NONE;
    }

    QuoteResult result = new QuoteResult(fill.amountOut(), applied, leftover, pricing.fee().totalBps(), market.mid(),
        market.usedFallback(), reason, RegimeFlag.mask(flags), pricing.fee());
    return new Execution(result, pricing.aomq(), pricing.aomqClamped() || floorLimited);
  }

  private SidePricing priceSide(
      DnmmProperties params,
      MarketInputs market,
      DivergenceOutcome div,
      ReserveState reserves,
      BigDecimal amountIn,
      boolean isBaseIn,
      boolean rebateEligible
  ) {
    AomqActivationState aomq = DegradedQuoteMode.evaluate(params, reserves, market.mid(), div.nextState().active(), market.usedFallback());
    boolean sideActive = aomq.activeFor(isBaseIn);
    int inScale = isBaseIn ? params.tokens().baseDecimals() : params.tokens().quoteDecimals();

    BigDecimal effectiveIn = sideActive ? DegradedQuoteMode.clampInput(params, amountIn, isBaseIn, market.mid(), inScale) : amountIn;
    boolean aomqClamped = effectiveIn.compareTo(amountIn) < 0;
    BigDecimal notional = isBaseIn ? effectiveIn.multiply(market.mid()) : effectiveIn;

    FeeContext ctx = new FeeContext(
        market.confBps(),
        market.spreadBps(),
        market.sigmaBps(),
        div.haircutBps(),
        notional,
        isBaseIn,
        reserves.baseReserve(),
        reserves.targetBaseStar(),
        sideActive,
        rebateEligible
    );
    FeeBreakdown fee = FeePipeline.compute(params, ctx);
    if (params.features().debugEmit()) {
      log.debug("fee breakdown isBaseIn={} notional={} {}", isBaseIn, notional, fee);
    }
    return new SidePricing(aomq, effectiveIn, aomqClamped, fee);
  }

  private static Set<RegimeFlag> marketFlags(
      DnmmProperties params,
      ReserveState reserves,
      MarketInputs market,
      DivergenceOutcome div,
      AomqActivationState aomq
  ) {
    Set<RegimeFlag> flags = EnumSet.noneOf(RegimeFlag.class);
    if (aomq.anyActive()) {
      flags.add(RegimeFlag.AOMQ);
    }
    if (market.usedFallback()) {
      flags.add(RegimeFlag.FALLBACK);
    }
    if (aomq.trigger() == AomqTrigger.NEAR_FLOOR
        || DegradedQuoteMode.nearFloor(params, reserves, market.mid(), true)
        || DegradedQuoteMode.nearFloor(params, reserves, market.mid(), false)) {
      flags.add(RegimeFlag.NEAR_FLOOR);
    }
    if (div.band() == DivergenceBand.SOFT || div.nextState().active()) {
      flags.add(RegimeFlag.SOFT_DIVERGENCE);
    }
    return flags;
  }

  private PreviewSnapshot snapshot(DnmmProperties params, MarketInputs market, int sigmaBps, int regimeFlags, long now) {
    int confBps = OracleFusion.confidenceBps(params, OracleMode.SPOT, market.spreadBps(), sigmaBps, market.secondaryConfBps());
    return new PreviewSnapshot(
        market.mid(),
        market.divergenceBps(),
        market.divergenceComparable(),
        regimeFlags,
        clock.blockNumber(),
        now,
        market.spreadBps(),
        confBps,
        sigmaBps,
        market.secondaryConfBps(),
        market.usedFallback(),
        market.source()
    );
  }

  private void publishTargetUpdated(RebalanceRecord record) {
    log.info("target updated trigger={} previousTarget={} newTarget={} price={}",
        record.trigger(), record.previousTarget(), record.newTarget(), record.price());
    events.publish(Instant.ofEpochSecond(record.timestamp()), DnmmEventTypes.POOL_TARGET_UPDATED, pairKey,
        new PoolEvents.TargetUpdated(record.previousTarget(), record.newTarget(), record.price(), record.timestamp(), record.trigger().name()));
  }

  private void publishSnapshot(PreviewSnapshot snapshot) {
    events.publish(Instant.ofEpochSecond(snapshot.timestamp()), DnmmEventTypes.POOL_PREVIEW_SNAPSHOT, pairKey,
        new PoolEvents.PreviewSnapshotRefreshed(snapshot.mid(), snapshot.divergenceBps(), snapshot.regimeFlags(), snapshot.blockRef(), snapshot.timestamp()));
  }

  private static boolean rebateEligible(DnmmProperties params, String caller) {
    if (!params.features().enableRebates() || caller == null || caller.isBlank()) {
      return false;
    }
    String c = caller.trim();
    return params.rebates().allowlist().stream().anyMatch(c::equalsIgnoreCase);
  }

  private static void requireValidAmount(DnmmProperties params, BigDecimal amountIn, boolean isBaseIn) {
    if (amountIn == null || amountIn.signum() <= 0) {
      throw PoolEngineException.invalidAmount("amountIn must be positive");
    }
    int decimals = isBaseIn ? params.tokens().baseDecimals() : params.tokens().quoteDecimals();
    if (amountIn.stripTrailingZeros().scale() > decimals) {
      throw PoolEngineException.invalidAmount("amountIn has more than " + decimals + " decimals");
    }
  }

  private record SidePricing(AomqActivationState aomq, BigDecimal effectiveIn, boolean aomqClamped, FeeBreakdown fee) {
  }

  private record Execution(QuoteResult result, AomqActivationState aomq, boolean clamped) {

    /**
     * No headroom on the output side. Previews report the row as clamped instead of failing.
     */
    static Execution floorBlocked(MarketInputs market, SidePricing pricing, BigDecimal amountIn) {
      QuoteResult empty = new QuoteResult(BigDecimal.ZERO, BigDecimal.ZERO, amountIn, pricing.fee().totalBps(), market.mid(),
          market.usedFallback(), QuoteReason.FLOOR_CLAMP, RegimeFlag.NEAR_FLOOR.bit(), pricing.fee());
      return new Execution(empty, pricing.aomq(), true);
    }
  }

  /**
   * Price inputs for one computation, taken either from a live oracle read or from the persisted snapshot.
   */
  private record MarketInputs(
      BigDecimal mid,
      int spreadBps,
      int confBps,
      int sigmaBps,
      int secondaryConfBps,
      boolean usedFallback,
      OracleSource source,
      long divergenceBps,
      boolean divergenceComparable
  ) {

    static MarketInputs live(ReferencePrice ref, DivergenceOutcome div) {
      return new MarketInputs(ref.mid(), ref.spreadBps(), ref.confidenceBps(), ref.sigmaBps(), ref.secondaryConfBps(),
          ref.usedFallback(), ref.source(), div.deltaBps(), ref.divergenceComparable());
    }

    static MarketInputs fromSnapshot(DnmmProperties params, PreviewSnapshot snapshot) {
      int conf = OracleFusion.confidenceBps(params, OracleMode.SPOT, snapshot.spreadBps(), snapshot.sigmaBps(), snapshot.secondaryConfBps());
      return new MarketInputs(snapshot.mid(), snapshot.spreadBps(), conf, snapshot.sigmaBps(), snapshot.secondaryConfBps(),
          snapshot.usedFallback(), snapshot.source(), snapshot.divergenceBps(), snapshot.divergenceComparable());
    }
  }
}
