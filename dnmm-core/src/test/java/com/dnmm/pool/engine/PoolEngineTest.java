package com.dnmm.pool.engine;

import com.dnmm.pool.config.InMemoryParameterStore;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.error.PoolErrorCode;
import com.dnmm.pool.events.DnmmEventTypes;
import com.dnmm.pool.events.PoolEvents;
import com.dnmm.pool.inventory.ReserveState;
import com.dnmm.pool.oracle.OracleMode;
import com.dnmm.pool.preview.PreviewFees;
import com.dnmm.pool.preview.PreviewLadder;
import com.dnmm.pool.preview.PreviewSnapshot;
import com.dnmm.pool.preview.RegimeFlag;
import com.dnmm.pool.recenter.RebalanceRecord;
import com.dnmm.pool.recenter.RecenterTrigger;
import com.dnmm.pool.testing.ManualLedgerClock;
import com.dnmm.pool.testing.RecordingEventPublisher;
import com.dnmm.pool.testing.StubOracleAdapter;
import com.dnmm.pool.testing.TestParams;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PoolEngineTest {

  private static final long T0 = 1_700_000_000L;

  private final StubOracleAdapter oracle = new StubOracleAdapter().primary("1.0");
  private final ManualLedgerClock clock = new ManualLedgerClock(T0);
  private final RecordingEventPublisher events = new RecordingEventPublisher();

  private PoolEngine engine(String... overrides) {
    String[] pool = {
        "dnmm.inventory.initial-base-reserve", "1000",
        "dnmm.inventory.initial-quote-reserve", "1000"
    };
    String[] all = Stream.concat(Stream.of(pool), Stream.of(overrides)).toArray(String[]::new);
    return new PoolEngine(new InMemoryParameterStore(TestParams.of(all)), oracle, clock, events);
  }

  private static SwapRequest baseIn(String amount) {
    return new SwapRequest(new BigDecimal(amount), null, true, OracleMode.SPOT, null, null);
  }

  @Test
  void quoteChargesBaseFeeAndLeavesStateAlone() {
    PoolEngine engine = engine();
    ReserveState before = engine.reserves();

    QuoteResult quote = engine.quote(new BigDecimal("10"), true, OracleMode.SPOT, null);

    assertThat(quote.feeBpsUsed()).isEqualTo(15);
    assertThat(quote.amountOut()).isEqualByComparingTo("9.985");
    assertThat(quote.reason()).isEqualTo(QuoteReason.NONE);
    assertThat(quote.isPartial()).isFalse();
    assertThat(quote.usedFallback()).isFalse();
    assertThat(engine.reserves()).isSameAs(before);
    assertThat(events.all()).isEmpty();
  }

  @Test
  void swapSettlesReservesAndPublishesEvents() {
    PoolEngine engine = engine();

    SwapResult result = engine.swap(baseIn("10"));

    assertThat(result.execution().amountOut()).isEqualByComparingTo("9.985");
    assertThat(result.targetUpdated()).isFalse();
    assertThat(engine.reserves().baseReserve()).isEqualByComparingTo("1010");
    assertThat(engine.reserves().quoteReserve()).isEqualByComparingTo("990.015");
    assertThat(engine.previewSnapshotRaw()).isPresent();
    assertThat(events.all()).extracting(RecordingEventPublisher.Published::type)
        .containsExactly(DnmmEventTypes.POOL_SWAP, DnmmEventTypes.POOL_PREVIEW_SNAPSHOT);
    assertThat(events.all()).extracting(RecordingEventPublisher.Published::key).containsOnly("HYPE/USDC");

    PoolEvents.SwapSettled swap = (PoolEvents.SwapSettled) events.ofType(DnmmEventTypes.POOL_SWAP).get(0).data();
    assertThat(swap.feeBps()).isEqualTo(15);
    assertThat(swap.reason()).isEqualTo("NONE");
  }

  @Test
  void rejectedAmountsNeverReachTheOracle() {
    PoolEngine engine = engine();

    assertThatThrownBy(() -> engine.quote(BigDecimal.ZERO, true, OracleMode.SPOT, null))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.INVALID_AMOUNT));
    assertThatThrownBy(() -> engine.quote(new BigDecimal("1.0000001"), false, OracleMode.SPOT, null))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.INVALID_AMOUNT));
  }

  @Test
  void failedSwapsLeaveStateUntouched() {
    PoolEngine engine = engine();
    ReserveState before = engine.reserves();

    SwapRequest late = new SwapRequest(new BigDecimal("10"), null, true, OracleMode.SPOT, T0 - 1, null);
    assertThatThrownBy(() -> engine.swap(late))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.DEADLINE_EXPIRED));

    SwapRequest greedy = new SwapRequest(new BigDecimal("10"), new BigDecimal("9.99"), true, OracleMode.SPOT, null, null);
    assertThatThrownBy(() -> engine.swap(greedy))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.SLIPPAGE));

    oracle.primary(null);
    assertThatThrownBy(() -> engine.swap(baseIn("10")))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.MID_UNSET));

    assertThat(engine.reserves()).isSameAs(before);
    assertThat(engine.previewSnapshotRaw()).isEmpty();
    assertThat(events.all()).isEmpty();
  }

  @Test
  void softDivergenceWidensAndDegradesTheQuote() {
    oracle.secondary("1.004", 0, 0);
    PoolEngine engine = engine();

    SwapResult result = engine.swap(baseIn("10"));
    QuoteResult quote = result.execution();

    assertThat(quote.fee().haircutBps()).isEqualTo(13);
    assertThat(quote.feeBpsUsed()).isEqualTo(60);
    assertThat(quote.reason()).isEqualTo(QuoteReason.SOFT_DIVERGENCE);
    assertThat(RegimeFlag.fromMask(quote.regimeFlags())).contains(RegimeFlag.AOMQ, RegimeFlag.SOFT_DIVERGENCE);
    assertThat(engine.getSoftDivergenceState().active()).isTrue();
    assertThat(engine.lastAomqState().anyActive()).isTrue();
    assertThat(events.ofType(DnmmEventTypes.POOL_DIVERGENCE_SOFT)).singleElement()
        .extracting(RecordingEventPublisher.Published::data)
        .isEqualTo(new PoolEvents.DivergenceSoft(40, 13, 0));
  }

  @Test
  void hardDivergenceRejects() {
    oracle.secondary("1.01", 0, 0);
    PoolEngine engine = engine();

    assertThatThrownBy(() -> engine.quote(new BigDecimal("10"), true, OracleMode.SPOT, null))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.DIVERGENCE_HARD));
  }

  @Test
  void fallbackOracleClampsToMinimumNotional() {
    oracle.primary("1.0", 31).ema("1.0");
    PoolEngine engine = engine();

    QuoteResult quote = engine.quote(new BigDecimal("500"), true, OracleMode.SPOT, null);

    assertThat(quote.usedFallback()).isTrue();
    assertThat(quote.reason()).isEqualTo(QuoteReason.AOMQ_CLAMP);
    assertThat(quote.appliedAmountIn()).isEqualByComparingTo("100");
    assertThat(quote.leftoverAmountIn()).isEqualByComparingTo("400");
    assertThat(quote.feeBpsUsed()).isEqualTo(60);
    assertThat(quote.amountOut()).isEqualByComparingTo("99.4");
    assertThat(RegimeFlag.fromMask(quote.regimeFlags())).contains(RegimeFlag.AOMQ, RegimeFlag.FALLBACK);
  }

  @Test
  void strictModeRefusesFallbackSources() {
    oracle.primary("1.0", 31).ema("1.0");
    PoolEngine engine = engine();

    assertThatThrownBy(() -> engine.quote(new BigDecimal("10"), true, OracleMode.STRICT, null))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.ORACLE_STALE));
  }

  @Test
  void allowlistedCallerGetsRebate() {
    PoolEngine engine = engine("dnmm.features.enable-rebates", "true", "dnmm.rebates.allowlist", "0xabc");

    assertThat(engine.quote(new BigDecimal("10"), true, OracleMode.SPOT, "0xABC").feeBpsUsed()).isEqualTo(12);
    assertThat(engine.quote(new BigDecimal("10"), true, OracleMode.SPOT, "0xdef").feeBpsUsed()).isEqualTo(15);
    assertThat(engine.quote(new BigDecimal("10"), true, OracleMode.SPOT, null).feeBpsUsed()).isEqualTo(15);
  }

  @Test
  void repeatedSwapsNeverBreachTheFloor() {
    PoolEngine engine = engine();
    PoolEngineException breach = null;

    for (int i = 0; i < 20 && breach == null; i++) {
      try {
        engine.swap(baseIn("200"));
      } catch (PoolEngineException e) {
        breach = e;
      }
      assertThat(engine.reserves().quoteReserve()).isGreaterThanOrEqualTo(new BigDecimal("30"));
    }

    assertThat(breach).isNotNull();
    assertThat(breach.code()).isEqualTo(PoolErrorCode.FLOOR_BREACH);
    assertThat(breach.details()).containsEntry("side", "quote");
  }

  @Test
  void drainingSwapsStopExactlyAtTheTargetAnchoredFloor() {
    PoolEngine engine = engine("dnmm.features.enable-aomq", "false");
    int settled = 0;
    PoolEngineException breach = null;

    while (breach == null && settled < 20) {
      try {
        engine.swap(baseIn("200"));
        settled++;
      } catch (PoolEngineException e) {
        breach = e;
      }
    }

    assertThat(settled).isEqualTo(5);
    assertThat(engine.reserves().quoteReserve()).isEqualByComparingTo("30");
    assertThat(breach.code()).isEqualTo(PoolErrorCode.FLOOR_BREACH);
  }

  @Test
  void swapWhoseOutputRoundsToZeroIsRejected() {
    PoolEngine engine = engine();
    ReserveState before = engine.reserves();

    assertThatThrownBy(() -> engine.swap(baseIn("0.0000001")))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> {
          assertThat(e.code()).isEqualTo(PoolErrorCode.INVALID_AMOUNT);
          assertThat(e.details()).containsEntry("outDecimals", 6);
        });
    assertThatThrownBy(() -> engine.quote(new BigDecimal("0.0000001"), true, OracleMode.SPOT, null))
        .isInstanceOf(PoolEngineException.class);
    assertThat(engine.reserves()).isSameAs(before);
    assertThat(events.all()).isEmpty();
  }

  @Test
  void autoRecenterCommitsOnceAfterLargeMove() {
    PoolEngine engine = engine();

    engine.swap(baseIn("1"));
    assertThat(engine.recenterState().lastRebalancePrice()).isEqualByComparingTo("1.0");

    clock.advance(5);
    oracle.primary("1.1");
    SwapResult moved = engine.swap(baseIn("1"));

    assertThat(moved.targetUpdated()).isTrue();
    RebalanceRecord record = moved.rebalance();
    assertThat(record.trigger()).isEqualTo(RecenterTrigger.AUTO);
    assertThat(record.newTarget()).isCloseTo(new BigDecimal("954.59"), within(new BigDecimal("0.01")));
    assertThat(engine.reserves().targetBaseStar()).isEqualByComparingTo(record.newTarget());

    clock.advance(5);
    oracle.primary("1.11");
    assertThat(engine.swap(baseIn("1")).targetUpdated()).isFalse();
    assertThat(events.ofType(DnmmEventTypes.POOL_TARGET_UPDATED)).hasSize(1);
  }

  @Test
  void manualRebalanceFollowsThresholdAndCooldown() {
    PoolEngine engine = engine();

    assertThatThrownBy(engine::manualRebalance)
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.RECENTER_THRESHOLD));

    oracle.primary("1.1");
    RebalanceRecord first = engine.manualRebalance();
    assertThat(first.trigger()).isEqualTo(RecenterTrigger.MANUAL);
    assertThat(first.newTarget()).isEqualByComparingTo("954.545454545454545454");

    assertThatThrownBy(engine::manualRebalance)
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.RECENTER_COOLDOWN));

    clock.advance(121);
    oracle.primary("1.2");
    assertThat(engine.manualRebalance().previousTarget()).isEqualByComparingTo(first.newTarget());
    assertThat(events.ofType(DnmmEventTypes.POOL_TARGET_UPDATED)).hasSize(2);
  }

  @Test
  void manualRebalanceNeedsFreshPrimary() {
    oracle.primary("1.1", 31).ema("1.1");
    PoolEngine engine = engine();

    assertThatThrownBy(engine::manualRebalance)
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.ORACLE_STALE));
    assertThat(engine.reserves().targetBaseStar()).isEqualByComparingTo("1000");
  }

  @Test
  void previewMatchesLiveQuoteAtSnapshot() {
    PoolEngine engine = engine();
    PreviewSnapshot snapshot = engine.refreshPreviewSnapshot();

    PreviewFees fees = engine.previewFees(List.of(new BigDecimal("10")));
    QuoteResult bid = engine.quote(new BigDecimal("10"), true, OracleMode.SPOT, null);
    QuoteResult ask = engine.quote(new BigDecimal("10"), false, OracleMode.SPOT, null);

    assertThat(snapshot.mid()).isEqualByComparingTo("1.0");
    assertThat(snapshot.timestamp()).isEqualTo(T0);
    assertThat(fees.bidFeeBps()).containsExactly(bid.feeBpsUsed());
    assertThat(fees.askFeeBps()).containsExactly(ask.feeBpsUsed());
    assertThat(events.ofType(DnmmEventTypes.POOL_PREVIEW_SNAPSHOT)).hasSize(1);
  }

  @Test
  void previewAfterSettledSwapMatchesTheNextSwap() {
    PoolEngine engine = engine();
    engine.swap(baseIn("10"));
    clock.advance(2);

    PreviewFees fees = engine.previewFees(List.of(new BigDecimal("10")));
    QuoteResult ask = engine.quote(new BigDecimal("10"), false, OracleMode.SPOT, null);
    SwapResult next = engine.swap(baseIn("10"));

    assertThat(fees.bidFeeBps()).containsExactly(next.execution().feeBpsUsed());
    assertThat(fees.askFeeBps()).containsExactly(ask.feeBpsUsed());
    assertThat(next.execution().feeBpsUsed()).isGreaterThan(15);
  }

  @Test
  void previewIgnoresOracleMovesUntilRefreshed() {
    PoolEngine engine = engine();
    engine.refreshPreviewSnapshot();

    oracle.primary(null);

    assertThat(engine.previewFees(List.of(new BigDecimal("10"))).bidFeeBps()).containsExactly(15);
  }

  @Test
  void previewWithoutSnapshotIsMidUnset() {
    PoolEngine engine = engine();

    assertThatThrownBy(() -> engine.previewFees(List.of(BigDecimal.ONE)))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.MID_UNSET));
  }

  @Test
  void stalePreviewRevertsWhenConfigured() {
    PoolEngine engine = engine("dnmm.preview.revert-on-stale-preview", "true");
    engine.refreshPreviewSnapshot();
    clock.advance(11);

    assertThatThrownBy(() -> engine.previewFees(List.of(BigDecimal.ONE)))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> {
          assertThat(e.code()).isEqualTo(PoolErrorCode.PREVIEW_SNAPSHOT_STALE);
          assertThat(e.details()).containsEntry("ageSec", 11L).containsEntry("maxAgeSec", 10L);
        });
  }

  @Test
  void stalePreviewIsServedByDefault() {
    PoolEngine engine = engine();
    engine.refreshPreviewSnapshot();
    clock.advance(60);

    assertThat(engine.previewFees(List.of(BigDecimal.ONE)).bidFeeBps()).containsExactly(15);
  }

  @Test
  void snapshotRefreshHonoursCooldown() {
    PoolEngine engine = engine("dnmm.preview.snapshot-cooldown-sec", "5");
    engine.refreshPreviewSnapshot();
    clock.advance(2);

    assertThatThrownBy(engine::refreshPreviewSnapshot)
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.PREVIEW_SNAPSHOT_COOLDOWN));
  }

  @Test
  void freshPreviewIsGated() {
    assertThatThrownBy(() -> engine().previewFeesFresh(List.of(BigDecimal.ONE)))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.INVALID_CONFIG));

    PoolEngine enabled = engine("dnmm.preview.enable-preview-fresh", "true");
    assertThat(enabled.previewFeesFresh(List.of(new BigDecimal("10"))).bidFeeBps()).containsExactly(15);
  }

  @Test
  void ladderScalesFromBaseSize() {
    PoolEngine engine = engine();
    engine.refreshPreviewSnapshot();
    clock.advance(3);

    PreviewLadder ladder = engine.previewLadder(BigDecimal.ONE);

    assertThat(ladder.rows()).extracting(PreviewLadder.Row::sizeBase)
        .usingElementComparator(BigDecimal::compareTo)
        .containsExactly(BigDecimal.ONE, BigDecimal.valueOf(2), BigDecimal.valueOf(5), BigDecimal.TEN);
    assertThat(ladder.rows()).allSatisfy(row -> {
      assertThat(row.askClamped()).isFalse();
      assertThat(row.bidClamped()).isFalse();
    });
    assertThat(ladder.snapshotAgeSec()).isEqualTo(3);
  }

  @Test
  void ladderDefaultsToReferenceNotionalAndFlagsClampedRows() {
    PoolEngine engine = engine();
    engine.refreshPreviewSnapshot();

    PreviewLadder ladder = engine.previewLadder(null);

    assertThat(ladder.rows().get(0).sizeBase()).isEqualByComparingTo("5000");
    assertThat(ladder.rows()).allSatisfy(row -> assertThat(row.bidClamped()).isTrue());
  }
}
