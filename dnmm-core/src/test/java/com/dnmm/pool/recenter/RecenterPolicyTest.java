package com.dnmm.pool.recenter;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.error.PoolErrorCode;
import com.dnmm.pool.inventory.ReserveState;
import com.dnmm.pool.testing.TestParams;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecenterPolicyTest {

  private static final int BASE_SCALE = 18;

  private final DnmmProperties params = DnmmProperties.defaults();
  private final ReserveState reserves = new ReserveState(new BigDecimal("1000"), new BigDecimal("1000"), new BigDecimal("1000"));

  @Test
  void targetSplitsPoolValueEvenly() {
    TargetChange change = RecenterPolicy.targetChange(params, reserves, new BigDecimal("1.1"), BASE_SCALE);

    assertThat(change.proposedTarget()).isEqualByComparingTo("954.545454545454545454");
    assertThat(change.changeBps()).isEqualTo(454);
    assertThat(change.commits()).isTrue();
  }

  @Test
  void firstObservationOnlySeedsThePrice() {
    RecenterOutcome out = RecenterPolicy.observe(params, RecenterState.initial(3), reserves, new BigDecimal("1.1"), 1_000, BASE_SCALE);

    assertThat(out.committed()).isFalse();
    assertThat(out.state().lastRebalancePrice()).isEqualByComparingTo("1.1");
    assertThat(out.reserves().targetBaseStar()).isEqualByComparingTo("1000");
  }

  @Test
  void subThresholdMoveIsAHealthyFrame() {
    RecenterState seeded = new RecenterState(BigDecimal.ONE, null, 1);

    RecenterOutcome out = RecenterPolicy.observe(params, seeded, reserves, new BigDecimal("1.05"), 1_000, BASE_SCALE);

    assertThat(out.committed()).isFalse();
    assertThat(out.state().healthyStreak()).isEqualTo(2);
  }

  @Test
  void deviationBeyondThresholdCommits() {
    RecenterState seeded = new RecenterState(BigDecimal.ONE, null, 3);

    RecenterOutcome out = RecenterPolicy.observe(params, seeded, reserves, new BigDecimal("1.1"), 1_000, BASE_SCALE);

    assertThat(out.committed()).isTrue();
    assertThat(out.record().trigger()).isEqualTo(RecenterTrigger.AUTO);
    assertThat(out.record().previousTarget()).isEqualByComparingTo("1000");
    assertThat(out.reserves().targetBaseStar()).isEqualByComparingTo(out.record().newTarget());
    assertThat(out.reserves().baseReserve()).isEqualByComparingTo("1000");
    assertThat(out.state()).isEqualTo(new RecenterState(new BigDecimal("1.1"), 1_000L, 0));
  }

  @Test
  void hysteresisAndCooldownGateTheNextCommit() {
    RecenterState afterCommit = new RecenterState(new BigDecimal("1.1"), 1_000L, 0);
    BigDecimal jump = new BigDecimal("1.25");

    RecenterOutcome blockedByStreak = RecenterPolicy.observe(params, afterCommit, reserves, jump, 2_000, BASE_SCALE);
    assertThat(blockedByStreak.committed()).isFalse();

    RecenterState state = afterCommit;
    for (int i = 0; i < 3; i++) {
      state = RecenterPolicy.observe(params, state, reserves, new BigDecimal("1.12"), 2_000, BASE_SCALE).state();
    }
    assertThat(state.healthyStreak()).isEqualTo(3);

    RecenterOutcome blockedByCooldown = RecenterPolicy.observe(params, state, reserves, jump, 1_050, BASE_SCALE);
    assertThat(blockedByCooldown.committed()).isFalse();

    RecenterOutcome committed = RecenterPolicy.observe(params, state, reserves, jump, 2_000, BASE_SCALE);
    assertThat(committed.committed()).isTrue();
  }

  @Test
  void disabledAutoRecenterChangesNothing() {
    DnmmProperties off = TestParams.of("dnmm.features.enable-auto-recenter", "false");
    RecenterState seeded = new RecenterState(BigDecimal.ONE, null, 3);

    RecenterOutcome out = RecenterPolicy.observe(off, seeded, reserves, new BigDecimal("2"), 1_000, BASE_SCALE);

    assertThat(out.committed()).isFalse();
    assertThat(out.state()).isSameAs(seeded);
  }

  @Test
  void manualRebalanceHonoursCooldownThenThreshold() {
    RecenterState recent = new RecenterState(BigDecimal.ONE, 1_000L, 3);

    assertThatThrownBy(() -> RecenterPolicy.manual(params, recent, reserves, new BigDecimal("1.1"), 1_060, BASE_SCALE))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> {
          assertThat(e.code()).isEqualTo(PoolErrorCode.RECENTER_COOLDOWN);
          assertThat(e.details()).containsEntry("elapsedSec", 60L).containsEntry("cooldownSec", 120L);
        });

    assertThatThrownBy(() -> RecenterPolicy.manual(params, recent, reserves, BigDecimal.ONE, 1_200, BASE_SCALE))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.RECENTER_THRESHOLD));

    RecenterOutcome out = RecenterPolicy.manual(params, recent, reserves, new BigDecimal("1.1"), 1_200, BASE_SCALE);
    assertThat(out.record().trigger()).isEqualTo(RecenterTrigger.MANUAL);
    assertThat(out.state().lastRebalanceAt()).isEqualTo(1_200L);
  }
}
