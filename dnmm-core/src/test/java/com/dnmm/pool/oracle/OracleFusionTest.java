package com.dnmm.pool.oracle;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.error.PoolErrorCode;
import com.dnmm.pool.testing.StubOracleAdapter;
import com.dnmm.pool.testing.TestParams;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OracleFusionTest {

  private final DnmmProperties params = DnmmProperties.defaults();
  private final StubOracleAdapter stub = new StubOracleAdapter();
  private final OracleFusion fusion = new OracleFusion(stub);

  @Test
  void freshPrimaryWinsAndBlendsSecondaryConfidence() {
    stub.primary("100", 2).book("99.95", "100.05").secondary("100.1", 20, 5);

    ReferencePrice ref = fusion.readReferencePrice(params, OracleMode.SPOT, 0);

    assertThat(ref.mid()).isEqualByComparingTo("100");
    assertThat(ref.source()).isEqualTo(OracleSource.PRIMARY);
    assertThat(ref.usedFallback()).isFalse();
    assertThat(ref.spreadBps()).isEqualTo(10);
    assertThat(ref.confidenceBps()).isEqualTo(20);
    assertThat(ref.divergenceComparable()).isTrue();
    assertThat(ref.reason()).isEqualTo("primary_spot");
  }

  @Test
  void missingBookCountsAsZeroSpread() {
    stub.primary("100", 0);

    ReferencePrice ref = fusion.readReferencePrice(params, OracleMode.SPOT, 0);

    assertThat(ref.spreadBps()).isZero();
    assertThat(ref.confidenceBps()).isZero();
    assertThat(ref.divergenceComparable()).isFalse();
  }

  @Test
  void stalePrimaryFallsBackToEmaInSpotMode() {
    stub.primary("100", 31).ema("99.5");

    ReferencePrice ref = fusion.readReferencePrice(params, OracleMode.SPOT, 0);

    assertThat(ref.mid()).isEqualByComparingTo("99.5");
    assertThat(ref.source()).isEqualTo(OracleSource.EMA_FALLBACK);
    assertThat(ref.usedFallback()).isTrue();
    assertThat(ref.reason()).isEqualTo("ema_fallback");
    assertThat(ref.divergenceComparable()).isFalse();
  }

  @Test
  void strictModeSkipsEmaAndUsesFreshSecondary() {
    stub.primary("100", 31).ema("99.5").secondary("100.2", 15, 10);

    ReferencePrice ref = fusion.readReferencePrice(params, OracleMode.STRICT, 0);

    assertThat(ref.source()).isEqualTo(OracleSource.SECONDARY);
    assertThat(ref.mid()).isEqualByComparingTo("100.2");
    assertThat(ref.usedFallback()).isTrue();
  }

  @Test
  void strictModeAppliesTighterSecondaryAge() {
    stub.primary("100", 31).ema("99.5").secondary("100.2", 15, 30);

    assertThatThrownBy(() -> fusion.readReferencePrice(params, OracleMode.STRICT, 0))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> {
          assertThat(e.code()).isEqualTo(PoolErrorCode.ORACLE_STALE);
          assertThat(e.details()).containsEntry("source", "PRIMARY").containsEntry("ageSec", 31L);
        });
  }

  @Test
  void nothingResolvedIsMidUnset() {
    assertThatThrownBy(() -> fusion.readReferencePrice(params, OracleMode.SPOT, 0))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.MID_UNSET));
  }

  @Test
  void staleSecondaryOnlyIsOracleStale() {
    DnmmProperties noEma = TestParams.of("dnmm.oracle.allow-ema-fallback", "false");
    stub.ema("99").secondary("100", 10, 61);

    assertThatThrownBy(() -> fusion.readReferencePrice(noEma, OracleMode.SPOT, 0))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> {
          assertThat(e.code()).isEqualTo(PoolErrorCode.ORACLE_STALE);
          assertThat(e.details()).containsEntry("source", "SECONDARY").containsEntry("maxAgeSec", 60L);
        });
  }

  @Test
  void confidenceIsCappedPerMode() {
    stub.primary("100", 0).book("90", "110");

    assertThat(fusion.readReferencePrice(params, OracleMode.SPOT, 0).confidenceBps()).isEqualTo(250);
    assertThat(fusion.readReferencePrice(params, OracleMode.STRICT, 0).confidenceBps()).isEqualTo(150);
  }

  @Test
  void confidenceTakesLargestWeightedTerm() {
    assertThat(OracleFusion.confidenceBps(params, OracleMode.SPOT, 10, 40, 20)).isEqualTo(40);

    DnmmProperties halfSigma = TestParams.of("dnmm.oracle.conf-weight-sigma-bps", "5000");
    assertThat(OracleFusion.confidenceBps(halfSigma, OracleMode.SPOT, 10, 40, 5)).isEqualTo(20);

    DnmmProperties spreadOnly = TestParams.of("dnmm.oracle.blend-on", "false");
    assertThat(OracleFusion.confidenceBps(spreadOnly, OracleMode.SPOT, 10, 400, 300)).isEqualTo(10);
  }

  @Test
  void freshPrimaryReadRejectsStaleSpotEvenWithFallbacks() {
    stub.primary("100", 45).ema("100").secondary("100", 0, 0);

    assertThatThrownBy(() -> fusion.readFreshPrimary(params))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.ORACLE_STALE));

    stub.primary("101.5", 3);
    assertThat(fusion.readFreshPrimary(params).mid()).isEqualByComparingTo(new BigDecimal("101.5"));
  }
}
