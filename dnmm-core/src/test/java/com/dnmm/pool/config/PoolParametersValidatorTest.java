package com.dnmm.pool.config;

import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.error.PoolErrorCode;
import com.dnmm.pool.testing.TestParams;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolParametersValidatorTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> PoolParametersValidator.validate(DnmmProperties.defaults())).doesNotThrowAnyException();
  }

  @Test
  void rejectsUnorderedDivergenceBands() {
    DnmmProperties params = TestParams.of("dnmm.divergence.soft-bps", "80", "dnmm.divergence.hard-bps", "75");

    assertThatThrownBy(() -> PoolParametersValidator.validate(params))
        .isInstanceOf(PoolEngineException.class)
        .satisfies(e -> {
          PoolEngineException pe = (PoolEngineException) e;
          assertThat(pe.code()).isEqualTo(PoolErrorCode.INVALID_CONFIG);
          assertThat(pe.details()).containsEntry("field", "divergence.soft-bps");
        });
  }

  @Test
  void rejectsFloorAtHalfOfReserves() {
    DnmmProperties params = TestParams.of("dnmm.inventory.floor-bps", "5000");

    assertThatThrownBy(() -> PoolParametersValidator.validate(params))
        .isInstanceOfSatisfying(PoolEngineException.class, e -> assertThat(e.code()).isEqualTo(PoolErrorCode.INVALID_CONFIG));
  }

  @Test
  void rejectsEmergencySpreadAboveCap() {
    DnmmProperties params = TestParams.of("dnmm.fee.cap-bps", "50", "dnmm.aomq.emergency-spread-bps", "60");

    assertThatThrownBy(() -> PoolParametersValidator.validate(params))
        .isInstanceOfSatisfying(PoolEngineException.class,
            e -> assertThat(e.details()).containsEntry("field", "aomq.emergency-spread-bps"));
  }

  @Test
  void parameterStoreKeepsPreviousSetWhenUpdateIsRejected() {
    InMemoryParameterStore store = new InMemoryParameterStore(DnmmProperties.defaults());
    DnmmProperties bad = TestParams.of("dnmm.divergence.accept-bps", "60");

    assertThatThrownBy(() -> store.update(bad)).isInstanceOf(PoolEngineException.class);
    assertThat(store.current().divergence().acceptBps()).isEqualTo(30);

    DnmmProperties good = TestParams.of("dnmm.fee.base-bps", "20");
    store.update(good);
    assertThat(store.current().fee().baseBps()).isEqualTo(20);
  }
}
