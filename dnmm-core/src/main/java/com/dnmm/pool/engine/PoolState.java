package com.dnmm.pool.engine;

import com.dnmm.pool.aomq.AomqActivationState;
import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.divergence.SoftDivergenceState;
import com.dnmm.pool.inventory.ReserveState;
import com.dnmm.pool.preview.PreviewSnapshot;
import com.dnmm.pool.recenter.RecenterState;

import java.math.BigDecimal;

/**
 * Everything the engine mutates. Immutable; an operation commits by swapping the whole reference.
 *
 * @param snapshot null until the first settled swap or explicit refresh
 */
public record PoolState(
    ReserveState reserves,
    SoftDivergenceState divergence,
    VolatilityState volatility,
    RecenterState recenter,
    PreviewSnapshot snapshot,
    AomqActivationState lastAomq
) {

  public static PoolState initial(DnmmProperties params) {
    DnmmProperties.Inventory inv = params.inventory();
    BigDecimal target = inv.targetBaseXstar() != null ? inv.targetBaseXstar() : inv.initialBaseReserve();
    return new PoolState(
        new ReserveState(inv.initialBaseReserve(), inv.initialQuoteReserve(), target),
        SoftDivergenceState.initial(),
        VolatilityState.initial(),
        RecenterState.initial(inv.recenterHysteresisFrames()),
        null,
        AomqActivationState.inactive()
    );
  }

  PoolState withSnapshot(PreviewSnapshot next) {
    return new PoolState(reserves, divergence, volatility, recenter, next, lastAomq);
  }

  PoolState withRecenter(RecenterState nextRecenter, ReserveState nextReserves) {
    return new PoolState(nextReserves, divergence, volatility, nextRecenter, snapshot, lastAomq);
  }
}
