package com.dnmm.pool.service.api;

import com.dnmm.pool.aomq.AomqActivationState;
import com.dnmm.pool.divergence.SoftDivergenceState;
import com.dnmm.pool.inventory.ReserveState;
import com.dnmm.pool.recenter.RecenterState;

public record PoolStateResponse(
    ReserveState reserves,
    SoftDivergenceState softDivergence,
    AomqActivationState lastAomq,
    RecenterState recenter,
    int sigmaBps
) {
}
