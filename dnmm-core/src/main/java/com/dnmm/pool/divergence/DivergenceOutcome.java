package com.dnmm.pool.divergence;

public record DivergenceOutcome(long deltaBps, DivergenceBand band, int haircutBps, SoftDivergenceState nextState) {
}
