package com.dnmm.pool.recenter;

import java.math.BigDecimal;

/**
 * Proposed target for a rebalance and its relative change against the current one.
 */
public record TargetChange(BigDecimal currentTarget, BigDecimal proposedTarget, long changeBps, boolean commits) {
}
