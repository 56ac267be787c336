package com.dnmm.pool.fee;

import java.math.BigDecimal;

/**
 * Inputs of one fee computation.
 *
 * @param notional trade notional in quote units
 * @param degraded degraded quote mode is active for the traded side
 */
public record FeeContext(
    int confBps,
    int spreadBps,
    int sigmaBps,
    int haircutBps,
    BigDecimal notional,
    boolean isBaseIn,
    BigDecimal baseReserve,
    BigDecimal targetBase,
    boolean degraded,
    boolean rebateEligible
) {
}
