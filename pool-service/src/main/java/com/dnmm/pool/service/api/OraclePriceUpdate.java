package com.dnmm.pool.service.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Price push for the paper feed.
 *
 * @param bps    spread for the primary, confidence for the secondary; ignored for the EMA
 * @param ageSec backdates the reading
 */
public record OraclePriceUpdate(
    @NotNull @DecimalMin(value="0", inclusive=false) BigDecimal mid,
    @PositiveOrZero Integer bps,
    @PositiveOrZero Long ageSec
) {
}
