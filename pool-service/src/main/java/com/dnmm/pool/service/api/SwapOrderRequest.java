package com.dnmm.pool.service.api;

import com.dnmm.pool.oracle.OracleMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record SwapOrderRequest(
    @NotNull @DecimalMin(value="0", inclusive=false) BigDecimal amountIn,
    @PositiveOrZero BigDecimal minAmountOut,
    @NotNull Boolean isBaseIn,
    OracleMode mode,
    Long deadline,
    String caller
) {
}
