package com.dnmm.pool.service.api;

import com.dnmm.pool.oracle.OracleMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record QuoteRequest(
    @NotNull @DecimalMin(value="0", inclusive=false) BigDecimal amountIn,
    @NotNull Boolean isBaseIn,
    OracleMode mode,
    String caller
) {
}
