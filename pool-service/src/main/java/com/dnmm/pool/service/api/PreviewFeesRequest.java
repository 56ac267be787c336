package com.dnmm.pool.service.api;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

public record PreviewFeesRequest(
    @NotEmpty @Size(max=64) List<@NotNull @PositiveOrZero BigDecimal> sizesBase
) {
}
