package com.dnmm.pool.service.oracle;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Seed values for the in-process paper oracle feed.
 */
@Validated
@ConfigurationProperties(prefix="dnmm.paper")
public record PaperOracleProperties(
    @NotNull @DecimalMin(value="0", inclusive=false) BigDecimal initialMid,
    @NotNull @PositiveOrZero Integer initialSpreadBps,
    @NotNull @PositiveOrZero Integer initialSecondaryConfBps,
    @NotNull Boolean secondaryEnabled,
    @NotNull @Min(1) Long blockTimeMillis
) {
  public PaperOracleProperties {
    if (initialMid == null) {
      initialMid = BigDecimal.valueOf(25);
    }
    if (initialSpreadBps == null) {
      initialSpreadBps = 10;
    }
    if (initialSecondaryConfBps == null) {
      initialSecondaryConfBps = 20;
    }
    if (secondaryEnabled == null) {
      secondaryEnabled = true;
    }
    if (blockTimeMillis == null) {
      blockTimeMillis = 1_000L;
    }
  }
}
