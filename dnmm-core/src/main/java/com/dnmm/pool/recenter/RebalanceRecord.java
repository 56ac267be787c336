package com.dnmm.pool.recenter;

import java.math.BigDecimal;

public record RebalanceRecord(
    BigDecimal previousTarget,
    BigDecimal newTarget,
    BigDecimal price,
    long timestamp,
    RecenterTrigger trigger
) {
}
