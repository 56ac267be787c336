package com.dnmm.pool.oracle;

import java.math.BigDecimal;

public record OracleReading(BigDecimal mid, long ageSeconds, int spreadBps, OracleSource source) {

  public boolean hasMid() {
    return mid != null && mid.signum() > 0;
  }
}
