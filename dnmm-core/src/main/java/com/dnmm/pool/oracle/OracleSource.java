package com.dnmm.pool.oracle;

/**
 * Closed set of price sources, listed in fallback priority order.
 */
public enum OracleSource {
  PRIMARY,
  EMA_FALLBACK,
  SECONDARY,
}
