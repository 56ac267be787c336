package com.dnmm.pool.oracle;

public enum OracleMode {
  /** Primary spot with EMA and secondary fallbacks, spot confidence cap. */
  SPOT,
  /** No EMA fallback, strict confidence cap and strict secondary max age. */
  STRICT,
}
