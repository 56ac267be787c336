package com.dnmm.pool.engine;

import com.dnmm.pool.oracle.OracleMode;

import java.math.BigDecimal;

/**
 * @param minAmountOut slippage bound; null accepts any output
 * @param deadline     ledger seconds after which the swap is rejected; null disables the check
 * @param caller       optional caller id, matched against the rebate allowlist
 */
public record SwapRequest(
    BigDecimal amountIn,
    BigDecimal minAmountOut,
    boolean isBaseIn,
    OracleMode mode,
    Long deadline,
    String caller
) {

  public SwapRequest {
    if (mode == null) {
      mode = OracleMode.SPOT;
    }
  }
}
