package com.dnmm.pool.engine;

import com.dnmm.pool.recenter.RebalanceRecord;

/**
 * @param rebalance the automatic recenter committed by this swap, or null
 */
public record SwapResult(QuoteResult execution, RebalanceRecord rebalance) {

  public boolean targetUpdated() {
    return rebalance != null;
  }
}
