package com.dnmm.pool.engine;

/**
 * Time and block reference used for staleness, cooldowns and snapshot stamps.
 */
public interface LedgerClock {

  long nowSeconds();

  long blockNumber();
}
