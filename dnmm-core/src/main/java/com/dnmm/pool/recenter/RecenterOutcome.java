package com.dnmm.pool.recenter;

import com.dnmm.pool.inventory.ReserveState;

/**
 * Next recenter state plus the reserves after any target update. {@code record} is null when nothing committed.
 */
public record RecenterOutcome(RecenterState state, ReserveState reserves, RebalanceRecord record) {

  public boolean committed() {
    return record != null;
  }
}
