package com.dnmm.pool.divergence;

public enum DivergenceBand {
  /** Only one independent mid was available; nothing to compare. */
  NOT_COMPARABLE,
  ACCEPT,
  SOFT,
  HARD,
}
