package com.dnmm.pool.error;

/**
 * Failure taxonomy of the pool engine. Every code aborts the operation before any state is committed.
 */
public enum PoolErrorCode {
  /** No oracle source produced a non-zero mid. */
  MID_UNSET(Category.PRICE_DATA),
  /** A source resolved but its reading exceeded the configured max age. */
  ORACLE_STALE(Category.PRICE_DATA),
  /** Primary and secondary mids disagree by more than the hard band. */
  DIVERGENCE_HARD(Category.PRICE_DATA),
  /** Nothing can be filled without breaching the reserve floor. */
  FLOOR_BREACH(Category.POLICY),
  RECENTER_COOLDOWN(Category.POLICY),
  RECENTER_THRESHOLD(Category.POLICY),
  PREVIEW_SNAPSHOT_STALE(Category.PRICE_DATA),
  PREVIEW_SNAPSHOT_COOLDOWN(Category.POLICY),
  SLIPPAGE(Category.POLICY),
  DEADLINE_EXPIRED(Category.POLICY),
  INVALID_AMOUNT(Category.INPUT),
  INVALID_CONFIG(Category.INPUT);

  private final Category category;

  PoolErrorCode(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  public enum Category {
    PRICE_DATA,
    POLICY,
    INPUT,
  }
}
