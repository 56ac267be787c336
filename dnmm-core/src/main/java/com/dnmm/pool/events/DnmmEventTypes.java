package com.dnmm.pool.events;

public final class DnmmEventTypes {

  public static final String POOL_SWAP = "pool.swap";
  public static final String POOL_TARGET_UPDATED = "pool.target_updated";
  public static final String POOL_PREVIEW_SNAPSHOT = "pool.preview_snapshot";
  public static final String POOL_DIVERGENCE_SOFT = "pool.divergence_soft";

  private DnmmEventTypes() {
  }
}
