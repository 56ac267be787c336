package com.dnmm.pool.aomq;

public enum AomqTrigger {
  NONE,
  SOFT_DIVERGENCE,
  NEAR_FLOOR,
  FALLBACK,
}
