package com.dnmm.pool.engine;

/**
 * Why a quote differs from a plain full fill. When several apply the earliest constant wins.
 */
public enum QuoteReason {
  AOMQ_CLAMP,
  FLOOR_CLAMP,
  SOFT_DIVERGENCE,
  FALLBACK,
  NONE,
}
