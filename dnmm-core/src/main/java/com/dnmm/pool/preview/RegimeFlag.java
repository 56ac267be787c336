package com.dnmm.pool.preview;

import java.util.EnumSet;
import java.util.Set;

/**
 * Regime bitmask reported with quotes, previews and snapshots.
 */
public enum RegimeFlag {
  AOMQ(1),
  FALLBACK(2),
  NEAR_FLOOR(4),
  SIZE_FEE(8),
  INV_TILT(16),
  SOFT_DIVERGENCE(32);

  private final int bit;

  RegimeFlag(int bit) {
    this.bit = bit;
  }

  public int bit() {
    return bit;
  }

  public static int mask(Set<RegimeFlag> flags) {
    int m = 0;
    for (RegimeFlag f : flags) {
      m |= f.bit;
    }
    return m;
  }

  public static Set<RegimeFlag> fromMask(int mask) {
    EnumSet<RegimeFlag> out = EnumSet.noneOf(RegimeFlag.class);
    for (RegimeFlag f : values()) {
      if ((mask & f.bit) != 0) {
        out.add(f);
      }
    }
    return out;
  }
}
