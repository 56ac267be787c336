package com.dnmm.pool.fee;

public record FeeBreakdown(
    int baseBps,
    int confidenceBps,
    int haircutBps,
    int inventoryDeviationBps,
    int sizeBps,
    int tiltBps,
    int bboFloorBps,
    int volatilityBps,
    int emergencyFloorBps,
    int rebateBps,
    int totalBps
) {

  public boolean sizeFeeApplied() {
    return sizeBps > 0;
  }

  public boolean tiltApplied() {
    return tiltBps != 0;
  }
}
