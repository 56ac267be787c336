package com.dnmm.pool.preview;

import java.math.BigDecimal;
import java.util.List;

public record PreviewLadder(List<Row> rows, long snapshotAgeSec, BigDecimal snapshotMid, long snapshotTimestamp) {

  public static final List<Integer> MULTIPLIERS = List.of(1, 2, 5, 10);

  public PreviewLadder {
    rows = List.copyOf(rows);
  }

  /**
   * @param askClamped the ask-side fill is cut by degraded mode or by the reserve floor
   */
  public record Row(BigDecimal sizeBase, int askFeeBps, int bidFeeBps, boolean askClamped, boolean bidClamped) {
  }
}
