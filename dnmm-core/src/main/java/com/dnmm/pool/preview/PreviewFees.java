package com.dnmm.pool.preview;

import java.util.List;

/**
 * Per-size fees. Ask entries price a quote-in trade, bid entries a base-in trade.
 */
public record PreviewFees(List<Integer> askFeeBps, List<Integer> bidFeeBps) {

  public PreviewFees {
    askFeeBps = List.copyOf(askFeeBps);
    bidFeeBps = List.copyOf(bidFeeBps);
  }
}
