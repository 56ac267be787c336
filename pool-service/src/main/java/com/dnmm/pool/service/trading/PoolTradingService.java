package com.dnmm.pool.service.trading;

import com.dnmm.pool.engine.PoolEngine;
import com.dnmm.pool.engine.QuoteResult;
import com.dnmm.pool.engine.SwapRequest;
import com.dnmm.pool.engine.SwapResult;
import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.oracle.OracleMode;
import com.dnmm.pool.preview.PreviewFees;
import com.dnmm.pool.preview.PreviewLadder;
import com.dnmm.pool.preview.PreviewSnapshot;
import com.dnmm.pool.recenter.RebalanceRecord;
import com.dnmm.pool.service.metrics.PoolMetricsService;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Front door to the engine. State-changing calls run one at a time under a single lock; quotes and previews
 * go straight through against the current immutable state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolTradingService {

  private final @NonNull PoolEngine engine;
  private final @NonNull PoolMetricsService metrics;

  private final ReentrantLock mutationLock = new ReentrantLock();

  public QuoteResult quote(BigDecimal amountIn, boolean isBaseIn, OracleMode mode, String caller) {
    return tracked("quote", () -> engine.quote(amountIn, isBaseIn, mode, caller));
  }

  public SwapResult swap(SwapRequest request) {
    SwapResult result = serialized("swap", () -> engine.swap(request));
    metrics.recordSwap(result);
    return result;
  }

  public RebalanceRecord manualRebalance() {
    RebalanceRecord record = serialized("rebalance", engine::manualRebalance);
    metrics.recordRecenter();
    return record;
  }

  public PreviewSnapshot refreshPreviewSnapshot() {
    return serialized("refresh_snapshot", engine::refreshPreviewSnapshot);
  }

  public PreviewFees previewFees(List<BigDecimal> sizes) {
    return tracked("preview_fees", () -> engine.previewFees(sizes));
  }

  public PreviewFees previewFeesFresh(List<BigDecimal> sizes) {
    return tracked("preview_fees_fresh", () -> engine.previewFeesFresh(sizes));
  }

  public PreviewLadder previewLadder(BigDecimal baseSize) {
    return tracked("preview_ladder", () -> engine.previewLadder(baseSize));
  }

  private <T> T serialized(String operation, Supplier<T> call) {
    mutationLock.lock();
    try {
      return tracked(operation, call);
    } finally {
      mutationLock.unlock();
    }
  }

  private <T> T tracked(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (PoolEngineException e) {
      metrics.recordReject(operation, e.code());
      log.warn("pool {} rejected code={} message={}", operation, e.code(), e.getMessage());
      throw e;
    }
  }
}
