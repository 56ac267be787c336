package com.dnmm.pool.service.web;

import com.dnmm.pool.engine.PoolEngine;
import com.dnmm.pool.engine.QuoteResult;
import com.dnmm.pool.engine.SwapRequest;
import com.dnmm.pool.engine.SwapResult;
import com.dnmm.pool.preview.PreviewFees;
import com.dnmm.pool.preview.PreviewLadder;
import com.dnmm.pool.preview.PreviewSnapshot;
import com.dnmm.pool.recenter.RebalanceRecord;
import com.dnmm.pool.service.api.PoolStateResponse;
import com.dnmm.pool.service.api.PreviewFeesRequest;
import com.dnmm.pool.service.api.QuoteRequest;
import com.dnmm.pool.service.api.SwapOrderRequest;
import com.dnmm.pool.service.trading.PoolTradingService;
import jakarta.validation.Valid;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/pool")
@Validated
@RequiredArgsConstructor
@Slf4j
public class PoolController {

  private final @NonNull PoolTradingService tradingService;
  private final @NonNull PoolEngine engine;

  @PostMapping("/quote")
  public ResponseEntity<QuoteResult> quote(@Valid @RequestBody QuoteRequest request) {
    return ResponseEntity.ok(tradingService.quote(request.amountIn(), request.isBaseIn(), request.mode(), request.caller()));
  }

  @PostMapping("/swap")
  public ResponseEntity<SwapResult> swap(@Valid @RequestBody SwapOrderRequest request) {
    log.info("api swap isBaseIn={} amountIn={} minAmountOut={} caller={}",
        request.isBaseIn(), request.amountIn(), request.minAmountOut(), request.caller());
    SwapRequest swap = new SwapRequest(
        request.amountIn(),
        request.minAmountOut(),
        request.isBaseIn(),
        request.mode(),
        request.deadline(),
        request.caller()
    );
    return ResponseEntity.ok(tradingService.swap(swap));
  }

  @PostMapping("/rebalance")
  public ResponseEntity<RebalanceRecord> rebalance() {
    return ResponseEntity.ok(tradingService.manualRebalance());
  }

  @PostMapping("/preview/fees")
  public ResponseEntity<PreviewFees> previewFees(@Valid @RequestBody PreviewFeesRequest request) {
    return ResponseEntity.ok(tradingService.previewFees(request.sizesBase()));
  }

  @PostMapping("/preview/fees/fresh")
  public ResponseEntity<PreviewFees> previewFeesFresh(@Valid @RequestBody PreviewFeesRequest request) {
    return ResponseEntity.ok(tradingService.previewFeesFresh(request.sizesBase()));
  }

  @GetMapping("/preview/ladder")
  public ResponseEntity<PreviewLadder> previewLadder(@RequestParam(name="baseSize", required=false) BigDecimal baseSize) {
    return ResponseEntity.ok(tradingService.previewLadder(baseSize));
  }

  @GetMapping("/preview/snapshot")
  public ResponseEntity<PreviewSnapshot> previewSnapshot() {
    return engine.previewSnapshotRaw()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @PostMapping("/preview/snapshot")
  public ResponseEntity<PreviewSnapshot> refreshPreviewSnapshot() {
    return ResponseEntity.ok(tradingService.refreshPreviewSnapshot());
  }

  @GetMapping("/state")
  public ResponseEntity<PoolStateResponse> state() {
    return ResponseEntity.ok(new PoolStateResponse(
        engine.reserves(),
        engine.getSoftDivergenceState(),
        engine.lastAomqState(),
        engine.recenterState(),
        engine.volatilityState().sigmaBps()
    ));
  }
}
