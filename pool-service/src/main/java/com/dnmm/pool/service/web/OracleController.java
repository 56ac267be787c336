package com.dnmm.pool.service.web;

import com.dnmm.pool.service.api.OraclePriceUpdate;
import com.dnmm.pool.service.oracle.PaperOracleFeed;
import jakarta.validation.Valid;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Drives the paper oracle feed.
 */
@RestController
@RequestMapping("/api/oracle")
@Validated
@RequiredArgsConstructor
public class OracleController {

  private final @NonNull PaperOracleFeed feed;

  @GetMapping
  public ResponseEntity<PaperOracleFeed.FeedView> view() {
    return ResponseEntity.ok(feed.view());
  }

  @PutMapping("/primary")
  public ResponseEntity<PaperOracleFeed.FeedView> publishPrimary(@Valid @RequestBody OraclePriceUpdate update) {
    feed.publishPrimary(update.mid(), orZero(update.bps()), orZero(update.ageSec()));
    return ResponseEntity.ok(feed.view());
  }

  @DeleteMapping("/primary")
  public ResponseEntity<PaperOracleFeed.FeedView> withdrawPrimary() {
    feed.withdrawPrimary();
    return ResponseEntity.ok(feed.view());
  }

  @PutMapping("/ema")
  public ResponseEntity<PaperOracleFeed.FeedView> publishEma(@Valid @RequestBody OraclePriceUpdate update) {
    feed.publishEma(update.mid());
    return ResponseEntity.ok(feed.view());
  }

  @PutMapping("/secondary")
  public ResponseEntity<PaperOracleFeed.FeedView> publishSecondary(@Valid @RequestBody OraclePriceUpdate update) {
    feed.publishSecondary(update.mid(), orZero(update.bps()), orZero(update.ageSec()));
    return ResponseEntity.ok(feed.view());
  }

  @DeleteMapping("/secondary")
  public ResponseEntity<PaperOracleFeed.FeedView> withdrawSecondary() {
    feed.withdrawSecondary();
    return ResponseEntity.ok(feed.view());
  }

  private static int orZero(Integer v) {
    return v == null ? 0 : v;
  }

  private static long orZero(Long v) {
    return v == null ? 0L : v;
  }
}
