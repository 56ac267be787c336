package com.dnmm.pool.error;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class PoolEngineException extends RuntimeException {

  private final PoolErrorCode code;
  private final Map<String, Object> details;

  public PoolEngineException(PoolErrorCode code, String message) {
    this(code, message, Map.of());
  }

  public PoolEngineException(PoolErrorCode code, String message, Map<String, Object> details) {
    super(code + ": " + message);
    this.code = Objects.requireNonNull(code, "code");
    this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static PoolEngineException midUnset(String message) {
    return new PoolEngineException(PoolErrorCode.MID_UNSET, message);
  }

  public static PoolEngineException oracleStale(String source, long ageSec, long maxAgeSec) {
    return new PoolEngineException(
        PoolErrorCode.ORACLE_STALE,
        source + " reading is " + ageSec + "s old (max " + maxAgeSec + "s)",
        ordered("source", source, "ageSec", ageSec, "maxAgeSec", maxAgeSec)
    );
  }

  public static PoolEngineException divergenceHard(long deltaBps, long hardBps) {
    return new PoolEngineException(
        PoolErrorCode.DIVERGENCE_HARD,
        "primary/secondary divergence " + deltaBps + "bps exceeds hard band " + hardBps + "bps",
        ordered("deltaBps", deltaBps, "hardBps", hardBps)
    );
  }

  public static PoolEngineException previewSnapshotStale(long ageSec, long maxAgeSec) {
    return new PoolEngineException(
        PoolErrorCode.PREVIEW_SNAPSHOT_STALE,
        "preview snapshot is " + ageSec + "s old (max " + maxAgeSec + "s)",
        ordered("ageSec", ageSec, "maxAgeSec", maxAgeSec)
    );
  }

  public static PoolEngineException floorBreach(String side, BigDecimal reserve, BigDecimal floor) {
    return new PoolEngineException(
        PoolErrorCode.FLOOR_BREACH,
        side + " reserve " + reserve.toPlainString() + " has no headroom above floor " + floor.toPlainString(),
        ordered("side", side, "reserve", reserve, "floor", floor)
    );
  }

  public static PoolEngineException recenterCooldown(long elapsedSec, long cooldownSec) {
    return new PoolEngineException(
        PoolErrorCode.RECENTER_COOLDOWN,
        "last rebalance was " + elapsedSec + "s ago (cooldown " + cooldownSec + "s)",
        ordered("elapsedSec", elapsedSec, "cooldownSec", cooldownSec)
    );
  }

  public static PoolEngineException recenterThreshold(long changeBps, long thresholdBps) {
    return new PoolEngineException(
        PoolErrorCode.RECENTER_THRESHOLD,
        "target change " + changeBps + "bps below threshold " + thresholdBps + "bps",
        ordered("changeBps", changeBps, "thresholdBps", thresholdBps)
    );
  }

  public static PoolEngineException previewSnapshotCooldown(long elapsedSec, long cooldownSec) {
    return new PoolEngineException(
        PoolErrorCode.PREVIEW_SNAPSHOT_COOLDOWN,
        "snapshot refreshed " + elapsedSec + "s ago (cooldown " + cooldownSec + "s)",
        ordered("elapsedSec", elapsedSec, "cooldownSec", cooldownSec)
    );
  }

  public static PoolEngineException slippage(BigDecimal amountOut, BigDecimal minAmountOut) {
    return new PoolEngineException(
        PoolErrorCode.SLIPPAGE,
        "amountOut " + amountOut.toPlainString() + " below minAmountOut " + minAmountOut.toPlainString(),
        ordered("amountOut", amountOut, "minAmountOut", minAmountOut)
    );
  }

  public static PoolEngineException deadlineExpired(long deadline, long now) {
    return new PoolEngineException(
        PoolErrorCode.DEADLINE_EXPIRED,
        "deadline " + deadline + " passed (now " + now + ")",
        ordered("deadline", deadline, "now", now)
    );
  }

  public static PoolEngineException invalidAmount(String reason) {
    return new PoolEngineException(PoolErrorCode.INVALID_AMOUNT, reason);
  }

  public static PoolEngineException outputRoundsToZero(BigDecimal amountIn, int outDecimals) {
    return new PoolEngineException(
        PoolErrorCode.INVALID_AMOUNT,
        "amountIn " + amountIn.toPlainString() + " buys nothing at " + outDecimals + " output decimals",
        ordered("amountIn", amountIn, "outDecimals", outDecimals)
    );
  }

  public static PoolEngineException invalidConfig(String field, String reason) {
    return new PoolEngineException(PoolErrorCode.INVALID_CONFIG, field + " " + reason, ordered("field", field));
  }

  public PoolErrorCode code() {
    return code;
  }

  public Map<String, Object> details() {
    return details;
  }

  private static Map<String, Object> ordered(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) {
      m.put(String.valueOf(kv[i]), kv[i + 1]);
    }
    return m;
  }
}
