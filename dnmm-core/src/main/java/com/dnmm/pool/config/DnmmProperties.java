package com.dnmm.pool.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="dnmm")
public record DnmmProperties(
    @Valid Tokens tokens,
    @Valid Oracle oracle,
    @Valid Divergence divergence,
    @Valid Fee fee,
    @Valid Inventory inventory,
    @Valid Maker maker,
    @Valid Preview preview,
    @Valid Aomq aomq,
    @Valid Rebates rebates,
    @Valid Features features
) {

  public DnmmProperties {
    if (tokens == null) {
      tokens = new Tokens(null, null, null, null);
    }
    if (oracle == null) {
      oracle = new Oracle(null, null, null, null, null, null, null, null, null, null, null);
    }
    if (divergence == null) {
      divergence = new Divergence(null, null, null, null, null, null, null);
    }
    if (fee == null) {
      fee = new Fee(null, null, null, null, null, null, null, null, null, null, null);
    }
    if (inventory == null) {
      inventory = new Inventory(null, null, null, null, null, null, null, null, null, null, null, null);
    }
    if (maker == null) {
      maker = new Maker(null, null, null, null);
    }
    if (preview == null) {
      preview = new Preview(null, null, null, null);
    }
    if (aomq == null) {
      aomq = new Aomq(null, null, null, null);
    }
    if (rebates == null) {
      rebates = new Rebates(null, null);
    }
    if (features == null) {
      features = new Features(null, null, null, null, null, null, null, null, null, null);
    }
  }

  public static DnmmProperties defaults() {
    return new DnmmProperties(null, null, null, null, null, null, null, null, null, null);
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public record Tokens(
      String baseSymbol,
      String quoteSymbol,
      @NotNull @Min(0) @Max(36) Integer baseDecimals,
      @NotNull @Min(0) @Max(36) Integer quoteDecimals
  ) {
    public Tokens {
      if (baseSymbol == null || baseSymbol.isBlank()) {
        baseSymbol = "HYPE";
      }
      if (quoteSymbol == null || quoteSymbol.isBlank()) {
        quoteSymbol = "USDC";
      }
      if (baseDecimals == null) {
        baseDecimals = 18;
      }
      if (quoteDecimals == null) {
        quoteDecimals = 6;
      }
    }
  }

  public record Oracle(
      /**
       * Readings older than this are rejected (primary spot and secondary in SPOT mode).
       */
      @NotNull @PositiveOrZero Long maxAgeSec,
      @NotNull @PositiveOrZero Long secondaryMaxAgeSec,
      /**
       * Secondary max age used in STRICT mode.
       */
      @NotNull @PositiveOrZero Long secondaryMaxAgeSecStrict,
      @NotNull @PositiveOrZero Integer confCapBpsSpot,
      @NotNull @PositiveOrZero Integer confCapBpsStrict,
      @NotNull Boolean allowEmaFallback,
      @NotNull Boolean blendOn,
      @NotNull @PositiveOrZero Integer confWeightSpreadBps,
      @NotNull @PositiveOrZero Integer confWeightSigmaBps,
      @NotNull @PositiveOrZero Integer confWeightSecondaryBps,
      /**
       * EWMA decay for the realized volatility estimate (10000 = never moves, 0 = last observation only).
       */
      @NotNull @Min(0) @Max(10_000) Integer sigmaEwmaLambdaBps
  ) {
    public Oracle {
      if (maxAgeSec == null) {
        maxAgeSec = 30L;
      }
      if (secondaryMaxAgeSec == null) {
        secondaryMaxAgeSec = 60L;
      }
      if (secondaryMaxAgeSecStrict == null) {
        secondaryMaxAgeSecStrict = 20L;
      }
      if (confCapBpsSpot == null) {
        confCapBpsSpot = 250;
      }
      if (confCapBpsStrict == null) {
        confCapBpsStrict = 150;
      }
      if (allowEmaFallback == null) {
        allowEmaFallback = true;
      }
      if (blendOn == null) {
        blendOn = true;
      }
      if (confWeightSpreadBps == null) {
        confWeightSpreadBps = 10_000;
      }
      if (confWeightSigmaBps == null) {
        confWeightSigmaBps = 10_000;
      }
      if (confWeightSecondaryBps == null) {
        confWeightSecondaryBps = 10_000;
      }
      if (sigmaEwmaLambdaBps == null) {
        sigmaEwmaLambdaBps = 9_000;
      }
    }
  }

  public record Divergence(
      /**
       * Single hard gate used when soft divergence is disabled.
       */
      @NotNull @PositiveOrZero Integer divergenceBps,
      @NotNull @PositiveOrZero Integer acceptBps,
      @NotNull @PositiveOrZero Integer softBps,
      @NotNull @PositiveOrZero Integer hardBps,
      @NotNull @PositiveOrZero Integer haircutMinBps,
      @NotNull @PositiveOrZero Integer haircutSlopeBps,
      /**
       * Consecutive healthy observations required before the soft state clears.
       */
      @NotNull @Min(1) Integer healthyFramesToClear
  ) {
    public Divergence {
      if (divergenceBps == null) {
        divergenceBps = 80;
      }
      if (acceptBps == null) {
        acceptBps = 30;
      }
      if (softBps == null) {
        softBps = 50;
      }
      if (hardBps == null) {
        hardBps = 75;
      }
      if (haircutMinBps == null) {
        haircutMinBps = 3;
      }
      if (haircutSlopeBps == null) {
        haircutSlopeBps = 1;
      }
      if (healthyFramesToClear == null) {
        healthyFramesToClear = 3;
      }
    }
  }

  public record Fee(
      @NotNull @PositiveOrZero Integer baseBps,
      @NotNull @PositiveOrZero Integer alphaConfNumerator,
      @NotNull @Min(1) Integer alphaConfDenominator,
      @NotNull @PositiveOrZero Integer betaInvDevNumerator,
      @NotNull @Min(1) Integer betaInvDevDenominator,
      @NotNull @PositiveOrZero @Max(10_000) Integer capBps,
      @NotNull @PositiveOrZero Integer gammaSizeLinBps,
      @NotNull @PositiveOrZero Integer gammaSizeQuadBps,
      @NotNull @PositiveOrZero Integer sizeFeeCapBps,
      /**
       * Volatility (LVR) surcharge slope, in bps of {@code sigma * sqrt(ttl)}.
       */
      @NotNull @PositiveOrZero Integer kappaLvrBps,
      @NotNull @PositiveOrZero Integer lvrCapBps
  ) {
    public Fee {
      if (baseBps == null) {
        baseBps = 15;
      }
      if (alphaConfNumerator == null) {
        alphaConfNumerator = 6;
      }
      if (alphaConfDenominator == null) {
        alphaConfDenominator = 10;
      }
      if (betaInvDevNumerator == null) {
        betaInvDevNumerator = 0;
      }
      if (betaInvDevDenominator == null) {
        betaInvDevDenominator = 10;
      }
      if (capBps == null) {
        capBps = 150;
      }
      if (gammaSizeLinBps == null) {
        gammaSizeLinBps = 12;
      }
      if (gammaSizeQuadBps == null) {
        gammaSizeQuadBps = 6;
      }
      if (sizeFeeCapBps == null) {
        sizeFeeCapBps = 30;
      }
      if (kappaLvrBps == null) {
        kappaLvrBps = 0;
      }
      if (lvrCapBps == null) {
        lvrCapBps = 50;
      }
    }
  }

  public record Inventory(
      /**
       * Initial target base inventory. When null the target is seeded from the initial base reserve.
       */
      @PositiveOrZero BigDecimal targetBaseXstar,
      @NotNull @PositiveOrZero BigDecimal initialBaseReserve,
      @NotNull @PositiveOrZero BigDecimal initialQuoteReserve,
      @NotNull @Min(0) @Max(4_999) Integer floorBps,
      @NotNull @PositiveOrZero Integer recenterThresholdBps,
      /**
       * Minimum relative target change for a rebalance to commit (rounding-noise guard).
       */
      @NotNull @PositiveOrZero Integer recenterMinTargetChangeBps,
      @NotNull @PositiveOrZero Long recenterCooldownSec,
      @NotNull @Min(0) Integer recenterHysteresisFrames,
      @NotNull @PositiveOrZero Integer invTiltBpsPer1pct,
      @NotNull @PositiveOrZero Integer invTiltMaxBps,
      @NotNull @PositiveOrZero Integer tiltConfWeightBps,
      @NotNull @PositiveOrZero Integer tiltSpreadWeightBps
  ) {
    public Inventory {
      if (initialBaseReserve == null) {
        initialBaseReserve = BigDecimal.ZERO;
      }
      if (initialQuoteReserve == null) {
        initialQuoteReserve = BigDecimal.ZERO;
      }
      if (floorBps == null) {
        floorBps = 300;
      }
      if (recenterThresholdBps == null) {
        recenterThresholdBps = 750;
      }
      if (recenterMinTargetChangeBps == null) {
        recenterMinTargetChangeBps = 25;
      }
      if (recenterCooldownSec == null) {
        recenterCooldownSec = 120L;
      }
      if (recenterHysteresisFrames == null) {
        recenterHysteresisFrames = 3;
      }
      if (invTiltBpsPer1pct == null) {
        invTiltBpsPer1pct = 8;
      }
      if (invTiltMaxBps == null) {
        invTiltMaxBps = 40;
      }
      if (tiltConfWeightBps == null) {
        tiltConfWeightBps = 2_000;
      }
      if (tiltSpreadWeightBps == null) {
        tiltSpreadWeightBps = 2_000;
      }
    }
  }

  public record Maker(
      /**
       * Reference notional (quote units) that normalizes trade size for the size fee.
       */
      @NotNull @DecimalMin(value="0", inclusive=false) BigDecimal s0Notional,
      @NotNull @PositiveOrZero Long ttlMs,
      @NotNull @PositiveOrZero Integer alphaBboBps,
      @NotNull @PositiveOrZero Integer betaFloorBps
  ) {
    public Maker {
      if (s0Notional == null) {
        s0Notional = BigDecimal.valueOf(5_000);
      }
      if (ttlMs == null) {
        ttlMs = 300L;
      }
      if (alphaBboBps == null) {
        alphaBboBps = 5_000;
      }
      if (betaFloorBps == null) {
        betaFloorBps = 10;
      }
    }
  }

  public record Preview(
      @NotNull @PositiveOrZero Long maxAgeSec,
      @NotNull @PositiveOrZero Long snapshotCooldownSec,
      @NotNull Boolean revertOnStalePreview,
      @NotNull Boolean enablePreviewFresh
  ) {
    public Preview {
      if (maxAgeSec == null) {
        maxAgeSec = 10L;
      }
      if (snapshotCooldownSec == null) {
        snapshotCooldownSec = 1L;
      }
      if (revertOnStalePreview == null) {
        revertOnStalePreview = false;
      }
      if (enablePreviewFresh == null) {
        enablePreviewFresh = false;
      }
    }
  }

  public record Aomq(
      /**
       * Largest notional (quote units) served on a side while degraded mode is active.
       */
      @NotNull @PositiveOrZero BigDecimal minQuoteNotional,
      @NotNull @PositiveOrZero Integer emergencySpreadBps,
      @NotNull @PositiveOrZero Integer floorEpsilonBps,
      /**
       * Added to the volatility term while degraded mode is active.
       */
      @NotNull @PositiveOrZero Integer toxicityBiasBps
  ) {
    public Aomq {
      if (minQuoteNotional == null) {
        minQuoteNotional = BigDecimal.valueOf(100);
      }
      if (emergencySpreadBps == null) {
        emergencySpreadBps = 60;
      }
      if (floorEpsilonBps == null) {
        floorEpsilonBps = 100;
      }
      if (toxicityBiasBps == null) {
        toxicityBiasBps = 0;
      }
    }
  }

  public record Rebates(
      @NotNull @PositiveOrZero Integer bps,
      List<String> allowlist
  ) {
    public Rebates {
      if (bps == null) {
        bps = 3;
      }
      allowlist = sanitizeStringList(allowlist);
    }
  }

  public record Features(
      @NotNull Boolean enableSoftDivergence,
      @NotNull Boolean enableSizeFee,
      @NotNull Boolean enableBboFloor,
      @NotNull Boolean enableInvTilt,
      @NotNull Boolean enableAomq,
      @NotNull Boolean enableRebates,
      @NotNull Boolean enableAutoRecenter,
      @NotNull Boolean enableLvrFee,
      @NotNull Boolean enableInvDevFee,
      @NotNull Boolean debugEmit
  ) {
    public Features {
      if (enableSoftDivergence == null) {
        enableSoftDivergence = true;
      }
      if (enableSizeFee == null) {
        enableSizeFee = true;
      }
      if (enableBboFloor == null) {
        enableBboFloor = true;
      }
      if (enableInvTilt == null) {
        enableInvTilt = true;
      }
      if (enableAomq == null) {
        enableAomq = true;
      }
      if (enableRebates == null) {
        enableRebates = false;
      }
      if (enableAutoRecenter == null) {
        enableAutoRecenter = true;
      }
      if (enableLvrFee == null) {
        enableLvrFee = false;
      }
      if (enableInvDevFee == null) {
        enableInvDevFee = false;
      }
      if (debugEmit == null) {
        debugEmit = false;
      }
    }
  }
}
