package com.dnmm.pool.service.metrics;

import com.dnmm.pool.engine.PoolEngine;
import com.dnmm.pool.engine.QuoteReason;
import com.dnmm.pool.engine.SwapResult;
import com.dnmm.pool.error.PoolErrorCode;
import com.dnmm.pool.metrics.DnmmMetrics;
import com.dnmm.pool.preview.RegimeFlag;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics service for pool-service.
 * Tracks swaps, partial fills, rejects, recenter commits and degraded-mode activity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolMetricsService {

    private final DnmmMetrics metrics;
    private final PoolEngine engine;

    // Counters
    private Counter swapsCounter;
    private Counter partialFillsCounter;
    private Counter recenterCommitsCounter;
    private Counter aomqSwapsCounter;

    // Gauge backing values
    private final AtomicLong lastFeeBps = new AtomicLong();
    private final AtomicLong lastDivergenceBps = new AtomicLong();

    @PostConstruct
    public void initializeMetrics() {
        log.info("Initializing pool metrics...");

        swapsCounter = metrics.createCounter(
                "dnmm_swaps_total",
                "Total number of settled swaps"
        );

        partialFillsCounter = metrics.createCounter(
                "dnmm_swaps_partial_total",
                "Settled swaps that returned part of the input"
        );

        recenterCommitsCounter = metrics.createCounter(
                "dnmm_recenter_commits_total",
                "Inventory target updates (automatic and manual)"
        );

        aomqSwapsCounter = metrics.createCounter(
                "dnmm_aomq_swaps_total",
                "Settled swaps priced while degraded quote mode was active"
        );

        metrics.registerLongGauge(
                "dnmm_last_fee_bps",
                "Fee applied to the last settled swap",
                lastFeeBps::get
        );

        metrics.registerLongGauge(
                "dnmm_last_divergence_bps",
                "Primary/secondary divergence seen by the last settled swap",
                lastDivergenceBps::get
        );

        metrics.registerBooleanGauge(
                "dnmm_soft_divergence_active",
                "Soft divergence state (1 = active)",
                () -> engine.getSoftDivergenceState().active()
        );

        log.info("Pool metrics initialized successfully");
    }

    public void recordSwap(SwapResult result) {
        swapsCounter.increment();
        if (result.execution().isPartial()) {
            partialFillsCounter.increment();
        }
        if ((result.execution().regimeFlags() & RegimeFlag.AOMQ.bit()) != 0 || result.execution().reason() == QuoteReason.AOMQ_CLAMP) {
            aomqSwapsCounter.increment();
        }
        if (result.targetUpdated()) {
            recenterCommitsCounter.increment();
        }
        lastFeeBps.set(result.execution().feeBpsUsed());
        lastDivergenceBps.set(engine.getSoftDivergenceState().lastDeltaBps());
    }

    public void recordRecenter() {
        recenterCommitsCounter.increment();
    }

    /**
     * Record a rejected operation, tagged by error code.
     */
    public void recordReject(String operation, PoolErrorCode code) {
        metrics.incrementCounter(
                "dnmm_rejects_total",
                Tag.of("operation", operation),
                Tag.of("code", code.name())
        );
    }
}
