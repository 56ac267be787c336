package com.dnmm.pool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Thin Micrometer helper shared by pool services.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DnmmMetrics {

    private final MeterRegistry registry;

    /**
     * Register a gauge that tracks a long value supplier.
     */
    public void registerLongGauge(String name, String description, Supplier<Long> valueSupplier, Tag... tags) {
        Gauge.builder(name, valueSupplier, supplier -> {
            Long value = supplier.get();
            return value != null ? value.doubleValue() : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Registered gauge: {} with description: {}", name, description);
    }

    /**
     * Register a gauge that tracks a boolean value (1 = true, 0 = false).
     */
    public void registerBooleanGauge(String name, String description, Supplier<Boolean> valueSupplier, Tag... tags) {
        Gauge.builder(name, valueSupplier, supplier -> {
            Boolean value = supplier.get();
            return Boolean.TRUE.equals(value) ? 1.0 : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Registered boolean gauge: {} with description: {}", name, description);
    }

    public Counter createCounter(String name, String description, Tag... tags) {
        Counter counter = Counter.builder(name)
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Created counter: {} with description: {}", name, description);
        return counter;
    }

    /**
     * Increment a counter by name (creates if doesn't exist).
     */
    public void incrementCounter(String name, Tag... tags) {
        Counter.builder(name)
                .tags(List.of(tags))
                .register(registry)
                .increment();
    }
}
