package io.serverhive.gameserver.app;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;

/**
 * Counters for lifecycle outcomes and drift repairs.
 */
public class LifecycleMetrics {

    private final MeterRegistry meterRegistry;

    public LifecycleMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public void success(String operation) {
        meterRegistry.counter("serverhive_gameserver_operations_total",
            "operation", operation,
            "outcome", "success"
        ).increment();
    }

    public void failure(String operation) {
        meterRegistry.counter("serverhive_gameserver_operations_total",
            "operation", operation,
            "outcome", "failure"
        ).increment();
    }

    public void crashed() {
        meterRegistry.counter("serverhive_gameserver_crashes_total").increment();
    }

    public void recovered(String reason) {
        meterRegistry.counter("serverhive_gameserver_recoveries_total", "reason", reason).increment();
    }

    public void forwarded(String operation) {
        meterRegistry.counter("serverhive_gameserver_forwarded_total", "operation", operation).increment();
    }
}
