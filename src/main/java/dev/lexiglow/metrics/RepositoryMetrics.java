package dev.lexiglow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for repository calls, tagged by backend, entity and operation.
 */
public class RepositoryMetrics {

    static final String TIMER_NAME = "lexiglow.repository.operations";
    static final String ERROR_COUNTER_NAME = "lexiglow.repository.errors";

    private final MeterRegistry meterRegistry;

    public RepositoryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordOperation(String backend, String entity, String operation, boolean success, long elapsedNanos) {
        Timer.builder(TIMER_NAME)
                .description("Repository call latency")
                .tag("backend", backend)
                .tag("entity", entity)
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "error")
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordError(String backend, String entity, String errorType) {
        Counter.builder(ERROR_COUNTER_NAME)
                .description("Repository failures by translated error type")
                .tag("backend", backend)
                .tag("entity", entity)
                .tag("type", errorType)
                .register(meterRegistry)
                .increment();
    }
}
