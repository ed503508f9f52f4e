package dev.lexiglow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RepositoryMetricsTest {

    private SimpleMeterRegistry registry;
    private RepositoryMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RepositoryMetrics(registry);
    }

    @Test
    @DisplayName("Should time operations per backend, entity, operation and outcome")
    void shouldTimeOperations() {
        metrics.recordOperation("relational", "Language", "findById", true, TimeUnit.MILLISECONDS.toNanos(4));
        metrics.recordOperation("relational", "Language", "findById", true, TimeUnit.MILLISECONDS.toNanos(6));
        metrics.recordOperation("relational", "Language", "findById", false, TimeUnit.MILLISECONDS.toNanos(1));

        Timer success = registry.get(RepositoryMetrics.TIMER_NAME)
                .tags("backend", "relational", "entity", "Language", "operation", "findById", "outcome", "success")
                .timer();
        assertThat(success.count()).isEqualTo(2);
        assertThat(success.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(10.0);

        Timer failure = registry.get(RepositoryMetrics.TIMER_NAME).tag("outcome", "error").timer();
        assertThat(failure.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count errors by translated type")
    void shouldCountErrors() {
        metrics.recordError("document", "User", "ConflictException");
        metrics.recordError("document", "User", "ConflictException");
        metrics.recordError("document", "Text", "RepositoryTimeoutException");

        Counter conflicts = registry.get(RepositoryMetrics.ERROR_COUNTER_NAME)
                .tags("backend", "document", "entity", "User", "type", "ConflictException")
                .counter();
        assertThat(conflicts.count()).isEqualTo(2.0);
        assertThat(registry.get(RepositoryMetrics.ERROR_COUNTER_NAME).counters()).hasSize(2);
    }
}
