package dev.lexiglow.repository.support;

import dev.lexiglow.exception.ConflictException;
import dev.lexiglow.exception.RepositoryTimeoutException;
import dev.lexiglow.metrics.RepositoryMetrics;
import dev.lexiglow.repository.BackendType;
import dev.lexiglow.util.UlidGenerator;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReactiveRepositorySupport")
class ReactiveRepositorySupportTest {

    private SimpleMeterRegistry meterRegistry;
    private SampleRepository repository;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        RepositoryContext context = new RepositoryContext(
                BackendType.RELATIONAL,
                new UlidGenerator(),
                Clock.fixed(Instant.parse("2024-03-01T08:00:00.123456Z"), ZoneOffset.UTC),
                Duration.ofMillis(100),
                new RepositoryMetrics(meterRegistry));
        repository = new SampleRepository(context);
    }

    @Test
    @DisplayName("Should pass values through and record a successful timer")
    void shouldRecordSuccess() {
        StepVerifier.create(repository.run(Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();

        Timer timer = meterRegistry.find("lexiglow.repository.operations")
                .tag("outcome", "success").tag("entity", "Sample").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should turn a slow call into a repository timeout")
    void shouldTimeOut() {
        StepVerifier.create(repository.run(Mono.never()))
                .expectError(RepositoryTimeoutException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(meterRegistry.find("lexiglow.repository.errors")
                .tag("type", "RepositoryTimeoutException").counter())
                .isNotNull();
    }

    @Test
    @DisplayName("Should translate backend errors on streams")
    void shouldTranslateManyErrors() {
        StepVerifier.create(repository.runMany(Flux.error(new DuplicateKeyException("dup"))))
                .expectError(ConflictException.class)
                .verify();
    }

    @Test
    @DisplayName("Should truncate timestamps to milliseconds")
    void shouldTruncateNow() {
        assertThat(repository.currentTime()).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 0, 0, 123_000_000));
    }

    @Test
    @DisplayName("Should reject negative paging arguments")
    void shouldRejectNegativePage() {
        assertThatThrownBy(() -> ReactiveRepositorySupport.checkPage(-1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReactiveRepositorySupport.checkPage(0, -1))
                .isInstanceOf(IllegalArgumentException.class);
        ReactiveRepositorySupport.checkPage(0, 0);
    }

    private static final class SampleRepository extends ReactiveRepositorySupport {

        SampleRepository(RepositoryContext context) {
            super(context, "Sample");
        }

        <R> Mono<R> run(Mono<R> source) {
            return execute("run", "1", source);
        }

        <R> Flux<R> runMany(Flux<R> source) {
            return executeMany("runMany", null, source);
        }

        LocalDateTime currentTime() {
            return now();
        }
    }
}
