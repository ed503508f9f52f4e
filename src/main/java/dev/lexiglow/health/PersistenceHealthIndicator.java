package dev.lexiglow.health;

import dev.lexiglow.repository.RepositoryFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports whether the active persistence backend answers a ping.
 */
@Component("persistence")
@RequiredArgsConstructor
@Slf4j
public class PersistenceHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final RepositoryFactory repositoryFactory;

    @Override
    public Mono<Health> health() {
        String backend = repositoryFactory.backendType().label();
        return repositoryFactory.ping()
                .timeout(TIMEOUT)
                .then(Mono.fromSupplier(() -> Health.up()
                        .withDetail("backend", backend)
                        .build()))
                .onErrorResume(ex -> buildDownHealth(backend, ex));
    }

    private Mono<Health> buildDownHealth(String backend, Throwable ex) {
        log.error("Persistence health check failed: {}", ex.getMessage());
        return Mono.just(Health.down()
                .withDetail("backend", backend)
                .withDetail("error", ex.getClass().getSimpleName())
                .build());
    }
}
