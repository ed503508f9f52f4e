package dev.lexiglow.repository.support;

import dev.lexiglow.exception.ConflictException;
import dev.lexiglow.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Base class for backend repositories. Wraps every storage publisher with the query
 * timeout, error translation, failure logging and latency metrics.
 */
@Slf4j
public abstract class ReactiveRepositorySupport {

    protected final RepositoryContext context;
    private final String entityType;

    protected ReactiveRepositorySupport(RepositoryContext context, String entityType) {
        this.context = context;
        this.entityType = entityType;
    }

    protected <R> Mono<R> execute(String operation, String entityId, Mono<R> source) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return source
                    .timeout(context.queryTimeout())
                    .onErrorMap(error -> translate(error, operation, entityId))
                    .doOnSuccess(result -> record(operation, true, start))
                    .doOnError(error -> record(operation, false, start));
        });
    }

    protected <R> Flux<R> executeMany(String operation, String entityId, Flux<R> source) {
        return Flux.defer(() -> {
            long start = System.nanoTime();
            return source
                    .timeout(context.queryTimeout())
                    .onErrorMap(error -> translate(error, operation, entityId))
                    .doOnComplete(() -> record(operation, true, start))
                    .doOnError(error -> record(operation, false, start));
        });
    }

    /**
     * Current time at the millisecond precision both backends store.
     */
    protected LocalDateTime now() {
        return LocalDateTime.now(context.clock()).truncatedTo(ChronoUnit.MILLIS);
    }

    protected String newId() {
        return context.idGenerator().nextId();
    }

    protected String entityType() {
        return entityType;
    }

    protected static void checkPage(long skip, int limit) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative: " + skip);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }

    private PersistenceException translate(Throwable error, String operation, String entityId) {
        PersistenceException translated = RepositoryErrorTranslator.translate(error, operation, entityType, entityId);
        if (translated != error) {
            if (translated instanceof ConflictException) {
                log.warn("{} {} [{}] rejected: {}", operation, entityType, entityId, error.getMessage());
            } else {
                log.error("{} {} [{}] failed on {} backend", operation, entityType, entityId,
                        context.backend().label(), error);
            }
            context.metrics().recordError(context.backend().label(), entityType, translated.getClass().getSimpleName());
        }
        return translated;
    }

    private void record(String operation, boolean success, long start) {
        context.metrics().recordOperation(context.backend().label(), entityType, operation, success,
                System.nanoTime() - start);
    }
}
