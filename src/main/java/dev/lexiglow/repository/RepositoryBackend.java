package dev.lexiglow.repository;

import reactor.core.publisher.Mono;

/**
 * One storage technology: owns the connection resources and knows how to build the
 * repository implementations bound to them.
 */
public interface RepositoryBackend {

    BackendType type();

    /**
     * Builds a new repository instance. Callers are expected to cache the result.
     *
     * @throws dev.lexiglow.exception.OperationNotSupportedException if this backend has no
     *         implementation for {@code repositoryType}
     */
    <R> R createRepository(Class<R> repositoryType);

    /**
     * Round trip to the store; completes empty when reachable.
     */
    Mono<Void> ping();

    /**
     * Releases pools and clients. Called once.
     */
    void close();
}
