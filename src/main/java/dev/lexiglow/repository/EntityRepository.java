package dev.lexiglow.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Base contract shared by every entity repository, independent of the storage backend.
 *
 * <p>Absence is never an error: lookups complete empty, {@link #update} completes empty
 * when the id is unknown and {@link #delete} emits {@code false}. Storage failures are
 * signalled as {@link dev.lexiglow.exception.PersistenceException} (or one of its
 * subtypes), never as backend-native exceptions.</p>
 *
 * @param <T> entity type
 */
public interface EntityRepository<T> {

    /**
     * Persists a new entity. An id is generated when none is set, {@code createdAt} is
     * filled when absent and {@code updatedAt} is refreshed.
     *
     * @return the persisted entity
     * @throws dev.lexiglow.exception.ConflictException (as error signal) on a uniqueness
     *         or referential violation
     */
    Mono<T> create(T entity);

    Mono<T> findById(String id);

    /**
     * Page of entities ordered by id (creation order).
     *
     * @param skip  rows to skip, {@code >= 0}
     * @param limit maximum rows, {@code >= 0}; {@code 0} yields nothing
     * @throws IllegalArgumentException if skip or limit is negative
     */
    Flux<T> findAll(long skip, int limit);

    /**
     * Replaces the mutable fields of the stored entity. {@code createdAt} is preserved.
     *
     * @return the stored entity after the update, or empty if no entity has this id
     */
    Mono<T> update(String id, T entity);

    /**
     * @return {@code true} if an entity was removed, {@code false} if none existed
     */
    Mono<Boolean> delete(String id);

    Mono<Boolean> exists(String id);
}
