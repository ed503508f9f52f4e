package dev.lexiglow.repository;

import dev.lexiglow.entity.UserLanguage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Languages a user is learning. Rows are keyed by (userId, languageId) instead of a
 * generated id, so this contract does not extend {@link EntityRepository}.
 */
public interface UserLanguageRepository {

    /**
     * Inserts the pair, or replaces proficiency and start date when it already exists.
     * {@code createdAt} of an existing row is kept.
     */
    Mono<UserLanguage> save(UserLanguage userLanguage);

    Mono<UserLanguage> find(String userId, String languageId);

    /** Ordered by language id. */
    Flux<UserLanguage> findByUser(String userId);

    Mono<Boolean> delete(String userId, String languageId);
}
