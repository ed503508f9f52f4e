package dev.lexiglow.repository;

import dev.lexiglow.entity.Language;
import reactor.core.publisher.Mono;

public interface LanguageRepository extends EntityRepository<Language> {

    Mono<Language> findByCode(String code);

    /** Exact match on the English name. */
    Mono<Language> findByName(String name);

    Mono<Boolean> existsByCode(String code);
}
