package dev.lexiglow.repository;

import dev.lexiglow.entity.UserVocabulary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface VocabularyRepository extends EntityRepository<UserVocabulary> {

    Flux<UserVocabulary> findByUser(String userId);

    Mono<UserVocabulary> findByUserAndLanguage(String userId, String languageId);
}
