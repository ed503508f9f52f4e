package dev.lexiglow.repository;

import dev.lexiglow.entity.UserVocabularyItem;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface VocabularyItemRepository extends EntityRepository<UserVocabularyItem> {

    Flux<UserVocabularyItem> findByVocabulary(String vocabularyId, long skip, int limit);

    Mono<UserVocabularyItem> findByVocabularyAndTerm(String vocabularyId, String term);

    Mono<Boolean> existsByVocabularyAndTerm(String vocabularyId, String term);

    /**
     * Adds one to {@code timesReviewed}.
     *
     * @return the updated item, or empty if it does not exist
     */
    Mono<UserVocabularyItem> incrementReviewCount(String id);
}
