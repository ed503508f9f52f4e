package dev.lexiglow.service;

import dev.lexiglow.dto.VocabularyItemRequest;
import dev.lexiglow.dto.VocabularyItemResponse;
import dev.lexiglow.dto.VocabularyItemUpdateRequest;
import dev.lexiglow.dto.VocabularyRequest;
import dev.lexiglow.dto.VocabularyResponse;
import dev.lexiglow.dto.VocabularyUpdateRequest;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.UserVocabulary;
import dev.lexiglow.entity.UserVocabularyItem;
import dev.lexiglow.entity.VocabularyItemStatus;
import dev.lexiglow.exception.DuplicateResourceException;
import dev.lexiglow.exception.ResourceNotFoundException;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.UserRepository;
import dev.lexiglow.repository.VocabularyItemRepository;
import dev.lexiglow.repository.VocabularyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Vocabularies (one per user and language) and the items collected in them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VocabularyService {

    private final VocabularyRepository vocabularyRepository;
    private final VocabularyItemRepository itemRepository;
    private final UserRepository userRepository;
    private final LanguageRepository languageRepository;
    private final IdService idService;

    public Flux<VocabularyResponse> getAllVocabularies(long skip, int limit) {
        return vocabularyRepository.findAll(skip, limit).map(VocabularyService::toResponse);
    }

    public Flux<VocabularyResponse> getVocabulariesByUser(String userId) {
        return vocabularyRepository.findByUser(userId).map(VocabularyService::toResponse);
    }

    public Mono<VocabularyResponse> getVocabularyById(String id) {
        return findVocabulary(id).map(VocabularyService::toResponse);
    }

    public Mono<VocabularyResponse> createVocabulary(VocabularyRequest request) {
        return requireExists(userRepository.exists(request.getUserId()), "User", request.getUserId())
                .then(Mono.defer(() -> requireExists(languageRepository.exists(request.getLanguageId()),
                        "Language", request.getLanguageId())))
                .then(Mono.defer(() -> vocabularyRepository
                        .findByUserAndLanguage(request.getUserId(), request.getLanguageId())
                        .hasElement()))
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("Vocabulary", "userId/languageId",
                                request.getUserId() + "/" + request.getLanguageId()));
                    }
                    UserVocabulary vocabulary = UserVocabulary.builder()
                            .id(idService.nextId())
                            .userId(request.getUserId())
                            .languageId(request.getLanguageId())
                            .name(request.getName())
                            .build();
                    return vocabularyRepository.create(vocabulary);
                })
                .doOnSuccess(v -> log.info("Vocabulary created: {} for user {}", v.getId(), v.getUserId()))
                .map(VocabularyService::toResponse);
    }

    public Mono<VocabularyResponse> updateVocabulary(String id, VocabularyUpdateRequest request) {
        return findVocabulary(id)
                .flatMap(existing -> request.getName() == null
                        ? Mono.just(existing)
                        : vocabularyRepository.update(id, existing.toBuilder().name(request.getName()).build()))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Vocabulary", "id", id)))
                .doOnSuccess(v -> log.info("Vocabulary updated: {}", id))
                .map(VocabularyService::toResponse);
    }

    /**
     * Removes the vocabulary together with its items.
     */
    public Mono<Void> deleteVocabulary(String id) {
        return vocabularyRepository.delete(id)
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.error(new ResourceNotFoundException("Vocabulary", "id", id));
                    }
                    log.info("Vocabulary deleted: {}", id);
                    return Mono.empty();
                });
    }

    public Flux<VocabularyItemResponse> getItems(String vocabularyId, long skip, int limit) {
        return findVocabulary(vocabularyId)
                .flatMapMany(vocabulary -> itemRepository.findByVocabulary(vocabularyId, skip, limit))
                .map(VocabularyService::toResponse);
    }

    public Mono<VocabularyItemResponse> getItem(String vocabularyId, String itemId) {
        return findItem(vocabularyId, itemId).map(VocabularyService::toResponse);
    }

    public Mono<VocabularyItemResponse> addItem(String vocabularyId, VocabularyItemRequest request) {
        return findVocabulary(vocabularyId)
                .then(Mono.defer(() -> itemRepository.existsByVocabularyAndTerm(vocabularyId, request.getTerm())))
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("VocabularyItem", "term", request.getTerm()));
                    }
                    UserVocabularyItem item = UserVocabularyItem.builder()
                            .id(idService.nextId())
                            .userVocabularyId(vocabularyId)
                            .term(request.getTerm())
                            .lemma(request.getLemma())
                            .stem(request.getStem())
                            .partOfSpeech(request.getPartOfSpeech())
                            .frequency(request.getFrequency())
                            .status(request.getStatus() != null ? request.getStatus() : VocabularyItemStatus.NEW)
                            .confidenceLevel(request.getConfidenceLevel() != null
                                    ? request.getConfidenceLevel() : ProficiencyLevel.A1)
                            .notes(request.getNotes())
                            .build();
                    return itemRepository.create(item);
                })
                .doOnSuccess(i -> log.info("Vocabulary item created: {} in {}", i.getId(), vocabularyId))
                .map(VocabularyService::toResponse);
    }

    public Mono<VocabularyItemResponse> updateItem(String vocabularyId, String itemId,
                                                   VocabularyItemUpdateRequest request) {
        return findItem(vocabularyId, itemId)
                .flatMap(existing -> {
                    Mono<Void> termCheck = request.getTerm() == null || request.getTerm().equals(existing.getTerm())
                            ? Mono.empty()
                            : itemRepository.existsByVocabularyAndTerm(vocabularyId, request.getTerm())
                                    .flatMap(exists -> exists
                                            ? Mono.error(new DuplicateResourceException(
                                                    "VocabularyItem", "term", request.getTerm()))
                                            : Mono.empty());
                    UserVocabularyItem.UserVocabularyItemBuilder merged = existing.toBuilder();
                    if (request.getTerm() != null) merged.term(request.getTerm());
                    if (request.getLemma() != null) merged.lemma(request.getLemma());
                    if (request.getStem() != null) merged.stem(request.getStem());
                    if (request.getPartOfSpeech() != null) merged.partOfSpeech(request.getPartOfSpeech());
                    if (request.getFrequency() != null) merged.frequency(request.getFrequency());
                    if (request.getStatus() != null) merged.status(request.getStatus());
                    if (request.getConfidenceLevel() != null) merged.confidenceLevel(request.getConfidenceLevel());
                    if (request.getNotes() != null) merged.notes(request.getNotes());
                    return termCheck.then(Mono.defer(() -> itemRepository.update(itemId, merged.build())));
                })
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("VocabularyItem", "id", itemId)))
                .doOnSuccess(i -> log.info("Vocabulary item updated: {}", itemId))
                .map(VocabularyService::toResponse);
    }

    public Mono<Void> deleteItem(String vocabularyId, String itemId) {
        return findItem(vocabularyId, itemId)
                .flatMap(item -> itemRepository.delete(itemId))
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.error(new ResourceNotFoundException("VocabularyItem", "id", itemId));
                    }
                    log.info("Vocabulary item deleted: {}", itemId);
                    return Mono.empty();
                });
    }

    /**
     * Counts one more review of the item.
     */
    public Mono<VocabularyItemResponse> reviewItem(String vocabularyId, String itemId) {
        return findItem(vocabularyId, itemId)
                .flatMap(item -> itemRepository.incrementReviewCount(itemId))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("VocabularyItem", "id", itemId)))
                .doOnSuccess(i -> log.debug("Vocabulary item {} reviewed {} times", itemId, i.getTimesReviewed()))
                .map(VocabularyService::toResponse);
    }

    private Mono<UserVocabulary> findVocabulary(String id) {
        return vocabularyRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Vocabulary", "id", id)));
    }

    // items are addressed through their vocabulary; an item of another vocabulary is not found
    private Mono<UserVocabularyItem> findItem(String vocabularyId, String itemId) {
        return itemRepository.findById(itemId)
                .filter(item -> vocabularyId.equals(item.getUserVocabularyId()))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("VocabularyItem", "id", itemId)));
    }

    private static Mono<Void> requireExists(Mono<Boolean> exists, String resource, String id) {
        return exists.flatMap(found -> found
                ? Mono.<Void>empty()
                : Mono.error(new ResourceNotFoundException(resource, "id", id)));
    }

    static VocabularyResponse toResponse(UserVocabulary vocabulary) {
        return VocabularyResponse.builder()
                .id(vocabulary.getId())
                .userId(vocabulary.getUserId())
                .languageId(vocabulary.getLanguageId())
                .name(vocabulary.getName())
                .createdAt(vocabulary.getCreatedAt())
                .updatedAt(vocabulary.getUpdatedAt())
                .build();
    }

    static VocabularyItemResponse toResponse(UserVocabularyItem item) {
        return VocabularyItemResponse.builder()
                .id(item.getId())
                .userVocabularyId(item.getUserVocabularyId())
                .term(item.getTerm())
                .lemma(item.getLemma())
                .stem(item.getStem())
                .partOfSpeech(item.getPartOfSpeech())
                .frequency(item.getFrequency())
                .status(item.getStatus())
                .timesReviewed(item.getTimesReviewed())
                .confidenceLevel(item.getConfidenceLevel())
                .notes(item.getNotes())
                .createdAt(item.getCreatedAt())
                .updatedAt(item.getUpdatedAt())
                .build();
    }
}
