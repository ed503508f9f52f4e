package dev.lexiglow.controller;

import dev.lexiglow.dto.VocabularyItemRequest;
import dev.lexiglow.dto.VocabularyItemResponse;
import dev.lexiglow.dto.VocabularyItemUpdateRequest;
import dev.lexiglow.dto.VocabularyRequest;
import dev.lexiglow.dto.VocabularyResponse;
import dev.lexiglow.dto.VocabularyUpdateRequest;
import dev.lexiglow.service.VocabularyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/vocabularies")
@RequiredArgsConstructor
@Validated
@Tag(name = "Vocabularies", description = "Personal vocabularies and their items")
@Slf4j
public class VocabularyController {

    private final VocabularyService vocabularyService;

    @GetMapping
    @Operation(summary = "List vocabularies", description = "With userId, only that user's vocabularies (unpaged)")
    public Mono<List<VocabularyResponse>> getVocabularies(
            @Parameter(description = "Owner filter") @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        if (userId != null) {
            log.debug("Fetching vocabularies of user={}", userId);
            return vocabularyService.getVocabulariesByUser(userId).collectList();
        }
        return vocabularyService.getAllVocabularies(skip, limit).collectList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get vocabulary by id")
    public Mono<VocabularyResponse> getVocabularyById(@PathVariable String id) {
        return vocabularyService.getVocabularyById(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create vocabulary", description = "One vocabulary per user and language")
    public Mono<VocabularyResponse> createVocabulary(@Valid @RequestBody VocabularyRequest request) {
        log.info("Creating vocabulary for user={} language={}", request.getUserId(), request.getLanguageId());
        return vocabularyService.createVocabulary(request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Rename vocabulary")
    public Mono<VocabularyResponse> updateVocabulary(@PathVariable String id,
                                                     @Valid @RequestBody VocabularyUpdateRequest request) {
        log.info("Updating vocabulary: id={}", id);
        return vocabularyService.updateVocabulary(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete vocabulary with all its items")
    public Mono<Void> deleteVocabulary(@PathVariable String id) {
        log.info("Deleting vocabulary: id={}", id);
        return vocabularyService.deleteVocabulary(id);
    }

    @GetMapping("/{id}/items")
    @Operation(summary = "List items of a vocabulary")
    public Mono<List<VocabularyItemResponse>> getItems(
            @PathVariable String id,
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return vocabularyService.getItems(id, skip, limit).collectList();
    }

    @GetMapping("/{id}/items/{itemId}")
    @Operation(summary = "Get vocabulary item")
    public Mono<VocabularyItemResponse> getItem(@PathVariable String id, @PathVariable String itemId) {
        return vocabularyService.getItem(id, itemId);
    }

    @PostMapping("/{id}/items")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Add item", description = "Terms are unique within a vocabulary")
    public Mono<VocabularyItemResponse> addItem(@PathVariable String id,
                                                @Valid @RequestBody VocabularyItemRequest request) {
        log.info("Adding item to vocabulary {}: term={}", id, request.getTerm());
        return vocabularyService.addItem(id, request);
    }

    @PutMapping("/{id}/items/{itemId}")
    @Operation(summary = "Update item")
    public Mono<VocabularyItemResponse> updateItem(@PathVariable String id, @PathVariable String itemId,
                                                   @Valid @RequestBody VocabularyItemUpdateRequest request) {
        log.info("Updating vocabulary item: id={}", itemId);
        return vocabularyService.updateItem(id, itemId, request);
    }

    @DeleteMapping("/{id}/items/{itemId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete item")
    public Mono<Void> deleteItem(@PathVariable String id, @PathVariable String itemId) {
        log.info("Deleting vocabulary item: id={}", itemId);
        return vocabularyService.deleteItem(id, itemId);
    }

    @PostMapping("/{id}/items/{itemId}/reviews")
    @Operation(summary = "Record a review", description = "Increments the review counter of the item")
    public Mono<VocabularyItemResponse> reviewItem(@PathVariable String id, @PathVariable String itemId) {
        log.debug("Recording review of item={}", itemId);
        return vocabularyService.reviewItem(id, itemId);
    }
}
