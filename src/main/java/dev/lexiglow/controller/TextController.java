package dev.lexiglow.controller;

import dev.lexiglow.dto.TagResponse;
import dev.lexiglow.dto.TextRequest;
import dev.lexiglow.dto.TextResponse;
import dev.lexiglow.dto.TextUpdateRequest;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.service.TextService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/texts")
@RequiredArgsConstructor
@Validated
@Tag(name = "Texts", description = "Reading texts and their tags")
@Slf4j
public class TextController {

    private final TextService textService;

    @GetMapping
    @Operation(summary = "List texts", description = "All texts, public and private")
    public Mono<List<TextResponse>> getAllTexts(
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        log.debug("Fetching texts skip={} limit={}", skip, limit);
        return textService.getAllTexts(skip, limit).collectList();
    }

    @GetMapping("/public")
    @Operation(summary = "List public texts")
    public Mono<List<TextResponse>> getPublicTexts(
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return textService.getPublicTexts(skip, limit).collectList();
    }

    @GetMapping("/search")
    @Operation(summary = "Search texts by title", description = "Case-insensitive substring match")
    public Mono<List<TextResponse>> searchTexts(
            @Parameter(description = "Title fragment", required = true)
            @RequestParam @NotBlank @Size(max = 255) String q,
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        log.debug("Searching texts q={}", q);
        return textService.searchTexts(q, skip, limit).collectList();
    }

    @GetMapping("/by-language/{languageId}")
    @Operation(summary = "List texts in a language")
    public Mono<List<TextResponse>> getTextsByLanguage(
            @PathVariable String languageId,
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return textService.getTextsByLanguage(languageId, skip, limit).collectList();
    }

    @GetMapping("/by-user/{userId}")
    @Operation(summary = "List texts owned by a user")
    public Mono<List<TextResponse>> getTextsByUser(
            @PathVariable String userId,
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return textService.getTextsByUser(userId, skip, limit).collectList();
    }

    @GetMapping("/by-level/{level}")
    @Operation(summary = "List texts of a CEFR level")
    public Mono<List<TextResponse>> getTextsByLevel(
            @Parameter(description = "A1, A2, B1, B2, C1 or C2") @PathVariable ProficiencyLevel level,
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return textService.getTextsByLevel(level, skip, limit).collectList();
    }

    @GetMapping("/by-tags")
    @Operation(summary = "List texts carrying any of the tags")
    public Mono<List<TextResponse>> getTextsByTags(
            @RequestParam List<String> tagIds,
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        log.debug("Fetching texts by tags={}", tagIds);
        return textService.getTextsByTags(tagIds, skip, limit).collectList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get text by id", description = "Includes the ids of its tags")
    public Mono<TextResponse> getTextById(@PathVariable String id) {
        log.debug("Fetching text by id={}", id);
        return textService.getTextById(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create text", description = "Word count is computed from the content when omitted")
    public Mono<TextResponse> createText(@Valid @RequestBody TextRequest request) {
        log.info("Creating text: title={}", request.getTitle());
        return textService.createText(request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update text")
    public Mono<TextResponse> updateText(@PathVariable String id, @Valid @RequestBody TextUpdateRequest request) {
        log.info("Updating text: id={}", id);
        return textService.updateText(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete text")
    public Mono<Void> deleteText(@PathVariable String id) {
        log.info("Deleting text: id={}", id);
        return textService.deleteText(id);
    }

    @GetMapping("/{id}/tags")
    @Operation(summary = "List tags of a text")
    public Mono<List<TagResponse>> getTextTags(@PathVariable String id) {
        return textService.getTextTags(id).collectList();
    }

    @PutMapping("/{id}/tags/{tagId}")
    @Operation(summary = "Tag a text", description = "Tagging twice with the same tag is a no-op")
    public Mono<TextResponse> addTag(@PathVariable String id, @PathVariable String tagId) {
        log.info("Adding tag {} to text {}", tagId, id);
        return textService.addTag(id, tagId);
    }

    @DeleteMapping("/{id}/tags/{tagId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Untag a text")
    public Mono<Void> removeTag(@PathVariable String id, @PathVariable String tagId) {
        log.info("Removing tag {} from text {}", tagId, id);
        return textService.removeTag(id, tagId);
    }
}
