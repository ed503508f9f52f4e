package dev.lexiglow.controller;

import dev.lexiglow.dto.TagRequest;
import dev.lexiglow.dto.TagResponse;
import dev.lexiglow.service.TextTagService;
import io.swagger.v3.oas.annotations.Operation;
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
@RequestMapping("/api/v1/tags")
@RequiredArgsConstructor
@Validated
@Tag(name = "Tags", description = "Text tags")
@Slf4j
public class TagController {

    private final TextTagService tagService;

    @GetMapping
    @Operation(summary = "List tags")
    public Mono<List<TagResponse>> getAllTags(
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        log.debug("Fetching tags skip={} limit={}", skip, limit);
        return tagService.getAllTags(skip, limit).collectList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get tag by id")
    public Mono<TagResponse> getTagById(@PathVariable String id) {
        log.debug("Fetching tag by id={}", id);
        return tagService.getTagById(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create tag")
    public Mono<TagResponse> createTag(@Valid @RequestBody TagRequest request) {
        log.info("Creating tag: name={}", request.getName());
        return tagService.createTag(request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update tag")
    public Mono<TagResponse> updateTag(@PathVariable String id, @Valid @RequestBody TagRequest request) {
        log.info("Updating tag: id={}", id);
        return tagService.updateTag(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete tag", description = "Also unlinks the tag from every text")
    public Mono<Void> deleteTag(@PathVariable String id) {
        log.info("Deleting tag: id={}", id);
        return tagService.deleteTag(id);
    }
}
