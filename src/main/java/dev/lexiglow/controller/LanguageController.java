package dev.lexiglow.controller;

import dev.lexiglow.dto.LanguageRequest;
import dev.lexiglow.dto.LanguageResponse;
import dev.lexiglow.dto.LanguageUpdateRequest;
import dev.lexiglow.service.LanguageService;
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
@RequestMapping("/api/v1/languages")
@RequiredArgsConstructor
@Validated
@Tag(name = "Languages", description = "Languages available for learning")
@Slf4j
public class LanguageController {

    private final LanguageService languageService;

    @GetMapping
    @Operation(summary = "List languages", description = "Page through languages in creation order")
    public Mono<List<LanguageResponse>> getAllLanguages(
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") @Min(0) long skip,
            @Parameter(description = "Maximum rows") @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        log.debug("Fetching languages skip={} limit={}", skip, limit);
        return languageService.getAllLanguages(skip, limit).collectList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get language by id")
    public Mono<LanguageResponse> getLanguageById(@PathVariable String id) {
        log.debug("Fetching language by id={}", id);
        return languageService.getLanguageById(id);
    }

    @GetMapping("/code/{code}")
    @Operation(summary = "Get language by ISO code")
    public Mono<LanguageResponse> getLanguageByCode(@PathVariable String code) {
        log.debug("Fetching language by code={}", code);
        return languageService.getLanguageByCode(code);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create language")
    public Mono<LanguageResponse> createLanguage(@Valid @RequestBody LanguageRequest request) {
        log.info("Creating language: code={}", request.getCode());
        return languageService.createLanguage(request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update language", description = "Fields left out of the request keep their value")
    public Mono<LanguageResponse> updateLanguage(@PathVariable String id,
                                                 @Valid @RequestBody LanguageUpdateRequest request) {
        log.info("Updating language: id={}", id);
        return languageService.updateLanguage(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete language", description = "On the relational backend, fails with 409 while the language is in use")
    public Mono<Void> deleteLanguage(@PathVariable String id) {
        log.info("Deleting language: id={}", id);
        return languageService.deleteLanguage(id);
    }
}
