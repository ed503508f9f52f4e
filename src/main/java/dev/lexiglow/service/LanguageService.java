package dev.lexiglow.service;

import dev.lexiglow.dto.LanguageRequest;
import dev.lexiglow.dto.LanguageResponse;
import dev.lexiglow.dto.LanguageUpdateRequest;
import dev.lexiglow.entity.Language;
import dev.lexiglow.exception.DuplicateResourceException;
import dev.lexiglow.exception.ResourceNotFoundException;
import dev.lexiglow.repository.LanguageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j
public class LanguageService {

    private final LanguageRepository languageRepository;
    private final IdService idService;

    public Flux<LanguageResponse> getAllLanguages(long skip, int limit) {
        return languageRepository.findAll(skip, limit)
                .map(LanguageService::toResponse);
    }

    public Mono<LanguageResponse> getLanguageById(String id) {
        return languageRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Language", "id", id)))
                .map(LanguageService::toResponse);
    }

    public Mono<LanguageResponse> getLanguageByCode(String code) {
        return languageRepository.findByCode(code)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Language", "code", code)))
                .map(LanguageService::toResponse);
    }

    public Mono<LanguageResponse> createLanguage(LanguageRequest request) {
        return languageRepository.existsByCode(request.getCode())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("Language", "code", request.getCode()));
                    }
                    Language language = Language.builder()
                            .id(idService.nextId())
                            .name(request.getName())
                            .code(request.getCode())
                            .nativeName(request.getNativeName())
                            .build();
                    return languageRepository.create(language)
                            .doOnSuccess(l -> log.info("Language created: {} ({})", l.getId(), l.getCode()))
                            .map(LanguageService::toResponse);
                });
    }

    public Mono<LanguageResponse> updateLanguage(String id, LanguageUpdateRequest request) {
        return languageRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Language", "id", id)))
                .flatMap(existing -> checkCodeAvailable(existing, request.getCode())
                        .then(Mono.defer(() -> {
                            Language merged = existing.toBuilder()
                                    .name(request.getName() != null ? request.getName() : existing.getName())
                                    .code(request.getCode() != null ? request.getCode() : existing.getCode())
                                    .nativeName(request.getNativeName() != null
                                            ? request.getNativeName() : existing.getNativeName())
                                    .build();
                            return languageRepository.update(id, merged);
                        })))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Language", "id", id)))
                .doOnSuccess(l -> log.info("Language updated: {}", id))
                .map(LanguageService::toResponse);
    }

    public Mono<Void> deleteLanguage(String id) {
        return languageRepository.delete(id)
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.error(new ResourceNotFoundException("Language", "id", id));
                    }
                    log.info("Language deleted: {}", id);
                    return Mono.empty();
                });
    }

    private Mono<Void> checkCodeAvailable(Language existing, String newCode) {
        if (newCode == null || newCode.equals(existing.getCode())) {
            return Mono.empty();
        }
        return languageRepository.existsByCode(newCode)
                .flatMap(exists -> exists
                        ? Mono.error(new DuplicateResourceException("Language", "code", newCode))
                        : Mono.empty());
    }

    static LanguageResponse toResponse(Language language) {
        return LanguageResponse.builder()
                .id(language.getId())
                .name(language.getName())
                .code(language.getCode())
                .nativeName(language.getNativeName())
                .createdAt(language.getCreatedAt())
                .build();
    }
}
