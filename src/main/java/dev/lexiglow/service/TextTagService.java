package dev.lexiglow.service;

import dev.lexiglow.dto.TagRequest;
import dev.lexiglow.dto.TagResponse;
import dev.lexiglow.entity.TextTag;
import dev.lexiglow.exception.DuplicateResourceException;
import dev.lexiglow.exception.ResourceNotFoundException;
import dev.lexiglow.repository.TextTagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j
public class TextTagService {

    private final TextTagRepository tagRepository;
    private final IdService idService;

    public Flux<TagResponse> getAllTags(long skip, int limit) {
        return tagRepository.findAll(skip, limit)
                .map(TextTagService::toResponse);
    }

    public Mono<TagResponse> getTagById(String id) {
        return tagRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "id", id)))
                .map(TextTagService::toResponse);
    }

    public Mono<TagResponse> createTag(TagRequest request) {
        return tagRepository.existsByName(request.getName())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("Tag", "name", request.getName()));
                    }
                    TextTag tag = TextTag.builder()
                            .id(idService.nextId())
                            .name(request.getName())
                            .description(request.getDescription())
                            .build();
                    return tagRepository.create(tag)
                            .doOnSuccess(t -> log.info("Tag created: {} ({})", t.getId(), t.getName()))
                            .map(TextTagService::toResponse);
                });
    }

    public Mono<TagResponse> updateTag(String id, TagRequest request) {
        return tagRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "id", id)))
                .flatMap(existing -> {
                    Mono<Void> nameCheck = request.getName().equals(existing.getName())
                            ? Mono.empty()
                            : tagRepository.existsByName(request.getName())
                                    .flatMap(exists -> exists
                                            ? Mono.error(new DuplicateResourceException("Tag", "name", request.getName()))
                                            : Mono.empty());
                    TextTag updated = existing.toBuilder()
                            .name(request.getName())
                            .description(request.getDescription())
                            .build();
                    return nameCheck.then(Mono.defer(() -> tagRepository.update(id, updated)));
                })
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "id", id)))
                .doOnSuccess(t -> log.info("Tag updated: {}", id))
                .map(TextTagService::toResponse);
    }

    public Mono<Void> deleteTag(String id) {
        return tagRepository.delete(id)
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.error(new ResourceNotFoundException("Tag", "id", id));
                    }
                    log.info("Tag deleted: {}", id);
                    return Mono.empty();
                });
    }

    static TagResponse toResponse(TextTag tag) {
        return TagResponse.builder()
                .id(tag.getId())
                .name(tag.getName())
                .description(tag.getDescription())
                .build();
    }
}
