package dev.lexiglow.service;

import dev.lexiglow.dto.TagResponse;
import dev.lexiglow.dto.TextRequest;
import dev.lexiglow.dto.TextResponse;
import dev.lexiglow.dto.TextUpdateRequest;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.Text;
import dev.lexiglow.exception.ResourceNotFoundException;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.TextRepository;
import dev.lexiglow.repository.TextTagRepository;
import dev.lexiglow.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class TextService {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TextRepository textRepository;
    private final TextTagRepository tagRepository;
    private final LanguageRepository languageRepository;
    private final UserRepository userRepository;
    private final IdService idService;

    public Flux<TextResponse> getAllTexts(long skip, int limit) {
        return textRepository.findAll(skip, limit).map(TextService::toResponse);
    }

    public Flux<TextResponse> getPublicTexts(long skip, int limit) {
        return textRepository.findPublic(skip, limit).map(TextService::toResponse);
    }

    public Flux<TextResponse> getTextsByLanguage(String languageId, long skip, int limit) {
        return textRepository.findByLanguage(languageId, skip, limit).map(TextService::toResponse);
    }

    public Flux<TextResponse> getTextsByUser(String userId, long skip, int limit) {
        return textRepository.findByUser(userId, skip, limit).map(TextService::toResponse);
    }

    public Flux<TextResponse> getTextsByLevel(ProficiencyLevel level, long skip, int limit) {
        return textRepository.findByProficiencyLevel(level, skip, limit).map(TextService::toResponse);
    }

    public Flux<TextResponse> searchTexts(String query, long skip, int limit) {
        return textRepository.searchByTitle(query, skip, limit).map(TextService::toResponse);
    }

    public Flux<TextResponse> getTextsByTags(Collection<String> tagIds, long skip, int limit) {
        return textRepository.findByTags(tagIds, skip, limit).map(TextService::toResponse);
    }

    /**
     * Single text with its tag ids.
     */
    public Mono<TextResponse> getTextById(String id) {
        return findText(id)
                .flatMap(text -> textRepository.findTagIds(id)
                        .collectList()
                        .map(tagIds -> toResponse(text, tagIds)));
    }

    public Mono<TextResponse> createText(TextRequest request) {
        Text text = Text.builder()
                .id(idService.nextId())
                .title(request.getTitle())
                .content(request.getContent())
                .languageId(request.getLanguageId())
                .userId(request.getUserId())
                .proficiencyLevel(request.getProficiencyLevel())
                .wordCount(request.getWordCount() != null ? request.getWordCount() : countWords(request.getContent()))
                .isPublic(request.getIsPublic() != null ? request.getIsPublic() : Boolean.TRUE)
                .source(request.getSource())
                .build();
        return requireReference(languageRepository.exists(request.getLanguageId()), "Language", request.getLanguageId())
                .then(Mono.defer(() -> request.getUserId() == null
                        ? Mono.<Void>empty()
                        : requireReference(userRepository.exists(request.getUserId()), "User", request.getUserId())))
                .then(Mono.defer(() -> textRepository.create(text)))
                .doOnSuccess(t -> log.info("Text created: {} ({} words)", t.getId(), t.getWordCount()))
                .map(TextService::toResponse);
    }

    public Mono<TextResponse> updateText(String id, TextUpdateRequest request) {
        return findText(id)
                .flatMap(existing -> {
                    Text.TextBuilder merged = existing.toBuilder();
                    if (request.getTitle() != null) merged.title(request.getTitle());
                    if (request.getLanguageId() != null) merged.languageId(request.getLanguageId());
                    if (request.getProficiencyLevel() != null) merged.proficiencyLevel(request.getProficiencyLevel());
                    if (request.getIsPublic() != null) merged.isPublic(request.getIsPublic());
                    if (request.getSource() != null) merged.source(request.getSource());
                    if (request.getContent() != null) {
                        merged.content(request.getContent());
                        merged.wordCount(countWords(request.getContent()));
                    }
                    if (request.getWordCount() != null) merged.wordCount(request.getWordCount());
                    Mono<Void> languageCheck = request.getLanguageId() == null
                            || request.getLanguageId().equals(existing.getLanguageId())
                            ? Mono.empty()
                            : requireReference(languageRepository.exists(request.getLanguageId()),
                                    "Language", request.getLanguageId());
                    return languageCheck.then(Mono.defer(() -> textRepository.update(id, merged.build())));
                })
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Text", "id", id)))
                .doOnSuccess(t -> log.info("Text updated: {}", id))
                .map(TextService::toResponse);
    }

    public Mono<Void> deleteText(String id) {
        return textRepository.delete(id)
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.error(new ResourceNotFoundException("Text", "id", id));
                    }
                    log.info("Text deleted: {}", id);
                    return Mono.empty();
                });
    }

    public Flux<TagResponse> getTextTags(String textId) {
        return findText(textId)
                .flatMapMany(text -> textRepository.findTagIds(textId))
                .concatMap(tagRepository::findById)
                .map(TextTagService::toResponse);
    }

    public Mono<TextResponse> addTag(String textId, String tagId) {
        return tagRepository.exists(tagId)
                .flatMap(exists -> exists
                        ? textRepository.addTag(textId, tagId)
                        : Mono.error(new ResourceNotFoundException("Tag", "id", tagId)))
                .flatMap(linked -> linked
                        ? getTextById(textId)
                        : Mono.error(new ResourceNotFoundException("Text", "id", textId)))
                .doOnSuccess(t -> log.info("Tag {} added to text {}", tagId, textId));
    }

    public Mono<Void> removeTag(String textId, String tagId) {
        return textRepository.removeTag(textId, tagId)
                .flatMap(removed -> {
                    if (!removed) {
                        return Mono.error(new ResourceNotFoundException("TextTagAssociation", "textId/tagId",
                                textId + "/" + tagId));
                    }
                    log.info("Tag {} removed from text {}", tagId, textId);
                    return Mono.empty();
                });
    }

    /**
     * Number of whitespace-separated tokens.
     */
    static int countWords(String content) {
        if (content == null) {
            return 0;
        }
        String trimmed = content.strip();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    private Mono<Text> findText(String id) {
        return textRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Text", "id", id)));
    }

    private static Mono<Void> requireReference(Mono<Boolean> exists, String resource, String id) {
        return exists.flatMap(found -> found
                ? Mono.<Void>empty()
                : Mono.error(new ResourceNotFoundException(resource, "id", id)));
    }

    static TextResponse toResponse(Text text) {
        return toResponse(text, null);
    }

    static TextResponse toResponse(Text text, List<String> tagIds) {
        return TextResponse.builder()
                .id(text.getId())
                .title(text.getTitle())
                .content(text.getContent())
                .languageId(text.getLanguageId())
                .userId(text.getUserId())
                .proficiencyLevel(text.getProficiencyLevel())
                .wordCount(text.getWordCount())
                .isPublic(text.getIsPublic())
                .source(text.getSource())
                .tagIds(tagIds)
                .createdAt(text.getCreatedAt())
                .updatedAt(text.getUpdatedAt())
                .build();
    }
}
