package dev.lexiglow.repository.document;

import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.Text;
import dev.lexiglow.entity.TextTagAssociation;
import dev.lexiglow.repository.TextRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static dev.lexiglow.repository.document.DocumentValues.ID;
import static dev.lexiglow.repository.document.DocumentValues.enumName;
import static dev.lexiglow.repository.document.DocumentValues.escapeRegex;
import static dev.lexiglow.repository.document.DocumentValues.getDateTime;
import static dev.lexiglow.repository.document.DocumentValues.getEnum;
import static dev.lexiglow.repository.document.DocumentValues.getInteger;
import static dev.lexiglow.repository.document.DocumentValues.toDate;

/**
 * Texts embed the ids of their tags in a {@code tagIds} array.
 */
class DocumentTextRepository extends AbstractDocumentRepository<Text> implements TextRepository {

    static final String TAG_IDS = "tagIds";

    DocumentTextRepository(RepositoryContext context, ReactiveMongoTemplate template) {
        super(context, "Text", template, DocumentCollections.TEXTS, true);
    }

    @Override
    public Mono<Text> create(Text text) {
        LocalDateTime now = now();
        Text prepared = text.toBuilder()
                .id(text.getId() != null ? text.getId() : newId())
                .isPublic(text.getIsPublic() != null ? text.getIsPublic() : Boolean.TRUE)
                .createdAt(text.getCreatedAt() != null ? text.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        Document document = toDocument(prepared).append(TAG_IDS, new ArrayList<String>());
        return execute("create", prepared.getId(), template.insert(document, collection).thenReturn(prepared));
    }

    @Override
    public Mono<Text> update(String id, Text text) {
        return super.update(id, text.toBuilder()
                .isPublic(text.getIsPublic() != null ? text.getIsPublic() : Boolean.TRUE)
                .build());
    }

    @Override
    public Flux<Text> findByLanguage(String languageId, long skip, int limit) {
        return queryPage("findByLanguage", Query.query(Criteria.where("languageId").is(languageId)), skip, limit);
    }

    @Override
    public Flux<Text> findByUser(String userId, long skip, int limit) {
        return queryPage("findByUser", Query.query(Criteria.where("userId").is(userId)), skip, limit);
    }

    @Override
    public Flux<Text> findByProficiencyLevel(ProficiencyLevel level, long skip, int limit) {
        return queryPage("findByProficiencyLevel",
                Query.query(Criteria.where("proficiencyLevel").is(level.name())), skip, limit);
    }

    @Override
    public Flux<Text> findPublic(long skip, int limit) {
        return queryPage("findPublic", Query.query(Criteria.where("isPublic").is(true)), skip, limit);
    }

    @Override
    public Flux<Text> searchByTitle(String query, long skip, int limit) {
        return queryPage("searchByTitle",
                Query.query(Criteria.where("title").regex(escapeRegex(query), "i")), skip, limit);
    }

    @Override
    public Flux<Text> findByTags(Collection<String> tagIds, long skip, int limit) {
        checkPage(skip, limit);
        if (tagIds == null || tagIds.isEmpty()) {
            return Flux.empty();
        }
        return queryPage("findByTags", Query.query(Criteria.where(TAG_IDS).in(tagIds)), skip, limit);
    }

    @Override
    public Mono<Boolean> addTag(String textId, String tagId) {
        return execute("addTag", textId, template.updateFirst(byId(textId),
                        new Update().addToSet(TAG_IDS, tagId), collection)
                .map(result -> result.getMatchedCount() > 0));
    }

    @Override
    public Mono<Boolean> removeTag(String textId, String tagId) {
        return execute("removeTag", textId, template.updateFirst(
                        Query.query(Criteria.where(ID).is(textId).and(TAG_IDS).is(tagId)),
                        new Update().pull(TAG_IDS, tagId), collection)
                .map(result -> result.getModifiedCount() > 0));
    }

    @Override
    public Flux<TextTagAssociation> findTagLinks(String textId) {
        return executeMany("findTagLinks", textId, template.findOne(byId(textId), Document.class, collection)
                .flatMapIterable(document -> {
                    List<String> ids = document.getList(TAG_IDS, String.class);
                    return ids != null ? ids.stream().sorted().map(tagId -> new TextTagAssociation(textId, tagId)).toList()
                            : List.<TextTagAssociation>of();
                }));
    }

    @Override
    protected Document toDocument(Text text) {
        return new Document(ID, text.getId())
                .append("title", text.getTitle())
                .append("content", text.getContent())
                .append("languageId", text.getLanguageId())
                .append("userId", text.getUserId())
                .append("proficiencyLevel", enumName(text.getProficiencyLevel()))
                .append("wordCount", text.getWordCount())
                .append("isPublic", text.getIsPublic())
                .append("source", text.getSource())
                .append("createdAt", toDate(text.getCreatedAt()))
                .append("updatedAt", toDate(text.getUpdatedAt()));
    }

    @Override
    protected Text toEntity(Document document) {
        return Text.builder()
                .id(document.getString(ID))
                .title(document.getString("title"))
                .content(document.getString("content"))
                .languageId(document.getString("languageId"))
                .userId(document.getString("userId"))
                .proficiencyLevel(getEnum(document, "proficiencyLevel", ProficiencyLevel.class))
                .wordCount(getInteger(document, "wordCount"))
                .isPublic(document.getBoolean("isPublic"))
                .source(document.getString("source"))
                .createdAt(getDateTime(document, "createdAt"))
                .updatedAt(getDateTime(document, "updatedAt"))
                .build();
    }
}
