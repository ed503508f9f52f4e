package dev.lexiglow.repository.document;

import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.UserLanguage;
import dev.lexiglow.repository.UserLanguageRepository;
import dev.lexiglow.repository.support.ReactiveRepositorySupport;
import dev.lexiglow.repository.support.RepositoryContext;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

import static dev.lexiglow.repository.document.DocumentValues.ID;
import static dev.lexiglow.repository.document.DocumentValues.enumName;
import static dev.lexiglow.repository.document.DocumentValues.getDateTime;
import static dev.lexiglow.repository.document.DocumentValues.getEnum;
import static dev.lexiglow.repository.document.DocumentValues.toDate;

/**
 * Stores each pair under a compound {@code _id: {userId, languageId}}.
 */
class DocumentUserLanguageRepository extends ReactiveRepositorySupport implements UserLanguageRepository {

    private final ReactiveMongoTemplate template;

    DocumentUserLanguageRepository(RepositoryContext context, ReactiveMongoTemplate template) {
        super(context, "UserLanguage");
        this.template = template;
    }

    @Override
    public Mono<UserLanguage> save(UserLanguage userLanguage) {
        LocalDateTime now = now();
        Document fields = toDocument(userLanguage.toBuilder()
                .proficiencyLevel(userLanguage.getProficiencyLevel() != null
                        ? userLanguage.getProficiencyLevel() : ProficiencyLevel.A1)
                .startedAt(userLanguage.getStartedAt() != null ? userLanguage.getStartedAt() : now)
                .createdAt(userLanguage.getCreatedAt() != null ? userLanguage.getCreatedAt() : now)
                .updatedAt(now)
                .build());
        Update update = new Update()
                .set("proficiencyLevel", fields.get("proficiencyLevel"))
                .set("updatedAt", fields.get("updatedAt"))
                .setOnInsert("createdAt", fields.get("createdAt"));
        // an existing pair keeps its start date unless a new one is given
        if (userLanguage.getStartedAt() != null) {
            update.set("startedAt", fields.get("startedAt"));
        } else {
            update.setOnInsert("startedAt", fields.get("startedAt"));
        }
        String key = userLanguage.getUserId() + "/" + userLanguage.getLanguageId();
        return execute("save", key, template.findAndModify(
                        byKey(userLanguage.getUserId(), userLanguage.getLanguageId()), update,
                        FindAndModifyOptions.options().upsert(true).returnNew(true),
                        Document.class, DocumentCollections.USER_LANGUAGES)
                .map(DocumentUserLanguageRepository::toEntity));
    }

    @Override
    public Mono<UserLanguage> find(String userId, String languageId) {
        return execute("find", userId + "/" + languageId, template.findOne(byKey(userId, languageId),
                        Document.class, DocumentCollections.USER_LANGUAGES)
                .map(DocumentUserLanguageRepository::toEntity));
    }

    @Override
    public Flux<UserLanguage> findByUser(String userId) {
        Query query = Query.query(Criteria.where("_id.userId").is(userId)).with(Sort.by("_id.languageId"));
        return executeMany("findByUser", userId, template.find(query, Document.class, DocumentCollections.USER_LANGUAGES)
                .map(DocumentUserLanguageRepository::toEntity));
    }

    @Override
    public Mono<Boolean> delete(String userId, String languageId) {
        return execute("delete", userId + "/" + languageId, template.remove(byKey(userId, languageId),
                        DocumentCollections.USER_LANGUAGES)
                .map(result -> result.getDeletedCount() > 0));
    }

    static Document key(String userId, String languageId) {
        return new Document("userId", userId).append("languageId", languageId);
    }

    private static Query byKey(String userId, String languageId) {
        return Query.query(Criteria.where(ID).is(key(userId, languageId)));
    }

    static Document toDocument(UserLanguage userLanguage) {
        return new Document(ID, key(userLanguage.getUserId(), userLanguage.getLanguageId()))
                .append("proficiencyLevel", enumName(userLanguage.getProficiencyLevel()))
                .append("startedAt", toDate(userLanguage.getStartedAt()))
                .append("createdAt", toDate(userLanguage.getCreatedAt()))
                .append("updatedAt", toDate(userLanguage.getUpdatedAt()));
    }

    static UserLanguage toEntity(Document document) {
        Document key = document.get(ID, Document.class);
        return UserLanguage.builder()
                .userId(key.getString("userId"))
                .languageId(key.getString("languageId"))
                .proficiencyLevel(getEnum(document, "proficiencyLevel", ProficiencyLevel.class))
                .startedAt(getDateTime(document, "startedAt"))
                .createdAt(getDateTime(document, "createdAt"))
                .updatedAt(getDateTime(document, "updatedAt"))
                .build();
    }
}
