package dev.lexiglow.repository.document;

import dev.lexiglow.entity.User;
import dev.lexiglow.repository.UserRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

import static dev.lexiglow.repository.document.DocumentValues.ID;
import static dev.lexiglow.repository.document.DocumentValues.getDateTime;
import static dev.lexiglow.repository.document.DocumentValues.toDate;

class DocumentUserRepository extends AbstractDocumentRepository<User> implements UserRepository {

    DocumentUserRepository(RepositoryContext context, ReactiveMongoTemplate template) {
        super(context, "User", template, DocumentCollections.USERS, true);
    }

    @Override
    public Mono<User> create(User user) {
        LocalDateTime now = now();
        User prepared = user.toBuilder()
                .id(user.getId() != null ? user.getId() : newId())
                .createdAt(user.getCreatedAt() != null ? user.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return insert(prepared.getId(), prepared);
    }

    /**
     * Removes the user, then the rows that belong to it: learning languages, vocabularies
     * with their items. Texts it owned are kept and lose their owner. The steps are not
     * atomic.
     */
    @Override
    public Mono<Boolean> delete(String id) {
        Mono<Boolean> work = removeById(id)
                .flatMap(deleted -> deleted ? cascadeDelete(id).thenReturn(true) : Mono.just(false));
        return execute("delete", id, work);
    }

    private Mono<Void> cascadeDelete(String userId) {
        Mono<Void> languages = template.remove(Query.query(Criteria.where("_id.userId").is(userId)),
                DocumentCollections.USER_LANGUAGES).then();
        Mono<Void> vocabularies = template.find(Query.query(Criteria.where("userId").is(userId)),
                        Document.class, DocumentCollections.VOCABULARIES)
                .map(document -> document.getString(ID))
                .collectList()
                .flatMap(ids -> ids.isEmpty() ? Mono.empty() : template.remove(
                                Query.query(Criteria.where("userVocabularyId").in(ids)), DocumentCollections.VOCABULARY_ITEMS)
                        .then(template.remove(Query.query(Criteria.where(ID).in(ids)), DocumentCollections.VOCABULARIES)))
                .then();
        Mono<Void> texts = template.updateMulti(Query.query(Criteria.where("userId").is(userId)),
                new Update().set("userId", null), DocumentCollections.TEXTS).then();
        return Mono.when(languages, vocabularies, texts);
    }

    @Override
    public Mono<User> findByEmail(String email) {
        return queryOne("findByEmail", email, Query.query(Criteria.where("email").is(email)));
    }

    @Override
    public Mono<User> findByUsername(String username) {
        return queryOne("findByUsername", username, Query.query(Criteria.where("username").is(username)));
    }

    @Override
    public Mono<Boolean> existsByEmail(String email) {
        return queryExists("existsByEmail", email, Query.query(Criteria.where("email").is(email)));
    }

    @Override
    public Mono<Boolean> existsByUsername(String username) {
        return queryExists("existsByUsername", username, Query.query(Criteria.where("username").is(username)));
    }

    @Override
    public Mono<Boolean> updateLastActive(String id) {
        return execute("updateLastActive", id, template.updateFirst(byId(id),
                        new Update().set("lastActiveAt", toDate(now())), collection)
                .map(result -> result.getMatchedCount() > 0));
    }

    @Override
    protected Document toDocument(User user) {
        return new Document(ID, user.getId())
                .append("email", user.getEmail())
                .append("username", user.getUsername())
                .append("passwordHash", user.getPasswordHash())
                .append("firstName", user.getFirstName())
                .append("lastName", user.getLastName())
                .append("nativeLanguageId", user.getNativeLanguageId())
                .append("currentLanguageId", user.getCurrentLanguageId())
                .append("createdAt", toDate(user.getCreatedAt()))
                .append("updatedAt", toDate(user.getUpdatedAt()))
                .append("lastActiveAt", toDate(user.getLastActiveAt()));
    }

    @Override
    protected User toEntity(Document document) {
        return User.builder()
                .id(document.getString(ID))
                .email(document.getString("email"))
                .username(document.getString("username"))
                .passwordHash(document.getString("passwordHash"))
                .firstName(document.getString("firstName"))
                .lastName(document.getString("lastName"))
                .nativeLanguageId(document.getString("nativeLanguageId"))
                .currentLanguageId(document.getString("currentLanguageId"))
                .createdAt(getDateTime(document, "createdAt"))
                .updatedAt(getDateTime(document, "updatedAt"))
                .lastActiveAt(getDateTime(document, "lastActiveAt"))
                .build();
    }
}
