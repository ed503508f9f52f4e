package dev.lexiglow.repository.document;

import dev.lexiglow.entity.UserVocabulary;
import dev.lexiglow.repository.VocabularyRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

import static dev.lexiglow.repository.document.DocumentValues.ID;
import static dev.lexiglow.repository.document.DocumentValues.getDateTime;
import static dev.lexiglow.repository.document.DocumentValues.toDate;

class DocumentVocabularyRepository extends AbstractDocumentRepository<UserVocabulary> implements VocabularyRepository {

    DocumentVocabularyRepository(RepositoryContext context, ReactiveMongoTemplate template) {
        super(context, "UserVocabulary", template, DocumentCollections.VOCABULARIES, true);
    }

    @Override
    public Mono<UserVocabulary> create(UserVocabulary vocabulary) {
        LocalDateTime now = now();
        UserVocabulary prepared = vocabulary.toBuilder()
                .id(vocabulary.getId() != null ? vocabulary.getId() : newId())
                .createdAt(vocabulary.getCreatedAt() != null ? vocabulary.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return insert(prepared.getId(), prepared);
    }

    /**
     * Removes the vocabulary and then its items.
     */
    @Override
    public Mono<Boolean> delete(String id) {
        Mono<Boolean> work = removeById(id)
                .flatMap(deleted -> !deleted ? Mono.just(false) : template.remove(
                                Query.query(Criteria.where("userVocabularyId").is(id)), DocumentCollections.VOCABULARY_ITEMS)
                        .thenReturn(true));
        return execute("delete", id, work);
    }

    @Override
    public Flux<UserVocabulary> findByUser(String userId) {
        Query query = Query.query(Criteria.where("userId").is(userId)).with(Sort.by(ID));
        return executeMany("findByUser", userId, template.find(query, Document.class, collection).map(this::toEntity));
    }

    @Override
    public Mono<UserVocabulary> findByUserAndLanguage(String userId, String languageId) {
        return queryOne("findByUserAndLanguage", userId,
                Query.query(Criteria.where("userId").is(userId).and("languageId").is(languageId)));
    }

    @Override
    protected Document toDocument(UserVocabulary vocabulary) {
        return new Document(ID, vocabulary.getId())
                .append("userId", vocabulary.getUserId())
                .append("languageId", vocabulary.getLanguageId())
                .append("name", vocabulary.getName())
                .append("createdAt", toDate(vocabulary.getCreatedAt()))
                .append("updatedAt", toDate(vocabulary.getUpdatedAt()));
    }

    @Override
    protected UserVocabulary toEntity(Document document) {
        return UserVocabulary.builder()
                .id(document.getString(ID))
                .userId(document.getString("userId"))
                .languageId(document.getString("languageId"))
                .name(document.getString("name"))
                .createdAt(getDateTime(document, "createdAt"))
                .updatedAt(getDateTime(document, "updatedAt"))
                .build();
    }
}
