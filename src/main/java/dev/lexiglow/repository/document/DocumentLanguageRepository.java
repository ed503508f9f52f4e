package dev.lexiglow.repository.document;

import dev.lexiglow.entity.Language;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import reactor.core.publisher.Mono;

import static dev.lexiglow.repository.document.DocumentValues.ID;
import static dev.lexiglow.repository.document.DocumentValues.getDateTime;
import static dev.lexiglow.repository.document.DocumentValues.toDate;

class DocumentLanguageRepository extends AbstractDocumentRepository<Language> implements LanguageRepository {

    DocumentLanguageRepository(RepositoryContext context, ReactiveMongoTemplate template) {
        super(context, "Language", template, DocumentCollections.LANGUAGES, false);
    }

    @Override
    public Mono<Language> create(Language language) {
        Language prepared = language.toBuilder()
                .id(language.getId() != null ? language.getId() : newId())
                .createdAt(language.getCreatedAt() != null ? language.getCreatedAt() : now())
                .build();
        return insert(prepared.getId(), prepared);
    }

    /**
     * Also removes the user-language pairs of the deleted language. Not atomic.
     */
    @Override
    public Mono<Boolean> delete(String id) {
        Mono<Boolean> work = removeById(id)
                .flatMap(deleted -> deleted
                        ? template.remove(Query.query(Criteria.where("_id.languageId").is(id)),
                                DocumentCollections.USER_LANGUAGES).thenReturn(true)
                        : Mono.just(false));
        return execute("delete", id, work);
    }

    @Override
    public Mono<Language> findByCode(String code) {
        return queryOne("findByCode", code, Query.query(Criteria.where("code").is(code)));
    }

    @Override
    public Mono<Language> findByName(String name) {
        return queryOne("findByName", name, Query.query(Criteria.where("name").is(name)));
    }

    @Override
    public Mono<Boolean> existsByCode(String code) {
        return queryExists("existsByCode", code, Query.query(Criteria.where("code").is(code)));
    }

    @Override
    protected Document toDocument(Language language) {
        return new Document(ID, language.getId())
                .append("name", language.getName())
                .append("code", language.getCode())
                .append("nativeName", language.getNativeName())
                .append("createdAt", toDate(language.getCreatedAt()));
    }

    @Override
    protected Language toEntity(Document document) {
        return Language.builder()
                .id(document.getString(ID))
                .name(document.getString("name"))
                .code(document.getString("code"))
                .nativeName(document.getString("nativeName"))
                .createdAt(getDateTime(document, "createdAt"))
                .build();
    }
}
