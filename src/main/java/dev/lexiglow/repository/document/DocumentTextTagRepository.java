package dev.lexiglow.repository.document;

import dev.lexiglow.entity.TextTag;
import dev.lexiglow.repository.TextTagRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Mono;

import static dev.lexiglow.repository.document.DocumentValues.ID;

class DocumentTextTagRepository extends AbstractDocumentRepository<TextTag> implements TextTagRepository {

    DocumentTextTagRepository(RepositoryContext context, ReactiveMongoTemplate template) {
        super(context, "TextTag", template, DocumentCollections.TEXT_TAGS, false);
    }

    @Override
    public Mono<TextTag> create(TextTag tag) {
        TextTag prepared = tag.toBuilder()
                .id(tag.getId() != null ? tag.getId() : newId())
                .build();
        return insert(prepared.getId(), prepared);
    }

    /**
     * Removes the tag and unlinks it from every text that carries it.
     */
    @Override
    public Mono<Boolean> delete(String id) {
        Mono<Boolean> work = removeById(id)
                .flatMap(deleted -> !deleted ? Mono.just(false) : template.updateMulti(
                                Query.query(Criteria.where("tagIds").is(id)),
                                new Update().pull("tagIds", id),
                                DocumentCollections.TEXTS)
                        .thenReturn(true));
        return execute("delete", id, work);
    }

    @Override
    public Mono<TextTag> findByName(String name) {
        return queryOne("findByName", name, Query.query(Criteria.where("name").is(name)));
    }

    @Override
    public Mono<Boolean> existsByName(String name) {
        return queryExists("existsByName", name, Query.query(Criteria.where("name").is(name)));
    }

    @Override
    protected Document toDocument(TextTag tag) {
        return new Document(ID, tag.getId())
                .append("name", tag.getName())
                .append("description", tag.getDescription());
    }

    @Override
    protected TextTag toEntity(Document document) {
        return TextTag.builder()
                .id(document.getString(ID))
                .name(document.getString("name"))
                .description(document.getString("description"))
                .build();
    }
}
