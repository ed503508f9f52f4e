package dev.lexiglow.repository.document;

import dev.lexiglow.repository.EntityRepository;
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

import java.util.Set;

import static dev.lexiglow.repository.document.DocumentValues.ID;
import static dev.lexiglow.repository.document.DocumentValues.toDate;

/**
 * Shared query plumbing for one collection of raw BSON documents. Subclasses supply the
 * entity/document mapping.
 *
 * @param <T> entity type
 */
abstract class AbstractDocumentRepository<T> extends ReactiveRepositorySupport implements EntityRepository<T> {

    /** Fields an update never overwrites. */
    private static final Set<String> IMMUTABLE_FIELDS = Set.of(ID, "createdAt", "tagIds");

    protected final ReactiveMongoTemplate template;
    protected final String collection;
    private final boolean tracksUpdatedAt;

    protected AbstractDocumentRepository(RepositoryContext context, String entityType, ReactiveMongoTemplate template,
                                         String collection, boolean tracksUpdatedAt) {
        super(context, entityType);
        this.template = template;
        this.collection = collection;
        this.tracksUpdatedAt = tracksUpdatedAt;
    }

    protected abstract Document toDocument(T entity);

    protected abstract T toEntity(Document document);

    protected Mono<T> insert(String id, T prepared) {
        return execute("create", id, template.insert(toDocument(prepared), collection).thenReturn(prepared));
    }

    @Override
    public Mono<T> findById(String id) {
        return execute("findById", id, template.findOne(byId(id), Document.class, collection).map(this::toEntity));
    }

    @Override
    public Flux<T> findAll(long skip, int limit) {
        return queryPage("findAll", new Query(), skip, limit);
    }

    @Override
    public Mono<T> update(String id, T entity) {
        Document changes = toDocument(entity);
        if (tracksUpdatedAt) {
            changes.put("updatedAt", toDate(now()));
        }
        Update update = new Update();
        changes.forEach((key, value) -> {
            if (!IMMUTABLE_FIELDS.contains(key)) {
                update.set(key, value);
            }
        });
        return execute("update", id, template.findAndModify(byId(id), update,
                        FindAndModifyOptions.options().returnNew(true), Document.class, collection)
                .map(this::toEntity));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return execute("delete", id, removeById(id));
    }

    @Override
    public Mono<Boolean> exists(String id) {
        return execute("exists", id, template.exists(byId(id), collection));
    }

    /**
     * Unwrapped delete, for subclasses that cascade after removal.
     */
    protected Mono<Boolean> removeById(String id) {
        return template.remove(byId(id), collection)
                .map(result -> result.getDeletedCount() > 0);
    }

    protected Mono<T> queryOne(String operation, String key, Query query) {
        return execute(operation, key, template.findOne(query.with(Sort.by(ID)), Document.class, collection)
                .map(this::toEntity));
    }

    protected Mono<Boolean> queryExists(String operation, String key, Query query) {
        return execute(operation, key, template.exists(query, collection));
    }

    /**
     * Paged query ordered by id. A zero limit completes without a round trip (a zero
     * limit means "no limit" to MongoDB).
     */
    protected Flux<T> queryPage(String operation, Query query, long skip, int limit) {
        checkPage(skip, limit);
        if (limit == 0) {
            return Flux.empty();
        }
        Query paged = query.with(Sort.by(ID)).skip(skip).limit(limit);
        return executeMany(operation, null, template.find(paged, Document.class, collection).map(this::toEntity));
    }

    protected static Query byId(String id) {
        return Query.query(Criteria.where(ID).is(id));
    }
}
