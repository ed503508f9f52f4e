package dev.lexiglow.repository.document;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import dev.lexiglow.config.PersistenceProperties;
import dev.lexiglow.exception.OperationNotSupportedException;
import dev.lexiglow.exception.PersistenceConfigurationException;
import dev.lexiglow.repository.BackendType;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.RepositoryBackend;
import dev.lexiglow.repository.TextRepository;
import dev.lexiglow.repository.TextTagRepository;
import dev.lexiglow.repository.UserLanguageRepository;
import dev.lexiglow.repository.UserRepository;
import dev.lexiglow.repository.VocabularyItemRepository;
import dev.lexiglow.repository.VocabularyRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * MongoDB backend over the reactive-streams driver. Unique indexes mirror the unique
 * constraints of the relational schema; foreign keys have no counterpart here.
 */
@Slf4j
public class DocumentRepositoryBackend implements RepositoryBackend {

    private final MongoClient mongoClient;
    private final ReactiveMongoTemplate template;
    private final String databaseName;
    private final Map<Class<?>, Supplier<?>> constructors;

    public DocumentRepositoryBackend(PersistenceProperties properties, RepositoryContext context) {
        this.mongoClient = createClient(properties);
        this.databaseName = properties.getDatabase();
        this.template = new ReactiveMongoTemplate(mongoClient, databaseName);
        this.constructors = Map.of(
                LanguageRepository.class, () -> new DocumentLanguageRepository(context, template),
                UserRepository.class, () -> new DocumentUserRepository(context, template),
                TextRepository.class, () -> new DocumentTextRepository(context, template),
                TextTagRepository.class, () -> new DocumentTextTagRepository(context, template),
                UserLanguageRepository.class, () -> new DocumentUserLanguageRepository(context, template),
                VocabularyRepository.class, () -> new DocumentVocabularyRepository(context, template),
                VocabularyItemRepository.class, () -> new DocumentVocabularyItemRepository(context, template));
    }

    /**
     * Creates the unique and lookup indexes. Existing indexes with the same definition are kept.
     */
    public Mono<Void> ensureIndexes() {
        return Flux.concat(
                        ensure(DocumentCollections.LANGUAGES, new Index().on("code", Sort.Direction.ASC).unique()),
                        ensure(DocumentCollections.USERS, new Index().on("email", Sort.Direction.ASC).unique()),
                        ensure(DocumentCollections.USERS, new Index().on("username", Sort.Direction.ASC).unique()),
                        ensure(DocumentCollections.TEXT_TAGS, new Index().on("name", Sort.Direction.ASC).unique()),
                        ensure(DocumentCollections.VOCABULARIES, new Index()
                                .on("userId", Sort.Direction.ASC)
                                .on("languageId", Sort.Direction.ASC)
                                .unique()),
                        ensure(DocumentCollections.VOCABULARY_ITEMS, new Index()
                                .on("userVocabularyId", Sort.Direction.ASC)
                                .on("term", Sort.Direction.ASC)
                                .unique()),
                        ensure(DocumentCollections.TEXTS, new Index().on("languageId", Sort.Direction.ASC)),
                        ensure(DocumentCollections.TEXTS, new Index().on(DocumentTextRepository.TAG_IDS, Sort.Direction.ASC)))
                .then()
                .doOnSuccess(done -> log.info("Document indexes ensured on database '{}'", databaseName));
    }

    private Mono<String> ensure(String collection, Index index) {
        return template.indexOps(collection).ensureIndex(index);
    }

    @Override
    public BackendType type() {
        return BackendType.DOCUMENT;
    }

    @Override
    public <R> R createRepository(Class<R> repositoryType) {
        Supplier<?> constructor = constructors.get(repositoryType);
        if (constructor == null) {
            throw new OperationNotSupportedException(
                    "Document backend has no implementation of " + repositoryType.getSimpleName());
        }
        return repositoryType.cast(constructor.get());
    }

    @Override
    public Mono<Void> ping() {
        return template.executeCommand(new Document("ping", 1)).then();
    }

    @Override
    public void close() {
        mongoClient.close();
    }

    private static MongoClient createClient(PersistenceProperties properties) {
        ConnectionString connectionString;
        try {
            connectionString = new ConnectionString(properties.getUrl());
        } catch (IllegalArgumentException e) {
            throw new PersistenceConfigurationException("Invalid MongoDB connection string", e);
        }
        long timeoutMillis = properties.getQueryTimeout().toMillis();
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(timeoutMillis, TimeUnit.MILLISECONDS))
                .applyToConnectionPoolSettings(pool -> pool
                        .minSize(properties.getPool().getInitialSize())
                        .maxSize(properties.getPool().getMaxSize()))
                .build();
        log.info("Created MongoDB client for database '{}'", properties.getDatabase());
        return MongoClients.create(settings);
    }
}
