package dev.lexiglow.repository.relational;

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
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Supplier;

/**
 * R2DBC backend: one connection pool, one {@link DatabaseClient} and one transaction
 * operator shared by all relational repositories.
 */
@Slf4j
public class RelationalRepositoryBackend implements RepositoryBackend {

    static final String SCHEMA_LOCATION = "db/schema.sql";

    private final ConnectionPool connectionPool;
    private final DatabaseClient databaseClient;
    private final Map<Class<?>, Supplier<?>> constructors;

    public RelationalRepositoryBackend(PersistenceProperties properties, RepositoryContext context) {
        this.connectionPool = createPool(properties);
        this.databaseClient = DatabaseClient.create(connectionPool);
        TransactionalOperator transactionalOperator =
                TransactionalOperator.create(new R2dbcTransactionManager(connectionPool));
        this.constructors = Map.of(
                LanguageRepository.class, () -> new RelationalLanguageRepository(context, databaseClient, transactionalOperator),
                UserRepository.class, () -> new RelationalUserRepository(context, databaseClient, transactionalOperator),
                TextRepository.class, () -> new RelationalTextRepository(context, databaseClient, transactionalOperator),
                TextTagRepository.class, () -> new RelationalTextTagRepository(context, databaseClient, transactionalOperator),
                UserLanguageRepository.class, () -> new RelationalUserLanguageRepository(context, databaseClient, transactionalOperator),
                VocabularyRepository.class, () -> new RelationalVocabularyRepository(context, databaseClient, transactionalOperator),
                VocabularyItemRepository.class, () -> new RelationalVocabularyItemRepository(context, databaseClient, transactionalOperator));
    }

    /**
     * Applies the bundled schema. Statements are idempotent.
     */
    public Mono<Void> initializeSchema() {
        return new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION))
                .populate(connectionPool)
                .doOnSuccess(done -> log.info("Relational schema applied from {}", SCHEMA_LOCATION));
    }

    @Override
    public BackendType type() {
        return BackendType.RELATIONAL;
    }

    @Override
    public <R> R createRepository(Class<R> repositoryType) {
        Supplier<?> constructor = constructors.get(repositoryType);
        if (constructor == null) {
            throw new OperationNotSupportedException(
                    "Relational backend has no implementation of " + repositoryType.getSimpleName());
        }
        return repositoryType.cast(constructor.get());
    }

    @Override
    public Mono<Void> ping() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .then();
    }

    @Override
    public void close() {
        connectionPool.dispose();
    }

    private static ConnectionPool createPool(PersistenceProperties properties) {
        ConnectionFactory connectionFactory;
        try {
            ConnectionFactoryOptions.Builder options = ConnectionFactoryOptions.parse(properties.getUrl()).mutate();
            if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
                options.option(ConnectionFactoryOptions.USER, properties.getUsername());
            }
            if (properties.getPassword() != null && !properties.getPassword().isEmpty()) {
                options.option(ConnectionFactoryOptions.PASSWORD, properties.getPassword());
            }
            connectionFactory = ConnectionFactories.get(options.build());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new PersistenceConfigurationException("Cannot create R2DBC connection factory for the configured URL", e);
        }
        PersistenceProperties.Pool pool = properties.getPool();
        ConnectionPoolConfiguration configuration = ConnectionPoolConfiguration.builder(connectionFactory)
                .initialSize(pool.getInitialSize())
                .maxSize(pool.getMaxSize())
                .maxIdleTime(pool.getMaxIdleTime())
                .build();
        log.info("Created R2DBC connection pool (initial={}, max={})", pool.getInitialSize(), pool.getMaxSize());
        return new ConnectionPool(configuration);
    }
}
