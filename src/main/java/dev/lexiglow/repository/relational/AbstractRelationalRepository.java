package dev.lexiglow.repository.relational;

import dev.lexiglow.repository.EntityRepository;
import dev.lexiglow.repository.support.ReactiveRepositorySupport;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.Parameter;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.UnaryOperator;

/**
 * Shared SQL plumbing for the relational repositories: lookups by id, paging, delete
 * and existence checks against a single table whose primary key column is {@code id}.
 *
 * @param <T> entity type
 */
abstract class AbstractRelationalRepository<T> extends ReactiveRepositorySupport implements EntityRepository<T> {

    protected final DatabaseClient databaseClient;
    protected final TransactionalOperator transactionalOperator;
    private final String table;

    protected AbstractRelationalRepository(RepositoryContext context, String entityType, String table,
                                           DatabaseClient databaseClient, TransactionalOperator transactionalOperator) {
        super(context, entityType);
        this.table = table;
        this.databaseClient = databaseClient;
        this.transactionalOperator = transactionalOperator;
    }

    protected abstract T mapRow(Row row);

    @Override
    public Mono<T> findById(String id) {
        return execute("findById", id, selectById(id));
    }

    @Override
    public Flux<T> findAll(long skip, int limit) {
        return queryPage("findAll", "SELECT * FROM " + table, UnaryOperator.identity(), skip, limit);
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return execute("delete", id, databaseClient.sql("DELETE FROM " + table + " WHERE id = :id")
                .bind("id", id)
                .fetch()
                .rowsUpdated()
                .map(rows -> rows > 0));
    }

    @Override
    public Mono<Boolean> exists(String id) {
        return execute("exists", id, databaseClient.sql("SELECT id FROM " + table + " WHERE id = :id")
                .bind("id", id)
                .map((row, meta) -> row.get("id", String.class))
                .first()
                .hasElement());
    }

    /**
     * Unwrapped lookup for use inside a larger operation (e.g. a transaction).
     */
    protected Mono<T> selectById(String id) {
        return databaseClient.sql("SELECT * FROM " + table + " WHERE id = :id")
                .bind("id", id)
                .map((row, meta) -> mapRow(row))
                .one();
    }

    protected Mono<T> queryOne(String operation, String key, String sql, UnaryOperator<GenericExecuteSpec> binder) {
        return execute(operation, key, binder.apply(databaseClient.sql(sql))
                .map((row, meta) -> mapRow(row))
                .first());
    }

    protected Mono<Boolean> queryExists(String operation, String key, String sql, UnaryOperator<GenericExecuteSpec> binder) {
        return execute(operation, key, binder.apply(databaseClient.sql(sql))
                .map((row, meta) -> Boolean.TRUE)
                .first()
                .hasElement());
    }

    /**
     * Runs {@code sql} ordered by id with LIMIT/OFFSET appended. A zero limit completes
     * without touching the database.
     */
    protected Flux<T> queryPage(String operation, String sql, UnaryOperator<GenericExecuteSpec> binder,
                                long skip, int limit) {
        checkPage(skip, limit);
        if (limit == 0) {
            return Flux.empty();
        }
        GenericExecuteSpec spec = databaseClient.sql(sql + " ORDER BY id LIMIT :limit OFFSET :offset")
                .bind("limit", limit)
                .bind("offset", skip);
        return executeMany(operation, null, binder.apply(spec)
                .map((row, meta) -> mapRow(row))
                .all());
    }

    protected <R> Mono<R> inTransaction(Mono<R> work) {
        return work.as(transactionalOperator::transactional);
    }

    /**
     * Bind value that turns into SQL NULL when {@code value} is null.
     */
    protected static Parameter nullable(Object value, Class<?> type) {
        return Parameter.fromOrEmpty(value, type);
    }

    protected static String enumName(Enum<?> value) {
        return value != null ? value.name() : null;
    }

    protected static <E extends Enum<E>> E toEnum(Class<E> type, String value) {
        return value != null ? Enum.valueOf(type, value) : null;
    }
}
