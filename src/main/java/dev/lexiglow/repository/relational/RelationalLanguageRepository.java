package dev.lexiglow.repository.relational;

import dev.lexiglow.entity.Language;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

class RelationalLanguageRepository extends AbstractRelationalRepository<Language> implements LanguageRepository {

    private static final String INSERT_LANGUAGE =
            "INSERT INTO languages (id, name, code, native_name, created_at) " +
            "VALUES (:id, :name, :code, :nativeName, :createdAt)";

    private static final String UPDATE_LANGUAGE =
            "UPDATE languages SET name = :name, code = :code, native_name = :nativeName WHERE id = :id";

    RelationalLanguageRepository(RepositoryContext context, DatabaseClient databaseClient,
                                 TransactionalOperator transactionalOperator) {
        super(context, "Language", "languages", databaseClient, transactionalOperator);
    }

    @Override
    public Mono<Language> create(Language language) {
        Language toInsert = language.toBuilder()
                .id(language.getId() != null ? language.getId() : newId())
                .createdAt(language.getCreatedAt() != null ? language.getCreatedAt() : now())
                .build();
        return execute("create", toInsert.getId(), databaseClient.sql(INSERT_LANGUAGE)
                .bind("id", toInsert.getId())
                .bind("name", nullable(toInsert.getName(), String.class))
                .bind("code", nullable(toInsert.getCode(), String.class))
                .bind("nativeName", nullable(toInsert.getNativeName(), String.class))
                .bind("createdAt", toInsert.getCreatedAt())
                .fetch()
                .rowsUpdated()
                .thenReturn(toInsert));
    }

    @Override
    public Mono<Language> update(String id, Language language) {
        Mono<Language> work = databaseClient.sql(UPDATE_LANGUAGE)
                .bind("id", id)
                .bind("name", nullable(language.getName(), String.class))
                .bind("code", nullable(language.getCode(), String.class))
                .bind("nativeName", nullable(language.getNativeName(), String.class))
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? selectById(id) : Mono.empty());
        return execute("update", id, inTransaction(work));
    }

    @Override
    public Mono<Language> findByCode(String code) {
        return queryOne("findByCode", code, "SELECT * FROM languages WHERE code = :code",
                spec -> spec.bind("code", code));
    }

    @Override
    public Mono<Language> findByName(String name) {
        return queryOne("findByName", name, "SELECT * FROM languages WHERE name = :name ORDER BY id",
                spec -> spec.bind("name", name));
    }

    @Override
    public Mono<Boolean> existsByCode(String code) {
        return queryExists("existsByCode", code, "SELECT id FROM languages WHERE code = :code",
                spec -> spec.bind("code", code));
    }

    @Override
    protected Language mapRow(Row row) {
        return Language.builder()
                .id(row.get("id", String.class))
                .name(row.get("name", String.class))
                .code(row.get("code", String.class))
                .nativeName(row.get("native_name", String.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .build();
    }
}
