package dev.lexiglow.repository.relational;

import dev.lexiglow.entity.UserVocabulary;
import dev.lexiglow.repository.VocabularyRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

class RelationalVocabularyRepository extends AbstractRelationalRepository<UserVocabulary> implements VocabularyRepository {

    private static final String INSERT_VOCABULARY =
            "INSERT INTO user_vocabularies (id, user_id, language_id, name, created_at, updated_at) " +
            "VALUES (:id, :userId, :languageId, :name, :createdAt, :updatedAt)";

    private static final String UPDATE_VOCABULARY =
            "UPDATE user_vocabularies SET user_id = :userId, language_id = :languageId, name = :name, " +
            "updated_at = :updatedAt WHERE id = :id";

    RelationalVocabularyRepository(RepositoryContext context, DatabaseClient databaseClient,
                                   TransactionalOperator transactionalOperator) {
        super(context, "UserVocabulary", "user_vocabularies", databaseClient, transactionalOperator);
    }

    @Override
    public Mono<UserVocabulary> create(UserVocabulary vocabulary) {
        LocalDateTime now = now();
        UserVocabulary toInsert = vocabulary.toBuilder()
                .id(vocabulary.getId() != null ? vocabulary.getId() : newId())
                .createdAt(vocabulary.getCreatedAt() != null ? vocabulary.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return execute("create", toInsert.getId(), databaseClient.sql(INSERT_VOCABULARY)
                .bind("id", toInsert.getId())
                .bind("userId", nullable(toInsert.getUserId(), String.class))
                .bind("languageId", nullable(toInsert.getLanguageId(), String.class))
                .bind("name", nullable(toInsert.getName(), String.class))
                .bind("createdAt", toInsert.getCreatedAt())
                .bind("updatedAt", toInsert.getUpdatedAt())
                .fetch()
                .rowsUpdated()
                .thenReturn(toInsert));
    }

    @Override
    public Mono<UserVocabulary> update(String id, UserVocabulary vocabulary) {
        Mono<UserVocabulary> work = databaseClient.sql(UPDATE_VOCABULARY)
                .bind("id", id)
                .bind("userId", nullable(vocabulary.getUserId(), String.class))
                .bind("languageId", nullable(vocabulary.getLanguageId(), String.class))
                .bind("name", nullable(vocabulary.getName(), String.class))
                .bind("updatedAt", now())
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? selectById(id) : Mono.empty());
        return execute("update", id, inTransaction(work));
    }

    @Override
    public Flux<UserVocabulary> findByUser(String userId) {
        return executeMany("findByUser", userId,
                databaseClient.sql("SELECT * FROM user_vocabularies WHERE user_id = :userId ORDER BY id")
                        .bind("userId", userId)
                        .map((row, meta) -> mapRow(row))
                        .all());
    }

    @Override
    public Mono<UserVocabulary> findByUserAndLanguage(String userId, String languageId) {
        return queryOne("findByUserAndLanguage", userId,
                "SELECT * FROM user_vocabularies WHERE user_id = :userId AND language_id = :languageId",
                spec -> spec.bind("userId", userId).bind("languageId", languageId));
    }

    @Override
    protected UserVocabulary mapRow(Row row) {
        return UserVocabulary.builder()
                .id(row.get("id", String.class))
                .userId(row.get("user_id", String.class))
                .languageId(row.get("language_id", String.class))
                .name(row.get("name", String.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
