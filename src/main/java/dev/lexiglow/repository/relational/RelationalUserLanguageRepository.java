package dev.lexiglow.repository.relational;

import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.UserLanguage;
import dev.lexiglow.repository.UserLanguageRepository;
import dev.lexiglow.repository.support.ReactiveRepositorySupport;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.Parameter;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

class RelationalUserLanguageRepository extends ReactiveRepositorySupport implements UserLanguageRepository {

    private static final String SELECT_ONE =
            "SELECT * FROM user_languages WHERE user_id = :userId AND language_id = :languageId";

    private static final String UPDATE_ONE =
            "UPDATE user_languages SET proficiency_level = :level, " +
            "started_at = COALESCE(CAST(:startedAt AS TIMESTAMP), started_at), updated_at = :updatedAt " +
            "WHERE user_id = :userId AND language_id = :languageId";

    private static final String INSERT_ONE =
            "INSERT INTO user_languages (user_id, language_id, proficiency_level, started_at, created_at, updated_at) " +
            "VALUES (:userId, :languageId, :level, :startedAt, :createdAt, :updatedAt)";

    private static final String DELETE_ONE =
            "DELETE FROM user_languages WHERE user_id = :userId AND language_id = :languageId";

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;

    RelationalUserLanguageRepository(RepositoryContext context, DatabaseClient databaseClient,
                                     TransactionalOperator transactionalOperator) {
        super(context, "UserLanguage");
        this.databaseClient = databaseClient;
        this.transactionalOperator = transactionalOperator;
    }

    @Override
    public Mono<UserLanguage> save(UserLanguage userLanguage) {
        LocalDateTime now = now();
        String userId = userLanguage.getUserId();
        String languageId = userLanguage.getLanguageId();
        ProficiencyLevel level = userLanguage.getProficiencyLevel() != null
                ? userLanguage.getProficiencyLevel() : ProficiencyLevel.A1;
        LocalDateTime startedAt = userLanguage.getStartedAt() != null ? userLanguage.getStartedAt() : now;

        // an existing pair keeps its start date unless a new one is given
        Mono<UserLanguage> work = databaseClient.sql(UPDATE_ONE)
                .bind("userId", userId)
                .bind("languageId", languageId)
                .bind("level", level.name())
                .bind("startedAt", Parameter.fromOrEmpty(userLanguage.getStartedAt(), LocalDateTime.class))
                .bind("updatedAt", now)
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? Mono.just(rows) : databaseClient.sql(INSERT_ONE)
                        .bind("userId", userId)
                        .bind("languageId", languageId)
                        .bind("level", level.name())
                        .bind("startedAt", startedAt)
                        .bind("createdAt", userLanguage.getCreatedAt() != null ? userLanguage.getCreatedAt() : now)
                        .bind("updatedAt", now)
                        .fetch()
                        .rowsUpdated())
                .then(selectOne(userId, languageId));
        return execute("save", userId + "/" + languageId, work.as(transactionalOperator::transactional));
    }

    @Override
    public Mono<UserLanguage> find(String userId, String languageId) {
        return execute("find", userId + "/" + languageId, selectOne(userId, languageId));
    }

    @Override
    public Flux<UserLanguage> findByUser(String userId) {
        return executeMany("findByUser", userId,
                databaseClient.sql("SELECT * FROM user_languages WHERE user_id = :userId ORDER BY language_id")
                        .bind("userId", userId)
                        .map((row, meta) -> mapRow(row))
                        .all());
    }

    @Override
    public Mono<Boolean> delete(String userId, String languageId) {
        return execute("delete", userId + "/" + languageId, databaseClient.sql(DELETE_ONE)
                .bind("userId", userId)
                .bind("languageId", languageId)
                .fetch()
                .rowsUpdated()
                .map(rows -> rows > 0));
    }

    private Mono<UserLanguage> selectOne(String userId, String languageId) {
        return databaseClient.sql(SELECT_ONE)
                .bind("userId", Parameter.fromOrEmpty(userId, String.class))
                .bind("languageId", Parameter.fromOrEmpty(languageId, String.class))
                .map((row, meta) -> mapRow(row))
                .one();
    }

    private UserLanguage mapRow(Row row) {
        return UserLanguage.builder()
                .userId(row.get("user_id", String.class))
                .languageId(row.get("language_id", String.class))
                .proficiencyLevel(ProficiencyLevel.valueOf(row.get("proficiency_level", String.class)))
                .startedAt(row.get("started_at", LocalDateTime.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
