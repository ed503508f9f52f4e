package dev.lexiglow.repository.relational;

import dev.lexiglow.entity.User;
import dev.lexiglow.repository.UserRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

class RelationalUserRepository extends AbstractRelationalRepository<User> implements UserRepository {

    private static final String INSERT_USER =
            "INSERT INTO users (id, email, username, password_hash, first_name, last_name, " +
            "native_language_id, current_language_id, created_at, updated_at, last_active_at) " +
            "VALUES (:id, :email, :username, :passwordHash, :firstName, :lastName, " +
            ":nativeLanguageId, :currentLanguageId, :createdAt, :updatedAt, :lastActiveAt)";

    private static final String UPDATE_USER =
            "UPDATE users SET email = :email, username = :username, password_hash = :passwordHash, " +
            "first_name = :firstName, last_name = :lastName, native_language_id = :nativeLanguageId, " +
            "current_language_id = :currentLanguageId, updated_at = :updatedAt, last_active_at = :lastActiveAt " +
            "WHERE id = :id";

    private static final String UPDATE_LAST_ACTIVE =
            "UPDATE users SET last_active_at = :lastActiveAt WHERE id = :id";

    RelationalUserRepository(RepositoryContext context, DatabaseClient databaseClient,
                             TransactionalOperator transactionalOperator) {
        super(context, "User", "users", databaseClient, transactionalOperator);
    }

    @Override
    public Mono<User> create(User user) {
        LocalDateTime now = now();
        User toInsert = user.toBuilder()
                .id(user.getId() != null ? user.getId() : newId())
                .createdAt(user.getCreatedAt() != null ? user.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return execute("create", toInsert.getId(), databaseClient.sql(INSERT_USER)
                .bind("id", toInsert.getId())
                .bind("email", nullable(toInsert.getEmail(), String.class))
                .bind("username", nullable(toInsert.getUsername(), String.class))
                .bind("passwordHash", nullable(toInsert.getPasswordHash(), String.class))
                .bind("firstName", nullable(toInsert.getFirstName(), String.class))
                .bind("lastName", nullable(toInsert.getLastName(), String.class))
                .bind("nativeLanguageId", nullable(toInsert.getNativeLanguageId(), String.class))
                .bind("currentLanguageId", nullable(toInsert.getCurrentLanguageId(), String.class))
                .bind("createdAt", toInsert.getCreatedAt())
                .bind("updatedAt", toInsert.getUpdatedAt())
                .bind("lastActiveAt", nullable(toInsert.getLastActiveAt(), LocalDateTime.class))
                .fetch()
                .rowsUpdated()
                .thenReturn(toInsert));
    }

    @Override
    public Mono<User> update(String id, User user) {
        Mono<User> work = databaseClient.sql(UPDATE_USER)
                .bind("id", id)
                .bind("email", nullable(user.getEmail(), String.class))
                .bind("username", nullable(user.getUsername(), String.class))
                .bind("passwordHash", nullable(user.getPasswordHash(), String.class))
                .bind("firstName", nullable(user.getFirstName(), String.class))
                .bind("lastName", nullable(user.getLastName(), String.class))
                .bind("nativeLanguageId", nullable(user.getNativeLanguageId(), String.class))
                .bind("currentLanguageId", nullable(user.getCurrentLanguageId(), String.class))
                .bind("updatedAt", now())
                .bind("lastActiveAt", nullable(user.getLastActiveAt(), LocalDateTime.class))
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? selectById(id) : Mono.empty());
        return execute("update", id, inTransaction(work));
    }

    @Override
    public Mono<User> findByEmail(String email) {
        return queryOne("findByEmail", email, "SELECT * FROM users WHERE email = :email",
                spec -> spec.bind("email", email));
    }

    @Override
    public Mono<User> findByUsername(String username) {
        return queryOne("findByUsername", username, "SELECT * FROM users WHERE username = :username",
                spec -> spec.bind("username", username));
    }

    @Override
    public Mono<Boolean> existsByEmail(String email) {
        return queryExists("existsByEmail", email, "SELECT id FROM users WHERE email = :email",
                spec -> spec.bind("email", email));
    }

    @Override
    public Mono<Boolean> existsByUsername(String username) {
        return queryExists("existsByUsername", username, "SELECT id FROM users WHERE username = :username",
                spec -> spec.bind("username", username));
    }

    @Override
    public Mono<Boolean> updateLastActive(String id) {
        return execute("updateLastActive", id, databaseClient.sql(UPDATE_LAST_ACTIVE)
                .bind("id", id)
                .bind("lastActiveAt", now())
                .fetch()
                .rowsUpdated()
                .map(rows -> rows > 0));
    }

    @Override
    protected User mapRow(Row row) {
        return User.builder()
                .id(row.get("id", String.class))
                .email(row.get("email", String.class))
                .username(row.get("username", String.class))
                .passwordHash(row.get("password_hash", String.class))
                .firstName(row.get("first_name", String.class))
                .lastName(row.get("last_name", String.class))
                .nativeLanguageId(row.get("native_language_id", String.class))
                .currentLanguageId(row.get("current_language_id", String.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .lastActiveAt(row.get("last_active_at", LocalDateTime.class))
                .build();
    }
}
