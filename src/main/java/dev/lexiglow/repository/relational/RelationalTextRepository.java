package dev.lexiglow.repository.relational;

import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.Text;
import dev.lexiglow.entity.TextTagAssociation;
import dev.lexiglow.repository.TextRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

class RelationalTextRepository extends AbstractRelationalRepository<Text> implements TextRepository {

    private static final String INSERT_TEXT =
            "INSERT INTO texts (id, title, content, language_id, user_id, proficiency_level, word_count, " +
            "is_public, source, created_at, updated_at) " +
            "VALUES (:id, :title, :content, :languageId, :userId, :level, :wordCount, " +
            ":isPublic, :source, :createdAt, :updatedAt)";

    private static final String UPDATE_TEXT =
            "UPDATE texts SET title = :title, content = :content, language_id = :languageId, user_id = :userId, " +
            "proficiency_level = :level, word_count = :wordCount, is_public = :isPublic, source = :source, " +
            "updated_at = :updatedAt WHERE id = :id";

    private static final String SELECT_BY_TAGS =
            "SELECT DISTINCT t.* FROM texts t " +
            "JOIN text_tag_associations a ON a.text_id = t.id WHERE a.tag_id IN (:tagIds)";

    private static final String SELECT_TAG_LINK =
            "SELECT tag_id FROM text_tag_associations WHERE text_id = :textId AND tag_id = :tagId";

    private static final String INSERT_TAG_LINK =
            "INSERT INTO text_tag_associations (text_id, tag_id) VALUES (:textId, :tagId)";

    private static final String DELETE_TAG_LINK =
            "DELETE FROM text_tag_associations WHERE text_id = :textId AND tag_id = :tagId";

    private static final String SELECT_TAG_LINKS =
            "SELECT text_id, tag_id FROM text_tag_associations WHERE text_id = :textId ORDER BY tag_id";

    RelationalTextRepository(RepositoryContext context, DatabaseClient databaseClient,
                             TransactionalOperator transactionalOperator) {
        super(context, "Text", "texts", databaseClient, transactionalOperator);
    }

    @Override
    public Mono<Text> create(Text text) {
        LocalDateTime now = now();
        Text toInsert = text.toBuilder()
                .id(text.getId() != null ? text.getId() : newId())
                .isPublic(text.getIsPublic() != null ? text.getIsPublic() : Boolean.TRUE)
                .createdAt(text.getCreatedAt() != null ? text.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return execute("create", toInsert.getId(), databaseClient.sql(INSERT_TEXT)
                .bind("id", toInsert.getId())
                .bind("title", nullable(toInsert.getTitle(), String.class))
                .bind("content", nullable(toInsert.getContent(), String.class))
                .bind("languageId", nullable(toInsert.getLanguageId(), String.class))
                .bind("userId", nullable(toInsert.getUserId(), String.class))
                .bind("level", nullable(enumName(toInsert.getProficiencyLevel()), String.class))
                .bind("wordCount", nullable(toInsert.getWordCount(), Integer.class))
                .bind("isPublic", toInsert.getIsPublic())
                .bind("source", nullable(toInsert.getSource(), String.class))
                .bind("createdAt", toInsert.getCreatedAt())
                .bind("updatedAt", toInsert.getUpdatedAt())
                .fetch()
                .rowsUpdated()
                .thenReturn(toInsert));
    }

    @Override
    public Mono<Text> update(String id, Text text) {
        Mono<Text> work = databaseClient.sql(UPDATE_TEXT)
                .bind("id", id)
                .bind("title", nullable(text.getTitle(), String.class))
                .bind("content", nullable(text.getContent(), String.class))
                .bind("languageId", nullable(text.getLanguageId(), String.class))
                .bind("userId", nullable(text.getUserId(), String.class))
                .bind("level", nullable(enumName(text.getProficiencyLevel()), String.class))
                .bind("wordCount", nullable(text.getWordCount(), Integer.class))
                .bind("isPublic", text.getIsPublic() != null ? text.getIsPublic() : Boolean.TRUE)
                .bind("source", nullable(text.getSource(), String.class))
                .bind("updatedAt", now())
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? selectById(id) : Mono.empty());
        return execute("update", id, inTransaction(work));
    }

    @Override
    public Flux<Text> findByLanguage(String languageId, long skip, int limit) {
        return queryPage("findByLanguage", "SELECT * FROM texts WHERE language_id = :languageId",
                spec -> spec.bind("languageId", languageId), skip, limit);
    }

    @Override
    public Flux<Text> findByUser(String userId, long skip, int limit) {
        return queryPage("findByUser", "SELECT * FROM texts WHERE user_id = :userId",
                spec -> spec.bind("userId", userId), skip, limit);
    }

    @Override
    public Flux<Text> findByProficiencyLevel(ProficiencyLevel level, long skip, int limit) {
        return queryPage("findByProficiencyLevel", "SELECT * FROM texts WHERE proficiency_level = :level",
                spec -> spec.bind("level", level.name()), skip, limit);
    }

    @Override
    public Flux<Text> findPublic(long skip, int limit) {
        return queryPage("findPublic", "SELECT * FROM texts WHERE is_public = TRUE",
                spec -> spec, skip, limit);
    }

    @Override
    public Flux<Text> searchByTitle(String query, long skip, int limit) {
        String pattern = "%" + escapeLike(query.toLowerCase(Locale.ROOT)) + "%";
        return queryPage("searchByTitle", "SELECT * FROM texts WHERE LOWER(title) LIKE :pattern ESCAPE '\\'",
                spec -> spec.bind("pattern", pattern), skip, limit);
    }

    @Override
    public Flux<Text> findByTags(Collection<String> tagIds, long skip, int limit) {
        checkPage(skip, limit);
        if (tagIds == null || tagIds.isEmpty()) {
            return Flux.empty();
        }
        List<String> ids = List.copyOf(tagIds);
        return queryPage("findByTags", SELECT_BY_TAGS, spec -> spec.bind("tagIds", ids), skip, limit);
    }

    @Override
    public Mono<Boolean> addTag(String textId, String tagId) {
        Mono<Boolean> work = selectById(textId)
                .flatMap(text -> databaseClient.sql(SELECT_TAG_LINK)
                        .bind("textId", textId)
                        .bind("tagId", tagId)
                        .map((row, meta) -> Boolean.TRUE)
                        .first()
                        .switchIfEmpty(databaseClient.sql(INSERT_TAG_LINK)
                                .bind("textId", textId)
                                .bind("tagId", tagId)
                                .fetch()
                                .rowsUpdated()
                                .thenReturn(Boolean.TRUE)))
                .defaultIfEmpty(Boolean.FALSE);
        return execute("addTag", textId, inTransaction(work));
    }

    @Override
    public Mono<Boolean> removeTag(String textId, String tagId) {
        return execute("removeTag", textId, databaseClient.sql(DELETE_TAG_LINK)
                .bind("textId", textId)
                .bind("tagId", tagId)
                .fetch()
                .rowsUpdated()
                .map(rows -> rows > 0));
    }

    @Override
    public Flux<TextTagAssociation> findTagLinks(String textId) {
        return executeMany("findTagLinks", textId, databaseClient.sql(SELECT_TAG_LINKS)
                .bind("textId", textId)
                .map((row, meta) -> new TextTagAssociation(row.get("text_id", String.class), row.get("tag_id", String.class)))
                .all());
    }

    /**
     * Escapes LIKE wildcards so they match literally (escape character is backslash).
     */
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    @Override
    protected Text mapRow(Row row) {
        return Text.builder()
                .id(row.get("id", String.class))
                .title(row.get("title", String.class))
                .content(row.get("content", String.class))
                .languageId(row.get("language_id", String.class))
                .userId(row.get("user_id", String.class))
                .proficiencyLevel(toEnum(ProficiencyLevel.class, row.get("proficiency_level", String.class)))
                .wordCount(row.get("word_count", Integer.class))
                .isPublic(row.get("is_public", Boolean.class))
                .source(row.get("source", String.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
