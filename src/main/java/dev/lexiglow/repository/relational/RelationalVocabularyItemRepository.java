package dev.lexiglow.repository.relational;

import dev.lexiglow.entity.PartOfSpeech;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.UserVocabularyItem;
import dev.lexiglow.entity.VocabularyItemStatus;
import dev.lexiglow.repository.VocabularyItemRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

class RelationalVocabularyItemRepository extends AbstractRelationalRepository<UserVocabularyItem>
        implements VocabularyItemRepository {

    private static final String INSERT_ITEM =
            "INSERT INTO user_vocabulary_items (id, user_vocabulary_id, term, lemma, stem, part_of_speech, frequency, " +
            "status, times_reviewed, confidence_level, notes, created_at, updated_at) " +
            "VALUES (:id, :vocabularyId, :term, :lemma, :stem, :partOfSpeech, :frequency, " +
            ":status, :timesReviewed, :confidence, :notes, :createdAt, :updatedAt)";

    private static final String UPDATE_ITEM =
            "UPDATE user_vocabulary_items SET user_vocabulary_id = :vocabularyId, term = :term, lemma = :lemma, " +
            "stem = :stem, part_of_speech = :partOfSpeech, frequency = :frequency, status = :status, " +
            "times_reviewed = :timesReviewed, confidence_level = :confidence, notes = :notes, " +
            "updated_at = :updatedAt WHERE id = :id";

    private static final String INCREMENT_REVIEWS =
            "UPDATE user_vocabulary_items SET times_reviewed = times_reviewed + 1, updated_at = :updatedAt " +
            "WHERE id = :id";

    RelationalVocabularyItemRepository(RepositoryContext context, DatabaseClient databaseClient,
                                       TransactionalOperator transactionalOperator) {
        super(context, "UserVocabularyItem", "user_vocabulary_items", databaseClient, transactionalOperator);
    }

    @Override
    public Mono<UserVocabularyItem> create(UserVocabularyItem item) {
        LocalDateTime now = now();
        UserVocabularyItem toInsert = item.toBuilder()
                .id(item.getId() != null ? item.getId() : newId())
                .status(item.getStatus() != null ? item.getStatus() : VocabularyItemStatus.NEW)
                .timesReviewed(item.getTimesReviewed() != null ? item.getTimesReviewed() : 0)
                .confidenceLevel(item.getConfidenceLevel() != null ? item.getConfidenceLevel() : ProficiencyLevel.A1)
                .createdAt(item.getCreatedAt() != null ? item.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return execute("create", toInsert.getId(), databaseClient.sql(INSERT_ITEM)
                .bind("id", toInsert.getId())
                .bind("vocabularyId", nullable(toInsert.getUserVocabularyId(), String.class))
                .bind("term", nullable(toInsert.getTerm(), String.class))
                .bind("lemma", nullable(toInsert.getLemma(), String.class))
                .bind("stem", nullable(toInsert.getStem(), String.class))
                .bind("partOfSpeech", nullable(enumName(toInsert.getPartOfSpeech()), String.class))
                .bind("frequency", nullable(toInsert.getFrequency(), Double.class))
                .bind("status", toInsert.getStatus().name())
                .bind("timesReviewed", toInsert.getTimesReviewed())
                .bind("confidence", toInsert.getConfidenceLevel().name())
                .bind("notes", nullable(toInsert.getNotes(), String.class))
                .bind("createdAt", toInsert.getCreatedAt())
                .bind("updatedAt", toInsert.getUpdatedAt())
                .fetch()
                .rowsUpdated()
                .thenReturn(toInsert));
    }

    @Override
    public Mono<UserVocabularyItem> update(String id, UserVocabularyItem item) {
        Mono<UserVocabularyItem> work = databaseClient.sql(UPDATE_ITEM)
                .bind("id", id)
                .bind("vocabularyId", nullable(item.getUserVocabularyId(), String.class))
                .bind("term", nullable(item.getTerm(), String.class))
                .bind("lemma", nullable(item.getLemma(), String.class))
                .bind("stem", nullable(item.getStem(), String.class))
                .bind("partOfSpeech", nullable(enumName(item.getPartOfSpeech()), String.class))
                .bind("frequency", nullable(item.getFrequency(), Double.class))
                .bind("status", nullable(enumName(item.getStatus()), String.class))
                .bind("timesReviewed", nullable(item.getTimesReviewed(), Integer.class))
                .bind("confidence", nullable(enumName(item.getConfidenceLevel()), String.class))
                .bind("notes", nullable(item.getNotes(), String.class))
                .bind("updatedAt", now())
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? selectById(id) : Mono.empty());
        return execute("update", id, inTransaction(work));
    }

    @Override
    public Flux<UserVocabularyItem> findByVocabulary(String vocabularyId, long skip, int limit) {
        return queryPage("findByVocabulary",
                "SELECT * FROM user_vocabulary_items WHERE user_vocabulary_id = :vocabularyId",
                spec -> spec.bind("vocabularyId", vocabularyId), skip, limit);
    }

    @Override
    public Mono<UserVocabularyItem> findByVocabularyAndTerm(String vocabularyId, String term) {
        return queryOne("findByVocabularyAndTerm", vocabularyId,
                "SELECT * FROM user_vocabulary_items WHERE user_vocabulary_id = :vocabularyId AND term = :term",
                spec -> spec.bind("vocabularyId", vocabularyId).bind("term", term));
    }

    @Override
    public Mono<Boolean> existsByVocabularyAndTerm(String vocabularyId, String term) {
        return queryExists("existsByVocabularyAndTerm", vocabularyId,
                "SELECT id FROM user_vocabulary_items WHERE user_vocabulary_id = :vocabularyId AND term = :term",
                spec -> spec.bind("vocabularyId", vocabularyId).bind("term", term));
    }

    @Override
    public Mono<UserVocabularyItem> incrementReviewCount(String id) {
        Mono<UserVocabularyItem> work = databaseClient.sql(INCREMENT_REVIEWS)
                .bind("id", id)
                .bind("updatedAt", now())
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? selectById(id) : Mono.empty());
        return execute("incrementReviewCount", id, inTransaction(work));
    }

    @Override
    protected UserVocabularyItem mapRow(Row row) {
        return UserVocabularyItem.builder()
                .id(row.get("id", String.class))
                .userVocabularyId(row.get("user_vocabulary_id", String.class))
                .term(row.get("term", String.class))
                .lemma(row.get("lemma", String.class))
                .stem(row.get("stem", String.class))
                .partOfSpeech(toEnum(PartOfSpeech.class, row.get("part_of_speech", String.class)))
                .frequency(row.get("frequency", Double.class))
                .status(toEnum(VocabularyItemStatus.class, row.get("status", String.class)))
                .timesReviewed(row.get("times_reviewed", Integer.class))
                .confidenceLevel(toEnum(ProficiencyLevel.class, row.get("confidence_level", String.class)))
                .notes(row.get("notes", String.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
