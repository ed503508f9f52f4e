package dev.lexiglow.repository.document;

import dev.lexiglow.entity.PartOfSpeech;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.UserVocabularyItem;
import dev.lexiglow.entity.VocabularyItemStatus;
import dev.lexiglow.repository.VocabularyItemRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import org.bson.Document;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

import static dev.lexiglow.repository.document.DocumentValues.ID;
import static dev.lexiglow.repository.document.DocumentValues.enumName;
import static dev.lexiglow.repository.document.DocumentValues.getDateTime;
import static dev.lexiglow.repository.document.DocumentValues.getDouble;
import static dev.lexiglow.repository.document.DocumentValues.getEnum;
import static dev.lexiglow.repository.document.DocumentValues.getInteger;
import static dev.lexiglow.repository.document.DocumentValues.toDate;

class DocumentVocabularyItemRepository extends AbstractDocumentRepository<UserVocabularyItem>
        implements VocabularyItemRepository {

    DocumentVocabularyItemRepository(RepositoryContext context, ReactiveMongoTemplate template) {
        super(context, "UserVocabularyItem", template, DocumentCollections.VOCABULARY_ITEMS, true);
    }

    @Override
    public Mono<UserVocabularyItem> create(UserVocabularyItem item) {
        LocalDateTime now = now();
        UserVocabularyItem prepared = item.toBuilder()
                .id(item.getId() != null ? item.getId() : newId())
                .status(item.getStatus() != null ? item.getStatus() : VocabularyItemStatus.NEW)
                .timesReviewed(item.getTimesReviewed() != null ? item.getTimesReviewed() : 0)
                .confidenceLevel(item.getConfidenceLevel() != null ? item.getConfidenceLevel() : ProficiencyLevel.A1)
                .createdAt(item.getCreatedAt() != null ? item.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        return insert(prepared.getId(), prepared);
    }

    @Override
    public Flux<UserVocabularyItem> findByVocabulary(String vocabularyId, long skip, int limit) {
        return queryPage("findByVocabulary", Query.query(Criteria.where("userVocabularyId").is(vocabularyId)),
                skip, limit);
    }

    @Override
    public Mono<UserVocabularyItem> findByVocabularyAndTerm(String vocabularyId, String term) {
        return queryOne("findByVocabularyAndTerm", vocabularyId,
                Query.query(Criteria.where("userVocabularyId").is(vocabularyId).and("term").is(term)));
    }

    @Override
    public Mono<Boolean> existsByVocabularyAndTerm(String vocabularyId, String term) {
        return queryExists("existsByVocabularyAndTerm", vocabularyId,
                Query.query(Criteria.where("userVocabularyId").is(vocabularyId).and("term").is(term)));
    }

    @Override
    public Mono<UserVocabularyItem> incrementReviewCount(String id) {
        Update update = new Update()
                .inc("timesReviewed", 1)
                .set("updatedAt", toDate(now()));
        return execute("incrementReviewCount", id, template.findAndModify(byId(id), update,
                        FindAndModifyOptions.options().returnNew(true), Document.class, collection)
                .map(this::toEntity));
    }

    @Override
    protected Document toDocument(UserVocabularyItem item) {
        return new Document(ID, item.getId())
                .append("userVocabularyId", item.getUserVocabularyId())
                .append("term", item.getTerm())
                .append("lemma", item.getLemma())
                .append("stem", item.getStem())
                .append("partOfSpeech", enumName(item.getPartOfSpeech()))
                .append("frequency", item.getFrequency())
                .append("status", enumName(item.getStatus()))
                .append("timesReviewed", item.getTimesReviewed())
                .append("confidenceLevel", enumName(item.getConfidenceLevel()))
                .append("notes", item.getNotes())
                .append("createdAt", toDate(item.getCreatedAt()))
                .append("updatedAt", toDate(item.getUpdatedAt()));
    }

    @Override
    protected UserVocabularyItem toEntity(Document document) {
        return UserVocabularyItem.builder()
                .id(document.getString(ID))
                .userVocabularyId(document.getString("userVocabularyId"))
                .term(document.getString("term"))
                .lemma(document.getString("lemma"))
                .stem(document.getString("stem"))
                .partOfSpeech(getEnum(document, "partOfSpeech", PartOfSpeech.class))
                .frequency(getDouble(document, "frequency"))
                .status(getEnum(document, "status", VocabularyItemStatus.class))
                .timesReviewed(getInteger(document, "timesReviewed"))
                .confidenceLevel(getEnum(document, "confidenceLevel", ProficiencyLevel.class))
                .notes(document.getString("notes"))
                .createdAt(getDateTime(document, "createdAt"))
                .updatedAt(getDateTime(document, "updatedAt"))
                .build();
    }
}
