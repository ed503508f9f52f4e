package dev.lexiglow.repository.relational;

import dev.lexiglow.entity.TextTag;
import dev.lexiglow.repository.TextTagRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

class RelationalTextTagRepository extends AbstractRelationalRepository<TextTag> implements TextTagRepository {

    private static final String INSERT_TAG =
            "INSERT INTO text_tags (id, name, description) VALUES (:id, :name, :description)";

    private static final String UPDATE_TAG =
            "UPDATE text_tags SET name = :name, description = :description WHERE id = :id";

    RelationalTextTagRepository(RepositoryContext context, DatabaseClient databaseClient,
                                TransactionalOperator transactionalOperator) {
        super(context, "TextTag", "text_tags", databaseClient, transactionalOperator);
    }

    @Override
    public Mono<TextTag> create(TextTag tag) {
        TextTag toInsert = tag.toBuilder()
                .id(tag.getId() != null ? tag.getId() : newId())
                .build();
        return execute("create", toInsert.getId(), databaseClient.sql(INSERT_TAG)
                .bind("id", toInsert.getId())
                .bind("name", nullable(toInsert.getName(), String.class))
                .bind("description", nullable(toInsert.getDescription(), String.class))
                .fetch()
                .rowsUpdated()
                .thenReturn(toInsert));
    }

    @Override
    public Mono<TextTag> update(String id, TextTag tag) {
        Mono<TextTag> work = databaseClient.sql(UPDATE_TAG)
                .bind("id", id)
                .bind("name", nullable(tag.getName(), String.class))
                .bind("description", nullable(tag.getDescription(), String.class))
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> rows > 0 ? selectById(id) : Mono.empty());
        return execute("update", id, inTransaction(work));
    }

    @Override
    public Mono<TextTag> findByName(String name) {
        return queryOne("findByName", name, "SELECT * FROM text_tags WHERE name = :name",
                spec -> spec.bind("name", name));
    }

    @Override
    public Mono<Boolean> existsByName(String name) {
        return queryExists("existsByName", name, "SELECT id FROM text_tags WHERE name = :name",
                spec -> spec.bind("name", name));
    }

    @Override
    protected TextTag mapRow(Row row) {
        return TextTag.builder()
                .id(row.get("id", String.class))
                .name(row.get("name", String.class))
                .description(row.get("description", String.class))
                .build();
    }
}
