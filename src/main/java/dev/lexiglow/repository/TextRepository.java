package dev.lexiglow.repository;

import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.Text;
import dev.lexiglow.entity.TextTagAssociation;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Texts and their tag links. All finders are paginated and ordered by id.
 */
public interface TextRepository extends EntityRepository<Text> {

    Flux<Text> findByLanguage(String languageId, long skip, int limit);

    Flux<Text> findByUser(String userId, long skip, int limit);

    Flux<Text> findByProficiencyLevel(ProficiencyLevel level, long skip, int limit);

    Flux<Text> findPublic(long skip, int limit);

    /**
     * Case-insensitive substring match on the title, across public and private texts.
     * Wildcard characters in {@code query} match literally.
     */
    Flux<Text> searchByTitle(String query, long skip, int limit);

    /**
     * Texts carrying at least one of the given tags, each text once.
     * An empty tag collection yields nothing.
     */
    Flux<Text> findByTags(Collection<String> tagIds, long skip, int limit);

    /**
     * Links a tag to a text. Linking an already linked tag is a no-op.
     *
     * @return {@code false} if the text does not exist
     */
    Mono<Boolean> addTag(String textId, String tagId);

    /**
     * @return {@code true} if a link was removed
     */
    Mono<Boolean> removeTag(String textId, String tagId);

    /**
     * Links held by a text, ordered by tag id.
     */
    Flux<TextTagAssociation> findTagLinks(String textId);

    default Flux<String> findTagIds(String textId) {
        return findTagLinks(textId).map(TextTagAssociation::tagId);
    }
}
