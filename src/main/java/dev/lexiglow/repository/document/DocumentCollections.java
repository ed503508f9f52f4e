package dev.lexiglow.repository.document;

/**
 * Collection names of the document backend.
 */
final class DocumentCollections {

    static final String LANGUAGES = "languages";
    static final String USERS = "users";
    static final String USER_LANGUAGES = "user_languages";
    static final String TEXTS = "texts";
    static final String TEXT_TAGS = "text_tags";
    static final String VOCABULARIES = "user_vocabularies";
    static final String VOCABULARY_ITEMS = "user_vocabulary_items";

    private DocumentCollections() {
    }
}
