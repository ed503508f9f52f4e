package dev.lexiglow.repository;

import java.util.Locale;

/**
 * Storage backends a {@link RepositoryFactory} can be built for.
 */
public enum BackendType {
    RELATIONAL,
    DOCUMENT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
