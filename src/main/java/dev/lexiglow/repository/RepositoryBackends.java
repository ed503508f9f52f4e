package dev.lexiglow.repository;

import dev.lexiglow.config.PersistenceProperties;
import dev.lexiglow.exception.PersistenceConfigurationException;
import dev.lexiglow.repository.document.DocumentRepositoryBackend;
import dev.lexiglow.repository.relational.RelationalRepositoryBackend;
import dev.lexiglow.repository.support.RepositoryContext;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Builds and prepares the backend selected by {@link PersistenceProperties}.
 */
@Slf4j
public final class RepositoryBackends {

    private static final Duration INITIALIZATION_TIMEOUT = Duration.ofSeconds(60);

    private RepositoryBackends() {
    }

    /**
     * Validates the settings, opens the backend and applies schema or indexes.
     *
     * @throws PersistenceConfigurationException if the settings are invalid or the store
     *         cannot be prepared
     */
    public static RepositoryBackend open(PersistenceProperties properties, RepositoryContext context) {
        BackendType type = properties.validate();
        if (type != context.backend()) {
            throw new PersistenceConfigurationException(
                    "Repository context is for " + context.backend().label() + " but " + type.label() + " was configured");
        }
        log.info("Opening {} persistence backend", type.label());
        RepositoryBackend backend;
        Mono<Void> initialization;
        if (type == BackendType.RELATIONAL) {
            RelationalRepositoryBackend relational = new RelationalRepositoryBackend(properties, context);
            initialization = properties.isInitializeSchema() ? relational.initializeSchema() : Mono.empty();
            backend = relational;
        } else {
            DocumentRepositoryBackend document = new DocumentRepositoryBackend(properties, context);
            initialization = document.ensureIndexes();
            backend = document;
        }
        try {
            initialization.block(INITIALIZATION_TIMEOUT);
        } catch (RuntimeException e) {
            backend.close();
            throw new PersistenceConfigurationException("Failed to prepare the " + type.label() + " store", e);
        }
        return backend;
    }
}
