package dev.lexiglow.config;

import dev.lexiglow.exception.PersistenceConfigurationException;
import dev.lexiglow.repository.BackendType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Locale;

/**
 * Persistence settings under {@code app.persistence}.
 *
 * <p>{@code backend} is kept as text so an unknown value is reported as a
 * {@link PersistenceConfigurationException} naming the accepted values.</p>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.persistence")
public class PersistenceProperties {

    /** {@code relational} or {@code document}. */
    private String backend;

    /** R2DBC URL or MongoDB connection string, depending on the backend. */
    private String url;

    private String username;

    private String password;

    /** MongoDB database name. */
    private String database = "lexiglow";

    private Duration queryTimeout = Duration.ofSeconds(5);

    /** Apply {@code db/schema.sql} on start-up (relational only). */
    private boolean initializeSchema = true;

    private Pool pool = new Pool();

    @Getter
    @Setter
    public static class Pool {
        private int initialSize = 2;
        private int maxSize = 10;
        private Duration maxIdleTime = Duration.ofMinutes(30);
    }

    /**
     * Checks the settings and returns the selected backend.
     *
     * @throws PersistenceConfigurationException if a required setting is missing or invalid
     */
    public BackendType validate() {
        if (backend == null || backend.isBlank()) {
            throw new PersistenceConfigurationException("app.persistence.backend is required (relational | document)");
        }
        BackendType type;
        try {
            type = BackendType.valueOf(backend.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PersistenceConfigurationException(
                    "Unsupported persistence backend '" + backend + "' (expected relational | document)", e);
        }
        if (url == null || url.isBlank()) {
            throw new PersistenceConfigurationException("app.persistence.url is required for the " + type.label() + " backend");
        }
        if (type == BackendType.RELATIONAL && !url.startsWith("r2dbc:")) {
            throw new PersistenceConfigurationException("Relational backend expects an r2dbc: URL");
        }
        if (type == BackendType.DOCUMENT && !(url.startsWith("mongodb://") || url.startsWith("mongodb+srv://"))) {
            throw new PersistenceConfigurationException("Document backend expects a mongodb:// connection string");
        }
        if (type == BackendType.DOCUMENT && (database == null || database.isBlank())) {
            throw new PersistenceConfigurationException("app.persistence.database is required for the document backend");
        }
        if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new PersistenceConfigurationException("app.persistence.query-timeout must be positive");
        }
        if (pool.getMaxSize() < 1 || pool.getInitialSize() < 0 || pool.getInitialSize() > pool.getMaxSize()) {
            throw new PersistenceConfigurationException("app.persistence.pool sizes are inconsistent");
        }
        return type;
    }
}
