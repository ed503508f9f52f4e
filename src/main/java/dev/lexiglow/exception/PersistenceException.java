package dev.lexiglow.exception;

import lombok.Getter;

/**
 * Storage failure raised by a repository. Carries the failed operation, the entity type
 * and, when known, the entity id so callers and logs can identify what went wrong.
 */
@Getter
public class PersistenceException extends RuntimeException {

    private final String operation;
    private final String entityType;
    private final String entityId;

    public PersistenceException(String operation, String entityType, String entityId, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public PersistenceException(String operation, String entityType, String entityId, Throwable cause) {
        this(operation, entityType, entityId, describe(operation, entityType, entityId), cause);
    }

    protected static String describe(String operation, String entityType, String entityId) {
        StringBuilder sb = new StringBuilder()
                .append(operation).append(" failed for ").append(entityType);
        if (entityId != null) {
            sb.append(" '").append(entityId).append("'");
        }
        return sb.toString();
    }
}
