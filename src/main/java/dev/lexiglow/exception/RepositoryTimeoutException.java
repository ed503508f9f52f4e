package dev.lexiglow.exception;

public class RepositoryTimeoutException extends PersistenceException {

    public RepositoryTimeoutException(String operation, String entityType, String entityId, Throwable cause) {
        super(operation, entityType, entityId, describe(operation, entityType, entityId) + ": timed out", cause);
    }
}
