package dev.lexiglow.exception;

import lombok.Getter;

/**
 * A write violated a uniqueness or referential constraint.
 */
@Getter
public class ConflictException extends PersistenceException {

    public enum Reason {
        /** Unique constraint (code, email, username, tag name, ...). */
        DUPLICATE,
        /** Foreign key or other integrity constraint. */
        INTEGRITY
    }

    private final Reason reason;

    public ConflictException(Reason reason, String operation, String entityType, String entityId, Throwable cause) {
        super(operation, entityType, entityId,
                describe(operation, entityType, entityId) + (reason == Reason.DUPLICATE
                        ? ": duplicate value violates a unique constraint"
                        : ": referential integrity violation"),
                cause);
        this.reason = reason;
    }

    protected ConflictException(String entityType, String message) {
        super("create", entityType, null, message, null);
        this.reason = Reason.DUPLICATE;
    }
}
