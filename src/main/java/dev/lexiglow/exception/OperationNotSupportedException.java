package dev.lexiglow.exception;

/**
 * Requested capability is not provided by the active persistence backend.
 */
public class OperationNotSupportedException extends RuntimeException {

    public OperationNotSupportedException(String message) {
        super(message);
    }
}
