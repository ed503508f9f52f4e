package dev.lexiglow.exception;

/**
 * Invalid persistence configuration detected at start-up. Not recoverable.
 */
public class PersistenceConfigurationException extends RuntimeException {

    public PersistenceConfigurationException(String message) {
        super(message);
    }

    public PersistenceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
