package dev.fumaz.conduit.exception;

/**
 * Base unchecked exception for Conduit-specific failures.
 */
public class ConduitException extends RuntimeException {

    public ConduitException(String message) {
        super(message);
    }

    public ConduitException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConduitException(Throwable cause) {
        super(cause);
    }
}
