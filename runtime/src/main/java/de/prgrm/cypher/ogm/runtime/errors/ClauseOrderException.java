package de.prgrm.cypher.ogm.runtime.errors;

public class ClauseOrderException extends UsageException {
    public ClauseOrderException(String message) {
        super(message);
    }

    public ClauseOrderException(String message, Throwable cause) {
        super(message, cause);
    }
}
