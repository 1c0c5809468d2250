package de.prgrm.cypher.ogm.runtime.errors;

/**
 * Root of every exception thrown by the mapper and the query builders.
 */
public class OgmException extends RuntimeException {
    public OgmException(String message) {
        super(message);
    }

    public OgmException(String message, Throwable cause) {
        super(message, cause);
    }
}
