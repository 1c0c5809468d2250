package de.prgrm.cypher.ogm.runtime.errors;

/**
 * The API was called in a way that can never produce a valid query. Always raised before any
 * statement is sent to the database.
 */
public class UsageException extends OgmException {
    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
