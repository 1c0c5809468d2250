package de.prgrm.cypher.ogm.runtime.errors;

/**
 * Raised when the database or the driver rejects a statement. The message always contains the
 * original server message.
 */
public class DatabaseException extends OgmException {
    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
