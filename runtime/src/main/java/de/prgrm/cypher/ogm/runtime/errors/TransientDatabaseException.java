package de.prgrm.cypher.ogm.runtime.errors;

public class TransientDatabaseException extends DatabaseException {
    public TransientDatabaseException(String message) {
        super(message);
    }

    public TransientDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
