package de.prgrm.cypher.ogm.runtime.errors;

public class OnDiskPropertyDatabaseNotDefinedException extends UsageException {
    public OnDiskPropertyDatabaseNotDefinedException(String message) {
        super(message);
    }

    public OnDiskPropertyDatabaseNotDefinedException(String message, Throwable cause) {
        super(message, cause);
    }
}
