package de.prgrm.cypher.ogm.runtime.errors;

public class ConstraintViolationException extends DatabaseException {
    public ConstraintViolationException(String message) {
        super(message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
