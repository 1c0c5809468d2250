package de.prgrm.cypher.ogm.runtime.errors;

public class ValidationException extends OgmException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
