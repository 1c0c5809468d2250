package de.prgrm.cypher.ogm.runtime.errors;

public class NotFoundException extends OgmException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
