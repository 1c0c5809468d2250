package de.prgrm.cypher.ogm.runtime.errors;

public class AmbiguousDispatchException extends OgmException {
    public AmbiguousDispatchException(String message) {
        super(message);
    }

    public AmbiguousDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
