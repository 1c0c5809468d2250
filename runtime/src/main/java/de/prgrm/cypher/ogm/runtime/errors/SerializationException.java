package de.prgrm.cypher.ogm.runtime.errors;

/**
 * A value has no Cypher literal form.
 */
public class SerializationException extends OgmException {
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
