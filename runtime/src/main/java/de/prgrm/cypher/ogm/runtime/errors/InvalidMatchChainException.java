package de.prgrm.cypher.ogm.runtime.errors;

public class InvalidMatchChainException extends UsageException {
    public InvalidMatchChainException(String message) {
        super(message);
    }

    public InvalidMatchChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
