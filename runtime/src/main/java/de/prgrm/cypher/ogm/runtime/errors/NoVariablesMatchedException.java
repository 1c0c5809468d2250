package de.prgrm.cypher.ogm.runtime.errors;

public class NoVariablesMatchedException extends UsageException {
    public NoVariablesMatchedException(String message) {
        super(message);
    }

    public NoVariablesMatchedException(String message, Throwable cause) {
        super(message, cause);
    }
}
