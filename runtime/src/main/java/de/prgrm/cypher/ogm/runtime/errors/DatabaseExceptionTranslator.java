package de.prgrm.cypher.ogm.runtime.errors;

import java.util.Locale;

import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;

/**
 * Maps driver failures onto the {@link DatabaseException} family. The server message is always
 * kept verbatim in the translated message.
 */
public final class DatabaseExceptionTranslator {

    public static DatabaseException translate(Throwable e, String query) {
        if (e instanceof DatabaseException databaseEx) {
            return databaseEx;
        }

        if (e instanceof Neo4jException neo4jEx) {
            return translateFromNeo4jException(neo4jEx, query);
        }

        if (e.getCause() instanceof Neo4jException causeEx) {
            return translateFromNeo4jException(causeEx, query);
        }

        String msg = safe(e.getMessage());
        if (msg.contains("Neo.ClientError.Schema.Constraint") || isConstraintViolation(msg)) {
            return new ConstraintViolationException(buildMessage(query, msg, extractCode(msg)), e);
        }

        return new DatabaseException(buildMessage(query, msg, null), e);
    }

    private static DatabaseException translateFromNeo4jException(Neo4jException e, String query) {
        String code = safe(e.code());
        String message = buildMessage(query, e.getMessage(), code.isEmpty() ? null : code);

        if (e instanceof TransientException
                || e instanceof ServiceUnavailableException
                || e instanceof SessionExpiredException) {
            return new TransientDatabaseException(message, e);
        }

        if (e instanceof ClientException) {
            switch (code) {
                case "Neo.ClientError.Schema.ConstraintValidationFailed",
                        "Neo.ClientError.Schema.ConstraintAlreadyExists",
                        "Neo.ClientError.Schema.ConstraintWithNameAlreadyExists" -> {
                    return new ConstraintViolationException(message, e);
                }
                case "Neo.ClientError.Security.Unauthorized" -> {
                    return new DatabaseException("Unauthorized: " + message, e);
                }
                default -> {
                    // Memgraph reports every query failure with a generic code
                    if (isConstraintViolation(safe(e.getMessage()))) {
                        return new ConstraintViolationException(message, e);
                    }
                }
            }
        }

        return new DatabaseException(message, e);
    }

    private static boolean isConstraintViolation(String message) {
        return message.contains("already exists with")
                || message.toLowerCase(Locale.ROOT).contains("constraint violation");
    }

    private static String buildMessage(String query, String message, String code) {
        return safe(message)
                + (code == null ? "" : " (code=" + code + ")")
                + (query == null ? "" : " [query: " + query.strip() + "]");
    }

    private static String extractCode(String message) {
        int idx = message.indexOf("Neo.ClientError.");
        if (idx < 0) {
            return null;
        }
        int end = message.indexOf(' ', idx);
        if (end < 0) {
            end = message.length();
        }
        return message.substring(idx, end).trim();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private DatabaseExceptionTranslator() {
    }
}
