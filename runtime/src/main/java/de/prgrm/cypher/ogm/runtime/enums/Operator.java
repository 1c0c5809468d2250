package de.prgrm.cypher.ogm.runtime.enums;

import java.util.Arrays;
import java.util.Locale;

import de.prgrm.cypher.ogm.runtime.errors.UsageException;

/**
 * Operators accepted by WHERE and SET clauses.
 */
public enum Operator {
    EQUAL("="),
    ASSIGNMENT("="),
    INEQUAL("<>"),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_EQUAL(">="),
    INCREMENT("+="),
    LABEL_FILTER(":"),
    IN("IN"),
    CONTAINS("CONTAINS"),
    STARTS_WITH("STARTS WITH"),
    ENDS_WITH("ENDS WITH"),
    REGEX("=~"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Unary operators take no right-hand side.
     */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * Renders {@code item op value}; the label filter is written without spaces ({@code n:Label}).
     */
    public String apply(String item, String value) {
        if (this == LABEL_FILTER) {
            return item + symbol + value;
        }
        if (isUnary()) {
            return item + " " + symbol;
        }
        return item + " " + symbol + " " + value;
    }

    public static Operator fromSymbol(String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UsageException("Operator " + symbol + " is not supported"));
    }
}
