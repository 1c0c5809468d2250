package de.prgrm.cypher.ogm.runtime.query;

import java.util.Objects;

/**
 * One item of a RETURN, WITH or YIELD list: an expression with an optional alias.
 */
public record Projection(String expression, String alias) {

    public Projection {
        Objects.requireNonNull(expression, "expression");
    }

    public static Projection of(String expression) {
        return new Projection(expression, null);
    }

    public static Projection of(String expression, String alias) {
        return new Projection(expression, alias);
    }

    /**
     * The name this item is visible under in the following clauses.
     */
    public String name() {
        return hasAlias() ? alias : expression;
    }

    public String toCypher() {
        return hasAlias() ? expression + " AS " + alias : expression;
    }

    private boolean hasAlias() {
        return alias != null && !alias.isEmpty() && !alias.equals(expression);
    }
}
