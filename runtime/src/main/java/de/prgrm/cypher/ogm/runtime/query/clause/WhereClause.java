package de.prgrm.cypher.ogm.runtime.query.clause;

import de.prgrm.cypher.ogm.runtime.enums.Operator;

/**
 * A WHERE condition or one of its AND / OR / XOR continuations. The value is already rendered.
 */
public record WhereClause(Keyword keyword, boolean negated, String item, Operator operator, String value)
        implements Clause {

    public enum Keyword {
        WHERE,
        AND,
        OR,
        XOR
    }

    @Override
    public String render() {
        return " " + keyword.name() + " " + (negated ? "NOT " : "") + operator.apply(item, value) + " ";
    }
}
