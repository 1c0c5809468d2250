package de.prgrm.cypher.ogm.runtime.query.clause;

public record LimitClause(String limit) implements Clause {
    @Override
    public String render() {
        return " LIMIT " + limit + " ";
    }
}
