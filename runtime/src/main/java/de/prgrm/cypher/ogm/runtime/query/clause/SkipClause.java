package de.prgrm.cypher.ogm.runtime.query.clause;

public record SkipClause(String skip) implements Clause {
    @Override
    public String render() {
        return " SKIP " + skip + " ";
    }
}
