package de.prgrm.cypher.ogm.runtime.query.clause;

public record MatchClause(boolean optional) implements Clause {
    @Override
    public String render() {
        return optional ? " OPTIONAL MATCH " : " MATCH ";
    }
}
