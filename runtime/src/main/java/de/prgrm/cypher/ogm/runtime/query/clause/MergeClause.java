package de.prgrm.cypher.ogm.runtime.query.clause;

public record MergeClause() implements Clause {
    @Override
    public String render() {
        return " MERGE ";
    }
}
