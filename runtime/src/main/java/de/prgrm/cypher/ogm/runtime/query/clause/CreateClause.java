package de.prgrm.cypher.ogm.runtime.query.clause;

public record CreateClause() implements Clause {
    @Override
    public String render() {
        return " CREATE ";
    }
}
