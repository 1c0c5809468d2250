package de.prgrm.cypher.ogm.runtime.query.clause;

public record CustomCypherClause(String cypher) implements Clause {
    @Override
    public String render() {
        return " " + cypher + " ";
    }
}
