package de.prgrm.cypher.ogm.runtime.query.clause;

public record CallClause(String procedure, String arguments) implements Clause {
    @Override
    public String render() {
        return " CALL " + procedure + "(" + (arguments == null ? "" : arguments) + ") ";
    }
}
