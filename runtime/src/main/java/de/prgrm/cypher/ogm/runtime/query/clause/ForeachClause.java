package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.List;

public record ForeachClause(String variable, String expression, List<String> updateClauses) implements Clause {

    public ForeachClause {
        updateClauses = List.copyOf(updateClauses);
    }

    @Override
    public String render() {
        return " FOREACH ( " + variable + " IN " + expression + " | " + String.join(" ", updateClauses) + " ) ";
    }
}
