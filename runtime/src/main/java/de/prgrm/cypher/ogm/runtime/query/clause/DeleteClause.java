package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.List;

public record DeleteClause(List<String> variables, boolean detach) implements Clause {

    public DeleteClause {
        variables = List.copyOf(variables);
    }

    @Override
    public String render() {
        return (detach ? " DETACH DELETE " : " DELETE ") + String.join(", ", variables) + " ";
    }
}
