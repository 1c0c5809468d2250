package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.List;

public record RemoveClause(List<String> items) implements Clause {

    public RemoveClause {
        items = List.copyOf(items);
    }

    @Override
    public String render() {
        return " REMOVE " + String.join(", ", items) + " ";
    }
}
