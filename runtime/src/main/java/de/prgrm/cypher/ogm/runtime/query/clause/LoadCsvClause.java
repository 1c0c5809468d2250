package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.Set;

import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;

public record LoadCsvClause(String path, boolean header, String row) implements Clause {
    @Override
    public String render() {
        return " LOAD CSV FROM " + CypherLiterals.serialize(path) + (header ? " WITH" : " NO")
                + " HEADER AS " + row + " ";
    }

    @Override
    public Set<String> declaredVariables() {
        return Set.of(row);
    }
}
