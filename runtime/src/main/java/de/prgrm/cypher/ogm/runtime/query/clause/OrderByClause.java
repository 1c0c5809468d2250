package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.List;
import java.util.stream.Collectors;

import de.prgrm.cypher.ogm.runtime.query.Sort;

public record OrderByClause(List<Sort> sorts) implements Clause {

    public OrderByClause {
        sorts = List.copyOf(sorts);
    }

    @Override
    public String render() {
        return " ORDER BY " + sorts.stream().map(Sort::toCypher).collect(Collectors.joining(", ")) + " ";
    }
}
