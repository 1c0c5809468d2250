package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import de.prgrm.cypher.ogm.runtime.query.Projection;

/**
 * RETURN, WITH and YIELD. An empty projection list renders {@code *}.
 */
public record ProjectionClause(Keyword keyword, List<Projection> projections) implements Clause {

    public enum Keyword {
        RETURN,
        WITH,
        YIELD
    }

    public ProjectionClause {
        projections = List.copyOf(projections);
    }

    public boolean isStar() {
        return projections.isEmpty();
    }

    @Override
    public String render() {
        String items = isStar()
                ? "*"
                : projections.stream().map(Projection::toCypher).collect(Collectors.joining(", "));
        return " " + keyword.name() + " " + items + " ";
    }

    @Override
    public Set<String> declaredVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (Projection projection : projections) {
            names.add(projection.name());
        }
        return names;
    }
}
