package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.List;
import java.util.Map;
import java.util.Set;

import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;

/**
 * {@code (variable:Label1:Label2 {key: "value"})}; absent parts are left out.
 */
public record NodePattern(String variable, List<String> labels, Map<String, Object> properties) implements Clause {

    public NodePattern {
        labels = labels == null ? List.of() : List.copyOf(labels);
        properties = PropertyMaps.copy(properties);
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder("(");
        if (variable != null) {
            sb.append(variable);
        }
        sb.append(CypherLiterals.labels(labels));
        if (!properties.isEmpty()) {
            sb.append(' ').append(PropertyMaps.render(properties));
        }
        return sb.append(')').toString();
    }

    @Override
    public Set<String> declaredVariables() {
        return variable == null ? Set.of() : Set.of(variable);
    }
}
