package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import de.prgrm.cypher.ogm.runtime.enums.Direction;
import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;

/**
 * {@code -[variable:TYPE{key: "value"}]->}. Unlike node patterns, the property map directly follows
 * the type, or the path algorithm when there is one.
 */
public record RelationshipPattern(String variable, String type, Map<String, Object> properties, Direction direction,
        PathAlgorithm algorithm) implements Clause {

    public RelationshipPattern {
        properties = PropertyMaps.copy(properties);
    }

    public RelationshipPattern(String variable, String type, Map<String, Object> properties, Direction direction) {
        this(variable, type, properties, direction, null);
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder(direction.open());
        if (variable != null) {
            sb.append(variable);
        }
        if (type != null) {
            sb.append(':').append(CypherLiterals.identifier(type));
        }
        if (algorithm != null) {
            sb.append(algorithm.render());
        }
        if (!properties.isEmpty()) {
            sb.append(PropertyMaps.render(properties));
        }
        return sb.append(direction.close()).toString();
    }

    @Override
    public Set<String> declaredVariables() {
        Set<String> declared = new LinkedHashSet<>();
        if (variable != null) {
            declared.add(variable);
        }
        if (algorithm != null && algorithm.totalWeight() != null) {
            declared.add(algorithm.totalWeight());
        }
        return declared;
    }
}
