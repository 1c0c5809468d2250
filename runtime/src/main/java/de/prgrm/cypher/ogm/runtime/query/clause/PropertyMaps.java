package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;

final class PropertyMaps {

    static Map<String, Object> copy(Map<String, Object> properties) {
        if (properties == null || properties.isEmpty()) {
            return Map.of();
        }
        // LinkedHashMap keeps caller order and tolerates null values
        return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    static String render(Map<String, Object> properties) {
        return properties.entrySet().stream()
                .map(e -> CypherLiterals.identifier(e.getKey()) + ": " + CypherLiterals.serializeProperty(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private PropertyMaps() {
    }
}
