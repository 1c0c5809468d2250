package de.prgrm.cypher.ogm.runtime.literal;

import java.util.Objects;

/**
 * A reference to a query variable or any other Cypher expression. Rendered verbatim wherever a
 * literal is expected, e.g. {@code where("n.name", EQUAL, CypherVariable.of("m.name"))}.
 */
public record CypherVariable(String name) {

    public CypherVariable {
        Objects.requireNonNull(name, "name");
    }

    public static CypherVariable of(String name) {
        return new CypherVariable(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
