package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.Set;

/**
 * One fragment of a Cypher statement. Rendering is pure; every fragment carries its own
 * surrounding blanks and the builder collapses repeated whitespace when joining them.
 */
public interface Clause {

    String render();

    /**
     * Variables that become visible to the clauses following this one.
     */
    default Set<String> declaredVariables() {
        return Set.of();
    }
}
