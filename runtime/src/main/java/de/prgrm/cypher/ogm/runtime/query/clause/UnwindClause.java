package de.prgrm.cypher.ogm.runtime.query.clause;

import java.util.Set;

public record UnwindClause(String listExpression, String variable) implements Clause {
    @Override
    public String render() {
        return " UNWIND " + listExpression + " AS " + variable + " ";
    }

    @Override
    public Set<String> declaredVariables() {
        return Set.of(variable);
    }
}
