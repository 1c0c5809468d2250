package de.prgrm.cypher.ogm.runtime.query.clause;

import de.prgrm.cypher.ogm.runtime.enums.Operator;

public record SetClause(String item, Operator operator, String value) implements Clause {
    @Override
    public String render() {
        return " SET " + operator.apply(item, value) + " ";
    }
}
