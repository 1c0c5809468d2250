package de.prgrm.cypher.ogm.runtime.query.clause;

public record UnionClause(boolean includeDuplicates) implements Clause {
    @Override
    public String render() {
        return includeDuplicates ? " UNION ALL " : " UNION ";
    }
}
