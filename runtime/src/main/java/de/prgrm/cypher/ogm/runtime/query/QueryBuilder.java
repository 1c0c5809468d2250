package de.prgrm.cypher.ogm.runtime.query;

import de.prgrm.cypher.ogm.runtime.client.DatabaseClient;

/**
 * Query builder for the standard openCypher dialect.
 */
public class QueryBuilder extends AbstractQueryBuilder<QueryBuilder> {

    public QueryBuilder(DatabaseClient database) {
        super(database);
    }

    /**
     * A builder that can only render, e.g. for FOREACH update clauses.
     */
    public QueryBuilder() {
        super(null);
    }

    @Override
    protected QueryBuilder self() {
        return this;
    }
}
