package de.prgrm.cypher.ogm.runtime.query;

import de.prgrm.cypher.ogm.runtime.client.DatabaseClient;
import de.prgrm.cypher.ogm.runtime.enums.Direction;
import de.prgrm.cypher.ogm.runtime.query.clause.LoadCsvClause;
import de.prgrm.cypher.ogm.runtime.query.clause.PathAlgorithm;

/**
 * Query builder with the Memgraph extensions to openCypher.
 */
public class MemgraphQueryBuilder extends AbstractQueryBuilder<MemgraphQueryBuilder> {

    public MemgraphQueryBuilder(DatabaseClient database) {
        super(database);
    }

    public MemgraphQueryBuilder() {
        super(null);
    }

    /**
     * {@code LOAD CSV FROM 'path' WITH HEADER AS row}; {@code row} is a map per line with a header,
     * a list otherwise.
     */
    public MemgraphQueryBuilder loadCsv(String path, boolean header, String row) {
        declare(row);
        return append(new LoadCsvClause(path, header, row));
    }

    /**
     * Outgoing relationship expanded with one of Memgraph's path algorithms.
     */
    public MemgraphQueryBuilder to(String type, String variable, PathAlgorithm algorithm) {
        return relationship(type, variable, null, Direction.OUTGOING, algorithm);
    }

    public MemgraphQueryBuilder from(String type, String variable, PathAlgorithm algorithm) {
        return relationship(type, variable, null, Direction.INCOMING, algorithm);
    }

    public MemgraphQueryBuilder related(String type, String variable, PathAlgorithm algorithm) {
        return relationship(type, variable, null, Direction.UNDIRECTED, algorithm);
    }

    @Override
    protected MemgraphQueryBuilder self() {
        return this;
    }
}
