package de.prgrm.cypher.ogm.runtime.client;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Transport used by a {@link DatabaseClient}. Implementations translate failures into
 * {@link de.prgrm.cypher.ogm.runtime.errors.DatabaseException}s.
 */
public interface Connection extends AutoCloseable {

    void execute(String query, Map<String, Object> parameters);

    /**
     * Lazily streams the result rows; closing the stream releases the underlying session.
     */
    Stream<Map<String, Object>> executeAndFetch(String query, Map<String, Object> parameters);

    boolean isActive();

    @Override
    void close();
}
