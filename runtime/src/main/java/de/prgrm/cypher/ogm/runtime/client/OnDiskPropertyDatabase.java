package de.prgrm.cypher.ogm.runtime.client;

import java.util.Optional;

/**
 * Side storage for large property values, keyed by entity id and property name. Values are stored
 * as text.
 */
public interface OnDiskPropertyDatabase {

    void saveNodeProperty(long nodeId, String name, String value);

    Optional<String> loadNodeProperty(long nodeId, String name);

    void deleteNodeProperty(long nodeId, String name);

    void saveRelationshipProperty(long relationshipId, String name, String value);

    Optional<String> loadRelationshipProperty(long relationshipId, String name);

    void deleteRelationshipProperty(long relationshipId, String name);

    /**
     * Removes every stored value.
     */
    void drop();
}
