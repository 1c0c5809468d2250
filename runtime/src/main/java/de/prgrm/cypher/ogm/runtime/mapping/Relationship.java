package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import de.prgrm.cypher.ogm.runtime.client.DatabaseClient;

/**
 * A directed, typed relationship between two nodes identified by their ids.
 */
public class Relationship extends GraphEntity {

    private final RelationshipSchema<?> schema;
    private final String type;
    private Long startNodeId;
    private Long endNodeId;

    public Relationship(String type, Long startNodeId, Long endNodeId, Map<String, Object> properties) {
        super(null);
        this.schema = null;
        this.type = Objects.requireNonNull(type, "type");
        this.startNodeId = startNodeId;
        this.endNodeId = endNodeId;
        if (properties != null) {
            properties.forEach(this::set);
        }
    }

    protected Relationship(RelationshipSchema<?> schema) {
        super(Objects.requireNonNull(schema, "schema"));
        this.schema = schema;
        this.type = schema.type();
    }

    public String type() {
        return type;
    }

    public Long startNodeId() {
        return startNodeId;
    }

    public Long endNodeId() {
        return endNodeId;
    }

    public Relationship between(Node start, Node end) {
        return between(start.id(), end.id());
    }

    public Relationship between(Long startNodeId, Long endNodeId) {
        this.startNodeId = startNodeId;
        this.endNodeId = endNodeId;
        return this;
    }

    public Optional<RelationshipSchema<?>> schema() {
        return Optional.ofNullable(schema);
    }

    @Override
    public Relationship set(String name, Object value) {
        super.set(name, value);
        return this;
    }

    public Relationship save(DatabaseClient db) {
        return db.saveRelationship(this);
    }

    public Relationship load(DatabaseClient db) {
        return db.loadRelationship(this);
    }

    public GetOrCreateResult<Relationship> getOrCreate(DatabaseClient db) {
        return db.getOrCreateRelationship(this);
    }

    @Override
    public void refreshFrom(GraphEntity loaded) {
        super.refreshFrom(loaded);
        if (loaded instanceof Relationship relationship) {
            if (startNodeId == null) {
                startNodeId = relationship.startNodeId;
            }
            if (endNodeId == null) {
                endNodeId = relationship.endNodeId;
            }
        }
    }

    @Override
    public String toString() {
        return "Relationship{id=" + id() + ", type=" + type + ", start=" + startNodeId + ", end=" + endNodeId
                + ", properties=" + properties() + "}";
    }
}
