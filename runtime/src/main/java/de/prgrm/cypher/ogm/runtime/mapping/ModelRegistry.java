package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import de.prgrm.cypher.ogm.runtime.client.DatabaseClient;
import de.prgrm.cypher.ogm.runtime.errors.AmbiguousDispatchException;
import de.prgrm.cypher.ogm.runtime.errors.UsageException;
import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;

/**
 * Registered entity schemas, used to turn database nodes and relationships into typed instances.
 * <p>
 * Node dispatch picks the schema whose label set is the largest subset of the node's labels. When
 * several schemas match with the same number of labels the highest {@link NodeSchema#priority()}
 * wins; a remaining tie is reported as {@link AmbiguousDispatchException}, registration order never
 * decides.
 */
@ApplicationScoped
public class ModelRegistry {

    private static final Logger LOG = Logger.getLogger(ModelRegistry.class);

    private final Map<Set<String>, NodeSchema<?>> nodeSchemas = new ConcurrentHashMap<>();
    private final Map<String, RelationshipSchema<?>> relationshipSchemas = new ConcurrentHashMap<>();

    /**
     * Registers a node schema and, transitively, its parents. Registering the same schema again is
     * a no-op; a different schema with the same label set is rejected.
     */
    public ModelRegistry register(NodeSchema<?> schema) {
        for (NodeSchema<?> parent : schema.parents()) {
            register(parent);
        }
        Set<String> key = Set.copyOf(schema.labels());
        NodeSchema<?> existing = nodeSchemas.putIfAbsent(key, schema);
        if (existing != null && existing != schema) {
            throw new UsageException("Another schema is already registered for labels " + key);
        }
        if (existing == null) {
            LOG.debugf("Registered node schema %s", schema);
        }
        return this;
    }

    public ModelRegistry register(RelationshipSchema<?> schema) {
        RelationshipSchema<?> existing = relationshipSchemas.putIfAbsent(schema.type(), schema);
        if (existing != null && existing != schema) {
            throw new UsageException("Another schema is already registered for relationship type "
                    + schema.type());
        }
        if (existing == null) {
            LOG.debugf("Registered relationship schema %s", schema);
        }
        return this;
    }

    public Optional<NodeSchema<?>> resolveNode(Collection<String> labels) {
        Set<String> nodeLabels = Set.copyOf(labels);
        List<NodeSchema<?>> candidates = nodeSchemas.values().stream()
                .filter(schema -> nodeLabels.containsAll(schema.labels()))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        int mostLabels = candidates.stream().mapToInt(s -> s.labels().size()).max().getAsInt();
        List<NodeSchema<?>> mostSpecific = candidates.stream()
                .filter(s -> s.labels().size() == mostLabels)
                .collect(Collectors.toList());
        int topPriority = mostSpecific.stream().mapToInt(s -> s.priority()).max().getAsInt();
        List<NodeSchema<?>> winners = mostSpecific.stream()
                .filter(s -> s.priority() == topPriority)
                .collect(Collectors.toList());

        if (winners.size() > 1) {
            throw new AmbiguousDispatchException("Labels " + nodeLabels + " match " + winners
                    + " equally, give one of them a higher priority");
        }
        return Optional.of(winners.get(0));
    }

    public Optional<RelationshipSchema<?>> resolveRelationship(String type) {
        return Optional.ofNullable(relationshipSchemas.get(type));
    }

    public Collection<NodeSchema<?>> nodeSchemas() {
        return Collections.unmodifiableCollection(nodeSchemas.values());
    }

    public Collection<RelationshipSchema<?>> relationshipSchemas() {
        return Collections.unmodifiableCollection(relationshipSchemas.values());
    }

    /**
     * Indexes declared by all registered schemas, each (label, property) once.
     */
    public Set<Index> indexes() {
        Set<Index> result = new LinkedHashSet<>();
        sortedSchemas().forEach(schema -> result.addAll(schema.indexes()));
        return result;
    }

    /**
     * Constraints declared by all registered schemas, each (label, property, kind) once.
     */
    public Set<Constraint> constraints() {
        Set<Constraint> result = new LinkedHashSet<>();
        sortedSchemas().forEach(schema -> result.addAll(schema.constraints()));
        return result;
    }

    /**
     * Creates the declared indexes and constraints that the database does not have yet. Nothing is
     * dropped; use {@link DatabaseClient#ensureIndexes} and {@link DatabaseClient#ensureConstraints}
     * to reconcile exactly.
     */
    public void applySchema(DatabaseClient db) {
        Set<Index> existingIndexes = db.getIndexes();
        for (Index index : indexes()) {
            if (!existingIndexes.contains(index)) {
                db.createIndex(index);
            }
        }
        Set<Constraint> existingConstraints = db.getConstraints();
        for (Constraint constraint : constraints()) {
            if (!existingConstraints.contains(constraint)) {
                db.createConstraint(constraint);
            }
        }
    }

    @PreDestroy
    public void clear() {
        nodeSchemas.clear();
        relationshipSchemas.clear();
    }

    // deterministic order for logging and schema creation
    private List<NodeSchema<?>> sortedSchemas() {
        return nodeSchemas.values().stream()
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .collect(Collectors.toList());
    }
}
