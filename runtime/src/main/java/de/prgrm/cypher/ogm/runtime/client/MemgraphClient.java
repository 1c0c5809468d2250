package de.prgrm.cypher.ogm.runtime.client;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

import de.prgrm.cypher.ogm.runtime.config.ConnectionSettings;
import de.prgrm.cypher.ogm.runtime.errors.OnDiskPropertyDatabaseNotDefinedException;
import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;
import de.prgrm.cypher.ogm.runtime.mapping.*;
import de.prgrm.cypher.ogm.runtime.query.MemgraphQueryBuilder;
import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;
import de.prgrm.cypher.ogm.runtime.schema.Trigger;

/**
 * Client for Memgraph.
 * <p>
 * Fields declared {@code onDisk} are kept out of the graph and written to an
 * {@link OnDiskPropertyDatabase} configured with {@link #initDiskStorage}.
 */
public class MemgraphClient extends DatabaseClient {

    private static final Logger LOG = Logger.getLogger(MemgraphClient.class);

    private volatile OnDiskPropertyDatabase onDiskStorage;

    public MemgraphClient() {
        this(ConnectionSettings.memgraph(), new ModelRegistry());
    }

    public MemgraphClient(ConnectionSettings settings, ModelRegistry registry) {
        super(settings, registry);
    }

    public MemgraphClient(Supplier<Connection> connectionFactory, ModelRegistry registry) {
        super(connectionFactory, registry);
    }

    @Override
    public MemgraphQueryBuilder query() {
        return new MemgraphQueryBuilder(this);
    }

    // ========================= Indexes =========================

    @Override
    public Set<Index> getIndexes() {
        try (Stream<Map<String, Object>> rows = executeAndFetch("SHOW INDEX INFO;")) {
            return rows
                    .filter(row -> row.get("label") != null)
                    .map(row -> new Index(String.valueOf(row.get("label")), propertyNames(row.get("property")),
                            null, false))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
    }

    @Override
    public void createIndex(Index index) {
        LOG.debugf("Creating %s", index);
        execute("CREATE INDEX ON " + target(index) + ";");
    }

    @Override
    public void dropIndex(Index index) {
        LOG.debugf("Dropping %s", index);
        execute("DROP INDEX ON " + target(index) + ";");
    }

    private static String target(Index index) {
        String label = ":" + CypherLiterals.identifier(index.label());
        if (index.properties().isEmpty()) {
            return label;
        }
        return label + "(" + index.properties().stream()
                .map(CypherLiterals::identifier)
                .collect(Collectors.joining(", ")) + ")";
    }

    // ========================= Constraints =========================

    @Override
    public Set<Constraint> getConstraints() {
        Set<Constraint> result = new LinkedHashSet<>();
        try (Stream<Map<String, Object>> rows = executeAndFetch("SHOW CONSTRAINT INFO;")) {
            rows.forEach(row -> {
                String type = String.valueOf(row.get("constraint type"));
                String label = String.valueOf(row.get("label"));
                List<String> properties = propertyNames(row.get("properties"));
                if ("exists".equals(type)) {
                    result.add(new Constraint(label, properties, Constraint.Kind.EXISTS, null));
                } else if ("unique".equals(type)) {
                    result.add(new Constraint(label, properties, Constraint.Kind.UNIQUE, null));
                } else {
                    LOG.debugf("Ignoring %s constraint on :%s%s", type, label, properties);
                }
            });
        }
        return result;
    }

    @Override
    public void createConstraint(Constraint constraint) {
        LOG.debugf("Creating %s", constraint);
        execute("CREATE " + constraintClause(constraint));
    }

    @Override
    public void dropConstraint(Constraint constraint) {
        LOG.debugf("Dropping %s", constraint);
        execute("DROP " + constraintClause(constraint));
    }

    private static String constraintClause(Constraint constraint) {
        String properties = constraint.properties().stream()
                .map(p -> "n." + CypherLiterals.identifier(p))
                .collect(Collectors.joining(", "));
        String assertion = constraint.kind() == Constraint.Kind.EXISTS
                ? "EXISTS (" + properties + ")"
                : properties + " IS UNIQUE";
        return "CONSTRAINT ON (n:" + CypherLiterals.identifier(constraint.label()) + ") ASSERT " + assertion + ";";
    }

    // SHOW ... INFO reports a single property as a string and several as a list
    private static List<String> propertyNames(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> names) {
            return names.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of(String.valueOf(value));
    }

    // ========================= Triggers =========================

    public void createTrigger(Trigger trigger) {
        LOG.debugf("Creating %s", trigger);
        execute(trigger.toCypher());
    }

    public List<Trigger> getTriggers() {
        try (Stream<Map<String, Object>> rows = executeAndFetch("SHOW TRIGGERS;")) {
            return rows
                    .map(row -> Trigger.fromShowTriggers(
                            String.valueOf(row.get("trigger name")),
                            (String) row.get("event type"),
                            String.valueOf(row.get("phase")),
                            String.valueOf(row.get("statement"))))
                    .collect(Collectors.toList());
        }
    }

    public void dropTrigger(Trigger trigger) {
        LOG.debugf("Dropping %s", trigger);
        execute("DROP TRIGGER " + trigger.name() + ";");
    }

    public void dropTriggers() {
        for (Trigger trigger : getTriggers()) {
            dropTrigger(trigger);
        }
    }

    // ========================= On-disk properties =========================

    public void initDiskStorage(OnDiskPropertyDatabase storage) {
        this.onDiskStorage = Objects.requireNonNull(storage, "storage");
    }

    /**
     * Drops every value in the configured storage and detaches it from this client.
     */
    public void removeOnDiskStorage() {
        OnDiskPropertyDatabase storage = onDiskStorage;
        if (storage != null) {
            storage.drop();
            onDiskStorage = null;
        }
    }

    public Optional<OnDiskPropertyDatabase> onDiskStorage() {
        return Optional.ofNullable(onDiskStorage);
    }

    @Override
    protected Map<String, Object> storedProperties(GraphEntity entity) {
        return entity.graphProperties();
    }

    @Override
    protected void beforeSave(GraphEntity entity) {
        boolean hasOnDiskValue = entity.onDiskFields().stream()
                .anyMatch(field -> entity.get(field.name()) != null);
        if (hasOnDiskValue) {
            requireStorage(entity);
        }
    }

    @Override
    protected void beforeLoad(GraphEntity entity) {
        if (!entity.onDiskFields().isEmpty()) {
            requireStorage(entity);
        }
    }

    @Override
    protected void afterNodeSaved(Node node) {
        for (FieldDescriptor field : node.onDiskFields()) {
            Object value = node.get(field.name());
            if (value != null) {
                requireStorage(node).saveNodeProperty(node.id(), field.name(), String.valueOf(value));
            }
        }
    }

    @Override
    protected void afterNodeLoaded(Node node) {
        for (FieldDescriptor field : node.onDiskFields()) {
            if (node.get(field.name()) == null) {
                requireStorage(node).loadNodeProperty(node.id(), field.name())
                        .ifPresent(value -> node.loadOnDiskProperty(field.name(), value));
            }
        }
    }

    @Override
    protected void afterRelationshipSaved(Relationship relationship) {
        for (FieldDescriptor field : relationship.onDiskFields()) {
            Object value = relationship.get(field.name());
            if (value != null) {
                requireStorage(relationship)
                        .saveRelationshipProperty(relationship.id(), field.name(), String.valueOf(value));
            }
        }
    }

    @Override
    protected void afterRelationshipLoaded(Relationship relationship) {
        for (FieldDescriptor field : relationship.onDiskFields()) {
            if (relationship.get(field.name()) == null) {
                requireStorage(relationship).loadRelationshipProperty(relationship.id(), field.name())
                        .ifPresent(value -> relationship.loadOnDiskProperty(field.name(), value));
            }
        }
    }

    private OnDiskPropertyDatabase requireStorage(GraphEntity entity) {
        OnDiskPropertyDatabase storage = onDiskStorage;
        if (storage == null) {
            throw new OnDiskPropertyDatabaseNotDefinedException(entity
                    + " has on-disk fields but no on-disk property database is configured, call initDiskStorage first");
        }
        return storage;
    }
}
