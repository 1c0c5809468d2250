package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.*;

import de.prgrm.cypher.ogm.runtime.client.DatabaseClient;

/**
 * A graph node. Typed nodes subclass this and pass their {@link NodeSchema}; a node read from the
 * database without a matching schema is a plain instance of this class.
 *
 * <pre>
 * public class User extends Node {
 *     public static final NodeSchema&lt;User&gt; SCHEMA = NodeSchema.builder("User", User::new)
 *             .field(FieldDescriptor.builder("id", String.class).unique().build())
 *             .build();
 *
 *     public User() {
 *         super(SCHEMA);
 *     }
 * }
 * </pre>
 */
public class Node extends GraphEntity {

    private final NodeSchema<?> schema;
    private final Set<String> labels = new LinkedHashSet<>();

    /**
     * A generic node.
     */
    public Node(Collection<String> labels, Map<String, Object> properties) {
        super(null);
        this.schema = null;
        if (labels != null) {
            this.labels.addAll(labels);
        }
        if (properties != null) {
            properties.forEach(this::set);
        }
    }

    public Node(String... labels) {
        this(List.of(labels), null);
    }

    protected Node(NodeSchema<?> schema) {
        super(Objects.requireNonNull(schema, "schema"));
        this.schema = schema;
        this.labels.addAll(schema.labels());
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(labels);
    }

    public Optional<NodeSchema<?>> schema() {
        return Optional.ofNullable(schema);
    }

    @Override
    public Node set(String name, Object value) {
        super.set(name, value);
        return this;
    }

    /**
     * Creates the node, or updates it when it already has an id.
     */
    public Node save(DatabaseClient db) {
        return db.saveNode(this);
    }

    /**
     * Loads the stored node by id or, without id, by its unique and indexed fields.
     */
    public Node load(DatabaseClient db) {
        return db.loadNode(this);
    }

    public GetOrCreateResult<Node> getOrCreate(DatabaseClient db) {
        return db.getOrCreateNode(this);
    }

    @Override
    public void refreshFrom(GraphEntity loaded) {
        super.refreshFrom(loaded);
        if (loaded instanceof Node node) {
            labels.addAll(node.labels);
        }
    }

    void replaceLabels(Collection<String> newLabels) {
        labels.clear();
        labels.addAll(newLabels);
    }

    @Override
    public String toString() {
        return "Node{id=" + id() + ", labels=" + labels + ", properties=" + properties() + "}";
    }
}
