package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.*;
import java.util.function.Supplier;

import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;

/**
 * Declarative description of a node type.
 * <p>
 * A schema may extend other schemas. Its label set is the union of its own label and the labels of
 * every parent, its fields are the parents' fields overridden by its own declarations. Indexes and
 * constraints are derived from the fields a schema declares itself, on its own label.
 *
 * <pre>
 * public static final NodeSchema&lt;Streamer&gt; SCHEMA = NodeSchema.builder("Streamer", Streamer::new)
 *         .extending(User.SCHEMA)
 *         .field(FieldDescriptor.builder("followers", Integer.class).build())
 *         .build();
 * </pre>
 */
public final class NodeSchema<T extends Node> implements EntitySchema {

    private final String label;
    private final Set<String> labels;
    private final List<NodeSchema<?>> parents;
    private final List<FieldDescriptor> ownFields;
    private final List<FieldDescriptor> fields;
    private final Supplier<T> factory;
    private final int priority;

    private NodeSchema(Builder<T> builder) {
        this.label = builder.label;
        this.parents = List.copyOf(builder.parents);
        this.ownFields = List.copyOf(builder.fields.values());
        this.factory = builder.factory;
        this.priority = builder.priority;

        Set<String> allLabels = new LinkedHashSet<>();
        allLabels.add(label);
        Map<String, FieldDescriptor> merged = new LinkedHashMap<>();
        for (NodeSchema<?> parent : parents) {
            allLabels.addAll(parent.labels);
            parent.fields.forEach(f -> merged.put(f.name(), f));
        }
        ownFields.forEach(f -> merged.put(f.name(), f));
        this.labels = Collections.unmodifiableSet(allLabels);
        this.fields = List.copyOf(merged.values());
    }

    public static <T extends Node> Builder<T> builder(String label, Supplier<T> factory) {
        return new Builder<>(label, factory);
    }

    @Override
    public String name() {
        return label;
    }

    /**
     * Own label first, then the parents' labels in declaration order.
     */
    public Set<String> labels() {
        return labels;
    }

    public List<NodeSchema<?>> parents() {
        return parents;
    }

    @Override
    public List<FieldDescriptor> fields() {
        return fields;
    }

    public List<FieldDescriptor> ownFields() {
        return ownFields;
    }

    /**
     * Breaks dispatch ties between schemas with equally many matching labels; higher wins.
     */
    public int priority() {
        return priority;
    }

    public T newInstance() {
        return factory.get();
    }

    /**
     * Indexes declared by this schema's own fields.
     */
    public Set<Index> indexes() {
        Set<Index> result = new LinkedHashSet<>();
        for (FieldDescriptor field : ownFields) {
            if (field.isIndex()) {
                result.add(Index.of(labelOf(field), field.name()));
            }
        }
        return result;
    }

    /**
     * Constraints declared by this schema's own fields.
     */
    public Set<Constraint> constraints() {
        Set<Constraint> result = new LinkedHashSet<>();
        for (FieldDescriptor field : ownFields) {
            if (field.isExists()) {
                result.add(Constraint.exists(labelOf(field), field.name()));
            }
            if (field.isUnique()) {
                result.add(Constraint.unique(labelOf(field), field.name()));
            }
        }
        return result;
    }

    private String labelOf(FieldDescriptor field) {
        return field.label() != null ? field.label() : label;
    }

    @Override
    public String toString() {
        return "NodeSchema" + labels;
    }

    public static final class Builder<T extends Node> {
        private final String label;
        private final Supplier<T> factory;
        private final List<NodeSchema<?>> parents = new ArrayList<>();
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private int priority;

        private Builder(String label, Supplier<T> factory) {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("A node schema needs a label");
            }
            this.label = label;
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder<T> extending(NodeSchema<?>... parents) {
            this.parents.addAll(Arrays.asList(parents));
            return this;
        }

        public Builder<T> field(FieldDescriptor field) {
            fields.put(field.name(), field);
            return this;
        }

        public Builder<T> priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NodeSchema<T> build() {
            return new NodeSchema<>(this);
        }
    }
}
