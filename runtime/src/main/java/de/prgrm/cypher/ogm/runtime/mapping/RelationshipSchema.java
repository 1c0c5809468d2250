package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.*;
import java.util.function.Supplier;

/**
 * Declarative description of a relationship type. Relationships are dispatched by exact type.
 */
public final class RelationshipSchema<T extends Relationship> implements EntitySchema {

    private final String type;
    private final List<FieldDescriptor> fields;
    private final Supplier<T> factory;

    private RelationshipSchema(Builder<T> builder) {
        this.type = builder.type;
        this.fields = List.copyOf(builder.fields.values());
        this.factory = builder.factory;
    }

    public static <T extends Relationship> Builder<T> builder(String type, Supplier<T> factory) {
        return new Builder<>(type, factory);
    }

    @Override
    public String name() {
        return type;
    }

    public String type() {
        return type;
    }

    @Override
    public List<FieldDescriptor> fields() {
        return fields;
    }

    public T newInstance() {
        return factory.get();
    }

    @Override
    public String toString() {
        return "RelationshipSchema[" + type + "]";
    }

    public static final class Builder<T extends Relationship> {
        private final String type;
        private final Supplier<T> factory;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();

        private Builder(String type, Supplier<T> factory) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("A relationship schema needs a type");
            }
            this.type = type;
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder<T> field(FieldDescriptor field) {
            fields.put(field.name(), field);
            return this;
        }

        public RelationshipSchema<T> build() {
            return new RelationshipSchema<>(this);
        }
    }
}
