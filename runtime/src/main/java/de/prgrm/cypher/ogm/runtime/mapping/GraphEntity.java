package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.*;

import de.prgrm.cypher.ogm.runtime.errors.ValidationException;

/**
 * State shared by nodes and relationships: server-assigned id and properties. Typed entities
 * validate every property against their schema; generic entities accept any property.
 */
public abstract class GraphEntity {

    private final EntitySchema schema;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Set<String> explicitlySet = new HashSet<>();
    private Long id;

    protected GraphEntity(EntitySchema schema) {
        this.schema = schema;
        if (schema != null) {
            for (FieldDescriptor field : schema.fields()) {
                if (field.defaultValue() != null) {
                    properties.put(field.name(), field.defaultValue());
                }
            }
        }
    }

    public Long id() {
        return id;
    }

    /**
     * Assigns the server id. Identity never changes once assigned.
     */
    public void setId(Long id) {
        if (this.id != null && !this.id.equals(id)) {
            throw new ValidationException("Identity of " + this + " is already " + this.id + ", can't change it to " + id);
        }
        this.id = id;
    }

    public Object get(String name) {
        return properties.get(name);
    }

    public <V> V get(String name, Class<V> type) {
        Object value = properties.get(name);
        if (value == null) {
            return null;
        }
        return type.cast(FieldConverter.convert(value, FieldConverter.boxed(type), name));
    }

    /**
     * Sets a property, {@code null} unsets it. Typed entities reject undeclared properties and values
     * that can't be converted to the declared type.
     */
    public GraphEntity set(String name, Object value) {
        Object converted = value;
        if (schema != null) {
            FieldDescriptor field = schema.field(name)
                    .orElseThrow(() -> new ValidationException(
                            "Field '" + name + "' is not declared on " + schema.name()));
            converted = FieldConverter.convert(value, field.type(), name);
        }
        if (converted == null) {
            properties.remove(name);
            explicitlySet.remove(name);
        } else {
            properties.put(name, converted);
            explicitlySet.add(name);
        }
        return this;
    }

    /**
     * All properties with a value, including on-disk fields.
     */
    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Properties stored on the graph itself, i.e. without on-disk fields.
     */
    public Map<String, Object> graphProperties() {
        Map<String, Object> result = new LinkedHashMap<>();
        properties.forEach((name, value) -> {
            if (!isOnDisk(name)) {
                result.put(name, value);
            }
        });
        return result;
    }

    public List<FieldDescriptor> onDiskFields() {
        if (schema == null) {
            return List.of();
        }
        return schema.fields().stream().filter(FieldDescriptor::isOnDisk).toList();
    }

    /**
     * Values of the unique and indexed fields that are set, in declaration order.
     */
    public Map<String, Object> keyProperties() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (schema != null) {
            for (FieldDescriptor field : schema.fields()) {
                Object value = properties.get(field.name());
                if (field.isKey() && value != null && !field.isOnDisk()) {
                    result.put(field.name(), value);
                }
            }
        }
        return result;
    }

    /**
     * Fails when a field declared with {@code exists} has no value.
     */
    public void validateRequired() {
        if (schema == null) {
            return;
        }
        List<String> missing = schema.fields().stream()
                .filter(f -> f.isExists() && properties.get(f.name()) == null)
                .map(FieldDescriptor::name)
                .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException(schema.name() + " is missing required fields " + missing);
        }
    }

    /**
     * Copies the state of a freshly loaded entity into this one. Values the caller set explicitly
     * must agree with the stored ones; the check runs before anything is modified.
     */
    public void refreshFrom(GraphEntity loaded) {
        for (String name : explicitlySet) {
            Object mine = properties.get(name);
            Object stored = loaded.properties.get(name);
            if (stored != null && !sameValue(mine, stored)) {
                throw new ValidationException("Field '" + name + "' is " + mine
                        + " but the stored entity has " + stored);
            }
        }
        setId(loaded.id);
        loaded.properties.forEach((name, value) -> {
            if (!explicitlySet.contains(name)) {
                loadProperty(name, value);
            }
        });
    }

    /**
     * Stores a value read from the database. Unlike {@link #set(String, Object)} undeclared
     * properties are kept and the value does not count as explicitly set.
     */
    void loadProperty(String name, Object value) {
        if (value == null) {
            properties.remove(name);
            return;
        }
        Object converted = value;
        if (schema != null) {
            Optional<FieldDescriptor> field = schema.field(name);
            if (field.isPresent()) {
                converted = FieldConverter.convert(value, field.get().type(), name);
            }
        }
        properties.put(name, converted);
    }

    /**
     * Stores a value read back from on-disk property storage.
     */
    public void loadOnDiskProperty(String name, Object value) {
        loadProperty(name, value);
    }

    protected EntitySchema entitySchema() {
        return schema;
    }

    private boolean isOnDisk(String name) {
        return schema != null && schema.field(name).map(FieldDescriptor::isOnDisk).orElse(false);
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }
}
