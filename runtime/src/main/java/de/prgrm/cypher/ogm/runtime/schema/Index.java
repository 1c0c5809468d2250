package de.prgrm.cypher.ogm.runtime.schema;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A label or label-property index. Equality covers label and property set only; the vendor name
 * and the managed flag are informational.
 */
public final class Index {

    private final String label;
    private final List<String> properties;
    private final String name;
    private final boolean managed;

    public Index(String label, List<String> properties, String name, boolean managed) {
        this.label = Objects.requireNonNull(label, "label");
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.name = name;
        this.managed = managed;
    }

    public static Index of(String label, String property) {
        return new Index(label, property == null ? List.of() : List.of(property), null, false);
    }

    public static Index of(String label) {
        return new Index(label, List.of(), null, false);
    }

    public String label() {
        return label;
    }

    /**
     * Empty for a label index.
     */
    public List<String> properties() {
        return properties;
    }

    /**
     * @return the name the database reported, {@code null} if unknown
     */
    public String name() {
        return name;
    }

    /**
     * Managed indexes are owned by the database (lookup indexes, indexes backing a constraint) and
     * are never dropped when reconciling.
     */
    public boolean isManaged() {
        return managed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Index that)) {
            return false;
        }
        return label.equals(that.label) && Set.copyOf(properties).equals(Set.copyOf(that.properties));
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, Set.copyOf(properties));
    }

    @Override
    public String toString() {
        return "Index[:" + label + (properties.isEmpty() ? "" : "(" + String.join(", ", properties) + ")") + "]";
    }
}
