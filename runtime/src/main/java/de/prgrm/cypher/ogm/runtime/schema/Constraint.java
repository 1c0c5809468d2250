package de.prgrm.cypher.ogm.runtime.schema;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An existence or uniqueness constraint. Equality covers label, property set and kind.
 */
public final class Constraint {

    public enum Kind {
        EXISTS,
        UNIQUE
    }

    private final String label;
    private final List<String> properties;
    private final Kind kind;
    private final String name;

    public Constraint(String label, List<String> properties, Kind kind, String name) {
        this.label = Objects.requireNonNull(label, "label");
        this.properties = List.copyOf(properties);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        if (this.properties.isEmpty()) {
            throw new IllegalArgumentException("A constraint needs at least one property");
        }
    }

    public static Constraint exists(String label, String property) {
        return new Constraint(label, List.of(property), Kind.EXISTS, null);
    }

    public static Constraint unique(String label, String... properties) {
        return new Constraint(label, List.of(properties), Kind.UNIQUE, null);
    }

    public String label() {
        return label;
    }

    public List<String> properties() {
        return properties;
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Constraint that)) {
            return false;
        }
        return label.equals(that.label) && kind == that.kind
                && Set.copyOf(properties).equals(Set.copyOf(that.properties));
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, kind, Set.copyOf(properties));
    }

    @Override
    public String toString() {
        return "Constraint[" + kind + " :" + label + "(" + String.join(", ", properties) + ")]";
    }
}
