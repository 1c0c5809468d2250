package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.Objects;

import de.prgrm.cypher.ogm.runtime.errors.UsageException;

/**
 * Immutable description of one property of an entity schema.
 *
 * <pre>
 * FieldDescriptor.builder("name", String.class).unique().exists().build();
 * </pre>
 */
public final class FieldDescriptor {

    private final String name;
    private final Class<?> type;
    private final Object defaultValue;
    private final boolean index;
    private final boolean exists;
    private final boolean unique;
    private final boolean onDisk;
    private final String label;

    private FieldDescriptor(Builder builder) {
        this.name = builder.name;
        this.type = FieldConverter.boxed(builder.type);
        this.defaultValue = builder.defaultValue == null ? null : FieldConverter.convert(builder.defaultValue, type, name);
        this.index = builder.index;
        this.exists = builder.exists;
        this.unique = builder.unique;
        this.onDisk = builder.onDisk;
        this.label = builder.label;
    }

    public static Builder builder(String name, Class<?> type) {
        return new Builder(name, type);
    }

    public String name() {
        return name;
    }

    public Class<?> type() {
        return type;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public boolean isIndex() {
        return index;
    }

    public boolean isExists() {
        return exists;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isOnDisk() {
        return onDisk;
    }

    /**
     * @return the label constraints and indexes of this field are created on, {@code null} for the
     *         declaring schema's own label
     */
    public String label() {
        return label;
    }

    /**
     * Unique and indexed fields identify a node when loading it.
     */
    public boolean isKey() {
        return unique || index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldDescriptor that)) {
            return false;
        }
        return index == that.index && exists == that.exists && unique == that.unique && onDisk == that.onDisk
                && name.equals(that.name) && type.equals(that.type)
                && Objects.equals(defaultValue, that.defaultValue) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, defaultValue, index, exists, unique, onDisk, label);
    }

    @Override
    public String toString() {
        return "FieldDescriptor[" + name + ": " + type.getSimpleName() + "]";
    }

    public static final class Builder {
        private final String name;
        private final Class<?> type;
        private Object defaultValue;
        private boolean index;
        private boolean exists;
        private boolean unique;
        private boolean onDisk;
        private String label;

        private Builder(String name, Class<?> type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder index() {
            this.index = true;
            return this;
        }

        public Builder exists() {
            this.exists = true;
            return this;
        }

        public Builder unique() {
            this.unique = true;
            return this;
        }

        public Builder onDisk() {
            this.onDisk = true;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        /**
         * @throws UsageException for an on-disk field whose type can't be stored as text
         */
        public FieldDescriptor build() {
            if (onDisk && !FieldConverter.isTextCodable(type)) {
                throw new UsageException("On-disk field '" + name + "' has type " + type.getSimpleName()
                        + ", which can't be stored as text and read back");
            }
            return new FieldDescriptor(this);
        }
    }
}
