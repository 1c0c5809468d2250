package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.List;
import java.util.Optional;

/**
 * Field layout shared by node and relationship schemas.
 */
public interface EntitySchema {

    /**
     * The node label or relationship type this schema declares.
     */
    String name();

    List<FieldDescriptor> fields();

    default Optional<FieldDescriptor> field(String name) {
        return fields().stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
