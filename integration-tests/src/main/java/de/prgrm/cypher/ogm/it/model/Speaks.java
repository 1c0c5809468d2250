package de.prgrm.cypher.ogm.it.model;

import de.prgrm.cypher.ogm.runtime.mapping.FieldDescriptor;
import de.prgrm.cypher.ogm.runtime.mapping.Relationship;
import de.prgrm.cypher.ogm.runtime.mapping.RelationshipSchema;

public class Speaks extends Relationship {

    public static final RelationshipSchema<Speaks> SCHEMA = RelationshipSchema.builder("SPEAKS", Speaks::new)
            .field(FieldDescriptor.builder("fluent", Boolean.class).defaultValue(false).build())
            .build();

    public Speaks() {
        super(SCHEMA);
    }
}
