package de.prgrm.cypher.ogm.it.model;

import de.prgrm.cypher.ogm.runtime.mapping.FieldDescriptor;
import de.prgrm.cypher.ogm.runtime.mapping.Relationship;
import de.prgrm.cypher.ogm.runtime.mapping.RelationshipSchema;

public class Follows extends Relationship {

    public static final RelationshipSchema<Follows> SCHEMA = RelationshipSchema.builder("FOLLOWS", Follows::new)
            .field(FieldDescriptor.builder("since", Integer.class).build())
            .build();

    public Follows() {
        super(SCHEMA);
    }
}
