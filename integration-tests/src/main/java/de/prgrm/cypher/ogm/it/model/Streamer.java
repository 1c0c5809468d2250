package de.prgrm.cypher.ogm.it.model;

import de.prgrm.cypher.ogm.runtime.mapping.FieldDescriptor;
import de.prgrm.cypher.ogm.runtime.mapping.NodeSchema;

/**
 * A user that streams. Carries both labels, so it wins dispatch over {@link User} for
 * {@code (:Streamer:User)} nodes.
 */
public class Streamer extends User {

    public static final NodeSchema<Streamer> SCHEMA = NodeSchema.builder("Streamer", Streamer::new)
            .extending(User.SCHEMA)
            .field(FieldDescriptor.builder("followers", Integer.class).index().build())
            .field(FieldDescriptor.builder("language", String.class).build())
            .build();

    public Streamer() {
        super(SCHEMA);
    }

    public static Streamer named(String name) {
        Streamer streamer = new Streamer();
        streamer.set("name", name);
        return streamer;
    }
}
