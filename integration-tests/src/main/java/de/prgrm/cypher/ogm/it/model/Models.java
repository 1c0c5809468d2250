package de.prgrm.cypher.ogm.it.model;

import de.prgrm.cypher.ogm.runtime.mapping.ModelRegistry;

public final class Models {

    private Models() {
    }

    public static ModelRegistry registry() {
        return new ModelRegistry()
                .register(User.SCHEMA)
                .register(Streamer.SCHEMA)
                .register(Language.SCHEMA)
                .register(Speaks.SCHEMA)
                .register(Follows.SCHEMA);
    }
}
