package de.prgrm.cypher.ogm.it.model;

import de.prgrm.cypher.ogm.runtime.mapping.FieldDescriptor;
import de.prgrm.cypher.ogm.runtime.mapping.Node;
import de.prgrm.cypher.ogm.runtime.mapping.NodeSchema;

public class Language extends Node {

    public static final NodeSchema<Language> SCHEMA = NodeSchema.builder("Language", Language::new)
            .field(FieldDescriptor.builder("name", String.class).unique().build())
            .build();

    public Language() {
        super(SCHEMA);
    }

    public static Language named(String name) {
        Language language = new Language();
        language.set("name", name);
        return language;
    }
}
