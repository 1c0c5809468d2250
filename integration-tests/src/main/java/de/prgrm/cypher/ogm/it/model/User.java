package de.prgrm.cypher.ogm.it.model;

import de.prgrm.cypher.ogm.runtime.mapping.FieldDescriptor;
import de.prgrm.cypher.ogm.runtime.mapping.Node;
import de.prgrm.cypher.ogm.runtime.mapping.NodeSchema;

public class User extends Node {

    public static final NodeSchema<User> SCHEMA = NodeSchema.builder("User", User::new)
            .field(FieldDescriptor.builder("name", String.class).unique().exists().build())
            .field(FieldDescriptor.builder("age", Integer.class).build())
            .build();

    public User() {
        this(SCHEMA);
    }

    protected User(NodeSchema<?> schema) {
        super(schema);
    }

    public static User named(String name) {
        User user = new User();
        user.set("name", name);
        return user;
    }

    public String getName() {
        return get("name", String.class);
    }
}
