package de.prgrm.cypher.ogm.runtime.mapping;

public class User extends Node {

    public static final NodeSchema<User> SCHEMA = NodeSchema.builder("User", User::new)
            .field(FieldDescriptor.builder("name", String.class).unique().exists().build())
            .field(FieldDescriptor.builder("age", Integer.class).build())
            .field(FieldDescriptor.builder("active", Boolean.class).defaultValue(true).build())
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
}
