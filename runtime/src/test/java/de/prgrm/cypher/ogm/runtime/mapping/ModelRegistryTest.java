package de.prgrm.cypher.ogm.runtime.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import de.prgrm.cypher.ogm.runtime.errors.AmbiguousDispatchException;
import de.prgrm.cypher.ogm.runtime.errors.UsageException;
import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;

class ModelRegistryTest {

    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry();
    }

    @Test
    void registeringASchemaRegistersItsParents() {
        registry.register(Streamer.SCHEMA);

        assertThat(registry.nodeSchemas()).containsExactlyInAnyOrder(Streamer.SCHEMA, User.SCHEMA);
    }

    @Test
    void largestLabelSubsetWins() {
        registry.register(Streamer.SCHEMA);

        assertThat(registry.resolveNode(List.of("User", "Streamer"))).contains(Streamer.SCHEMA);
        assertThat(registry.resolveNode(List.of("User"))).contains(User.SCHEMA);
        assertThat(registry.resolveNode(List.of("User", "Moderator"))).contains(User.SCHEMA);
        assertThat(registry.resolveNode(List.of("Streamer"))).isEmpty();
    }

    @Test
    void unknownLabelsResolveToNothing() {
        registry.register(User.SCHEMA);

        assertThat(registry.resolveNode(List.of("Language"))).isEmpty();
        assertThat(registry.resolveNode(List.of())).isEmpty();
    }

    @Test
    void equallySpecificSchemasAreAmbiguous() {
        NodeSchema<Node> admin = NodeSchema.builder("Admin", () -> new Node("Admin")).build();
        NodeSchema<Node> moderator = NodeSchema.builder("Moderator", () -> new Node("Moderator")).build();
        registry.register(admin).register(moderator);

        assertThatThrownBy(() -> registry.resolveNode(List.of("Admin", "Moderator")))
                .isInstanceOf(AmbiguousDispatchException.class);
    }

    @Test
    void priorityBreaksTies() {
        NodeSchema<Node> admin = NodeSchema.builder("Admin", () -> new Node("Admin")).priority(1).build();
        NodeSchema<Node> moderator = NodeSchema.builder("Moderator", () -> new Node("Moderator")).build();
        registry.register(moderator).register(admin);

        Optional<NodeSchema<?>> resolved = registry.resolveNode(List.of("Moderator", "Admin"));

        assertThat(resolved).contains(admin);
    }

    @Test
    void conflictingRegistrationIsRejected() {
        registry.register(User.SCHEMA);
        NodeSchema<Node> other = NodeSchema.builder("User", () -> new Node("User")).build();

        registry.register(User.SCHEMA);
        assertThatThrownBy(() -> registry.register(other)).isInstanceOf(UsageException.class);
    }

    @Test
    void relationshipsResolveByExactType() {
        registry.register(Follows.SCHEMA);

        assertThat(registry.resolveRelationship("FOLLOWS")).contains(Follows.SCHEMA);
        assertThat(registry.resolveRelationship("follows")).isEmpty();
    }

    @Test
    void schemaDescriptorsAreCollectedOnce() {
        registry.register(Streamer.SCHEMA).register(User.SCHEMA);

        assertThat(registry.indexes()).containsExactly(Index.of("Streamer", "followers"));
        assertThat(registry.constraints())
                .containsExactly(Constraint.exists("User", "name"), Constraint.unique("User", "name"));
    }

    @Test
    void clearForgetsEverything() {
        registry.register(Streamer.SCHEMA).register(Follows.SCHEMA);

        registry.clear();

        assertThat(registry.nodeSchemas()).isEmpty();
        assertThat(registry.relationshipSchemas()).isEmpty();
    }
}
