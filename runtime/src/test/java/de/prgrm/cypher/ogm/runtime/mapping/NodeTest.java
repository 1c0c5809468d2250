package de.prgrm.cypher.ogm.runtime.mapping;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import de.prgrm.cypher.ogm.runtime.errors.UsageException;
import de.prgrm.cypher.ogm.runtime.errors.ValidationException;
import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;

class NodeTest {

    @Test
    void defaultsAreAppliedAtConstruction() {
        User user = new User();

        assertEquals(true, user.get("active"));
        assertNull(user.get("name"));
    }

    @Test
    void valuesAreConvertedToTheDeclaredType() {
        User user = new User();

        user.set("age", 42L);
        assertEquals(42, user.get("age"));

        user.set("age", "43");
        assertEquals(Integer.valueOf(43), user.get("age", Integer.class));
    }

    @Test
    void typeMismatchIsRejected() {
        User user = new User();

        ValidationException e = assertThrows(ValidationException.class, () -> user.set("age", "old"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
        assertThrows(ValidationException.class, () -> user.set("age", List.of(1)));
        assertThrows(ValidationException.class, () -> user.set("age", 3_000_000_000L));
    }

    @Test
    void onDiskFieldsMustBeStorableAsText() {
        assertThrows(UsageException.class, () -> FieldDescriptor.builder("tags", List.class).onDisk().build());
        assertDoesNotThrow(() -> FieldDescriptor.builder("born", LocalDate.class).onDisk().build());
    }

    @Test
    void textIsParsedForTemporalFields() {
        FieldDescriptor born = FieldDescriptor.builder("born", LocalDate.class).build();
        Node node = new Node("Person");
        node.set("born", "2024-01-02");

        assertEquals("2024-01-02", node.get("born"));
        assertEquals(LocalDate.of(2024, 1, 2), node.get("born", born.type()));
    }

    @Test
    void undeclaredFieldIsRejectedOnTypedNodes() {
        assertThrows(ValidationException.class, () -> new User().set("nickname", "Ronnie"));
    }

    @Test
    void genericNodesAcceptAnyProperty() {
        Node node = new Node("Person").set("nickname", "Ronnie").set("age", 3L);

        assertEquals(Set.of("Person"), node.labels());
        assertEquals(Map.of("nickname", "Ronnie", "age", 3L), node.properties());
        assertTrue(node.schema().isEmpty());
    }

    @Test
    void settingNullUnsets() {
        User user = User.named("Ron");

        user.set("name", null);

        assertFalse(user.properties().containsKey("name"));
    }

    @Test
    void requiredFields() {
        assertThrows(ValidationException.class, () -> new User().validateRequired());
        User.named("Ron").validateRequired();
    }

    @Test
    void inheritedLabelsAndFields() {
        Streamer streamer = Streamer.named("Ron");

        assertEquals(List.of("Streamer", "User"), List.copyOf(streamer.labels()));
        assertEquals(List.of("name", "age", "active", "followers", "bio"),
                streamer.schema().orElseThrow().fields().stream().map(FieldDescriptor::name).toList());
        assertEquals(true, streamer.get("active"));
    }

    @Test
    void onDiskFieldsStayOutOfTheGraph() {
        Streamer streamer = Streamer.named("Ron");
        streamer.set("bio", "long text");

        assertEquals("long text", streamer.properties().get("bio"));
        assertFalse(streamer.graphProperties().containsKey("bio"));
        assertEquals(List.of("bio"), streamer.onDiskFields().stream().map(FieldDescriptor::name).toList());
    }

    @Test
    void keyPropertiesAreTheSetUniqueAndIndexedFields() {
        Streamer streamer = Streamer.named("Ron");
        streamer.set("age", 30);
        streamer.set("followers", 10);

        assertEquals(Map.of("name", "Ron", "followers", 10), streamer.keyProperties());
        assertTrue(new User().keyProperties().isEmpty());
    }

    @Test
    void schemaDescriptorsComeFromOwnFieldsOnTheOwnLabel() {
        assertEquals(Set.of(Index.of("Streamer", "followers")), Streamer.SCHEMA.indexes());
        assertTrue(Streamer.SCHEMA.constraints().isEmpty());
        assertEquals(Set.of(Constraint.exists("User", "name"), Constraint.unique("User", "name")),
                User.SCHEMA.constraints());
    }

    @Test
    void refreshFromFillsUnsetFieldsAndAssignsIdentity() {
        User user = User.named("Ron");
        User stored = User.named("Ron");
        stored.set("age", 30);
        stored.setId(7L);

        user.refreshFrom(stored);

        assertEquals(7L, user.id());
        assertEquals(30, user.get("age"));
    }

    @Test
    void refreshFromRejectsConflictsBeforeTouchingAnything() {
        User user = User.named("Ron");
        user.set("age", 31);
        User stored = User.named("Ron");
        stored.set("age", 30);
        stored.setId(7L);

        assertThrows(ValidationException.class, () -> user.refreshFrom(stored));
        assertNull(user.id());
        assertEquals(31, user.get("age"));
    }

    @Test
    void identityNeverChanges() {
        User user = new User();
        user.setId(1L);
        user.setId(1L);

        assertThrows(ValidationException.class, () -> user.setId(2L));
    }

    @Test
    void loadedPropertiesDoNotCountAsExplicitlySet() {
        User user = new User();
        user.loadProperty("name", "Ron");
        User stored = User.named("Harry");

        user.refreshFrom(stored);

        assertEquals("Harry", user.get("name"));
    }

    @Test
    void relationshipEndpoints() {
        User ron = new User();
        ron.setId(1L);
        User harry = new User();
        harry.setId(2L);

        Relationship follows = new Follows().between(ron, harry).set("since", 2020L);

        assertEquals("FOLLOWS", follows.type());
        assertEquals(1L, follows.startNodeId());
        assertEquals(2L, follows.endNodeId());
        assertEquals(2020, follows.get("since"));
    }
}
