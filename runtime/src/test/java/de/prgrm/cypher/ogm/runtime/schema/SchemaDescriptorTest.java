package de.prgrm.cypher.ogm.runtime.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class SchemaDescriptorTest {

    @Test
    void indexEqualityIgnoresNameAndPropertyOrder() {
        assertEquals(Index.of("User", "name"), new Index("User", List.of("name"), "index_42", true));
        assertEquals(new Index("User", List.of("a", "b"), null, false), new Index("User", List.of("b", "a"), null, false));
        assertNotEquals(Index.of("User", "name"), Index.of("User"));
        assertNotEquals(Index.of("User", "name"), Index.of("Streamer", "name"));
    }

    @Test
    void constraintEqualityCoversKind() {
        assertEquals(Constraint.unique("User", "a", "b"), Constraint.unique("User", "b", "a"));
        assertNotEquals(Constraint.unique("User", "name"), Constraint.exists("User", "name"));
        assertThrows(IllegalArgumentException.class, () -> Constraint.unique("User"));
    }
}
