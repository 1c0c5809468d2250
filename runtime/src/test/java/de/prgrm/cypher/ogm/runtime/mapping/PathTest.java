package de.prgrm.cypher.ogm.runtime.mapping;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class PathTest {

    @Test
    void nodesAreOneMoreThanRelationships() {
        List<Node> nodes = List.of(new Node("A"), new Node("B"), new Node("C"), new Node("D"));
        List<Relationship> relationships = List.of(
                new Relationship("R", null, null, null),
                new Relationship("R", null, null, null),
                new Relationship("R", null, null, null));

        Path path = new Path(nodes, relationships);

        assertEquals(3, path.length());
        assertSame(nodes.get(0), path.start());
        assertSame(nodes.get(3), path.end());
    }

    @Test
    void mismatchedCountsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new Path(List.of(new Node("A"), new Node("B")), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new Path(List.of(), List.of(new Relationship("R", null, null, null))));
    }

    @Test
    void emptyPath() {
        Path path = new Path(List.of(), List.of());

        assertNull(path.start());
        assertEquals(0, path.length());
    }
}
