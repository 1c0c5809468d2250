package de.prgrm.cypher.ogm.runtime.mapping;

import java.util.List;

/**
 * Nodes in traversal order and the relationships connecting consecutive nodes.
 */
public record Path(List<Node> nodes, List<Relationship> relationships) {

    public Path {
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
        if (!nodes.isEmpty() && nodes.size() != relationships.size() + 1) {
            throw new IllegalArgumentException("A path with " + nodes.size() + " nodes needs "
                    + (nodes.size() - 1) + " relationships, got " + relationships.size());
        }
        if (nodes.isEmpty() && !relationships.isEmpty()) {
            throw new IllegalArgumentException("A path without nodes can't have relationships");
        }
    }

    public Node start() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public Node end() {
        return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
    }

    public int length() {
        return relationships.size();
    }
}
